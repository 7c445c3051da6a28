package com.btoropt.ir.pass.validation;

import com.btoropt.compiler.model.Instruction;
import com.btoropt.ir.pass.LidRemap;
import com.btoropt.ir.pass.RenumberingPass;

import java.util.List;

/**
 * 把每条指令的 lid 改为它在序列中的位置（从 0 开始），操作数随之重连。
 */
public class CheckLidOrdering extends RenumberingPass {

    @Override
    public String getId() {
        return "check-lid-ordering";
    }

    @Override
    protected Result renumber(List<Instruction> instructions) {
        LidRemap remap = LidRemap.sequential(instructions, 0);
        return new Result(remap.rewireAll(instructions), remap);
    }
}
