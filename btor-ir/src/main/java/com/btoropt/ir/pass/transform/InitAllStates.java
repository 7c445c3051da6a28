package com.btoropt.ir.pass.transform;

import com.btoropt.compiler.model.Instruction;
import com.btoropt.compiler.model.Literal;
import com.btoropt.compiler.model.Opcode;
import com.btoropt.ir.pass.LidRemap;
import com.btoropt.ir.pass.RenumberingPass;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 确保每个 state 都有初始化。
 * <p>
 * 没有 init 的 state 之后紧跟插入 {@code constd <sort> 0} 与对应的 init；
 * 整个序列随后从 1 开始连续重新编号。
 */
public class InitAllStates extends RenumberingPass {

    @Override
    public String getId() {
        return "init-all-states";
    }

    @Override
    protected Result renumber(List<Instruction> instructions) {
        Set<Integer> initialized = new HashSet<>();
        for (Instruction inst : instructions) {
            if (inst.getOpcode() == Opcode.INIT) {
                initialized.add(inst.operand(1));
            }
        }

        // 1. 分配新 lid，未初始化的 state 后预留两个位置
        LidRemap remap = new LidRemap();
        int lid = 1;
        for (Instruction inst : instructions) {
            remap.put(inst.getLid(), lid++);
            if (needsInit(inst, initialized)) {
                lid += 2;
            }
        }

        // 2. 重连并插入
        List<Instruction> result = new ArrayList<>();
        for (Instruction inst : instructions) {
            result.add(remap.rewire(inst));
            if (needsInit(inst, initialized)) {
                int state = remap.apply(inst.getLid());
                int sort = remap.apply(inst.sortLid());
                Literal zero = Literal.decimal(state + 1, sort, BigInteger.ZERO);
                result.add(zero);
                result.add(new Instruction(state + 2, Opcode.INIT, sort, state, zero.getLid()));
            }
        }
        return new Result(result, remap);
    }

    private static boolean needsInit(Instruction inst, Set<Integer> initialized) {
        return inst.getOpcode() == Opcode.STATE && !initialized.contains(inst.getLid());
    }
}
