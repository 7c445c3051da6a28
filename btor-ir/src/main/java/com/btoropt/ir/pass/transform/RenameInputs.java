package com.btoropt.ir.pass.transform;

import com.btoropt.compiler.model.Declaration;
import com.btoropt.compiler.model.Instruction;
import com.btoropt.compiler.model.Opcode;
import com.btoropt.ir.pass.Pass;

import java.util.ArrayList;
import java.util.List;

/**
 * 把第 i 个 input（按文件顺序，从 0 开始）重命名为 {@code inp_<i>}，其他指令原样保留。
 */
public class RenameInputs implements Pass {

    @Override
    public String getId() {
        return "rename-inputs";
    }

    @Override
    public List<Instruction> run(List<Instruction> instructions) {
        List<Instruction> result = new ArrayList<>(instructions.size());
        int i = 0;
        for (Instruction inst : instructions) {
            if (inst.getOpcode() == Opcode.INPUT) {
                result.add(((Declaration) inst).withName("inp_" + i));
                i++;
            } else {
                result.add(inst);
            }
        }
        return result;
    }
}
