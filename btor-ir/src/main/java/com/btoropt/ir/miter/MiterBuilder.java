package com.btoropt.ir.miter;

import com.btoropt.compiler.error.StructuralException;
import com.btoropt.compiler.model.*;
import com.btoropt.ir.pass.LidRemap;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 把同一设计的两个独立编译结果合并成 miter 电路，用于逻辑等价检查。
 * <p>
 * 第二个程序的 input 按名字和 sort 类型匹配到第一个程序的 input 上，两者共享输入；
 * 两个程序最后的 output 被移除，改为 {@code neq} + {@code bad}：
 * bad 可达当且仅当存在某组输入使两个设计的输出不同。
 */
public final class MiterBuilder {

    private static final Logger LOG = Logger.getLogger(MiterBuilder.class.getName());

    private MiterBuilder() {}

    /**
     * 合并两个平坦程序，参数不会被修改。
     *
     * @throws StructuralException 最后一条指令不是 output，或两个程序的 input 无法一一对应
     */
    public static List<Instruction> merge(List<Instruction> first, List<Instruction> second) {
        InstructionTable firstTable = InstructionTable.of(first);
        InstructionTable secondTable = InstructionTable.of(second);

        // 1. 第一个程序：去掉最后的 output
        Property firstOutput = lastOutput(first, "first");
        List<Instruction> result = new ArrayList<>(first.subList(0, first.size() - 1));
        int next = 1;
        List<Declaration> firstInputs = new ArrayList<>();
        for (Instruction inst : result) {
            next = Math.max(next, inst.getLid() + 1);
            if (inst.getOpcode() == Opcode.INPUT) {
                firstInputs.add((Declaration) inst);
            }
        }

        // 2. 第二个程序：input 映射到第一个程序的 input，其余指令依次编号
        LidRemap remap = new LidRemap();
        List<Instruction> renumbered = new ArrayList<>();
        List<Declaration> matched = new ArrayList<>();
        for (Instruction inst : second) {
            if (inst.getOpcode() == Opcode.INPUT) {
                Declaration counterpart = match((Declaration) inst, secondTable, firstInputs, firstTable);
                if (matched.contains(counterpart)) {
                    throw new StructuralException("Input '" + counterpart.getName()
                            + "' of the first program is matched more than once");
                }
                matched.add(counterpart);
                remap.put(inst.getLid(), counterpart.getLid());
            } else {
                remap.put(inst.getLid(), next++);
                renumbered.add(inst);
            }
        }
        if (matched.size() != firstInputs.size()) {
            List<String> unmatched = new ArrayList<>();
            for (Declaration input : firstInputs) {
                if (!matched.contains(input)) unmatched.add(input.getName());
            }
            throw new StructuralException("Inputs of the first program have no counterpart: " + unmatched);
        }

        Property secondOutput = lastOutput(second, "second");
        for (int i = 0; i < renumbered.size() - 1; i++) {
            result.add(remap.rewire(renumbered.get(i)));
        }
        next--; // 第二个程序的 output 不保留，复用它的 lid

        // 3. 等价性质
        Sort bool = Sort.bitvector(next++, 1);
        Instruction neq = new Instruction(next++, Opcode.NEQ, bool.getLid(),
                firstOutput.value(), remap.apply(secondOutput.value()));
        result.add(bool);
        result.add(neq);
        result.add(Property.bad(next, neq.getLid()));

        LOG.fine(() -> "Miter of " + first.size() + " and " + second.size() + " instructions sharing "
                + firstInputs.size() + " inputs");
        return result;
    }

    private static Property lastOutput(List<Instruction> program, String which) {
        if (program.isEmpty() || program.get(program.size() - 1).getOpcode() != Opcode.OUTPUT) {
            throw new StructuralException("The last instruction of the " + which + " program must be an output");
        }
        return (Property) program.get(program.size() - 1);
    }

    private static Declaration match(Declaration input, InstructionTable table,
                                     List<Declaration> candidates, InstructionTable candidateTable) {
        Sort sort = table.sortOf(input);
        Map<String, Declaration> byName = new HashMap<>();
        for (Declaration candidate : candidates) {
            byName.putIfAbsent(candidate.getName(), candidate);
        }
        Declaration candidate = byName.get(input.getName());
        if (candidate == null || !candidateTable.sortOf(candidate).sameType(sort)) {
            throw new StructuralException("Input '" + input.getName()
                    + "' of the second program has no input of the same name and sort in the first program");
        }
        return candidate;
    }
}
