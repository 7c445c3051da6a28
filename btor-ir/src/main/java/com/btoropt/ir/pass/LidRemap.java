package com.btoropt.ir.pass;

import com.btoropt.compiler.model.Instruction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 显式的 lid 重映射（旧 lid → 新 lid）。
 * <p>
 * 指令不可变，重新编号时由本类生成新副本并同时重连操作数，
 * 而不是依赖共享引用观察到同一次修改。
 */
public final class LidRemap {

    private final Map<Integer, Integer> mapping = new HashMap<>();

    public void put(int oldLid, int newLid) {
        mapping.put(oldLid, newLid);
    }

    public boolean contains(int oldLid) {
        return mapping.containsKey(oldLid);
    }

    /**
     * @throws IllegalStateException lid 没有映射
     */
    public int apply(int oldLid) {
        Integer newLid = mapping.get(oldLid);
        if (newLid == null) {
            throw new IllegalStateException("No remapping for line id " + oldLid);
        }
        return newLid;
    }

    /** 新 lid，操作数全部经过映射 */
    public Instruction rewire(Instruction inst) {
        int[] operands = inst.getOperands();
        for (int i = 0; i < operands.length; i++) {
            operands[i] = apply(operands[i]);
        }
        return inst.withLid(apply(inst.getLid())).withOperands(operands);
    }

    public List<Instruction> rewireAll(List<Instruction> instructions) {
        List<Instruction> result = new ArrayList<>(instructions.size());
        for (Instruction inst : instructions) {
            result.add(rewire(inst));
        }
        return result;
    }

    /**
     * 按序列位置编号：第 i 条指令得到 {@code firstLid + i}。
     */
    public static LidRemap sequential(List<Instruction> instructions, int firstLid) {
        LidRemap remap = new LidRemap();
        for (int i = 0; i < instructions.size(); i++) {
            remap.put(instructions.get(i).getLid(), firstLid + i);
        }
        return remap;
    }
}
