package com.btoropt.compiler.model;

import com.btoropt.compiler.error.StructuralException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * lid → 指令查找表。
 * <p>
 * 顺序解析时逐条 {@link #add(Instruction)}；延迟解析时通过 {@link #of(List)} 一次性建好，
 * 之后只读，可被多个线程并发查询。
 */
public class InstructionTable {

    private final Map<Integer, Instruction> byLid = new LinkedHashMap<>();
    private int maxLid = 0;

    public InstructionTable() {
    }

    /**
     * 由完整序列构建查找表。
     *
     * @throws StructuralException lid 重复
     */
    public static InstructionTable of(List<? extends Instruction> instructions) {
        InstructionTable table = new InstructionTable();
        for (Instruction inst : instructions) {
            table.add(inst);
        }
        return table;
    }

    /**
     * @throws StructuralException lid 重复
     */
    public void add(Instruction inst) {
        Instruction previous = byLid.putIfAbsent(inst.getLid(), inst);
        if (previous != null) {
            throw new StructuralException("Duplicate line id " + inst.getLid());
        }
        maxLid = Math.max(maxLid, inst.getLid());
    }

    /** 未声明时返回 null */
    public Instruction get(int lid) {
        return byLid.get(lid);
    }

    public boolean contains(int lid) {
        return byLid.containsKey(lid);
    }

    /** 取 sort；lid 不存在或不是 sort 时返回 null */
    public Sort sortOf(Instruction inst) {
        int sid = inst.sortLid();
        Instruction sort = sid < 0 ? null : byLid.get(sid);
        return sort instanceof Sort ? (Sort) sort : null;
    }

    /** 表中最大的 lid，空表为 0 */
    public int maxLid() {
        return maxLid;
    }
}
