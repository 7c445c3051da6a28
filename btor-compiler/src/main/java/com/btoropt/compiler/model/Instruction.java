package com.btoropt.compiler.model;

import java.util.Arrays;

/**
 * BTOR2 指令。
 * <p>
 * 指令是不可变值：操作数以被引用指令的 lid 保存（arena + 索引），
 * 通过所在序列的 {@link InstructionTable} 解析。pass 只能通过 {@link #withLid(int)}
 * 和 {@link #withOperands(int[])} 产生新副本来"移动"或"重连"指令，操作码本身永不改变。
 * <p>
 * 没有额外字段的指令（zero/one/ones、init/next、ite、二元与一元运算、set、prec/post）
 * 直接使用本类；带额外字段的族各有子类。
 */
public class Instruction {

    private final int lid;
    private final Opcode opcode;
    private final int[] operands;

    public Instruction(int lid, Opcode opcode, int... operands) {
        if (operands.length != opcode.getArity()) {
            throw new IllegalArgumentException(opcode.getToken() + " expects " + opcode.getArity()
                    + " operands, got " + operands.length);
        }
        this.lid = lid;
        this.opcode = opcode;
        this.operands = operands.clone();
    }

    public int getLid() { return lid; }
    public Opcode getOpcode() { return opcode; }
    public boolean isStandard() { return opcode.isStandard(); }

    /** 操作数 lid 列表（副本） */
    public int[] getOperands() { return operands.clone(); }

    public int operandCount() { return operands.length; }

    /**
     * 获取第 n 个操作数的 lid。
     */
    public int operand(int n) {
        return operands[n];
    }

    /** 是否引用了给定 lid */
    public boolean uses(int referencedLid) {
        for (int op : operands) {
            if (op == referencedLid) return true;
        }
        return false;
    }

    /** 携带 sort 的指令返回其 sort 的 lid，否则返回 -1 */
    public int sortLid() {
        return opcode.getArity() > 0 && opcode.slot(0) == OperandKind.SORT ? operands[0] : -1;
    }

    public Instruction withLid(int newLid) {
        return newLid == lid ? this : copy(newLid, operands);
    }

    public Instruction withOperands(int[] newOperands) {
        return copy(lid, newOperands);
    }

    /**
     * 子类覆盖以保留额外字段。
     */
    protected Instruction copy(int newLid, int[] newOperands) {
        return new Instruction(newLid, opcode, newOperands);
    }

    /**
     * 结构相等：比较操作码、操作数与额外字段，不比较 lid。
     */
    public final boolean structurallyEquals(Instruction other) {
        if (other == null || other.opcode != opcode || other.getClass() != getClass()) return false;
        return Arrays.equals(operands, other.operands) && sameFields(other);
    }

    protected boolean sameFields(Instruction other) {
        return true;
    }

    /**
     * 序列化为一行 BTOR2 文本：{@code <lid> <opcode> <operands...> <fields...>}。
     */
    public final String serialize() {
        StringBuilder sb = new StringBuilder();
        sb.append(lid).append(' ').append(opcode.getToken());
        for (int op : operands) {
            sb.append(' ').append(op);
        }
        appendFields(sb);
        return sb.toString();
    }

    /** 追加操作码特有的尾部字段（每个字段前带一个空格） */
    protected void appendFields(StringBuilder sb) {
    }

    @Override
    public String toString() {
        return serialize();
    }
}
