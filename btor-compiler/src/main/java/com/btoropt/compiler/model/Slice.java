package com.btoropt.compiler.model;

/**
 * 位切片 {@code slice <sort> <operand> <highbit> <lowbit>}，结果宽度为 highbit - lowbit + 1。
 */
public class Slice extends Instruction {

    private final int highBit;
    private final int lowBit;

    public Slice(int lid, int sort, int operand, int highBit, int lowBit) {
        super(lid, Opcode.SLICE, sort, operand);
        if (highBit < lowBit) {
            throw new IllegalArgumentException("slice highbit " + highBit + " is below lowbit " + lowBit);
        }
        this.highBit = highBit;
        this.lowBit = lowBit;
    }

    public int getHighBit() { return highBit; }
    public int getLowBit() { return lowBit; }

    public int getWidth() {
        return highBit - lowBit + 1;
    }

    @Override
    protected Instruction copy(int newLid, int[] newOperands) {
        return new Slice(newLid, newOperands[0], newOperands[1], highBit, lowBit);
    }

    @Override
    protected boolean sameFields(Instruction other) {
        Slice s = (Slice) other;
        return highBit == s.highBit && lowBit == s.lowBit;
    }

    @Override
    protected void appendFields(StringBuilder sb) {
        sb.append(' ').append(highBit).append(' ').append(lowBit);
    }
}
