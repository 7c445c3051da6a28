package com.btoropt.compiler.model;

/**
 * input / state 声明：一个 sort 加一个名字。
 */
public class Declaration extends Instruction {

    private final String name;

    public Declaration(int lid, Opcode opcode, int sort, String name) {
        super(lid, opcode, sort);
        if (opcode.getFamily() != Opcode.Family.DECLARATION) {
            throw new IllegalArgumentException("not a declaration opcode: " + opcode.getToken());
        }
        this.name = name;
    }

    public static Declaration input(int lid, int sort, String name) {
        return new Declaration(lid, Opcode.INPUT, sort, name);
    }

    public static Declaration state(int lid, int sort, String name) {
        return new Declaration(lid, Opcode.STATE, sort, name);
    }

    public String getName() { return name; }

    public boolean isInput() { return getOpcode() == Opcode.INPUT; }

    /** 同一声明换一个名字 */
    public Declaration withName(String newName) {
        return new Declaration(getLid(), getOpcode(), operand(0), newName);
    }

    @Override
    protected Instruction copy(int newLid, int[] newOperands) {
        return new Declaration(newLid, getOpcode(), newOperands[0], name);
    }

    @Override
    protected boolean sameFields(Instruction other) {
        return name.equals(((Declaration) other).name);
    }

    @Override
    protected void appendFields(StringBuilder sb) {
        sb.append(' ').append(name);
    }
}
