package com.btoropt.compiler.model;

import java.util.Objects;

/**
 * output / bad / constraint：引用一个值，可带可选符号名。
 */
public class Property extends Instruction {

    private final String name; // null 表示无符号名

    public Property(int lid, Opcode opcode, int value, String name) {
        super(lid, opcode, value);
        if (opcode.getFamily() != Opcode.Family.PROPERTY) {
            throw new IllegalArgumentException("not a property opcode: " + opcode.getToken());
        }
        this.name = name;
    }

    public static Property bad(int lid, int cond) {
        return new Property(lid, Opcode.BAD, cond, null);
    }

    public static Property constraint(int lid, int cond) {
        return new Property(lid, Opcode.CONSTRAINT, cond, null);
    }

    public static Property output(int lid, int value) {
        return new Property(lid, Opcode.OUTPUT, value, null);
    }

    /** 被引用值的 lid */
    public int value() { return operand(0); }

    public String getName() { return name; }

    @Override
    protected Instruction copy(int newLid, int[] newOperands) {
        return new Property(newLid, getOpcode(), newOperands[0], name);
    }

    @Override
    protected boolean sameFields(Instruction other) {
        return Objects.equals(name, ((Property) other).name);
    }

    @Override
    protected void appendFields(StringBuilder sb) {
        if (name != null) sb.append(' ').append(name);
    }
}
