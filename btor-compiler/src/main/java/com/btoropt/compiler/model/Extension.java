package com.btoropt.compiler.model;

import java.util.Objects;

/**
 * uext / sext：把操作数扩展 width 位。
 * <p>
 * width 为 0 时不是真正的扩展，而是给操作数起别名（{@link #isRenaming()}）。
 */
public class Extension extends Instruction {

    private final int width;
    private final String name;

    public Extension(int lid, Opcode opcode, int sort, int operand, int width, String name) {
        super(lid, opcode, sort, operand);
        if (opcode.getFamily() != Opcode.Family.EXTENSION) {
            throw new IllegalArgumentException("not an extension opcode: " + opcode.getToken());
        }
        this.width = width;
        this.name = name;
    }

    public int getWidth() { return width; }
    public String getName() { return name; }

    public boolean isRenaming() {
        return width == 0;
    }

    @Override
    protected Instruction copy(int newLid, int[] newOperands) {
        return new Extension(newLid, getOpcode(), newOperands[0], newOperands[1], width, name);
    }

    @Override
    protected boolean sameFields(Instruction other) {
        Extension e = (Extension) other;
        return width == e.width && Objects.equals(name, e.name);
    }

    @Override
    protected void appendFields(StringBuilder sb) {
        sb.append(' ').append(width).append(' ').append(name);
    }
}
