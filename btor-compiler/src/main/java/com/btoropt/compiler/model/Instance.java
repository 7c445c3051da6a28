package com.btoropt.compiler.model;

/**
 * 模块实例化 {@code <lid> inst <module>}（尚未内联）。
 */
public class Instance extends Instruction {

    private final String moduleName;

    public Instance(int lid, String moduleName) {
        super(lid, Opcode.INST);
        this.moduleName = moduleName;
    }

    public String getModuleName() { return moduleName; }

    @Override
    protected Instruction copy(int newLid, int[] newOperands) {
        return new Instance(newLid, moduleName);
    }

    @Override
    protected boolean sameFields(Instruction other) {
        return moduleName.equals(((Instance) other).moduleName);
    }

    @Override
    protected void appendFields(StringBuilder sb) {
        sb.append(' ').append(moduleName);
    }
}
