package com.btoropt.compiler.model;

/**
 * 跨作用域引用 {@code <lid> ref <module> <target-lid>}，显示为 {@code module:lid}。
 * <p>
 * 目标位于另一个模块的指令序列中，因此不作为本地操作数保存；解析时已从该模块取得目标指令。
 */
public class Ref extends Instruction {

    private final String moduleName;
    private final Instruction target;

    public Ref(int lid, String moduleName, Instruction target) {
        super(lid, Opcode.REF);
        this.moduleName = moduleName;
        this.target = target;
    }

    public String getModuleName() { return moduleName; }
    public Instruction getTarget() { return target; }
    public int getTargetLid() { return target.getLid(); }

    public String qualifiedName() {
        return moduleName + ":" + target.getLid();
    }

    @Override
    protected Instruction copy(int newLid, int[] newOperands) {
        return new Ref(newLid, moduleName, target);
    }

    @Override
    protected boolean sameFields(Instruction other) {
        Ref r = (Ref) other;
        return moduleName.equals(r.moduleName) && target.getLid() == r.target.getLid();
    }

    @Override
    protected void appendFields(StringBuilder sb) {
        sb.append(' ').append(moduleName).append(' ').append(target.getLid());
    }
}
