package com.btoropt.compiler.model;

/**
 * 操作数槽位要求的实体种类。
 */
public enum OperandKind {
    SORT,
    STATE,
    VALUE,
    INSTANCE,
    REFERENCE;

    /**
     * 检查给定操作码的指令能否出现在该槽位。
     */
    public boolean accepts(Opcode opcode) {
        switch (this) {
            case SORT:      return opcode == Opcode.SORT;
            case STATE:     return opcode == Opcode.STATE;
            case INSTANCE:  return opcode == Opcode.INST;
            case REFERENCE: return opcode == Opcode.REF;
            case VALUE:     return opcode.producesValue();
            default:        return false;
        }
    }

    public String describe() {
        switch (this) {
            case SORT:      return "a sort";
            case STATE:     return "a state";
            case INSTANCE:  return "an instance";
            case REFERENCE: return "a ref";
            default:        return "a value";
        }
    }
}
