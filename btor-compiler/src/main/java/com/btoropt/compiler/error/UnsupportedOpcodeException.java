package com.btoropt.compiler.error;

/**
 * 操作码不在支持集合中（或在当前作用域内不允许使用）。
 */
public class UnsupportedOpcodeException extends Btor2SyntaxException {

    private final String opcode;

    public UnsupportedOpcodeException(String opcode, int lineNumber, String line) {
        super("Unsupported operation type: " + opcode, lineNumber, line);
        this.opcode = opcode;
    }

    public String getOpcode() {
        return opcode;
    }
}
