package com.btoropt.compiler.model;

import java.math.BigInteger;

/**
 * 常量字面量：constd（十进制）、consth（十六进制）、const（二进制）。
 * <p>
 * 值以 {@link BigInteger} 保存，位宽可超过 64；源码中的字面量文本原样保留用于打印
 * （例如二进制常量的前导零）。
 */
public class Literal extends Instruction {

    private final BigInteger value;
    private final String text;

    public Literal(int lid, Opcode opcode, int sort, BigInteger value, String text) {
        super(lid, opcode, sort);
        if (opcode.getFamily() != Opcode.Family.LITERAL) {
            throw new IllegalArgumentException("not a literal opcode: " + opcode.getToken());
        }
        this.value = value;
        this.text = text;
    }

    /**
     * 按操作码的进制解析字面量文本。
     *
     * @throws NumberFormatException 文本不是该进制下的合法整数
     */
    public static Literal parse(int lid, Opcode opcode, int sort, String text) {
        return new Literal(lid, opcode, sort, new BigInteger(text, opcode.getRadix()), text);
    }

    public static Literal decimal(int lid, int sort, BigInteger value) {
        return new Literal(lid, Opcode.CONSTD, sort, value, value.toString());
    }

    public BigInteger getValue() { return value; }
    public String getText() { return text; }

    public boolean isZero() { return value.signum() == 0; }

    @Override
    protected Instruction copy(int newLid, int[] newOperands) {
        return new Literal(newLid, getOpcode(), newOperands[0], value, text);
    }

    @Override
    protected boolean sameFields(Instruction other) {
        return value.equals(((Literal) other).value);
    }

    @Override
    protected void appendFields(StringBuilder sb) {
        sb.append(' ').append(text);
    }
}
