package com.btoropt.compiler.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * BTOR2 操作码（含 btoropt 的模块化扩展）。
 * <p>
 * 每个操作码属于一个 {@link Family}，族决定了字段布局、操作数槽位种类和最少 token 数。
 */
public enum Opcode {
    // 类型
    SORT("sort", Family.SORT),

    // 声明
    INPUT("input", Family.DECLARATION),
    STATE("state", Family.DECLARATION),

    // 属性
    OUTPUT("output", Family.PROPERTY),
    BAD("bad", Family.PROPERTY),
    CONSTRAINT("constraint", Family.PROPERTY),

    // 常量
    ZERO("zero", Family.SORT_CONSTANT),
    ONE("one", Family.SORT_CONSTANT),
    ONES("ones", Family.SORT_CONSTANT),
    CONSTD("constd", Family.LITERAL, 10),
    CONSTH("consth", Family.LITERAL, 16),
    CONST("const", Family.LITERAL, 2),

    // 状态迁移
    INIT("init", Family.STATE_UPDATE),
    NEXT("next", Family.STATE_UPDATE),

    SLICE("slice", Family.SLICE),
    ITE("ite", Family.TERNARY),

    // 二元
    IMPLIES("implies", Family.BINARY),
    IFF("iff", Family.BINARY),
    ADD("add", Family.BINARY),
    SUB("sub", Family.BINARY),
    MUL("mul", Family.BINARY),
    SDIV("sdiv", Family.BINARY),
    UDIV("udiv", Family.BINARY),
    SMOD("smod", Family.BINARY),
    SREM("srem", Family.BINARY),
    UREM("urem", Family.BINARY),
    SLL("sll", Family.BINARY),
    SRL("srl", Family.BINARY),
    SRA("sra", Family.BINARY),
    AND("and", Family.BINARY),
    OR("or", Family.BINARY),
    XOR("xor", Family.BINARY),
    CONCAT("concat", Family.BINARY),
    EQ("eq", Family.BINARY),
    NEQ("neq", Family.BINARY),
    UGT("ugt", Family.BINARY),
    SGT("sgt", Family.BINARY),
    UGTE("ugte", Family.BINARY),
    SGTE("sgte", Family.BINARY),
    ULT("ult", Family.BINARY),
    SLT("slt", Family.BINARY),
    ULTE("ulte", Family.BINARY),
    SLTE("slte", Family.BINARY),

    // 一元
    NOT("not", Family.UNARY),
    INC("inc", Family.UNARY),
    DEC("dec", Family.UNARY),
    NEG("neg", Family.UNARY),
    REDOR("redor", Family.UNARY),
    REDAND("redand", Family.UNARY),
    REDXOR("redxor", Family.UNARY),

    // 扩展（width 为 0 时是重命名别名）
    UEXT("uext", Family.EXTENSION),
    SEXT("sext", Family.EXTENSION),

    // ===== 非标准：模块化扩展 =====
    INST("inst", Family.INSTANCE),
    REF("ref", Family.REFERENCE),
    SET("set", Family.BINDING),
    PREC("prec", Family.CONDITION),
    POST("post", Family.CONDITION);

    /**
     * 操作码族：同族操作码共享字段布局。
     * <p>
     * {@code minTokens} 为一行最少 token 数（含 lid 与操作码本身）。
     */
    public enum Family {
        SORT(4, true, false),
        DECLARATION(3, true, true, OperandKind.SORT),
        PROPERTY(3, true, false, OperandKind.VALUE),
        SORT_CONSTANT(3, true, true, OperandKind.SORT),
        LITERAL(4, true, true, OperandKind.SORT),
        STATE_UPDATE(5, true, false, OperandKind.SORT, OperandKind.STATE, OperandKind.VALUE),
        SLICE(6, true, true, OperandKind.SORT, OperandKind.VALUE),
        TERNARY(6, true, true, OperandKind.SORT, OperandKind.VALUE, OperandKind.VALUE, OperandKind.VALUE),
        BINARY(5, true, true, OperandKind.SORT, OperandKind.VALUE, OperandKind.VALUE),
        UNARY(4, true, true, OperandKind.SORT, OperandKind.VALUE),
        EXTENSION(5, true, true, OperandKind.SORT, OperandKind.VALUE),
        INSTANCE(3, false, false),
        REFERENCE(4, false, true),
        BINDING(5, false, false, OperandKind.INSTANCE, OperandKind.REFERENCE, OperandKind.VALUE),
        CONDITION(3, false, false, OperandKind.VALUE);

        private final int minTokens;
        private final boolean standard;
        private final boolean producesValue;
        private final OperandKind[] slots;

        Family(int minTokens, boolean standard, boolean producesValue, OperandKind... slots) {
            this.minTokens = minTokens;
            this.standard = standard;
            this.producesValue = producesValue;
            this.slots = slots;
        }
    }

    private static final Map<String, Opcode> BY_TOKEN;

    static {
        Map<String, Opcode> map = new HashMap<>();
        for (Opcode op : values()) {
            map.put(op.token, op);
        }
        BY_TOKEN = Collections.unmodifiableMap(map);
    }

    private final String token;
    private final Family family;
    private final int radix;

    Opcode(String token, Family family) {
        this(token, family, 0);
    }

    Opcode(String token, Family family, int radix) {
        this.token = token;
        this.family = family;
        this.radix = radix;
    }

    /**
     * 按源码关键字查找操作码，未知关键字返回 null。
     */
    public static Opcode fromToken(String token) {
        return BY_TOKEN.get(token);
    }

    public String getToken() { return token; }
    public Family getFamily() { return family; }

    /** 一行最少 token 数（含 lid 与操作码） */
    public int getMinTokens() { return family.minTokens; }

    /** 是否属于 BTOR2 标准 */
    public boolean isStandard() { return family.standard; }

    /** 该指令能否作为值操作数被其他指令引用 */
    public boolean producesValue() { return family.producesValue; }

    /** 常量字面量的进制；非字面量为 0 */
    public int getRadix() { return radix; }

    /** 操作数槽位数量 */
    public int getArity() { return family.slots.length; }

    /** 第 n 个操作数槽位要求的实体种类 */
    public OperandKind slot(int n) { return family.slots[n]; }
}
