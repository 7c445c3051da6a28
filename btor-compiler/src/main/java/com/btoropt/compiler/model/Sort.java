package com.btoropt.compiler.model;

/**
 * sort 声明，例如 {@code 1 sort bitvec 32}。
 * <p>
 * 源码使用的关键字（bitvector / bitvec）原样保留用于打印；相等性只看种类和宽度。
 */
public class Sort extends Instruction {

    private final SortKind kind;
    private final String keyword;
    private final int width;

    public Sort(int lid, SortKind kind, String keyword, int width) {
        super(lid, Opcode.SORT);
        this.kind = kind;
        this.keyword = keyword;
        this.width = width;
    }

    public static Sort bitvector(int lid, int width) {
        return new Sort(lid, SortKind.BITVECTOR, "bitvec", width);
    }

    public SortKind getKind() { return kind; }
    public String getKeyword() { return keyword; }
    public int getWidth() { return width; }

    /** 与另一个 sort 描述同一类型（可跨程序比较） */
    public boolean sameType(Sort other) {
        return other != null && kind == other.kind && width == other.width;
    }

    @Override
    protected Instruction copy(int newLid, int[] newOperands) {
        return new Sort(newLid, kind, keyword, width);
    }

    @Override
    protected boolean sameFields(Instruction other) {
        return sameType((Sort) other);
    }

    @Override
    protected void appendFields(StringBuilder sb) {
        sb.append(' ').append(keyword).append(' ').append(width);
    }
}
