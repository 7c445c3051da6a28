package com.btoropt.compiler.model;

/**
 * sort 的种类。{@code bitvector} 与 {@code bitvec} 是同一种类的两个关键字。
 */
public enum SortKind {
    BITVECTOR,
    ARRAY;

    /**
     * 按关键字查找种类，未知关键字返回 null。
     */
    public static SortKind fromKeyword(String keyword) {
        switch (keyword) {
            case "bitvector":
            case "bitvec":
                return BITVECTOR;
            case "array":
                return ARRAY;
            default:
                return null;
        }
    }
}
