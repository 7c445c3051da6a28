package com.btoropt.compiler.parser;

/**
 * 操作数解析策略。
 */
public enum ParseStrategy {
    /** 逐行解析并立即查找操作数，要求源码按拓扑序排列 */
    EAGER,
    /** 先解码全部行，建好查找表后再统一解析，允许前向引用 */
    DEFERRED
}
