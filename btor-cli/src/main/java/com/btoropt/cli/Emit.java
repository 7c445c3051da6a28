package com.btoropt.cli;

/**
 * 输出格式
 */
public enum Emit {
    BTOR2,
    JSON
}
