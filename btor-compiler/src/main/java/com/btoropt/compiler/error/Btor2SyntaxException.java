package com.btoropt.compiler.error;

/**
 * 语法错误：未知操作码或字段数量不足。
 */
public class Btor2SyntaxException extends Btor2Exception {

    public Btor2SyntaxException(String message, int lineNumber, String line) {
        super(message, lineNumber, line);
    }
}
