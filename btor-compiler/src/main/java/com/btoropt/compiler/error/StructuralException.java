package com.btoropt.compiler.error;

/**
 * 结构错误：块嵌套、缺少块结束符、lid 重复、模块/契约数量或命名约束被破坏等。
 */
public class StructuralException extends Btor2Exception {

    public StructuralException(String message) {
        super(message);
    }

    public StructuralException(String message, int lineNumber, String line) {
        super(message, lineNumber, line);
    }

    public StructuralException(String message, int lineNumber, String line, Throwable cause) {
        super(message, lineNumber, line, cause);
    }
}
