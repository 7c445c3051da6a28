package com.btoropt.compiler.error;

/**
 * 指令格式错误：字段数量不足，或数值字段无法解析。
 */
public class MalformedInstructionException extends Btor2SyntaxException {

    public MalformedInstructionException(String message, int lineNumber, String line) {
        super(message, lineNumber, line);
    }
}
