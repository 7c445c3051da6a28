package com.btoropt.compiler.error;

/**
 * BTOR2 处理异常的基类。
 * <p>
 * 解析与 pass 执行都是 fail-fast 的：异常一旦抛出，整个解析或管线即中止，不存在部分结果。
 */
public class Btor2Exception extends RuntimeException {

    private final int lineNumber;
    private final String line;

    public Btor2Exception(String message) {
        this(message, -1, null);
    }

    public Btor2Exception(String message, int lineNumber, String line) {
        super(message);
        this.lineNumber = lineNumber;
        this.line = line;
    }

    public Btor2Exception(String message, int lineNumber, String line, Throwable cause) {
        super(message, cause);
        this.lineNumber = lineNumber;
        this.line = line;
    }

    /** 出错的源码行号（从 1 开始），未知时为 -1 */
    public int getLineNumber() {
        return lineNumber;
    }

    /** 出错的源码行文本，未知时为 null */
    public String getLine() {
        return line;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (lineNumber > 0) {
            sb.append(" at line ").append(lineNumber);
        }
        if (line != null) {
            sb.append(" (found '").append(line.trim()).append("')");
        }
        return sb.toString();
    }
}
