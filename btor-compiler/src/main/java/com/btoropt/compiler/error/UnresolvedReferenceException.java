package com.btoropt.compiler.error;

/**
 * 操作数引用无法解析：lid 未声明，或声明的实体种类与操作数位置不符（如需要 sort 的位置给了非 sort）。
 */
public class UnresolvedReferenceException extends Btor2Exception {

    private final int referencedLid;

    public UnresolvedReferenceException(String message, int referencedLid) {
        super(message);
        this.referencedLid = referencedLid;
    }

    public UnresolvedReferenceException(String message, int referencedLid, int lineNumber, String line) {
        super(message, lineNumber, line);
        this.referencedLid = referencedLid;
    }

    /** 无法解析的 lid；按名称引用模块失败时为 -1 */
    public int getReferencedLid() {
        return referencedLid;
    }
}
