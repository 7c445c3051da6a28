package com.btoropt.compiler.error;

/**
 * 请求的 pass id 不在注册表中。
 */
public class UnsupportedPassException extends Btor2Exception {

    private final String passId;

    public UnsupportedPassException(String passId) {
        super("Invalid pass given as argument: " + passId);
        this.passId = passId;
    }

    public String getPassId() {
        return passId;
    }
}
