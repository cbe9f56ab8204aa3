package com.demo.quotatoken.verifier;

/**
 * 鉴权失败原因。对外统一返回 401，仅内部日志区分。
 */
public enum AuthFailure {

    MISSING_CREDENTIAL("missing credential"),
    MALFORMED_CREDENTIAL("malformed credential"),
    INVALID_SIGNATURE("invalid signature"),
    EXPIRED("token expired"),
    EXHAUSTED("token revoked or expired"),
    STORE_UNAVAILABLE("token store unavailable");

    private final String message;

    AuthFailure(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
