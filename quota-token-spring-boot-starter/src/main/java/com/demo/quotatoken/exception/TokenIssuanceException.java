package com.demo.quotatoken.exception;

/**
 * 签发失败：记录未能写入存储，token 不会返回给调用方。
 */
public class TokenIssuanceException extends RuntimeException {

    public TokenIssuanceException(String message) {
        super(message);
    }

    public TokenIssuanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
