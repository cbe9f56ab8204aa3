package com.demo.quotatoken.store;

/**
 * 存储层瞬时故障（连接失败、命令超时等）。调用方按 401 处理，可重试。
 */
public class TokenStoreUnavailableException extends RuntimeException {

    public TokenStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
