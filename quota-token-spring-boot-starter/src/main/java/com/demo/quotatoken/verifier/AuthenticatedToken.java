package com.demo.quotatoken.verifier;

import com.demo.quotatoken.model.TokenSubject;

import java.time.Instant;

/**
 * 校验通过后挂到请求上下文的身份信息；下游只读取它，不再解析 token。
 *
 * @param tokenId       jti
 * @param subject       身份
 * @param expiresAt     过期时间
 * @param remainingUses 本次使用后剩余次数
 */
public record AuthenticatedToken(String tokenId, TokenSubject subject, Instant expiresAt, long remainingUses) {
}
