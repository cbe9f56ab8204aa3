package com.demo.quotatoken.issuer;

import java.time.Instant;

/**
 * 签发结果
 *
 * @param token         已签名的 JWT
 * @param tokenId       jti
 * @param expiresAt     过期时间
 * @param remainingUses 初始可用次数
 */
public record IssuedToken(String token, String tokenId, Instant expiresAt, long remainingUses) {

    /**
     * 可直接放入 Authorization 头的值
     */
    public String authorizationValue() {
        return "bearer " + token;
    }
}
