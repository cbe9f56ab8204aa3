package com.demo.quotatoken.store;

import com.demo.quotatoken.model.TokenSubject;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * 单个 token 的配额状态。
 * <p>
 * 只有 remainingUses 可变，且只减不增；归零的记录在同一次原子操作中被删除。
 *
 * @param tokenId       token 唯一标识（= jti）
 * @param subject       身份信息
 * @param remainingUses 剩余可用次数
 * @param expiresAt     过期时间
 * @param issuedAt      签发时间（仅审计用）
 */
public record TokenRecord(String tokenId,
                          TokenSubject subject,
                          long remainingUses,
                          Instant expiresAt,
                          Instant issuedAt) {

    public TokenRecord {
        Objects.requireNonNull(tokenId, "tokenId must not be null");
        Objects.requireNonNull(subject, "subject must not be null");
        Objects.requireNonNull(expiresAt, "expiresAt must not be null");
        Objects.requireNonNull(issuedAt, "issuedAt must not be null");
        if (remainingUses < 0) {
            throw new IllegalArgumentException("remainingUses must be >= 0");
        }
    }

    public TokenRecord withRemainingUses(long remainingUses) {
        return new TokenRecord(tokenId, subject, remainingUses, expiresAt, issuedAt);
    }

    /**
     * now 晚于 expiresAt + grace 才算过期，与 JWT 的 exp + clock skew 判定一致
     */
    public boolean isExpiredAt(Instant now, Duration grace) {
        return now.isAfter(expiresAt.plus(grace));
    }
}
