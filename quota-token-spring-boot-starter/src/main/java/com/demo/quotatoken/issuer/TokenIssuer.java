package com.demo.quotatoken.issuer;

import com.demo.quotatoken.exception.TokenIssuanceException;
import com.demo.quotatoken.model.TokenSubject;
import com.demo.quotatoken.properties.TokenQuotaProps;
import com.demo.quotatoken.security.JwtUtil;
import com.demo.quotatoken.store.TokenRecord;
import com.demo.quotatoken.store.TokenRecordStore;
import com.demo.quotatoken.store.TokenStoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.UUID;

/**
 * 签发限次 token。
 * <p>
 * 顺序：先写存储，再返回 token。记录写入失败时抛出 {@link TokenIssuanceException}，
 * 不会出现“有 token 无配额记录”的情况。
 */
public class TokenIssuer {

    private static final Logger log = LoggerFactory.getLogger(TokenIssuer.class);

    private final JwtUtil jwtUtil;
    private final TokenRecordStore store;
    private final Clock clock;
    private final long ttlSeconds;
    private final long defaultMaxUses;

    public TokenIssuer(JwtUtil jwtUtil, TokenRecordStore store, TokenQuotaProps props, Clock clock) {
        this.jwtUtil = Objects.requireNonNull(jwtUtil, "jwtUtil must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(props, "props must not be null");
        if (props.getMaxUses() <= 0) {
            throw new IllegalArgumentException("quota-token.max-uses must be > 0");
        }
        this.ttlSeconds = props.getAccessTtlSeconds();
        this.defaultMaxUses = props.getMaxUses();
    }

    public IssuedToken issue(TokenSubject subject) {
        return issue(subject, defaultMaxUses);
    }

    public IssuedToken issue(TokenSubject subject, long maxUses) {
        Objects.requireNonNull(subject, "subject must not be null");
        if (maxUses <= 0) {
            throw new IllegalArgumentException("maxUses must be > 0");
        }

        // JWT 时间字段为秒精度，记录与 claim 保持一致
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = now.plusSeconds(ttlSeconds);
        String tokenId = UUID.randomUUID().toString();

        String jwt = jwtUtil.generateAccessToken(tokenId, subject, now, expiresAt);
        TokenRecord record = new TokenRecord(tokenId, subject, maxUses, expiresAt, now);

        boolean created;
        try {
            created = store.createIfAbsent(record);
        } catch (TokenStoreUnavailableException e) {
            throw new TokenIssuanceException("Token store unavailable, token not issued", e);
        }
        if (!created) {
            throw new TokenIssuanceException("Token id already exists: " + tokenId);
        }

        log.info("Issued token tokenId={} userId={} maxUses={} expiresAt={}",
                tokenId, subject.userId(), maxUses, expiresAt);
        return new IssuedToken(jwt, tokenId, expiresAt, maxUses);
    }
}
