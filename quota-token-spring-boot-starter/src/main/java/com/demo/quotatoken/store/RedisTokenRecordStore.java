package com.demo.quotatoken.store;

import com.demo.quotatoken.model.TokenSubject;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Redis 实现，适用于多实例部署。
 * <p>
 * 数据结构：Hash，key = keyPrefix + tokenId，字段：
 * <ul>
 *   <li>remaining_uses：剩余次数</li>
 *   <li>expires_at / issued_at：epoch 秒</li>
 *   <li>subject：身份信息 JSON</li>
 * </ul>
 * key 通过 PEXPIREAT 设置到 expires_at + expiryGrace（= JWT clock skew），由 Redis 负责过期淘汰。
 * <p>
 * 条件创建与条件扣减均为单个 Lua 脚本，一次往返完成，脚本在 Redis 内串行执行。
 */
public class RedisTokenRecordStore implements TokenRecordStore {

    static final String F_REMAINING = "remaining_uses";
    static final String F_EXPIRES_AT = "expires_at";
    static final String F_ISSUED_AT = "issued_at";
    static final String F_SUBJECT = "subject";

    static final long STATUS_NOT_FOUND = -1;
    static final long STATUS_EXHAUSTED = -2;

    /**
     * KEYS[1]=key, ARGV=remaining, expires_at, issued_at, subject, expire_at_millis
     */
    static final RedisScript<Long> CREATE_SCRIPT = new DefaultRedisScript<>("""
            if redis.call('EXISTS', KEYS[1]) == 1 then
              return 0
            end
            redis.call('HSET', KEYS[1], 'remaining_uses', ARGV[1], 'expires_at', ARGV[2], 'issued_at', ARGV[3], 'subject', ARGV[4])
            redis.call('PEXPIREAT', KEYS[1], ARGV[5])
            return 1
            """, Long.class);

    /**
     * 返回 {status} 或 {remaining, expires_at, issued_at, subject}
     */
    static final RedisScript<List> CONSUME_SCRIPT = new DefaultRedisScript<>("""
            local remaining = redis.call('HGET', KEYS[1], 'remaining_uses')
            if not remaining then
              return {-1}
            end
            remaining = tonumber(remaining)
            if remaining <= 0 then
              redis.call('DEL', KEYS[1])
              return {-2}
            end
            remaining = remaining - 1
            local fields = redis.call('HMGET', KEYS[1], 'expires_at', 'issued_at', 'subject')
            if remaining == 0 then
              redis.call('DEL', KEYS[1])
            else
              redis.call('HSET', KEYS[1], 'remaining_uses', remaining)
            end
            return {remaining, fields[1], fields[2], fields[3]}
            """, List.class);

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final Duration expiryGrace;

    public RedisTokenRecordStore(StringRedisTemplate redis, ObjectMapper objectMapper, String keyPrefix) {
        this(redis, objectMapper, keyPrefix, Duration.ZERO);
    }

    public RedisTokenRecordStore(StringRedisTemplate redis, ObjectMapper objectMapper, String keyPrefix,
                                 Duration expiryGrace) {
        this.redis = Objects.requireNonNull(redis, "redis must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
        this.expiryGrace = expiryGrace == null ? Duration.ZERO : expiryGrace;
    }

    @Override
    public boolean createIfAbsent(TokenRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        String subjectJson = writeSubject(record.subject());
        try {
            Long created = redis.execute(CREATE_SCRIPT, List.of(key(record.tokenId())),
                    String.valueOf(record.remainingUses()),
                    String.valueOf(record.expiresAt().getEpochSecond()),
                    String.valueOf(record.issuedAt().getEpochSecond()),
                    subjectJson,
                    String.valueOf(expireAtMillis(record)));
            return created != null && created == 1L;
        } catch (DataAccessException e) {
            throw new TokenStoreUnavailableException("Failed to create token record " + record.tokenId(), e);
        }
    }

    @Override
    public ConsumeResult decrementIfPositive(String tokenId) {
        List<?> reply;
        try {
            reply = redis.execute(CONSUME_SCRIPT, List.of(key(tokenId)));
        } catch (DataAccessException e) {
            throw new TokenStoreUnavailableException("Failed to consume token record " + tokenId, e);
        }
        return toConsumeResult(tokenId, reply);
    }

    @Override
    public boolean delete(String tokenId) {
        try {
            return Boolean.TRUE.equals(redis.delete(key(tokenId)));
        } catch (DataAccessException e) {
            throw new TokenStoreUnavailableException("Failed to delete token record " + tokenId, e);
        }
    }

    @Override
    public Optional<TokenRecord> find(String tokenId) {
        Map<Object, Object> hash;
        try {
            hash = redis.opsForHash().entries(key(tokenId));
        } catch (DataAccessException e) {
            throw new TokenStoreUnavailableException("Failed to read token record " + tokenId, e);
        }
        if (hash == null || hash.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new TokenRecord(
                tokenId,
                readSubject(text(hash.get(F_SUBJECT))),
                parseLong(hash.get(F_REMAINING)),
                Instant.ofEpochSecond(parseLong(hash.get(F_EXPIRES_AT))),
                Instant.ofEpochSecond(parseLong(hash.get(F_ISSUED_AT)))
        ));
    }

    /**
     * 将 CONSUME_SCRIPT 的返回值转换为 ConsumeResult
     */
    ConsumeResult toConsumeResult(String tokenId, List<?> reply) {
        if (reply == null || reply.isEmpty()) {
            throw new IllegalStateException("Empty reply from consume script for " + tokenId);
        }
        long status = parseLong(reply.get(0));
        if (status == STATUS_NOT_FOUND) {
            return new ConsumeResult.NotFound(tokenId);
        }
        if (status == STATUS_EXHAUSTED) {
            return new ConsumeResult.Exhausted(tokenId);
        }
        if (status < 0 || reply.size() < 4) {
            throw new IllegalStateException("Unexpected reply from consume script for " + tokenId + ": " + reply);
        }
        return new ConsumeResult.Consumed(new TokenRecord(
                tokenId,
                readSubject(text(reply.get(3))),
                status,
                Instant.ofEpochSecond(parseLong(reply.get(1))),
                Instant.ofEpochSecond(parseLong(reply.get(2)))
        ));
    }

    long expireAtMillis(TokenRecord record) {
        return record.expiresAt().plus(expiryGrace).toEpochMilli();
    }

    String key(String tokenId) {
        return keyPrefix + tokenId;
    }

    private String writeSubject(TokenSubject subject) {
        try {
            return objectMapper.writeValueAsString(subject);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize token subject", e);
        }
    }

    private TokenSubject readSubject(String json) {
        try {
            return objectMapper.readValue(json, TokenSubject.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt subject in token record", e);
        }
    }

    private static long parseLong(Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        return Long.parseLong(text(value));
    }

    private static String text(Object value) {
        if (value instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        return String.valueOf(value);
    }
}
