package com.demo.quotatoken.store;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 单实例内存实现。
 * <p>
 * 扣减基于 {@link ConcurrentHashMap#computeIfPresent}：同一 key 的计算串行执行，
 * 等价于存储侧的条件更新，因此与 Redis 实现具有相同的原子性保证。
 * 过期记录在访问时惰性淘汰；expiryGrace 与 JWT 校验的 clock skew 保持一致。
 */
public class InMemoryTokenRecordStore implements TokenRecordStore {

    private final Map<String, TokenRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration expiryGrace;

    public InMemoryTokenRecordStore(Clock clock) {
        this(clock, Duration.ZERO);
    }

    public InMemoryTokenRecordStore(Clock clock, Duration expiryGrace) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.expiryGrace = expiryGrace == null ? Duration.ZERO : expiryGrace;
    }

    @Override
    public boolean createIfAbsent(TokenRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        return records.putIfAbsent(record.tokenId(), record) == null;
    }

    @Override
    public ConsumeResult decrementIfPositive(String tokenId) {
        AtomicReference<ConsumeResult> result = new AtomicReference<>(new ConsumeResult.NotFound(tokenId));

        records.computeIfPresent(tokenId, (id, current) -> {
            if (current.isExpiredAt(clock.instant(), expiryGrace)) {
                return null;
            }
            if (current.remainingUses() <= 0) {
                result.set(new ConsumeResult.Exhausted(id));
                return null;
            }
            TokenRecord updated = current.withRemainingUses(current.remainingUses() - 1);
            result.set(new ConsumeResult.Consumed(updated));
            // 归零即删除，与扣减处于同一原子步骤
            return updated.remainingUses() == 0 ? null : updated;
        });

        return result.get();
    }

    @Override
    public boolean delete(String tokenId) {
        return records.remove(tokenId) != null;
    }

    @Override
    public Optional<TokenRecord> find(String tokenId) {
        TokenRecord record = records.get(tokenId);
        if (record == null) {
            return Optional.empty();
        }
        if (record.isExpiredAt(clock.instant(), expiryGrace)) {
            records.remove(tokenId, record);
            return Optional.empty();
        }
        return Optional.of(record);
    }

    int size() {
        return records.size();
    }
}
