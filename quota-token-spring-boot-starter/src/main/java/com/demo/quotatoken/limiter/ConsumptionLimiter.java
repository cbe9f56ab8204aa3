package com.demo.quotatoken.limiter;

import com.demo.quotatoken.store.ConsumeResult;
import com.demo.quotatoken.store.TokenRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.util.Objects;

/**
 * 使用次数扣减。
 * <p>
 * 每次调用只发出一个存储原语 {@link TokenRecordStore#decrementIfPositive(String)}，
 * 不在本地读取剩余次数，也不持有任何进程内锁；并发正确性完全由存储的条件更新保证。
 * <p>
 * 存储故障以 {@code TokenStoreUnavailableException} 原样抛出，不重试。
 */
public class ConsumptionLimiter {

    private static final Logger log = LoggerFactory.getLogger(ConsumptionLimiter.class);

    private final TokenRecordStore store;

    public ConsumptionLimiter(TokenRecordStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    public ConsumeResult consume(String tokenId) {
        if (!StringUtils.hasText(tokenId)) {
            return new ConsumeResult.NotFound(tokenId);
        }

        ConsumeResult result = store.decrementIfPositive(tokenId);

        if (result instanceof ConsumeResult.Consumed c) {
            if (c.record().remainingUses() == 0) {
                log.info("Token exhausted by this use, record deleted tokenId={}", tokenId);
            } else {
                log.debug("Token consumed tokenId={} remainingUses={}", tokenId, c.record().remainingUses());
            }
        } else if (result instanceof ConsumeResult.Exhausted) {
            log.info("Token rejected: no uses left tokenId={}", tokenId);
        } else {
            // 不存在：可能是撤销/耗尽后的重放，也可能是伪造 id 的探测
            log.info("Token rejected: no record tokenId={}", tokenId);
        }
        return result;
    }
}
