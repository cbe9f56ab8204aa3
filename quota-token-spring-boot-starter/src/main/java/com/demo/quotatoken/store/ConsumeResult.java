package com.demo.quotatoken.store;

/**
 * 一次扣减的结果。
 * <p>
 * Exhausted / NotFound 对外统一视为“token 无效”，仅在日志中区分。
 */
public sealed interface ConsumeResult {

    /**
     * 扣减成功，record 为扣减后的状态（remainingUses 可能为 0，此时记录已被删除）。
     */
    record Consumed(TokenRecord record) implements ConsumeResult {
    }

    /**
     * 记录存在但已无剩余次数。
     */
    record Exhausted(String tokenId) implements ConsumeResult {
    }

    /**
     * 记录不存在（从未签发 / 已耗尽删除 / 已撤销 / 已过期淘汰）。
     */
    record NotFound(String tokenId) implements ConsumeResult {
    }

    default boolean consumed() {
        return this instanceof Consumed;
    }
}
