package com.demo.quotatoken.store;

import java.util.Optional;

/**
 * Token 记录存储，弥补 JWT 无状态、无法限制使用次数的不足。
 * <p>
 * 所有写操作必须是存储自身提供的原子原语（条件创建 / 条件扣减 / 删除），
 * 不允许在调用方“读出、计算、写回”。多实例共享同一存储时正确性依然成立。
 * <p>
 * 所有方法在存储不可用或超时时抛出 {@link TokenStoreUnavailableException}。
 */
public interface TokenRecordStore {

    /**
     * 条件创建：仅当 tokenId 不存在时写入。
     *
     * @return true：写入成功；false：tokenId 已存在，未做任何修改
     */
    boolean createIfAbsent(TokenRecord record);

    /**
     * 原子扣减：remainingUses &gt; 0 时减 1，减到 0 时在同一操作内删除记录。
     * <p>
     * 记录不存在或已过期返回 NotFound；remainingUses 已为 0 返回 Exhausted（同时删除）。
     * 条件不满足时不产生任何修改，也不会创建记录。
     */
    ConsumeResult decrementIfPositive(String tokenId);

    /**
     * 无条件删除（撤销）。
     *
     * @return 删除前记录是否存在
     */
    boolean delete(String tokenId);

    /**
     * 按 key 读取，过期记录视为不存在。
     */
    Optional<TokenRecord> find(String tokenId);
}
