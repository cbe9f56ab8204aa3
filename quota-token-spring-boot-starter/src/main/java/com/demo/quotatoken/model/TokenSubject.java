package com.demo.quotatoken.model;

import java.util.Objects;
import java.util.Set;

/**
 * Token 所代表的身份（签发后不可变）。
 *
 * @param userId   用户 ID（同时写入 sub）
 * @param username 用户名
 * @param roles    角色集合
 * @param groups   分组集合
 */
public record TokenSubject(String userId, String username, Set<String> roles, Set<String> groups) {

    public TokenSubject {
        Objects.requireNonNull(userId, "userId must not be null");
        if (userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        groups = groups == null ? Set.of() : Set.copyOf(groups);
    }
}
