package com.demo.quotatoken.issuer;

import com.demo.quotatoken.security.JwtUtil;
import com.demo.quotatoken.store.TokenRecordStore;
import io.jsonwebtoken.Claims;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.util.Objects;

/**
 * 显式撤销：无条件删除存储记录，之后该 token 的任何使用都会失败。
 */
public class TokenRevoker {

    private static final Logger log = LoggerFactory.getLogger(TokenRevoker.class);

    private final JwtUtil jwtUtil;
    private final TokenRecordStore store;

    public TokenRevoker(JwtUtil jwtUtil, TokenRecordStore store) {
        this.jwtUtil = Objects.requireNonNull(jwtUtil, "jwtUtil must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    /**
     * 按 tokenId 撤销（幂等）。
     *
     * @return 撤销前记录是否存在
     */
    public boolean revoke(String tokenId) {
        if (!StringUtils.hasText(tokenId)) {
            throw new IllegalArgumentException("tokenId must not be blank");
        }
        boolean existed = store.delete(tokenId);
        log.info("Revoked token tokenId={} existed={}", tokenId, existed);
        return existed;
    }

    /**
     * 按调用方持有的 token 撤销（支持 "Bearer xxx" 与裸 token）。签名必须有效，过期 token 也可撤销。
     */
    public boolean revokeToken(String presented) {
        String token = jwtUtil.extractBearerToken(presented);
        if (token == null) {
            throw new IllegalArgumentException("Token is blank");
        }
        Claims claims = jwtUtil.parseIgnoringExpiry(token);
        String jti = jwtUtil.getJti(claims);
        if (!StringUtils.hasText(jti)) {
            throw new IllegalArgumentException("Missing jti");
        }
        return revoke(jti);
    }
}
