package com.demo.quotatoken.verifier;

import com.demo.quotatoken.limiter.ConsumptionLimiter;
import com.demo.quotatoken.model.TokenSubject;
import com.demo.quotatoken.security.JwtUtil;
import com.demo.quotatoken.store.ConsumeResult;
import com.demo.quotatoken.store.TokenRecord;
import com.demo.quotatoken.store.TokenStoreUnavailableException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.security.SignatureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.util.Objects;

/**
 * 每个请求的 token 校验入口。
 * <p>
 * 流程：
 * 1) 取 header（Authorization，回退 X-Authorization）
 * 2) 校验签名（固定 HS256）、结构与 aud
 * 3) 校验 exp（过期 token 不消耗次数）
 * 4) 扣减一次使用次数（校验即消耗，与下游处理结果无关）
 * 5) 返回身份信息
 * <p>
 * 任何失败都以 {@link VerificationResult.Rejected} 返回，不向外抛出异常。
 */
public class TokenVerifier {

    public static final String HEADER_AUTHORIZATION = "Authorization";
    public static final String HEADER_LEGACY_AUTHORIZATION = "X-Authorization";

    private static final Logger log = LoggerFactory.getLogger(TokenVerifier.class);

    private final JwtUtil jwtUtil;
    private final ConsumptionLimiter limiter;

    public TokenVerifier(JwtUtil jwtUtil, ConsumptionLimiter limiter) {
        this.jwtUtil = Objects.requireNonNull(jwtUtil, "jwtUtil must not be null");
        this.limiter = Objects.requireNonNull(limiter, "limiter must not be null");
    }

    public VerificationResult verify(HeaderLookup headers) {
        Objects.requireNonNull(headers, "headers must not be null");
        String header = headers.get(HEADER_AUTHORIZATION);
        if (!StringUtils.hasText(header)) {
            header = headers.get(HEADER_LEGACY_AUTHORIZATION);
        }
        return verify(header);
    }

    /**
     * @param authorizationHeader "Bearer xxx" 或裸 token
     */
    public VerificationResult verify(String authorizationHeader) {
        // 1️⃣ 取token
        if (!StringUtils.hasText(authorizationHeader)) {
            return reject(AuthFailure.MISSING_CREDENTIAL, null);
        }
        String token = jwtUtil.extractBearerToken(authorizationHeader);
        if (token == null) {
            return reject(AuthFailure.MALFORMED_CREDENTIAL, null);
        }

        // 2️⃣ 3️⃣ 签名 + 结构 + exp
        Claims claims;
        String jti;
        TokenSubject subject;
        try {
            claims = jwtUtil.parseAndValidate(token);
            jwtUtil.validateAudience(claims);
            jti = jwtUtil.getJti(claims);
            if (!StringUtils.hasText(jti)) {
                return reject(AuthFailure.MALFORMED_CREDENTIAL, null);
            }
            subject = jwtUtil.getSubject(claims);
        } catch (ExpiredJwtException e) {
            return reject(AuthFailure.EXPIRED, e.getClaims().getId());
        } catch (SignatureException e) {
            return reject(AuthFailure.INVALID_SIGNATURE, null);
        } catch (JwtException | IllegalArgumentException e) {
            return reject(AuthFailure.MALFORMED_CREDENTIAL, null);
        }

        // 4️⃣ 扣减
        ConsumeResult result;
        try {
            result = limiter.consume(jti);
        } catch (TokenStoreUnavailableException e) {
            log.warn("Token store unavailable while verifying tokenId={}", jti, e);
            return new VerificationResult.Rejected(AuthFailure.STORE_UNAVAILABLE);
        } catch (RuntimeException e) {
            // 存储返回损坏数据等非预期异常，同样按存储不可用拒绝
            log.warn("Unexpected token store failure while verifying tokenId={}", jti, e);
            return new VerificationResult.Rejected(AuthFailure.STORE_UNAVAILABLE);
        }
        if (!(result instanceof ConsumeResult.Consumed consumed)) {
            return reject(AuthFailure.EXHAUSTED, jti);
        }

        // 5️⃣ 身份以 token claims 为准，剩余次数取自存储
        TokenRecord record = consumed.record();
        return new VerificationResult.Verified(new AuthenticatedToken(
                jti, subject, claims.getExpiration().toInstant(), record.remainingUses()));
    }

    private static VerificationResult reject(AuthFailure reason, String tokenId) {
        log.debug("Token rejected reason={} tokenId={}", reason, tokenId);
        return new VerificationResult.Rejected(reason);
    }
}
