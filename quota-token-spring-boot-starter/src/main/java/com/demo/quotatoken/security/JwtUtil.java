package com.demo.quotatoken.security;

import com.demo.quotatoken.model.TokenSubject;
import com.demo.quotatoken.properties.TokenQuotaProps;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Header;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import org.springframework.util.StringUtils;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * JWT 工具
 * <p>
 * 功能：负责 token 的签发、解析与基础校验（签名 + alg + exp + iss + aud），算法固定 HS256。
 * <p>
 * 参数：
 * - jti = token 唯一标识（= 存储中的 tokenId）
 * - iss = 签发者
 * - sub = userId
 * - aud = 接收方
 * - iat = 签发时间
 * - exp = 过期时间
 * - user_id / username / roles / groups = 身份信息
 * <p>
 * 说明：使用次数不在此类处理，由 ConsumptionLimiter 负责。
 */
public class JwtUtil {

    public static final String CLAIM_USER_ID = "user_id";
    public static final String CLAIM_USERNAME = "username";
    public static final String CLAIM_ROLES = "roles";
    public static final String CLAIM_GROUPS = "groups";

    private final TokenQuotaProps props;
    private final SecretKey key;
    private final JwtParser parser;

    public JwtUtil(TokenQuotaProps props, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        validateProps(props);
        this.key = initKey(props.getSecret());
        this.parser = Jwts.parser()
                .verifyWith(key)
                .requireIssuer(props.getIssuer())
                .clockSkewSeconds(props.getClockSkewSeconds())
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    // =========================
    // 生成 Token
    // =========================

    /**
     * 生成 Access Token。iat/exp 以秒为精度写入，调用方应传入已截断到秒的时间。
     */
    public String generateAccessToken(String tokenId, TokenSubject subject, Instant issuedAt, Instant expiresAt) {
        if (!StringUtils.hasText(tokenId)) throw new IllegalArgumentException("tokenId must not be blank");
        Objects.requireNonNull(subject, "subject must not be null");
        if (!expiresAt.isAfter(issuedAt)) throw new IllegalArgumentException("expiresAt must be after issuedAt");

        var builder = Jwts.builder()
                .id(tokenId)                                            // jti
                .issuer(props.getIssuer())                              // iss
                .subject(subject.userId())                              // sub=userId
                .audience().add(props.getAudience()).and()             // aud
                .claim(CLAIM_USER_ID, subject.userId())
                .claim(CLAIM_ROLES, sorted(subject.roles()))
                .claim(CLAIM_GROUPS, sorted(subject.groups()))
                .issuedAt(Date.from(issuedAt))                          // iat
                .expiration(Date.from(expiresAt))                       // exp
                .signWith(key, Jwts.SIG.HS256);

        if (StringUtils.hasText(subject.username())) {
            builder.claim(CLAIM_USERNAME, subject.username());
        }
        return builder.compact();
    }

    // =========================
    // 解析 + 基础校验
    // =========================

    /**
     * 解析并校验签名、alg、exp、iss。
     * <p>
     * 失败时抛出 JJWT 原始异常，调用方据此区分：
     * ExpiredJwtException（过期）/ SignatureException（签名错误）/ 其它 JwtException（结构错误）。
     * alg 非 HS256 时抛出 UnsupportedJwtException，即使 key 长度足以验证 HS384/HS512。
     */
    public Claims parseAndValidate(String token) {
        if (!StringUtils.hasText(token)) {
            throw new IllegalArgumentException("Token is blank");
        }
        Jws<Claims> jws;
        try {
            jws = parser.parseSignedClaims(token);
        } catch (ExpiredJwtException e) {
            requireHs256(e.getHeader());
            throw e;
        }
        requireHs256(jws.getHeader());
        return jws.getPayload();
    }

    /**
     * 解析并校验签名，但接受已过期的 token（用于撤销）。
     * JJWT 在签名校验通过后才做 exp 校验，因此异常中的 claims 是可信的。
     */
    public Claims parseIgnoringExpiry(String token) {
        try {
            return parseAndValidate(token);
        } catch (ExpiredJwtException e) {
            return e.getClaims();
        }
    }

    /**
     * 校验接收方aud：token 的 aud 与配置至少有一个交集
     */
    public void validateAudience(Claims claims) {
        List<String> allowed = props.getAudience();
        Set<String> tokenAud = claims.getAudience();
        boolean ok = tokenAud != null && tokenAud.stream().anyMatch(allowed::contains);
        if (!ok) {
            throw new IllegalArgumentException("Invalid audience");
        }
    }

    /**
     * 从 claims 还原身份信息
     */
    public TokenSubject getSubject(Claims claims) {
        String userId = claims.get(CLAIM_USER_ID, String.class);
        if (!StringUtils.hasText(userId)) {
            userId = claims.getSubject();
        }
        if (!StringUtils.hasText(userId)) {
            throw new IllegalArgumentException("Missing sub(userId)");
        }
        return new TokenSubject(
                userId,
                claims.get(CLAIM_USERNAME, String.class),
                toStringSet(claims.get(CLAIM_ROLES)),
                toStringSet(claims.get(CLAIM_GROUPS)));
    }

    /**
     * 取 jti
     */
    public String getJti(Claims claims) {
        return claims.getId();
    }

    /**
     * 从 Header 值提取 token。
     * - 兼容大小写：bearer/Bearer
     * - 兼容多空格：Bearer    xxx
     * - 兼容 Bearer:xxx
     * - 兼容不带 Bearer 前缀的裸 token
     *
     * @return token；header 为空或仅有 Bearer 前缀时返回 null
     */
    public String extractBearerToken(String authorizationHeader) {
        if (!StringUtils.hasText(authorizationHeader)) return null;

        String h = authorizationHeader.trim();
        String prefix = "Bearer";
        if (!h.regionMatches(true, 0, prefix, 0, prefix.length()) || !isSchemeBoundary(h, prefix.length())) {
            // 裸 token
            return h;
        }

        String rest = h.substring(prefix.length()).trim();
        if (rest.startsWith(":")) { // 极少数网关会写成 Bearer:xxx
            rest = rest.substring(1).trim();
        }
        return rest.isEmpty() ? null : rest;
    }

    // =========================
    // 内部辅助方法
    // =========================

    private static boolean isSchemeBoundary(String h, int idx) {
        if (h.length() == idx) return true;
        char c = h.charAt(idx);
        return Character.isWhitespace(c) || c == ':';
    }

    private static void requireHs256(Header header) {
        String alg = header == null ? null : header.getAlgorithm();
        if (!Jwts.SIG.HS256.getId().equals(alg)) {
            throw new UnsupportedJwtException("Unsupported alg: " + alg);
        }
    }

    private void validateProps(TokenQuotaProps props) {
        if (!StringUtils.hasText(props.getIssuer())) {
            throw new IllegalArgumentException("quota-token.issuer must not be blank");
        }
        if (props.getAudience() == null || props.getAudience().isEmpty()) {
            throw new IllegalArgumentException("quota-token.audience must not be empty");
        }
        if (props.getAccessTtlSeconds() <= 0) {
            throw new IllegalArgumentException("quota-token.access-ttl-seconds must be > 0");
        }
        if (props.getClockSkewSeconds() < 0) {
            throw new IllegalArgumentException("quota-token.clock-skew-seconds must be >= 0");
        }
        if (!StringUtils.hasText(props.getSecret())) {
            throw new IllegalArgumentException("quota-token.secret must not be blank");
        }
    }

    private SecretKey initKey(String secret) {
        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        // HS256 至少 32 bytes
        if (bytes.length < 32) {
            throw new IllegalArgumentException("quota-token.secret length must be at least 32 bytes for HS256");
        }
        return Keys.hmacShaKeyFor(bytes);
    }

    private static List<String> sorted(Set<String> values) {
        List<String> list = new ArrayList<>(values);
        Collections.sort(list);
        return list;
    }

    private static Set<String> toStringSet(Object value) {
        if (value == null) return Set.of();
        if (value instanceof Collection<?> c) {
            Set<String> set = new LinkedHashSet<>();
            for (Object x : c) {
                if (x == null) continue;
                String v = String.valueOf(x);
                if (StringUtils.hasText(v)) set.add(v);
            }
            return set;
        }
        String v = String.valueOf(value);
        return StringUtils.hasText(v) ? Set.of(v) : Set.of();
    }
}
