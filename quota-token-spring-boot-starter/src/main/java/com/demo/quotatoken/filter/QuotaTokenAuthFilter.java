package com.demo.quotatoken.filter;

import com.demo.quotatoken.verifier.AuthenticatedToken;
import com.demo.quotatoken.verifier.TokenVerifier;
import com.demo.quotatoken.verifier.VerificationResult;
import com.demo.quotatoken.web.response.JsonResponseWriter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * 限次 Token 鉴权过滤器
 * <p>
 * 功能：对非免鉴权路径强制校验 token，通过后写入 SecurityContext 与请求属性。
 * <p>
 * 约定：Authorization: Bearer token（回退 X-Authorization），principal = {@link AuthenticatedToken}，
 * authorities = ROLE_ + roles。
 * <p>
 * 策略：任何失败统一返回 401 {"detail":"Unauthorized"}，不暴露具体原因。
 */
public class QuotaTokenAuthFilter extends OncePerRequestFilter {

    public static final String REQ_ATTR_AUTH = "quota-token.auth";
    static final String HEADER_FORWARDED_PREFIX = "X-Forwarded-Prefix";

    private static final UrlPathHelper URL_PATH_HELPER = new UrlPathHelper();

    private final TokenVerifier verifier;
    private final JsonResponseWriter responseWriter;
    private final List<String> exemptPaths;

    public QuotaTokenAuthFilter(TokenVerifier verifier,
                                JsonResponseWriter responseWriter,
                                List<String> exemptPaths) {
        this.verifier = Objects.requireNonNull(verifier, "verifier must not be null");
        this.responseWriter = Objects.requireNonNull(responseWriter, "responseWriter must not be null");
        this.exemptPaths = exemptPaths == null ? List.of() : List.copyOf(exemptPaths);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return isExempt(pathWithinApplication(request));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        // 已认证则不重复校验（也不重复扣减）
        if (SecurityContextHolder.getContext().getAuthentication() != null) {
            chain.doFilter(req, res);
            return;
        }

        VerificationResult result = verifier.verify(req::getHeader);

        if (!(result instanceof VerificationResult.Verified verified)) {
            SecurityContextHolder.clearContext();
            responseWriter.writeUnauthorized(res);
            return;
        }

        AuthenticatedToken token = verified.token();
        var authorities = token.subject().roles().stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(r -> r.startsWith("ROLE_") ? r : "ROLE_" + r)
                .map(SimpleGrantedAuthority::new)
                .toList();

        var authentication = new UsernamePasswordAuthenticationToken(token, null, authorities);
        SecurityContextHolder.getContext().setAuthentication(authentication);
        req.setAttribute(REQ_ATTR_AUTH, token);

        chain.doFilter(req, res);
    }

    boolean isExempt(String path) {
        for (String p : exemptPaths) {
            if (p.endsWith("/") && path.startsWith(p)) {
                return true;
            }
            if (path.equals(p)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 解码后的应用内路径：去掉 context path；部署在网关前缀下时再去掉 X-Forwarded-Prefix
     */
    private static String pathWithinApplication(HttpServletRequest request) {
        String path = URL_PATH_HELPER.getPathWithinApplication(request);
        if (!StringUtils.hasText(request.getContextPath())) {
            String prefix = request.getHeader(HEADER_FORWARDED_PREFIX);
            if (StringUtils.hasText(prefix)) {
                prefix = StringUtils.trimTrailingCharacter(prefix.trim(), '/');
                if (!prefix.isEmpty() && path.startsWith(prefix + "/")) {
                    return path.substring(prefix.length());
                }
            }
        }
        return path;
    }
}
