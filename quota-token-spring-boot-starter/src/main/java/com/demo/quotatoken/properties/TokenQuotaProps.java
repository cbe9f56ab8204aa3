package com.demo.quotatoken.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 限次 Token 配置属性
 */
@ConfigurationProperties(prefix = "quota-token")
public class TokenQuotaProps {

    /**
     * JWT 签名密钥（HS256）。
     *
     * <p>要求：UTF-8 编码后长度 ≥ 32 bytes。缺失时启动失败。</p>
     * <p>建议通过环境变量/配置中心注入，避免明文提交到仓库。</p>
     */
    private String secret;

    /**
     * 签发者
     */
    private String issuer = "quota-token";

    /**
     * 接收方
     */
    private List<String> audience = List.of("default-app");

    /**
     * Access Token 有效期（秒）。
     */
    private long accessTtlSeconds = 900;

    /**
     * 每个 token 的最大使用次数。
     */
    private long maxUses = 1000;

    /**
     * 时钟偏移容忍（秒）：用于校验 exp。
     */
    private long clockSkewSeconds = 0;

    private final Store store = new Store();

    private final Filter filter = new Filter();

    public String getSecret() {
        return secret;
    }

    public void setSecret(String secret) {
        this.secret = secret;
    }

    public String getIssuer() {
        return issuer;
    }

    public void setIssuer(String issuer) {
        this.issuer = issuer;
    }

    public List<String> getAudience() {
        return audience;
    }

    public void setAudience(List<String> audience) {
        this.audience = audience;
    }

    public long getAccessTtlSeconds() {
        return accessTtlSeconds;
    }

    public void setAccessTtlSeconds(long accessTtlSeconds) {
        this.accessTtlSeconds = accessTtlSeconds;
    }

    public long getMaxUses() {
        return maxUses;
    }

    public void setMaxUses(long maxUses) {
        this.maxUses = maxUses;
    }

    public long getClockSkewSeconds() {
        return clockSkewSeconds;
    }

    public void setClockSkewSeconds(long clockSkewSeconds) {
        this.clockSkewSeconds = clockSkewSeconds;
    }

    public Store getStore() {
        return store;
    }

    public Filter getFilter() {
        return filter;
    }

    /**
     * Token 记录存储配置
     */
    public static class Store {

        /**
         * 存储类型：memory（单实例）/ redis（多实例共享）。
         */
        private StoreType type = StoreType.MEMORY;

        /**
         * Redis key 前缀
         */
        private String keyPrefix = "quota-token:";

        /**
         * 单次存储命令超时；超时按瞬时故障处理（401，可重试）。
         */
        private Duration timeout = Duration.ofSeconds(2);

        public StoreType getType() {
            return type;
        }

        public void setType(StoreType type) {
            this.type = type;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public enum StoreType {
        MEMORY,
        REDIS
    }

    /**
     * 鉴权过滤器配置
     */
    public static class Filter {

        /**
         * 是否注册 QuotaTokenAuthFilter
         */
        private boolean enabled = true;

        /**
         * 免鉴权路径；以 "/" 结尾表示前缀匹配，否则精确匹配。
         */
        private List<String> exemptPaths = new ArrayList<>(List.of(
                "/health",
                "/health/components",
                "/tracks",
                "/authenticate",
                "/docs",
                "/redoc",
                "/openapi.json",
                "/static/",
                "/favicon.ico"
        ));

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getExemptPaths() {
            return exemptPaths;
        }

        public void setExemptPaths(List<String> exemptPaths) {
            this.exemptPaths = exemptPaths;
        }
    }
}
