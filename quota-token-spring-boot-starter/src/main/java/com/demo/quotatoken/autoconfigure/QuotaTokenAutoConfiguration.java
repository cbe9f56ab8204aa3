package com.demo.quotatoken.autoconfigure;

import com.demo.quotatoken.filter.QuotaTokenAuthFilter;
import com.demo.quotatoken.issuer.TokenIssuer;
import com.demo.quotatoken.issuer.TokenRevoker;
import com.demo.quotatoken.limiter.ConsumptionLimiter;
import com.demo.quotatoken.properties.TokenQuotaProps;
import com.demo.quotatoken.security.JwtUtil;
import com.demo.quotatoken.store.InMemoryTokenRecordStore;
import com.demo.quotatoken.store.RedisTokenRecordStore;
import com.demo.quotatoken.store.TokenRecordStore;
import com.demo.quotatoken.verifier.TokenVerifier;
import com.demo.quotatoken.web.response.JsonResponseWriter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.data.redis.LettuceClientConfigurationBuilderCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * 限次 Token 自动装配
 * <p>
 * 业务侧只需配置 quota-token.secret；存储默认内存实现，
 * 多实例部署时配置 quota-token.store.type=redis。
 * <p>
 * QuotaTokenAuthFilter 不会自动注册到 Servlet 容器，需由业务加入 SecurityFilterChain：
 * {@code http.addFilterBefore(filter, UsernamePasswordAuthenticationFilter.class)}
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration")
@EnableConfigurationProperties(TokenQuotaProps.class)
public class QuotaTokenAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock quotaTokenClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public JwtUtil jwtUtil(TokenQuotaProps props, Clock clock) {
        return new JwtUtil(props, clock);
    }

    @Bean
    @ConditionalOnMissingBean(TokenRecordStore.class)
    @ConditionalOnProperty(prefix = "quota-token.store", name = "type", havingValue = "memory", matchIfMissing = true)
    public InMemoryTokenRecordStore inMemoryTokenRecordStore(Clock clock, TokenQuotaProps props) {
        return new InMemoryTokenRecordStore(clock, Duration.ofSeconds(props.getClockSkewSeconds()));
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenIssuer tokenIssuer(JwtUtil jwtUtil, TokenRecordStore store, TokenQuotaProps props, Clock clock) {
        return new TokenIssuer(jwtUtil, store, props, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConsumptionLimiter consumptionLimiter(TokenRecordStore store) {
        return new ConsumptionLimiter(store);
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenVerifier tokenVerifier(JwtUtil jwtUtil, ConsumptionLimiter limiter) {
        return new TokenVerifier(jwtUtil, limiter);
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenRevoker tokenRevoker(JwtUtil jwtUtil, TokenRecordStore store) {
        return new TokenRevoker(jwtUtil, store);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(StringRedisTemplate.class)
    @ConditionalOnProperty(prefix = "quota-token.store", name = "type", havingValue = "redis")
    static class RedisStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean(TokenRecordStore.class)
        @ConditionalOnBean(StringRedisTemplate.class)
        public RedisTokenRecordStore redisTokenRecordStore(StringRedisTemplate redisTemplate,
                                                           ObjectProvider<ObjectMapper> objectMapper,
                                                           TokenQuotaProps props) {
            return new RedisTokenRecordStore(redisTemplate,
                    objectMapper.getIfAvailable(ObjectMapper::new),
                    props.getStore().getKeyPrefix(),
                    Duration.ofSeconds(props.getClockSkewSeconds()));
        }

        /**
         * 存储命令超时：超时抛出异常，由 TokenVerifier 按 STORE_UNAVAILABLE 处理
         */
        @Bean
        @ConditionalOnClass(name = "io.lettuce.core.RedisClient")
        public LettuceClientConfigurationBuilderCustomizer quotaTokenCommandTimeout(TokenQuotaProps props) {
            return builder -> builder.commandTimeout(props.getStore().getTimeout());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnProperty(prefix = "quota-token.filter", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class FilterConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public JsonResponseWriter quotaTokenJsonResponseWriter(ObjectProvider<ObjectMapper> objectMapper) {
            return new JsonResponseWriter(objectMapper.getIfAvailable(ObjectMapper::new));
        }

        @Bean
        @ConditionalOnMissingBean
        public QuotaTokenAuthFilter quotaTokenAuthFilter(TokenVerifier verifier,
                                                         JsonResponseWriter responseWriter,
                                                         TokenQuotaProps props) {
            return new QuotaTokenAuthFilter(verifier, responseWriter, props.getFilter().getExemptPaths());
        }

        /**
         * 禁止容器自动注册，避免与 SecurityFilterChain 中的同一实例重复执行
         */
        @Bean
        public FilterRegistrationBean<QuotaTokenAuthFilter> quotaTokenAuthFilterRegistration(QuotaTokenAuthFilter filter) {
            FilterRegistrationBean<QuotaTokenAuthFilter> registration = new FilterRegistrationBean<>(filter);
            registration.setEnabled(false);
            return registration;
        }
    }
}
