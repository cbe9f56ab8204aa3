package com.demo.quotatoken.verifier;

import com.demo.quotatoken.issuer.IssuedToken;
import com.demo.quotatoken.issuer.TokenIssuer;
import com.demo.quotatoken.limiter.ConsumptionLimiter;
import com.demo.quotatoken.properties.TokenQuotaProps;
import com.demo.quotatoken.security.JwtUtil;
import com.demo.quotatoken.store.InMemoryTokenRecordStore;
import com.demo.quotatoken.store.TokenRecordStore;
import com.demo.quotatoken.store.TokenStoreUnavailableException;
import com.demo.quotatoken.support.MutableClock;
import com.demo.quotatoken.support.TestFixtures;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class TokenVerifierTest {

    private MutableClock clock;
    private JwtUtil jwtUtil;
    private InMemoryTokenRecordStore store;
    private TokenIssuer issuer;
    private TokenVerifier verifier;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestFixtures.T0);
        TokenQuotaProps props = TestFixtures.props(5);
        jwtUtil = new JwtUtil(props, clock);
        // 存储侧不做过期淘汰，用于断言“过期 token 不触碰存储”
        store = spy(new InMemoryTokenRecordStore(Clock.fixed(TestFixtures.T0, ZoneOffset.UTC)));
        issuer = new TokenIssuer(jwtUtil, store, props, clock);
        verifier = new TokenVerifier(jwtUtil, new ConsumptionLimiter(store));
    }

    private static AuthFailure failure(VerificationResult result) {
        return assertInstanceOf(VerificationResult.Rejected.class, result).reason();
    }

    private static AuthenticatedToken accepted(VerificationResult result) {
        return assertInstanceOf(VerificationResult.Verified.class, result).token();
    }

    @Test
    void testScenario_quotaFiveSixRequests() {
        IssuedToken issued = issuer.issue(TestFixtures.subject());
        String header = "Bearer " + issued.token();

        for (long expected = 4; expected >= 0; expected--) {
            assertEquals(expected, accepted(verifier.verify(header)).remainingUses());
        }

        VerificationResult sixth = verifier.verify(header);
        assertEquals(AuthFailure.EXHAUSTED, failure(sixth));
        assertEquals("token revoked or expired", ((VerificationResult.Rejected) sixth).message());
        assertTrue(store.find(issued.tokenId()).isEmpty());
    }

    @Test
    void testVerify_attachesDecodedSubject() {
        IssuedToken issued = issuer.issue(TestFixtures.subject());

        AuthenticatedToken token = accepted(verifier.verify("Bearer " + issued.token()));

        assertEquals(issued.tokenId(), token.tokenId());
        assertEquals("42", token.subject().userId());
        assertEquals("alice", token.subject().username());
        assertEquals(Set.of("admin", "user"), token.subject().roles());
        assertEquals(Set.of("group1"), token.subject().groups());
        assertEquals(issued.expiresAt(), token.expiresAt());
    }

    @Test
    void testVerify_missingHeader() {
        assertEquals(AuthFailure.MISSING_CREDENTIAL, failure(verifier.verify(HeaderLookup.of(Map.of()))));
        assertEquals(AuthFailure.MISSING_CREDENTIAL, failure(verifier.verify("   ")));
        verifyNoInteractions(store);
    }

    @Test
    void testVerify_bearerWithoutToken() {
        assertEquals(AuthFailure.MALFORMED_CREDENTIAL, failure(verifier.verify("Bearer ")));
        assertEquals(AuthFailure.MALFORMED_CREDENTIAL, failure(verifier.verify("Bearer:")));
        verifyNoInteractions(store);
    }

    @Test
    void testVerify_garbageToken() {
        assertEquals(AuthFailure.MALFORMED_CREDENTIAL, failure(verifier.verify("Bearer not-a-jwt")));
        assertEquals(AuthFailure.MALFORMED_CREDENTIAL, failure(verifier.verify("a.b.c")));
        verifyNoInteractions(store);
    }

    @Test
    void testVerify_badSignature() {
        IssuedToken issued = issuer.issue(TestFixtures.subject());
        TokenQuotaProps otherProps = TestFixtures.props(5);
        otherProps.setSecret("another-secret-another-secret-123");
        String forged = new JwtUtil(otherProps, clock).generateAccessToken(
                issued.tokenId(), TestFixtures.subject(), TestFixtures.T0, TestFixtures.T0.plusSeconds(900));

        assertEquals(AuthFailure.INVALID_SIGNATURE, failure(verifier.verify("Bearer " + forged)));
        verify(store, never()).decrementIfPositive(anyString());
        assertEquals(5, store.find(issued.tokenId()).orElseThrow().remainingUses());
    }

    @Test
    void testVerify_missingJti() {
        String noJti = Jwts.builder()
                .issuer("quota-token")
                .subject("42")
                .expiration(Date.from(TestFixtures.T0.plusSeconds(60)))
                .signWith(Keys.hmacShaKeyFor(TestFixtures.SECRET.getBytes(StandardCharsets.UTF_8)), Jwts.SIG.HS256)
                .compact();

        assertEquals(AuthFailure.MALFORMED_CREDENTIAL, failure(verifier.verify(noJti)));
        verifyNoInteractions(store);
    }

    @Test
    void testVerify_expiredTokenDoesNotSpendQuota() {
        IssuedToken issued = issuer.issue(TestFixtures.subject());
        clock.advance(Duration.ofSeconds(901));

        assertEquals(AuthFailure.EXPIRED, failure(verifier.verify("Bearer " + issued.token())));

        verify(store, never()).decrementIfPositive(anyString());
        assertEquals(5, store.find(issued.tokenId()).orElseThrow().remainingUses());
    }

    @Test
    void testVerify_legacyHeaderFallback() {
        IssuedToken issued = issuer.issue(TestFixtures.subject());

        VerificationResult result = verifier.verify(HeaderLookup.of(Map.of("x-authorization", "Bearer " + issued.token())));

        assertEquals(4, accepted(result).remainingUses());
    }

    @Test
    void testVerify_headerNameCaseInsensitive() {
        IssuedToken issued = issuer.issue(TestFixtures.subject());

        VerificationResult result = verifier.verify(HeaderLookup.of(Map.of("AUTHORIZATION", issued.authorizationValue())));

        assertTrue(result.verified());
    }

    @Test
    void testVerify_rawTokenWithoutScheme() {
        IssuedToken issued = issuer.issue(TestFixtures.subject());

        assertTrue(verifier.verify(issued.token()).verified());
        assertTrue(verifier.verify("  " + issued.token() + "  ").verified());
    }

    @Test
    void testVerify_revokedToken() {
        IssuedToken issued = issuer.issue(TestFixtures.subject());
        store.delete(issued.tokenId());

        assertEquals(AuthFailure.EXHAUSTED, failure(verifier.verify(issued.authorizationValue())));
    }

    @Test
    void testVerify_storeUnavailable() {
        IssuedToken issued = issuer.issue(TestFixtures.subject());
        TokenRecordStore down = mock(TokenRecordStore.class);
        when(down.decrementIfPositive(anyString()))
                .thenThrow(new TokenStoreUnavailableException("timeout", new RuntimeException()));
        TokenVerifier v = new TokenVerifier(jwtUtil, new ConsumptionLimiter(down));

        assertEquals(AuthFailure.STORE_UNAVAILABLE, failure(v.verify(issued.authorizationValue())));
    }

    @Test
    void testVerify_storeReturnsCorruptData() {
        IssuedToken issued = issuer.issue(TestFixtures.subject());
        TokenRecordStore broken = mock(TokenRecordStore.class);
        when(broken.decrementIfPositive(anyString()))
                .thenThrow(new IllegalStateException("Corrupt subject in token record"));
        TokenVerifier v = new TokenVerifier(jwtUtil, new ConsumptionLimiter(broken));

        VerificationResult result = assertDoesNotThrow(() -> v.verify(issued.authorizationValue()));

        assertEquals(AuthFailure.STORE_UNAVAILABLE, failure(result));
    }

    @Test
    void testVerify_rejectsNonHs256Algorithm() {
        // 64 bytes：足以验证 HS512
        String longSecret = TestFixtures.SECRET + TestFixtures.SECRET;
        TokenQuotaProps props = TestFixtures.props(5);
        props.setSecret(longSecret);
        JwtUtil util = new JwtUtil(props, clock);
        InMemoryTokenRecordStore s = spy(new InMemoryTokenRecordStore(clock));
        IssuedToken issued = new TokenIssuer(util, s, props, clock).issue(TestFixtures.subject());
        TokenVerifier v = new TokenVerifier(util, new ConsumptionLimiter(s));

        String hs512 = Jwts.builder()
                .id(issued.tokenId())
                .issuer("quota-token")
                .subject("42")
                .audience().add("default-app").and()
                .claim(JwtUtil.CLAIM_USER_ID, "42")
                .issuedAt(Date.from(TestFixtures.T0))
                .expiration(Date.from(TestFixtures.T0.plusSeconds(900)))
                .signWith(Keys.hmacShaKeyFor(longSecret.getBytes(StandardCharsets.UTF_8)), Jwts.SIG.HS512)
                .compact();

        assertEquals(AuthFailure.MALFORMED_CREDENTIAL, failure(v.verify("Bearer " + hs512)));
        verify(s, never()).decrementIfPositive(anyString());
        assertEquals(5, s.find(issued.tokenId()).orElseThrow().remainingUses());

        assertEquals(4, accepted(v.verify(issued.authorizationValue())).remainingUses());
    }

    @Test
    void testVerify_foreignAudience() {
        TokenQuotaProps otherProps = TestFixtures.props(5);
        otherProps.setAudience(List.of("other-app"));
        String foreign = new JwtUtil(otherProps, clock).generateAccessToken(
                "jti-1", TestFixtures.subject(), TestFixtures.T0, TestFixtures.T0.plusSeconds(900));

        assertEquals(AuthFailure.MALFORMED_CREDENTIAL, failure(verifier.verify("Bearer " + foreign)));
        verifyNoInteractions(store);
    }
}
