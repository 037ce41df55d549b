package io.jobhive.core.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.jobhive.job.error.UnauthorizedException;
import io.jsonwebtoken.Jwts;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JwtVerifierTest {

    private final JwtVerifier verifier = new JwtVerifier(Tokens.SECRET, Duration.ZERO, Clock.systemUTC());

    @Test
    void readsSubjectAndRoles() {
        Caller caller = verifier.verify(Tokens.user("ana", List.of("JOB_SUBMIT", "VIEWER")));

        assertThat(caller.id()).isEqualTo("ana");
        assertThat(caller.kind()).isEqualTo(Caller.Kind.USER);
        assertThat(caller.roles()).containsExactlyInAnyOrder("JOB_SUBMIT", "VIEWER");
    }

    @Test
    void fallsBackToPermissionsNestedInUserClaims() {
        String token = Tokens.token(Tokens.SECRET,
            Map.of("user_claims", Map.of("id", 7, "permissions", List.of("JOB_SUBMIT"))),
            "ana", Instant.now().plusSeconds(60));

        assertThat(verifier.verify(token).roles()).containsExactly("JOB_SUBMIT");
    }

    @Test
    void rejectsExpiredTokens() {
        String token = Tokens.token(Tokens.SECRET, Map.of(), "ana", Instant.now().minusSeconds(60));

        assertThatThrownBy(() -> verifier.verify(token)).isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void rejectsTokensWithoutExpiry() {
        String token = Tokens.token(Tokens.SECRET, Map.of(), "ana", null);

        assertThatThrownBy(() -> verifier.verify(token))
            .isInstanceOf(UnauthorizedException.class)
            .hasMessageContaining("expiry");
    }

    @Test
    void rejectsForeignSignatures() {
        String token = Tokens.token("another-secret-that-is-also-long-enough!!", Map.of(), "ana",
            Instant.now().plusSeconds(60));

        assertThatThrownBy(() -> verifier.verify(token)).isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void rejectsStrongerHmacVariantsUnderTheSameSecret() {
        String secret = "a-secret-of-at-least-sixty-four-bytes-so-hs512-can-use-it-too-0123456789";
        JwtVerifier longSecret = new JwtVerifier(secret, Duration.ZERO, Clock.systemUTC());
        Instant expiry = Instant.now().plusSeconds(60);

        assertThat(longSecret.verify(Tokens.token(secret, Map.of(), "ana", expiry)).id()).isEqualTo("ana");
        assertThatThrownBy(() -> longSecret.verify(Tokens.token(secret, Jwts.SIG.HS384, Map.of(), "ana", expiry)))
            .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> longSecret.verify(Tokens.token(secret, Jwts.SIG.HS512, Map.of(), "ana", expiry)))
            .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void rejectsGarbage() {
        assertThatThrownBy(() -> verifier.verify("not.a.jwt")).isInstanceOf(UnauthorizedException.class);
    }
}
