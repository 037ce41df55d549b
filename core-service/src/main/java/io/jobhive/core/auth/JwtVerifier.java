package io.jobhive.core.auth;

import io.jobhive.job.error.UnauthorizedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import javax.crypto.SecretKey;

/**
 * Verifies bearer tokens signed with HS256; other algorithms are rejected even under the same secret. Roles come from the {@code roles} claim, falling back to
 * {@code permissions} (top level or inside {@code user_claims}) for tokens minted by the login
 * service.
 */
public class JwtVerifier {

    private static final String ALGORITHM = Jwts.SIG.HS256.getId();

    private final SecretKey key;
    private final Duration clockSkew;
    private final Clock clock;

    public JwtVerifier(String secret, Duration clockSkew, Clock clock) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.clockSkew = clockSkew;
        this.clock = clock;
    }

    public Caller verify(String token) {
        Jws<Claims> jws;
        try {
            jws = Jwts.parser()
                .verifyWith(key)
                .clockSkewSeconds(clockSkew.toSeconds())
                .clock(() -> Date.from(clock.instant()))
                .build()
                .parseSignedClaims(token);
        } catch (JwtException | IllegalArgumentException e) {
            throw new UnauthorizedException("Invalid bearer token", e);
        }
        // a long secret would also verify HS384/HS512, only HS256 is accepted
        if (!ALGORITHM.equals(jws.getHeader().getAlgorithm())) {
            throw new UnauthorizedException("Invalid bearer token");
        }
        Claims claims = jws.getPayload();
        if (claims.getExpiration() == null) {
            throw new UnauthorizedException("Bearer token has no expiry");
        }
        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new UnauthorizedException("Bearer token has no subject");
        }
        return new Caller(subject, Caller.Kind.USER, roles(claims));
    }

    private static Set<String> roles(Claims claims) {
        Set<String> roles = new LinkedHashSet<>();
        addAll(roles, claims.get("roles"));
        if (roles.isEmpty()) {
            addAll(roles, claims.get("permissions"));
        }
        if (roles.isEmpty() && claims.get("user_claims") instanceof Map<?, ?> nested) {
            addAll(roles, nested.get("permissions"));
        }
        return Set.copyOf(roles);
    }

    private static void addAll(Set<String> target, Object claim) {
        if (claim instanceof Collection<?> values) {
            values.stream().filter(v -> v != null).map(Object::toString).forEach(target::add);
        } else if (claim instanceof String value && !value.isBlank()) {
            target.add(value);
        }
    }
}
