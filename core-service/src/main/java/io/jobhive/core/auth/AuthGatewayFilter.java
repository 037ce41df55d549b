package io.jobhive.core.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobhive.job.error.ApiError;
import io.jobhive.job.error.ForbiddenException;
import io.jobhive.job.error.JobHiveException;
import io.jobhive.job.error.UnauthorizedException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

/**
 * Authenticates every request before it reaches a controller. Services present {@code X-API-Key};
 * users present an HS256 bearer token, which the event stream also accepts as an
 * {@code access_token} query parameter.
 */
public class AuthGatewayFilter extends OncePerRequestFilter {

    public static final String API_KEY_HEADER = "X-API-Key";
    public static final String ACCESS_TOKEN_PARAM = "access_token";

    private static final Logger log = LoggerFactory.getLogger(AuthGatewayFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";
    // ids and channels may arrive with encoded slashes, so they match more than one segment
    private static final Pattern RESULT_CALLBACK = Pattern.compile("^/jobs/.+/result/?$");
    private static final Pattern EVENT_PUBLISH = Pattern.compile("^/events/(?!subscribe/?$).+$");
    private static final Pattern SUBMIT = Pattern.compile("^/jobs/?$|^/jobs/.+/replay/?$");
    private static final Pattern SUBSCRIBE = Pattern.compile("^/events/subscribe/?$");

    private final byte[] apiKey;
    private final JwtVerifier jwtVerifier;
    private final Set<String> submitRoles;
    private final ObjectMapper mapper;

    public AuthGatewayFilter(String apiKey, JwtVerifier jwtVerifier, Collection<String> submitRoles,
                             ObjectMapper mapper) {
        this.apiKey = apiKey.getBytes(StandardCharsets.UTF_8);
        this.jwtVerifier = jwtVerifier;
        this.submitRoles = Set.copyOf(submitRoles);
        this.mapper = mapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = path(request);
        return path.equals("/actuator") || path.startsWith("/actuator/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        Caller caller;
        try {
            caller = authenticate(request);
            authorize(request, caller);
        } catch (JobHiveException e) {
            log.info("Rejected {} {}: {}", request.getMethod(), path(request), e.getMessage());
            writeError(response, e);
            return;
        }
        request.setAttribute(Caller.REQUEST_ATTRIBUTE, caller);
        MDC.put("client_id", caller.id());
        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove("client_id");
        }
    }

    private Caller authenticate(HttpServletRequest request) {
        String presentedKey = request.getHeader(API_KEY_HEADER);
        if (presentedKey != null) {
            if (!MessageDigest.isEqual(apiKey, presentedKey.getBytes(StandardCharsets.UTF_8))) {
                throw new UnauthorizedException("Invalid API key");
            }
            return Caller.service();
        }
        String token = bearerToken(request);
        if (token == null) {
            throw new UnauthorizedException("Missing credentials");
        }
        return jwtVerifier.verify(token);
    }

    private void authorize(HttpServletRequest request, Caller caller) {
        if (caller.isService()) {
            return;
        }
        String path = path(request);
        boolean post = "POST".equalsIgnoreCase(request.getMethod());
        if (post && (RESULT_CALLBACK.matcher(path).matches() || EVENT_PUBLISH.matcher(path).matches())) {
            throw new ForbiddenException("This endpoint requires the service API key");
        }
        if (post && SUBMIT.matcher(path).matches()
            && caller.roles().stream().noneMatch(submitRoles::contains)) {
            throw new ForbiddenException("Caller '%s' lacks a submit role %s".formatted(caller.id(), List.copyOf(submitRoles)));
        }
    }

    private String bearerToken(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            String token = header.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? null : token;
        }
        if (SUBSCRIBE.matcher(path(request)).matches()) {
            String token = request.getParameter(ACCESS_TOKEN_PARAM);
            return token == null || token.isBlank() ? null : token;
        }
        return null;
    }

    private void writeError(HttpServletResponse response, JobHiveException e) throws IOException {
        response.setStatus(e.code().httpStatus());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        if (e instanceof UnauthorizedException) {
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        }
        mapper.writeValue(response.getOutputStream(), ApiError.of(e));
    }

    /**
     * Path as handler mapping sees it: decoded, without {@code ;} parameters and duplicate slashes.
     */
    private static String path(HttpServletRequest request) {
        return UrlPathHelper.defaultInstance.getPathWithinApplication(request);
    }
}
