package io.jobhive.core.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RestController;

class AuthGatewayFilterTest {

    private static final String API_KEY = "service-key";

    private final RouteController routes = new RouteController();
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        JwtVerifier verifier = new JwtVerifier(Tokens.SECRET, Duration.ZERO, Clock.systemUTC());
        AuthGatewayFilter filter = new AuthGatewayFilter(API_KEY, verifier, List.of("JOB_SUBMIT"), new ObjectMapper());
        mvc = MockMvcBuilders.standaloneSetup(routes).addFilters(filter).build();
    }

    @Test
    void missingCredentialsAreRejectedBeforeTheHandlerRuns() throws Exception {
        mvc.perform(post("/jobs").contentType(MediaType.APPLICATION_JSON).content("{}"))
            .andExpect(status().isUnauthorized())
            .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
            .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));

        assertThat(routes.calls.get()).isZero();
    }

    @Test
    void wrongApiKeyIsRejected() throws Exception {
        mvc.perform(post("/jobs/1/result").header(AuthGatewayFilter.API_KEY_HEADER, "service-kez"))
            .andExpect(status().isUnauthorized());

        assertThat(routes.calls.get()).isZero();
    }

    @Test
    void apiKeyOpensEveryRoute() throws Exception {
        mvc.perform(post("/jobs").header(AuthGatewayFilter.API_KEY_HEADER, API_KEY)).andExpect(status().isOk());
        mvc.perform(post("/jobs/1/result").header(AuthGatewayFilter.API_KEY_HEADER, API_KEY)).andExpect(status().isOk());
        mvc.perform(post("/events/jobs").header(AuthGatewayFilter.API_KEY_HEADER, API_KEY)).andExpect(status().isOk());
        mvc.perform(get("/jobs").header(AuthGatewayFilter.API_KEY_HEADER, API_KEY))
            .andExpect(status().isOk())
            .andExpect(content().string("service"));
    }

    @Test
    void bearerWithSubmitRoleMaySubmitButNotCallBack() throws Exception {
        String token = Tokens.user("ana", List.of("JOB_SUBMIT"));

        mvc.perform(post("/jobs").header(HttpHeaders.AUTHORIZATION, "Bearer " + token)).andExpect(status().isOk());
        mvc.perform(post("/jobs/1/result").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error").value("FORBIDDEN"));
        mvc.perform(post("/events/jobs").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
            .andExpect(status().isForbidden());

        assertThat(routes.calls.get()).isEqualTo(1);
    }

    @Test
    void bearerWithoutSubmitRoleMayOnlyRead() throws Exception {
        String token = Tokens.user("viewer", List.of("VIEWER"));

        mvc.perform(post("/jobs").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
            .andExpect(status().isForbidden());
        mvc.perform(post("/jobs/1/replay").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
            .andExpect(status().isForbidden());
        mvc.perform(get("/jobs").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
            .andExpect(status().isOk())
            .andExpect(content().string("viewer"));
    }

    @Test
    void pathParametersAndEncodingDoNotSidestepRouteRules() throws Exception {
        String viewer = "Bearer " + Tokens.user("viewer", List.of("VIEWER"));

        mvc.perform(post("/jobs/1/result;x=1").header(HttpHeaders.AUTHORIZATION, viewer))
            .andExpect(status().isForbidden());
        mvc.perform(post("/jobs;x=1").header(HttpHeaders.AUTHORIZATION, viewer))
            .andExpect(status().isForbidden());
        mvc.perform(post("/jobs/1;v=2/replay").header(HttpHeaders.AUTHORIZATION, viewer))
            .andExpect(status().isForbidden());
        mvc.perform(post("/events/jobs;x=1").header(HttpHeaders.AUTHORIZATION, viewer))
            .andExpect(status().isForbidden());
        mvc.perform(post("/jobs//1/result").header(HttpHeaders.AUTHORIZATION, viewer))
            .andExpect(status().isForbidden());
        mvc.perform(post("/jobs/%31/result").header(HttpHeaders.AUTHORIZATION, viewer))
            .andExpect(status().isForbidden());

        assertThat(routes.calls.get()).isZero();
    }

    @Test
    void accessTokenParameterIsOnlyHonouredOnTheEventStream() throws Exception {
        String token = Tokens.user("ana", List.of());

        mvc.perform(get("/events/subscribe").param(AuthGatewayFilter.ACCESS_TOKEN_PARAM, token))
            .andExpect(status().isOk());
        mvc.perform(get("/jobs").param(AuthGatewayFilter.ACCESS_TOKEN_PARAM, token))
            .andExpect(status().isUnauthorized());
    }

    @Test
    void invalidBearerIsUnauthorized() throws Exception {
        mvc.perform(get("/jobs").header(HttpHeaders.AUTHORIZATION, "Bearer nope"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.message").value("Invalid bearer token"));
    }

    @Test
    void actuatorIsNotFiltered() throws Exception {
        mvc.perform(get("/actuator/health")).andExpect(status().isOk());
    }

    @RestController
    static class RouteController {
        final AtomicInteger calls = new AtomicInteger();

        @PostMapping("/jobs")
        String submit() {
            calls.incrementAndGet();
            return "ok";
        }

        @GetMapping("/jobs")
        String list(@RequestAttribute(name = "io.jobhive.core.auth.Caller") Caller caller) {
            return caller.id();
        }

        @PostMapping("/jobs/{id}/result")
        String result(@PathVariable String id) {
            calls.incrementAndGet();
            return "ok";
        }

        @PostMapping("/jobs/{id}/replay")
        String replay(@PathVariable String id) {
            calls.incrementAndGet();
            return "ok";
        }

        @PostMapping("/events/{channel}")
        String publish(@PathVariable String channel) {
            calls.incrementAndGet();
            return "ok";
        }

        @GetMapping("/events/subscribe")
        String subscribe() {
            return "ok";
        }

        @GetMapping("/actuator/health")
        String health() {
            return "UP";
        }
    }
}
