package io.jobhive.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobhive.client.config.CoreClientProperties;
import io.jobhive.job.JobReceipt;
import io.jobhive.job.JobRequest;
import io.jobhive.job.JobResultReport;
import io.jobhive.job.error.ApiError;
import io.jobhive.job.error.DispatchUnavailableException;
import io.jobhive.job.error.ErrorCode;
import io.jobhive.job.error.ForbiddenException;
import io.jobhive.job.error.InvalidRequestException;
import io.jobhive.job.error.InvalidWorkerTypeException;
import io.jobhive.job.error.JobHiveException;
import io.jobhive.job.error.JobNotFoundException;
import io.jobhive.job.error.ResourceExhaustedException;
import io.jobhive.job.error.UnauthorizedException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the central service authenticated with the shared API key. Transport failures
 * and retryable error codes are retried a bounded number of times; everything else is mapped
 * back onto the error taxonomy.
 */
public class HttpCoreApiClient implements CoreApi {
    private static final Logger log = LoggerFactory.getLogger(HttpCoreApiClient.class);
    static final String API_KEY_HEADER = "X-API-Key";

    private final HttpClient http;
    private final ObjectMapper json;
    private final String baseUrl;
    private final String apiKey;
    private final Duration requestTimeout;
    private final int maxAttempts;
    private final Duration retryBackoff;

    public HttpCoreApiClient(ObjectMapper json, CoreClientProperties properties) {
        this.json = Objects.requireNonNull(json, "json");
        Objects.requireNonNull(properties, "properties");
        this.http = HttpClient.newBuilder()
            .connectTimeout(properties.getConnectTimeout())
            .build();
        this.baseUrl = stripTrailingSlash(properties.getUrl());
        this.apiKey = properties.getApiKey();
        this.requestTimeout = properties.getRequestTimeout();
        this.maxAttempts = properties.getMaxAttempts();
        this.retryBackoff = properties.getRetryBackoff();
    }

    @Override
    public JobReceipt submit(JobRequest request) {
        Objects.requireNonNull(request, "request");
        HttpResponse<String> resp = post("/jobs", "submit " + request.workerType(), request, null);
        try {
            return json.readValue(resp.body(), JobReceipt.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unreadable submit response: " + resp.body(), ex);
        }
    }

    @Override
    public void reportResult(UUID jobId, JobResultReport report) {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(report, "report");
        post("/jobs/" + jobId + "/result", "result " + jobId + " " + report.status(), report, jobId);
    }

    private HttpResponse<String> post(String path, String label, Object body, UUID jobId) {
        String payload;
        try {
            payload = json.writeValueAsString(body);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Unable to serialise " + label, ex);
        }
        HttpRequest req = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + path))
            .header("Accept", "application/json")
            .header("Content-Type", "application/json")
            .header(API_KEY_HEADER, apiKey)
            .timeout(requestTimeout)
            .POST(HttpRequest.BodyPublishers.ofString(payload))
            .build();
        JobHiveException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
                log.debug("{} response status {}", label, resp.statusCode());
                if (resp.statusCode() >= 200 && resp.statusCode() < 300) {
                    return resp;
                }
                JobHiveException mapped = toException(resp, path, jobId);
                if (!mapped.code().retryable()) {
                    throw mapped;
                }
                last = mapped;
            } catch (IOException ex) {
                last = new DispatchUnavailableException("Central service unreachable at " + baseUrl, ex);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new DispatchUnavailableException("Interrupted calling central service", ex);
            }
            if (attempt < maxAttempts) {
                log.warn("{} failed (attempt {}/{}): {}", label, attempt, maxAttempts, last.getMessage());
                pause(retryBackoff.multipliedBy(1L << (attempt - 1)));
            }
        }
        throw last;
    }

    private JobHiveException toException(HttpResponse<String> resp, String path, UUID jobId) {
        ApiError error = readError(resp.body());
        String message = error.message() != null ? error.message() : "HTTP " + resp.statusCode() + " from " + path;
        ErrorCode code = parseCode(error.error());
        if (code == ErrorCode.INVALID_WORKER_TYPE) {
            return new InvalidWorkerTypeException(message);
        }
        return switch (resp.statusCode()) {
            case 400 -> new InvalidRequestException(message);
            case 401 -> new UnauthorizedException(message);
            case 403 -> new ForbiddenException(message);
            case 404 -> jobId != null ? new JobNotFoundException(jobId) : new InvalidRequestException(message);
            case 503 -> code == ErrorCode.RESOURCE_EXHAUSTED
                ? new ResourceExhaustedException(message)
                : new DispatchUnavailableException(message);
            default -> new DispatchUnavailableException(message);
        };
    }

    private ApiError readError(String body) {
        if (body == null || body.isBlank()) {
            return new ApiError(null, null);
        }
        try {
            return json.readValue(body, ApiError.class);
        } catch (JsonProcessingException ex) {
            return new ApiError(null, body);
        }
    }

    private static ErrorCode parseCode(String value) {
        if (value == null) {
            return null;
        }
        try {
            return ErrorCode.valueOf(value);
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    private static void pause(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new DispatchUnavailableException("Interrupted while backing off", ex);
        }
    }

    private static String stripTrailingSlash(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalStateException("jobhive.core.url must not be null or blank");
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
