package io.jobcenter4j.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobcenter4j.JobExecutor;
import io.jobcenter4j.core.JobExecutionException;
import io.jobcenter4j.core.JobKind;
import io.jobcenter4j.core.JobParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Calls an HTTP endpoint.
 *
 * <p>Parameters: {@code requestUrl} (required), {@code requestMethod} (GET when absent), {@code headers}
 * (JSON object of string values), {@code body} and {@code failOnErrorStatus}. Any response counts as success
 * unless {@code failOnErrorStatus} is {@code true}, in which case a non-2xx status fails the run.
 * A malformed URL is fatal: retrying it on the next fire cannot succeed.
 */
public class HttpJobExecutor implements JobExecutor {
    private static final Logger log = LoggerFactory.getLogger(HttpJobExecutor.class);

    static final String DEFAULT_METHOD = "GET";
    private static final Set<String> METHODS = Set.of("GET", "POST", "PUT", "DELETE", "PATCH");
    private static final TypeReference<Map<String, String>> HEADERS_TYPE = new TypeReference<>() {
    };

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public HttpJobExecutor(HttpClient httpClient, ObjectMapper objectMapper, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
    }

    public HttpJobExecutor(ObjectMapper objectMapper) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), objectMapper, Duration.ofSeconds(30));
    }

    @Override
    public JobKind kind() {
        return JobKind.HTTP;
    }

    @Override
    public void validate(Map<String, String> parameters) {
        JobExecutor.super.validate(parameters);
        try {
            toUri(parameters.get(JobParameters.REQUEST_URL));
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid requestUrl: " + e.getMessage(), e);
        }
        method(parameters);
        headers(parameters);
    }

    @Override
    public void execute(Map<String, String> parameters) throws Exception {
        URI uri;
        try {
            uri = toUri(parameters.get(JobParameters.REQUEST_URL));
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new JobExecutionException("Malformed requestUrl: " + e.getMessage(), true, e);
        }

        String method = method(parameters);
        String body = parameters.get(JobParameters.BODY);
        HttpRequest.BodyPublisher publisher = body == null || body.isEmpty()
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body);

        HttpRequest.Builder request = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .method(method, publisher);
        headers(parameters).forEach(request::header);

        HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        log.debug("jobcenter http call method={} url={} status={}", method, uri, status);

        if (Boolean.parseBoolean(parameters.get(JobParameters.FAIL_ON_ERROR_STATUS)) && (status < 200 || status > 299)) {
            throw new JobExecutionException(method + " " + uri + " returned status " + status);
        }
    }

    private static URI toUri(String url) throws URISyntaxException {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("requestUrl is blank");
        }
        URI uri = new URI(url.trim());
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw new IllegalArgumentException("requestUrl must be http or https: " + url);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("requestUrl has no host: " + url);
        }
        return uri;
    }

    private static String method(Map<String, String> parameters) {
        String raw = parameters.get(JobParameters.REQUEST_METHOD);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_METHOD;
        }
        String method = raw.trim().toUpperCase(Locale.ROOT);
        if (!METHODS.contains(method)) {
            throw new IllegalArgumentException("Unsupported requestMethod: " + raw);
        }
        return method;
    }

    private Map<String, String> headers(Map<String, String> parameters) {
        String raw = parameters.get(JobParameters.HEADERS);
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, String> headers = objectMapper.readValue(raw, HEADERS_TYPE);
            return headers == null ? Map.of() : headers;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("headers must be a JSON object of strings: " + e.getOriginalMessage(), e);
        }
    }
}
