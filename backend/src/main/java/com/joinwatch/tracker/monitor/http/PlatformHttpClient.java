package com.joinwatch.tracker.monitor.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.joinwatch.tracker.config.MonitorProperties;
import com.joinwatch.tracker.monitor.model.AuditEntryView;
import com.joinwatch.tracker.monitor.model.ChannelInfo;
import com.joinwatch.tracker.monitor.model.CommunityInfo;
import com.joinwatch.tracker.monitor.model.HttpCallResult;
import com.joinwatch.tracker.monitor.model.MemberView;
import com.joinwatch.tracker.monitor.model.MessageView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;

@Service
public class PlatformHttpClient implements PlatformClient {
    private static final Logger log = LoggerFactory.getLogger(PlatformHttpClient.class);

    private final MonitorProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient client;
    private final Semaphore globalLimiter;
    private final Object spacingLock = new Object();
    private final Map<String, String> directChannels = new ConcurrentHashMap<>();
    private Instant nextAllowedAt = Instant.EPOCH;

    public PlatformHttpClient(
        MonitorProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(Math.max(1, properties.getGlobalConcurrency()));
    }

    @Override
    public PlatformResponse<List<CommunityInfo>> listCommunities() {
        HttpCallResult result = get("/users/@me/guilds");
        return toResponse(result, root -> readArray(root, this::readCommunity));
    }

    @Override
    public PlatformResponse<CommunityInfo> fetchCommunity(String communityId) {
        HttpCallResult result = get("/guilds/" + communityId + "?with_counts=true");
        return toResponse(result, this::readCommunity);
    }

    @Override
    public PlatformResponse<List<ChannelInfo>> listChannels(String communityId) {
        HttpCallResult result = get("/guilds/" + communityId + "/channels");
        return toResponse(result, root -> readArray(root, this::readChannel));
    }

    @Override
    public PlatformResponse<List<MessageView>> fetchRecentMessages(String channelId, int limit) {
        int safeLimit = Math.max(1, Math.min(limit, 100));
        HttpCallResult result = get("/channels/" + channelId + "/messages?limit=" + safeLimit);
        return toResponse(result, root -> readArray(root, this::readMessage));
    }

    @Override
    public PlatformResponse<List<MemberView>> listMembers(String communityId, int limit) {
        int safeLimit = Math.max(1, Math.min(limit, 1000));
        HttpCallResult result = get("/guilds/" + communityId + "/members?limit=" + safeLimit);
        return toResponse(result, root -> readArray(root, this::readMember));
    }

    @Override
    public PlatformResponse<List<AuditEntryView>> fetchAuditLog(String communityId, int actionType, int limit) {
        int safeLimit = Math.max(1, Math.min(limit, 100));
        HttpCallResult result = get("/guilds/" + communityId + "/audit-logs?action_type=" + actionType + "&limit=" + safeLimit);
        return toResponse(result, root -> readArray(root.path("audit_log_entries"), this::readAuditEntry));
    }

    @Override
    public PlatformResponse<MemberView> fetchUser(String userId) {
        HttpCallResult result = get("/users/" + userId);
        return toResponse(result, root -> readUser(root, null));
    }

    @Override
    public PlatformResponse<String> sendDirectMessage(String recipientId, String content) {
        PlatformResponse<String> channel = openDirectChannel(recipientId);
        if (!channel.isOk()) {
            return channel;
        }
        String body = writeJson(Map.of("content", content == null ? "" : content));
        // a timed-out send may still have been delivered; the dispatcher decides whether to try again
        HttpCallResult result = send("POST", "/channels/" + channel.payload() + "/messages", body, false);
        PlatformResponse<String> response = toResponse(result, root -> requiredText(root, "id"));
        if (response.status() == PlatformStatus.NOT_FOUND) {
            // stale cached channel; the next send reopens it
            directChannels.remove(recipientId);
        }
        return response;
    }

    private PlatformResponse<String> openDirectChannel(String recipientId) {
        String cached = directChannels.get(recipientId);
        if (cached != null) {
            return PlatformResponse.ok(cached, 200);
        }
        String body = writeJson(Map.of("recipient_id", recipientId));
        // opening returns the existing channel when there is one, so a repeat is harmless
        HttpCallResult result = send("POST", "/users/@me/channels", body, true);
        PlatformResponse<String> response = toResponse(result, root -> requiredText(root, "id"));
        if (response.isOk()) {
            directChannels.put(recipientId, response.payload());
        }
        return response;
    }

    private HttpCallResult get(String path) {
        return send("GET", path, null, true);
    }

    private HttpCallResult send(String method, String path, String body, boolean idempotent) {
        int maxAttempts = idempotent ? Math.max(1, 1 + properties.getRequestMaxRetries()) : 1;
        HttpCallResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResult = executeOnce(method, path, body);
            if (!shouldRetry(lastResult) || attempt >= maxAttempts) {
                return lastResult;
            }
            log.debug("Retrying {} {} after status={} error={}", method, path, lastResult.statusCode(), lastResult.errorCode());
            if (!sleepBackoff(attempt)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    private HttpCallResult executeOnce(String method, String path, String body) {
        Instant startedAt = Instant.now();
        String url = properties.getApiBaseUrl() + path;
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            return errorResult(method, url, startedAt, "invalid_url", e.getMessage());
        }

        boolean acquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;
            enforceSpacing();

            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", MonitorProperties.normalizeUserAgent(properties.getUserAgent()))
                .header("Accept", "application/json");
            String token = properties.getAuthToken();
            if (token != null && !token.isBlank()) {
                builder.header("Authorization", token);
            }
            HttpRequest request;
            if ("POST".equalsIgnoreCase(method)) {
                request = builder
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body == null ? "" : body, StandardCharsets.UTF_8))
                    .build();
            } else {
                request = builder.GET().build();
            }

            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            return new HttpCallResult(
                method,
                url,
                response.statusCode(),
                response.body(),
                response.headers().firstValue("Retry-After").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(method, url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(method, url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(method, url, startedAt, "interrupted", e.getMessage());
        } finally {
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    private <T> PlatformResponse<T> toResponse(HttpCallResult result, Function<JsonNode, T> reader) {
        if (result.errorCode() != null) {
            PlatformStatus status = "invalid_url".equals(result.errorCode())
                ? PlatformStatus.MALFORMED
                : PlatformStatus.TRANSIENT_ERROR;
            return PlatformResponse.failure(status, 0, result.errorCode() + ": " + result.errorMessage());
        }
        int code = result.statusCode();
        if (result.isSuccessful()) {
            try {
                JsonNode root = objectMapper.readTree(result.body() == null ? "" : result.body());
                if (root == null || root.isMissingNode()) {
                    return PlatformResponse.failure(PlatformStatus.MALFORMED, code, "empty body");
                }
                return PlatformResponse.ok(reader.apply(root), code);
            } catch (JsonProcessingException e) {
                return PlatformResponse.failure(PlatformStatus.MALFORMED, code, "invalid json: " + e.getOriginalMessage());
            } catch (MalformedResponseException e) {
                return PlatformResponse.failure(PlatformStatus.MALFORMED, code, e.getMessage());
            }
        }
        if (code == 429) {
            Duration retryAfter = parseRetryAfter(result);
            log.warn("Rate limited on {} {}; retry after {}", result.method(), result.url(), retryAfter);
            return PlatformResponse.rateLimited(code, retryAfter, abbreviate(result.body()));
        }
        return PlatformResponse.failure(classifyStatus(code), code, abbreviate(result.body()));
    }

    static PlatformStatus classifyStatus(int code) {
        if (code >= 200 && code < 300) {
            return PlatformStatus.OK;
        }
        if (code == 404) {
            return PlatformStatus.NOT_FOUND;
        }
        if (code == 401 || code == 403) {
            return PlatformStatus.FORBIDDEN;
        }
        if (code == 429) {
            return PlatformStatus.RATE_LIMITED;
        }
        if (code == 408 || code >= 500) {
            return PlatformStatus.TRANSIENT_ERROR;
        }
        return PlatformStatus.MALFORMED;
    }

    private Duration parseRetryAfter(HttpCallResult result) {
        Duration fromHeader = parseSeconds(result.retryAfterHeader());
        if (fromHeader != null) {
            return fromHeader;
        }
        try {
            JsonNode root = objectMapper.readTree(result.body() == null ? "" : result.body());
            JsonNode value = root == null ? null : root.get("retry_after");
            if (value != null && value.isNumber()) {
                return toDuration(value.asDouble());
            }
        } catch (JsonProcessingException e) {
            log.debug("Unreadable rate-limit body from {}: {}", result.url(), e.getOriginalMessage());
        }
        return null;
    }

    private Duration parseSeconds(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return toDuration(Double.parseDouble(raw.trim()));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private Duration toDuration(double seconds) {
        if (Double.isNaN(seconds) || seconds < 0) {
            return null;
        }
        return Duration.ofMillis(Math.round(seconds * 1000d));
    }

    private boolean shouldRetry(HttpCallResult result) {
        if (result == null) {
            return false;
        }
        String errorCode = result.errorCode();
        if (errorCode != null && !errorCode.isBlank()) {
            return !errorCode.equals("invalid_url") && !errorCode.equals("interrupted");
        }
        int status = result.statusCode();
        return status == 408 || status >= 500;
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = properties.getRequestRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        int maxDelayMs = properties.getRequestRetryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.max(0, attempt - 1));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        if (delay <= 0) {
            return true;
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        long sleepMs = (delay / 2) + jitter;
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void enforceSpacing() throws InterruptedException {
        synchronized (spacingLock) {
            Instant now = Instant.now();
            if (nextAllowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, nextAllowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            nextAllowedAt = Instant.now().plusMillis(properties.getMinRequestSpacingMs());
        }
    }

    private <T> List<T> readArray(JsonNode root, Function<JsonNode, T> reader) {
        if (!root.isArray()) {
            throw new MalformedResponseException("expected array but got " + root.getNodeType());
        }
        List<T> items = new ArrayList<>();
        for (JsonNode node : root) {
            items.add(reader.apply(node));
        }
        return items;
    }

    private CommunityInfo readCommunity(JsonNode node) {
        String id = requiredText(node, "id");
        Map<String, Long> counts = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getKey().endsWith("_count") && field.getValue().isIntegralNumber()) {
                counts.put(field.getKey(), field.getValue().asLong());
            }
        }
        return new CommunityInfo(id, text(node, "name"), counts);
    }

    private MemberView readMember(JsonNode node) {
        return readUser(node.path("user"), parseTimestamp(text(node, "joined_at")));
    }

    private MemberView readUser(JsonNode user, Instant joinedAt) {
        return new MemberView(
            requiredText(user, "id"),
            text(user, "username"),
            text(user, "global_name"),
            text(user, "avatar"),
            user.path("bot").asBoolean(false),
            user.path("system").asBoolean(false),
            joinedAt
        );
    }

    private AuditEntryView readAuditEntry(JsonNode node) {
        return new AuditEntryView(
            requiredText(node, "id"),
            node.path("action_type").asInt(-1),
            text(node, "target_id")
        );
    }

    private ChannelInfo readChannel(JsonNode node) {
        JsonNode type = node.get("type");
        return new ChannelInfo(
            requiredText(node, "id"),
            text(node, "name"),
            type != null && type.isInt() ? type.asInt() : -1
        );
    }

    private MessageView readMessage(JsonNode node) {
        JsonNode author = node.path("author");
        JsonNode type = node.get("type");
        return new MessageView(
            requiredText(node, "id"),
            type != null && type.isInt() ? type.asInt() : MessageView.DEFAULT,
            text(node, "content"),
            text(author, "id"),
            text(author, "username"),
            text(author, "global_name"),
            text(author, "avatar"),
            author.path("bot").asBoolean(false),
            author.path("system").asBoolean(false),
            parseTimestamp(text(node, "timestamp"))
        );
    }

    private Instant parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private String requiredText(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null || value.isBlank()) {
            throw new MalformedResponseException("missing field '" + field + "'");
        }
        return value;
    }

    private String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    private String writeJson(Map<String, String> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to encode request body", e);
        }
    }

    private String abbreviate(String body) {
        if (body == null) {
            return null;
        }
        String trimmed = body.strip();
        return trimmed.length() <= 300 ? trimmed : trimmed.substring(0, 300) + "...";
    }

    private HttpCallResult errorResult(String method, String url, Instant startedAt, String code, String message) {
        return new HttpCallResult(
            method,
            url,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }
}
