package io.taskpatrol.checker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskpatrol.security.SecretMaterial;
import io.taskpatrol.util.Hashing;
import io.taskpatrol.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;

/**
 * JSON-over-HTTP client for the inspection gateway. Each call is {@code POST <endpoint>/<service>/<action>}
 * with body {@code {"region": ..., "parameters": {...}}}, signed with HMAC-SHA256 keyed by the
 * credential secret. Temporary credentials also send their session token, which is covered by the
 * signature.
 */
public final class HttpRemoteServiceClient implements RemoteServiceClient {
    private static final Logger logger = LoggerFactory.getLogger(HttpRemoteServiceClient.class);
    static final String ACCESS_KEY_HEADER = "X-TaskPatrol-Access-Key";
    static final String DATE_HEADER = "X-TaskPatrol-Date";
    static final String SIGNATURE_HEADER = "X-TaskPatrol-Signature";
    static final String SESSION_TOKEN_HEADER = "X-TaskPatrol-Session-Token";
    static final Duration MAX_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final URI endpoint;
    private final Duration requestTimeout;
    private final Clock clock;
    private final HttpClient client;

    public HttpRemoteServiceClient(String endpoint, Duration requestTimeout) {
        this(endpoint, requestTimeout, Clock.systemUTC());
    }

    public HttpRemoteServiceClient(String endpoint, Duration requestTimeout, Clock clock) {
        String base = endpoint == null ? "" : endpoint.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        if (base.isEmpty()) {
            throw new IllegalArgumentException("remote endpoint is required");
        }
        this.endpoint = URI.create(base);
        this.requestTimeout = requestTimeout;
        this.clock = clock;
        this.client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(requestTimeout.compareTo(MAX_CONNECT_TIMEOUT) < 0 ? requestTimeout : MAX_CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Override
    public JsonNode invoke(RemoteCall call, SecretMaterial credentials) throws RemoteCallException {
        String path = endpoint.getPath() + "/" + call.service() + "/" + call.action();
        ObjectNode body = Jsons.mapper().createObjectNode();
        body.put("region", call.region());
        body.set("parameters", call.parameters() == null ? Jsons.mapper().createObjectNode() : call.parameters());
        String payload = Jsons.toCompactJson(body);
        String date = Long.toString(clock.millis());
        String sessionToken = credentials.sessionToken() == null ? null : new String(credentials.sessionToken());
        String signature = sign(credentials.secret(), stringToSign(path, date, payload, sessionToken));

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(endpoint.resolve(path))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header(ACCESS_KEY_HEADER, credentials.accessKeyId())
                .header(DATE_HEADER, date)
                .header(SIGNATURE_HEADER, signature);
        if (sessionToken != null) {
            builder.header(SESSION_TOKEN_HEADER, sessionToken);
        }
        HttpRequest request = builder
                .POST(HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new RemoteCallException("RequestTimeout", 0, true,
                    call.service() + "." + call.action() + " timed out after " + requestTimeout.toMillis() + "ms", e);
        } catch (IOException e) {
            throw new RemoteCallException("TransportError", 0, false,
                    call.service() + "." + call.action() + " transport failure: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteCallException("Interrupted", 0, true,
                    call.service() + "." + call.action() + " was interrupted", e);
        }

        int status = response.statusCode();
        JsonNode parsed = parseBody(response.body());
        if (status >= 200 && status < 300) {
            logger.debug("{}.{} answered {} in region {}", call.service(), call.action(), status, call.region());
            return parsed;
        }
        JsonNode error = parsed.has("error") ? parsed.path("error") : parsed;
        String code = error.path("code").asText("");
        String message = error.path("message").asText("");
        if (message.isBlank()) {
            message = response.body() == null ? "" : response.body();
        }
        throw new RemoteCallException(code.isBlank() ? "HTTP" + status : code, status,
                call.service() + "." + call.action() + " failed with HTTP " + status + ": " + message);
    }

    private static JsonNode parseBody(String body) {
        if (body == null || body.isBlank()) {
            return Jsons.mapper().createObjectNode();
        }
        try {
            return Jsons.parse(body);
        } catch (IllegalArgumentException e) {
            ObjectNode wrapped = Jsons.mapper().createObjectNode();
            wrapped.put("raw", body);
            return wrapped;
        }
    }

    Duration connectTimeout() {
        return client.connectTimeout().orElse(requestTimeout);
    }

    static String stringToSign(String path, String date, String payload, String sessionToken) {
        String base = "POST\n" + path + "\n" + date + "\n" + Hashing.sha256Hex(payload);
        return sessionToken == null ? base : base + "\n" + sessionToken;
    }

    static String sign(char[] secret, String stringToSign) {
        ByteBuffer encoded = StandardCharsets.UTF_8.encode(CharBuffer.wrap(secret));
        byte[] key = new byte[encoded.remaining()];
        encoded.get(key);
        try {
            return Hashing.hmacSha256Hex(key, stringToSign.getBytes(StandardCharsets.UTF_8));
        } finally {
            Arrays.fill(key, (byte) 0);
            if (encoded.hasArray()) {
                Arrays.fill(encoded.array(), (byte) 0);
            }
        }
    }
}
