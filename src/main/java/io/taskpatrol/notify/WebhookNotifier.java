package io.taskpatrol.notify;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskpatrol.model.ExecutionStatus;
import io.taskpatrol.util.Jsons;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

/**
 * Posts {@code {"tenant_id", "execution_id", "status", "notified_at_ms"}} to a fixed URL. Any non-2xx
 * answer counts as a failed delivery.
 */
public final class WebhookNotifier implements Notifier {
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final URI target;
    private final Clock clock;
    private final HttpClient client;

    public WebhookNotifier(String url) {
        this(url, Clock.systemUTC());
    }

    public WebhookNotifier(String url, Clock clock) {
        this.target = URI.create(url.trim());
        this.clock = clock;
        this.client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(TIMEOUT)
                .build();
    }

    @Override
    public void notify(String tenantId, String executionId, ExecutionStatus status) throws NotificationException {
        ObjectNode body = Jsons.mapper().createObjectNode();
        body.put("tenant_id", tenantId);
        body.put("execution_id", executionId);
        body.put("status", status.name().toLowerCase(Locale.ROOT));
        body.put("notified_at_ms", clock.millis());
        HttpRequest request = HttpRequest.newBuilder()
                .uri(target)
                .timeout(TIMEOUT)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(body), StandardCharsets.UTF_8))
                .build();
        HttpResponse<Void> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.discarding());
        } catch (IOException e) {
            throw new NotificationException("Webhook delivery failed for " + executionId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationException("Webhook delivery interrupted for " + executionId, e);
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new NotificationException("Webhook answered HTTP " + response.statusCode() + " for " + executionId);
        }
    }
}
