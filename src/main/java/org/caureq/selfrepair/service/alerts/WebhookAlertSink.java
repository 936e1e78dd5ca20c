package org.caureq.selfrepair.service.alerts;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.LinkedHashMap;

/** POSTs the incident as JSON to a webhook. Non-2xx responses are delivery failures. */
@Slf4j
public class WebhookAlertSink implements AlertSink {
    private final WebClient http;
    private final String url;
    private final Duration timeout;

    public WebhookAlertSink(WebClient http, String url, Duration timeout) {
        this.http = http;
        this.url = url;
        this.timeout = timeout;
    }

    @Override
    public void notify(String component, IncidentContext incident) throws AlertException {
        var body = new LinkedHashMap<String, Object>();
        body.put("component", component);
        body.put("type", incident.type());
        body.put("text", "[%s] %s: %s".formatted(incident.type(), component, incident.reason()));
        body.put("incident", incident);
        try {
            http.post().uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(s -> !s.is2xxSuccessful(),
                            r -> r.bodyToMono(String.class).defaultIfEmpty("")
                                    .map(b -> new WebhookStatusException(r.statusCode().value(), b)))
                    .toBodilessEntity()
                    .timeout(timeout)
                    .retryWhen(Retry.backoff(2, Duration.ofMillis(500)).jitter(0.4)
                            .filter(ex -> ex instanceof WebClientRequestException))
                    .block();
            log.info("[Alerts] webhook notified for {} incident {}", component, incident.incidentId());
        } catch (WebhookStatusException e) {
            throw new AlertException(e.status, "webhook returned %d%s".formatted(e.status, e.body.isBlank() ? "" : " -> " + e.body));
        } catch (RuntimeException e) {
            throw new AlertException("webhook delivery failed: " + e.getMessage(), e);
        }
    }

    private static final class WebhookStatusException extends RuntimeException {
        final int status;
        final String body;

        WebhookStatusException(int status, String body) {
            super("webhook returned " + status);
            this.status = status;
            this.body = body;
        }
    }
}
