package org.caureq.selfrepair.service.health.probe;

import org.caureq.selfrepair.service.health.HealthProbe;
import org.caureq.selfrepair.service.health.ProbeResult;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;

/** Healthy on any 2xx answer from the target URL. */
public class HttpProbe implements HealthProbe {
    private final WebClient http;
    private final String url;

    public HttpProbe(WebClient http, String url) {
        this.http = http;
        this.url = url;
    }

    @Override
    public ProbeResult check(Duration timeout) {
        try {
            var resp = http.get().uri(url)
                    .accept(MediaType.ALL)
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(timeout)
                    .block();
            int code = resp == null ? 0 : resp.getStatusCode().value();
            return code >= 200 && code < 300
                    ? ProbeResult.healthy("GET %s -> %d".formatted(url, code))
                    : ProbeResult.unhealthy("GET %s -> %d".formatted(url, code));
        } catch (WebClientResponseException e) {
            return ProbeResult.unhealthy("GET %s -> %d".formatted(url, e.getStatusCode().value()));
        }
    }
}
