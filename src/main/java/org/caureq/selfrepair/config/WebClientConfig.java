package org.caureq.selfrepair.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/** Shared client for HTTP probes and the alert webhook. */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient supervisorWebClient(SupervisorProps props) {
        HttpClient http = HttpClient.create()
                .responseTimeout(props.health().probeTimeout().plus(Duration.ofSeconds(1)))
                .followRedirect(true);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(http))
                .exchangeStrategies(
                        ExchangeStrategies.builder()
                                .codecs(c -> c.defaultCodecs().maxInMemorySize(256 * 1024))
                                .build()
                )
                .build();
    }
}
