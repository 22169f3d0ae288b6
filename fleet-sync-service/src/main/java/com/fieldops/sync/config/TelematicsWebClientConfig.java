package com.fieldops.sync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldops.common.exception.NetworkFailureException;
import com.fieldops.common.exception.RateLimitExceededException;
import com.fieldops.sync.client.GeotabJsonRpcTransport;
import com.fieldops.sync.client.MockTelematicsTransport;
import com.fieldops.sync.client.TelematicsTransport;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

@Configuration
public class TelematicsWebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(TelematicsWebClientConfig.class);

    private static final String COMPONENT = "TelematicsTransport";

    @Bean
    public WebClient telematicsWebClient(WebClient.Builder builder, TelematicsSettings settings) {
        int timeoutMillis = (int) settings.callTimeout().toMillis();
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.min(timeoutMillis, 10_000))
            .responseTimeout(settings.callTimeout())
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS))
            );

        return builder
            .baseUrl(settings.baseUrl())
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(statusFilter())
            .filter(loggingFilter())
            .build();
    }

    /** Live JSON-RPC transport, or the fixed demo fleet when mock mode is on. */
    @Bean
    public TelematicsTransport telematicsTransport(TelematicsSettings settings,
                                                  WebClient telematicsWebClient,
                                                  ObjectMapper objectMapper,
                                                  Clock clock) {
        if (settings.mockMode()) {
            log.info("Telematics transport: mock (demo fleet)");
            return new MockTelematicsTransport(objectMapper, clock);
        }
        log.info("Telematics transport: JSON-RPC baseUrl={}", settings.baseUrl());
        return new GeotabJsonRpcTransport(telematicsWebClient, objectMapper);
    }

    private ExchangeFilterFunction statusFilter() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                return clientResponse.releaseBody()
                    .then(Mono.<ClientResponse>error(new RateLimitExceededException(COMPONENT, "HTTP 429 from telematics API")));
            }
            if (clientResponse.statusCode().is5xxServerError()) {
                return clientResponse.releaseBody()
                    .then(Mono.<ClientResponse>error(new NetworkFailureException(COMPONENT,
                        "telematics server error: " + clientResponse.statusCode())));
            }
            return Mono.just(clientResponse);
        });
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            // bodies carry credentials; only method and URI are logged
            log.debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
