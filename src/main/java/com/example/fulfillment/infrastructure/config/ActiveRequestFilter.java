package com.example.fulfillment.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Tracks order and webhook requests for the shutdown drain.
 * Once draining, new order mutations are refused; reads and gateway callbacks still pass.
 */
@Component
@Order(2)
public class ActiveRequestFilter implements WebFilter {

    private static final Logger log = LoggerFactory.getLogger(ActiveRequestFilter.class);

    private static final byte[] DRAINING_BODY =
            "{\"error\":\"SHUTTING_DOWN\",\"message\":\"Service is restarting, please try again shortly\"}"
                    .getBytes(StandardCharsets.UTF_8);

    private final GracefulShutdownConfig gracefulShutdownConfig;

    public ActiveRequestFilter(GracefulShutdownConfig gracefulShutdownConfig) {
        this.gracefulShutdownConfig = gracefulShutdownConfig;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        boolean orderApi = path.startsWith("/api/");

        if (!orderApi && !path.startsWith("/webhooks/")) {
            return chain.filter(exchange);
        }

        if (orderApi && gracefulShutdownConfig.isDraining()
                && !HttpMethod.GET.equals(exchange.getRequest().getMethod())) {
            log.info("Refusing {} {} while draining", exchange.getRequest().getMethod(), path);
            return refuse(exchange.getResponse());
        }

        gracefulShutdownConfig.incrementActiveRequests();

        return chain.filter(exchange)
                .doFinally(signalType -> {
                    gracefulShutdownConfig.decrementActiveRequests();
                    log.debug("Request to {} completed with signal: {}", path, signalType);
                });
    }

    private Mono<Void> refuse(ServerHttpResponse response) {
        response.setStatusCode(HttpStatus.SERVICE_UNAVAILABLE);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        DataBuffer buffer = response.bufferFactory().wrap(DRAINING_BODY);
        return response.writeWith(Mono.just(buffer));
    }
}
