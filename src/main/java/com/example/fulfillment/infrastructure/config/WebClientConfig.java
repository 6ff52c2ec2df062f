package com.example.fulfillment.infrastructure.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * WebClient instances for the payment gateway, the carrier and the
 * messaging service. Every client has finite connect and I/O timeouts.
 */
@Configuration
public class WebClientConfig {

    @Value("${services.payment.base-url:http://localhost:8081}")
    private String paymentBaseUrl;

    @Value("${services.payment.timeout-ms:8000}")
    private int paymentTimeoutMs;

    @Value("${services.carrier.base-url:http://localhost:8082}")
    private String carrierBaseUrl;

    @Value("${services.carrier.timeout-ms:10000}")
    private int carrierTimeoutMs;

    @Value("${services.notification.base-url:http://localhost:8083}")
    private String notificationBaseUrl;

    @Value("${services.notification.timeout-ms:5000}")
    private int notificationTimeoutMs;

    @Bean
    public WebClient paymentGatewayWebClient(WebClient.Builder builder) {
        return createWebClient(builder, paymentBaseUrl, paymentTimeoutMs);
    }

    @Bean
    public WebClient carrierWebClient(WebClient.Builder builder) {
        return createWebClient(builder, carrierBaseUrl, carrierTimeoutMs);
    }

    @Bean
    public WebClient notificationWebClient(WebClient.Builder builder) {
        return createWebClient(builder, notificationBaseUrl, notificationTimeoutMs);
    }

    private WebClient createWebClient(WebClient.Builder builder, String baseUrl, int timeoutMs) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 2000)
                .responseTimeout(Duration.ofMillis(timeoutMs))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS)));

        return builder.clone()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }
}
