package com.example.fulfillment.infrastructure.adapter.in.web.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Rejects payment notifications from addresses outside the configured
 * allow-list. Entries are exact addresses or IPv4 CIDR blocks. An empty
 * list accepts every origin.
 */
@Component
@Order(1)
public class WebhookOriginFilter implements WebFilter {

    private static final Logger log = LoggerFactory.getLogger(WebhookOriginFilter.class);

    static final String WEBHOOK_PATH = "/webhooks/payments";

    private final List<AddressRule> rules;

    public WebhookOriginFilter(@Value("${fulfillment.webhook.allowed-ips:}") String allowedIps) {
        this.rules = parse(allowedIps);
        if (rules.isEmpty()) {
            log.warn("No webhook allow-list configured, payment notifications are accepted from any origin");
        } else {
            log.info("Webhook allow-list has {} entries", rules.size());
        }
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (rules.isEmpty() || !exchange.getRequest().getPath().value().startsWith(WEBHOOK_PATH)) {
            return chain.filter(exchange);
        }

        InetSocketAddress remote = exchange.getRequest().getRemoteAddress();
        InetAddress address = remote != null ? remote.getAddress() : null;
        if (address != null && isAllowed(address)) {
            return chain.filter(exchange);
        }

        log.warn("Rejected payment notification from {}", remote);
        exchange.getResponse().setStatusCode(HttpStatus.FORBIDDEN);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        byte[] body = "{\"error\":\"FORBIDDEN\",\"message\":\"Origin not allowed\"}".getBytes(StandardCharsets.UTF_8);
        return exchange.getResponse().writeWith(Mono.just(exchange.getResponse().bufferFactory().wrap(body)));
    }

    boolean isAllowed(InetAddress address) {
        for (AddressRule rule : rules) {
            if (rule.matches(address)) {
                return true;
            }
        }
        return false;
    }

    static List<AddressRule> parse(String allowedIps) {
        List<AddressRule> parsed = new ArrayList<>();
        if (allowedIps == null || allowedIps.isBlank()) {
            return parsed;
        }
        Arrays.stream(allowedIps.split(","))
                .map(String::trim)
                .filter(entry -> !entry.isEmpty())
                .forEach(entry -> parsed.add(AddressRule.of(entry)));
        return List.copyOf(parsed);
    }

    /**
     * One allow-list entry. Exact addresses use a full-length prefix.
     */
    record AddressRule(byte[] network, int prefixLength) {

        static AddressRule of(String entry) {
            String host = entry;
            int prefix = -1;
            int slash = entry.indexOf('/');
            if (slash >= 0) {
                host = entry.substring(0, slash);
                try {
                    prefix = Integer.parseInt(entry.substring(slash + 1));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid webhook allow-list entry: " + entry, e);
                }
            }
            byte[] bytes = literal(host, entry);
            int maxPrefix = bytes.length * 8;
            if (prefix < 0) {
                prefix = maxPrefix;
            }
            if (prefix > maxPrefix || (slash >= 0 && bytes.length != 4)) {
                throw new IllegalArgumentException("Invalid webhook allow-list entry: " + entry);
            }
            return new AddressRule(bytes, prefix);
        }

        boolean matches(InetAddress address) {
            byte[] candidate = address.getAddress();
            if (candidate.length != network.length) {
                return false;
            }
            int fullBytes = prefixLength / 8;
            for (int i = 0; i < fullBytes; i++) {
                if (candidate[i] != network[i]) {
                    return false;
                }
            }
            int remainingBits = prefixLength % 8;
            if (remainingBits == 0) {
                return true;
            }
            int mask = (0xFF << (8 - remainingBits)) & 0xFF;
            return (candidate[fullBytes] & mask) == (network[fullBytes] & mask);
        }

        private static byte[] literal(String host, String entry) {
            // Only literals: a hostname here would trigger a DNS lookup.
            if (!host.matches("[0-9a-fA-F:.]+")) {
                throw new IllegalArgumentException("Invalid webhook allow-list entry: " + entry);
            }
            try {
                return InetAddress.getByName(host).getAddress();
            } catch (UnknownHostException e) {
                throw new IllegalArgumentException("Invalid webhook allow-list entry: " + entry, e);
            }
        }
    }
}
