package com.example.fulfillment.infrastructure.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI fulfillmentServiceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Fulfillment Service API")
                        .description("""
                                Order fulfillment engine: checkout, payments, shipment and tracking.

                                ## Order lifecycle

                                `NEW → PENDING_PAYMENT → PAID_PARTIALLY → PAID_FULL → ASSEMBLED → SHIPPED → ARCHIVED`

                                Unpaid orders end in `ABANDONED`.

                                ## Side effects

                                - **Payments**: at most one intent per order and kind is outstanding; the gateway webhook and the
                                  timeout sweeper settle each order exactly once.
                                - **Shipments**: at most one carrier shipment per order. Failures stay in `ASSEMBLED` for a manual retry.
                                - **Notifications**: recorded in an outbox together with the state change and delivered asynchronously.
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Fulfillment Team")
                                .email("fulfillment@example.com")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Development")
                ));
    }
}
