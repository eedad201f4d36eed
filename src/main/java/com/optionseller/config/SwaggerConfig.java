package com.optionseller.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Swagger/OpenAPI Configuration
 */
@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI optionSellerOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Option Seller API")
                        .description("""
                                Schedules a delayed short call + short put at a target premium.

                                At the scheduled time the service re-reads the index LTP, picks the
                                OTM call and put trading closest to the target price and places
                                stop-loss-market SELL orders on both legs.
                                """)
                        .version("1.0.0"))
                .servers(List.of(new Server()
                        .url("http://localhost:8080")
                        .description("Local Development Server")))
                .tags(List.of(new Tag().name("Scheduled Sells")
                        .description("Arm, inspect and trace delayed sell jobs")));
    }
}
