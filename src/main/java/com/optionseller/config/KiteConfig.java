package com.optionseller.config;

import com.zerodhatech.kiteconnect.KiteConnect;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Kite Connect Configuration
 * Session establishment happens outside this service; an access token generated
 * elsewhere is handed in through configuration.
 */
@Configuration
@ConfigurationProperties(prefix = "kite")
@Getter
@Setter
public class KiteConfig {

    private String apiKey;
    private String accessToken;

    @Bean
    public KiteConnect kiteConnect() {
        KiteConnect kiteConnect = new KiteConnect(apiKey);

        if (accessToken != null && !accessToken.isEmpty()) {
            kiteConnect.setAccessToken(accessToken);
        }

        return kiteConnect;
    }
}
