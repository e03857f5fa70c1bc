package ru.hedge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "telegram")
public class TelegramBotConfig {
    private boolean enabled;
    private String botUsername;
    private String botToken;
}
