package com.chatwarden.config;

import com.chatwarden.observability.IdentityMaskingConverter;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

/**
 * Pushes the identity-masking switch from application properties into the
 * Logback {@link IdentityMaskingConverter} via its static holder.
 */
@Configuration
public class LoggingConfig {

    private static final Logger log = LoggerFactory.getLogger(LoggingConfig.class);

    private final ChatwardenProperties properties;

    public LoggingConfig(ChatwardenProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void configureIdentityMasking() {
        boolean mask = properties.getLogging().isMaskIdentities();
        IdentityMaskingConverter.setEnabled(mask);
        log.info("Identity masking in logs {}", mask ? "enabled" : "disabled");
    }
}
