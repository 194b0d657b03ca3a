package com.chatwarden.config;

import com.chatwarden.violation.EscalationPolicy;
import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.aop.ObservedAspect;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ModerationConfig {

    /**
     * All "now" comparisons in the stores go through this clock so tests can pin time.
     */
    @Bean
    public Clock moderationClock() {
        return Clock.systemUTC();
    }

    @Bean
    public EscalationPolicy escalationPolicy(ChatwardenProperties properties) {
        ChatwardenProperties.EscalationProperties escalation = properties.getEscalation();
        return new EscalationPolicy(escalation.getDurationsMinutes(), escalation.getDefaultMinutes());
    }

    // Backs @Observed on ModerationEngine#evaluate
    @Bean
    public ObservedAspect observedAspect(ObservationRegistry registry) {
        return new ObservedAspect(registry);
    }
}
