package com.chatwarden.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "chatwarden")
public class ChatwardenProperties {

    private LedgerProperties ledger = new LedgerProperties();
    private PolicyDefaults defaults = new PolicyDefaults();
    private EscalationProperties escalation = new EscalationProperties();
    private RetentionProperties retention = new RetentionProperties();
    private LoggingProperties logging = new LoggingProperties();

    public LedgerProperties getLedger() { return ledger; }
    public void setLedger(LedgerProperties ledger) { this.ledger = ledger; }

    public PolicyDefaults getDefaults() { return defaults; }
    public void setDefaults(PolicyDefaults defaults) { this.defaults = defaults; }

    public EscalationProperties getEscalation() { return escalation; }
    public void setEscalation(EscalationProperties escalation) { this.escalation = escalation; }

    public RetentionProperties getRetention() { return retention; }
    public void setRetention(RetentionProperties retention) { this.retention = retention; }

    public LoggingProperties getLogging() { return logging; }
    public void setLogging(LoggingProperties logging) { this.logging = logging; }

    public static class LedgerProperties {
        /** "jpa" (default) or "redis". */
        private String backend = "jpa";
        private Duration redisTimeout = Duration.ofSeconds(1);

        public String getBackend() { return backend; }
        public void setBackend(String backend) { this.backend = backend; }
        public Duration getRedisTimeout() { return redisTimeout; }
        public void setRedisTimeout(Duration redisTimeout) { this.redisTimeout = redisTimeout; }
    }

    /**
     * Process-wide policy used for chats that were never customized.
     */
    public static class PolicyDefaults {
        private int stickerThreshold = 3;
        private int stickerWindowSeconds = 30;
        private int textThreshold = 3;
        private int textWindowSeconds = 20;
        private int imageThreshold = 3;
        private int imageWindowSeconds = 30;
        private int videoThreshold = 3;
        private int videoWindowSeconds = 30;
        private boolean warnEnabled = true;

        public int getStickerThreshold() { return stickerThreshold; }
        public void setStickerThreshold(int v) { this.stickerThreshold = v; }
        public int getStickerWindowSeconds() { return stickerWindowSeconds; }
        public void setStickerWindowSeconds(int v) { this.stickerWindowSeconds = v; }
        public int getTextThreshold() { return textThreshold; }
        public void setTextThreshold(int v) { this.textThreshold = v; }
        public int getTextWindowSeconds() { return textWindowSeconds; }
        public void setTextWindowSeconds(int v) { this.textWindowSeconds = v; }
        public int getImageThreshold() { return imageThreshold; }
        public void setImageThreshold(int v) { this.imageThreshold = v; }
        public int getImageWindowSeconds() { return imageWindowSeconds; }
        public void setImageWindowSeconds(int v) { this.imageWindowSeconds = v; }
        public int getVideoThreshold() { return videoThreshold; }
        public void setVideoThreshold(int v) { this.videoThreshold = v; }
        public int getVideoWindowSeconds() { return videoWindowSeconds; }
        public void setVideoWindowSeconds(int v) { this.videoWindowSeconds = v; }
        public boolean isWarnEnabled() { return warnEnabled; }
        public void setWarnEnabled(boolean warnEnabled) { this.warnEnabled = warnEnabled; }
    }

    public static class EscalationProperties {
        private List<Integer> durationsMinutes = new ArrayList<>(List.of(10, 60, 300, 1440));
        private int defaultMinutes = 2880;

        public List<Integer> getDurationsMinutes() { return durationsMinutes; }
        public void setDurationsMinutes(List<Integer> durationsMinutes) { this.durationsMinutes = durationsMinutes; }
        public int getDefaultMinutes() { return defaultMinutes; }
        public void setDefaultMinutes(int defaultMinutes) { this.defaultMinutes = defaultMinutes; }
    }

    public static class RetentionProperties {
        private int ledgerRetentionHours = 24;
        private int auditLogDays = 365;
        private int restrictionLogDays = 90;

        public int getLedgerRetentionHours() { return ledgerRetentionHours; }
        public void setLedgerRetentionHours(int h) { this.ledgerRetentionHours = h; }
        public int getAuditLogDays() { return auditLogDays; }
        public void setAuditLogDays(int d) { this.auditLogDays = d; }
        public int getRestrictionLogDays() { return restrictionLogDays; }
        public void setRestrictionLogDays(int d) { this.restrictionLogDays = d; }
    }

    public static class LoggingProperties {
        private boolean maskIdentities = false;

        public boolean isMaskIdentities() { return maskIdentities; }
        public void setMaskIdentities(boolean maskIdentities) { this.maskIdentities = maskIdentities; }
    }
}
