package com.chatwarden.policy;

import com.chatwarden.config.ChatwardenProperties;
import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "chat_policies")
public class ChatPolicy {

    @Id
    @Column(name = "chat_id")
    private Long chatId;

    @Column(name = "sticker_threshold", nullable = false)
    private int stickerThreshold;

    @Column(name = "sticker_window_seconds", nullable = false)
    private int stickerWindowSeconds;

    @Column(name = "text_threshold", nullable = false)
    private int textThreshold;

    @Column(name = "text_window_seconds", nullable = false)
    private int textWindowSeconds;

    @Column(name = "image_threshold", nullable = false)
    private int imageThreshold;

    @Column(name = "image_window_seconds", nullable = false)
    private int imageWindowSeconds;

    @Column(name = "video_threshold", nullable = false)
    private int videoThreshold;

    @Column(name = "video_window_seconds", nullable = false)
    private int videoWindowSeconds;

    @Column(name = "warn_enabled", nullable = false)
    private boolean warnEnabled = true;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public ChatPolicy() {}

    public static ChatPolicy withDefaults(long chatId, ChatwardenProperties.PolicyDefaults defaults, Instant now) {
        ChatPolicy policy = new ChatPolicy();
        policy.chatId = chatId;
        policy.updatedAt = now;
        policy.stickerThreshold = defaults.getStickerThreshold();
        policy.stickerWindowSeconds = defaults.getStickerWindowSeconds();
        policy.textThreshold = defaults.getTextThreshold();
        policy.textWindowSeconds = defaults.getTextWindowSeconds();
        policy.imageThreshold = defaults.getImageThreshold();
        policy.imageWindowSeconds = defaults.getImageWindowSeconds();
        policy.videoThreshold = defaults.getVideoThreshold();
        policy.videoWindowSeconds = defaults.getVideoWindowSeconds();
        policy.warnEnabled = defaults.isWarnEnabled();
        return policy;
    }

    public CategoryLimits limitsFor(ContentCategory category) {
        return limitsFor(category.policySlot());
    }

    public CategoryLimits limitsFor(PolicySlot slot) {
        return switch (slot) {
            case STICKER -> new CategoryLimits(stickerThreshold, stickerWindowSeconds);
            case TEXT -> new CategoryLimits(textThreshold, textWindowSeconds);
            case IMAGE -> new CategoryLimits(imageThreshold, imageWindowSeconds);
            case VIDEO -> new CategoryLimits(videoThreshold, videoWindowSeconds);
        };
    }

    /**
     * Applies an already validated value. warnEnabled is chat-wide, so the slot is
     * ignored for {@link PolicyField#WARN_ENABLED}.
     */
    void apply(PolicySlot slot, PolicyField field, int value) {
        if (field == PolicyField.WARN_ENABLED) {
            this.warnEnabled = value == 1;
            return;
        }
        boolean threshold = field == PolicyField.THRESHOLD;
        switch (slot) {
            case STICKER -> { if (threshold) stickerThreshold = value; else stickerWindowSeconds = value; }
            case TEXT -> { if (threshold) textThreshold = value; else textWindowSeconds = value; }
            case IMAGE -> { if (threshold) imageThreshold = value; else imageWindowSeconds = value; }
            case VIDEO -> { if (threshold) videoThreshold = value; else videoWindowSeconds = value; }
        }
    }

    public Long getChatId() { return chatId; }

    public int getStickerThreshold() { return stickerThreshold; }
    public int getStickerWindowSeconds() { return stickerWindowSeconds; }
    public int getTextThreshold() { return textThreshold; }
    public int getTextWindowSeconds() { return textWindowSeconds; }
    public int getImageThreshold() { return imageThreshold; }
    public int getImageWindowSeconds() { return imageWindowSeconds; }
    public int getVideoThreshold() { return videoThreshold; }
    public int getVideoWindowSeconds() { return videoWindowSeconds; }

    public boolean isWarnEnabled() { return warnEnabled; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
