package com.chatwarden.observability;

import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Logback converter that masks platform identifiers (runs of five or more digits)
 * in log messages, keeping the first three digits: {@code 123456789 -> 123***}.
 * Switched on through chatwarden.logging.mask-identities.
 */
public class IdentityMaskingConverter extends ClassicConverter {

    private static final Pattern IDENTIFIER = Pattern.compile("(-?\\d{3})\\d{2,}");

    private static volatile boolean enabled = false;

    public static void setEnabled(boolean value) {
        enabled = value;
    }

    @Override
    public String convert(ILoggingEvent event) {
        String message = event.getFormattedMessage();
        if (message == null) return "";
        if (!enabled) return message;
        return mask(message);
    }

    static String mask(String message) {
        Matcher matcher = IDENTIFIER.matcher(message);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(matcher.group(1) + "***"));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
