package com.talewright.core.llm;

import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies provider failures from their error text and extracts advertised token limits.
 */
public final class ProviderErrors {

    private ProviderErrors() {}

    public enum Kind {
        /** Rate limit, 5xx or timeout: retry with backoff. */
        TRANSIENT,
        /** Requested output length exceeds what the model allows: retry once with a smaller budget. */
        TOKEN_LIMIT,
        /** Anything else: fail the call. */
        FATAL
    }

    private static final List<String> TRANSIENT_MARKERS = List.of(
            "rate limit", "rate_limit", "too many requests", "timeout", "timed out",
            "overloaded", "temporarily unavailable");

    private static final Pattern TRANSIENT_STATUS = Pattern.compile("\\b(429|500|502|503|504)\\b");

    /** Each pattern's last group is the limit the provider supports. */
    private static final List<Pattern> LIMIT_PATTERNS = List.of(
            // max_tokens: 20000 > 16384
            Pattern.compile("max_tokens:\\s*(\\d+)\\s*>\\s*(\\d+)"),
            // maximum context length is 8192 tokens ... requested 9000 (limit is the first number)
            Pattern.compile("maximum.*?context.*?(\\d+)\\s*tokens"),
            // max_tokens is too large: 20000 ... supports at most 16384
            Pattern.compile("max_tokens.*?too large:\\s*(\\d+).*?supports.*?(\\d+)"),
            // maxOutputTokens must be <= 8192
            Pattern.compile("maxoutputtokens.*?<=\\s*(\\d+)"),
            // exceeds maximum of 4096 tokens
            Pattern.compile("exceeds.*?maximum.*?(\\d+)\\s*tokens"),
            // max_tokens ... maximum value is 8192
            Pattern.compile("max_tokens.*?maximum.*?(\\d+)"));

    public static Kind classify(Throwable error) {
        String message = messageChain(error);
        if (isTokenLimit(message)) {
            return Kind.TOKEN_LIMIT;
        }
        for (String marker : TRANSIENT_MARKERS) {
            if (message.contains(marker)) {
                return Kind.TRANSIENT;
            }
        }
        return TRANSIENT_STATUS.matcher(message).find() ? Kind.TRANSIENT : Kind.FATAL;
    }

    /**
     * Output-token limit advertised in a provider error, if one can be read.
     */
    public static OptionalInt extractTokenLimit(Throwable error) {
        String message = messageChain(error);
        for (Pattern pattern : LIMIT_PATTERNS) {
            Matcher m = pattern.matcher(message);
            if (m.find()) {
                return OptionalInt.of(Integer.parseInt(m.group(m.groupCount())));
            }
        }
        return OptionalInt.empty();
    }

    private static boolean isTokenLimit(String message) {
        return message.contains("max_tokens")
                || message.contains("maximum context")
                || message.contains("maxoutputtokens")
                || (message.contains("exceeds") && message.contains("token"));
    }

    /** Lower-cased messages of the throwable and its causes, joined. */
    static String messageChain(Throwable error) {
        StringBuilder sb = new StringBuilder();
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (current.getMessage() != null) {
                sb.append(current.getMessage()).append(' ');
            }
            if (current instanceof SocketTimeoutException || current instanceof TimeoutException) {
                sb.append("timeout ");
            }
            current = current.getCause();
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }
}
