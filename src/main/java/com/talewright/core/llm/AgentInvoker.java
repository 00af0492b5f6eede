package com.talewright.core.llm;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.talewright.core.logging.MdcContext;
import com.talewright.core.metrics.TalewrightMetrics;
import com.talewright.core.model.AgentRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;
import java.util.function.Function;

/**
 * Uniform {@code call(agentRole, promptContext)} over a {@link TextGenerator}.
 * <p>
 * Transient provider failures are retried with exponential backoff. A token-limit failure
 * lowers the output budget to the limit the provider reports (or half the request when it
 * reports none), caches that limit for the model, and retries once. JSON replies that cannot
 * be parsed, or bound to the requested record type, get one corrective re-prompt before
 * {@link LlmParseException} is thrown.
 */
@Service
public class AgentInvoker {

    private static final Logger log = LoggerFactory.getLogger(AgentInvoker.class);

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final TextGenerator generator;
    private final TokenLimitCache tokenLimits;
    private final TalewrightMetrics metrics;
    private final RetryPolicy retryPolicy;
    private final LlmProperties properties;
    private final Sleeper sleeper;
    private final ObjectMapper mapper;
    private final ObjectMapper bindingMapper = LenientBinding.mapper();

    @Autowired
    public AgentInvoker(TextGenerator generator, TokenLimitCache tokenLimits, TalewrightMetrics metrics,
                        LlmProperties properties) {
        this(generator, tokenLimits, metrics, properties, Sleeper.SYSTEM);
    }

    public AgentInvoker(TextGenerator generator, TokenLimitCache tokenLimits, TalewrightMetrics metrics,
                        LlmProperties properties, Sleeper sleeper) {
        this.generator = generator;
        this.tokenLimits = tokenLimits;
        this.metrics = metrics;
        this.properties = properties;
        this.retryPolicy = properties.retryPolicy();
        this.sleeper = sleeper;
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
    }

    /**
     * Calls an agent and returns its reply.
     *
     * @throws AgentInvocationException when the provider keeps failing
     * @throws LlmParseException        when a JSON reply stays unparsable after correction
     */
    public AgentReply call(AgentRole role, PromptContext ctx) {
        return invoke(role, ctx, "", raw -> null).reply();
    }

    /**
     * Calls an agent for a JSON reply and binds it to {@code type}. The format instructions of a
     * {@link BeanOutputConverter} are appended to the prompt. A reply the converter rejects is
     * bound again with a lenient Jackson mapper; a reply neither can bind gets the same single
     * corrective re-prompt as an unparsable one.
     *
     * @throws AgentInvocationException when the provider keeps failing
     * @throws LlmParseException        when the reply stays unbindable after correction
     */
    public <T> StructuredReply<T> callStructured(AgentRole role, PromptContext ctx, Class<T> type) {
        BeanOutputConverter<T> converter = new BeanOutputConverter<>(type);
        PromptContext json = ctx.format() == OutputFormat.JSON ? ctx : ctx.withFormat(OutputFormat.JSON);
        return invoke(role, json, "\n\n" + converter.getFormat(), raw -> bind(raw, type, converter));
    }

    private <T> StructuredReply<T> invoke(AgentRole role, PromptContext ctx, String formatInstructions,
                                          Function<String, T> binder) {
        MdcContext.setAgent(role.key());
        long start = System.currentTimeMillis();
        String outcome = "error";
        try {
            String model = resolveModel(ctx);
            String system = AgentPrompts.systemPrompt(role, ctx.format());
            String user = ctx.userPrompt() + formatInstructions;
            int[] attempts = {0};

            String raw = completeWithRetry(role, system, user, model, ctx, attempts);
            if (ctx.format() == OutputFormat.PROSE) {
                outcome = "ok";
                return new StructuredReply<>(new AgentReply(role, raw.strip(), Map.of(), attempts[0]), null);
            }

            try {
                Map<String, Object> json = parseJson(raw);
                T value = binder.apply(raw);
                outcome = "ok";
                return new StructuredReply<>(new AgentReply(role, raw, json, attempts[0]), value);
            } catch (LlmParseException first) {
                log.warn("{} returned unparsable JSON, re-prompting once: {}", role, first.getMessage());
                log.debug("Raw {} reply: {}", role, raw);
                String retried = completeWithRetry(role, system, user + AgentPrompts.correction(first.getMessage()),
                        model, ctx, attempts);
                Map<String, Object> json = parseJson(retried);
                T value = binder.apply(retried);
                outcome = "corrected";
                return new StructuredReply<>(new AgentReply(role, retried, json, attempts[0]), value);
            }
        } finally {
            metrics.recordAgentCall(role.key(), outcome, System.currentTimeMillis() - start);
            MdcContext.clearAgent();
        }
    }

    /**
     * Binds a reply with the converter, falling back to the lenient mapper. A top-level array is
     * bound as the {@code items} field.
     */
    <T> T bind(String raw, Class<T> type, BeanOutputConverter<T> converter) {
        String cleaned = extractJson(raw);
        if (cleaned.startsWith("{")) {
            try {
                T value = converter.convert(cleaned);
                if (value != null) {
                    return value;
                }
            } catch (RuntimeException e) {
                log.debug("Strict binding to {} failed, trying lenient binding: {}", type.getSimpleName(), e.getMessage());
            }
        }
        try {
            return bindingMapper.convertValue(parseJson(cleaned), type);
        } catch (IllegalArgumentException e) {
            throw new LlmParseException("Failed to bind agent reply to " + type.getSimpleName() + ": "
                    + e.getMessage(), e);
        }
    }

    private String completeWithRetry(AgentRole role, String system, String user, String model, PromptContext ctx,
                                     int[] attempts) {
        int maxTokens = tokenLimits.apply(model, ctx.maxTokens());
        double temperature = ctx.model() != null ? ctx.model().temperature() : properties.getTemperature();
        boolean tokenRetryUsed = false;
        int attempt = 1;
        while (true) {
            attempts[0]++;
            try {
                log.debug("{} call attempt {} (model={}, maxTokens={})", role, attempt, model, maxTokens);
                String text = generator.complete(new CompletionRequest(system, user, model, maxTokens, temperature));
                if (text == null || text.isBlank()) {
                    throw new LlmEmptyResponseException(role + " returned empty content");
                }
                return text;
            } catch (LlmEmptyResponseException e) {
                if (attempt >= retryPolicy.maxAttempts()) {
                    throw new AgentInvocationException(role, attempts[0], e.getMessage(), e);
                }
                log.warn("{} returned empty content (attempt {}/{}), retrying", role, attempt, retryPolicy.maxAttempts());
                backoff(role, attempt, attempts[0], e);
                attempt++;
            } catch (RuntimeException e) {
                ProviderErrors.Kind kind = ProviderErrors.classify(e);
                if (kind == ProviderErrors.Kind.TOKEN_LIMIT && !tokenRetryUsed) {
                    OptionalInt advertised = ProviderErrors.extractTokenLimit(e);
                    int limit = advertised.isPresent() ? advertised.getAsInt() : Math.max(1, maxTokens / 2);
                    tokenLimits.record(model, limit);
                    int reduced = Math.min(maxTokens - 1, limit);
                    log.warn("{} exceeded output token limit of {} (requested {}), retrying with {}",
                            role, model, maxTokens, reduced);
                    maxTokens = Math.max(1, reduced);
                    tokenRetryUsed = true;
                    metrics.incrementProviderRetries("token_limit");
                    continue;
                }
                if (kind == ProviderErrors.Kind.TRANSIENT && attempt < retryPolicy.maxAttempts()) {
                    log.warn("{} transient provider error (attempt {}/{}): {}",
                            role, attempt, retryPolicy.maxAttempts(), e.getMessage());
                    metrics.incrementProviderRetries("transient");
                    backoff(role, attempt, attempts[0], e);
                    attempt++;
                    continue;
                }
                log.error("{} call failed after {} attempt(s): {}", role, attempts[0], e.getMessage());
                throw new AgentInvocationException(role, attempts[0],
                        role + " call failed after " + attempts[0] + " attempt(s): " + e.getMessage(), e);
            }
        }
    }

    private void backoff(AgentRole role, int attempt, int totalAttempts, RuntimeException cause) {
        Duration delay = retryPolicy.backoffAfter(attempt);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new AgentInvocationException(role, totalAttempts, role + " retry interrupted", cause);
        }
    }

    private String resolveModel(PromptContext ctx) {
        if (ctx.model() != null && ctx.model().model() != null && !ctx.model().model().isBlank()) {
            return ctx.model().model();
        }
        return properties.getModel();
    }

    /**
     * Parses a JSON reply, tolerating markdown fences and leading or trailing chatter.
     */
    Map<String, Object> parseJson(String raw) {
        String cleaned = extractJson(raw);
        try {
            JsonNode node = mapper.readTree(cleaned);
            if (node == null || node.isMissingNode()) {
                throw new LlmParseException("reply contains no JSON");
            }
            if (node.isArray()) {
                Map<String, Object> wrapped = new LinkedHashMap<>();
                wrapped.put("items", mapper.convertValue(node, Object.class));
                return wrapped;
            }
            if (!node.isObject()) {
                throw new LlmParseException("reply is JSON but not an object");
            }
            return mapper.convertValue(node, MAP_TYPE);
        } catch (LlmParseException e) {
            throw e;
        } catch (Exception e) {
            throw new LlmParseException("Failed to parse agent reply: " + e.getMessage(), e);
        }
    }

    static String extractJson(String raw) {
        String cleaned = raw.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        cleaned = cleaned.trim();
        int obj = cleaned.indexOf('{');
        int arr = cleaned.indexOf('[');
        int begin = obj < 0 ? arr : (arr < 0 ? obj : Math.min(obj, arr));
        if (begin > 0) {
            char open = cleaned.charAt(begin);
            int end = cleaned.lastIndexOf(open == '{' ? '}' : ']');
            if (end > begin) {
                cleaned = cleaned.substring(begin, end + 1);
            }
        }
        return cleaned;
    }
}
