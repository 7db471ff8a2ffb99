package com.example.cdscoverage.service;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.converter.BeanOutputConverter;

import java.time.Duration;

/**
 * Utility for resilient LLM calls with lenient JSON parsing and automatic retry.
 * <p>
 * Tolerates the usual defects of model output:
 * <ul>
 *   <li>Trailing commas ({@code [{"a":1},]})</li>
 *   <li>Java-style comments in JSON</li>
 *   <li>Single quotes instead of double quotes</li>
 *   <li>Unexpected fields (ignoreUnknown)</li>
 * </ul>
 * Uses {@link BeanOutputConverter} with a lenient {@link ObjectMapper} and retries with a
 * linear back-off ({@code retryDelay * attempt}).
 */
public final class ResilientLlmCaller {

    private static final Logger log = LoggerFactory.getLogger(ResilientLlmCaller.class);

    /** Lenient ObjectMapper that tolerates trailing commas, comments, and single quotes. */
    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ResilientLlmCaller() {
        // static helpers only
    }

    /**
     * Calls the LLM via {@code .entity(converter)} semantics with retry and lenient JSON parsing.
     *
     * @param chatClient   the LLM client to use
     * @param systemPrompt the system prompt
     * @param userPrompt   the user prompt (format instructions are added automatically)
     * @param type         the target class for parsing
     * @param callerName   caller name (for logging)
     * @param maxRetries   retries after the first attempt
     * @param retryDelay   base delay between attempts
     * @param <T>          target type
     * @return the parsed response
     * @throws RuntimeException if all attempts fail or the thread is interrupted
     */
    public static <T> T callEntity(ChatClient chatClient, String systemPrompt, String userPrompt,
                                   Class<T> type, String callerName, int maxRetries, Duration retryDelay) {
        var converter = new BeanOutputConverter<>(type, LENIENT_MAPPER);
        String fullUserPrompt = userPrompt + "\n\n" + converter.getFormat();

        Exception lastError = null;
        for (int attempt = 1; attempt <= maxRetries + 1; attempt++) {
            try {
                ChatResponse chatResponse = chatClient.prompt()
                        .system(systemPrompt)
                        .user(fullUserPrompt)
                        .call()
                        .chatResponse();

                logTokenUsage(chatResponse, callerName);

                String content = (chatResponse != null && chatResponse.getResult() != null)
                        ? chatResponse.getResult().getOutput().getText()
                        : null;
                if (content == null || content.isBlank()) {
                    throw new RuntimeException("Empty or null content in LLM response");
                }
                return converter.convert(content);
            } catch (Exception e) {
                lastError = e;
                if (attempt <= maxRetries) {
                    long delay = retryDelay.toMillis() * attempt;
                    log.warn("{}: attempt {}/{} failed ({}), retrying in {}ms...",
                            callerName, attempt, maxRetries + 1, rootCauseMessage(e), delay);
                    try {
                        Thread.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        }
        throw new RuntimeException("Error in " + callerName + " after " + (maxRetries + 1)
                + " attempts: " + (lastError != null ? lastError.getMessage() : "interrupted"), lastError);
    }

    private static void logTokenUsage(ChatResponse chatResponse, String callerName) {
        if (chatResponse == null || chatResponse.getMetadata() == null) return;
        var usage = chatResponse.getMetadata().getUsage();
        if (usage == null || usage.getTotalTokens() == null) return;
        log.debug("{}: {} tokens (model={})", callerName, usage.getTotalTokens(),
                chatResponse.getMetadata().getModel());
    }

    /**
     * Message of the innermost cause, capped at 150 characters.
     */
    public static String rootCauseMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        String msg = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return msg.length() > 150 ? msg.substring(0, 150) + "..." : msg;
    }
}
