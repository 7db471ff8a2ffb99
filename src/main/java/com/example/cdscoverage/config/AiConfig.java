package com.example.cdscoverage.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Beans shared across the engine.
 * <p>
 * - generationChatClient (OpenAI): used by the scenario generation collaborator
 * - objectMapper: persisted reports and the taxonomy definition
 * - generationExecutor: runs generation calls under a per-call timeout
 */
@Configuration
public class AiConfig {

    /**
     * ChatClient used to generate candidate scenarios.
     */
    @Bean("generationChatClient")
    public ChatClient generationChatClient(OpenAiChatModel openAiChatModel) {
        return ChatClient.builder(openAiChatModel).build();
    }

    /**
     * Executor for generation calls; each call is awaited with a timeout by the caller.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService generationExecutor() {
        return Executors.newCachedThreadPool(namedDaemonThreads("generation-"));
    }

    /**
     * ObjectMapper shared for JSON serialization. Snake-case keys and sorted map entries keep
     * the report layout stable across runs.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return createObjectMapper();
    }

    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
