package com.eainde.workout.config;

import com.eainde.workout.thread.MdcAwareExecutor;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

@Configuration
public class AgentConfig {

    @Bean
    public ChatModel chatModel(@Value("${workout-logger.model.api-key}") String apiKey,
                               @Value("${workout-logger.model.model-name:gemini-2.5-flash}") String modelName,
                               @Value("${workout-logger.model.temperature:0.7}") double temperature,
                               @Value("${workout-logger.model.max-output-tokens:8192}") int maxOutputTokens,
                               @Value("${workout-logger.model.timeout:PT60S}") Duration timeout) {
        return GoogleAiGeminiChatModel.builder()
                .apiKey(apiKey)
                .modelName(modelName)
                .temperature(temperature)
                .maxOutputTokens(maxOutputTokens)
                .timeout(timeout)
                .listeners(List.of(new ModelCallLoggingListener()))
                .build();
    }

    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor backgroundExecutor(@Value("${workout-logger.background.pool-size:4}") int poolSize,
                                               @Value("${workout-logger.background.queue-capacity:100}") int queueCapacity) {
        return MdcAwareExecutor.bounded(poolSize, queueCapacity);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
