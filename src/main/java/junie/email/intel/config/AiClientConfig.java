package junie.email.intel.config;

import com.theokanning.openai.service.OpenAiService;
import junie.email.intel.service.AiAnalysisClient;
import junie.email.intel.service.GeminiAnalysisClient;
import junie.email.intel.service.OpenAiAnalysisClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Configuration to switch between AI providers.
 * Set ai.provider=gemini or ai.provider=openai in application.properties
 */
@Configuration
public class AiClientConfig {

    @Bean
    @Primary
    @ConditionalOnProperty(name = "ai.provider", havingValue = "gemini", matchIfMissing = false)
    public AiAnalysisClient geminiAnalysisClient(@Value("${gemini.api.key:}") String apiKey) {
        return new GeminiAnalysisClient(apiKey);
    }

    @Bean
    @Primary
    @ConditionalOnProperty(name = "ai.provider", havingValue = "openai", matchIfMissing = true)
    public AiAnalysisClient openAiAnalysisClient(@Value("${openai.api.key:}") String apiKey,
                                                 AiInvocationProperties properties) {
        // The per-call timeout is enforced by the invocation service; this only bounds the socket
        OpenAiService openAiService = new OpenAiService(apiKey, properties.getCallTimeout().plusSeconds(5));
        return new OpenAiAnalysisClient(openAiService);
    }
}
