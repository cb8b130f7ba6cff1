package junie.email.intel.service;

import com.theokanning.openai.OpenAiHttpException;
import com.theokanning.openai.Usage;
import com.theokanning.openai.completion.chat.ChatCompletionRequest;
import com.theokanning.openai.completion.chat.ChatCompletionResult;
import com.theokanning.openai.completion.chat.ChatMessage;
import com.theokanning.openai.service.OpenAiService;
import junie.email.intel.model.AiAnalysisRequest;
import junie.email.intel.model.AiAnalysisResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;

@Slf4j
public class OpenAiAnalysisClient implements AiAnalysisClient {
    static final String SYSTEM_PROMPT =
            "You are an assistant that triages email. Be concise and accurate. Always respond with valid JSON.";

    private final OpenAiService openAiService;

    public OpenAiAnalysisClient(OpenAiService openAiService) {
        this.openAiService = openAiService;
    }

    @Override
    public AiAnalysisResponse analyze(AiAnalysisRequest request) {
        try {
            ChatCompletionRequest chatRequest = ChatCompletionRequest.builder()
                    .model(request.getModelHint())
                    .messages(List.of(
                            new ChatMessage("system", SYSTEM_PROMPT),
                            new ChatMessage("user", request.getPrompt())))
                    .maxTokens(request.getMaxTokens())
                    .temperature(0.2)
                    .build();

            ChatCompletionResult result = openAiService.createChatCompletion(chatRequest);
            if (result.getChoices() == null || result.getChoices().isEmpty()) {
                throw new IllegalStateException("OpenAI returned no choices for model " + request.getModelHint());
            }
            String content = result.getChoices().get(0).getMessage().getContent();
            Usage usage = result.getUsage();
            return AiAnalysisResponse.builder()
                    .content(content == null ? "" : content.trim())
                    .model(result.getModel() != null ? result.getModel() : request.getModelHint())
                    .promptTokens(usage != null ? usage.getPromptTokens() : 0)
                    .completionTokens(usage != null ? usage.getCompletionTokens() : 0)
                    .build();
        } catch (RuntimeException e) {
            throw translate(e, request.getModelHint());
        }
    }

    @Override
    public String providerName() {
        return "openai";
    }

    private RuntimeException translate(RuntimeException e, String model) {
        if (e instanceof OpenAiHttpException) {
            OpenAiHttpException http = (OpenAiHttpException) e;
            if (http.statusCode == 429 || "insufficient_quota".equals(http.code)) {
                return new QuotaException("OpenAI quota/rate limit exceeded for " + model + ": " + e.getMessage(), e);
            }
            return e;
        }
        String message = e.getMessage() != null ? e.getMessage().toLowerCase(Locale.ROOT) : "";
        if (message.contains("quota") || message.contains("rate limit")
                || (e.getCause() != null && e.getCause().getMessage() != null
                && e.getCause().getMessage().contains("429"))) {
            return new QuotaException("OpenAI quota/rate limit exceeded for " + model + ": " + e.getMessage(), e);
        }
        return e;
    }
}
