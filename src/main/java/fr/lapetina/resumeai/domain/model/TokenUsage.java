package fr.lapetina.resumeai.domain.model;

/**
 * Token accounting reported by a provider.
 */
public record TokenUsage(int promptTokens, int completionTokens, int totalTokens) {

    public static final TokenUsage EMPTY = new TokenUsage(0, 0, 0);

    public static TokenUsage of(int promptTokens, int completionTokens) {
        return new TokenUsage(promptTokens, completionTokens, promptTokens + completionTokens);
    }
}
