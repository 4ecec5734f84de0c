package fr.lapetina.chatgateway.domain.model;

/**
 * Token accounting reported with a complete response.
 * The upstream gives no token counts, so both sides are estimated as
 * whitespace-separated word counts.
 */
public record TokenUsage(int promptTokens, int completionTokens) {

    public int totalTokens() {
        return promptTokens + completionTokens;
    }

    public static TokenUsage estimate(String prompt, String completion) {
        return new TokenUsage(countWords(prompt), countWords(completion));
    }

    static int countWords(String text) {
        if (text == null) {
            return 0;
        }
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return 0;
        }
        return trimmed.split("\\s+").length;
    }
}
