package fr.lapetina.chatgateway.infrastructure.upstream;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a complete reply into word-sized deltas.
 * Whitespace stays attached to the preceding word, so the chunks concatenate
 * back to the original text.
 */
public final class TextChunker {

    private static final Pattern WORD_BOUNDARY = Pattern.compile("(?<=\\s)(?=\\S)");

    private TextChunker() {
    }

    public static List<String> chunk(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return List.of(WORD_BOUNDARY.split(text));
    }
}
