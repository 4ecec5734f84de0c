package fr.lapetina.chatgateway.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Author role of a chat message, with the label used when the conversation
 * is flattened into a single upstream prompt.
 */
public enum ChatRole {
    SYSTEM("System"),
    USER("User"),
    ASSISTANT("Assistant");

    private final String promptLabel;

    ChatRole(String promptLabel) {
        this.promptLabel = promptLabel;
    }

    public String getPromptLabel() {
        return promptLabel;
    }

    /**
     * Parses a wire role name ({@code system}, {@code user}, {@code assistant}).
     */
    public static Optional<ChatRole> fromWire(String role) {
        if (role == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(role.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
