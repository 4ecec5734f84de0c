package fr.lapetina.chatgateway.domain.translate;

import fr.lapetina.chatgateway.domain.model.ChatRequest;
import fr.lapetina.chatgateway.domain.model.ChatRole;
import fr.lapetina.chatgateway.domain.model.ModelDescriptor;
import fr.lapetina.chatgateway.domain.model.RequestEnvelope;

import java.util.List;
import java.util.Objects;

/**
 * Turns a client chat request into a {@link RequestEnvelope}: the message list
 * is flattened into one prompt and the model alias is resolved.
 *
 * Pure: it touches no credential and no shared state.
 */
public final class RequestTranslator {

    static final String BLOCK_SEPARATOR = "\n\n";

    private final ModelCatalog catalog;

    public RequestTranslator(ModelCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "Model catalog is required");
    }

    /**
     * @throws UnknownModelException    if the model alias is not in the catalog
     * @throws IllegalArgumentException if a message carries an unknown role
     */
    public RequestEnvelope translate(ChatRequest request) {
        ModelDescriptor model = catalog.resolve(request.model());
        String prompt = flatten(request.messages());

        return new RequestEnvelope(
                request.requestId(),
                prompt,
                model.alias(),
                model.upstreamId(),
                request.stream(),
                request.createdAt()
        );
    }

    /**
     * Renders each message as {@code "<Label>: <content>"}, in order, separated by a blank line.
     */
    public static String flatten(List<ChatRequest.Message> messages) {
        StringBuilder prompt = new StringBuilder();
        for (ChatRequest.Message message : messages) {
            ChatRole role = ChatRole.fromWire(message.role())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown message role: " + message.role()));
            if (prompt.length() > 0) {
                prompt.append(BLOCK_SEPARATOR);
            }
            prompt.append(role.getPromptLabel())
                    .append(": ")
                    .append(message.content() != null ? message.content() : "");
        }
        return prompt.toString();
    }

    public ModelCatalog getCatalog() {
        return catalog;
    }
}
