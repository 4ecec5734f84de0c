package fr.lapetina.chatgateway.domain.translate;

import java.util.List;

/**
 * Thrown when a request names a model alias the catalog does not know.
 */
public final class UnknownModelException extends RuntimeException {

    private final String alias;

    public UnknownModelException(String alias, List<String> known) {
        super("Model '" + alias + "' not found. Available models: " + known);
        this.alias = alias;
    }

    public String getAlias() {
        return alias;
    }
}
