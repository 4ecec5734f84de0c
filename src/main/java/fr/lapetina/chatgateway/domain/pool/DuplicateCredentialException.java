package fr.lapetina.chatgateway.domain.pool;

/**
 * Thrown when registering a secret pair that is already in the pool.
 */
public final class DuplicateCredentialException extends RuntimeException {

    private final String existingId;

    public DuplicateCredentialException(String existingId) {
        super("Secret pair already registered as " + existingId);
        this.existingId = existingId;
    }

    public String getExistingId() {
        return existingId;
    }
}
