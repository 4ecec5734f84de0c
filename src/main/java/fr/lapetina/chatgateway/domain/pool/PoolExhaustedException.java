package fr.lapetina.chatgateway.domain.pool;

/**
 * Thrown by {@link CredentialPool#select} when no credential is both available
 * and outside the caller's exclusion set.
 */
public final class PoolExhaustedException extends Exception {

    private final int registered;
    private final int excluded;

    public PoolExhaustedException(int registered, int excluded) {
        super("No eligible credential: registered=" + registered + ", excluded=" + excluded);
        this.registered = registered;
        this.excluded = excluded;
    }

    public int getRegistered() {
        return registered;
    }

    public int getExcluded() {
        return excluded;
    }
}
