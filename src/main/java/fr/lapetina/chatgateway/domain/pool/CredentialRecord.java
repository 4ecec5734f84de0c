package fr.lapetina.chatgateway.domain.pool;

import fr.lapetina.chatgateway.domain.model.CredentialSnapshot;
import fr.lapetina.chatgateway.domain.model.SecretPair;

import java.time.Instant;
import java.util.Objects;

/**
 * One registered upstream identity and its health state.
 *
 * Identity fields are immutable. The mutable state (availability, error count,
 * last use) is written only by {@link CredentialPool} while it holds its lock;
 * the mutators are package-private so no other component can change them.
 * Fields are volatile so that reads outside the lock see recent values.
 */
public final class CredentialRecord {

    /** Consecutive failures after which a credential is taken out of rotation. */
    public static final int MAX_ERRORS = 3;

    private final String id;
    private final int position;
    private final SecretPair secretPair;
    private final String displayName;

    private volatile boolean available = true;
    private volatile int errorCount = 0;
    private volatile Instant lastUsed = Instant.EPOCH;

    CredentialRecord(String id, int position, SecretPair secretPair, String displayName) {
        this.id = Objects.requireNonNull(id, "Credential ID is required");
        this.position = position;
        this.secretPair = Objects.requireNonNull(secretPair, "Secret pair is required");
        this.displayName = displayName == null || displayName.isBlank() ? id : displayName;
    }

    public String getId() {
        return id;
    }

    /**
     * Zero-based registration position; the tie-break and rotation order.
     */
    public int getPosition() {
        return position;
    }

    public SecretPair getSecretPair() {
        return secretPair;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isAvailable() {
        return available;
    }

    public int getErrorCount() {
        return errorCount;
    }

    public Instant getLastUsed() {
        return lastUsed;
    }

    void markUsed(Instant when) {
        this.lastUsed = when;
    }

    void markSuccess() {
        this.errorCount = 0;
        this.available = true;
    }

    /**
     * @return the error count after this failure
     */
    int markFailure() {
        int errors = errorCount + 1;
        this.errorCount = errors;
        if (errors >= MAX_ERRORS) {
            this.available = false;
        }
        return errors;
    }

    CredentialSnapshot snapshot() {
        return new CredentialSnapshot(id, displayName, available, errorCount, lastUsed);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CredentialRecord that = (CredentialRecord) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "CredentialRecord{" +
                "id='" + id + '\'' +
                ", name='" + displayName + '\'' +
                ", available=" + available +
                ", errors=" + errorCount +
                '}';
    }
}
