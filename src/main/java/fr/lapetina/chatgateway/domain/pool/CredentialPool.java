package fr.lapetina.chatgateway.domain.pool;

import fr.lapetina.chatgateway.domain.model.CredentialSnapshot;
import fr.lapetina.chatgateway.domain.model.SecretPair;
import fr.lapetina.chatgateway.domain.strategy.RoundRobinStrategy;
import fr.lapetina.chatgateway.domain.strategy.SelectionStrategy;
import fr.lapetina.chatgateway.infrastructure.config.ConfigLoader.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the registered credentials and decides which one serves the next attempt.
 *
 * The pool is append-only: credentials are registered once and live as long as
 * the pool. It is the only component that mutates credential state.
 *
 * Every read-modify-write (selection with its last-use stamp, success and
 * failure reports, status snapshots) runs under a single lock. None of these
 * critical sections perform I/O, so a status snapshot holds the lock only for
 * the copy.
 */
public final class CredentialPool {

    private static final Logger log = LoggerFactory.getLogger(CredentialPool.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final List<CredentialRecord> records = new ArrayList<>();
    private final Map<String, CredentialRecord> byId = new HashMap<>();
    private final Map<SecretPair, String> idsBySecret = new HashMap<>();
    private final Clock clock;

    private SelectionStrategy strategy;
    private int nextId = 1;
    private Instant lastStamp = Instant.EPOCH;

    private CredentialPool(SelectionStrategy strategy, Clock clock) {
        this.strategy = Objects.requireNonNull(strategy, "Strategy is required");
        this.clock = Objects.requireNonNull(clock, "Clock is required");
    }

    /**
     * Registers a new credential at the end of the rotation order.
     *
     * @param secretPair  the credential's tokens
     * @param displayName human label, or null to use the generated id
     * @return the generated credential id
     * @throws DuplicateCredentialException if the same pair is already registered
     */
    public String register(SecretPair secretPair, String displayName) {
        Objects.requireNonNull(secretPair, "Secret pair is required");
        lock.lock();
        try {
            String existing = idsBySecret.get(secretPair);
            if (existing != null) {
                throw new DuplicateCredentialException(existing);
            }
            String id = "cred-" + nextId++;
            CredentialRecord record = new CredentialRecord(id, records.size(), secretPair, displayName);
            records.add(record);
            byId.put(id, record);
            idsBySecret.put(secretPair, id);
            log.info("Credential registered: id={}, name={}", id, record.getDisplayName());
            return id;
        } finally {
            lock.unlock();
        }
    }

    public String register(SecretPair secretPair) {
        return register(secretPair, null);
    }

    /**
     * Picks an available credential outside {@code exclude} with the current
     * strategy, and stamps its last use.
     *
     * @param exclude credential ids already tried by the calling request
     * @throws PoolExhaustedException if no credential is eligible
     */
    public CredentialRecord select(Set<String> exclude) throws PoolExhaustedException {
        Set<String> excluded = exclude != null ? exclude : Set.of();
        lock.lock();
        try {
            Optional<CredentialRecord> selected = strategy.select(
                    records,
                    record -> record.isAvailable() && !excluded.contains(record.getId())
            );

            if (selected.isEmpty()) {
                log.warn("No eligible credential: strategy={}, registered={}, available={}, excluded={}",
                        strategy.getName(), records.size(), countAvailable(), excluded.size());
                throw new PoolExhaustedException(records.size(), excluded.size());
            }

            CredentialRecord record = selected.get();
            record.markUsed(nextStamp());

            log.debug("Credential selected: id={}, strategy={}, errors={}",
                    record.getId(), strategy.getName(), record.getErrorCount());
            return record;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears the error count and puts the credential back in rotation.
     */
    public void reportSuccess(String id) {
        lock.lock();
        try {
            CredentialRecord record = byId.get(id);
            if (record == null) {
                log.debug("Success reported for unknown credential: id={}", id);
                return;
            }
            boolean restored = !record.isAvailable();
            record.markSuccess();
            if (restored) {
                log.info("Credential restored: id={}, name={}", id, record.getDisplayName());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Counts one failure against the credential; the third consecutive failure
     * takes it out of rotation. Unknown ids are ignored.
     */
    public void reportFailure(String id) {
        lock.lock();
        try {
            CredentialRecord record = byId.get(id);
            if (record == null) {
                log.debug("Failure reported for unknown credential: id={}", id);
                return;
            }
            boolean wasAvailable = record.isAvailable();
            int errors = record.markFailure();
            if (wasAvailable && !record.isAvailable()) {
                log.warn("Credential disabled: id={}, name={}, errorCount={}",
                        id, record.getDisplayName(), errors);
            } else {
                log.info("Credential failure recorded: id={}, errorCount={}", id, errors);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Consistent copy of every credential's state, in registration order.
     */
    public List<CredentialSnapshot> status() {
        lock.lock();
        try {
            List<CredentialSnapshot> snapshot = new ArrayList<>(records.size());
            for (CredentialRecord record : records) {
                snapshot.add(record.snapshot());
            }
            return List.copyOf(snapshot);
        } finally {
            lock.unlock();
        }
    }

    public Optional<CredentialSnapshot> status(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(byId.get(id)).map(CredentialRecord::snapshot);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return records.size();
        } finally {
            lock.unlock();
        }
    }

    public int availableCount() {
        lock.lock();
        try {
            return countAvailable();
        } finally {
            lock.unlock();
        }
    }

    public SelectionStrategy getStrategy() {
        lock.lock();
        try {
            return strategy;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Switches the selection strategy. Safe to call while requests are in flight.
     */
    public void setStrategy(SelectionStrategy newStrategy) {
        Objects.requireNonNull(newStrategy, "Strategy is required");
        lock.lock();
        try {
            SelectionStrategy old = this.strategy;
            newStrategy.reset();
            this.strategy = newStrategy;
            log.info("Selection strategy changed: {} -> {}", old.getName(), newStrategy.getName());
        } finally {
            lock.unlock();
        }
    }

    private int countAvailable() {
        int count = 0;
        for (CredentialRecord record : records) {
            if (record.isAvailable()) {
                count++;
            }
        }
        return count;
    }

    // Selections within the same clock tick still get distinct, increasing stamps.
    private Instant nextStamp() {
        Instant now = clock.instant();
        if (!now.isAfter(lastStamp)) {
            now = lastStamp.plusNanos(1);
        }
        lastStamp = now;
        return now;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder that registers the configured credentials in order.
     * Building a pool with no credential is a configuration error.
     */
    public static final class Builder {
        private SelectionStrategy strategy = new RoundRobinStrategy();
        private Clock clock = Clock.systemUTC();
        private final List<SecretPair> secrets = new ArrayList<>();
        private final List<String> names = new ArrayList<>();

        public Builder strategy(SelectionStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder credential(SecretPair secretPair, String displayName) {
            secrets.add(secretPair);
            names.add(displayName);
            return this;
        }

        public Builder credential(SecretPair secretPair) {
            return credential(secretPair, null);
        }

        public CredentialPool build() {
            if (secrets.isEmpty()) {
                throw new ConfigurationException("No credentials configured; at least one secret pair is required");
            }
            CredentialPool pool = new CredentialPool(strategy, clock);
            for (int i = 0; i < secrets.size(); i++) {
                try {
                    pool.register(secrets.get(i), names.get(i));
                } catch (DuplicateCredentialException e) {
                    String name = names.get(i) != null ? names.get(i) : "#" + (i + 1);
                    throw new ConfigurationException("Duplicate credential '" + name
                            + "': same secret pair as " + e.getExistingId(), e);
                }
            }
            log.info("Credential pool built: credentials={}, strategy={}", pool.size(), strategy.getName());
            return pool;
        }
    }
}
