package fr.lapetina.chatgateway.domain.strategy;

import fr.lapetina.chatgateway.domain.pool.CredentialRecord;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Round-robin credential selection.
 *
 * Walks the full registration order from the cursor, skipping ineligible
 * credentials and wrapping around. After a pick the cursor moves just past
 * the chosen credential, so healthy credentials are visited in order.
 *
 * The cursor is guarded by the pool lock.
 */
public final class RoundRobinStrategy implements SelectionStrategy {

    private int cursor = 0;

    @Override
    public String getName() {
        return "round_robin";
    }

    @Override
    public Optional<CredentialRecord> select(List<CredentialRecord> records, Predicate<CredentialRecord> eligible) {
        if (records == null || records.isEmpty()) {
            return Optional.empty();
        }

        int size = records.size();
        int start = Math.floorMod(cursor, size);

        for (int i = 0; i < size; i++) {
            int index = (start + i) % size;
            CredentialRecord record = records.get(index);

            if (eligible.test(record)) {
                cursor = (index + 1) % size;
                return Optional.of(record);
            }
        }

        return Optional.empty();
    }

    @Override
    public void reset() {
        cursor = 0;
    }
}
