package fr.lapetina.chatgateway.domain.strategy;

import fr.lapetina.chatgateway.domain.pool.CredentialRecord;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Least-recently-used credential selection.
 *
 * Picks the eligible credential whose last use is oldest; never-used
 * credentials come first. Ties go to the lower error count, then to the
 * earlier registration.
 */
public final class LeastUsedStrategy implements SelectionStrategy {

    private static final Comparator<CredentialRecord> ORDER =
            Comparator.comparing(CredentialRecord::getLastUsed)
                    .thenComparingInt(CredentialRecord::getErrorCount)
                    .thenComparingInt(CredentialRecord::getPosition);

    @Override
    public String getName() {
        return "least_used";
    }

    @Override
    public Optional<CredentialRecord> select(List<CredentialRecord> records, Predicate<CredentialRecord> eligible) {
        if (records == null || records.isEmpty()) {
            return Optional.empty();
        }

        return records.stream()
                .filter(eligible)
                .min(ORDER);
    }
}
