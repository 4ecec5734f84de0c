package fr.lapetina.chatgateway.domain.strategy;

import fr.lapetina.chatgateway.domain.pool.CredentialRecord;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Random credential selection.
 *
 * Uniform choice among eligible credentials.
 *
 * Thread-safe via ThreadLocalRandom.
 */
public final class RandomStrategy implements SelectionStrategy {

    @Override
    public String getName() {
        return "random";
    }

    @Override
    public Optional<CredentialRecord> select(List<CredentialRecord> records, Predicate<CredentialRecord> eligible) {
        if (records == null || records.isEmpty()) {
            return Optional.empty();
        }

        List<CredentialRecord> candidates = records.stream()
                .filter(eligible)
                .collect(Collectors.toList());

        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        int index = ThreadLocalRandom.current().nextInt(candidates.size());
        return Optional.of(candidates.get(index));
    }
}
