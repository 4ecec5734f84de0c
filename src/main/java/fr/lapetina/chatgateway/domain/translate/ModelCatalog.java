package fr.lapetina.chatgateway.domain.translate;

import fr.lapetina.chatgateway.domain.model.ModelDescriptor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Table of client-facing model aliases and the upstream models they map to.
 * Immutable once built; listing order is insertion order.
 */
public final class ModelCatalog {

    private static final List<ModelDescriptor> BUILT_IN = List.of(
            new ModelDescriptor("gemini-2.5-pro", "gemini-2.5-pro", "pro", false),
            new ModelDescriptor("gemini-2.5-flash", "gemini-2.5-flash", "standard", false),
            new ModelDescriptor("gemini-2.0-flash", "gemini-2.0-flash", "standard", false),
            new ModelDescriptor("gemini-2.0-flash-thinking", "gemini-2.0-flash-thinking", "standard", false),
            new ModelDescriptor("gemini-2.5-exp-advanced", "gemini-2.5-exp-advanced", "advanced", false),
            new ModelDescriptor("gemini-2.0-exp-advanced", "gemini-2.0-exp-advanced", "advanced", true)
    );

    private final Map<String, ModelDescriptor> byAlias;

    public ModelCatalog(Collection<ModelDescriptor> descriptors) {
        Map<String, ModelDescriptor> map = new LinkedHashMap<>();
        for (ModelDescriptor descriptor : descriptors) {
            if (map.putIfAbsent(descriptor.alias(), descriptor) != null) {
                throw new IllegalArgumentException("Duplicate model alias: " + descriptor.alias());
            }
        }
        this.byAlias = map;
    }

    /**
     * The catalog shipped with the gateway.
     */
    public static ModelCatalog defaults() {
        return new ModelCatalog(BUILT_IN);
    }

    /**
     * Resolves an alias.
     *
     * @throws UnknownModelException if the alias is not in the catalog
     */
    public ModelDescriptor resolve(String alias) {
        ModelDescriptor descriptor = alias == null ? null : byAlias.get(alias);
        if (descriptor == null) {
            throw new UnknownModelException(alias, aliases());
        }
        return descriptor;
    }

    public Optional<ModelDescriptor> find(String alias) {
        return Optional.ofNullable(alias == null ? null : byAlias.get(alias));
    }

    public boolean contains(String alias) {
        return alias != null && byAlias.containsKey(alias);
    }

    public List<ModelDescriptor> list() {
        return List.copyOf(byAlias.values());
    }

    public List<String> aliases() {
        return new ArrayList<>(byAlias.keySet());
    }

    public int size() {
        return byAlias.size();
    }
}
