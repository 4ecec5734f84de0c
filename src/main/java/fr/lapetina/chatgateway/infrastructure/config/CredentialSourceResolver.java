package fr.lapetina.chatgateway.infrastructure.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Resolves the credentials to register from environment variables.
 *
 * Three sources are supported, tried from the most structured to the simplest;
 * the first one that yields at least one valid credential wins entirely:
 * <ol>
 *   <li>{@code CREDENTIALS_JSON}: a JSON array of
 *       {@code {"secret_primary", "secret_secondary", "name"}} objects</li>
 *   <li>{@code CREDENTIAL_<i>_PRIMARY}, {@code CREDENTIAL_<i>_SECONDARY},
 *       {@code CREDENTIAL_<i>_NAME} for {@code i} in 1..10, gaps allowed</li>
 *   <li>{@code CREDENTIAL_PRIMARY} and {@code CREDENTIAL_SECONDARY}</li>
 * </ol>
 */
public final class CredentialSourceResolver {

    private static final Logger log = LoggerFactory.getLogger(CredentialSourceResolver.class);

    static final String JSON_VARIABLE = "CREDENTIALS_JSON";
    static final String INDEXED_PREFIX = "CREDENTIAL_";
    static final String LEGACY_PRIMARY = "CREDENTIAL_PRIMARY";
    static final String LEGACY_SECONDARY = "CREDENTIAL_SECONDARY";
    static final String LEGACY_NAME = "Primary Account";
    static final int MAX_INDEXED = 10;

    private final Function<String, String> env;
    private final ObjectMapper objectMapper;

    public CredentialSourceResolver(Function<String, String> env, ObjectMapper objectMapper) {
        this.env = Objects.requireNonNull(env, "Environment lookup is required");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper is required");
    }

    public CredentialSourceResolver(Function<String, String> env) {
        this(env, new ObjectMapper());
    }

    public CredentialSourceResolver() {
        this(System::getenv);
    }

    /**
     * @return the credentials of the winning source, or an empty list if no source is set
     */
    public List<CredentialEntry> resolve() {
        List<CredentialEntry> entries = fromJson();
        if (!entries.isEmpty()) {
            log.info("Credentials loaded: source={}, count={}", JSON_VARIABLE, entries.size());
            return entries;
        }

        entries = fromIndexed();
        if (!entries.isEmpty()) {
            log.info("Credentials loaded: source=indexed, count={}", entries.size());
            return entries;
        }

        entries = fromLegacy();
        if (!entries.isEmpty()) {
            log.info("Credentials loaded: source=legacy, count={}", entries.size());
            return entries;
        }

        log.warn("No credentials found in environment");
        return List.of();
    }

    List<CredentialEntry> fromJson() {
        String raw = env.apply(JSON_VARIABLE);
        if (isBlank(raw)) {
            return List.of();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            // Parser messages quote the offending token, which may be a secret
            log.error("Ignoring malformed {}: line={}, column={}", JSON_VARIABLE,
                    e.getLocation() != null ? e.getLocation().getLineNr() : -1,
                    e.getLocation() != null ? e.getLocation().getColumnNr() : -1);
            return List.of();
        }
        if (root == null || !root.isArray()) {
            log.error("Ignoring {}: expected a JSON array", JSON_VARIABLE);
            return List.of();
        }

        List<CredentialEntry> entries = new ArrayList<>();
        int position = 0;
        for (JsonNode node : root) {
            position++;
            String primary = node.path("secret_primary").asText(null);
            if (isBlank(primary)) {
                log.warn("Skipping {} entry {}: missing secret_primary", JSON_VARIABLE, position);
                continue;
            }
            String secondary = node.path("secret_secondary").asText("");
            String name = node.path("name").asText(null);
            entries.add(CredentialEntry.of(primary, secondary, isBlank(name) ? "Account-" + position : name));
        }
        return entries;
    }

    List<CredentialEntry> fromIndexed() {
        List<CredentialEntry> entries = new ArrayList<>();
        for (int i = 1; i <= MAX_INDEXED; i++) {
            String primary = env.apply(INDEXED_PREFIX + i + "_PRIMARY");
            if (isBlank(primary)) {
                continue;
            }
            String secondary = env.apply(INDEXED_PREFIX + i + "_SECONDARY");
            String name = env.apply(INDEXED_PREFIX + i + "_NAME");
            entries.add(CredentialEntry.of(primary, secondary, isBlank(name) ? "Account-" + i : name));
        }
        return entries;
    }

    List<CredentialEntry> fromLegacy() {
        String primary = env.apply(LEGACY_PRIMARY);
        if (isBlank(primary)) {
            return List.of();
        }
        return List.of(CredentialEntry.of(primary, env.apply(LEGACY_SECONDARY), LEGACY_NAME));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
