package io.medpack.integrator.resolve;

import io.medpack.integrator.model.EntityKind;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Maps the ids packages authored to the canonical ids of the merged graph.
 *
 * <p>A reference is looked up first as an id of the referencing package, then as a canonical id,
 * then as an explicitly qualified {@code tag:id}. Anything else is returned unchanged so that
 * validation can report it.</p>
 */
public final class CanonicalIdIndex {

    private final Map<EntityKind, Map<String, String>> byQualifiedId = new EnumMap<>(EntityKind.class);
    private final Map<EntityKind, Set<String>> canonicalIds = new EnumMap<>(EntityKind.class);

    CanonicalIdIndex() {
        for (EntityKind kind : EntityKind.values()) {
            byQualifiedId.put(kind, new TreeMap<>());
            canonicalIds.put(kind, new TreeSet<>());
        }
    }

    void register(EntityKind kind, String qualifiedId, String canonicalId) {
        byQualifiedId.get(kind).put(qualifiedId, canonicalId);
        canonicalIds.get(kind).add(canonicalId);
    }

    /**
     * Resolves a reference made by an entity of the given package.
     *
     * @param kind       kind of the referenced entity
     * @param packageTag package of the referencing entity (may be null)
     * @param reference  id as authored
     * @return canonical id, or the reference unchanged when nothing matches
     */
    @NotNull
    public String resolve(@NotNull EntityKind kind, @Nullable String packageTag, @NotNull String reference) {
        Map<String, String> qualified = byQualifiedId.get(kind);
        if (packageTag != null) {
            String local = qualified.get(Candidate.qualify(packageTag, reference));
            if (local != null) {
                return local;
            }
        }
        if (canonicalIds.get(kind).contains(reference)) {
            return reference;
        }
        String explicit = qualified.get(reference);
        return explicit != null ? explicit : reference;
    }

    /**
     * Qualified id to canonical id for one kind.
     */
    @NotNull
    public Map<String, String> mappings(@NotNull EntityKind kind) {
        return Collections.unmodifiableMap(byQualifiedId.get(kind));
    }
}
