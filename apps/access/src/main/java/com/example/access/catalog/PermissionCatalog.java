package com.example.access.catalog;

import com.example.access.catalog.exception.UnknownPermissionException;
import com.example.access.catalog.model.PermissionCategory;
import com.example.access.catalog.model.PermissionCode;
import com.example.access.catalog.model.PermissionDefinition;
import com.example.access.catalog.model.RiskTier;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Registry of every permission code the system knows.
 *
 * <p>Registration happens at startup; lookups are lock-free afterwards. A code that is
 * not registered here never satisfies an authorization query.
 */
@Slf4j
public class PermissionCatalog {

    private final ConcurrentHashMap<PermissionCode, PermissionDefinition> definitions = new ConcurrentHashMap<>();

    public static PermissionCatalog of(Collection<PermissionDefinition> definitions) {
        PermissionCatalog catalog = new PermissionCatalog();
        definitions.forEach(catalog::register);
        return catalog;
    }

    public PermissionDefinition register(String code, String label, PermissionCategory category, RiskTier sensitivity) {
        return register(PermissionDefinition.of(code, label, category, sensitivity));
    }

    /**
     * Registers a definition. Re-registering an identical definition is a no-op.
     *
     * @throws IllegalStateException if the code is already registered with a different definition
     */
    public PermissionDefinition register(PermissionDefinition definition) {
        PermissionDefinition existing = definitions.putIfAbsent(definition.code(), definition);
        if (existing != null && !existing.equals(definition)) {
            throw new IllegalStateException("Permission '" + definition.code()
                    + "' is already registered with a different definition");
        }
        if (existing == null) {
            log.debug("Registered permission {} ({}, {})", definition.code(), definition.category(),
                    definition.sensitivity());
        }
        return definition;
    }

    public boolean exists(PermissionCode code) {
        return code != null && definitions.containsKey(code);
    }

    public boolean exists(String code) {
        return PermissionCode.parse(code).map(this::exists).orElse(false);
    }

    public Optional<PermissionDefinition> find(PermissionCode code) {
        return code == null ? Optional.empty() : Optional.ofNullable(definitions.get(code));
    }

    public PermissionDefinition require(PermissionCode code) {
        return find(code).orElseThrow(() -> new UnknownPermissionException(code == null ? null : code.value()));
    }

    public PermissionDefinition require(String code) {
        return PermissionCode.parse(code)
                .flatMap(this::find)
                .orElseThrow(() -> new UnknownPermissionException(code));
    }

    public RiskTier sensitivityOf(PermissionCode code) {
        return require(code).sensitivity();
    }

    public List<PermissionCode> listByCategory(PermissionCategory category) {
        return definitions.values().stream()
                .filter(definition -> definition.category() == category)
                .map(PermissionDefinition::code)
                .sorted()
                .toList();
    }

    public List<PermissionDefinition> all() {
        return definitions.values().stream()
                .sorted(Comparator.comparing(PermissionDefinition::code))
                .toList();
    }

    public Set<PermissionCode> codes() {
        return Set.copyOf(definitions.keySet());
    }

    public Map<PermissionCategory, List<PermissionDefinition>> grouped() {
        return all().stream()
                .collect(Collectors.groupingBy(
                        PermissionDefinition::category,
                        () -> new EnumMap<>(PermissionCategory.class),
                        Collectors.toList()));
    }

    public int size() {
        return definitions.size();
    }
}
