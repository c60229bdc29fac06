package org.themecheck.checks;

import org.themecheck.checks.rules.BlockIdUsage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, ordered set of check definitions. The registration order breaks ties when offenses of
 * different checks start at the same offset.
 */
public final class CheckRegistry {

    private final List<ICheckDefinition> checks;
    private final Map<String, Integer> order;

    private CheckRegistry(List<ICheckDefinition> checks) {
        this.checks = Collections.unmodifiableList(checks);
        Map<String, Integer> indices = new HashMap<>();
        for (int i = 0; i < checks.size(); i++) {
            indices.put(checks.get(i).meta().code(), i);
        }
        this.order = indices;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a registry with the built-in checks.
     * @return A fully initialized registry.
     */
    public static CheckRegistry initializeWithDefaults() {
        return builder()
                .register(new BlockIdUsage())
                .build();
    }

    /**
     * @return The checks in registration order.
     */
    public List<ICheckDefinition> checks() {
        return checks;
    }

    public Optional<ICheckDefinition> find(String code) {
        Integer index = order.get(code);
        return index == null ? Optional.empty() : Optional.of(checks.get(index));
    }

    /**
     * Returns the registration index of a check code. Codes not belonging to a registered check
     * (syntax errors, broken references) sort after all checks.
     */
    public int orderOf(String code) {
        return order.getOrDefault(code, Integer.MAX_VALUE);
    }

    public static final class Builder {
        private final List<ICheckDefinition> checks = new ArrayList<>();

        /**
         * @throws IllegalArgumentException if a check with the same code is already registered.
         */
        public Builder register(ICheckDefinition check) {
            String code = check.meta().code();
            for (ICheckDefinition existing : checks) {
                if (existing.meta().code().equals(code)) {
                    throw new IllegalArgumentException("Duplicate check code: " + code);
                }
            }
            checks.add(check);
            return this;
        }

        public CheckRegistry build() {
            return new CheckRegistry(new ArrayList<>(checks));
        }
    }
}
