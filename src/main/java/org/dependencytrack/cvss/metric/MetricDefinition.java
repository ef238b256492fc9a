package org.dependencytrack.cvss.metric;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Definition of a single metric of a CVSS version.
 *
 * @param code                The code used in vectors, e.g. {@code AV}
 * @param name                Human-readable name, e.g. {@code Attack Vector}
 * @param group               The {@link MetricGroup} the metric belongs to
 * @param required            Whether the metric must be present in every vector
 * @param values              Legal values, in specification order
 * @param weights             Numeric weight per value; values without weight are absent
 * @param changedScopeWeights Weights to use instead of {@code weights} when scope is changed;
 *                            empty for metrics that do not depend on scope
 * @param modifies            For modified metrics, the code of the base metric they override
 */
public record MetricDefinition(
        String code,
        String name,
        MetricGroup group,
        boolean required,
        List<String> values,
        Map<String, Double> weights,
        Map<String, Double> changedScopeWeights,
        @Nullable String modifies) {

    /**
     * Value of an optional metric that has not been provided.
     */
    public static final String NOT_DEFINED = "X";

    public MetricDefinition {
        requireNonNull(code, "code must not be null");
        requireNonNull(name, "name must not be null");
        requireNonNull(group, "group must not be null");
        values = List.copyOf(values);
        weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
        changedScopeWeights = Collections.unmodifiableMap(new LinkedHashMap<>(changedScopeWeights));
        if (required && values.contains(NOT_DEFINED)) {
            throw new IllegalArgumentException("Required metric %s must not accept %s".formatted(code, NOT_DEFINED));
        }
        if (!required && !values.contains(NOT_DEFINED)) {
            throw new IllegalArgumentException("Optional metric %s must accept %s".formatted(code, NOT_DEFINED));
        }
    }

    public boolean isLegal(final String value) {
        return values.contains(value);
    }

    public boolean isModified() {
        return modifies != null;
    }

    public double weight(final String value) {
        final Double weight = weights.get(value);
        if (weight == null) {
            throw new IllegalStateException("No weight defined for %s:%s".formatted(code, value));
        }

        return weight;
    }

    public double weight(final String value, final boolean scopeChanged) {
        if (!scopeChanged || changedScopeWeights.isEmpty()) {
            return weight(value);
        }

        final Double weight = changedScopeWeights.get(value);
        if (weight == null) {
            throw new IllegalStateException("No changed-scope weight defined for %s:%s".formatted(code, value));
        }

        return weight;
    }

    static Builder builder(final String code, final String name, final MetricGroup group) {
        return new Builder(code, name, group);
    }

    static final class Builder {

        private final String code;
        private final String name;
        private final MetricGroup group;
        private final List<String> values = new ArrayList<>();
        private final Map<String, Double> weights = new LinkedHashMap<>();
        private final Map<String, Double> changedScopeWeights = new LinkedHashMap<>();
        private boolean required;
        private String modifies;

        private Builder(final String code, final String name, final MetricGroup group) {
            this.code = code;
            this.name = name;
            this.group = group;
        }

        Builder required() {
            this.required = true;
            return this;
        }

        Builder modifies(final String baseCode) {
            this.modifies = baseCode;
            return this;
        }

        Builder value(final String value) {
            values.add(value);
            return this;
        }

        Builder value(final String value, final double weight) {
            values.add(value);
            weights.put(value, weight);
            return this;
        }

        Builder value(final String value, final double weight, final double changedScopeWeight) {
            value(value, weight);
            changedScopeWeights.put(value, changedScopeWeight);
            return this;
        }

        MetricDefinition build() {
            return new MetricDefinition(code, name, group, required, values, weights, changedScopeWeights, modifies);
        }

    }

}
