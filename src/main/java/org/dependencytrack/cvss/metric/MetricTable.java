package org.dependencytrack.cvss.metric;

import org.dependencytrack.cvss.api.Version;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Read-only metric definitions and weights of a single CVSS {@link Version}.
 * <p>
 * Definitions are kept in canonical vector order: base, temporal / threat,
 * environmental, then supplemental metrics.
 */
public final class MetricTable {

    private final Version version;
    private final List<MetricDefinition> definitions;
    private final Map<String, MetricDefinition> definitionByCode;

    MetricTable(final Version version, final List<MetricDefinition> definitions) {
        this.version = requireNonNull(version, "version must not be null");
        this.definitions = List.copyOf(definitions);

        final var definitionByCode = new LinkedHashMap<String, MetricDefinition>(definitions.size());
        MetricGroup previousGroup = MetricGroup.BASE;
        for (final MetricDefinition definition : this.definitions) {
            if (definition.group().compareTo(previousGroup) < 0) {
                throw new IllegalArgumentException(
                        "Metric %s of group %s is out of canonical order".formatted(definition.code(), definition.group()));
            }
            if (definitionByCode.put(definition.code(), definition) != null) {
                throw new IllegalArgumentException("Duplicate definition of metric " + definition.code());
            }
            previousGroup = definition.group();
        }
        for (final MetricDefinition definition : this.definitions) {
            if (definition.isModified() && !definitionByCode.containsKey(definition.modifies())) {
                throw new IllegalArgumentException("Metric %s modifies unknown metric %s".formatted(
                        definition.code(), definition.modifies()));
            }
        }
        this.definitionByCode = Map.copyOf(definitionByCode);
    }

    public static MetricTable forVersion(final Version version) {
        return switch (version) {
            case V3_1 -> Cvss31Metrics.TABLE;
            case V4_0 -> Cvss40Metrics.TABLE;
        };
    }

    public Version version() {
        return version;
    }

    public List<MetricDefinition> definitions() {
        return definitions;
    }

    public List<MetricDefinition> definitions(final MetricGroup group) {
        return definitions.stream()
                .filter(definition -> definition.group() == group)
                .toList();
    }

    public Optional<MetricDefinition> definition(final String code) {
        return Optional.ofNullable(definitionByCode.get(code));
    }

    /**
     * @throws IllegalArgumentException When no metric with the given code exists
     */
    public MetricDefinition require(final String code) {
        return definition(code).orElseThrow(() -> new IllegalArgumentException(
                "Metric %s is not defined for CVSS %s".formatted(code, version.number())));
    }

    public double weight(final String code, final String value) {
        return require(code).weight(value);
    }

}
