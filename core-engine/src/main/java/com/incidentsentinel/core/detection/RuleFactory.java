package com.incidentsentinel.core.detection;

import com.incidentsentinel.core.model.MetricKind;
import com.incidentsentinel.core.model.RuleDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Factory that creates {@link IncidentRule} instances from
 * {@link RuleDefinition} configurations.
 *
 * <p>
 * This is the single point of extension when adding new rule types:
 * register the new type string here and create the corresponding rule.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleFactory {

    private static final Logger LOG = LoggerFactory.getLogger(RuleFactory.class);

    private RuleFactory() {
        // utility class - not instantiable
    }

    /**
     * Create a rule for the given definition.
     *
     * @param rule the rule configuration; must not be {@code null}
     * @return an appropriate {@link IncidentRule} instance
     * @throws NullPointerException     if {@code rule} or its type is {@code null}
     * @throws IllegalArgumentException if the rule type is unknown
     */
    public static IncidentRule create(RuleDefinition rule) {
        Objects.requireNonNull(rule, "RuleDefinition must not be null");
        Objects.requireNonNull(rule.getType(), "Rule type must not be null");

        MetricKind kind;
        try {
            kind = MetricKind.fromName(rule.getType());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown rule type: '" + rule.getType()
                    + "'. Supported types: cpu, memory, network", e);
        }
        return switch (kind) {
            case CPU -> new CpuUtilizationRule(rule);
            case MEMORY -> new AvailableMemoryRule(rule);
            case NETWORK -> new NetworkTrafficRule(rule);
        };
    }

    /**
     * Create rules for every definition in the supplied list.
     *
     * <p>
     * The returned list is <strong>unmodifiable</strong> and keeps the input
     * order.
     * </p>
     *
     * @param rules list of rule configurations; must not be {@code null}
     * @return unmodifiable list of rules (one per definition)
     * @throws NullPointerException if {@code rules} is {@code null}
     */
    public static List<IncidentRule> createAll(List<RuleDefinition> rules) {
        Objects.requireNonNull(rules, "Rules list must not be null");
        LOG.info("Creating {} incident rule(s) from configuration", rules.size());
        List<IncidentRule> created = rules.stream()
                .map(RuleFactory::create)
                .toList();
        return Collections.unmodifiableList(created);
    }
}
