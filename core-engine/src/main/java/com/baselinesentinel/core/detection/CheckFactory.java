package com.baselinesentinel.core.detection;

import com.baselinesentinel.core.config.CheckRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Creates {@link AnomalyCheck} instances from {@link CheckRule}
 * configurations.
 *
 * <p>
 * The check type and the presence of a code field together select the
 * implementation:
 * </p>
 * <table>
 * <caption>Check selection</caption>
 * <tr><th>type</th><th>codeField</th><th>check</th></tr>
 * <tr><td>baseline</td><td>set</td><td>{@link BaselineCheck}</td></tr>
 * <tr><td>baseline</td><td>absent</td><td>{@link GaugeBaselineCheck}</td></tr>
 * <tr><td>breach</td><td>set</td><td>{@link ErrorCategoryBreachCheck}</td></tr>
 * <tr><td>breach</td><td>absent</td><td>{@link SustainedBreachCheck}</td></tr>
 * <tr><td>bigkeys</td><td>ignored</td><td>{@link OversizedKeyCheck}</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class CheckFactory {

    private static final Logger LOG = LoggerFactory.getLogger(CheckFactory.class);

    private CheckFactory() {
    }

    /**
     * @param rule check configuration; must not be {@code null}
     * @return the check
     * @throws NullPointerException     if {@code rule} or its type is {@code null}
     * @throws IllegalArgumentException if the check type is unknown
     */
    public static AnomalyCheck create(CheckRule rule) {
        Objects.requireNonNull(rule, "CheckRule must not be null");
        Objects.requireNonNull(rule.getType(), "Check type must not be null");

        String type = rule.getType().toLowerCase(Locale.ROOT);
        return switch (type) {
            case CheckRule.TYPE_BASELINE -> rule.hasCodeField()
                    ? new BaselineCheck(rule)
                    : new GaugeBaselineCheck(rule);
            case CheckRule.TYPE_BREACH -> rule.hasCodeField()
                    ? new ErrorCategoryBreachCheck(rule)
                    : new SustainedBreachCheck(rule);
            case CheckRule.TYPE_BIGKEYS -> new OversizedKeyCheck(rule);
            default -> throw new IllegalArgumentException(
                    "Unknown check type: '" + rule.getType()
                            + "'. Supported types: baseline, breach, bigkeys");
        };
    }

    /**
     * @param rules check configurations; must not be {@code null}
     * @return unmodifiable list of checks, one per rule
     */
    public static List<AnomalyCheck> createAll(List<CheckRule> rules) {
        Objects.requireNonNull(rules, "Rules list must not be null");
        LOG.debug("Creating {} check(s) from configuration", rules.size());
        return Collections.unmodifiableList(rules.stream()
                .map(CheckFactory::create)
                .toList());
    }
}
