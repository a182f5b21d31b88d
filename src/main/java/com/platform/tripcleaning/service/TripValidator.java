package com.platform.tripcleaning.service;

import com.platform.tripcleaning.domain.TripRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stateless rule evaluator. Drops every record that fails any enabled {@link ValidationRule}.
 */
public class TripValidator implements TripFilterStage {

    private static final Logger log = LoggerFactory.getLogger(TripValidator.class);

    private final ValidationSettings settings;
    private final List<ValidationRule> rules;

    public TripValidator(ValidationSettings settings) {
        this(settings, List.of(ValidationRule.values()));
    }

    TripValidator(ValidationSettings settings, List<ValidationRule> order) {
        this.settings = settings;
        List<ValidationRule> enabled = new ArrayList<>();
        for (ValidationRule rule : order) {
            if (!rule.isSanityRule() || settings.sanityRulesEnabled()) {
                enabled.add(rule);
            }
        }
        this.rules = List.copyOf(enabled);
    }

    public List<ValidationRule> getRules() {
        return rules;
    }

    /**
     * Evaluate one record. NaN in a numeric bound fails the bound's rule.
     */
    public ValidationOutcome validate(TripRecord trip) {
        for (ValidationRule rule : rules) {
            if (!rule.accepts(trip, settings)) {
                return ValidationOutcome.rejected(rule);
            }
        }
        return ValidationOutcome.ACCEPTED;
    }

    @Override
    public String name() {
        return "validation";
    }

    @Override
    public StageResult apply(List<TripRecord> input) {
        List<TripRecord> survivors = new ArrayList<>(input.size());
        Map<ValidationRule, Long> counts = new EnumMap<>(ValidationRule.class);

        for (TripRecord trip : input) {
            ValidationOutcome outcome = validate(trip);
            if (outcome.accepted()) {
                survivors.add(trip);
            } else {
                counts.merge(outcome.failedRule(), 1L, Long::sum);
            }
        }

        Map<String, Long> rejections = new LinkedHashMap<>();
        for (ValidationRule rule : rules) {
            long removed = counts.getOrDefault(rule, 0L);
            rejections.put(rule.reason(), removed);
            if (removed > 0) {
                log.info("Removed {} rows failing {}", removed, rule.reason());
            }
        }
        log.info("Validation kept {} of {} rows", survivors.size(), input.size());
        return new StageResult(name(), input.size(), survivors, rejections);
    }

    public record ValidationOutcome(boolean accepted, ValidationRule failedRule) {

        static final ValidationOutcome ACCEPTED = new ValidationOutcome(true, null);

        static ValidationOutcome rejected(ValidationRule rule) {
            return new ValidationOutcome(false, rule);
        }
    }
}
