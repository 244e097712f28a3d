package com.bulkvalidate.engine;

import java.util.List;
import java.util.Objects;

/**
 * Runs an ordered list of rules against a record. The first rule that reports a failure decides
 * the verdict; later rules are not evaluated.
 */
public class CustomerValidator {
    private final List<ValidationRule> rules;

    public CustomerValidator(List<ValidationRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    public static CustomerValidator standard(PoolConfig cfg) {
        return new CustomerValidator(Rules.standard(cfg));
    }

    public Verdict validate(CustomerRecord record) {
        for (ValidationRule rule : rules) {
            String failure = rule.check(record);
            if (failure != null) {
                return Verdict.invalid(failure);
            }
        }
        return Verdict.valid();
    }
}
