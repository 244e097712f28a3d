package com.bulkvalidate.engine;

/**
 * A single check applied to a record. Implementations must be pure: no I/O, no shared state,
 * same answer for the same input.
 */
@FunctionalInterface
public interface ValidationRule {

    /** @return the failure message, or {@code null} when the record passes this rule */
    String check(CustomerRecord record);
}
