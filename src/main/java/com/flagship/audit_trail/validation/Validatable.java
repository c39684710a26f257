package com.flagship.audit_trail.validation;

import java.time.Clock;
import java.util.List;

/**
 * Capability implemented by records that carry cross-field validation.
 *
 * Callers check for it with {@code instanceof} when validating attached
 * sub-records or collection elements.
 */
public interface Validatable {

    /**
     * Runs every rule and returns all violations (never fail-fast, never throws).
     *
     * @param clock source of "now" for temporal rules
     */
    List<ValidationViolation> validate(Clock clock);

    /**
     * Quick check for latency-sensitive paths. Uses the same predicates as
     * {@link #validate(Clock)} without building the violation list.
     */
    boolean isValid(Clock clock);

    default List<ValidationViolation> validate() {
        return validate(Clock.systemUTC());
    }

    default boolean isValid() {
        return isValid(Clock.systemUTC());
    }
}
