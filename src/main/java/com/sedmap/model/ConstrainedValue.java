package com.sedmap.model;

import com.sedmap.exception.ConfigurationException;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * A value checked against optional bounds and an extra rule when it is set.
 * Used for the numeric options of the pipeline instead of one wrapper class per type.
 */
public final class ConstrainedValue<T extends Comparable<? super T>> {

    private final String name;
    private final T min;
    private final T max;
    private final Predicate<T> rule;
    private final String ruleMessage;
    private T value;

    private ConstrainedValue(String name, T initial, T min, T max, Predicate<T> rule, String ruleMessage) {
        this.name = name;
        this.min = min;
        this.max = max;
        this.rule = rule;
        this.ruleMessage = ruleMessage;
        set(initial);
    }

    public static <T extends Comparable<? super T>> ConstrainedValue<T> of(String name, T initial, T min, T max) {
        return new ConstrainedValue<>(name, initial, min, max, v -> true, null);
    }

    public static <T extends Comparable<? super T>> ConstrainedValue<T> atLeast(String name, T initial, T min) {
        return new ConstrainedValue<>(name, initial, min, null, v -> true, null);
    }

    /** Adds a rule on top of the bounds; {@code message} is reported when it fails. */
    public ConstrainedValue<T> withRule(Predicate<T> extraRule, String message) {
        return new ConstrainedValue<>(name, value, min, max, extraRule, message);
    }

    public T get() {
        return value;
    }

    public void set(T candidate) {
        if (candidate == null) {
            throw new ConfigurationException(name + " must not be null");
        }
        if (min != null && candidate.compareTo(min) < 0) {
            throw new ConfigurationException(name + " has value " + candidate + " but it must be larger than or equal to " + min);
        }
        if (max != null && candidate.compareTo(max) > 0) {
            throw new ConfigurationException(name + " has value " + candidate + " but it must be less than or equal to " + max);
        }
        if (!rule.test(candidate)) {
            throw new ConfigurationException(name + " has value " + candidate + ": " + ruleMessage);
        }
        this.value = candidate;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConstrainedValue)) return false;
        ConstrainedValue<?> other = (ConstrainedValue<?>) o;
        return name.equals(other.name) && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
