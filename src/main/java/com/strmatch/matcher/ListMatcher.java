package com.strmatch.matcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Matcher that checks if the input is equal to any of the stored strings.
 * <p>
 * Values keep their insertion order (used for printing only) and may repeat.
 * {@link #add(String)} is the only mutating operation on any matcher; it is not
 * thread-safe and must not run concurrently with {@link #match(CharSequence)}.
 * <p>
 * {@link #equals(Object)} and {@link #hashCode()} follow the current contents
 * in order, so two lists with the same members in a different order are not
 * equal even though they match the same strings, and the hash code changes
 * after {@link #add(String)}. Do not keep a list matcher (or a
 * {@link StringMatcher} holding one) in a hash-based collection while adding
 * values to it.
 */
public final class ListMatcher implements Matcher {

    private final List<String> values;

    public ListMatcher() {
        this.values = new ArrayList<>();
    }

    public ListMatcher(List<String> values) {
        Objects.requireNonNull(values, "values");
        this.values = new ArrayList<>(values.size());
        for (String value : values) {
            add(value);
        }
    }

    /**
     * Append a value to the list.
     *
     * @param value Value to add
     * @return this list, for chaining
     */
    public ListMatcher add(String value) {
        values.add(Objects.requireNonNull(value, "value"));
        return this;
    }

    @Override
    public boolean match(CharSequence input) {
        for (String value : values) {
            if (value.contentEquals(input)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Get a read-only view of the values.
     */
    public List<String> getValues() {
        return Collections.unmodifiableList(values);
    }

    @Override
    public MatcherType getType() {
        return MatcherType.LIST;
    }

    @Override
    public void print(StringBuilder out) {
        out.append("list[");
        for (String value : values) {
            out.append('[').append(value).append(']');
        }
        out.append(']');
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ListMatcher other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(MatcherType.LIST, values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        print(sb);
        return sb.toString();
    }
}
