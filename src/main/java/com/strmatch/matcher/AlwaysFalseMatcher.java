package com.strmatch.matcher;

/**
 * Matcher that never matches.
 */
public final class AlwaysFalseMatcher implements Matcher {

    public static final AlwaysFalseMatcher INSTANCE = new AlwaysFalseMatcher();

    private AlwaysFalseMatcher() {}

    @Override
    public boolean match(CharSequence input) {
        return false;
    }

    @Override
    public MatcherType getType() {
        return MatcherType.ALWAYS_FALSE;
    }

    @Override
    public void print(StringBuilder out) {
        out.append("always_false");
    }

    @Override
    public String toString() {
        return "always_false";
    }
}
