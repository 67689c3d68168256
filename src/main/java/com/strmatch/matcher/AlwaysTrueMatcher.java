package com.strmatch.matcher;

/**
 * Matcher that always matches.
 * Used as default/catch-all rule in a classifier.
 */
public final class AlwaysTrueMatcher implements Matcher {

    public static final AlwaysTrueMatcher INSTANCE = new AlwaysTrueMatcher();

    private AlwaysTrueMatcher() {}

    @Override
    public boolean match(CharSequence input) {
        return true;
    }

    @Override
    public MatcherType getType() {
        return MatcherType.ALWAYS_TRUE;
    }

    @Override
    public void print(StringBuilder out) {
        out.append("always_true");
    }

    @Override
    public String toString() {
        return "always_true";
    }
}
