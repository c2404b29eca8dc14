package com.tessera.query.local;

import java.util.regex.Pattern;

/**
 * SQL LIKE pattern compiled to a regular expression.
 *
 * {@code %} matches any sequence, {@code _} any single character; every other
 * character is literal. The pattern is anchored at both ends.
 */
public final class LikePattern {

    private final String sqlPattern;
    private final Pattern regex;

    private LikePattern(String sqlPattern) {
        this.sqlPattern = sqlPattern;
        this.regex = Pattern.compile(toRegex(sqlPattern), Pattern.DOTALL);
    }

    public static LikePattern compile(String sqlPattern) {
        if (sqlPattern == null) {
            throw new IllegalArgumentException("LIKE pattern must not be null");
        }
        return new LikePattern(sqlPattern);
    }

    public boolean matches(String value) {
        return value != null && regex.matcher(value).matches();
    }

    public String getSqlPattern() {
        return sqlPattern;
    }

    static String toRegex(String sqlPattern) {
        StringBuilder regex = new StringBuilder("^");
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < sqlPattern.length(); i++) {
            char c = sqlPattern.charAt(i);
            if (c == '%' || c == '_') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '%' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return regex.append("$").toString();
    }

    @Override
    public String toString() {
        return sqlPattern;
    }
}
