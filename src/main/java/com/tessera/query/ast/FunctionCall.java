package com.tessera.query.ast;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Function or aggregate call in a select list, e.g. {@code count(*)}.
 */
public final class FunctionCall implements Expression {

    private final String name;
    private final List<Expression> args;
    private final String alias;

    public FunctionCall(String name, List<Expression> args, String alias) {
        this.name = Objects.requireNonNull(name, "name").toLowerCase(Locale.ROOT);
        this.args = List.copyOf(args);
        this.alias = alias;
    }

    public String getName() {
        return name;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public String getAlias() {
        return alias;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionCall)) return false;
        FunctionCall that = (FunctionCall) o;
        return name.equals(that.name) && args.equals(that.args) && Objects.equals(alias, that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, args, alias);
    }

    @Override
    public String toString() {
        return name + "(" + args.stream().map(String::valueOf).collect(Collectors.joining(", ")) + ")";
    }
}
