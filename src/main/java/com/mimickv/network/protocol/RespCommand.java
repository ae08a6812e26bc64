package com.mimickv.network.protocol;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable client request: a command name followed by its arguments.
 * The name is stored upper-cased so lookups are case-insensitive.
 */
public final class RespCommand {

    private final String name;
    private final List<String> args;

    public RespCommand(String name, List<String> args) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Command name cannot be null or empty");
        }
        this.name = name.toUpperCase(Locale.ROOT);
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    /**
     * Build a command from its wire parts, the first one being the name.
     */
    public static RespCommand of(List<String> parts) {
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Command needs at least a name");
        }
        return new RespCommand(parts.get(0), parts.subList(1, parts.size()));
    }

    public static RespCommand of(String... parts) {
        return of(Arrays.asList(parts));
    }

    public String getName() {
        return name;
    }

    public List<String> getArgs() {
        return args;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RespCommand that = (RespCommand) o;
        return name.equals(that.name) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, args);
    }

    @Override
    public String toString() {
        return "RespCommand{name=" + name + ", args=" + args.size() + '}';
    }
}
