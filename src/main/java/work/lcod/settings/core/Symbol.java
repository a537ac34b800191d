package work.lcod.settings.core;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Interned name token produced for {@code symbol} variables. Two symbols with the same name are the same instance.
 */
public final class Symbol implements Comparable<Symbol> {
    private static final ConcurrentMap<String, Symbol> TABLE = new ConcurrentHashMap<>();

    private final String name;

    private Symbol(String name) {
        this.name = name;
    }

    public static Symbol of(String name) {
        Objects.requireNonNull(name, "name");
        return TABLE.computeIfAbsent(name, Symbol::new);
    }

    public String name() {
        return name;
    }

    @Override
    public int compareTo(Symbol other) {
        return name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
