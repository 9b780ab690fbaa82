package org.asymptote.analyzer.analysis;

import java.util.Locale;
import java.util.Set;

/**
 * Procedures the dialect provides without a declaration. All of them cost constant time.
 */
public final class BuiltIns {

    private static final Set<String> NAMES = Set.of(
            "swap", "print", "write", "read", "length", "min", "max", "abs",
            "floor", "ceil", "sqrt", "log", "random", "exchange", "intercambiar");

    private BuiltIns() {
    }

    public static boolean isBuiltIn(String name) {
        return name != null && NAMES.contains(name.toLowerCase(Locale.ROOT));
    }
}
