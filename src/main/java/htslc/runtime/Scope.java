// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.runtime;

import java.util.Map;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import htslc.util.annotation.Nullable;
import htslc.util.condition.ConditionContext;

/**
 * An immutable set of variable bindings visible to expressions during a render.
 * <p>
 * Binding a variable returns a new scope that shadows any earlier binding of the same name; the original scope is
 * left untouched, so a scope can be shared between concurrent renders.
 */
public final class Scope {
    private Scope(final @Nullable Scope parent, final @Nullable String name, final @Nullable Object value) {
        this.parent = parent;
        this.name = name;
        this.value = value;
    }

    /**
     * Returns the scope with no variables bound.
     */
    public static Scope empty() {
        return empty;
    }

    /**
     * Returns a scope binding every entry of the given map, in its iteration order.
     */
    public static Scope of(final Map<String, ?> variables) {
        var scope = empty;
        for (final var entry : variables.entrySet()) {
            scope = scope.bind(entry.getKey(), entry.getValue());
        }
        return scope;
    }

    /**
     * Returns a new scope with the given variable bound to the given value.
     */
    @CheckReturnValue
    public Scope bind(final String variable, final @Nullable Object newValue) {
        return new Scope(this, variable, newValue);
    }

    /**
     * Returns the value of the given variable.
     * <p>
     * If the variable isn't bound, a fatal {@link RenderErrorCondition} is signaled.
     */
    public @Nullable Object lookup(final String variable) {
        final var binding = find(variable);
        if (binding == null) {
            throw ConditionContext.error(new RenderErrorCondition("Unbound variable " + variable));
        }
        return binding.value;
    }

    private @Nullable Scope find(final String variable) {
        for (var scope = this; scope != null; scope = scope.parent) {
            if (variable.equals(scope.name)) {
                return scope;
            }
        }
        return null;
    }

    private static final Scope empty = new Scope(null, null, null);

    private final @Nullable Scope parent;
    // Null only for the empty scope.
    private final @Nullable String name;
    private final @Nullable Object value;
}
