// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.runtime;

import htslc.util.annotation.Nullable;

/**
 * An opaque expression whose value is only known at render time.
 * <p>
 * Expressions are evaluated against the {@link Scope} of the current render, which holds the variables bound by
 * enclosing loops and by the caller. Implementations must not retain per-render state, since a compiled program is
 * shared by all renders.
 */
@FunctionalInterface
public interface Expression {
    /**
     * Evaluates this expression in the given scope.
     */
    @Nullable Object evaluate(Scope scope);

    /**
     * Returns an expression evaluating to the value of the named variable.
     */
    static Expression variable(final String name) {
        return new Variable(name);
    }

    /**
     * Returns an expression that always evaluates to the given value.
     */
    static Expression constant(final @Nullable Object value) {
        return new Constant(value);
    }

    /**
     * A reference to a variable of the render scope.
     */
    record Variable(String name) implements Expression {
        @Override
        public @Nullable Object evaluate(final Scope scope) {
            return scope.lookup(name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A value fixed at compile time.
     */
    record Constant(@Nullable Object value) implements Expression {
        @Override
        public @Nullable Object evaluate(final Scope scope) {
            return value;
        }

        @Override
        public String toString() {
            return "'" + value;
        }
    }
}
