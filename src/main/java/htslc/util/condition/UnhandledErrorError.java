// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The error type thrown when no handler performed a non-local control flow transfer in response to
 * {@link ConditionContext#error(Condition)}.
 * <p>
 * Library callers that don't establish handlers of their own see every compile error as this type, so the condition
 * is kept available through {@link #condition()}.
 */
public final class UnhandledErrorError extends AssertionError {
    UnhandledErrorError(final @NotNull Condition condition) {
        super("Fatal condition signaled, but no condition handler unwound; condition: " + condition);
        this.condition = condition;
    }

    /**
     * Retrieves the fatal condition no handler took care of.
     */
    public @NotNull Condition condition() {
        return condition;
    }

    private final transient @NotNull Condition condition;
}
