// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Throwable type used internally by the restart mechanism for transferring control flow to a given restart point.
 * <p>
 * Exposed so that functions can be marked as throwing {@code Unwind}; catching or throwing it manually is strongly
 * discouraged. It extends {@link Throwable} directly, since it's neither an exceptional situation nor an error.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final @NotNull Restart target) {
        super("Unwinding to a restart point", null, false, false);
        this.target = target;
    }

    @NotNull Restart target() {
        return target;
    }

    private final transient @NotNull Restart target;
}
