// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The body executed under a restart point; receives the restart so it can unwind to it directly.
 */
@FunctionalInterface
public interface RestartCallback<T> {
    T call(@NotNull Restart restart) throws Unwind;
}
