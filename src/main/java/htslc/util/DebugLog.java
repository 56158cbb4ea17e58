// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.util;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import htslc.util.condition.ConditionContext;
import htslc.util.condition.MessageSupplier;
import htslc.util.condition.SuppressedExceptionCondition;
import org.jetbrains.annotations.NotNull;

/**
 * A sink for free-text compiler trace lines, such as the names, properties and child counts of compiled elements.
 * <p>
 * The debug log is purely observational: nothing written to it may affect compiled output, and failures to write it
 * are never fatal.
 */
@FunctionalInterface
public interface DebugLog {
    /**
     * Records the given <em>lazily evaluated</em> line. Disabled logs never call the supplier.
     */
    void log(@NotNull MessageSupplier line);

    /**
     * Returns a debug log that discards everything.
     */
    static @NotNull DebugLog disabled() {
        return Disabled.instance;
    }

    /**
     * Returns a debug log appending each line, terminated by a line feed, to the file at the given path.
     * <p>
     * I/O errors are signaled as non-fatal {@link SuppressedExceptionCondition}s and otherwise ignored.
     */
    static @NotNull DebugLog appendingTo(final @NotNull Path path) {
        return line -> ConditionContext.withSuppressedExceptions(() -> Files.writeString(
            path,
            line.get() + '\n',
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.APPEND
        ));
    }

    final class Disabled implements DebugLog {
        private Disabled() {
        }

        @Override
        public void log(final @NotNull MessageSupplier line) {
        }

        private static final Disabled instance = new Disabled();
    }
}
