// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.cli;

import java.io.PrintStream;
import htslc.util.Trace;
import htslc.util.condition.Condition;
import htslc.util.condition.ConditionContext;
import htslc.util.condition.HandlerProcedure;
import htslc.util.condition.SignaledCondition;
import htslc.util.condition.SuppressedExceptionCondition;

/**
 * The handler of last resort: reports the condition with the operation trace, then abandons the operation by
 * unwinding to the newest restart. Non-fatal conditions are reported and otherwise declined.
 */
final class FallbackHandler implements HandlerProcedure {
    FallbackHandler(final PrintStream out, final PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public void handle(final SignaledCondition condition) {
        if (!condition.isFatal()) {
            if (condition.condition() instanceof SuppressedExceptionCondition c) {
                try (final var streams = Streams.acquire(out, err)) {
                    showCondition(streams, c, "A condition");
                }
            }
            return;
        }
        try (final var streams = Streams.acquire(out, err)) {
            showCondition(streams, condition.condition(), "A fatal condition");
        }
        final var restarts = ConditionContext.restarts().iterator();
        if (restarts.hasNext()) {
            final var restart = restarts.next();
            try (final var streams = Streams.acquire(out, err)) {
                streams.err().println("Invoking restart " + restart.name());
            }
            restart.unwindTo();
        }
    }

    private static void showCondition(
        final Streams streams,
        final Condition condition,
        final String prefix
    ) {
        final var err = streams.err();
        err.println(prefix + " of type " + condition.getClass().getName() + " has been signaled.");
        err.println("\nDetailed message:");
        err.println(condition.detailedMessage().stripTrailing());
        err.println("\nOperation trace:");
        for (final var traceMessage : Trace.activeTraces()) {
            err.println(" - " + traceMessage);
        }
        err.println();
    }

    private final PrintStream out;
    private final PrintStream err;
}
