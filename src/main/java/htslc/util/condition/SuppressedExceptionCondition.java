// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.util.condition;

/**
 * A non-fatal condition type indicating that an exception was caught and ignored, for example a failure to append to
 * the debug log.
 * <p>
 * Handlers are not allowed to unwind to a restart in response to this condition.
 */
public final class SuppressedExceptionCondition extends Condition {
    /**
     * Initializes a new suppressed exception condition indicating that the given exception was suppressed.
     */
    public SuppressedExceptionCondition(final Exception exception) {
        super("Suppressed exception: " + exception);
    }
}
