// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.runtime;

import htslc.util.condition.Condition;

/**
 * A condition type indicating that a compiled program could not be rendered, for example because an expression
 * referred to an unbound variable or a loop was given something that can't be iterated.
 */
public final class RenderErrorCondition extends Condition {
    public RenderErrorCondition(final String message) {
        super(message);
    }
}
