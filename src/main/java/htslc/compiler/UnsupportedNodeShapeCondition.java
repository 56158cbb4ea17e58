// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.compiler;

import htslc.form.Form;
import htslc.form.Forms;
import htslc.util.condition.Condition;

/**
 * A condition type indicating that a form can't be compiled in the position it appears in: a vector that doesn't
 * start with an element token, an attribute value of an unsupported kind, or a child that isn't markup, text or
 * a dynamic reference.
 */
public final class UnsupportedNodeShapeCondition extends Condition {
    UnsupportedNodeShapeCondition(final String problem, final Form node) {
        super(problem + ": " + Forms.prettyPrint(node));
        this.node = node;
    }

    /**
     * Retrieves the offending node.
     */
    public Form node() {
        return node;
    }

    private final Form node;
}
