// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.compiler;

import htslc.form.Form;
import htslc.form.Forms;
import htslc.form.SpecialForm;
import htslc.util.condition.Condition;

/**
 * A condition type indicating that a special form was given the wrong number or the wrong kind of arguments.
 */
public final class MalformedSpecialFormCondition extends Condition {
    MalformedSpecialFormCondition(final SpecialForm form, final String problem, final Form.Vector received) {
        super("Malformed " + form.tag() + " special form: " + problem);
        this.form = form;
        this.received = received;
    }

    /**
     * Retrieves the special form that was malformed.
     */
    public SpecialForm form() {
        return form;
    }

    /**
     * Retrieves the offending special form node, as it was received.
     */
    public Form.Vector received() {
        return received;
    }

    @Override
    public String detailedMessage() {
        return message() + "\nExpected shape: " + form.expectedShape() + "\nReceived: " + Forms.prettyPrint(received);
    }

    private final SpecialForm form;
    private final Form.Vector received;
}
