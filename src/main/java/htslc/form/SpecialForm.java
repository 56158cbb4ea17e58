// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.form;

import java.util.HashMap;
import java.util.Map;
import htslc.util.annotation.Nullable;

/**
 * The reserved control-flow tags recognized in place of an element name.
 */
public enum SpecialForm {
    FRAGMENT("<>", "[<> properties? child...]"),
    FOR("for", "[for [variable iterable ...] body]"),
    IF("if", "[if test then else]"),
    WHEN("when", "[when test then]"),
    COND("cond", "[cond test expression ...] with an even number of forms after the tag");

    SpecialForm(final String tag, final String expectedShape) {
        this.tag = tag;
        this.expectedShape = expectedShape;
    }

    /**
     * Returns the special form with the given tag, or {@code null} if the tag isn't reserved.
     */
    public static @Nullable SpecialForm byTag(final String tag) {
        return byTag.get(tag);
    }

    /**
     * Retrieves the reserved keyword name of this special form.
     */
    public String tag() {
        return tag;
    }

    /**
     * Retrieves a user-readable description of the shape this special form requires.
     */
    public String expectedShape() {
        return expectedShape;
    }

    private final String tag;
    private final String expectedShape;

    private static final Map<String, SpecialForm> byTag = new HashMap<>();

    static {
        for (final var form : values()) {
            byTag.put(form.tag, form);
        }
    }
}
