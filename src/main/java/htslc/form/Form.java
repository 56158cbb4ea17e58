// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.form;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import htslc.runtime.Expression;
import htslc.util.annotation.Nullable;

/**
 * Base type of HTSL element-tree forms.
 * <p>
 * Forms are guaranteed to be immutable. Which variants are valid depends on the position: a child of a markup node
 * must be a {@link Vector}, {@link Text}, {@link Symbol} or {@link Dynamic}; the other variants only appear as
 * element tokens, attribute values or special-form arguments.
 */
public sealed interface Form {
    /**
     * An element token such as {@code div.main#hero}, or a special-form tag such as {@code for}.
     */
    record Keyword(String name) implements Form {
    }

    /**
     * A bare symbol: a reference to a render-time variable, or the variable being bound in a {@code for} binding.
     */
    record Symbol(String name) implements Form {
    }

    /**
     * Static text, escaped once at compile time.
     */
    record Text(String value) implements Form {
    }

    /**
     * An integer literal.
     */
    record Integer(BigInteger value) implements Form {
    }

    /**
     * An ordered sequence of forms: a markup node when it starts with a {@link Keyword}, or the binding vector of
     * a {@code for} special form.
     * <p>
     * The optional {@code key} is out-of-band metadata giving the node a stable identity; it's never a child.
     */
    record Vector(List<Form> items, @Nullable Form key) implements Form {
        public Vector {
            items = List.copyOf(items);
        }

        /**
         * Initializes a new vector with no stable key.
         */
        public Vector(final List<Form> items) {
            this(items, null);
        }

        /**
         * Returns a copy of this vector with the given stable key.
         */
        public Vector withKey(final @Nullable Form newKey) {
            return new Vector(items, newKey);
        }

        /**
         * Returns the first item, or {@code null} if this vector is empty.
         */
        public @Nullable Form head() {
            return items.isEmpty() ? null : items.get(0);
        }

        /**
         * Returns every item except the first.
         */
        public List<Form> trailing() {
            return items.isEmpty() ? items : items.subList(1, items.size());
        }
    }

    /**
     * An ordered mapping from attribute names to attribute values.
     */
    record Properties(Map<String, Form> entries) implements Form {
        public Properties {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }
    }

    /**
     * An opaque expression, evaluated and escaped at render time.
     */
    record Dynamic(Expression expression) implements Form {
    }

    /**
     * The attribute value meaning "leave this attribute out entirely".
     */
    enum Omit implements Form {
        OMIT
    }
}
