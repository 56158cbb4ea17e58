// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.form;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import htslc.runtime.Expression;
import htslc.util.UnreachableCodeReachedError;
import htslc.util.annotation.Nullable;

/**
 * A utility class for building element trees in Java code and for inspecting forms.
 * <p>
 * The builders don't validate anything: malformed trees are representable on purpose, and it's the compiler's job
 * to reject them.
 */
public final class Forms {
    private Forms() {
    }

    public static Form.Keyword keyword(final String name) {
        return new Form.Keyword(name);
    }

    public static Form.Symbol symbol(final String name) {
        return new Form.Symbol(name);
    }

    public static Form.Text text(final String value) {
        return new Form.Text(value);
    }

    public static Form.Integer integer(final long value) {
        return new Form.Integer(BigInteger.valueOf(value));
    }

    public static Form.Dynamic dynamic(final Expression expression) {
        return new Form.Dynamic(expression);
    }

    public static Form.Vector vector(final Form... items) {
        return new Form.Vector(Arrays.asList(items));
    }

    /**
     * Returns a markup node for the given element token, followed by the given items.
     */
    public static Form.Vector element(final String token, final Form... rest) {
        final var items = new ArrayList<Form>(rest.length + 1);
        items.add(keyword(token));
        items.addAll(Arrays.asList(rest));
        return new Form.Vector(items);
    }

    /**
     * Returns a property map built from alternating attribute names and values.
     *
     * @throws IllegalArgumentException If a name isn't a {@link String}, a value isn't a {@link Form}, or the number
     *                                  of arguments is odd.
     */
    public static Form.Properties properties(final Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Attribute names and values must come in pairs");
        }
        final var entries = new LinkedHashMap<String, Form>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            if (!(namesAndValues[i] instanceof String name) || !(namesAndValues[i + 1] instanceof Form value)) {
                throw new IllegalArgumentException("Expected an attribute name and a form at position " + i);
            }
            entries.put(name, value);
        }
        return new Form.Properties(entries);
    }

    public static Form.Vector fragment(final Form... rest) {
        return special(SpecialForm.FRAGMENT, rest);
    }

    /**
     * Returns a {@code for} special form. The bindings alternate variable symbols and iterable forms.
     */
    public static Form.Vector forEach(final Form.Vector bindings, final Form body) {
        return special(SpecialForm.FOR, bindings, body);
    }

    public static Form.Vector ifElse(final Form test, final Form then, final Form otherwise) {
        return special(SpecialForm.IF, test, then, otherwise);
    }

    public static Form.Vector when(final Form test, final Form then) {
        return special(SpecialForm.WHEN, test, then);
    }

    /**
     * Returns a {@code cond} special form from alternating tests and bodies.
     */
    public static Form.Vector cond(final Form... testsAndBodies) {
        return special(SpecialForm.COND, testsAndBodies);
    }

    /**
     * Returns a vector tagged with the given special form's keyword, followed by the given items.
     */
    public static Form.Vector special(final SpecialForm form, final Form... rest) {
        return element(form.tag(), rest);
    }

    /**
     * Returns the given form as a keyword, or {@code null} if it isn't one.
     */
    public static Form.@Nullable Keyword asKeyword(final @Nullable Form form) {
        return (form instanceof Form.Keyword keyword) ? keyword : null;
    }

    /**
     * Returns the given form as a vector, or {@code null} if it isn't one.
     */
    public static Form.@Nullable Vector asVector(final Form form) {
        return (form instanceof Form.Vector vector) ? vector : null;
    }

    /**
     * Prints the given form in the textual HTSL syntax, on a single line. Intended for error messages and debugging.
     */
    public static String prettyPrint(final Form form) {
        final var builder = new StringBuilder();
        append(builder, form);
        return builder.toString();
    }

    /**
     * Prints the given forms separated by spaces.
     */
    public static String prettyPrint(final List<Form> forms) {
        final var builder = new StringBuilder();
        appendAll(builder, forms);
        return builder.toString();
    }

    private static void append(final StringBuilder builder, final Form form) {
        if (form instanceof Form.Keyword keyword) {
            builder.append(':').append(keyword.name());
        } else if (form instanceof Form.Symbol symbol) {
            builder.append(symbol.name());
        } else if (form instanceof Form.Text text) {
            appendString(builder, text.value());
        } else if (form instanceof Form.Integer integer) {
            builder.append(integer.value());
        } else if (form instanceof Form.Vector vector) {
            final var key = vector.key();
            if (key != null) {
                builder.append("^{:key ");
                append(builder, key);
                builder.append("} ");
            }
            builder.append('[');
            appendAll(builder, vector.items());
            builder.append(']');
        } else if (form instanceof Form.Properties properties) {
            builder.append('{');
            var first = true;
            for (final var entry : properties.entries().entrySet()) {
                if (!first) {
                    builder.append(' ');
                }
                first = false;
                builder.append(':').append(entry.getKey()).append(' ');
                append(builder, entry.getValue());
            }
            builder.append('}');
        } else if (form instanceof Form.Dynamic dynamic) {
            builder.append("#<").append(dynamic.expression()).append('>');
        } else if (form == Form.Omit.OMIT) {
            builder.append(":htsl/omit");
        } else {
            throw new UnreachableCodeReachedError();
        }
    }

    private static void appendAll(final StringBuilder builder, final List<Form> forms) {
        var first = true;
        for (final var form : forms) {
            if (!first) {
                builder.append(' ');
            }
            first = false;
            append(builder, form);
        }
    }

    private static void appendString(final StringBuilder builder, final String string) {
        builder.append('"');
        builder.append(string.replace("\\", "\\\\").replace("\"", "\\\""));
        builder.append('"');
    }
}
