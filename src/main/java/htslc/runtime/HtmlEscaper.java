// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: GPL-3.0-or-later
package htslc.runtime;

import htslc.util.annotation.Nullable;

/**
 * The default {@link Escaper}, replacing {@code &}, {@code <}, {@code >}, {@code "} and {@code '}.
 * <p>
 * The result is safe both in text content and in quoted attribute values.
 */
public final class HtmlEscaper implements Escaper {
    private HtmlEscaper() {
    }

    /**
     * Returns the shared instance.
     */
    public static HtmlEscaper instance() {
        return instance;
    }

    @Override
    public String escape(final String text) {
        var indexToEscape = findCharacterToEscape(text, 0);
        if (indexToEscape < 0) {
            return text;
        }
        final var builder = new StringBuilder(text.length() + extraCapacity);
        int index = 0;
        while (indexToEscape >= 0) {
            builder.append(text, index, indexToEscape);
            builder.append(entityFor(text.charAt(indexToEscape)));
            index = indexToEscape + 1;
            indexToEscape = findCharacterToEscape(text, index);
        }
        builder.append(text, index, text.length());
        return builder.toString();
    }

    private static int findCharacterToEscape(final String text, final int startIndex) {
        final var length = text.length();
        for (int i = startIndex; i < length; i += 1) {
            if (entityFor(text.charAt(i)) != null) {
                return i;
            }
        }
        return -1;
    }

    private static @Nullable String entityFor(final char character) {
        return switch (character) {
            case '<' -> "&lt;";
            case '>' -> "&gt;";
            case '&' -> "&amp;";
            case '"' -> "&quot;";
            case '\'' -> "&#39;";
            default -> null;
        };
    }

    private static final int extraCapacity = 16;
    private static final HtmlEscaper instance = new HtmlEscaper();
}
