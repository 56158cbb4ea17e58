// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.form;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import htslc.util.annotation.Nullable;

/**
 * A compound element token, such as {@code div.main.row#hero}, split into its parts.
 *
 * @param name       The element name: everything before the first {@code .} or {@code #}. Empty if the token starts
 *                   with either.
 * @param classNames Every {@code .}-prefixed segment, in order, duplicates included.
 * @param id         The segment following the first {@code #}, up to the next {@code .}, or {@code null}.
 */
public record ElementToken(String name, List<String> classNames, @Nullable String id) {
    public ElementToken {
        classNames = List.copyOf(classNames);
    }

    /**
     * Classifies the given token. Never fails: malformed tokens produce empty names, no classes or no id.
     */
    public static ElementToken parse(final String token) {
        final var nameMatcher = namePattern.matcher(token);
        final var name = nameMatcher.find() ? nameMatcher.group(1) : "";

        final var classNames = new ArrayList<String>();
        final var classMatcher = classPattern.matcher(token);
        while (classMatcher.find()) {
            classNames.add(classMatcher.group(1));
        }

        final var idMatcher = idPattern.matcher(token);
        final var id = idMatcher.find() ? idMatcher.group(1) : null;
        return new ElementToken(name, classNames, id);
    }

    /**
     * Returns the class names joined with single spaces, as they appear in a {@code class} attribute, or
     * {@code null} if there are none.
     */
    public @Nullable String classAttribute() {
        return classNames.isEmpty() ? null : String.join(" ", classNames);
    }

    private static final Pattern namePattern = Pattern.compile("^([^.#]+)");
    private static final Pattern classPattern = Pattern.compile("\\.([^.#]+)");
    // A later '#' doesn't end the id, only a '.' does.
    private static final Pattern idPattern = Pattern.compile("#([^.]+)");
}
