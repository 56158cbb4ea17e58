// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.runtime;

/**
 * A pure text-to-HTML escaping function.
 * <p>
 * The same escaper is used at compile time for literal text and at render time for dynamic values, so both paths
 * produce identical output for identical text.
 */
@FunctionalInterface
public interface Escaper {
    /**
     * Returns the given text with every character that is significant in HTML replaced by an entity reference.
     */
    String escape(String text);

    /**
     * Returns the default HTML escaper.
     */
    static Escaper html() {
        return HtmlEscaper.instance();
    }
}
