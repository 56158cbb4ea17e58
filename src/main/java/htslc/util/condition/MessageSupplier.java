// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.util.condition;

/**
 * A lazily-evaluated message, used by traces and the debug log.
 */
@FunctionalInterface
public interface MessageSupplier {
    String get();
}
