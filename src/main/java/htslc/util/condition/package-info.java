// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Common Lisp-inspired condition and restart system, used to report compile-time and render-time errors.
 */
@NonNullByDefault
package htslc.util.condition;

import htslc.util.annotation.NonNullByDefault;
