// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Representation of HTSL element trees as Java objects, and the analyses of their shapes.
 */
@NonNullByDefault
package htslc.form;

import htslc.util.annotation.NonNullByDefault;
