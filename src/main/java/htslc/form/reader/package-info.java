// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The reader of the textual HTSL syntax.
 */
@NonNullByDefault
package htslc.form.reader;

import htslc.util.annotation.NonNullByDefault;
