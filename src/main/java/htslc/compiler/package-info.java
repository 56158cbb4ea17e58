// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The HTSL compiler: turns element trees into instruction programs.
 */
@NonNullByDefault
package htslc.compiler;

import htslc.util.annotation.NonNullByDefault;
