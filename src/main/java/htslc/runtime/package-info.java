// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Render-time values: expressions, variable scopes and HTML escaping.
 */
@NonNullByDefault
package htslc.runtime;

import htslc.util.annotation.NonNullByDefault;
