// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Peephole optimization of instruction trees.
 */
@NonNullByDefault
package htslc.optimizer;

import htslc.util.annotation.NonNullByDefault;
