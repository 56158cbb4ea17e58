// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Compiled emission programs and their interpreter.
 */
@NonNullByDefault
package htslc.program;

import htslc.util.annotation.NonNullByDefault;
