// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Conditions wrapping Java exceptions, for signaling exceptions thrown by library code through the condition system.
 */
@NonNullByDefault
package htslc.util.condition.exception;

import htslc.util.annotation.NonNullByDefault;
