// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.optimizer;

import htslc.program.Instruction;

/**
 * A single rewrite of an instruction tree.
 * <p>
 * Passes must be total and must preserve output: executing the rewritten tree against any sink writes exactly what
 * executing the original tree would have.
 */
@FunctionalInterface
public interface OptimizationPass {
    Instruction apply(Instruction instruction);
}
