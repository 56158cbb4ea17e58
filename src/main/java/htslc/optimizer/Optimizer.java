// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.optimizer;

import java.util.List;
import htslc.program.Instruction;

/**
 * The instruction tree optimizer: an ordered list of passes, each applied once over the whole tree.
 * <p>
 * The optimizer never fails, and its result is a fixed point: optimizing an optimized tree returns an equal tree.
 */
public final class Optimizer {
    /**
     * Initializes a new optimizer running the given passes in order.
     */
    public Optimizer(final List<OptimizationPass> passes) {
        this.passes = List.copyOf(passes);
    }

    /**
     * Returns the optimizer running the standard passes: {@link FlattenSequences}, then {@link MergeLiterals}.
     */
    public static Optimizer standard() {
        return standard;
    }

    /**
     * Returns the optimized form of the given instruction tree.
     */
    public Instruction optimize(final Instruction instruction) {
        var result = instruction;
        for (final var pass : passes) {
            result = pass.apply(result);
        }
        return result;
    }

    private static final Optimizer standard = new Optimizer(List.of(new FlattenSequences(), new MergeLiterals()));

    private final List<OptimizationPass> passes;
}
