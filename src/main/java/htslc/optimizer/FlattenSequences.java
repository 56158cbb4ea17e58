// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.optimizer;

import java.util.ArrayList;
import htslc.program.Instruction;

/**
 * Splices nested sequences into their parent: {@code seq(a, seq(b), seq(c), d)} becomes {@code seq(a, b, c, d)}.
 * <p>
 * Literal merging only looks at siblings within one sequence, so this pass runs first to put as many literal writes
 * next to each other as possible. Only sequences directly inside sequences are spliced; the body of a loop or
 * a branch stays a separate sequence.
 */
public final class FlattenSequences extends RewritingPass {
    @Override
    protected Instruction rewriteSequence(final Instruction.Sequence sequence) {
        final var flattened = new ArrayList<Instruction>(sequence.instructions().size());
        for (final var instruction : sequence.instructions()) {
            // Nested sequences have been flattened already, one level of splicing is enough.
            if (instruction instanceof Instruction.Sequence nested) {
                flattened.addAll(nested.instructions());
            } else {
                flattened.add(instruction);
            }
        }
        return new Instruction.Sequence(flattened);
    }
}
