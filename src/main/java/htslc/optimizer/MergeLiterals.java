// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.optimizer;

import java.util.ArrayList;
import java.util.List;
import htslc.program.Instruction;

/**
 * Collapses every run of adjacent literal writes within a sequence into a single write of their concatenation.
 * <p>
 * Any other instruction ends the current run, so literal text never moves past dynamic content or control flow.
 * Empty literal writes disappear.
 */
public final class MergeLiterals extends RewritingPass {
    @Override
    protected Instruction rewriteSequence(final Instruction.Sequence sequence) {
        final var merged = new ArrayList<Instruction>(sequence.instructions().size());
        final var pending = new StringBuilder();
        for (final var instruction : sequence.instructions()) {
            if (instruction instanceof Instruction.WriteLiteral literal) {
                pending.append(literal.text());
            } else {
                flush(pending, merged);
                merged.add(instruction);
            }
        }
        flush(pending, merged);
        return new Instruction.Sequence(merged);
    }

    private static void flush(final StringBuilder pending, final List<Instruction> output) {
        if (pending.length() > 0) {
            output.add(new Instruction.WriteLiteral(pending.toString()));
            pending.setLength(0);
        }
    }
}
