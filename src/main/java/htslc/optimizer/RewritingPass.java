// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.optimizer;

import java.util.ArrayList;
import htslc.program.Instruction;
import htslc.program.InstructionVisitor;

/**
 * Base class of passes that rewrite {@link Instruction.Sequence}s, applied bottom-up over the whole tree.
 * <p>
 * Every compound instruction is rebuilt from its rewritten children first, so by the time
 * {@link #rewriteSequence(Instruction.Sequence)} sees a sequence, its elements are already final.
 */
abstract class RewritingPass implements OptimizationPass, InstructionVisitor<Instruction> {
    @Override
    public final Instruction apply(final Instruction instruction) {
        return instruction.accept(this);
    }

    /**
     * Rewrites a sequence whose elements have already been rewritten.
     */
    protected abstract Instruction rewriteSequence(Instruction.Sequence sequence);

    @Override
    public final Instruction visitWriteLiteral(final Instruction.WriteLiteral instruction) {
        return instruction;
    }

    @Override
    public final Instruction visitWriteDynamic(final Instruction.WriteDynamic instruction) {
        return instruction;
    }

    @Override
    public final Instruction visitSequence(final Instruction.Sequence instruction) {
        final var children = new ArrayList<Instruction>(instruction.instructions().size());
        for (final var child : instruction.instructions()) {
            children.add(child.accept(this));
        }
        return rewriteSequence(new Instruction.Sequence(children));
    }

    @Override
    public final Instruction visitRepeat(final Instruction.Repeat instruction) {
        return new Instruction.Repeat(instruction.bindings(), instruction.body().accept(this));
    }

    @Override
    public final Instruction visitBranch(final Instruction.Branch instruction) {
        return new Instruction.Branch(
            instruction.condition(),
            instruction.then().accept(this),
            instruction.otherwise().accept(this)
        );
    }

    @Override
    public final Instruction visitGuard(final Instruction.Guard instruction) {
        return new Instruction.Guard(instruction.condition(), instruction.body().accept(this));
    }

    @Override
    public final Instruction visitMultiBranch(final Instruction.MultiBranch instruction) {
        final var clauses = new ArrayList<Instruction.Clause>(instruction.clauses().size());
        for (final var clause : instruction.clauses()) {
            clauses.add(new Instruction.Clause(clause.test(), clause.body().accept(this)));
        }
        return new Instruction.MultiBranch(clauses);
    }
}
