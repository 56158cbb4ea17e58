// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.program;

/**
 * A visitor over the instruction variants, with one method per variant.
 *
 * @param <R> the result type of the visit
 */
public interface InstructionVisitor<R> {
    R visitWriteLiteral(Instruction.WriteLiteral instruction);

    R visitWriteDynamic(Instruction.WriteDynamic instruction);

    R visitSequence(Instruction.Sequence instruction);

    R visitRepeat(Instruction.Repeat instruction);

    R visitBranch(Instruction.Branch instruction);

    R visitGuard(Instruction.Guard instruction);

    R visitMultiBranch(Instruction.MultiBranch instruction);
}
