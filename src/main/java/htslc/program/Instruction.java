// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.program;

import java.util.List;
import htslc.runtime.Expression;

/**
 * Base type of emission instructions, the intermediate representation produced by the compiler.
 * <p>
 * Instructions are guaranteed to be immutable, and two instruction trees are equal iff they have the same shape and
 * equal texts and expressions.
 */
public sealed interface Instruction {
    /**
     * Dispatches to the visitor method for this instruction's variant.
     */
    <R> R accept(InstructionVisitor<R> visitor);

    /**
     * Writes text that was already escaped at compile time.
     */
    record WriteLiteral(String text) implements Instruction {
        @Override
        public <R> R accept(final InstructionVisitor<R> visitor) {
            return visitor.visitWriteLiteral(this);
        }
    }

    /**
     * Evaluates each expression, concatenates the results, and writes the concatenation, escaped iff
     * {@code escaped} is set.
     */
    record WriteDynamic(List<Expression> expressions, boolean escaped) implements Instruction {
        public WriteDynamic {
            expressions = List.copyOf(expressions);
        }

        /**
         * Initializes a new escaped dynamic write, the kind used for element content.
         */
        public WriteDynamic(final List<Expression> expressions) {
            this(expressions, true);
        }

        @Override
        public <R> R accept(final InstructionVisitor<R> visitor) {
            return visitor.visitWriteDynamic(this);
        }
    }

    /**
     * Executes the given instructions in order.
     */
    record Sequence(List<Instruction> instructions) implements Instruction {
        public Sequence {
            instructions = List.copyOf(instructions);
        }

        @Override
        public <R> R accept(final InstructionVisitor<R> visitor) {
            return visitor.visitSequence(this);
        }
    }

    /**
     * Executes the body once for every combination of binding values, the first binding being the outermost loop.
     */
    record Repeat(List<Binding> bindings, Instruction body) implements Instruction {
        public Repeat {
            bindings = List.copyOf(bindings);
        }

        @Override
        public <R> R accept(final InstructionVisitor<R> visitor) {
            return visitor.visitRepeat(this);
        }
    }

    /**
     * Executes {@code then} if the condition is truthy, {@code otherwise} if it isn't.
     */
    record Branch(Expression condition, Instruction then, Instruction otherwise) implements Instruction {
        @Override
        public <R> R accept(final InstructionVisitor<R> visitor) {
            return visitor.visitBranch(this);
        }
    }

    /**
     * Executes the body only if the condition is truthy.
     */
    record Guard(Expression condition, Instruction body) implements Instruction {
        @Override
        public <R> R accept(final InstructionVisitor<R> visitor) {
            return visitor.visitGuard(this);
        }
    }

    /**
     * Executes the body of the first clause whose test is truthy, or nothing if there's no such clause.
     */
    record MultiBranch(List<Clause> clauses) implements Instruction {
        public MultiBranch {
            clauses = List.copyOf(clauses);
        }

        @Override
        public <R> R accept(final InstructionVisitor<R> visitor) {
            return visitor.visitMultiBranch(this);
        }
    }

    /**
     * A loop variable together with the expression producing the values it's bound to.
     */
    record Binding(String variable, Expression iterable) {
    }

    /**
     * A test of a {@link MultiBranch} together with the instruction executed when it's the first truthy one.
     */
    record Clause(Expression test, Instruction body) {
    }
}
