// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.program;

import java.util.stream.Collectors;
import htslc.util.UnreachableCodeReachedError;

/**
 * A utility class containing common operations on instruction trees.
 */
public final class Instructions {
    private Instructions() {
    }

    /**
     * Pretty-prints the given instruction tree, one instruction per line, nested instructions indented. Intended
     * primarily for debugging and for the command-line program dump.
     */
    public static String prettyPrint(final Instruction instruction) {
        final var printer = new PrettyPrinter();
        printer.print(instruction, 0);
        return printer.builder.toString();
    }

    /**
     * Counts the instructions in the given tree, the root included.
     */
    public static int count(final Instruction instruction) {
        return instruction.accept(Counter.instance);
    }

    private static final class PrettyPrinter {
        private void print(final Instruction instruction, final int level) {
            final var indentation = "  ".repeat(level);
            builder.append(indentation);
            if (instruction instanceof Instruction.WriteLiteral literal) {
                builder.append("write-literal ").append(quote(literal.text())).append('\n');
            } else if (instruction instanceof Instruction.WriteDynamic dynamic) {
                builder.append(dynamic.escaped() ? "write-dynamic " : "write-dynamic-raw ");
                builder.append(dynamic.expressions().stream().map(String::valueOf).collect(Collectors.joining(" ")));
                builder.append('\n');
            } else if (instruction instanceof Instruction.Sequence sequence) {
                builder.append("sequence\n");
                for (final var child : sequence.instructions()) {
                    print(child, level + 1);
                }
            } else if (instruction instanceof Instruction.Repeat repeat) {
                builder.append("repeat");
                for (final var binding : repeat.bindings()) {
                    builder.append(' ').append(binding.variable()).append(" in ").append(binding.iterable());
                }
                builder.append('\n');
                print(repeat.body(), level + 1);
            } else if (instruction instanceof Instruction.Branch branch) {
                builder.append("branch ").append(branch.condition()).append('\n');
                print(branch.then(), level + 1);
                builder.append(indentation).append("else\n");
                print(branch.otherwise(), level + 1);
            } else if (instruction instanceof Instruction.Guard guard) {
                builder.append("guard ").append(guard.condition()).append('\n');
                print(guard.body(), level + 1);
            } else if (instruction instanceof Instruction.MultiBranch multiBranch) {
                builder.append("multi-branch\n");
                for (final var clause : multiBranch.clauses()) {
                    builder.append(indentation).append("  case ").append(clause.test()).append('\n');
                    print(clause.body(), level + 2);
                }
            } else {
                throw new UnreachableCodeReachedError();
            }
        }

        private static String quote(final String text) {
            return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + '"';
        }

        private final StringBuilder builder = new StringBuilder();
    }

    private static final class Counter implements InstructionVisitor<Integer> {
        @Override
        public Integer visitWriteLiteral(final Instruction.WriteLiteral instruction) {
            return 1;
        }

        @Override
        public Integer visitWriteDynamic(final Instruction.WriteDynamic instruction) {
            return 1;
        }

        @Override
        public Integer visitSequence(final Instruction.Sequence instruction) {
            var total = 1;
            for (final var child : instruction.instructions()) {
                total += child.accept(this);
            }
            return total;
        }

        @Override
        public Integer visitRepeat(final Instruction.Repeat instruction) {
            return 1 + instruction.body().accept(this);
        }

        @Override
        public Integer visitBranch(final Instruction.Branch instruction) {
            return 1 + instruction.then().accept(this) + instruction.otherwise().accept(this);
        }

        @Override
        public Integer visitGuard(final Instruction.Guard instruction) {
            return 1 + instruction.body().accept(this);
        }

        @Override
        public Integer visitMultiBranch(final Instruction.MultiBranch instruction) {
            var total = 1;
            for (final var clause : instruction.clauses()) {
                total += clause.body().accept(this);
            }
            return total;
        }

        private static final Counter instance = new Counter();
    }
}
