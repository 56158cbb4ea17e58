// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.random.RandomGenerator;
import java.util.stream.LongStream;
import htslc.optimizer.FlattenSequences;
import htslc.optimizer.MergeLiterals;
import htslc.optimizer.Optimizer;
import htslc.program.Instruction;
import htslc.program.Instructions;
import htslc.program.Program;
import htslc.runtime.Escaper;
import htslc.runtime.Expression;
import htslc.runtime.Scope;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

final class OptimizerTest {
    static LongStream provideSeeds() {
        return RandomUtils.seeds(16);
    }

    @Test
    void nestedSequencesAreFlattened() {
        final var tree = sequence(literal("a"), sequence(dynamic("x"), sequence(literal("b"))), sequence(), literal("c"));
        assertThat(new FlattenSequences().apply(tree))
            .isEqualTo(sequence(literal("a"), dynamic("x"), literal("b"), literal("c")));
    }

    @Test
    void flatteningStopsAtControlFlow() {
        final var body = sequence(literal("a"), sequence(literal("b")));
        final var tree = sequence(new Instruction.Guard(Expression.variable("t"), body));
        assertThat(new FlattenSequences().apply(tree))
            .isEqualTo(sequence(new Instruction.Guard(Expression.variable("t"), sequence(literal("a"), literal("b")))));
    }

    @Test
    void literalsMergeAcrossFlattenedSequences() {
        final var tree = sequence(literal("<p>"), sequence(literal("a"), sequence(literal("b"))), literal("</p>"));
        assertThat(Optimizer.standard().optimize(tree)).isEqualTo(sequence(literal("<p>ab</p>")));
    }

    @Test
    void literalsNeverMovePastDynamicWrites() {
        final var tree = sequence(literal("a"), literal("b"), dynamic("x"), literal("c"), literal("d"));
        assertThat(Optimizer.standard().optimize(tree))
            .isEqualTo(sequence(literal("ab"), dynamic("x"), literal("cd")));
    }

    @Test
    void emptyLiteralsDisappear() {
        final var tree = sequence(literal(""), dynamic("x"), literal(""));
        assertThat(new MergeLiterals().apply(tree)).isEqualTo(sequence(dynamic("x")));
    }

    @Test
    void literalsInsideBranchesAreMerged() {
        final var tree = new Instruction.Branch(
            Expression.variable("t"),
            sequence(literal("a"), literal("b")),
            sequence(literal("c"), sequence(literal("d")))
        );
        assertThat(Optimizer.standard().optimize(tree)).isEqualTo(new Instruction.Branch(
            Expression.variable("t"),
            sequence(literal("ab")),
            sequence(literal("cd"))
        ));
    }

    @Test
    void noPassesMeansNoChange() {
        final var tree = sequence(literal("a"), sequence(literal("b")));
        assertThat(new Optimizer(List.of()).optimize(tree)).isSameAs(tree);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 10, 100, 1_000})
    void adjacentLiteralsMergeIntoOne(final int count) {
        final var literals = new ArrayList<Instruction>(count);
        final var expected = new StringBuilder();
        for (int i = 0; i < count; i += 1) {
            literals.add(literal(Integer.toString(i)));
            expected.append(i);
        }
        assertThat(Optimizer.standard().optimize(new Instruction.Sequence(literals)))
            .isEqualTo(sequence(literal(expected.toString())));
    }

    @ParameterizedTest
    @MethodSource("provideSeeds")
    void optimizationPreservesOutput(final long seed) {
        final var random = RandomUtils.createGenerator(seed);
        for (int iteration = 0; iteration < 50; iteration += 1) {
            final var tree = randomInstruction(random, 5);
            final var optimized = Optimizer.standard().optimize(tree);
            assertThat(render(optimized)).isEqualTo(render(tree));
            assertThat(Instructions.count(optimized)).isLessThanOrEqualTo(Instructions.count(tree));
        }
    }

    @ParameterizedTest
    @MethodSource("provideSeeds")
    void optimizationIsIdempotent(final long seed) {
        final var random = RandomUtils.createGenerator(seed);
        for (int iteration = 0; iteration < 50; iteration += 1) {
            final var optimized = Optimizer.standard().optimize(randomInstruction(random, 5));
            assertThat(Optimizer.standard().optimize(optimized)).isEqualTo(optimized);
        }
    }

    private static Instruction randomInstruction(final RandomGenerator random, final int depth) {
        final var choice = (depth == 0) ? random.nextInt(2) : random.nextInt(8);
        return switch (choice) {
            case 0 -> literal(RandomUtils.randomText(random, 4));
            case 1 -> dynamic(RandomUtils.pick(random, List.of("v", "n", "v")));
            case 2, 3, 4 -> {
                final var size = random.nextInt(5);
                final var children = new ArrayList<Instruction>(size);
                for (int i = 0; i < size; i += 1) {
                    children.add(randomInstruction(random, depth - 1));
                }
                yield new Instruction.Sequence(children);
            }
            case 5 -> new Instruction.Repeat(
                List.of(new Instruction.Binding("v", Expression.variable("xs"))),
                randomInstruction(random, depth - 1)
            );
            case 6 -> new Instruction.Branch(
                Expression.variable(RandomUtils.pick(random, List.of("yes", "no"))),
                randomInstruction(random, depth - 1),
                randomInstruction(random, depth - 1)
            );
            default -> new Instruction.MultiBranch(List.of(
                new Instruction.Clause(Expression.variable("no"), randomInstruction(random, depth - 1)),
                new Instruction.Clause(Expression.variable("yes"), randomInstruction(random, depth - 1))
            ));
        };
    }

    private static String render(final Instruction instruction) {
        return new Program(instruction, Escaper.html()).renderToString(scope);
    }

    private static Instruction.Sequence sequence(final Instruction... instructions) {
        return new Instruction.Sequence(List.of(instructions));
    }

    private static Instruction.WriteLiteral literal(final String text) {
        return new Instruction.WriteLiteral(text);
    }

    private static Instruction.WriteDynamic dynamic(final String variable) {
        return new Instruction.WriteDynamic(List.of(Expression.variable(variable)));
    }

    private static final Scope scope = Scope.of(Map.of(
        "v", "<&>",
        "n", 7,
        "xs", List.of("a", "'"),
        "yes", true,
        "no", false
    ));
}
