// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.program;

import java.io.IOException;
import java.io.Writer;
import java.util.Arrays;
import java.util.stream.Stream;
import htslc.runtime.Escaper;
import htslc.runtime.RenderErrorCondition;
import htslc.runtime.Scope;
import htslc.util.UnreachableCodeReachedError;
import htslc.util.annotation.Nullable;
import htslc.util.condition.ConditionContext;

/**
 * The instruction interpreter: executes an instruction tree against a sink, in program order.
 * <p>
 * An interpreter instance belongs to a single render; programs themselves hold no render state.
 */
public final class Interpreter {
    private Interpreter(final Writer writer, final Escaper escaper) {
        this.writer = writer;
        this.escaper = escaper;
    }

    /**
     * Executes the given instruction tree, writing the output to the given {@link Writer}.
     * <p>
     * Any {@link IOException}s thrown by the writer are allowed to propagate. Expressions referring to unbound
     * variables and loops over values that can't be iterated signal a fatal {@link RenderErrorCondition}.
     */
    public static void execute(
        final Instruction instruction,
        final Writer writer,
        final Scope scope,
        final Escaper escaper
    ) throws IOException {
        new Interpreter(writer, escaper).execute(instruction, scope);
    }

    /**
     * Returns {@code false} for {@code null} and {@link Boolean#FALSE}, {@code true} for every other value.
     */
    public static boolean isTruthy(final @Nullable Object value) {
        return value != null && !Boolean.FALSE.equals(value);
    }

    private void execute(final Instruction instruction, final Scope scope) throws IOException {
        if (instruction instanceof Instruction.WriteLiteral literal) {
            writer.write(literal.text());
        } else if (instruction instanceof Instruction.WriteDynamic dynamic) {
            writeDynamic(dynamic, scope);
        } else if (instruction instanceof Instruction.Sequence sequence) {
            for (final var child : sequence.instructions()) {
                execute(child, scope);
            }
        } else if (instruction instanceof Instruction.Repeat repeat) {
            executeRepeat(repeat, 0, scope);
        } else if (instruction instanceof Instruction.Branch branch) {
            final var test = branch.condition().evaluate(scope);
            execute(isTruthy(test) ? branch.then() : branch.otherwise(), scope);
        } else if (instruction instanceof Instruction.Guard guard) {
            if (isTruthy(guard.condition().evaluate(scope))) {
                execute(guard.body(), scope);
            }
        } else if (instruction instanceof Instruction.MultiBranch multiBranch) {
            for (final var clause : multiBranch.clauses()) {
                if (isTruthy(clause.test().evaluate(scope))) {
                    execute(clause.body(), scope);
                    break;
                }
            }
        } else {
            throw new UnreachableCodeReachedError();
        }
    }

    private void writeDynamic(final Instruction.WriteDynamic dynamic, final Scope scope) throws IOException {
        final var builder = new StringBuilder();
        for (final var expression : dynamic.expressions()) {
            final var value = expression.evaluate(scope);
            if (value != null) {
                builder.append(value);
            }
        }
        final var text = builder.toString();
        writer.write(dynamic.escaped() ? escaper.escape(text) : text);
    }

    private void executeRepeat(
        final Instruction.Repeat repeat,
        final int bindingIndex,
        final Scope scope
    ) throws IOException {
        final var bindings = repeat.bindings();
        if (bindingIndex == bindings.size()) {
            execute(repeat.body(), scope);
            return;
        }
        final var binding = bindings.get(bindingIndex);
        for (final var value : asIterable(binding, binding.iterable().evaluate(scope))) {
            executeRepeat(repeat, bindingIndex + 1, scope.bind(binding.variable(), value));
        }
    }

    private static Iterable<?> asIterable(final Instruction.Binding binding, final @Nullable Object value) {
        if (value instanceof Iterable<?> iterable) {
            return iterable;
        } else if (value instanceof Object[] array) {
            return Arrays.asList(array);
        } else if (value instanceof Stream<?> stream) {
            return stream.toList();
        }
        throw ConditionContext.error(new RenderErrorCondition(
            "Can't iterate over the value of " + binding.iterable() + " bound to " + binding.variable() + ": "
                + value));
    }

    private final Writer writer;
    private final Escaper escaper;
}
