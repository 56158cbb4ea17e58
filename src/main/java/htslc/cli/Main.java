// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.cli;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import htslc.compiler.CompilerOptions;
import htslc.compiler.HtslCompiler;
import htslc.form.Form;
import htslc.form.reader.FormReader;
import htslc.runtime.Scope;
import htslc.util.Trace;
import htslc.util.annotation.Nullable;
import htslc.util.condition.ConditionContext;
import htslc.util.condition.Handler;
import htslc.util.condition.exception.IOExceptionCondition;

/**
 * The command line front end: reads a template file, compiles every top-level form in it, and renders each program
 * followed by a newline, or prints the optimized instruction tree with {@code --dump}.
 * <p>
 * Variables are given as {@code name=value} arguments; a value containing a comma is bound to the list of its
 * comma-separated parts.
 */
public final class Main {
    private Main() {
    }

    @SuppressWarnings("UseOfSystemOutOrSystemErr")
    public static void main(final String[] args) {
        System.exit(run(args, System.getenv(), System.out, System.err));
    }

    /**
     * Runs the program with the given arguments and environment, writing output to {@code out} and diagnostics to
     * {@code err}. Returns the process exit code: 0 on success, 1 if a fatal condition was signaled, 64 on a usage
     * error.
     */
    public static int run(
        final String[] args,
        final Map<String, String> environment,
        final PrintStream out,
        final PrintStream err
    ) {
        return mainImpl(args, environment, out, err).value;
    }

    private static ExitCode mainImpl(
        final String[] args,
        final Map<String, String> environment,
        final PrintStream out,
        final PrintStream err
    ) {
        final var arguments = Arguments.parse(args);
        if (arguments == null) {
            try (final var streams = Streams.acquire(out, err)) {
                streams.err().println(usage);
                return ExitCode.USAGE;
            }
        }

        try (final var handler = new Handler(new FallbackHandler(out, err))) {
            handler.use();
            final var exitCode = ConditionContext.withRestart("abort", restart -> {
                render(arguments, CompilerOptions.fromEnvironment(environment), out, err);
                return ExitCode.SUCCESS;
            });
            return (exitCode != null) ? exitCode : ExitCode.ERROR;
        }
    }

    private static void render(
        final Arguments arguments,
        final CompilerOptions environmentOptions,
        final PrintStream out,
        final PrintStream err
    ) {
        final var options = arguments.escapeAttributes()
            ? environmentOptions.withEscapeAttributeValues(true)
            : environmentOptions;
        final var compiler = new HtslCompiler(options);
        final var forms = readTemplate(arguments.templateFile());
        final var scope = Scope.of(arguments.variables());
        try (final var streams = Streams.acquire(out, err)) {
            final Writer writer = new OutputStreamWriter(streams.out(), StandardCharsets.UTF_8);
            for (final var form : forms) {
                final var program = compiler.compile(form);
                if (arguments.dump()) {
                    writer.write(program.toString());
                } else {
                    try (final var trace = new Trace("Rendering template " + arguments.templateFile())) {
                        trace.use();
                        program.render(writer, scope);
                    }
                    writer.write('\n');
                }
            }
            writer.flush();
        } catch (final IOException e) {
            throw ConditionContext.error(new IOExceptionCondition(e));
        }
    }

    private static List<Form> readTemplate(final Path templateFile) {
        try (final var trace = new Trace(() -> "Reading template " + templateFile)) {
            trace.use();
            final String source;
            try {
                source = Files.readString(templateFile, StandardCharsets.UTF_8);
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
            return FormReader.readAll(source);
        }
    }

    private static final String usage =
        "Usage: htslc [--dump] [--escape-attributes] <template file> [name=value...]";

    private enum ExitCode {
        SUCCESS(0),
        ERROR(1),
        USAGE(64);

        ExitCode(final int value) {
            this.value = value;
        }

        private final int value;
    }

    private record Arguments(
        boolean dump,
        boolean escapeAttributes,
        Path templateFile,
        Map<String, Object> variables
    ) {
        // Returns null if the arguments are malformed.
        private static @Nullable Arguments parse(final String[] args) {
            var dump = false;
            var escapeAttributes = false;
            var index = 0;
            for (; index < args.length && args[index].startsWith("--"); index += 1) {
                switch (args[index]) {
                    case "--dump" -> dump = true;
                    case "--escape-attributes" -> escapeAttributes = true;
                    default -> {
                        return null;
                    }
                }
            }
            if (index >= args.length) {
                return null;
            }
            final var templateFile = Path.of(args[index]);
            final var variables = new LinkedHashMap<String, Object>();
            for (index += 1; index < args.length; index += 1) {
                final var argument = args[index];
                final var separator = argument.indexOf('=');
                if (separator <= 0) {
                    return null;
                }
                final var value = argument.substring(separator + 1);
                variables.put(
                    argument.substring(0, separator),
                    (value.indexOf(',') >= 0) ? Arrays.asList(value.split(",", -1)) : value
                );
            }
            return new Arguments(dump, escapeAttributes, templateFile, variables);
        }
    }
}
