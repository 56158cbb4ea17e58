// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import htslc.cli.Main;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class MainTest {
    @Test
    void rendersEveryTopLevelFormOnItsOwnLine(@TempDir final Path directory) throws IOException {
        final var template = write(directory, "[:p.greeting \"Hi, \" name] [:hr]");
        final var result = Invocation.run(template.toString(), "name=<Ann>");
        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).isEqualTo("<p class=\"greeting\">Hi, &lt;Ann&gt;</p>\n<hr></hr>\n");
        assertThat(result.err()).isEmpty();
    }

    @Test
    void commaSeparatedValuesAreBoundToLists(@TempDir final Path directory) throws IOException {
        final var template = write(directory, "[:ul [:for [x xs] [:li x]]]");
        assertThat(Invocation.run(template.toString(), "xs=a,b").out())
            .isEqualTo("<ul><li>a</li><li>b</li></ul>\n");
        assertThat(Invocation.run(template.toString(), "xs=a,").out())
            .isEqualTo("<ul><li>a</li><li></li></ul>\n");
    }

    @Test
    void valueWithoutCommaIsAString(@TempDir final Path directory) throws IOException {
        final var template = write(directory, "[:ul [:for [x xs] [:li x]]]");
        final var result = Invocation.run(template.toString(), "xs=ab");
        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("A fatal condition", "RenderErrorCondition", "Rendering template");
    }

    @Test
    void valueMayContainEqualsSigns(@TempDir final Path directory) throws IOException {
        final var template = write(directory, "[:span q]");
        assertThat(Invocation.run(template.toString(), "q=a=b").out()).isEqualTo("<span>a=b</span>\n");
    }

    @Test
    void dumpPrintsTheOptimizedProgram(@TempDir final Path directory) throws IOException {
        final var template = write(directory, "[:b \"x\" y]");
        final var result = Invocation.run("--dump", template.toString());
        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).isEqualTo("""
            sequence
              write-literal "<b>x"
              write-dynamic y
              write-literal "</b>"
            """);
    }

    @Test
    void attributeValuesAreEscapedOnlyOnRequest(@TempDir final Path directory) throws IOException {
        final var template = write(directory, "[:a {:title t :rel \"a&b\"}]");
        assertThat(Invocation.run(template.toString(), "t=x&y").out())
            .isEqualTo("<a title=\"x&y\" rel=\"a&b\"></a>\n");
        assertThat(Invocation.run("--escape-attributes", template.toString(), "t=x&y").out())
            .isEqualTo("<a title=\"x&amp;y\" rel=\"a&amp;b\"></a>\n");
    }

    @Test
    void flagsCanBeCombined(@TempDir final Path directory) throws IOException {
        final var template = write(directory, "[:a {:title t}]");
        final var result = Invocation.run("--escape-attributes", "--dump", template.toString());
        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).contains("write-dynamic t").doesNotContain("write-dynamic-raw");
        assertThat(Invocation.run("--dump", template.toString()).out()).contains("write-dynamic-raw t");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "--bogus TEMPLATE", "--dump", "TEMPLATE novalue", "TEMPLATE =value"})
    void malformedArgumentsAreAUsageError(final String arguments, @TempDir final Path directory) throws IOException {
        final var template = write(directory, "[:p]");
        final var args = arguments.isEmpty()
            ? new String[0]
            : arguments.replace("TEMPLATE", template.toString()).split(" ");
        final var result = Invocation.run(args);
        assertThat(result.exitCode()).isEqualTo(64);
        assertThat(result.out()).isEmpty();
        assertThat(result.err()).startsWith("Usage: htslc");
    }

    @Test
    void missingTemplateIsAnError(@TempDir final Path directory) {
        final var result = Invocation.run(directory.resolve("nope.htsl").toString());
        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("IOExceptionCondition", "Reading template", "Invoking restart abort");
    }

    @Test
    void readErrorIsAnError(@TempDir final Path directory) throws IOException {
        final var template = write(directory, "[:p\n  \"unterminated]");
        final var result = Invocation.run(template.toString());
        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.out()).isEmpty();
        assertThat(result.err()).contains("ReadErrorCondition");
    }

    @Test
    void compileErrorIsAnError(@TempDir final Path directory) throws IOException {
        final var template = write(directory, "[:ul [:if t \"only then\"]]");
        final var result = Invocation.run(template.toString(), "t=1");
        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("MalformedSpecialFormCondition", "Compiling HTSL special form if");
    }

    private static Path write(final Path directory, final String source) throws IOException {
        final var path = directory.resolve("template.htsl");
        Files.writeString(path, source, StandardCharsets.UTF_8);
        return path;
    }

    private record Invocation(int exitCode, String out, String err) {
        private static Invocation run(final String... args) {
            final var out = new ByteArrayOutputStream();
            final var err = new ByteArrayOutputStream();
            final int exitCode;
            try (
                final var outStream = new PrintStream(out, true, StandardCharsets.UTF_8);
                final var errStream = new PrintStream(err, true, StandardCharsets.UTF_8)
            ) {
                exitCode = Main.run(args, Map.of(), outStream, errStream);
            }
            return new Invocation(
                exitCode,
                out.toString(StandardCharsets.UTF_8),
                err.toString(StandardCharsets.UTF_8)
            );
        }
    }
}
