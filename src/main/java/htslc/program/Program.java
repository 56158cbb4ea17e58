// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.program;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import htslc.runtime.Escaper;
import htslc.runtime.Scope;
import htslc.util.UnreachableCodeReachedError;

/**
 * A compiled, immutable emission program, ready to be rendered any number of times.
 * <p>
 * Programs can be shared between threads freely; each render needs its own {@link Writer}.
 */
public final class Program {
    /**
     * Initializes a new program executing the given instruction tree, escaping dynamic values with the given
     * escaper.
     */
    public Program(final Instruction root, final Escaper escaper) {
        this.root = root;
        this.escaper = escaper;
    }

    /**
     * Retrieves the root of this program's instruction tree.
     */
    public Instruction root() {
        return root;
    }

    /**
     * Renders this program to the given writer, with the variables of the given scope visible to expressions.
     * <p>
     * Any {@link IOException}s thrown by the writer are allowed to propagate.
     */
    public void render(final Writer writer, final Scope scope) throws IOException {
        Interpreter.execute(root, writer, scope, escaper);
    }

    /**
     * Renders this program into a new string.
     */
    public String renderToString(final Scope scope) {
        final var writer = new StringWriter();
        try {
            render(writer, scope);
        } catch (final IOException e) {
            throw new UnreachableCodeReachedError("StringWriter threw an IOException: " + e);
        }
        return writer.toString();
    }

    @Override
    public String toString() {
        return Instructions.prettyPrint(root);
    }

    private final Instruction root;
    private final Escaper escaper;
}
