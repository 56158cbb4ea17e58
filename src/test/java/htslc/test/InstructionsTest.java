// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.test;

import java.util.List;
import htslc.compiler.HtslCompiler;
import htslc.program.Instruction;
import htslc.program.Instructions;
import htslc.runtime.Expression;
import static htslc.form.Forms.cond;
import static htslc.form.Forms.element;
import static htslc.form.Forms.forEach;
import static htslc.form.Forms.ifElse;
import static htslc.form.Forms.keyword;
import static htslc.form.Forms.symbol;
import static htslc.form.Forms.text;
import static htslc.form.Forms.vector;
import static htslc.form.Forms.when;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class InstructionsTest {
    @Test
    void countIncludesEveryNode() {
        final var tree = new Instruction.Sequence(List.of(
            new Instruction.WriteLiteral("a"),
            new Instruction.Guard(Expression.variable("t"), new Instruction.WriteLiteral("b")),
            new Instruction.Branch(Expression.variable("t"), new Instruction.Sequence(List.of()),
                new Instruction.WriteLiteral("c"))
        ));
        assertThat(Instructions.count(tree)).isEqualTo(7);
    }

    @Test
    void prettyPrintShowsStructure() {
        final var tree = element("ul",
            forEach(vector(symbol("x"), symbol("xs")), element("li", symbol("x"))),
            ifElse(symbol("t"), text("\"y\""), text("n")),
            when(symbol("w"), text("w")),
            cond(symbol("a"), text("A"), keyword("else"), text("E")));
        final var program = new HtslCompiler().compile(tree);
        assertThat(program.toString()).isEqualTo("""
            sequence
              write-literal "<ul>"
              repeat x in xs
                sequence
                  write-literal "<li>"
                  write-dynamic x
                  write-literal "</li>"
              branch t
                write-literal "&quot;y&quot;"
              else
                write-literal "n"
              guard w
                write-literal "w"
              multi-branch
                case a
                  write-literal "A"
                case ':else
                  write-literal "E"
              write-literal "</ul>"
            """);
    }
}
