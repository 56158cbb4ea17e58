// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.test;

import java.util.List;
import java.util.Map;
import htslc.compiler.HtslCompiler;
import htslc.form.reader.FormReader;
import htslc.program.Instruction;
import htslc.runtime.Scope;
import static htslc.form.Forms.element;
import static htslc.form.Forms.forEach;
import static htslc.form.Forms.properties;
import static htslc.form.Forms.symbol;
import static htslc.form.Forms.text;
import static htslc.form.Forms.vector;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class EndToEndTest {
    @Test
    void nestedListRendersAsExpected() {
        final var tree = element("div.main",
            element("h3", text("section")),
            element("div.second-level",
                forEach(vector(symbol("x"), symbol("xs")),
                    element("li", properties("data-idx", symbol("x")), text("item"), symbol("x")))));
        final var program = new HtslCompiler().compile(tree);
        assertThat(program.renderToString(Scope.of(Map.of("xs", List.of(0, 1, 2))))).isEqualTo(expected);
    }

    @Test
    void readTemplateRendersTheSame() {
        final var source = """
            ; the same tree, in the textual syntax
            [:div.main
             [:h3 "section"]
             [:div.second-level
              [:for [x xs]
               [:li {:data-idx x} "item" x]]]]
            """;
        final var forms = FormReader.readAll(source);
        assertThat(forms).hasSize(1);
        final var program = new HtslCompiler().compile(forms.get(0));
        assertThat(program.renderToString(Scope.of(Map.of("xs", List.of(0, 1, 2))))).isEqualTo(expected);
    }

    @Test
    void optimizedProgramIsCompact() {
        final var tree = element("div.main",
            element("h3", text("section")),
            element("div.second-level",
                forEach(vector(symbol("x"), symbol("xs")),
                    element("li", properties("data-idx", symbol("x")), text("item"), symbol("x")))));
        final var root = (Instruction.Sequence) new HtslCompiler().compile(tree).root();
        assertThat(root.instructions()).hasSize(3);
        assertThat(root.instructions().get(0))
            .isEqualTo(new Instruction.WriteLiteral("<div class=\"main\"><h3>section</h3><div class=\"second-level\">"));
        assertThat(root.instructions().get(1)).isInstanceOf(Instruction.Repeat.class);
        assertThat(root.instructions().get(2)).isEqualTo(new Instruction.WriteLiteral("</div></div>"));
    }

    private static final String expected = "<div class=\"main\"><h3>section</h3><div class=\"second-level\">"
        + "<li data-idx=\"0\">item0</li><li data-idx=\"1\">item1</li><li data-idx=\"2\">item2</li></div></div>";
}
