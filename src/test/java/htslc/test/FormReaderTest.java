// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.test;

import java.math.BigInteger;
import htslc.form.Form;
import htslc.form.Forms;
import htslc.form.reader.FormReader;
import htslc.form.reader.ReadErrorCondition;
import htslc.runtime.Expression;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class FormReaderTest {
    @Test
    void emptyInputHasNoForms() {
        assertThat(FormReader.readAll("")).isEmpty();
        assertThat(FormReader.readAll("  ; just a comment\n , ,")).isEmpty();
    }

    @Test
    void atomsAreRead() {
        assertThat(FormReader.readAll(":div.a#b sym \"text\" 42 -7 +3 - :htsl/omit")).containsExactly(
            Forms.keyword("div.a#b"),
            Forms.symbol("sym"),
            Forms.text("text"),
            Forms.integer(42),
            Forms.integer(-7),
            Forms.integer(3),
            Forms.symbol("-"),
            Form.Omit.OMIT
        );
    }

    @Test
    void hugeIntegersAreRead() {
        assertThat(FormReader.readAll("123456789012345678901234567890"))
            .containsExactly(new Form.Integer(new BigInteger("123456789012345678901234567890")));
    }

    @Test
    void constantsAreRead() {
        assertThat(FormReader.readAll("true false nil")).containsExactly(
            Forms.dynamic(Expression.constant(true)),
            Forms.dynamic(Expression.constant(false)),
            Forms.dynamic(Expression.constant(null))
        );
    }

    @Test
    void stringEscapesAreRead() {
        assertThat(FormReader.readAll("\"a\\\"b\\\\c\\nd\\te\""))
            .containsExactly(Forms.text("a\"b\\c\nd\te"));
    }

    @Test
    void nestedVectorsAndPropertiesAreRead() {
        final var forms = FormReader.readAll("[:a {:href \"/\", \"data-x\" x} \"go\" [:b]]");
        assertThat(forms).containsExactly(Forms.element("a",
            Forms.properties("href", Forms.text("/"), "data-x", Forms.symbol("x")),
            Forms.text("go"),
            Forms.element("b")
        ));
    }

    @Test
    void metadataKeyIsAttached() {
        final var forms = FormReader.readAll("^{:key id} [:li \"x\"]");
        assertThat(forms).hasSize(1);
        final var vector = (Form.Vector) forms.get(0);
        assertThat(vector.key()).isEqualTo(Forms.symbol("id"));
        assertThat(vector.items()).containsExactly(Forms.keyword("li"), Forms.text("x"));
    }

    @Test
    void metadataWithoutKeyLeavesNoKey() {
        final var vector = (Form.Vector) FormReader.readAll("^{:other 1} [:li]").get(0);
        assertThat(vector.key()).isNull();
    }

    @Test
    void readerReturnsFormsOneByOne() {
        final var reader = new FormReader("[:a] [:b]\n\n; done\n");
        assertThat(reader.readTopLevelForm()).isEqualTo(Forms.element("a"));
        assertThat(reader.readTopLevelForm()).isEqualTo(Forms.element("b"));
        assertThat(reader.readTopLevelForm()).isNull();
        assertThat(reader.readTopLevelForm()).isNull();
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "[:a",
        "{:a 1",
        "{:a}",
        "{[:x] 1}",
        "\"unterminated",
        "\"bad \\q escape\"",
        "]",
        "(:a)",
        "'quoted",
        ":",
        "^[:a]",
        "^{:key 1} \"text\"",
        "^{:key 1}",
    })
    void malformedInputIsAReadError(final String source) {
        assertThat(Conditions.fatalConditionOf(() -> FormReader.readAll(source)))
            .isInstanceOf(ReadErrorCondition.class);
    }

    @Test
    void readErrorsCarryLineNumbers() {
        final var condition = Conditions.fatalConditionOf(() -> FormReader.readAll("[:a]\n\n[:b\n  \"x\"\n  ]]"));
        assertThat(condition).isInstanceOf(ReadErrorCondition.class);
        final var location = ((ReadErrorCondition) condition).sourceLocation();
        assertThat(location.topLevelFormLine()).isEqualTo(5);
        assertThat(location.lineNumber()).isEqualTo(5);
        assertThat(condition.detailedMessage()).contains("In line 5");
    }

    @Test
    void deepNestingIsRejected() {
        final var source = "[".repeat(1_000) + "]".repeat(1_000);
        assertThat(Conditions.fatalConditionOf(() -> FormReader.readAll(source)))
            .isInstanceOf(ReadErrorCondition.class)
            .extracting(c -> c.message())
            .asString()
            .contains("Recursion limit");
    }

    @Test
    void printedFormsReadBack() {
        final var form = Forms.element("div.x",
            Forms.properties("title", Forms.text("a \"q\""), "hidden", Form.Omit.OMIT, "n", Forms.integer(3)),
            Forms.fragment(Forms.symbol("y")),
            Forms.element("li").withKey(Forms.keyword("k")));
        assertThat(FormReader.readAll(Forms.prettyPrint(form))).containsExactly(form);
    }
}
