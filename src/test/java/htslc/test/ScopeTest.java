// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.test;

import java.util.LinkedHashMap;
import htslc.runtime.RenderErrorCondition;
import htslc.runtime.Scope;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class ScopeTest {
    @Test
    void bindingDoesNotModifyTheOriginal() {
        final var outer = Scope.empty().bind("x", 1);
        final var inner = outer.bind("x", 2).bind("y", 3);
        assertThat(outer.lookup("x")).isEqualTo(1);
        assertThat(Conditions.fatalConditionOf(() -> outer.lookup("y"))).isInstanceOf(RenderErrorCondition.class);
        assertThat(inner.lookup("x")).isEqualTo(2);
        assertThat(inner.lookup("y")).isEqualTo(3);
    }

    @Test
    void nullIsABoundValue() {
        final var scope = Scope.empty().bind("n", null);
        assertThat(scope.lookup("n")).isNull();
        assertThat(scope.bind("m", 1).lookup("n")).isNull();
    }

    @Test
    void everyMapEntryIsBound() {
        final var variables = new LinkedHashMap<String, Object>();
        variables.put("a", "first");
        variables.put("b", "second");
        final var scope = Scope.of(variables);
        assertThat(scope.lookup("a")).isEqualTo("first");
        assertThat(scope.lookup("b")).isEqualTo("second");
    }

    @Test
    void unboundLookupIsARenderError() {
        final var condition = Conditions.fatalConditionOf(() -> Scope.empty().lookup("ghost"));
        assertThat(condition).isInstanceOf(RenderErrorCondition.class);
        assertThat(condition.message()).isEqualTo("Unbound variable ghost");
    }
}
