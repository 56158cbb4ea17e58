// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.compiler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import htslc.form.ElementToken;
import htslc.form.Form;
import htslc.form.Forms;
import htslc.form.NodeShape;
import htslc.form.SpecialForm;
import htslc.optimizer.Optimizer;
import htslc.program.Instruction;
import htslc.program.Instructions;
import htslc.program.Program;
import htslc.runtime.Expression;
import htslc.util.Trace;
import htslc.util.annotation.Nullable;
import htslc.util.condition.ConditionContext;
import htslc.util.condition.UnhandledErrorError;

/**
 * The HTSL compiler: the primary means of turning element trees into emission programs.
 * <p>
 * Compilation is a pure function of the element tree and the options, so a compiler can be shared between threads.
 * <p>
 * On error, a fatal condition is signaled and compilation of the whole program is abandoned:
 * <ul>
 * <li>{@link MalformedSpecialFormCondition} if a special form has the wrong number or kind of arguments.
 * <li>{@link UnsupportedNodeShapeCondition} if a form can't be compiled in the position it appears in.
 * </ul>
 */
public final class HtslCompiler {
    /**
     * Initializes a new compiler with the given options.
     */
    public HtslCompiler(final CompilerOptions options) {
        this.options = options;
    }

    /**
     * Initializes a new compiler with the {@linkplain CompilerOptions#defaults() default options}.
     */
    public HtslCompiler() {
        this(CompilerOptions.defaults());
    }

    /**
     * Compiles the given element tree and optimizes the result.
     */
    public Program compile(final Form form) {
        final var compiled = compileUnoptimized(form);
        final var optimized = Optimizer.standard().optimize(compiled);
        options.debugLog().log(() -> "Optimized " + Instructions.count(compiled) + " instructions into "
            + Instructions.count(optimized));
        return new Program(optimized, options.escaper());
    }

    /**
     * Compiles the given element tree without optimizing it, one instruction per write the tree implies.
     */
    public Instruction compileUnoptimized(final Form form) {
        if (form instanceof Form.Vector vector) {
            return compileVector(vector);
        } else if (form instanceof Form.Text text) {
            return literal(options.escaper().escape(text.value()));
        } else if (form instanceof Form.Symbol symbol) {
            return new Instruction.WriteDynamic(List.of(Expression.variable(symbol.name())));
        } else if (form instanceof Form.Dynamic dynamic) {
            return new Instruction.WriteDynamic(List.of(dynamic.expression()));
        }
        throw signalUnsupported("Can't compile this to HTML", form);
    }

    private Instruction compileVector(final Form.Vector vector) {
        final var head = Forms.asKeyword(vector.head());
        if (head == null) {
            throw signalUnsupported("A markup node must start with an element token or a special form tag", vector);
        }
        final var specialForm = SpecialForm.byTag(head.name());
        if (specialForm != null) {
            try (final var trace = new Trace(() -> "Compiling HTSL special form " + specialForm.tag())) {
                trace.use();
                return specialFormCompilers.get(specialForm).compile(this, vector);
            }
        }
        try (final var trace = new Trace(() -> "Compiling HTSL element " + head.name())) {
            trace.use();
            return compileElement(ElementToken.parse(head.name()), vector);
        }
    }

    private Instruction compileElement(final ElementToken token, final Form.Vector vector) {
        final var name = token.name();
        final var shape = NodeShape.of(vector.trailing());
        final var attributes = assembleAttributes(token, shape.properties(), vector.key());
        options.debugLog().log(() -> "HTML element " + name + " with properties "
            + Forms.prettyPrint(new Form.Properties(attributes)) + " and " + shape.children().size() + " children");

        final var instructions = new ArrayList<Instruction>();
        instructions.add(literal("<" + name));
        for (final var attribute : attributes.entrySet()) {
            compileAttribute(attribute.getKey(), attribute.getValue(), instructions);
        }
        instructions.add(literal(">"));
        for (final var child : shape.children()) {
            instructions.add(compileUnoptimized(child));
        }
        instructions.add(literal("</" + name + ">"));
        return new Instruction.Sequence(instructions);
    }

    // Later entries win, but an overridden attribute keeps the position it was first given.
    private static Map<String, Form> assembleAttributes(
        final ElementToken token,
        final Form.@Nullable Properties properties,
        final @Nullable Form key
    ) {
        final var attributes = new LinkedHashMap<String, Form>();
        if (key != null) {
            attributes.put("key", key);
        }
        if (properties != null) {
            attributes.putAll(properties.entries());
        }
        final var classAttribute = token.classAttribute();
        if (classAttribute != null) {
            attributes.put("class", new Form.Text(classAttribute));
        }
        final var id = token.id();
        if (id != null) {
            attributes.put("id", new Form.Text(id));
        }
        return attributes;
    }

    private void compileAttribute(final String name, final Form value, final List<Instruction> output) {
        if (value == Form.Omit.OMIT) {
            return;
        }
        final var staticValue = staticAttributeValue(value);
        if (staticValue != null) {
            final var written = options.escapeAttributeValues() ? options.escaper().escape(staticValue) : staticValue;
            output.add(literal(" " + name + "=\"" + written + "\""));
            return;
        }
        final Expression expression;
        if (value instanceof Form.Symbol symbol) {
            expression = Expression.variable(symbol.name());
        } else if (value instanceof Form.Dynamic dynamic) {
            expression = dynamic.expression();
        } else {
            throw signalUnsupported("Don't know what to do with this value of attribute " + name, value);
        }
        output.add(literal(" " + name + "=\""));
        output.add(new Instruction.WriteDynamic(List.of(expression), options.escapeAttributeValues()));
        output.add(literal("\""));
    }

    private static @Nullable String staticAttributeValue(final Form value) {
        if (value instanceof Form.Text text) {
            return text.value();
        } else if (value instanceof Form.Integer integer) {
            return integer.value().toString();
        } else if (value instanceof Form.Keyword keyword) {
            return keyword.name();
        }
        return null;
    }

    private Instruction compileFragment(final Form.Vector form) {
        final var shape = NodeShape.of(form.trailing());
        options.debugLog().log(() -> "Fragment with properties "
            + ((shape.properties() == null) ? "none" : Forms.prettyPrint(shape.properties()))
            + " and key " + ((form.key() == null) ? "none" : Forms.prettyPrint(form.key())));
        return new Instruction.Sequence(compileAll(shape.children()));
    }

    private Instruction compileFor(final Form.Vector form) {
        final var arguments = form.trailing();
        if (arguments.size() != 2) {
            throw signalMalformed(SpecialForm.FOR, "expected bindings and a single body form", form);
        }
        final var bindingForms = Forms.asVector(arguments.get(0));
        if (bindingForms == null) {
            throw signalMalformed(SpecialForm.FOR, "bindings must be a vector", form);
        }
        final var items = bindingForms.items();
        if (items.size() % 2 != 0) {
            throw signalMalformed(SpecialForm.FOR, "bindings must be pairs of a variable and an iterable", form);
        }
        final var bindings = new ArrayList<Instruction.Binding>(items.size() / 2);
        for (int i = 0; i < items.size(); i += 2) {
            if (!(items.get(i) instanceof Form.Symbol variable)) {
                throw signalMalformed(
                    SpecialForm.FOR, "binding variable must be a symbol: " + Forms.prettyPrint(items.get(i)), form);
            }
            final var iterable = toExpression(SpecialForm.FOR, items.get(i + 1), form);
            bindings.add(new Instruction.Binding(variable.name(), iterable));
        }
        return new Instruction.Repeat(bindings, compileUnoptimized(arguments.get(1)));
    }

    private Instruction compileIf(final Form.Vector form) {
        final var arguments = form.trailing();
        if (arguments.size() != 3) {
            throw signalMalformed(SpecialForm.IF, "expected exactly 3 forms: test, then and else", form);
        }
        return new Instruction.Branch(
            toExpression(SpecialForm.IF, arguments.get(0), form),
            compileUnoptimized(arguments.get(1)),
            compileUnoptimized(arguments.get(2))
        );
    }

    private Instruction compileWhen(final Form.Vector form) {
        final var arguments = form.trailing();
        if (arguments.size() != 2) {
            throw signalMalformed(SpecialForm.WHEN, "expected exactly 2 forms: test and then", form);
        }
        return new Instruction.Guard(
            toExpression(SpecialForm.WHEN, arguments.get(0), form),
            compileUnoptimized(arguments.get(1))
        );
    }

    private Instruction compileCond(final Form.Vector form) {
        final var arguments = form.trailing();
        if (arguments.size() % 2 != 0) {
            throw signalMalformed(SpecialForm.COND, "expected an even number of forms", form);
        }
        final var clauses = new ArrayList<Instruction.Clause>(arguments.size() / 2);
        for (int i = 0; i < arguments.size(); i += 2) {
            clauses.add(new Instruction.Clause(
                toExpression(SpecialForm.COND, arguments.get(i), form),
                compileUnoptimized(arguments.get(i + 1))
            ));
        }
        return new Instruction.MultiBranch(clauses);
    }

    private List<Instruction> compileAll(final List<Form> forms) {
        final var result = new ArrayList<Instruction>(forms.size());
        for (final var form : forms) {
            result.add(compileUnoptimized(form));
        }
        return result;
    }

    private static Expression toExpression(
        final SpecialForm specialForm,
        final Form operand,
        final Form.Vector whole
    ) {
        if (operand instanceof Form.Symbol symbol) {
            return Expression.variable(symbol.name());
        } else if (operand instanceof Form.Dynamic dynamic) {
            return dynamic.expression();
        } else if (operand instanceof Form.Text text) {
            return Expression.constant(text.value());
        } else if (operand instanceof Form.Integer integer) {
            return Expression.constant(integer.value());
        } else if (operand instanceof Form.Keyword keyword) {
            // Keywords are truthy constants, which is what makes ":else" work in cond.
            return Expression.constant(":" + keyword.name());
        }
        throw signalMalformed(
            specialForm, "this doesn't appear to be an expression: " + Forms.prettyPrint(operand), whole);
    }

    private static Instruction.WriteLiteral literal(final String text) {
        return new Instruction.WriteLiteral(text);
    }

    private static UnhandledErrorError signalMalformed(
        final SpecialForm form,
        final String problem,
        final Form.Vector received
    ) {
        return ConditionContext.error(new MalformedSpecialFormCondition(form, problem, received));
    }

    private static UnhandledErrorError signalUnsupported(final String problem, final Form node) {
        return ConditionContext.error(new UnsupportedNodeShapeCondition(problem, node));
    }

    private static final Map<SpecialForm, SpecialFormCompiler> specialFormCompilers = Map.of(
        SpecialForm.FRAGMENT, HtslCompiler::compileFragment,
        SpecialForm.FOR, HtslCompiler::compileFor,
        SpecialForm.IF, HtslCompiler::compileIf,
        SpecialForm.WHEN, HtslCompiler::compileWhen,
        SpecialForm.COND, HtslCompiler::compileCond
    );

    private final CompilerOptions options;

    @FunctionalInterface
    private interface SpecialFormCompiler {
        Instruction compile(HtslCompiler compiler, Form.Vector form);
    }
}
