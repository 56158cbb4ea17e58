// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.form.reader;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import htslc.form.Form;
import htslc.form.Forms;
import htslc.runtime.Expression;
import htslc.util.UnreachableCodeReachedError;
import htslc.util.annotation.Nullable;
import htslc.util.condition.ConditionContext;
import htslc.util.condition.UnhandledErrorError;

/**
 * The HTSL reader: the primary means of converting template source text into a stream of {@link Form} objects.
 * <p>
 * The syntax is a small subset of EDN:
 * <ul>
 * <li>{@code [...]} is a {@link Form.Vector}, {@code {...}} a {@link Form.Properties} with keyword or string keys.
 * <li>{@code "..."} is {@link Form.Text}, with the {@code \"}, {@code \\}, {@code \n} and {@code \t} escapes.
 * <li>{@code :name} is a {@link Form.Keyword}, except {@code :htsl/omit}, which is {@link Form.Omit#OMIT}.
 * <li>Integers are {@link Form.Integer}s; {@code true}, {@code false} and {@code nil} are constant
 * {@link Form.Dynamic}s; any other token is a {@link Form.Symbol}.
 * <li>{@code ^{:key form}} before a vector gives it a stable key.
 * <li>{@code ;} starts a comment that extends to the end of line; commas are whitespace.
 * </ul>
 */
public final class FormReader {
    /**
     * Initializes a new reader that will read forms from the given source text.
     */
    public FormReader(final String source) {
        this.source = source;
    }

    /**
     * Reads every top-level form in the given source text.
     */
    public static List<Form> readAll(final String source) {
        final var reader = new FormReader(source);
        final var forms = new ArrayList<Form>();
        for (var form = reader.readTopLevelForm(); form != null; form = reader.readTopLevelForm()) {
            forms.add(form);
        }
        return forms;
    }

    /**
     * Attempts to parse the next top-level form.
     *
     * <ul>
     * <li>If a form was correctly parsed, it's returned.
     * <li>If the end of input is reached, {@code null} is returned.
     * <li>If a parse error occurs, a fatal {@link ReadErrorCondition} condition is signaled.
     * </ul>
     */
    public @Nullable Form readTopLevelForm() {
        if (skipSkippables().hitEof()) {
            return null;
        }
        topLevelFormLine = lineNumber;
        currentDepth = 0;
        return readForm();
    }

    private HitEof skipSkippables() {
        while (position < source.length()) {
            final var ch = source.charAt(position);
            if (CharClass.of(ch) != CharClass.SKIPPABLE) {
                return HitEof.NO;
            }
            position += 1;
            if (ch == '\n') {
                lineNumber += 1;
            } else if (ch == ';') {
                final var lineFeed = source.indexOf('\n', position);
                if (lineFeed < 0) {
                    position = source.length();
                    return HitEof.YES;
                }
                position = lineFeed;
            }
        }
        return HitEof.YES;
    }

    private Form readForm() {
        currentDepth += 1;
        try {
            if (currentDepth > maxDepth) {
                throw signalReadError("Recursion limit reached, try to limit nesting");
            }
            final var ch = source.charAt(position);
            switch (CharClass.of(ch)) {
                case RESERVED -> throw signalReservedCharacterError(ch);
                case SKIPPABLE -> throw new UnreachableCodeReachedError(
                    "readForm called without preceding skipSkippables");
                default -> {
                }
            }
            if (CharClass.of(ch) == CharClass.REGULAR) {
                return readToken();
            }
            position += 1;
            return switch (ch) {
                case '[' -> readVector();
                case '{' -> readProperties();
                case '"' -> readString();
                case '^' -> readWithMetadata();
                case ']', '}' -> throw signalReadError("Expected a form, but found '" + ch + "' instead");
                default -> throw new UnreachableCodeReachedError("Unknown separator character " + ch);
            };
        } finally {
            currentDepth -= 1;
        }
    }

    private Form.Vector readVector() {
        final var items = new ArrayList<Form>();
        while (true) {
            if (skipSkippables().hitEof()) {
                throw signalUnterminatedError(']');
            }
            if (source.charAt(position) == ']') {
                position += 1;
                return new Form.Vector(items);
            }
            items.add(readForm());
        }
    }

    private Form.Properties readProperties() {
        final var entries = new LinkedHashMap<String, Form>();
        while (true) {
            if (skipSkippables().hitEof()) {
                throw signalUnterminatedError('}');
            }
            if (source.charAt(position) == '}') {
                position += 1;
                return new Form.Properties(entries);
            }
            final var name = propertyName(readForm());
            if (skipSkippables().hitEof() || source.charAt(position) == '}') {
                throw signalReadError("Property " + name + " has no value");
            }
            entries.put(name, readForm());
        }
    }

    private String propertyName(final Form key) {
        if (key instanceof Form.Keyword keyword) {
            return keyword.name();
        } else if (key instanceof Form.Text text) {
            return text.value();
        }
        throw signalReadError("Property names must be keywords or strings, found " + Forms.prettyPrint(key));
    }

    private Form.Vector readWithMetadata() {
        if (skipSkippables().hitEof()) {
            throw signalReadError("Expected metadata after '^' but found end of input instead");
        }
        if (!(readForm() instanceof Form.Properties metadata)) {
            throw signalReadError("Metadata must be a property map");
        }
        if (skipSkippables().hitEof()) {
            throw signalReadError("Expected a vector after metadata but found end of input instead");
        }
        if (!(readForm() instanceof Form.Vector vector)) {
            throw signalReadError("Metadata can only be attached to vectors");
        }
        return vector.withKey(metadata.entries().get("key"));
    }

    private Form.Text readString() {
        final var contents = new StringBuilder(initialStringCapacity);
        while (true) {
            if (position >= source.length()) {
                throw signalReadError("Expected closing '\"' but found end of input instead");
            }
            final var ch = source.charAt(position);
            position += 1;
            if (ch == '\n') {
                lineNumber += 1;
            }
            if (ch == '"') {
                return new Form.Text(contents.toString());
            } else if (ch != '\\') {
                contents.append(ch);
                continue;
            }
            if (position >= source.length()) {
                throw signalReadError("Expected closing '\"' but found end of input instead");
            }
            final var escaped = source.charAt(position);
            position += 1;
            contents.append(switch (escaped) {
                case '"' -> '"';
                case '\\' -> '\\';
                case 'n' -> '\n';
                case 't' -> '\t';
                default -> throw signalReadError("Unknown escape sequence \\" + escaped);
            });
        }
    }

    private Form readToken() {
        final var start = position;
        while (position < source.length() && CharClass.of(source.charAt(position)) == CharClass.REGULAR) {
            position += 1;
        }
        return resolveToken(source.substring(start, position));
    }

    private Form resolveToken(final String token) {
        if (token.startsWith(":")) {
            if (token.length() == 1) {
                throw signalReadError("Keyword name expected after ':'");
            }
            final var name = token.substring(1);
            return name.equals(omitKeyword) ? Form.Omit.OMIT : new Form.Keyword(name);
        }
        final var isNumeric = (token.startsWith("+") || token.startsWith("-"))
            ? allAsciiDigits(token, 1)
            : allAsciiDigits(token, 0);
        if (isNumeric) {
            try {
                return new Form.Integer(new BigInteger(token));
            } catch (final NumberFormatException e) {
                // The token has already been confirmed to be an optional sign followed by ASCII digits.
                throw new UnreachableCodeReachedError();
            }
        }
        return switch (token) {
            case "true" -> new Form.Dynamic(Expression.constant(Boolean.TRUE));
            case "false" -> new Form.Dynamic(Expression.constant(Boolean.FALSE));
            case "nil" -> new Form.Dynamic(Expression.constant(null));
            default -> new Form.Symbol(token);
        };
    }

    private UnhandledErrorError signalUnterminatedError(final char expected) {
        throw signalReadError("Expected closing '" + expected + "' but found end of input instead");
    }

    private UnhandledErrorError signalReservedCharacterError(final char ch) {
        final var message = (ch <= lastControlCharacter)
            ? String.format("Reserved control character U+%04X found", (int) ch)
            : ("Reserved character '" + ch + "' found");
        throw signalReadError(message);
    }

    private UnhandledErrorError signalReadError(final String message) {
        throw ConditionContext.error(new ReadErrorCondition(message, new SourceLocation(lineNumber, topLevelFormLine)));
    }

    private static boolean allAsciiDigits(final String string, final int startIndex) {
        final var length = string.length();
        if (length <= startIndex) {
            return false;
        }
        for (int i = startIndex; i < length; i += 1) {
            final var ch = string.charAt(i);
            if (ch < '0' || ch > '9') {
                return false;
            }
        }
        return true;
    }

    private static final String omitKeyword = "htsl/omit";
    private static final char lastControlCharacter = 0x1F;
    private static final int initialStringCapacity = 64;
    private static final int maxDepth = 150;

    private final String source;
    private int position = 0;
    private int lineNumber = 1;
    private int topLevelFormLine = 0;
    private int currentDepth = 0;

    private enum HitEof {
        NO,
        YES;

        private boolean hitEof() {
            return this == YES;
        }
    }

    private enum CharClass {
        REGULAR,
        SKIPPABLE,
        SEPARATOR,
        RESERVED;

        private static CharClass of(final char ch) {
            return (ch < charClasses.length) ? charClasses[ch] : REGULAR;
        }

        private static final CharClass[] charClasses;

        static {
            final var classes = new CharClass[128];
            Arrays.fill(classes, REGULAR);
            for (char ch = 0; ch <= lastControlCharacter; ch += 1) {
                classes[ch] = RESERVED;
            }
            classes[' '] = SKIPPABLE;
            classes['\r'] = SKIPPABLE;
            classes['\n'] = SKIPPABLE;
            classes['\t'] = SKIPPABLE;
            classes['\u000B'] = SKIPPABLE;
            classes['\u000C'] = SKIPPABLE;
            classes[','] = SKIPPABLE;
            classes[';'] = SKIPPABLE;
            classes['['] = SEPARATOR;
            classes[']'] = SEPARATOR;
            classes['{'] = SEPARATOR;
            classes['}'] = SEPARATOR;
            classes['"'] = SEPARATOR;
            classes['^'] = SEPARATOR;
            classes['('] = RESERVED;
            classes[')'] = RESERVED;
            classes['\''] = RESERVED;
            classes['`'] = RESERVED;
            classes['|'] = RESERVED;
            classes['\\'] = RESERVED;
            classes[0x7F] = RESERVED;
            charClasses = classes;
        }
    }
}
