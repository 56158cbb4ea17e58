// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.compiler;

import java.nio.file.Path;
import java.util.Map;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import htslc.runtime.Escaper;
import htslc.util.DebugLog;

/**
 * Settings of an {@link HtslCompiler}.
 *
 * @param escaper               The escaper applied to literal text at compile time and to dynamic values at render
 *                              time.
 * @param escapeAttributeValues Whether attribute values, static and dynamic alike, are escaped too. Off by
 *                              default: attribute values are trusted and written verbatim after quoting.
 * @param debugLog              The log receiving a line per compiled element and fragment.
 */
public record CompilerOptions(Escaper escaper, boolean escapeAttributeValues, DebugLog debugLog) {
    /**
     * The environment variable enabling the debug log. Its value names the log file; an empty value or {@code 1}
     * selects {@value #defaultDebugLogFile} in the working directory.
     */
    public static final String debugLogVariable = "HTSLC_DEBUG";

    /**
     * The debug log file used when {@value #debugLogVariable} doesn't name one.
     */
    public static final String defaultDebugLogFile = "htslc.debug";

    /**
     * Returns the default options: HTML escaping, verbatim static attribute values, no debug log.
     */
    public static CompilerOptions defaults() {
        return new CompilerOptions(Escaper.html(), false, DebugLog.disabled());
    }

    /**
     * Returns the default options, with the debug log enabled if the given environment says so.
     */
    public static CompilerOptions fromEnvironment(final Map<String, String> environment) {
        final var debugLogSetting = environment.get(debugLogVariable);
        if (debugLogSetting == null) {
            return defaults();
        }
        final var fileName = (debugLogSetting.isBlank() || "1".equals(debugLogSetting))
            ? defaultDebugLogFile
            : debugLogSetting;
        return defaults().withDebugLog(DebugLog.appendingTo(Path.of(fileName)));
    }

    @CheckReturnValue
    public CompilerOptions withEscaper(final Escaper newEscaper) {
        return new CompilerOptions(newEscaper, escapeAttributeValues, debugLog);
    }

    @CheckReturnValue
    public CompilerOptions withEscapeAttributeValues(final boolean newEscapeAttributeValues) {
        return new CompilerOptions(escaper, newEscapeAttributeValues, debugLog);
    }

    @CheckReturnValue
    public CompilerOptions withDebugLog(final DebugLog newDebugLog) {
        return new CompilerOptions(escaper, escapeAttributeValues, newDebugLog);
    }
}
