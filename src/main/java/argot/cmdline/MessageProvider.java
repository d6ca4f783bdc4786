/*
 * The MIT License
 *
 * Copyright (c) 2024 The Broad Institute
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package argot.cmdline;

import java.util.List;

/**
 * Supplies the text of the errors reported by the parser and the command manager. Override individual methods to
 * change or translate the wording, and pass the instance with {@link ParseOptions#setMessageProvider}.
 */
public class MessageProvider {
    public static final MessageProvider DEFAULT = new MessageProvider();

    public String unknownArgument(final String name) {
        return "Unknown argument '" + name + "'.";
    }

    public String ambiguousPrefix(final String prefix, final List<String> candidates) {
        return "Argument '" + prefix + "' is ambiguous; it could be any of " + String.join(", ", candidates) + ".";
    }

    public String unknownCommand(final String name) {
        return "Unknown command '" + name + "'.";
    }

    public String noCommand() {
        return "No command was specified.";
    }

    public String didYouMean(final List<String> suggestions) {
        if (suggestions.size() == 1) {
            return "Did you mean this?";
        }
        return "Did you mean one of these?";
    }

    public String missingNamedArgumentValue(final String name) {
        return "No value was supplied for argument '" + name + "'.";
    }

    public String duplicateArgument(final String name) {
        return "Argument '" + name + "' was supplied more than once.";
    }

    public String duplicateArgumentWarning(final String name) {
        return "Argument '" + name + "' was supplied more than once; the last value is used.";
    }

    public String tooManyArguments(final String value) {
        return "Too many arguments were supplied; no positional argument takes the value '" + value + "'.";
    }

    public String missingRequiredArguments(final List<String> names) {
        if (names.size() == 1) {
            return "Argument '" + names.get(0) + "' is required.";
        }
        return "Arguments " + quote(names) + " are required.";
    }

    public String argumentValueConversion(final String name, final String value, final String typeName, final String detail) {
        final StringBuilder sb = new StringBuilder();
        sb.append("The value '").append(value).append("' for argument '").append(name)
                .append("' could not be converted to ").append(typeName).append('.');
        if (detail != null && !detail.isEmpty()) {
            sb.append(' ').append(detail);
        }
        return sb.toString();
    }

    public String combinedShortNameNonSwitch(final String names) {
        return "The combined short argument '" + names + "' contains an argument that is not a switch.";
    }

    public String duplicateDictionaryKey(final String name, final Object key) {
        return "The key '" + key + "' was supplied more than once for argument '" + name + "'.";
    }

    public String nullArgumentValue(final String name) {
        return "A null value is not allowed for argument '" + name + "'.";
    }

    public String createArgumentsTypeError(final String typeName, final String detail) {
        return "Could not create an instance of " + typeName + ": " + detail;
    }

    public String applyValueError(final String name, final String detail) {
        return "Could not set the value of argument '" + name + "': " + detail;
    }

    public String unknownVersion() {
        return "Version:Unknown";
    }

    private static String quote(final List<String> names) {
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < names.size(); ++i) {
            if (i > 0) {
                sb.append(i == names.size() - 1 ? " and " : ", ");
            }
            sb.append('\'').append(names.get(i)).append('\'');
        }
        return sb.toString();
    }
}
