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

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Outcome of {@link CommandLineParser#tryParse}. Exactly one of {@link #getValue()} and {@link #getError()} is set
 * unless parsing was cancelled with {@link CancelMode#ABORT}, in which case neither is.
 */
public final class ParseResult<T> {
    private final ParseStatus status;
    private final T value;
    private final CommandLineArgumentException error;
    private final String argumentName;
    private final ArgumentKind cancelledByKind;
    private final List<String> remainingArguments;
    private final boolean helpRequested;
    private final Set<String> suppliedNames;

    private ParseResult(final ParseStatus status, final T value, final CommandLineArgumentException error,
                        final String argumentName, final ArgumentKind cancelledByKind,
                        final List<String> remainingArguments, final boolean helpRequested,
                        final Set<String> suppliedNames) {
        this.status = status;
        this.value = value;
        this.error = error;
        this.argumentName = argumentName;
        this.cancelledByKind = cancelledByKind;
        this.remainingArguments = remainingArguments;
        this.helpRequested = helpRequested;
        this.suppliedNames = suppliedNames;
    }

    static <T> ParseResult<T> success(final T value, final String cancelledBy, final List<String> remaining,
                                      final Set<String> suppliedNames) {
        return new ParseResult<>(ParseStatus.SUCCESS, value, null, cancelledBy, null, remaining, false, suppliedNames);
    }

    static <T> ParseResult<T> canceled(final ArgumentDescriptor cancelledBy, final List<String> remaining,
                                       final boolean helpRequested, final Set<String> suppliedNames) {
        return new ParseResult<>(ParseStatus.CANCELED, null, null,
                cancelledBy == null ? null : cancelledBy.getName(),
                cancelledBy == null ? null : cancelledBy.getKind(),
                remaining, helpRequested, suppliedNames);
    }

    static <T> ParseResult<T> error(final CommandLineArgumentException error) {
        return new ParseResult<>(ParseStatus.ERROR, null, error, error.getArgumentName(), null,
                Collections.<String>emptyList(), false, Collections.<String>emptySet());
    }

    public ParseStatus getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == ParseStatus.SUCCESS;
    }

    /** @return the populated argument object, or null unless the status is {@link ParseStatus#SUCCESS}. */
    public T getValue() {
        return value;
    }

    /** @return the error, or null unless the status is {@link ParseStatus#ERROR}. */
    public CommandLineArgumentException getError() {
        return error;
    }

    /**
     * @return for a cancelled parse, the argument that cancelled it (null if it stopped at the prefix terminator);
     * for an error, the argument the error applies to
     */
    public String getArgumentName() {
        return argumentName;
    }

    /** @return true if the parse was cancelled by the automatic version argument. */
    public boolean isVersionRequested() {
        return cancelledByKind == ArgumentKind.AUTOMATIC_VERSION;
    }

    /** @return the tokens after the point where parsing was cancelled; empty if it was not. */
    public List<String> getRemainingArguments() {
        return remainingArguments;
    }

    /** @return true if parsing was aborted by an argument such as {@code -help}, so usage should be shown. */
    public boolean isHelpRequested() {
        return helpRequested;
    }

    /** @return true if the argument with this name or alias was given on the command line. */
    public boolean isSupplied(final String name) {
        return suppliedNames.contains(name);
    }
}
