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

import argot.cmdline.usage.UsageWriter;

import java.io.PrintStream;

/**
 * Parses command lines into instances of an argument class.
 *
 * <pre>
 * public static class Arguments {
 *     &#64;Argument(position = 0, required = true, doc = "File to read.")
 *     public String input;
 *
 *     &#64;Argument(doc = "Number of lines to print.")
 *     public int count = 10;
 * }
 *
 * final Arguments arguments = new CommandLineParser&lt;&gt;(Arguments.class).parseWithErrorHandling(args);
 * if (arguments == null) {
 *     return 1;
 * }
 * </pre>
 *
 * A parser may be reused and shared between threads; every call parses in its own session.
 */
public class CommandLineParser<T> {
    private final Class<T> type;
    private final ParseOptions options;
    private final ArgumentSchema schema;

    public CommandLineParser(final Class<T> type) {
        this(type, new ParseOptions());
    }

    /**
     * @throws CommandLineParserDefinitionException if the class does not define a valid set of arguments
     */
    public CommandLineParser(final Class<T> type, final ParseOptions options) {
        this.type = type;
        this.options = options.forType(type);
        this.schema = ArgumentSchema.of(type, this.options);
    }

    /**
     * Parses a command line with the given options.
     */
    public static <T> ParseResult<T> parse(final Class<T> type, final String[] args, final ParseOptions options) {
        return new CommandLineParser<>(type, options).tryParse(args, 0);
    }

    public Class<T> getType() {
        return type;
    }

    /** @return the options in effect, with the class defaults applied. */
    public ParseOptions getOptions() {
        return options;
    }

    public ArgumentSchema getSchema() {
        return schema;
    }

    /**
     * Parses the arguments from {@code index} on. Errors in the command line are returned in the result, never
     * thrown, and nothing is written to the output streams.
     */
    public ParseResult<T> tryParse(final String[] args, final int index) {
        return new ParseSession<>(schema, options, type).run(args, index);
    }

    public ParseResult<T> tryParse(final String... args) {
        return tryParse(args, 0);
    }

    /**
     * Parses the arguments.
     *
     * @return the populated instance, or null if parsing was cancelled with {@link CancelMode#ABORT}
     * @throws CommandLineArgumentException if the command line is invalid
     */
    public T parse(final String... args) {
        final ParseResult<T> result = tryParse(args, 0);
        if (result.getStatus() == ParseStatus.ERROR) {
            throw result.getError();
        }
        return result.getValue();
    }

    /**
     * Parses the arguments. On an error, writes the message and usage to {@link ParseOptions#getError()}. When help
     * is requested, writes usage to {@link ParseOptions#getOut()}; when the version is requested, writes the version.
     *
     * @return the populated instance, or null if there was an error or parsing was cancelled
     */
    public T parseWithErrorHandling(final String... args) {
        final ParseResult<T> result = tryParse(args, 0);
        switch (result.getStatus()) {
            case SUCCESS:
                return result.getValue();
            case ERROR:
                final PrintStream error = options.getError();
                error.println("ERROR: " + result.getError().getMessage());
                error.println();
                writeUsage(error);
                return null;
            case CANCELED:
                if (result.isVersionRequested()) {
                    options.getOut().println(getVersionString());
                } else if (result.isHelpRequested()) {
                    writeUsage(options.getOut());
                }
                return null;
            default:
                throw new IllegalStateException("Unexpected parse status " + result.getStatus());
        }
    }

    public void writeUsage(final PrintStream stream) {
        new UsageWriter(options).writeUsage(stream, schema, getProgramName());
    }

    public String getProgramName() {
        return options.getProgramName() != null ? options.getProgramName() : type.getSimpleName();
    }

    /**
     * @return the program name and the {@code Implementation-Version} of the argument class's package
     */
    public String getVersionString() {
        final Package pkg = type.getPackage();
        final String version = pkg == null ? null : pkg.getImplementationVersion();
        return getProgramName() + " " + (version != null ? version : options.getMessageProvider().unknownVersion());
    }
}
