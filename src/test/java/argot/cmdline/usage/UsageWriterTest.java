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
package argot.cmdline.usage;

import argot.cmdline.Argument;
import argot.cmdline.ArgumentSchema;
import argot.cmdline.Description;
import argot.cmdline.MultiValueSeparator;
import argot.cmdline.NameTransform;
import argot.cmdline.ParseOptions;
import argot.cmdline.ParsingMode;
import argot.cmdline.commands.Command;
import argot.cmdline.commands.CommandInfo;
import argot.cmdline.commands.CommandProperties;
import argot.cmdline.validation.RequiresAny;
import argot.cmdline.validation.ValidateRange;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

public class UsageWriterTest {

    public enum Mode {
        FAST, SLOW
    }

    @Description("Sorts the lines of a file.")
    @RequiresAny({"input", "stdin"})
    public static class SortArguments {
        @Argument(position = 0, doc = "File to sort.")
        public String input;

        @Argument(shortName = 'r', doc = "Reverse the order.")
        public boolean reverse;

        @Argument(defaultValue = "4", doc = "Worker threads.")
        @ValidateRange(min = 1, max = 64)
        public int threads;

        @Argument(required = true, valueDescription = "Field")
        public String key;

        @Argument
        public Mode mode;

        @Argument
        @MultiValueSeparator(",")
        public List<String> column;

        @Argument(hidden = true)
        public boolean debug;

        @Argument
        public boolean stdin;
    }

    @CommandProperties(name = "sort", oneLineSummary = "Sorts lines.")
    public static class SortCommand implements Command {
        @Override
        public int run() {
            return 0;
        }
    }

    @CommandProperties(name = "uniq", oneLineSummary = "Removes adjacent duplicate lines.")
    public static class UniqCommand implements Command {
        @Override
        public int run() {
            return 0;
        }
    }

    private static String write(final ParseOptions options) {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        final PrintStream stream = new PrintStream(bytes, true);
        new UsageWriter(options).writeUsage(stream, ArgumentSchema.of(SortArguments.class, options), "sort");
        return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void testUsage() {
        final String usage = write(new ParseOptions().setArgumentNamePrefixes("-"));
        Assert.assertTrue(usage.startsWith("Sorts the lines of a file.\n"), usage);
        Assert.assertTrue(usage.contains("Usage: sort [[-input] <String>]"), usage);
        Assert.assertTrue(usage.contains(" -key <Field> "), usage);
        Assert.assertTrue(usage.contains("[-reverse]"), usage);
        Assert.assertTrue(usage.contains("Arguments:"), usage);
        Assert.assertTrue(usage.contains("-reverse, -r"), usage);
        Assert.assertTrue(usage.contains("Reverse the order."), usage);
        Assert.assertTrue(usage.contains("Default value: 4."), usage);
        Assert.assertTrue(usage.contains("Must be between 1 and 64."), usage);
        Assert.assertTrue(usage.contains("Required."), usage);
        Assert.assertTrue(usage.contains("Possible values: {FAST, SLOW}"), usage);
        Assert.assertTrue(usage.contains("Values may be separated by ','."), usage);
        Assert.assertTrue(usage.contains("-help, -?, -h"), usage);
        Assert.assertTrue(usage.contains("You must use at least one of 'input', 'stdin'."), usage);
        Assert.assertFalse(usage.contains("debug"), usage);
    }

    @Test
    public void testLongShortUsage() {
        final String usage = write(new ParseOptions().setMode(ParsingMode.LONG_SHORT).setArgumentNamePrefixes("-"));
        Assert.assertTrue(usage.contains("-r, --reverse"), usage);
        Assert.assertTrue(usage.contains("-?, -h, --help"), usage);
        Assert.assertTrue(usage.contains("[--reverse]"), usage);
    }

    @Test
    public void testLineWidth() {
        final String usage = write(new ParseOptions().setArgumentNamePrefixes("-").setUsageLineWidth(60));
        for (final String line : usage.split("\n")) {
            if (line.contains("Usage:")) {
                continue;
            }
            Assert.assertTrue(line.length() <= 60, line);
        }
    }

    @Test
    public void testCommandList() {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        final PrintStream stream = new PrintStream(bytes, true);
        new UsageWriter(new ParseOptions()).writeCommandList(stream, "tool", Arrays.asList(
                CommandInfo.create(SortCommand.class, NameTransform.NONE),
                CommandInfo.create(UniqCommand.class, NameTransform.NONE)));
        final String text = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
        Assert.assertTrue(text.startsWith("Usage: tool <command> [arguments]"), text);
        Assert.assertTrue(text.contains("Available commands:"), text);
        Assert.assertTrue(text.indexOf("    sort") < text.indexOf("    uniq"), text);
        Assert.assertTrue(text.contains("Removes adjacent duplicate lines."), text);
    }
}
