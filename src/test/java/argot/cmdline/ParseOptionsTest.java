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

import argot.cmdline.conversion.StringConverter;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Locale;

public class ParseOptionsTest {

    @ParseOptionsDefaults(mode = ParsingMode.LONG_SHORT, caseSensitive = true, nameTransform = NameTransform.DASH_CASE,
            argumentNamePrefixes = {"+"}, duplicateArguments = ErrorMode.WARNING)
    public static class Annotated {
        @Argument
        public String maxCount;
    }

    public static class NotAnnotated {
        @Argument
        public String maxCount;
    }

    @Test
    public void testFallbackValues() {
        final ParseOptions options = new ParseOptions();
        Assert.assertEquals(options.getLongArgumentNamePrefix(), "--");
        Assert.assertEquals(options.getNameValueSeparators(), new char[]{':', '='});
        Assert.assertEquals(options.getLocale(), Locale.ROOT);
        Assert.assertTrue(options.isAllowWhiteSpaceValueSeparator());
        Assert.assertTrue(options.isAutoHelpArgument());
        Assert.assertTrue(options.isAutoVersionArgument());
        Assert.assertTrue(options.isNegativeNumbersAsValues());
        Assert.assertEquals(options.getPrefixTermination(), PrefixTerminationMode.NONE);
        Assert.assertEquals(options.getArgumentNamePrefixes(), ParseOptions.getDefaultArgumentNamePrefixes());
        Assert.assertTrue(options.getArgumentNamePrefixes().contains("-"));
        Assert.assertSame(options.getMessageProvider(), MessageProvider.DEFAULT);
        Assert.assertSame(options.getOut(), System.out);
        Assert.assertSame(options.getError(), System.err);
        Assert.assertNull(options.getProgramName());
    }

    @Test
    public void testClassDefaultsFillUnsetOptions() {
        final ParseOptions resolved = new ParseOptions().forType(Annotated.class);
        Assert.assertEquals(resolved.getMode(), ParsingMode.LONG_SHORT);
        Assert.assertTrue(resolved.isCaseSensitive());
        Assert.assertEquals(resolved.getNameTransform(), NameTransform.DASH_CASE);
        Assert.assertEquals(resolved.getArgumentNamePrefixes(), Arrays.asList("+"));
        Assert.assertEquals(resolved.getDuplicateArguments(), ErrorMode.WARNING);
    }

    @Test
    public void testExplicitOptionsWin() {
        final ParseOptions options = new ParseOptions()
                .setMode(ParsingMode.DEFAULT)
                .setNameTransform(NameTransform.SNAKE_CASE);
        final ParseOptions resolved = options.forType(Annotated.class);
        Assert.assertEquals(resolved.getMode(), ParsingMode.DEFAULT);
        Assert.assertEquals(resolved.getNameTransform(), NameTransform.SNAKE_CASE);
        Assert.assertTrue(resolved.isCaseSensitive());

        // the original is not modified
        Assert.assertEquals(options.isCaseSensitive(), CommandLineDefaults.CASE_SENSITIVE);
    }

    @Test
    public void testWithoutClassDefaults() {
        final ParseOptions options = new ParseOptions().setCaseSensitive(true);
        final ParseOptions resolved = options.forType(NotAnnotated.class);
        Assert.assertNotSame(resolved, options);
        Assert.assertTrue(resolved.isCaseSensitive());
        Assert.assertEquals(resolved.getMode(), CommandLineDefaults.PARSING_MODE);
    }

    @Test
    public void testClassDefaultsAreUsedByTheParser() {
        final Annotated annotated = new CommandLineParser<>(Annotated.class).parse("--max-count", "7");
        Assert.assertEquals(annotated.maxCount, "7");
    }

    @Test
    public void testConvertersAreCopied() {
        final ParseOptions options = new ParseOptions().registerConverter(String.class, StringConverter.INSTANCE);
        final ParseOptions resolved = options.forType(NotAnnotated.class);
        Assert.assertSame(resolved.getConverters().get(String.class), StringConverter.INSTANCE);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testEmptyPrefix() {
        new ParseOptions().setArgumentNamePrefixes("-", "");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNoSeparators() {
        new ParseOptions().setNameValueSeparators();
    }

    @Test
    public void testAllowDuplicateArguments() {
        final ParseOptions options = new ParseOptions();
        Assert.assertFalse(options.setAllowDuplicateArguments(false).isAllowDuplicateArguments());
        Assert.assertTrue(options.setAllowDuplicateArguments(true).isAllowDuplicateArguments());
        Assert.assertTrue(options.setDuplicateArguments(ErrorMode.WARNING).isAllowDuplicateArguments());
    }
}
