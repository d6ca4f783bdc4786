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
package argot.cmdline.validation;

import argot.cmdline.Argument;
import argot.cmdline.ArgumentDescriptor;
import argot.cmdline.CommandLineParser;
import argot.cmdline.CommandLineParserDefinitionException;
import argot.cmdline.ErrorCategory;
import argot.cmdline.ParseResult;
import argot.cmdline.ParseStatus;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.math.BigInteger;
import java.util.List;

public class ValidatorTest {

    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.FIELD)
    @ArgumentValidation(EvenValidator.class)
    public @interface ValidateEven {
    }

    public static class EvenValidator implements ArgumentValidator {
        @Override
        public ValidationMode getMode() {
            return ValidationMode.AFTER_CONVERSION;
        }

        @Override
        public boolean isValid(final ArgumentDescriptor argument, final Object value, final ValidationContext context) {
            return ((Integer) value) % 2 == 0;
        }

        @Override
        public String getErrorMessage(final ArgumentDescriptor argument, final Object value) {
            return value + " is odd.";
        }
    }

    public static class Validated {
        @Argument
        @ValidateNotEmpty
        public String name;

        @Argument
        @ValidateNotWhiteSpace
        public String title;

        @Argument
        @ValidatePattern(value = "^[a-z]+$", message = "Lower case letters only.")
        public String id;

        @Argument
        @ValidateRange(min = 1, max = 10)
        public Integer level;

        @Argument
        @ValidateStringLength(min = 2, max = 4)
        public String code;

        @Argument
        @Prohibits("quiet")
        public boolean verbose;

        @Argument
        public boolean quiet;

        @Argument
        @ValidateEven
        public int even;
    }

    public static class Counted {
        @Argument
        @ValidateCount(min = 1, max = 2)
        public List<String> tag;
    }

    @RequiresAny({"file", "url"})
    public static class Source {
        @Argument
        public String file;

        @Argument
        public String url;
    }

    public static class LargeNumbers {
        // 2^53, the largest power of two below which every long is exactly a double
        @Argument
        @ValidateRange(max = 9007199254740992d)
        public long count;

        @Argument
        @ValidateRange(min = -9007199254740992d)
        public BigInteger big;
    }

    public static class BadRange {
        @Argument
        @ValidateRange(min = 5, max = 1)
        public int value;
    }

    public static class UnknownDependency {
        @Argument
        @Requires("missing")
        public String value;
    }

    @DataProvider(name = "invalid")
    public Object[][] invalid() {
        return new Object[][]{
                {new String[]{"-name:"}, ErrorCategory.VALIDATION_FAILED, "name"},
                {new String[]{"-title", "  "}, ErrorCategory.VALIDATION_FAILED, "title"},
                {new String[]{"-id:ABC"}, ErrorCategory.VALIDATION_FAILED, "id"},
                {new String[]{"-level:11"}, ErrorCategory.VALIDATION_FAILED, "level"},
                {new String[]{"-level:0"}, ErrorCategory.VALIDATION_FAILED, "level"},
                {new String[]{"-code:a"}, ErrorCategory.VALIDATION_FAILED, "code"},
                {new String[]{"-code:abcde"}, ErrorCategory.VALIDATION_FAILED, "code"},
                {new String[]{"-verbose", "-quiet"}, ErrorCategory.DEPENDENCY_FAILED, "verbose"},
                {new String[]{"-even:3"}, ErrorCategory.VALIDATION_FAILED, "even"},
        };
    }

    @Test(dataProvider = "invalid")
    public void testInvalid(final String[] args, final ErrorCategory category, final String argumentName) {
        final ParseResult<Validated> result = new CommandLineParser<>(Validated.class).tryParse(args);
        Assert.assertEquals(result.getStatus(), ParseStatus.ERROR);
        Assert.assertEquals(result.getError().getCategory(), category, result.getError().getMessage());
        Assert.assertEquals(result.getArgumentName(), argumentName);
    }

    @Test
    public void testValid() {
        final Validated v = new CommandLineParser<>(Validated.class).parse(
                "-name:n", "-title:t", "-id:abc", "-level:10", "-code:abcd", "-verbose", "-even:4");
        Assert.assertEquals(v.id, "abc");
        Assert.assertEquals(v.level.intValue(), 10);
        Assert.assertEquals(v.code, "abcd");
        Assert.assertTrue(v.verbose);
        Assert.assertEquals(v.even, 4);
    }

    @Test
    public void testCustomMessages() {
        final ParseResult<Validated> pattern = new CommandLineParser<>(Validated.class).tryParse("-id:ABC");
        Assert.assertEquals(pattern.getError().getMessage(), "Lower case letters only.");

        final ParseResult<Validated> even = new CommandLineParser<>(Validated.class).tryParse("-even:3");
        Assert.assertEquals(even.getError().getMessage(), "3 is odd.");

        final ParseResult<Validated> prohibits = new CommandLineParser<>(Validated.class).tryParse("-quiet", "-verbose");
        Assert.assertEquals(prohibits.getError().getMessage(), "Argument 'verbose' cannot be used together with 'quiet'.");
    }

    @Test
    public void testRangeIsExactForLargeNumbers() {
        final CommandLineParser<LargeNumbers> parser = new CommandLineParser<>(LargeNumbers.class);
        Assert.assertEquals(parser.parse("-count:9007199254740992").count, 9007199254740992L);
        final ParseResult<LargeNumbers> count = parser.tryParse("-count:9007199254740993");
        Assert.assertEquals(count.getError().getCategory(), ErrorCategory.VALIDATION_FAILED);
        Assert.assertEquals(count.getArgumentName(), "count");

        Assert.assertEquals(parser.parse("-big:-9007199254740992").big, BigInteger.valueOf(-9007199254740992L));
        final ParseResult<LargeNumbers> big = parser.tryParse("-big:-9007199254740993");
        Assert.assertEquals(big.getError().getCategory(), ErrorCategory.VALIDATION_FAILED);
        Assert.assertEquals(big.getArgumentName(), "big");
    }

    @Test
    public void testCount() {
        final CommandLineParser<Counted> parser = new CommandLineParser<>(Counted.class);
        Assert.assertEquals(parser.tryParse().getError().getCategory(), ErrorCategory.VALIDATION_FAILED);
        Assert.assertEquals(parser.tryParse("-tag", "a", "-tag", "b", "-tag", "c").getArgumentName(), "tag");
        Assert.assertEquals(parser.parse("-tag", "a", "-tag", "b").tag.size(), 2);
        Assert.assertEquals(CountValidator.count(null), 0);
        Assert.assertEquals(CountValidator.count("x"), 1);
    }

    @Test
    public void testRequiresAny() {
        final CommandLineParser<Source> parser = new CommandLineParser<>(Source.class);
        final ParseResult<Source> missing = parser.tryParse();
        Assert.assertEquals(missing.getStatus(), ParseStatus.ERROR);
        Assert.assertEquals(missing.getError().getCategory(), ErrorCategory.DEPENDENCY_FAILED);
        Assert.assertNull(missing.getArgumentName());
        Assert.assertEquals(missing.getError().getMessage(), "At least one of the arguments 'file', 'url' must be supplied.");

        Assert.assertEquals(parser.parse("-url", "http://example.com").url, "http://example.com");
        Assert.assertEquals(parser.tryParse("-help").getStatus(), ParseStatus.CANCELED);
    }

    @Test
    public void testUsageHelp() {
        final ArgumentDescriptor level = new CommandLineParser<>(Validated.class).getSchema().getArgument("level");
        Assert.assertEquals(level.getValidators().size(), 1);
        Assert.assertEquals(level.getValidators().get(0).getUsageHelp(), "Must be between 1 and 10.");

        final ArgumentDescriptor code = new CommandLineParser<>(Validated.class).getSchema().getArgument("code");
        Assert.assertEquals(code.getValidators().get(0).getUsageHelp(), "Must be between 2 and 4 characters long.");
    }

    @Test(expectedExceptions = CommandLineParserDefinitionException.class)
    public void testInvalidRange() {
        new CommandLineParser<>(BadRange.class);
    }

    @Test(expectedExceptions = CommandLineParserDefinitionException.class)
    public void testUnknownDependency() {
        new CommandLineParser<>(UnknownDependency.class);
    }
}
