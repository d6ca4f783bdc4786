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

import argot.cmdline.conversion.ArgumentConverter;
import argot.cmdline.validation.Requires;
import argot.cmdline.validation.ValidateNotNull;
import htsjdk.samtools.util.CollectionUtil;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.text.NumberFormat;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedSet;

public class CommandLineParserTest {

    public enum FrobnicationFlavor {
        FOO, BAR, BAZ
    }

    @Description("Read input, frobnicate it, and write frobnicated results to output.")
    public static class FrobnicateArguments {
        @Argument(position = 0, required = true, doc = "File to frobnicate.")
        public File input;

        @Argument(position = 1, doc = "Where to write the result.")
        public File output;

        @Argument(shortName = 'T', doc = "Frobnication threshold setting.")
        public Integer threshold = 20;

        @Argument
        public FrobnicationFlavor flavor;

        @Argument(doc = "Allowed shmiggle types.")
        public List<String> shmiggleType = new ArrayList<>();

        @Argument
        public boolean truthiness;
    }

    public static class OrderedPositionals {
        @Argument(position = 5)
        public String second;

        @Argument(position = 2)
        public String first;
    }

    public static class TrailingMultiValue {
        @Argument(position = 0, required = true)
        public String command;

        @Argument(position = 1)
        public List<String> files;
    }

    public static class Numbers {
        @Argument(position = 0)
        public int first;

        @Argument
        public int value;

        @Argument
        public double ratio;
    }

    public static class NumberNamedSwitch {
        @Argument(name = "1")
        public boolean one;

        @Argument(position = 0)
        public int value;
    }

    public static class SeparatedValues {
        @Argument
        @MultiValueSeparator(",")
        public List<Integer> numbers;

        @Argument
        @MultiValueSeparator
        public String[] files;

        @Argument
        public boolean flag;

        @Argument
        public SortedSet<String> tags;
    }

    @ParseOptionsDefaults(mode = ParsingMode.LONG_SHORT)
    public static class ShortSwitches {
        @Argument(isShort = true)
        public boolean verbose;

        @Argument(isShort = true)
        public boolean all;

        @Argument(shortName = 'o')
        public String output;

        @Argument(isLong = false, shortName = 'n')
        public int number;
    }

    @ParseOptionsDefaults(mode = ParsingMode.LONG_SHORT)
    public static class LongShortByDefault {
        @Argument
        public String name;
    }

    public static class Connection {
        @Argument
        public String ip;

        @Argument
        @Requires("ip")
        public Integer port;
    }

    public static class Cancelling {
        @Argument(cancelParsing = CancelMode.ABORT)
        public boolean stop;

        @Argument(cancelParsing = CancelMode.SUCCESS)
        public boolean done;

        @Argument(required = true)
        public String name;

        @Argument
        public int count;
    }

    public static class HelpWithSuccess {
        @Argument(position = 0, required = true)
        public String first;

        @Argument(position = 1, required = true)
        public String second;

        @Argument(position = 2, required = true)
        public String third;

        @Argument(cancelParsing = CancelMode.SUCCESS)
        public boolean help;
    }

    public static class Rest {
        @Argument
        public boolean flag;

        @Argument(position = 0)
        public List<String> rest;
    }

    public static class Dictionaries {
        @Argument
        public Map<String, Integer> limits;

        @Argument
        @AllowDuplicateDictionaryKeys
        @KeyValueSeparator(":=")
        public Map<String, String> settings;
    }

    public static class Defaults {
        @Argument(defaultValue = "42")
        public int answer;

        @Argument(defaultValue = "1,2")
        @MultiValueSeparator(",")
        public List<Integer> list;

        @Argument
        public String untouched = "initial";
    }

    public static class Copy {
        private final String source;
        private final String destination;

        public Copy(final String source, @Argument(name = "dest") final String destination) {
            if ("boom".equals(source)) {
                throw new IllegalArgumentException("cannot copy boom");
            }
            this.source = source;
            this.destination = destination;
        }

        @Argument
        public boolean force;

        public String getSource() {
            return source;
        }

        public String getDestination() {
            return destination;
        }
    }

    public static class NullConverter implements ArgumentConverter<Integer> {
        @Override
        public Integer convert(final String value, final Locale locale) {
            return null;
        }
    }

    public static class NullValues {
        @Argument
        @ArgumentConverterType(NullConverter.class)
        public int primitive;

        @Argument
        @ArgumentConverterType(NullConverter.class)
        public Integer boxed = 5;

        @Argument
        @ArgumentConverterType(NullConverter.class)
        @ValidateNotNull
        public Integer notNull;
    }

    public static class Measurements {
        @Argument
        public double amount;

        @Argument
        public LocalDate date;
    }

    private static <T> ParseResult<T> parse(final Class<T> type, final String... args) {
        return new CommandLineParser<>(type).tryParse(args);
    }

    private static void assertError(final ParseResult<?> result, final ErrorCategory category, final String argumentName) {
        Assert.assertEquals(result.getStatus(), ParseStatus.ERROR);
        Assert.assertNull(result.getValue());
        Assert.assertEquals(result.getError().getCategory(), category, result.getError().getMessage());
        Assert.assertEquals(result.getArgumentName(), argumentName);
    }

    @Test
    public void testPositive() {
        final String[] args = {
                "-T:17",
                "-flavor=BAR",
                "-truthiness",
                "-shmiggleType", "shmiggle1",
                "-shmiggleType:shmiggle2",
                "positional1",
                "positional2",
        };
        final FrobnicateArguments fa = new CommandLineParser<>(FrobnicateArguments.class).parse(args);
        Assert.assertEquals(fa.input, new File("positional1"));
        Assert.assertEquals(fa.output, new File("positional2"));
        Assert.assertEquals(fa.threshold.intValue(), 17);
        Assert.assertEquals(fa.flavor, FrobnicationFlavor.BAR);
        Assert.assertEquals(fa.shmiggleType, CollectionUtil.makeList("shmiggle1", "shmiggle2"));
        Assert.assertTrue(fa.truthiness);
    }

    @Test
    public void testSuppliedAndDefaulted() {
        final ParseResult<FrobnicateArguments> result = parse(FrobnicateArguments.class, "in.txt", "-t", "5");
        Assert.assertEquals(result.getStatus(), ParseStatus.SUCCESS);
        Assert.assertTrue(result.isSupplied("input"));
        Assert.assertTrue(result.isSupplied("threshold"));
        Assert.assertTrue(result.isSupplied("T"));
        Assert.assertFalse(result.isSupplied("flavor"));
        Assert.assertEquals(result.getValue().threshold.intValue(), 5);
        Assert.assertNull(result.getValue().output);
        Assert.assertTrue(result.getRemainingArguments().isEmpty());
    }

    @Test
    public void testFieldInitializerKeptWhenNotSupplied() {
        final FrobnicateArguments fa = new CommandLineParser<>(FrobnicateArguments.class).parse("in.txt");
        Assert.assertEquals(fa.threshold.intValue(), 20);
        Assert.assertTrue(fa.shmiggleType.isEmpty());
        Assert.assertFalse(fa.truthiness);
    }

    @Test
    public void testMissingRequiredArgument() {
        assertError(parse(FrobnicateArguments.class, "-T", "3"), ErrorCategory.MISSING_REQUIRED_ARGUMENT, "input");
    }

    @Test
    public void testMissingRequiredArgumentsAreAggregated() {
        final ParseResult<Copy> result = parse(Copy.class, "-force");
        assertError(result, ErrorCategory.MISSING_REQUIRED_ARGUMENT, "source");
        Assert.assertTrue(result.getError().getMessage().contains("dest"));
    }

    @DataProvider(name = "badValues")
    public Object[][] badValues() {
        return new Object[][]{
                {new String[]{"in", "-threshold:ABC"}, ErrorCategory.ARGUMENT_VALUE_CONVERSION, "threshold"},
                {new String[]{"in", "-flavor:HiMom"}, ErrorCategory.ARGUMENT_VALUE_CONVERSION, "flavor"},
                {new String[]{"in", "-flavor:1"}, ErrorCategory.ARGUMENT_VALUE_CONVERSION, "flavor"},
                {new String[]{"in", "-truthiness:maybe"}, ErrorCategory.ARGUMENT_VALUE_CONVERSION, "truthiness"},
                {new String[]{"in", "-frobnicate"}, ErrorCategory.UNKNOWN_ARGUMENT, "frobnicate"},
                {new String[]{"in", "-threshold"}, ErrorCategory.MISSING_NAMED_ARGUMENT_VALUE, "threshold"},
                {new String[]{"in", "-threshold", "-flavor:FOO"}, ErrorCategory.MISSING_NAMED_ARGUMENT_VALUE, "threshold"},
                {new String[]{"in", "out", "extra"}, ErrorCategory.TOO_MANY_ARGUMENTS, null},
                {new String[]{"in", "-flavor:FOO", "-flavor:BAR"}, ErrorCategory.DUPLICATE_ARGUMENT, "flavor"},
        };
    }

    @Test(dataProvider = "badValues")
    public void testBadCommandLine(final String[] args, final ErrorCategory category, final String argumentName) {
        assertError(parse(FrobnicateArguments.class, args), category, argumentName);
    }

    @Test(expectedExceptions = CommandLineArgumentException.class)
    public void testParseThrows() {
        new CommandLineParser<>(FrobnicateArguments.class).parse("in", "-threshold:ABC");
    }

    @Test
    public void testEnumIsCaseInsensitive() {
        Assert.assertEquals(new CommandLineParser<>(FrobnicateArguments.class).parse("in", "-flavor", "baz").flavor,
                FrobnicationFlavor.BAZ);
    }

    @Test
    public void testPositionalOrdering() {
        final OrderedPositionals op = new CommandLineParser<>(OrderedPositionals.class).parse("a", "b");
        Assert.assertEquals(op.first, "a");
        Assert.assertEquals(op.second, "b");
    }

    @Test
    public void testTrailingMultiValuePositional() {
        final TrailingMultiValue tm = new CommandLineParser<>(TrailingMultiValue.class).parse("a", "b", "c", "d");
        Assert.assertEquals(tm.command, "a");
        Assert.assertEquals(tm.files, Arrays.asList("b", "c", "d"));
    }

    @Test
    public void testNamedBeforePositional() {
        final FrobnicateArguments fa = new CommandLineParser<>(FrobnicateArguments.class).parse("-input", "x.txt", "y.txt");
        Assert.assertEquals(fa.input, new File("x.txt"));
        Assert.assertEquals(fa.output, new File("y.txt"));
    }

    @Test
    public void testNegativeNumbers() {
        final Numbers numbers = new CommandLineParser<>(Numbers.class).parse("-value", "-5", "-7", "-ratio:-0.25");
        Assert.assertEquals(numbers.value, -5);
        Assert.assertEquals(numbers.first, -7);
        Assert.assertEquals(numbers.ratio, -0.25);
    }

    @Test
    public void testNegativeNumberTieBreak() {
        final NumberNamedSwitch asValue = new CommandLineParser<>(NumberNamedSwitch.class).parse("-1");
        Assert.assertEquals(asValue.value, -1);
        Assert.assertFalse(asValue.one);

        final ParseOptions options = new ParseOptions().setNegativeNumbersAsValues(false);
        final NumberNamedSwitch asName = new CommandLineParser<>(NumberNamedSwitch.class, options).parse("-1", "-2");
        Assert.assertTrue(asName.one);
        Assert.assertEquals(asName.value, -2);
    }

    @Test
    public void testOnlyDashMarksNegativeNumbers() {
        assertError(new CommandLineParser<>(ShortSwitches.class).tryParse("--5"), ErrorCategory.UNKNOWN_ARGUMENT, "5");

        final ParseOptions options = new ParseOptions().setArgumentNamePrefixes("-", "/");
        final CommandLineParser<Numbers> parser = new CommandLineParser<>(Numbers.class, options);
        assertError(parser.tryParse("/5"), ErrorCategory.UNKNOWN_ARGUMENT, "5");
        Assert.assertEquals(parser.parse("-5").first, -5);
    }

    @DataProvider(name = "emptyNames")
    public Object[][] emptyNames() {
        return new Object[][]{
                {ShortSwitches.class, "-:x"},
                {ShortSwitches.class, "-="},
                {ShortSwitches.class, "--=x"},
                {Numbers.class, "-:x"},
                {Numbers.class, "-="},
        };
    }

    @Test(dataProvider = "emptyNames")
    public void testEmptyArgumentName(final Class<?> type, final String token) {
        assertError(new CommandLineParser<>(type).tryParse(token), ErrorCategory.UNKNOWN_ARGUMENT, token);
    }

    @Test
    public void testMultiValueAccumulation() {
        final SeparatedValues sv = new CommandLineParser<>(SeparatedValues.class)
                .parse("-numbers:1,2,3", "-numbers", "4", "-tags", "b", "-tags", "a", "-tags", "b");
        Assert.assertEquals(sv.numbers, Arrays.asList(1, 2, 3, 4));
        Assert.assertEquals(new ArrayList<>(sv.tags), Arrays.asList("a", "b"));
        Assert.assertNull(sv.files);
    }

    @Test
    public void testWhiteSpaceSeparatedMultiValue() {
        final SeparatedValues sv = new CommandLineParser<>(SeparatedValues.class).parse("-files", "a", "b", "c", "-flag");
        Assert.assertEquals(sv.files, new String[]{"a", "b", "c"});
        Assert.assertTrue(sv.flag);
    }

    @Test
    public void testCombinedShortSwitches() {
        final CommandLineParser<ShortSwitches> parser = new CommandLineParser<>(ShortSwitches.class);
        final ShortSwitches both = parser.parse("-va");
        Assert.assertTrue(both.verbose);
        Assert.assertTrue(both.all);

        final ShortSwitches withValue = parser.parse("-vao:out.txt");
        Assert.assertTrue(withValue.verbose);
        Assert.assertTrue(withValue.all);
        Assert.assertEquals(withValue.output, "out.txt");

        final ShortSwitches cleared = parser.parse("-va:false");
        Assert.assertFalse(cleared.verbose);
        Assert.assertFalse(cleared.all);

        final ShortSwitches longNames = parser.parse("--verbose", "--output", "x", "-n", "3");
        Assert.assertTrue(longNames.verbose);
        Assert.assertEquals(longNames.output, "x");
        Assert.assertEquals(longNames.number, 3);

        assertError(parser.tryParse("-ov"), ErrorCategory.COMBINED_SHORT_NAME_NON_SWITCH, "ov");
        assertError(parser.tryParse("-vx"), ErrorCategory.UNKNOWN_ARGUMENT, "x");
        assertError(parser.tryParse("--number", "3"), ErrorCategory.UNKNOWN_ARGUMENT, "number");
    }

    @Test
    public void testExplicitOptionsOverrideClassDefaults() {
        Assert.assertEquals(new CommandLineParser<>(LongShortByDefault.class).parse("--name", "x").name, "x");

        final ParseOptions options = new ParseOptions().setMode(ParsingMode.DEFAULT);
        final CommandLineParser<LongShortByDefault> parser = new CommandLineParser<>(LongShortByDefault.class, options);
        Assert.assertEquals(parser.getOptions().getMode(), ParsingMode.DEFAULT);
        assertError(parser.tryParse("--name", "x"), ErrorCategory.UNKNOWN_ARGUMENT, "-name");
    }

    @Test
    public void testDependencyValidator() {
        assertError(parse(Connection.class, "-port", "80"), ErrorCategory.DEPENDENCY_FAILED, "port");

        final Connection connection = new CommandLineParser<>(Connection.class).parse("-port", "80", "-ip", "10.0.0.1");
        Assert.assertEquals(connection.port.intValue(), 80);
        Assert.assertEquals(connection.ip, "10.0.0.1");

        Assert.assertEquals(parse(Connection.class, "-ip", "10.0.0.1").getStatus(), ParseStatus.SUCCESS);
    }

    @Test
    public void testAbortStopsBeforeLaterErrors() {
        final ParseResult<Cancelling> result = parse(Cancelling.class, "-stop", "-count", "notanumber");
        Assert.assertEquals(result.getStatus(), ParseStatus.CANCELED);
        Assert.assertNull(result.getValue());
        Assert.assertNull(result.getError());
        Assert.assertEquals(result.getArgumentName(), "stop");
        Assert.assertTrue(result.isHelpRequested());
        Assert.assertEquals(result.getRemainingArguments(), Arrays.asList("-count", "notanumber"));
    }

    @Test
    public void testCancelWithSuccessSkipsRequiredArguments() {
        final ParseResult<Cancelling> result = parse(Cancelling.class, "-count", "3", "-done", "-x", "y");
        Assert.assertEquals(result.getStatus(), ParseStatus.SUCCESS);
        Assert.assertEquals(result.getValue().count, 3);
        Assert.assertTrue(result.getValue().done);
        Assert.assertNull(result.getValue().name);
        Assert.assertEquals(result.getArgumentName(), "done");
        Assert.assertEquals(result.getRemainingArguments(), Arrays.asList("-x", "y"));
    }

    @Test
    public void testCancelWithSuccessLeavesLaterPositionalsUnfilled() {
        final ParseResult<HelpWithSuccess> result = parse(HelpWithSuccess.class, "foo", "bar", "-help", "baz");
        Assert.assertEquals(result.getStatus(), ParseStatus.SUCCESS);
        Assert.assertTrue(result.getValue().help);
        Assert.assertEquals(result.getValue().first, "foo");
        Assert.assertEquals(result.getValue().second, "bar");
        Assert.assertNull(result.getValue().third);
        Assert.assertEquals(result.getRemainingArguments(), Collections.singletonList("baz"));
    }

    @Test
    public void testParseReturnsNullWhenAborted() {
        Assert.assertNull(new CommandLineParser<>(Cancelling.class).parse("-stop"));
    }

    @DataProvider(name = "helpArguments")
    public Object[][] helpArguments() {
        return new Object[][]{{"-help"}, {"-?"}, {"-h"}, {"-HELP"}};
    }

    @Test(dataProvider = "helpArguments")
    public void testAutomaticHelp(final String token) {
        final ParseResult<FrobnicateArguments> result = parse(FrobnicateArguments.class, token);
        Assert.assertEquals(result.getStatus(), ParseStatus.CANCELED);
        Assert.assertTrue(result.isHelpRequested());
        Assert.assertEquals(result.getArgumentName(), "help");
    }

    @Test
    public void testHelpWritesUsage() {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        final ParseOptions options = new ParseOptions().setOut(new PrintStream(out, true));
        Assert.assertNull(new CommandLineParser<>(FrobnicateArguments.class, options).parseWithErrorHandling("-help"));
        final String usage = new String(out.toByteArray(), StandardCharsets.UTF_8);
        Assert.assertTrue(usage.contains("Usage: FrobnicateArguments"), usage);
        Assert.assertTrue(usage.contains("-threshold"), usage);
    }

    @Test
    public void testAutomaticVersion() {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        final ParseOptions options = new ParseOptions().setOut(new PrintStream(out, true)).setProgramName("frob");
        final CommandLineParser<FrobnicateArguments> parser = new CommandLineParser<>(FrobnicateArguments.class, options);

        final ParseResult<FrobnicateArguments> result = parser.tryParse("-version");
        Assert.assertEquals(result.getStatus(), ParseStatus.CANCELED);
        Assert.assertTrue(result.isVersionRequested());
        Assert.assertFalse(result.isHelpRequested());

        Assert.assertNull(parser.parseWithErrorHandling("-version"));
        Assert.assertTrue(new String(out.toByteArray(), StandardCharsets.UTF_8).startsWith("frob "));
    }

    @Test
    public void testErrorWritesMessageAndUsage() {
        final ByteArrayOutputStream err = new ByteArrayOutputStream();
        final ParseOptions options = new ParseOptions().setError(new PrintStream(err, true));
        Assert.assertNull(new CommandLineParser<>(FrobnicateArguments.class, options).parseWithErrorHandling("-bogus"));
        final String text = new String(err.toByteArray(), StandardCharsets.UTF_8);
        Assert.assertTrue(text.startsWith("ERROR: "), text);
        Assert.assertTrue(text.contains("bogus"), text);
        Assert.assertTrue(text.contains("Usage:"), text);
    }

    @Test
    public void testDuplicateArgumentPolicies() {
        assertError(parse(Cancelling.class, "-name", "a", "-name", "b"), ErrorCategory.DUPLICATE_ARGUMENT, "name");

        for (final ErrorMode mode : new ErrorMode[]{ErrorMode.WARNING, ErrorMode.ALLOW}) {
            final ParseOptions options = new ParseOptions().setDuplicateArguments(mode);
            final Cancelling c = new CommandLineParser<>(Cancelling.class, options).parse("-name", "a", "-name", "b");
            Assert.assertEquals(c.name, "b");
        }

        final ParseOptions allow = new ParseOptions().setAllowDuplicateArguments(true);
        Assert.assertEquals(allow.getDuplicateArguments(), ErrorMode.ALLOW);
    }

    @Test
    public void testPrefixTerminationPositionalOnly() {
        final ParseOptions options = new ParseOptions().setPrefixTermination(PrefixTerminationMode.POSITIONAL_ONLY);
        final Rest rest = new CommandLineParser<>(Rest.class, options).parse("a", "--", "-flag", "b");
        Assert.assertFalse(rest.flag);
        Assert.assertEquals(rest.rest, Arrays.asList("a", "-flag", "b"));
    }

    @Test
    public void testPrefixTerminationCancelWithSuccess() {
        final ParseOptions options = new ParseOptions().setPrefixTermination(PrefixTerminationMode.CANCEL_WITH_SUCCESS);
        final ParseResult<Rest> result = new CommandLineParser<>(Rest.class, options).tryParse("a", "-flag", "--", "-b", "c");
        Assert.assertEquals(result.getStatus(), ParseStatus.SUCCESS);
        Assert.assertNull(result.getArgumentName());
        Assert.assertTrue(result.getValue().flag);
        Assert.assertEquals(result.getValue().rest, Collections.singletonList("a"));
        Assert.assertEquals(result.getRemainingArguments(), Arrays.asList("-b", "c"));
    }

    @Test
    public void testDictionaries() {
        final Dictionaries d = new CommandLineParser<>(Dictionaries.class)
                .parse("-limits", "a=1", "-limits:b=2", "-settings", "x:=1", "-settings", "x:=2");
        Assert.assertEquals(d.limits.size(), 2);
        Assert.assertEquals(d.limits.get("a").intValue(), 1);
        Assert.assertEquals(d.limits.get("b").intValue(), 2);
        Assert.assertEquals(d.settings.get("x"), "2");

        assertError(parse(Dictionaries.class, "-limits", "a=1", "-limits", "a=2"), ErrorCategory.INVALID_DICTIONARY_VALUE, "limits");
        assertError(parse(Dictionaries.class, "-limits", "a"), ErrorCategory.ARGUMENT_VALUE_CONVERSION, "limits");
        assertError(parse(Dictionaries.class, "-limits", "a=x"), ErrorCategory.ARGUMENT_VALUE_CONVERSION, "limits");
    }

    @Test
    public void testDefaultValues() {
        final ParseResult<Defaults> result = parse(Defaults.class);
        Assert.assertEquals(result.getStatus(), ParseStatus.SUCCESS);
        Assert.assertEquals(result.getValue().answer, 42);
        Assert.assertEquals(result.getValue().list, Arrays.asList(1, 2));
        Assert.assertEquals(result.getValue().untouched, "initial");
        Assert.assertFalse(result.isSupplied("answer"));

        final Defaults supplied = new CommandLineParser<>(Defaults.class).parse("-answer", "7", "-list", "3");
        Assert.assertEquals(supplied.answer, 7);
        Assert.assertEquals(supplied.list, Collections.singletonList(3));
    }

    @Test
    public void testConstructorParameters() {
        final Copy copy = new CommandLineParser<>(Copy.class).parse("a", "b", "-force");
        Assert.assertEquals(copy.getSource(), "a");
        Assert.assertEquals(copy.getDestination(), "b");
        Assert.assertTrue(copy.force);

        final Copy byName = new CommandLineParser<>(Copy.class).parse("-dest", "y", "-source", "x");
        Assert.assertEquals(byName.getSource(), "x");
        Assert.assertEquals(byName.getDestination(), "y");
    }

    @Test
    public void testConstructorFailure() {
        assertError(parse(Copy.class, "boom", "b"), ErrorCategory.CREATE_ARGUMENTS_TYPE_ERROR, null);
    }

    @Test
    public void testNullValues() {
        assertError(parse(NullValues.class, "-primitive", "1"), ErrorCategory.NULL_ARGUMENT_VALUE, "primitive");
        assertError(parse(NullValues.class, "-notNull", "1"), ErrorCategory.NULL_ARGUMENT_VALUE, "notNull");
        Assert.assertNull(new CommandLineParser<>(NullValues.class).parse("-boxed", "1").boxed);
    }

    @Test
    public void testCaseSensitivity() {
        Assert.assertEquals(new CommandLineParser<>(FrobnicateArguments.class).parse("in", "-THRESHOLD:5").threshold.intValue(), 5);

        final ParseOptions options = new ParseOptions().setCaseSensitive(true);
        assertError(new CommandLineParser<>(FrobnicateArguments.class, options).tryParse("in", "-THRESHOLD:5"),
                ErrorCategory.UNKNOWN_ARGUMENT, "THRESHOLD");
    }

    @Test
    public void testPrefixAliases() {
        Assert.assertEquals(new CommandLineParser<>(FrobnicateArguments.class).parse("in", "-thresh:5").threshold.intValue(), 5);
        Assert.assertTrue(new CommandLineParser<>(FrobnicateArguments.class).parse("in", "-tr").truthiness);

        final ParseOptions options = new ParseOptions().setAutoPrefixAliases(false);
        assertError(new CommandLineParser<>(FrobnicateArguments.class, options).tryParse("in", "-thresh:5"),
                ErrorCategory.UNKNOWN_ARGUMENT, "thresh");
    }

    @Test
    public void testWhiteSpaceSeparatorCanBeDisabled() {
        final ParseOptions options = new ParseOptions().setAllowWhiteSpaceValueSeparator(false);
        assertError(new CommandLineParser<>(FrobnicateArguments.class, options).tryParse("in", "-threshold", "5"),
                ErrorCategory.MISSING_NAMED_ARGUMENT_VALUE, "threshold");
    }

    @Test
    public void testTryParseFromIndex() {
        final ParseResult<FrobnicateArguments> result = new CommandLineParser<>(FrobnicateArguments.class)
                .tryParse(new String[]{"ignored", "-flavor", "FOO", "in"}, 1);
        Assert.assertEquals(result.getValue().input, new File("in"));
        Assert.assertEquals(result.getValue().flavor, FrobnicationFlavor.FOO);
    }

    @Test
    public void testStaticParse() {
        final ParseResult<Connection> result = CommandLineParser.parse(Connection.class, new String[]{"-ip", "::1"}, new ParseOptions());
        Assert.assertEquals(result.getValue().ip, "::1");
    }

    @DataProvider(name = "locales")
    public Object[][] locales() {
        return new Object[][]{
                {Locale.ROOT, 1234.5},
                {Locale.US, -1234.5},
                {Locale.GERMANY, 1234.5},
                {Locale.GERMANY, -0.125},
                {Locale.FRANCE, 98765.25},
        };
    }

    @Test(dataProvider = "locales")
    public void testLocaleRoundTrip(final Locale locale, final double amount) {
        final NumberFormat format = NumberFormat.getInstance(locale);
        format.setMaximumFractionDigits(10);
        final LocalDate date = LocalDate.of(2024, 3, 15);
        final String localDate = DateTimeFormatter.ofLocalizedDate(FormatStyle.MEDIUM).withLocale(locale).format(date);

        final ParseOptions options = new ParseOptions().setLocale(locale);
        final Measurements m = new CommandLineParser<>(Measurements.class, options)
                .parse("-amount", format.format(amount), "-date", localDate);
        Assert.assertEquals(m.amount, amount);
        Assert.assertEquals(m.date, date);

        final Measurements iso = new CommandLineParser<>(Measurements.class, options).parse("-date", "2024-03-15");
        Assert.assertEquals(iso.date, date);
    }
}
