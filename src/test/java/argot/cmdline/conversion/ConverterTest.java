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
package argot.cmdline.conversion;

import argot.cmdline.CommandLineParseException;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.File;
import java.math.BigDecimal;
import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

public class ConverterTest {

    public enum Flavor {
        SWEET, SOUR
    }

    public static class Temperature {
        private final double celsius;

        private Temperature(final double celsius) {
            this.celsius = celsius;
        }

        public static Temperature parse(final String value, final Locale locale) {
            final String number = value.endsWith("C") ? value.substring(0, value.length() - 1) : value;
            return new Temperature(NumberConverter.DOUBLE.convert(number, locale));
        }

        public double getCelsius() {
            return celsius;
        }
    }

    public static class Unconvertible {
        public Unconvertible(final int value) {
        }
    }

    @DataProvider(name = "numbers")
    public Object[][] numbers() {
        return new Object[][]{
                {NumberConverter.INTEGER, "1,234", Locale.US, 1234},
                {NumberConverter.INTEGER, "-17", Locale.ROOT, -17},
                {NumberConverter.LONG, "-1,234,567", Locale.US, -1234567L},
                {NumberConverter.DOUBLE, "12,345.5", Locale.US, 12345.5},
                {NumberConverter.LONG, "1.000.000", Locale.GERMANY, 1000000L},
                {NumberConverter.DOUBLE, "1.234,5", Locale.GERMANY, 1234.5},
                {NumberConverter.DOUBLE, " 2.5 ", Locale.ROOT, 2.5},
                {NumberConverter.FLOAT, "0,5", Locale.FRANCE, 0.5f},
                {NumberConverter.BIG_DECIMAL, "12345678901234567890.5", Locale.ROOT, new BigDecimal("12345678901234567890.5")},
        };
    }

    @Test(dataProvider = "numbers")
    public void testNumbers(final NumberConverter<?> converter, final String value, final Locale locale, final Object expected) {
        Assert.assertEquals(converter.convert(value, locale), expected);
    }

    @DataProvider(name = "badNumbers")
    public Object[][] badNumbers() {
        return new Object[][]{
                {NumberConverter.INTEGER, "", Locale.ROOT},
                {NumberConverter.INTEGER, "1.5", Locale.ROOT},
                {NumberConverter.BYTE, "300", Locale.ROOT},
                {NumberConverter.DOUBLE, "abc", Locale.ROOT},
                {NumberConverter.INTEGER, "1,5", Locale.ROOT},
                {NumberConverter.INTEGER, ",123", Locale.ROOT},
                {NumberConverter.INTEGER, "1234,567", Locale.ROOT},
                {NumberConverter.INTEGER, "1,23,456", Locale.US},
                {NumberConverter.DOUBLE, "2.5", Locale.GERMANY},
                {NumberConverter.DOUBLE, "1,234.5,6", Locale.US},
                {NumberConverter.DOUBLE, "1.5,5.5", Locale.GERMANY},
        };
    }

    @Test(dataProvider = "badNumbers", expectedExceptions = CommandLineParseException.class)
    public void testBadNumbers(final NumberConverter<?> converter, final String value, final Locale locale) {
        converter.convert(value, locale);
    }

    @Test
    public void testBoolean() {
        Assert.assertTrue(BooleanConverter.INSTANCE.convert(" TRUE ", Locale.ROOT));
        Assert.assertFalse(BooleanConverter.INSTANCE.convert("false", Locale.ROOT));
    }

    @Test(expectedExceptions = CommandLineParseException.class)
    public void testBadBoolean() {
        BooleanConverter.INSTANCE.convert("yes", Locale.ROOT);
    }

    @Test
    public void testCharacter() {
        Assert.assertEquals(CharacterConverter.INSTANCE.convert("x", Locale.ROOT).charValue(), 'x');
    }

    @Test(expectedExceptions = CommandLineParseException.class)
    public void testBadCharacter() {
        CharacterConverter.INSTANCE.convert("xy", Locale.ROOT);
    }

    @Test
    public void testEnum() {
        Assert.assertEquals(new EnumConverter<>(Flavor.class).convert("sweet", Locale.ROOT), Flavor.SWEET);
        Assert.assertEquals(new EnumConverter<>(Flavor.class, true).convert("SOUR", Locale.ROOT), Flavor.SOUR);
        try {
            new EnumConverter<>(Flavor.class, true).convert("sour", Locale.ROOT);
            Assert.fail("Expected a conversion error");
        } catch (final CommandLineParseException e) {
            Assert.assertTrue(e.getMessage().contains("Possible values: {SWEET, SOUR}"), e.getMessage());
        }
    }

    @Test
    public void testDateTime() {
        Assert.assertEquals(DateTimeConverter.LOCAL_DATE.convert("2024-03-15", Locale.ROOT), LocalDate.of(2024, 3, 15));
        Assert.assertEquals(DateTimeConverter.LOCAL_DATE.convert("3/15/24", Locale.US), LocalDate.of(2024, 3, 15));
        Assert.assertEquals(DateTimeConverter.LOCAL_TIME.convert("13:45", Locale.ROOT), LocalTime.of(13, 45));
        Assert.assertEquals(DateTimeConverter.DURATION.convert("PT5M", Locale.ROOT), Duration.ofMinutes(5));
    }

    @Test(expectedExceptions = CommandLineParseException.class)
    public void testBadDate() {
        DateTimeConverter.LOCAL_DATE.convert("yesterday", Locale.US);
    }

    @Test
    public void testKeyValuePair() {
        final KeyValuePairConverter<String, Integer> converter =
                new KeyValuePairConverter<>(StringConverter.INSTANCE, NumberConverter.INTEGER, "->");
        final Map.Entry<String, Integer> entry = converter.convert("a->12", Locale.ROOT);
        Assert.assertEquals(entry.getKey(), "a");
        Assert.assertEquals(entry.getValue().intValue(), 12);

        final Map.Entry<String, String> nested =
                new KeyValuePairConverter<>(StringConverter.INSTANCE, StringConverter.INSTANCE, "=").convert("k=v=w", Locale.ROOT);
        Assert.assertEquals(nested.getValue(), "v=w");
    }

    @Test(expectedExceptions = CommandLineParseException.class)
    public void testKeyValuePairWithoutSeparator() {
        new KeyValuePairConverter<>(StringConverter.INSTANCE, StringConverter.INSTANCE, "=").convert("novalue", Locale.ROOT);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testKeyValuePairEmptySeparator() {
        new KeyValuePairConverter<>(StringConverter.INSTANCE, StringConverter.INSTANCE, "");
    }

    @Test
    public void testParseMethod() {
        final ParseMethodConverter<Temperature> converter = ParseMethodConverter.find(Temperature.class);
        Assert.assertNotNull(converter);
        Assert.assertEquals(converter.getMethod().getParameterCount(), 2);
        Assert.assertEquals(converter.convert("21,5C", Locale.GERMANY).getCelsius(), 21.5);

        final UUID uuid = UUID.randomUUID();
        Assert.assertEquals(ParseMethodConverter.find(UUID.class).convert(uuid.toString(), Locale.ROOT), uuid);
        Assert.assertNull(ParseMethodConverter.find(StringBuilder.class));
    }

    @Test(expectedExceptions = CommandLineParseException.class)
    public void testParseMethodFailure() {
        ParseMethodConverter.find(UUID.class).convert("not-a-uuid", Locale.ROOT);
    }

    @Test
    public void testConstructor() {
        Assert.assertEquals(ConstructorConverter.find(StringBuilder.class).convert("abc", Locale.ROOT).toString(), "abc");
        Assert.assertNull(ConstructorConverter.find(Unconvertible.class));
        Assert.assertNull(ConstructorConverter.find(CharSequence.class));
    }

    @Test(expectedExceptions = CommandLineParseException.class)
    public void testConstructorFailure() {
        ConverterRegistry.getDefaultConverter(URI.class).convert("not a uri", Locale.ROOT);
    }

    @Test
    public void testRegistry() {
        Assert.assertSame(ConverterRegistry.getDefaultConverter(int.class), NumberConverter.INTEGER);
        Assert.assertSame(ConverterRegistry.getDefaultConverter(Integer.class), NumberConverter.INTEGER);
        Assert.assertSame(ConverterRegistry.getDefaultConverter(boolean.class), BooleanConverter.INSTANCE);
        Assert.assertSame(ConverterRegistry.getDefaultConverter(Path.class), PathConverter.INSTANCE);
        Assert.assertEquals(ConverterRegistry.getDefaultConverter(File.class).convert("a/b", Locale.ROOT), new File("a/b"));
        Assert.assertEquals(ConverterRegistry.getDefaultConverter(Path.class).convert("a/b", Locale.ROOT), Paths.get("a/b"));
        Assert.assertEquals(ConverterRegistry.getDefaultConverter(Flavor.class).convert("Sour", Locale.ROOT), Flavor.SOUR);
        Assert.assertTrue(ConverterRegistry.getDefaultConverter(UUID.class) instanceof ParseMethodConverter);
        Assert.assertTrue(ConverterRegistry.getDefaultConverter(StringBuilder.class) instanceof ConstructorConverter);
        Assert.assertNull(ConverterRegistry.getDefaultConverter(Object.class));
        Assert.assertNull(ConverterRegistry.getDefaultConverter(Unconvertible.class));
        Assert.assertSame(ConverterRegistry.getDefaultConverter(UUID.class), ConverterRegistry.getDefaultConverter(UUID.class));
    }

    @Test
    public void testWrap() {
        Assert.assertEquals(ConverterRegistry.wrap(long.class), Long.class);
        Assert.assertEquals(ConverterRegistry.wrap(String.class), String.class);
    }
}
