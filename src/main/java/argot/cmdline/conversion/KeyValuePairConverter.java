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

import java.util.AbstractMap;
import java.util.Locale;
import java.util.Map;

/**
 * Converts {@code key<separator>value} into a map entry, splitting at the first occurrence of the separator.
 */
public class KeyValuePairConverter<K, V> implements ArgumentConverter<Map.Entry<K, V>> {
    public static final String DEFAULT_SEPARATOR = "=";

    private final ArgumentConverter<K> keyConverter;
    private final ArgumentConverter<V> valueConverter;
    private final String separator;

    public KeyValuePairConverter(final ArgumentConverter<K> keyConverter, final ArgumentConverter<V> valueConverter,
                                 final String separator) {
        if (separator == null || separator.isEmpty()) {
            throw new IllegalArgumentException("Key/value separator may not be empty");
        }
        this.keyConverter = keyConverter;
        this.valueConverter = valueConverter;
        this.separator = separator;
    }

    public String getSeparator() {
        return separator;
    }

    @Override
    public Map.Entry<K, V> convert(final String value, final Locale locale) {
        final int index = value.indexOf(separator);
        if (index < 0) {
            throw new CommandLineParseException("'" + value + "' is not a valid key/value pair; expected key" + separator + "value.");
        }
        final K key = keyConverter.convert(value.substring(0, index), locale);
        final V converted = valueConverter.convert(value.substring(index + separator.length()), locale);
        return new AbstractMap.SimpleImmutableEntry<>(key, converted);
    }
}
