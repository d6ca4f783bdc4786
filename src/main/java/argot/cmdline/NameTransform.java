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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Transformation applied to a field, parameter or class name when no explicit argument or command name is given.
 */
public enum NameTransform {
    /** The member name is used as is. */
    NONE,
    /** {@code maxCount} becomes {@code MaxCount}. */
    PASCAL_CASE,
    /** {@code MaxCount} becomes {@code maxCount}. */
    CAMEL_CASE,
    /** {@code maxCount} becomes {@code max-count}. */
    DASH_CASE,
    /** {@code maxCount} becomes {@code max_count}. */
    SNAKE_CASE;

    public String apply(final String name) {
        if (this == NONE || name.isEmpty()) {
            return name;
        }

        final List<String> words = splitWords(name);
        final StringBuilder sb = new StringBuilder(name.length() + words.size());
        for (int i = 0; i < words.size(); ++i) {
            final String word = words.get(i);
            switch (this) {
                case PASCAL_CASE:
                    sb.append(capitalize(word));
                    break;
                case CAMEL_CASE:
                    sb.append(i == 0 ? word.toLowerCase(Locale.ROOT) : capitalize(word));
                    break;
                case DASH_CASE:
                    if (i > 0) sb.append('-');
                    sb.append(word.toLowerCase(Locale.ROOT));
                    break;
                case SNAKE_CASE:
                    if (i > 0) sb.append('_');
                    sb.append(word.toLowerCase(Locale.ROOT));
                    break;
                default:
                    throw new IllegalStateException("Unexpected name transform " + this);
            }
        }
        return sb.toString();
    }

    private static String capitalize(final String word) {
        return Character.toUpperCase(word.charAt(0)) + word.substring(1).toLowerCase(Locale.ROOT);
    }

    /**
     * Splits an identifier on underscores, dashes and case changes. A run of capitals is kept together as one word,
     * so {@code URLPath} gives {@code URL} and {@code Path}.
     */
    static List<String> splitWords(final String name) {
        final List<String> words = new ArrayList<>();
        final StringBuilder current = new StringBuilder();
        for (int i = 0; i < name.length(); ++i) {
            final char ch = name.charAt(i);
            if (ch == '_' || ch == '-') {
                flush(words, current);
                continue;
            }
            if (Character.isUpperCase(ch) && current.length() > 0) {
                final char previous = name.charAt(i - 1);
                final boolean nextIsLower = i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1));
                if (!Character.isUpperCase(previous) || nextIsLower) {
                    flush(words, current);
                }
            }
            current.append(ch);
        }
        flush(words, current);
        return words;
    }

    private static void flush(final List<String> words, final StringBuilder current) {
        if (current.length() > 0) {
            words.add(current.toString());
            current.setLength(0);
        }
    }
}
