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

import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The value of one argument during a single parse.
 */
final class ArgumentState {
    private final ArgumentDescriptor argument;
    private boolean hasValue;
    private String usedName;
    private String rawValue;
    private Object value;
    private final List<Object> values = new ArrayList<>();
    private final Map<Object, Object> entries = new LinkedHashMap<>();

    ArgumentState(final ArgumentDescriptor argument) {
        this.argument = argument;
    }

    ArgumentDescriptor getArgument() {
        return argument;
    }

    boolean hasValue() {
        return hasValue;
    }

    String getUsedName() {
        return usedName;
    }

    String getRawValue() {
        return rawValue;
    }

    void markSupplied(final String usedName, final String rawValue) {
        this.hasValue = true;
        this.usedName = usedName;
        this.rawValue = rawValue;
    }

    void setValue(final Object value) {
        this.value = value;
    }

    void addValue(final Object value) {
        values.add(value);
    }

    boolean containsKey(final Object key) {
        return entries.containsKey(key);
    }

    void putEntry(final Map.Entry<?, ?> entry) {
        entries.put(entry.getKey(), entry.getValue());
    }

    /**
     * @return the value as validators see it: the scalar value, or an unmodifiable view of the values or entries so
     * far. Null if the argument has no value.
     */
    Object getValue() {
        if (!hasValue) {
            return null;
        }
        if (argument.isDictionary()) {
            return Collections.unmodifiableMap(entries);
        }
        if (argument.isMultiValue()) {
            return Collections.unmodifiableList(values);
        }
        return value;
    }

    /** @return the supplied value in the form of the field or parameter type. */
    Object toTargetValue() {
        if (argument.isDictionary()) {
            return createMap(entries);
        }
        if (argument.isMultiValue()) {
            return createCollection(values);
        }
        return value;
    }

    /** @return the default value in the form of the field or parameter type. */
    Object defaultToTargetValue() {
        if (!argument.isMultiValue()) {
            return argument.getDefaultValue();
        }
        final List<?> defaults = (List<?>) argument.getDefaultValue();
        if (argument.isDictionary()) {
            final Map<Object, Object> map = new LinkedHashMap<>();
            for (final Object o : defaults) {
                final Map.Entry<?, ?> entry = (Map.Entry<?, ?>) o;
                map.put(entry.getKey(), entry.getValue());
            }
            return createMap(map);
        }
        return createCollection(defaults);
    }

    @SuppressWarnings("unchecked")
    private Object createCollection(final List<?> elements) {
        final Class<?> type = argument.getArgumentType();
        if (type.isArray()) {
            final Object array = Array.newInstance(type.getComponentType(), elements.size());
            for (int i = 0; i < elements.size(); ++i) {
                Array.set(array, i, elements.get(i));
            }
            return array;
        }
        final Collection<Object> collection;
        if (isInstantiable(type)) {
            collection = (Collection<Object>) instantiate(type);
        } else if (type.isAssignableFrom(ArrayList.class)) {
            collection = new ArrayList<>();
        } else if (type.isAssignableFrom(LinkedHashSet.class)) {
            collection = new LinkedHashSet<>();
        } else if (type.isAssignableFrom(TreeSet.class)) {
            collection = new TreeSet<>();
        } else if (type.isAssignableFrom(ArrayDeque.class)) {
            collection = new ArrayDeque<>();
        } else {
            throw new CommandLineArgumentException(ErrorCategory.APPLY_VALUE_ERROR, argument.getName(),
                    "Cannot create a collection of type " + type.getName() + " for argument " + argument.getName());
        }
        collection.addAll(elements);
        return collection;
    }

    @SuppressWarnings("unchecked")
    private Object createMap(final Map<Object, Object> source) {
        final Class<?> type = argument.getArgumentType();
        final Map<Object, Object> map;
        if (isInstantiable(type)) {
            map = (Map<Object, Object>) instantiate(type);
        } else if (type.isAssignableFrom(LinkedHashMap.class)) {
            map = new LinkedHashMap<>();
        } else if (type.isAssignableFrom(TreeMap.class)) {
            map = new TreeMap<>();
        } else {
            throw new CommandLineArgumentException(ErrorCategory.APPLY_VALUE_ERROR, argument.getName(),
                    "Cannot create a map of type " + type.getName() + " for argument " + argument.getName());
        }
        map.putAll(source);
        return map;
    }

    private static boolean isInstantiable(final Class<?> type) {
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            return false;
        }
        try {
            type.getConstructor();
            return true;
        } catch (final NoSuchMethodException e) {
            return false;
        }
    }

    private Object instantiate(final Class<?> type) {
        try {
            return type.getConstructor().newInstance();
        } catch (final InvocationTargetException e) {
            throw new CommandLineArgumentException(ErrorCategory.APPLY_VALUE_ERROR, argument.getName(),
                    "Cannot create " + type.getName() + " for argument " + argument.getName(), e.getCause());
        } catch (final NoSuchMethodException | InstantiationException | IllegalAccessException e) {
            throw new CommandLineArgumentException(ErrorCategory.APPLY_VALUE_ERROR, argument.getName(),
                    "Cannot create " + type.getName() + " for argument " + argument.getName(), e);
        }
    }
}
