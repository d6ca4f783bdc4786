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
import argot.cmdline.validation.ArgumentValidator;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable description of one command line argument, built by {@link ArgumentSchema} from an {@link Argument}
 * field, a constructor parameter, or one of the automatic arguments.
 */
public final class ArgumentDescriptor {
    private final String name;
    private final String memberName;
    private final List<String> aliases;
    private final char shortName;
    private final List<Character> shortAliases;
    private final boolean hasLongName;
    private final Integer position;
    private final ValueKind valueKind;
    private final Class<?> argumentType;
    private final Class<?> elementType;
    private final Class<?> keyType;
    private final boolean required;
    private final boolean hasDefaultValue;
    private final Object defaultValue;
    private final boolean multiValue;
    private final boolean dictionary;
    private final String multiValueSeparator;
    private final boolean allowMultiValueWhiteSpaceSeparator;
    private final String keyValueSeparator;
    private final boolean allowDuplicateDictionaryKeys;
    private final boolean isSwitch;
    private final CancelMode cancelMode;
    private final List<ArgumentValidator> validators;
    private final ArgumentConverter<?> converter;
    private final String description;
    private final String valueDescription;
    private final boolean hidden;
    private final ArgumentKind kind;
    private final Field field;
    private final int parameterIndex;

    private ArgumentDescriptor(final Builder builder) {
        this.name = builder.name;
        this.memberName = builder.memberName;
        this.aliases = Collections.unmodifiableList(new ArrayList<>(builder.aliases));
        this.shortName = builder.shortName;
        this.shortAliases = Collections.unmodifiableList(new ArrayList<>(builder.shortAliases));
        this.hasLongName = builder.hasLongName;
        this.position = builder.position;
        this.argumentType = builder.argumentType;
        this.elementType = builder.elementType;
        this.keyType = builder.keyType;
        this.required = builder.required;
        this.hasDefaultValue = builder.hasDefaultValue;
        this.defaultValue = builder.defaultValue;
        this.multiValue = builder.multiValue;
        this.dictionary = builder.dictionary;
        this.multiValueSeparator = builder.multiValueSeparator;
        this.allowMultiValueWhiteSpaceSeparator = builder.allowMultiValueWhiteSpaceSeparator;
        this.keyValueSeparator = builder.keyValueSeparator;
        this.allowDuplicateDictionaryKeys = builder.allowDuplicateDictionaryKeys;
        this.isSwitch = builder.elementType == Boolean.class && !builder.dictionary;
        this.cancelMode = builder.cancelMode;
        this.validators = Collections.unmodifiableList(new ArrayList<>(builder.validators));
        this.converter = builder.converter;
        this.description = builder.description;
        this.hidden = builder.hidden;
        this.kind = builder.kind;
        this.field = builder.field;
        this.parameterIndex = builder.parameterIndex;

        if (dictionary) {
            this.valueKind = ValueKind.DICTIONARY;
        } else if (multiValue) {
            this.valueKind = ValueKind.COLLECTION;
        } else {
            this.valueKind = ValueKind.forElementType(elementType);
        }

        if (builder.valueDescription != null && !builder.valueDescription.isEmpty()) {
            this.valueDescription = builder.valueDescription;
        } else if (dictionary) {
            this.valueDescription = keyType.getSimpleName() + keyValueSeparator + elementType.getSimpleName();
        } else {
            this.valueDescription = elementType.getSimpleName();
        }
    }

    /**
     * The primary name. For an argument with only a short name this is the short name as a string.
     */
    public String getName() {
        return name;
    }

    /** Name of the field or constructor parameter, or null for automatic arguments. */
    public String getMemberName() {
        return memberName;
    }

    public List<String> getAliases() {
        return aliases;
    }

    /** @return the short name, or {@code '\0'} if there is none. */
    public char getShortName() {
        return shortName;
    }

    public boolean hasShortName() {
        return shortName != '\0';
    }

    public List<Character> getShortAliases() {
        return shortAliases;
    }

    public boolean hasLongName() {
        return hasLongName;
    }

    /** @return the index among the positional arguments, or null if the argument can only be given by name. */
    public Integer getPosition() {
        return position;
    }

    public boolean isPositional() {
        return position != null;
    }

    public ValueKind getValueKind() {
        return valueKind;
    }

    /** The declared type of the field or parameter. */
    public Class<?> getArgumentType() {
        return argumentType;
    }

    /**
     * The type each value is converted to: the type itself for single-value arguments, the element type for
     * multi-value arguments and the value type for dictionaries. Primitive types are given as their wrappers.
     */
    public Class<?> getElementType() {
        return elementType;
    }

    /** @return the key type of a dictionary argument, otherwise null. */
    public Class<?> getKeyType() {
        return keyType;
    }

    public boolean isRequired() {
        return required;
    }

    public boolean hasDefaultValue() {
        return hasDefaultValue;
    }

    /**
     * @return the converted default value. For multi-value arguments this is the list of converted elements, and
     * for dictionaries the list of entries.
     */
    public Object getDefaultValue() {
        return defaultValue;
    }

    public boolean isMultiValue() {
        return multiValue;
    }

    public boolean isDictionary() {
        return dictionary;
    }

    /** @return the separator that splits one token into several values, or null. */
    public String getMultiValueSeparator() {
        return multiValueSeparator;
    }

    public boolean isAllowMultiValueWhiteSpaceSeparator() {
        return allowMultiValueWhiteSpaceSeparator;
    }

    public String getKeyValueSeparator() {
        return keyValueSeparator;
    }

    public boolean isAllowDuplicateDictionaryKeys() {
        return allowDuplicateDictionaryKeys;
    }

    /** A switch is a boolean argument that does not need an explicit value. */
    public boolean isSwitch() {
        return isSwitch;
    }

    public CancelMode getCancelMode() {
        return cancelMode;
    }

    public List<ArgumentValidator> getValidators() {
        return validators;
    }

    public ArgumentConverter<?> getConverter() {
        return converter;
    }

    public String getDescription() {
        return description;
    }

    public String getValueDescription() {
        return valueDescription;
    }

    public boolean isHidden() {
        return hidden;
    }

    public ArgumentKind getKind() {
        return kind;
    }

    Field getField() {
        return field;
    }

    int getParameterIndex() {
        return parameterIndex;
    }

    @Override
    public String toString() {
        return name;
    }

    static final class Builder {
        private String name;
        private String memberName;
        private final List<String> aliases = new ArrayList<>();
        private char shortName = '\0';
        private final List<Character> shortAliases = new ArrayList<>();
        private boolean hasLongName = true;
        private Integer position;
        private Class<?> argumentType;
        private Class<?> elementType;
        private Class<?> keyType;
        private boolean required;
        private boolean hasDefaultValue;
        private Object defaultValue;
        private boolean multiValue;
        private boolean dictionary;
        private String multiValueSeparator;
        private boolean allowMultiValueWhiteSpaceSeparator;
        private String keyValueSeparator;
        private boolean allowDuplicateDictionaryKeys;
        private CancelMode cancelMode = CancelMode.NONE;
        private final List<ArgumentValidator> validators = new ArrayList<>();
        private ArgumentConverter<?> converter;
        private String description = "";
        private String valueDescription;
        private boolean hidden;
        private ArgumentKind kind = ArgumentKind.FIELD;
        private Field field;
        private int parameterIndex = -1;

        Builder name(final String name) {
            this.name = name;
            return this;
        }

        String name() {
            return name;
        }

        Builder memberName(final String memberName) {
            this.memberName = memberName;
            return this;
        }

        Builder alias(final String alias) {
            this.aliases.add(alias);
            return this;
        }

        Builder shortName(final char shortName) {
            this.shortName = shortName;
            return this;
        }

        Builder shortAlias(final char shortAlias) {
            this.shortAliases.add(shortAlias);
            return this;
        }

        Builder hasLongName(final boolean hasLongName) {
            this.hasLongName = hasLongName;
            return this;
        }

        Builder position(final Integer position) {
            this.position = position;
            return this;
        }

        Builder argumentType(final Class<?> argumentType) {
            this.argumentType = argumentType;
            return this;
        }

        Builder elementType(final Class<?> elementType) {
            this.elementType = elementType;
            return this;
        }

        Builder keyType(final Class<?> keyType) {
            this.keyType = keyType;
            return this;
        }

        Builder required(final boolean required) {
            this.required = required;
            return this;
        }

        Builder defaultValue(final Object defaultValue) {
            this.hasDefaultValue = true;
            this.defaultValue = defaultValue;
            return this;
        }

        Builder multiValue(final boolean multiValue) {
            this.multiValue = multiValue;
            return this;
        }

        Builder dictionary(final boolean dictionary) {
            this.dictionary = dictionary;
            return this;
        }

        Builder multiValueSeparator(final String separator) {
            this.multiValueSeparator = separator;
            return this;
        }

        Builder allowMultiValueWhiteSpaceSeparator(final boolean allow) {
            this.allowMultiValueWhiteSpaceSeparator = allow;
            return this;
        }

        Builder keyValueSeparator(final String separator) {
            this.keyValueSeparator = separator;
            return this;
        }

        Builder allowDuplicateDictionaryKeys(final boolean allow) {
            this.allowDuplicateDictionaryKeys = allow;
            return this;
        }

        Builder cancelMode(final CancelMode cancelMode) {
            this.cancelMode = cancelMode;
            return this;
        }

        Builder validators(final List<ArgumentValidator> validators) {
            this.validators.addAll(validators);
            return this;
        }

        Builder converter(final ArgumentConverter<?> converter) {
            this.converter = converter;
            return this;
        }

        Builder description(final String description) {
            this.description = description;
            return this;
        }

        Builder valueDescription(final String valueDescription) {
            this.valueDescription = valueDescription;
            return this;
        }

        Builder hidden(final boolean hidden) {
            this.hidden = hidden;
            return this;
        }

        Builder kind(final ArgumentKind kind) {
            this.kind = kind;
            return this;
        }

        Builder field(final Field field) {
            this.field = field;
            return this;
        }

        Builder parameterIndex(final int parameterIndex) {
            this.parameterIndex = parameterIndex;
            return this;
        }

        ArgumentDescriptor build() {
            return new ArgumentDescriptor(this);
        }
    }
}
