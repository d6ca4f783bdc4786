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
import argot.cmdline.conversion.BooleanConverter;
import argot.cmdline.conversion.ConverterRegistry;
import argot.cmdline.conversion.KeyValuePairConverter;
import argot.cmdline.validation.ArgumentValidator;
import argot.cmdline.validation.ClassValidator;
import argot.cmdline.validation.DependencyValidator;
import argot.cmdline.validation.ValidatorFactory;

import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Discovers the arguments of a class by reflection and checks that they form a consistent set.
 */
final class ArgumentSchemaBuilder {
    private static final String HELP_NAME = "help";
    private static final String VERSION_NAME = "version";

    private final Class<?> type;
    private final ParseOptions options;
    private final ParsingMode mode;
    private final char[] separators;
    private final NavigableMap<String, ArgumentDescriptor> longNames;
    private final NavigableMap<String, ArgumentDescriptor> shortNames;

    ArgumentSchemaBuilder(final Class<?> type, final ParseOptions options) {
        this.type = type;
        this.options = options;
        this.mode = options.getMode();
        this.separators = options.getNameValueSeparators();
        final Comparator<String> comparator = ArgumentSchema.nameComparator(options.isCaseSensitive());
        this.longNames = new TreeMap<>(comparator);
        this.shortNames = new TreeMap<>(comparator);
    }

    ArgumentSchema build() {
        checkType();
        final Constructor<?> constructor = findConstructor();

        final List<ArgumentDescriptor.Builder> parameterArguments = new ArrayList<>();
        final Parameter[] parameters = constructor.getParameters();
        for (int i = 0; i < parameters.length; ++i) {
            final Parameter parameter = parameters[i];
            final Argument annotation = parameter.getAnnotation(Argument.class);
            if ((annotation == null || annotation.name().isEmpty()) && !parameter.isNamePresent()) {
                throw new CommandLineParserDefinitionException("The name of constructor parameter " + i + " of " +
                        type.getName() + " is not available; compile with -parameters or use @Argument(name=...)");
            }
            parameterArguments.add(describe(parameter, parameter.getType(), parameter.getParameterizedType(),
                    parameter.getName(), annotation)
                    .kind(ArgumentKind.CONSTRUCTOR_PARAMETER)
                    .parameterIndex(i)
                    .required(true));
        }

        final List<ArgumentDescriptor.Builder> positionalFields = new ArrayList<>();
        final List<Integer> fieldPositions = new ArrayList<>();
        final List<ArgumentDescriptor.Builder> namedFields = new ArrayList<>();
        for (final Field field : getArgumentFields()) {
            final Argument annotation = field.getAnnotation(Argument.class);
            final ArgumentDescriptor.Builder builder = describe(field, field.getType(), field.getGenericType(), field.getName(), annotation)
                    .kind(ArgumentKind.FIELD)
                    .field(field)
                    .required(annotation.required());
            if (annotation.position() >= 0) {
                int insertAt = 0;
                while (insertAt < fieldPositions.size() && fieldPositions.get(insertAt) <= annotation.position()) {
                    if (fieldPositions.get(insertAt) == annotation.position()) {
                        throw new CommandLineParserDefinitionException("Arguments " + positionalFields.get(insertAt).name() +
                                " and " + builder.name() + " of " + type.getName() + " have the same position " + annotation.position());
                    }
                    ++insertAt;
                }
                fieldPositions.add(insertAt, annotation.position());
                positionalFields.add(insertAt, builder);
            } else {
                namedFields.add(builder);
            }
        }

        final List<ArgumentDescriptor.Builder> positional = new ArrayList<>(parameterArguments);
        positional.addAll(positionalFields);
        final List<ArgumentDescriptor> arguments = new ArrayList<>();
        boolean sawOptional = false;
        for (int i = 0; i < positional.size(); ++i) {
            final ArgumentDescriptor argument = positional.get(i).position(i).build();
            if (argument.isMultiValue() && i < positional.size() - 1) {
                throw new CommandLineParserDefinitionException("Multi-value positional argument " + argument.getName() +
                        " of " + type.getName() + " must be the last positional argument");
            }
            if (argument.isRequired() && sawOptional) {
                throw new CommandLineParserDefinitionException("Required positional argument " + argument.getName() +
                        " of " + type.getName() + " follows an optional positional argument");
            }
            sawOptional |= !argument.isRequired();
            arguments.add(argument);
        }
        for (final ArgumentDescriptor.Builder builder : namedFields) {
            arguments.add(builder.build());
        }

        for (final ArgumentDescriptor argument : arguments) {
            register(argument);
        }
        addAutomaticArguments(arguments);

        final List<ClassValidator> classValidators = ValidatorFactory.createClassValidators(type);
        checkDependencies(arguments, classValidators);

        final Description description = type.getAnnotation(Description.class);
        return new ArgumentSchema(type, mode, options.isCaseSensitive(), constructor, arguments, longNames, shortNames,
                classValidators, description == null ? "" : description.value());
    }

    private void checkType() {
        if (type.isInterface() || type.isEnum() || Modifier.isAbstract(type.getModifiers())) {
            throw new CommandLineParserDefinitionException(type.getName() + " must be a concrete class to hold command line arguments");
        }
        if (type.isMemberClass() && !Modifier.isStatic(type.getModifiers())) {
            throw new CommandLineParserDefinitionException(type.getName() + " must be a top level or static nested class");
        }
    }

    private Constructor<?> findConstructor() {
        final Constructor<?>[] constructors = type.getConstructors();
        Constructor<?> annotated = null;
        for (final Constructor<?> constructor : constructors) {
            if (constructor.isAnnotationPresent(CommandLineConstructor.class)) {
                if (annotated != null) {
                    throw new CommandLineParserDefinitionException("More than one constructor of " + type.getName() +
                            " is annotated with @CommandLineConstructor");
                }
                annotated = constructor;
            }
        }
        if (annotated != null) {
            return annotated;
        }
        if (constructors.length == 1) {
            return constructors[0];
        }
        if (constructors.length == 0) {
            throw new CommandLineParserDefinitionException(type.getName() + " has no public constructor");
        }
        throw new CommandLineParserDefinitionException(type.getName() + " has more than one public constructor; " +
                "annotate the one to use with @CommandLineConstructor");
    }

    /** @return the @Argument fields, superclass fields first, each class in declaration order. */
    private List<Field> getArgumentFields() {
        final List<Class<?>> hierarchy = new ArrayList<>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.add(0, c);
        }
        final List<Field> fields = new ArrayList<>();
        for (final Class<?> c : hierarchy) {
            for (final Field field : c.getDeclaredFields()) {
                if (!field.isAnnotationPresent(Argument.class)) {
                    continue;
                }
                final int modifiers = field.getModifiers();
                if (!Modifier.isPublic(modifiers) || Modifier.isStatic(modifiers) || Modifier.isFinal(modifiers)) {
                    throw new CommandLineParserDefinitionException("Argument field " + c.getName() + "." + field.getName() +
                            " must be public, non-static and non-final");
                }
                fields.add(field);
            }
        }
        return fields;
    }

    private ArgumentDescriptor.Builder describe(final AnnotatedElement element,
                                                final Class<?> rawType,
                                                final Type genericType,
                                                final String memberName,
                                                final Argument annotation) {
        final ArgumentDescriptor.Builder builder = new ArgumentDescriptor.Builder()
                .memberName(memberName)
                .argumentType(rawType);

        final String name = annotation != null && !annotation.name().isEmpty()
                ? annotation.name()
                : options.getNameTransform().apply(memberName);

        final boolean dictionary = Map.class.isAssignableFrom(rawType);
        final boolean multiValue = dictionary || Collection.class.isAssignableFrom(rawType) || rawType.isArray();
        final Class<?> elementType;
        Class<?> keyType = null;
        if (dictionary) {
            keyType = ConverterRegistry.wrap(typeArgument(genericType, 0, name));
            elementType = ConverterRegistry.wrap(typeArgument(genericType, 1, name));
        } else if (rawType.isArray()) {
            elementType = ConverterRegistry.wrap(rawType.getComponentType());
        } else if (multiValue) {
            elementType = ConverterRegistry.wrap(typeArgument(genericType, 0, name));
        } else {
            elementType = ConverterRegistry.wrap(rawType);
        }
        builder.elementType(elementType).keyType(keyType).multiValue(multiValue).dictionary(dictionary);

        describeNames(builder, name, annotation, element);

        final MultiValueSeparator multiValueSeparator = element.getAnnotation(MultiValueSeparator.class);
        if (multiValueSeparator != null) {
            if (!multiValue) {
                throw new CommandLineParserDefinitionException("@MultiValueSeparator is only allowed on multi-value arguments, not on " + name);
            }
            if (multiValueSeparator.value().isEmpty()) {
                builder.allowMultiValueWhiteSpaceSeparator(true);
            } else {
                builder.multiValueSeparator(multiValueSeparator.value());
            }
        }

        final KeyValueSeparator keyValueSeparator = element.getAnnotation(KeyValueSeparator.class);
        if (keyValueSeparator != null && (!dictionary || keyValueSeparator.value().isEmpty())) {
            throw new CommandLineParserDefinitionException("@KeyValueSeparator on " + name + " must be non-empty and on a Map argument");
        }
        final String kvSeparator = keyValueSeparator != null ? keyValueSeparator.value() : KeyValuePairConverter.DEFAULT_SEPARATOR;
        if (dictionary) {
            builder.keyValueSeparator(kvSeparator)
                    .allowDuplicateDictionaryKeys(element.isAnnotationPresent(AllowDuplicateDictionaryKeys.class));
        }

        builder.converter(findConverter(element, elementType, keyType, kvSeparator, name));
        builder.validators(ValidatorFactory.createValidators(element));

        if (annotation != null) {
            builder.description(annotation.doc())
                    .valueDescription(annotation.valueDescription())
                    .hidden(annotation.hidden())
                    .cancelMode(annotation.cancelParsing());
            if (!Argument.NO_DEFAULT_VALUE.equals(annotation.defaultValue())) {
                builder.defaultValue(convertDefaultValue(builder.build(), annotation.defaultValue()));
            }
        }
        return builder;
    }

    private void describeNames(final ArgumentDescriptor.Builder builder, final String name, final Argument annotation,
                               final AnnotatedElement element) {
        final Alias alias = element.getAnnotation(Alias.class);
        final ShortAlias shortAlias = element.getAnnotation(ShortAlias.class);
        char shortName = '\0';
        boolean isLong = true;
        if (annotation != null) {
            isLong = annotation.isLong();
            if (annotation.shortName() != '\0') {
                shortName = annotation.shortName();
            } else if (annotation.isShort() && !name.isEmpty()) {
                shortName = name.charAt(0);
            }
        }

        if (mode == ParsingMode.LONG_SHORT) {
            if (!isLong && shortName == '\0') {
                throw new CommandLineParserDefinitionException("Argument " + name + " has neither a long nor a short name");
            }
            builder.hasLongName(isLong).shortName(shortName);
            builder.name(isLong ? name : String.valueOf(shortName));
            if (shortAlias != null) {
                for (final char c : shortAlias.value()) {
                    builder.shortAlias(c);
                }
            }
        } else {
            if (!isLong) {
                throw new CommandLineParserDefinitionException("Argument " + name + " has only a short name, which requires long/short parsing mode");
            }
            builder.name(name);
            // Short names are ordinary aliases in default mode.
            if (annotation != null && annotation.shortName() != '\0') {
                builder.alias(String.valueOf(annotation.shortName()));
            }
            if (shortAlias != null) {
                for (final char c : shortAlias.value()) {
                    builder.alias(String.valueOf(c));
                }
            }
        }
        if (alias != null) {
            for (final String a : alias.value()) {
                builder.alias(a);
            }
        }
    }

    private Class<?> typeArgument(final Type genericType, final int index, final String name) {
        if (genericType instanceof ParameterizedType) {
            Type argument = ((ParameterizedType) genericType).getActualTypeArguments()[index];
            if (argument instanceof WildcardType) {
                argument = ((WildcardType) argument).getUpperBounds()[0];
            }
            if (argument instanceof Class) {
                return (Class<?>) argument;
            }
            if (argument instanceof ParameterizedType) {
                return (Class<?>) ((ParameterizedType) argument).getRawType();
            }
        }
        throw new CommandLineParserDefinitionException("Cannot determine the element type of argument " + name +
                "; declare it with a concrete type argument");
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private ArgumentConverter<?> findConverter(final AnnotatedElement element, final Class<?> elementType,
                                               final Class<?> keyType, final String kvSeparator, final String name) {
        final ArgumentConverterType converterType = element.getAnnotation(ArgumentConverterType.class);
        final ArgumentConverter<?> valueConverter;
        if (converterType != null) {
            valueConverter = instantiateConverter(converterType.value(), name);
        } else {
            valueConverter = lookupConverter(elementType, name);
        }
        if (keyType == null) {
            return valueConverter;
        }
        final ArgumentConverter<?> keyConverter = lookupConverter(keyType, name);
        return new KeyValuePairConverter((ArgumentConverter<Object>) keyConverter, (ArgumentConverter<Object>) valueConverter, kvSeparator);
    }

    private ArgumentConverter<?> lookupConverter(final Class<?> valueType, final String name) {
        ArgumentConverter<?> converter = options.getConverters().get(valueType);
        if (converter == null) {
            converter = ConverterRegistry.getDefaultConverter(valueType);
        }
        if (converter == null) {
            throw new CommandLineParserDefinitionException("No converter is available for type " + valueType.getName() +
                    " of argument " + name);
        }
        return converter;
    }

    @SuppressWarnings("rawtypes")
    private ArgumentConverter<?> instantiateConverter(final Class<? extends ArgumentConverter> converterClass, final String name) {
        try {
            return converterClass.getConstructor().newInstance();
        } catch (final NoSuchMethodException | InstantiationException | IllegalAccessException e) {
            throw new CommandLineParserDefinitionException("Converter " + converterClass.getName() + " of argument " + name +
                    " needs a public no-argument constructor", e);
        } catch (final InvocationTargetException e) {
            throw new CommandLineParserDefinitionException("Could not create converter " + converterClass.getName() +
                    " of argument " + name, e.getCause());
        }
    }

    private Object convertDefaultValue(final ArgumentDescriptor argument, final String raw) {
        try {
            if (!argument.isMultiValue()) {
                return argument.getConverter().convert(raw, Locale.ROOT);
            }
            final String separator = argument.getMultiValueSeparator();
            final String[] pieces = separator == null ? new String[]{raw} : raw.split(Pattern.quote(separator), -1);
            final List<Object> values = new ArrayList<>(pieces.length);
            for (final String piece : pieces) {
                values.add(argument.getConverter().convert(piece, Locale.ROOT));
            }
            return Collections.unmodifiableList(values);
        } catch (final CommandLineParseException e) {
            throw new CommandLineParserDefinitionException("Default value '" + raw + "' of argument " + argument.getName() +
                    " is not valid: " + e.getMessage(), e);
        }
    }

    private void checkName(final String name) {
        if (name.isEmpty()) {
            throw new CommandLineParserDefinitionException("Argument names of " + type.getName() + " may not be empty");
        }
        for (int i = 0; i < name.length(); ++i) {
            final char ch = name.charAt(i);
            if (Character.isWhitespace(ch)) {
                throw new CommandLineParserDefinitionException("Argument name '" + name + "' may not contain white space");
            }
            for (final char separator : separators) {
                if (ch == separator) {
                    throw new CommandLineParserDefinitionException("Argument name '" + name +
                            "' contains the name/value separator '" + separator + "'");
                }
            }
        }
    }

    private void register(final ArgumentDescriptor argument) {
        if (argument.hasLongName()) {
            registerName(longNames, argument.getName(), argument);
            for (final String alias : argument.getAliases()) {
                registerName(longNames, alias, argument);
            }
        }
        if (argument.hasShortName()) {
            registerName(shortNames, String.valueOf(argument.getShortName()), argument);
            for (final Character alias : argument.getShortAliases()) {
                registerName(shortNames, String.valueOf(alias), argument);
            }
        }
    }

    private void registerName(final Map<String, ArgumentDescriptor> names, final String name, final ArgumentDescriptor argument) {
        checkName(name);
        final ArgumentDescriptor existing = names.get(name);
        if (existing != null) {
            throw new CommandLineParserDefinitionException("Duplicate argument name '" + name + "' in " + type.getName() +
                    " (used by " + existing.getName() + " and " + argument.getName() + ")");
        }
        names.put(name, argument);
    }

    private void addAutomaticArguments(final List<ArgumentDescriptor> arguments) {
        if (options.isAutoHelpArgument()) {
            final String helpName = options.getNameTransform().apply(HELP_NAME);
            if (!longNames.containsKey(helpName)) {
                final ArgumentDescriptor.Builder help = automaticSwitch(helpName, ArgumentKind.AUTOMATIC_HELP)
                        .description("Displays this help message.");
                if (mode == ParsingMode.LONG_SHORT) {
                    final boolean questionFree = !shortNames.containsKey("?");
                    final boolean hFree = !shortNames.containsKey("h");
                    if (questionFree) {
                        help.shortName('?');
                        if (hFree) {
                            help.shortAlias('h');
                        }
                    } else if (hFree) {
                        help.shortName('h');
                    }
                } else {
                    for (final String alias : new String[]{"?", "h"}) {
                        if (!longNames.containsKey(alias)) {
                            help.alias(alias);
                        }
                    }
                }
                final ArgumentDescriptor argument = help.build();
                register(argument);
                arguments.add(argument);
            }
        }
        if (options.isAutoVersionArgument()) {
            final String versionName = options.getNameTransform().apply(VERSION_NAME);
            if (!longNames.containsKey(versionName)) {
                final ArgumentDescriptor argument = automaticSwitch(versionName, ArgumentKind.AUTOMATIC_VERSION)
                        .description("Displays version information.")
                        .build();
                register(argument);
                arguments.add(argument);
            }
        }
    }

    private static ArgumentDescriptor.Builder automaticSwitch(final String name, final ArgumentKind kind) {
        return new ArgumentDescriptor.Builder()
                .name(name)
                .kind(kind)
                .argumentType(boolean.class)
                .elementType(Boolean.class)
                .converter(BooleanConverter.INSTANCE)
                .cancelMode(CancelMode.ABORT);
    }

    private void checkDependencies(final List<ArgumentDescriptor> arguments, final List<ClassValidator> classValidators) {
        for (final ArgumentDescriptor argument : arguments) {
            for (final ArgumentValidator validator : argument.getValidators()) {
                if (validator instanceof DependencyValidator) {
                    checkNamesExist(((DependencyValidator) validator).getArgumentNames(), argument.getName());
                }
            }
        }
        for (final ClassValidator validator : classValidators) {
            if (validator instanceof DependencyValidator) {
                checkNamesExist(((DependencyValidator) validator).getArgumentNames(), type.getSimpleName());
            }
        }
    }

    private void checkNamesExist(final List<String> names, final String owner) {
        for (final String name : names) {
            final boolean found = longNames.containsKey(name) || (name.length() == 1 && shortNames.containsKey(name));
            if (!found) {
                throw new CommandLineParserDefinitionException("Validator of " + owner + " in " + type.getName() +
                        " refers to unknown argument '" + name + "'");
            }
        }
    }
}
