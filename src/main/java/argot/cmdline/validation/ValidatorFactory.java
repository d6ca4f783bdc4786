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

import argot.cmdline.CommandLineParserDefinitionException;

import java.lang.annotation.Annotation;
import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.List;

/**
 * Creates the validators declared by validation annotations on arguments and argument classes.
 */
public final class ValidatorFactory {

    private ValidatorFactory() {
    }

    /** @return the validators of an argument field or parameter, in the order the annotations are declared. */
    public static List<ArgumentValidator> createValidators(final AnnotatedElement element) {
        final List<ArgumentValidator> validators = new ArrayList<>();
        for (final Annotation annotation : element.getAnnotations()) {
            final ArgumentValidation validation = annotation.annotationType().getAnnotation(ArgumentValidation.class);
            if (validation != null) {
                validators.add(instantiate(validation.value(), annotation));
            }
        }
        return validators;
    }

    /** @return the class-level validators of an argument class. */
    public static List<ClassValidator> createClassValidators(final Class<?> type) {
        final List<ClassValidator> validators = new ArrayList<>();
        for (final Annotation annotation : type.getAnnotations()) {
            final ClassValidation validation = annotation.annotationType().getAnnotation(ClassValidation.class);
            if (validation != null) {
                validators.add(instantiate(validation.value(), annotation));
            }
        }
        return validators;
    }

    private static <V> V instantiate(final Class<? extends V> validatorClass, final Annotation annotation) {
        try {
            Constructor<? extends V> ctor;
            try {
                ctor = validatorClass.getConstructor(annotation.annotationType());
                return ctor.newInstance(annotation);
            } catch (final NoSuchMethodException e) {
                ctor = validatorClass.getConstructor();
                return ctor.newInstance();
            }
        } catch (final NoSuchMethodException e) {
            throw new CommandLineParserDefinitionException("Validator " + validatorClass.getName() +
                    " needs a public constructor taking @" + annotation.annotationType().getSimpleName() +
                    " or no arguments", e);
        } catch (final InvocationTargetException e) {
            throw new CommandLineParserDefinitionException("Could not create validator " + validatorClass.getName() +
                    ": " + e.getCause().getMessage(), e.getCause());
        } catch (final InstantiationException | IllegalAccessException e) {
            throw new CommandLineParserDefinitionException("Could not create validator " + validatorClass.getName(), e);
        }
    }
}
