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
package argot.util;

import argot.ArgotException;
import org.broadinstitute.barclay.utils.Utils;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Utility for loading properties files from resources.
 */
public class PropertyUtils {

    /**
     * Attempt to load a Properties object from a properties file on the classpath.
     * @param propertyFilePath name of the properties file to load. Must have a .properties extension
     * @param clazz class used to obtain a class loader to use to locate the properties file
     * @return null if the files doesn't exist or isn't readable, otherwise a Properties object
     */
    public static Properties loadPropertiesFile(final String propertyFilePath, final Class<?> clazz) {
        Utils.nonNull(propertyFilePath);

        try (final InputStream inputStream = clazz.getClassLoader().getResourceAsStream(propertyFilePath)) {
            if (inputStream != null) {
                final Properties properties = new Properties();
                properties.load(inputStream);
                return properties;
            } else {
                return null;
            }
        } catch (IOException ex) {
            throw new ArgotException(String.format("IOException loading properties file %s", propertyFilePath), ex);
        }
    }

    /**
     * Returns the value of a system property, falling back to the given properties (which may be null) and then
     * to the default value.
     */
    public static String getProperty(final String name, final Properties fallback, final String defaultValue) {
        final String systemValue = System.getProperty(name);
        if (systemValue != null) {
            return systemValue;
        }
        if (fallback != null) {
            return fallback.getProperty(name, defaultValue);
        }
        return defaultValue;
    }
}
