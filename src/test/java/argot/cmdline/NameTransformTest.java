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

import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;

public class NameTransformTest {

    @DataProvider(name = "transforms")
    public Object[][] transforms() {
        return new Object[][]{
                {NameTransform.NONE, "maxCount", "maxCount"},
                {NameTransform.PASCAL_CASE, "maxCount", "MaxCount"},
                {NameTransform.CAMEL_CASE, "MaxCount", "maxCount"},
                {NameTransform.DASH_CASE, "maxCount", "max-count"},
                {NameTransform.SNAKE_CASE, "maxCount", "max_count"},
                {NameTransform.DASH_CASE, "URLPath", "url-path"},
                {NameTransform.CAMEL_CASE, "URLPath", "urlPath"},
                {NameTransform.PASCAL_CASE, "max_count", "MaxCount"},
                {NameTransform.SNAKE_CASE, "max-count", "max_count"},
                {NameTransform.DASH_CASE, "help", "help"},
                {NameTransform.PASCAL_CASE, "", ""},
        };
    }

    @Test(dataProvider = "transforms")
    public void testApply(final NameTransform transform, final String name, final String expected) {
        Assert.assertEquals(transform.apply(name), expected);
    }

    @Test
    public void testSplitWords() {
        Assert.assertEquals(NameTransform.splitWords("URLPath"), Arrays.asList("URL", "Path"));
        Assert.assertEquals(NameTransform.splitWords("some_valueHere"), Arrays.asList("some", "value", "Here"));
        Assert.assertEquals(NameTransform.splitWords("__x"), Arrays.asList("x"));
    }
}
