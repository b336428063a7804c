/*
 * The MIT License
 *
 * Copyright (c) 2026 The Broad Institute
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
package samstream.util;

import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class FieldValidationTest {

    @DataProvider(name = "positions")
    public Object[][] positions() {
        return new Object[][]{
                {-2L, false},
                {-1L, true},
                {0L, true},
                {(1L << 31) - 2, true},
                {(1L << 31) - 1, false},
        };
    }

    @Test(dataProvider = "positions")
    public void testIsValidPosition(final long position, final boolean expected) {
        Assert.assertEquals(FieldValidation.isValidPosition(position), expected);
    }

    @DataProvider(name = "lengths")
    public Object[][] lengths() {
        return new Object[][]{
                {-1L, false},
                {0L, false},
                {1L, true},
                {(1L << 31) - 1, true},
                {1L << 31, false},
        };
    }

    @Test(dataProvider = "lengths")
    public void testIsValidLength(final long length, final boolean expected) {
        Assert.assertEquals(FieldValidation.isValidLength(length), expected);
    }

    @DataProvider(name = "indexPositions")
    public Object[][] indexPositions() {
        return new Object[][]{
                {-2L, false},
                {-1L, true},
                {0L, true},
                {(1L << 29) - 2, true},
                {(1L << 29) - 1, false},
                {(1L << 31) - 2, false},
        };
    }

    @Test(dataProvider = "indexPositions")
    public void testIsValidIndexPosition(final long position, final boolean expected) {
        Assert.assertEquals(FieldValidation.isValidIndexPosition(position), expected);
    }

    @Test
    public void testIsValidTemplateLength() {
        Assert.assertTrue(FieldValidation.isValidTemplateLength(0));
        Assert.assertTrue(FieldValidation.isValidTemplateLength(-(1L << 31)));
        Assert.assertTrue(FieldValidation.isValidTemplateLength((1L << 31) - 1));
        Assert.assertFalse(FieldValidation.isValidTemplateLength(-(1L << 31) - 1));
        Assert.assertFalse(FieldValidation.isValidTemplateLength(1L << 31));
    }

    @Test
    public void testIsValidInt32() {
        Assert.assertTrue(FieldValidation.isValidInt32(Integer.MIN_VALUE));
        Assert.assertTrue(FieldValidation.isValidInt32(Integer.MAX_VALUE));
        Assert.assertFalse(FieldValidation.isValidInt32(Integer.MIN_VALUE - 1L));
        Assert.assertFalse(FieldValidation.isValidInt32(Integer.MAX_VALUE + 1L));
    }
}
