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
package samstream.sam;

import htsjdk.samtools.SAMFormatException;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class SamFlagTest {

    @DataProvider(name = "flagTexts")
    public Object[][] flagTexts() {
        return new Object[][]{
                {"99", 99},
                {"0x63", 99},
                {"pP---R1-----", 99},
                {"0", 0},
                {"0x0", 0},
                {"------------", 0},
                {"--u---------", 4},
                {"65535", 0xFFFF},
        };
    }

    @Test(dataProvider = "flagTexts")
    public void testParseFlags(final String text, final int expected) {
        Assert.assertEquals(SamFlag.parseFlags(text), expected);
    }

    @DataProvider(name = "badFlagTexts")
    public Object[][] badFlagTexts() {
        return new Object[][]{
                {""},
                {"0x"},
                {"65536"},
                {"0x10000"},
                {"-1"},
                {"12abc"},
                // letters in the wrong slot
                {"Pp----------"},
                {"pP---R1----"},
        };
    }

    @Test(dataProvider = "badFlagTexts", expectedExceptions = SAMFormatException.class)
    public void testParseBadFlags(final String text) {
        SamFlag.parseFlags(text);
    }

    @Test
    public void testFormats() {
        Assert.assertEquals(FlagFormat.DECIMAL.format(99), "99");
        Assert.assertEquals(FlagFormat.HEX.format(99), "0x63");
        Assert.assertEquals(FlagFormat.STRING.format(99), "pP---R1-----");
        Assert.assertEquals(FlagFormat.STRING.format(16), "----r-------");
        Assert.assertEquals(FlagFormat.STRING.format(0xFFF), "pPuUrR12sfdS");
    }

    @Test
    public void testPairedOnlyBitsHiddenWhenUnpaired() {
        // mate unmapped and first-of-pair mean nothing without the paired bit
        final int flags = SamFlag.READ_UNMAPPED.intValue() | SamFlag.MATE_UNMAPPED.intValue() | SamFlag.FIRST_OF_PAIR.intValue();
        Assert.assertEquals(FlagFormat.STRING.format(flags), "--u---------");
        Assert.assertEquals(FlagFormat.DECIMAL.format(flags), Integer.toString(flags));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testStringFormatRejectsHighBits() {
        FlagFormat.STRING.format(0x1000);
    }

    @Test
    public void testEveryFormatParsesBack() {
        for (final FlagFormat format : FlagFormat.values()) {
            Assert.assertEquals(SamFlag.parseFlags(format.format(0x853)), 0x853, format.name());
        }
    }

    @Test
    public void testFromCode() {
        Assert.assertEquals(FlagFormat.fromCode(0), FlagFormat.DECIMAL);
        Assert.assertEquals(FlagFormat.fromCode(1), FlagFormat.HEX);
        Assert.assertEquals(FlagFormat.fromCode(2), FlagFormat.STRING);
        for (final FlagFormat format : FlagFormat.values()) {
            Assert.assertEquals(FlagFormat.fromCode(format.getCode()), format);
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testFromCodeAboveRange() {
        FlagFormat.fromCode(FlagFormat.MAX_CODE + 1);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testFromCodeBelowRange() {
        FlagFormat.fromCode(FlagFormat.MIN_CODE - 1);
    }
}
