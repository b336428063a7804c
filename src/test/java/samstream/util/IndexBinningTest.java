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

import java.util.BitSet;

public class IndexBinningTest {

    @Test
    public void testDerivedTables() {
        final int[] expectedStarts = {0, 1, 9, 73, 585, 4681};
        final int[] expectedShifts = {29, 26, 23, 20, 17, 14};
        for (int level = 0; level < IndexBinning.LEVELS; ++level) {
            Assert.assertEquals(IndexBinning.levelStart(level), expectedStarts[level], "start of level " + level);
            Assert.assertEquals(IndexBinning.levelShift(level), expectedShifts[level], "shift of level " + level);
        }
        Assert.assertEquals(IndexBinning.MAX_BINS, 37449);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testLevelOutOfRange() {
        IndexBinning.levelStart(IndexBinning.LEVELS);
    }

    @DataProvider(name = "intervals")
    public Object[][] intervals() {
        return new Object[][]{
                {0, 1, 4681},
                {100, 200, 4681},
                {16384, 16385, 4682},
                // straddles a finest-level boundary
                {16383, 16385, 585},
                {0, 1 << 26, 1},
                {1 << 26, (1 << 26) + 1, 4681 + 4096},
                {100, 100000000, 0},
                // empty interval is treated as the single point beg
                {500, 500, 4681},
                {-1, 0, 4680},
        };
    }

    @Test(dataProvider = "intervals")
    public void testReg2bin(final int beg, final int end, final int expectedBin) {
        Assert.assertEquals(IndexBinning.reg2bin(beg, end), expectedBin);
    }

    @Test
    public void testNestedIntervalIsNotCoarser() {
        final int outerBin = IndexBinning.reg2bin(100, 100000000);
        final int innerBin = IndexBinning.reg2bin(100, 200);
        Assert.assertNotEquals(innerBin, outerBin);
        Assert.assertTrue(IndexBinning.binLevel(innerBin) >= IndexBinning.binLevel(outerBin));
        Assert.assertTrue(IndexBinning.levelStart(IndexBinning.binLevel(outerBin)) <=
                IndexBinning.levelStart(IndexBinning.binLevel(innerBin)));
    }

    @Test
    public void testBinGeometry() {
        Assert.assertEquals(IndexBinning.binLevel(0), 0);
        Assert.assertEquals(IndexBinning.binLevel(4680), 4);
        Assert.assertEquals(IndexBinning.binLevel(4681), 5);
        Assert.assertEquals(IndexBinning.binStart(4682), 16384);
        Assert.assertEquals(IndexBinning.binSpan(4682), 16384L);
        Assert.assertEquals(IndexBinning.binEnd(4682), 32768L);
        Assert.assertEquals(IndexBinning.binSpan(0), 1L << 29);
        Assert.assertEquals(IndexBinning.binSpan(1), 1L << 26);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testBinLevelOutOfRange() {
        IndexBinning.binLevel(IndexBinning.MAX_BINS);
    }

    @Test
    public void testRegionToBins() {
        final BitSet bins = IndexBinning.regionToBins(0, 1);
        Assert.assertEquals(bins.cardinality(), 6);
        for (int level = 0; level < IndexBinning.LEVELS; ++level) {
            Assert.assertTrue(bins.get(IndexBinning.levelStart(level)));
        }

        final BitSet twoFinest = IndexBinning.regionToBins(0, (1 << 14) + 1);
        Assert.assertEquals(twoFinest.cardinality(), 7);
        Assert.assertTrue(twoFinest.get(4681));
        Assert.assertTrue(twoFinest.get(4682));
    }

    @Test
    public void testRegionToBinsContainsReg2bin() {
        final int beg = 123456;
        final int end = 987654;
        final BitSet bins = IndexBinning.regionToBins(beg, end);
        Assert.assertTrue(bins.get(IndexBinning.reg2bin(beg, end)));
        Assert.assertTrue(bins.get(IndexBinning.reg2bin(beg + 10, beg + 20)));
    }
}
