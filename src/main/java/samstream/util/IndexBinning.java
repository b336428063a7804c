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

import java.util.BitSet;

/**
 * Hierarchical binning of genomic intervals, as used by BAM and Tribble indices.
 *
 * The coordinate space spans {@link FieldValidation#INDEX_WORD_BITS} bits and is cut into six nested levels.
 * Level 0 is a single window covering everything; each finer level splits every window of the level above into
 * 2^{@link #NEXT_BIN_SHIFT} windows.  Bins are numbered level by level, so level L starts at (8^L - 1) / 7.
 * Both tables are computed here from the two constants rather than spelled out.
 */
public final class IndexBinning {

    /** Each level has 2^NEXT_BIN_SHIFT times as many windows as the level above it. */
    public static final int NEXT_BIN_SHIFT = 3;

    public static final int LEVELS = 6;

    /** Deepest level, with the smallest windows. */
    public static final int FINEST_LEVEL = LEVELS - 1;

    private static final int[] LEVEL_STARTS = new int[LEVELS + 1];
    private static final int[] LEVEL_SHIFTS = new int[LEVELS];

    static {
        for (int level = 0; level <= LEVELS; ++level) {
            LEVEL_STARTS[level] = ((1 << (level * NEXT_BIN_SHIFT)) - 1) / 7;
        }
        for (int level = 0; level < LEVELS; ++level) {
            LEVEL_SHIFTS[level] = FieldValidation.INDEX_WORD_BITS - level * NEXT_BIN_SHIFT;
        }
    }

    /** Number of distinct bins over all levels, =(8^6-1)/7 */
    public static final int MAX_BINS = LEVEL_STARTS[LEVELS];

    /** Total span of genomic coordinates that can be binned. */
    public static final int BIN_GENOMIC_SPAN = 1 << FieldValidation.INDEX_WORD_BITS;

    private IndexBinning() {
    }

    /**
     * @return the first bin number of the given level.
     */
    public static int levelStart(final int level) {
        checkLevel(level);
        return LEVEL_STARTS[level];
    }

    /**
     * @return log2 of the window size at the given level.
     */
    public static int levelShift(final int level) {
        checkLevel(level);
        return LEVEL_SHIFTS[level];
    }

    /**
     * Calculate the bin of the smallest window that contains [beg, end).
     * Total over positions accepted by {@link FieldValidation#isValidIndexPosition(long)}; end &lt;= beg is
     * treated as the single point beg.
     *
     * @param beg 0-based start of the interval, inclusive
     * @param end 0-based end of the interval, exclusive
     */
    public static int reg2bin(final int beg, final int end) {
        final int last = end - 1;
        for (int level = FINEST_LEVEL; level > 0; --level) {
            final int shift = LEVEL_SHIFTS[level];
            if (beg >> shift == last >> shift) {
                return LEVEL_STARTS[level] + (beg >> shift);
            }
        }
        return LEVEL_STARTS[0];
    }

    /**
     * Get candidate bins for the specified region.
     * @param beg 0-based start of the region, inclusive.  Negative values are treated as 0.
     * @param end 0-based end of the region, exclusive.
     * @return bit set with a bit for each bin that may hold features overlapping the region.
     */
    public static BitSet regionToBins(final int beg, final int end) {
        final int maxPos = BIN_GENOMIC_SPAN - 1;
        final int start = beg <= 0 ? 0 : beg & maxPos;
        final int last = Math.max(start, Math.min(end - 1, maxPos));

        final BitSet bitSet = new BitSet(MAX_BINS);
        for (int level = 0; level < LEVELS; ++level) {
            final int shift = LEVEL_SHIFTS[level];
            final int levelStart = LEVEL_STARTS[level];
            for (int k = levelStart + (start >> shift); k <= levelStart + (last >> shift); ++k) {
                bitSet.set(k);
            }
        }
        return bitSet;
    }

    /**
     * @return the level a bin belongs to.
     */
    public static int binLevel(final int bin) {
        if (bin < 0 || bin >= MAX_BINS) {
            throw new IllegalArgumentException("Bin number out of range: " + bin);
        }
        int level = FINEST_LEVEL;
        while (bin < LEVEL_STARTS[level]) {
            --level;
        }
        return level;
    }

    /**
     * @return 0-based first coordinate covered by the bin.
     */
    public static int binStart(final int bin) {
        final int level = binLevel(bin);
        return (bin - LEVEL_STARTS[level]) << LEVEL_SHIFTS[level];
    }

    /**
     * @return number of coordinates covered by the bin.
     */
    public static long binSpan(final int bin) {
        return 1L << LEVEL_SHIFTS[binLevel(bin)];
    }

    /**
     * @return 0-based coordinate one past the last covered by the bin.
     */
    public static long binEnd(final int bin) {
        return binStart(bin) + binSpan(bin);
    }

    private static void checkLevel(final int level) {
        if (level < 0 || level >= LEVELS) {
            throw new IllegalArgumentException("Bin level must be in [0, " + FINEST_LEVEL + "]: " + level);
        }
    }
}
