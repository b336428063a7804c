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

/**
 * Range checks for the numeric fields of a SAM text record.  The text format has to stay losslessly
 * convertible to BAM, so a value outside these ranges is a format violation even though the text
 * itself could carry it.
 *
 * All methods take a long so that values parsed from text can be checked before they are narrowed.
 */
public final class FieldValidation {

    /** Width of a signed BAM word, less the sign bit. */
    public static final int WORD_BITS = 31;

    /** Coordinates stored in a binning index are limited to this many bits. */
    public static final int INDEX_WORD_BITS = 29;

    public static final long MAX_LENGTH = (1L << WORD_BITS) - 1;
    public static final long MAX_POSITION = (1L << WORD_BITS) - 2;
    public static final long MIN_TEMPLATE_LENGTH = -(1L << WORD_BITS);
    public static final long MAX_TEMPLATE_LENGTH = (1L << WORD_BITS) - 1;
    public static final long MAX_INDEX_POSITION = (1L << INDEX_WORD_BITS) - 2;

    /** Zero-based position meaning "no coordinate". */
    public static final int UNKNOWN_POSITION = -1;

    private FieldValidation() {
    }

    /** True if i fits in a signed 32-bit integer. */
    public static boolean isValidInt32(final long i) {
        return Integer.MIN_VALUE <= i && i <= Integer.MAX_VALUE;
    }

    /** True if i is a usable sequence or read length. */
    public static boolean isValidLength(final long i) {
        return 1 <= i && i <= MAX_LENGTH;
    }

    /** True if i is a usable zero-based position; -1 is the unknown position. */
    public static boolean isValidPosition(final long i) {
        return UNKNOWN_POSITION <= i && i <= MAX_POSITION;
    }

    public static boolean isValidTemplateLength(final long i) {
        return MIN_TEMPLATE_LENGTH <= i && i <= MAX_TEMPLATE_LENGTH;
    }

    /**
     * True if i is a zero-based position that can be packed into a bin number.
     * @see IndexBinning#reg2bin(int, int)
     */
    public static boolean isValidIndexPosition(final long i) {
        return UNKNOWN_POSITION <= i && i <= MAX_INDEX_POSITION;
    }
}
