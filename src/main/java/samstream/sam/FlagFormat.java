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

/**
 * How the FLAG column is rendered when writing SAM text.  Readers accept all three forms.
 */
public enum FlagFormat {
    /** e.g. 99 */
    DECIMAL(0) {
        @Override
        public String format(final int flags) {
            return Integer.toString(flags);
        }
    },
    /** e.g. 0x63 */
    HEX(1) {
        @Override
        public String format(final int flags) {
            return "0x" + Integer.toHexString(flags);
        }
    },
    /** e.g. pP---R1----- */
    STRING(2) {
        @Override
        public String format(final int flags) {
            return SamFlag.toLetterString(flags);
        }
    };

    public static final int MIN_CODE = DECIMAL.code;
    public static final int MAX_CODE = STRING.code;

    private final int code;

    FlagFormat(final int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public abstract String format(int flags);

    /**
     * @throws IllegalArgumentException if code is not between {@link #MIN_CODE} and {@link #MAX_CODE}.
     */
    public static FlagFormat fromCode(final int code) {
        if (code < MIN_CODE || code > MAX_CODE) {
            throw new IllegalArgumentException("Flag format option out of range: " + code +
                    " (must be between " + MIN_CODE + " and " + MAX_CODE + ")");
        }
        for (final FlagFormat format : values()) {
            if (format.code == code) {
                return format;
            }
        }
        throw new IllegalStateException("No flag format for code " + code);
    }
}
