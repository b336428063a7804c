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

/**
 * SAM flag bits, with the letter each one is shown as in the {@link FlagFormat#STRING} rendering.
 */
public enum SamFlag {
    READ_PAIRED(0x1, 'p'),
    PROPER_PAIR(0x2, 'P'),
    READ_UNMAPPED(0x4, 'u'),
    MATE_UNMAPPED(0x8, 'U'),
    READ_REVERSE_STRAND(0x10, 'r'),
    MATE_REVERSE_STRAND(0x20, 'R'),
    FIRST_OF_PAIR(0x40, '1'),
    SECOND_OF_PAIR(0x80, '2'),
    SECONDARY_ALIGNMENT(0x100, 's'),
    READ_FAILS_VENDOR_QUALITY_CHECK(0x200, 'f'),
    DUPLICATE_READ(0x400, 'd'),
    SUPPLEMENTARY_ALIGNMENT(0x800, 'S');

    /** Flag values are stored in 16 bits in BAM. */
    public static final int MAX_FLAGS = 0xFFFF;

    /** Bits that mean nothing unless {@link #READ_PAIRED} is set. */
    public static final int PAIRED_ONLY_MASK = PROPER_PAIR.flag | MATE_UNMAPPED.flag | MATE_REVERSE_STRAND.flag |
            FIRST_OF_PAIR.flag | SECOND_OF_PAIR.flag;

    /** Bits that the letter form can show. */
    public static final int STRING_FORM_MASK = 0xFFF;

    private static final char UNSET_CHAR = '-';
    private static final String HEX_PREFIX = "0x";

    private final int flag;
    private final char letter;

    SamFlag(final int flag, final char letter) {
        this.flag = flag;
        this.letter = letter;
    }

    public int intValue() {
        return flag;
    }

    public char getLetter() {
        return letter;
    }

    public boolean isSet(final int flags) {
        return (flags & flag) != 0;
    }

    /**
     * Letter form of the flags, lowest bit first, '-' for unset bits.  When the read is not paired the pair-only
     * bits are shown as unset since nothing can be assumed about them.
     */
    static String toLetterString(int flags) {
        if ((flags & ~STRING_FORM_MASK) != 0) {
            throw new IllegalArgumentException("Flags " + flags + " have bits that cannot be written in letter form");
        }
        if (!READ_PAIRED.isSet(flags)) {
            flags &= ~PAIRED_ONLY_MASK;
        }
        final SamFlag[] values = values();
        final char[] chars = new char[values.length];
        for (int i = 0; i < values.length; ++i) {
            chars[i] = values[i].isSet(flags) ? values[i].letter : UNSET_CHAR;
        }
        return new String(chars);
    }

    /**
     * Parses a FLAG column in any of the forms {@link FlagFormat} can produce.
     * @throws SAMFormatException if the text is in none of them, or the value does not fit in 16 bits.
     */
    public static int parseFlags(final String text) {
        final int flags;
        if (text.startsWith(HEX_PREFIX)) {
            flags = parseNumber(text.substring(HEX_PREFIX.length()), 16, text);
        } else if (!text.isEmpty() && Character.isDigit(text.charAt(0))) {
            flags = parseNumber(text, 10, text);
        } else {
            flags = parseLetters(text);
        }
        if (flags < 0 || flags > MAX_FLAGS) {
            throw new SAMFormatException("FLAG out of range: " + text);
        }
        return flags;
    }

    private static int parseNumber(final String digits, final int radix, final String text) {
        try {
            return Integer.parseInt(digits, radix);
        } catch (final NumberFormatException e) {
            throw new SAMFormatException("Non-numeric value in FLAG column: " + text);
        }
    }

    private static int parseLetters(final String text) {
        final SamFlag[] values = values();
        if (text.length() != values.length) {
            throw new SAMFormatException("Unrecognized FLAG value: " + text);
        }
        int flags = 0;
        for (int i = 0; i < values.length; ++i) {
            final char c = text.charAt(i);
            if (c == values[i].letter) {
                flags |= values[i].flag;
            } else if (c != UNSET_CHAR) {
                throw new SAMFormatException("Unexpected character '" + c + "' at position " + i + " of FLAG " + text);
            }
        }
        return flags;
    }
}
