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
import htsjdk.samtools.TagValueAndUnsignedArrayFlag;
import htsjdk.samtools.TextTagCodec;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * An optional TAG:TYPE:VALUE field of a SAM text record.  The value is held in its validated text form, so a
 * record decoded and encoded again reproduces the field exactly; {@link #getValue()} gives the typed value as
 * htsjdk's {@link TextTagCodec} produces it.
 */
public final class OptionalField {
    public static final char CHARACTER_TYPE = 'A';
    public static final char INTEGER_TYPE = 'i';
    public static final char FLOAT_TYPE = 'f';
    public static final char STRING_TYPE = 'Z';
    public static final char HEX_TYPE = 'H';
    public static final char ARRAY_TYPE = 'B';

    private static final char SEPARATOR = ':';

    private static final long MAX_UNSIGNED_INT = 0xffffffffL;

    private static final Pattern TAG_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9]");

    // Value syntax per type.  htsjdk converts the value but accepts more than SAM allows, e.g. NaN for f.
    private static final String FLOAT_SYNTAX = "[-+]?[0-9]*\\.?[0-9]+([eE][-+]?[0-9]+)?";
    private static final Pattern CHARACTER_VALUE = Pattern.compile("[!-~]");
    private static final Pattern INTEGER_VALUE = Pattern.compile("[-+]?[0-9]+");
    private static final Pattern FLOAT_VALUE = Pattern.compile(FLOAT_SYNTAX);
    private static final Pattern STRING_VALUE = Pattern.compile("[ !-~]*");
    private static final Pattern HEX_VALUE = Pattern.compile("([0-9A-Fa-f][0-9A-Fa-f])*");
    private static final Pattern ARRAY_VALUE = Pattern.compile("[cCsSiIf](," + FLOAT_SYNTAX + ")+");

    private final String tag;
    private final char type;
    private final String text;
    private final Object value;
    private final boolean unsignedArray;

    private OptionalField(final String tag, final char type, final String text, final Object value,
                          final boolean unsignedArray) {
        this.tag = tag;
        this.type = type;
        this.text = text;
        this.value = value;
        this.unsignedArray = unsignedArray;
    }

    /**
     * Convert from SAM text representation of an optional field.  A colon may appear in the value, so everything
     * after the second colon is the value.
     * @param tagString of the form TAG:TYPE:VALUE
     * @throws SAMFormatException if the field is malformed or its value does not match its type.  An i value
     * between 2^31 and 2^32-1 is accepted here, as a Long; callers decide whether to allow it.
     */
    public static OptionalField decode(final String tagString) {
        final Map.Entry<String, Object> entry;
        try {
            entry = new TextTagCodec().decode(tagString);
        } catch (final IllegalArgumentException e) {
            throw new SAMFormatException("Malformed value in tag '" + tagString + "': " + e.getMessage());
        }

        final String tag = entry.getKey();
        if (!TAG_NAME.matcher(tag).matches()) {
            throw new SAMFormatException("Invalid tag name '" + tag + "'");
        }
        // the codec only accepts single-character types
        final char type = tagString.charAt(tag.length() + 1);
        final String text = tagString.substring(tag.length() + 3);
        if (!valuePattern(type).matcher(text).matches()) {
            throw new SAMFormatException("Tag " + tag + " of type " + type + " has malformed value '" + text + "'");
        }

        if (type == INTEGER_TYPE) {
            final long integer = ((Number) entry.getValue()).longValue();
            if (integer < Integer.MIN_VALUE || integer > MAX_UNSIGNED_INT) {
                throw new SAMFormatException("Tag " + tag + " of type i does not fit in 32 bits: " + text);
            }
        }
        if (entry.getValue() instanceof TagValueAndUnsignedArrayFlag) {
            final TagValueAndUnsignedArrayFlag valueAndFlag = (TagValueAndUnsignedArrayFlag) entry.getValue();
            return new OptionalField(tag, type, text, valueAndFlag.value, valueAndFlag.isUnsignedArray);
        }
        return new OptionalField(tag, type, text, entry.getValue(), false);
    }

    private static Pattern valuePattern(final char type) {
        switch (type) {
            case CHARACTER_TYPE: return CHARACTER_VALUE;
            case INTEGER_TYPE:   return INTEGER_VALUE;
            case FLOAT_TYPE:     return FLOAT_VALUE;
            case STRING_TYPE:    return STRING_VALUE;
            case HEX_TYPE:       return HEX_VALUE;
            case ARRAY_TYPE:     return ARRAY_VALUE;
            default:
                throw new SAMFormatException("Unrecognized tag type: " + type);
        }
    }

    public static OptionalField ofInt(final String tag, final int value) {
        return of(tag, value);
    }

    public static OptionalField ofString(final String tag, final String value) {
        return of(tag, value);
    }

    public static OptionalField ofChar(final String tag, final char value) {
        return of(tag, value);
    }

    public static OptionalField ofFloat(final String tag, final float value) {
        return of(tag, value);
    }

    private static OptionalField of(final String tag, final Object value) {
        return decode(new TextTagCodec().encode(tag, value));
    }

    public String getTag() { return tag; }

    public char getType() { return type; }

    /** The value exactly as written in SAM text. */
    public String getText() { return text; }

    /**
     * @return Character for A; Integer for i, or Long for a value above 2^31-1; Float for f; String for Z;
     * byte[] for H; and for B a byte[], short[], int[] or float[].  Unsigned B arrays (C, S, I) use the same
     * signed Java types, holding the bit pattern of each element, so C,200 comes back as (byte) -56.
     * See {@link #isUnsignedArray()}.
     */
    public Object getValue() { return value; }

    /**
     * @return true for a B field with element type C, S or I.
     */
    public boolean isUnsignedArray() { return unsignedArray; }

    /**
     * @return TAG:TYPE:VALUE
     */
    public String encode() {
        return tag + SEPARATOR + type + SEPARATOR + text;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof OptionalField)) return false;
        final OptionalField that = (OptionalField) o;
        return type == that.type && tag.equals(that.tag) && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tag, type, text);
    }

    @Override
    public String toString() {
        return encode();
    }
}
