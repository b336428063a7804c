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
package samstream;

import htsjdk.samtools.ValidationStringency;
import samstream.sam.FlagFormat;

/**
 * Embodies defaults for global values that affect how SAM text is read and written.  Defaults are encoded in the
 * class and are also overridable using system properties prefixed with "samstream.".
 */
public class Defaults {

    /** Stringency used by readers that are not given one explicitly. */
    public static final ValidationStringency VALIDATION_STRINGENCY;

    /** How writers render the FLAG column when not told otherwise. */
    public static final FlagFormat FLAG_FORMAT;

    /** Size of the read buffer placed in front of input streams. */
    public static final int BUFFER_SIZE;

    static {
        VALIDATION_STRINGENCY = ValidationStringency.valueOf(getStringProperty("validation_stringency", ValidationStringency.STRICT.name()));
        FLAG_FORMAT = FlagFormat.valueOf(getStringProperty("flag_format", FlagFormat.DECIMAL.name()));
        BUFFER_SIZE = getPositiveIntProperty("buffer_size", 128 * 1024);
    }

    private Defaults() {
    }

    /** Gets a string system property, prefixed with "samstream." using the default if the property does not exist. */
    private static String getStringProperty(final String name, final String def) {
        return System.getProperty("samstream." + name, def);
    }

    /**
     * Gets a positive int system property, prefixed with "samstream." using the default if the property does not exist.
     * @throws IllegalArgumentException if the value is not an integer greater than zero.
     */
    static int getPositiveIntProperty(final String name, final int def) {
        final String value = getStringProperty(name, Integer.toString(def));
        final int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("samstream." + name + " must be an integer: " + value, e);
        }
        if (parsed <= 0) {
            throw new IllegalArgumentException("samstream." + name + " must be greater than zero: " + value);
        }
        return parsed;
    }
}
