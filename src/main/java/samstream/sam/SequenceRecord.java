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

import htsjdk.samtools.SAMException;
import samstream.util.FieldValidation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A reference sequence.  Corresponds to an @SQ record in the SAM text header.
 *
 * Instances are immutable.  An instance that has not been added to a header has index
 * {@link #UNREGISTERED_INDEX}; {@link SamTextHeader#addSequence(SequenceRecord)} hands back the registered copy,
 * and readers make sure every record naming a sequence shares that one instance.
 */
public final class SequenceRecord {
    public static final String SEQUENCE_NAME_TAG = "SN";
    public static final String SEQUENCE_LENGTH_TAG = "LN";

    /** Length of a sequence known only by name, e.g. one discovered from records of a headerless file. */
    public static final int UNKNOWN_SEQUENCE_LENGTH = 0;

    public static final int UNREGISTERED_INDEX = -1;

    /**
     * Not a valid sequence name; reserved in the RNEXT field to mean "same reference as RNAME".
     */
    public static final String RESERVED_MRNM_SEQUENCE_NAME = "=";

    // Split on any whitespace
    private static final Pattern SEQUENCE_NAME_SPLITTER = Pattern.compile("\\s");

    private final String name;
    private final int length;
    private final int index;
    private final Map<String, String> attributes;

    public SequenceRecord(final String name, final int length) {
        this(name, length, UNREGISTERED_INDEX, Collections.emptyMap());
    }

    /**
     * @param attributes tags other than SN and LN, kept in the given order.
     */
    public SequenceRecord(final String name, final int length, final Map<String, String> attributes) {
        this(name, length, UNREGISTERED_INDEX, attributes);
    }

    private SequenceRecord(final String name, final int length, final int index, final Map<String, String> attributes) {
        validateSequenceName(name);
        if (length != UNKNOWN_SEQUENCE_LENGTH && !FieldValidation.isValidLength(length)) {
            throw new SAMException("Invalid length for sequence " + name + ": " + length);
        }
        this.name = name;
        this.length = length;
        this.index = index;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public String getSequenceName() { return name; }

    public int getSequenceLength() { return length; }

    public boolean hasKnownLength() { return length != UNKNOWN_SEQUENCE_LENGTH; }

    /**
     * @return Index of this record in the header it lives in, or {@link #UNREGISTERED_INDEX}.
     */
    public int getSequenceIndex() { return index; }

    public boolean isRegistered() { return index != UNREGISTERED_INDEX; }

    public String getAttribute(final String tag) { return attributes.get(tag); }

    /** Tags other than SN and LN, in header order. */
    public Map<String, String> getAttributes() { return attributes; }

    /** Used by the header when it takes ownership of this sequence. */
    SequenceRecord withIndex(final int newIndex) {
        return new SequenceRecord(name, length, newIndex, attributes);
    }

    /**
     * Looser than equals(): same name and compatible length, ignoring index and other tags.
     * A sequence of unknown length is compatible with any length.
     */
    public boolean isSameSequence(final SequenceRecord that) {
        if (this == that) return true;
        if (that == null) return false;
        if (!name.equals(that.name)) return false;
        return length == UNKNOWN_SEQUENCE_LENGTH || that.length == UNKNOWN_SEQUENCE_LENGTH || length == that.length;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof SequenceRecord)) return false;

        final SequenceRecord that = (SequenceRecord) o;
        return index == that.index && length == that.length && name.equals(that.name) && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, length, index);
    }

    @Override
    public String toString() {
        return "SequenceRecord(name=" + name + ", length=" + length + ", index=" + index + ")";
    }

    /**
     * Truncate sequence name at the first whitespace.
     */
    public static String truncateSequenceName(final String sequenceName) {
        return SEQUENCE_NAME_SPLITTER.split(sequenceName, 2)[0];
    }

    /**
     * Throw an exception if the sequence name is not valid.
     */
    public static void validateSequenceName(final String name) {
        if (name == null || name.isEmpty()) {
            throw new SAMException("Sequence name must not be empty");
        }
        if (SEQUENCE_NAME_SPLITTER.matcher(name).find()) {
            throw new SAMException("Sequence name contains invalid character: " + name);
        }
        if (RESERVED_MRNM_SEQUENCE_NAME.equals(name) || ReferenceBinding.NO_ALIGNMENT_REFERENCE_NAME.equals(name)) {
            throw new SAMException("'" + name + "' is not a valid sequence name");
        }
    }
}
