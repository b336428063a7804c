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

import htsjdk.samtools.Cigar;
import htsjdk.samtools.CigarElement;
import htsjdk.samtools.TextCigarCodec;
import samstream.util.FieldValidation;
import samstream.util.IndexBinning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One alignment line of a SAM text file.
 *
 * Positions are held 0-based, with {@link #NO_ALIGNMENT_START} for "no position"; the text form is 1-based
 * with 0 for "no position".  Reference fields are {@link ReferenceBinding}s rather than names, so a record
 * handed out by {@link SamTextReader} points at the very {@link SequenceRecord} instance held in the reader's header.
 *
 * A record is created by the decoder for each line and belongs to the caller afterwards.  It is not thread-safe.
 */
public class SamTextRecord {
    /** Alignment start meaning "no position", i.e. POS 0 in text. */
    public static final int NO_ALIGNMENT_START = FieldValidation.UNKNOWN_POSITION;

    public static final int NO_MAPPING_QUALITY = 0;
    public static final int UNKNOWN_MAPPING_QUALITY = 255;

    /** SEQ or QUAL column for a record that has none. */
    public static final String NULL_SEQUENCE_STRING = "*";
    public static final String NULL_QUALS_STRING = "*";

    /** Bin of a record with no coordinate, =reg2bin(-1, 0) */
    public static final int UNMAPPED_READ_BIN = IndexBinning.reg2bin(-1, 0);

    /** Bin value for a record whose coordinates cannot be binned. */
    public static final int NO_BIN = -1;

    private String mReadName = "*";
    private int mFlags = 0;
    private ReferenceBinding mReferenceBinding = ReferenceBinding.UNMAPPED;
    private int mAlignmentStart = NO_ALIGNMENT_START;
    private int mMappingQuality = NO_MAPPING_QUALITY;
    private Cigar mCigar = new Cigar();
    private ReferenceBinding mMateReferenceBinding = ReferenceBinding.UNMAPPED;
    private int mMateAlignmentStart = NO_ALIGNMENT_START;
    private int mInferredInsertSize = 0;
    private String mReadString = NULL_SEQUENCE_STRING;
    private String mBaseQualityString = NULL_QUALS_STRING;
    private final List<OptionalField> mAttributes = new ArrayList<>();

    public String getReadName() { return mReadName; }

    public void setReadName(final String value) { mReadName = value; }

    public int getFlags() { return mFlags; }

    public void setFlags(final int value) { mFlags = value; }

    public boolean getFlag(final SamFlag flag) { return flag.isSet(mFlags); }

    public void setFlag(final SamFlag flag, final boolean value) {
        if (value) {
            mFlags |= flag.intValue();
        } else {
            mFlags &= ~flag.intValue();
        }
    }

    public boolean getReadPairedFlag() { return getFlag(SamFlag.READ_PAIRED); }

    public boolean getReadUnmappedFlag() { return getFlag(SamFlag.READ_UNMAPPED); }

    public boolean getMateUnmappedFlag() { return getFlag(SamFlag.MATE_UNMAPPED); }

    public boolean getReadNegativeStrandFlag() { return getFlag(SamFlag.READ_REVERSE_STRAND); }

    public ReferenceBinding getReferenceBinding() { return mReferenceBinding; }

    public void setReferenceBinding(final ReferenceBinding binding) {
        mReferenceBinding = Objects.requireNonNull(binding, "binding");
    }

    /** Convenience for {@code getReferenceBinding().getName()}; "*" if unmapped. */
    public String getReferenceName() { return mReferenceBinding.getName(); }

    public int getReferenceIndex() { return mReferenceBinding.getIndex(); }

    /**
     * @return 0-based start of the alignment, or {@link #NO_ALIGNMENT_START}.
     */
    public int getAlignmentStart() { return mAlignmentStart; }

    public void setAlignmentStart(final int value) { mAlignmentStart = value; }

    /**
     * @return 0-based exclusive end of the alignment on the reference: start plus the reference span of the CIGAR,
     * or {@link #NO_ALIGNMENT_START}.  A long, since a CIGAR may span more than 2^31 bases.
     */
    public long getAlignmentEnd() {
        if (mAlignmentStart == NO_ALIGNMENT_START) {
            return NO_ALIGNMENT_START;
        }
        return mAlignmentStart + getReferenceSpan();
    }

    /**
     * @return number of reference bases covered by the CIGAR, excluding padding.
     */
    public long getReferenceSpan() {
        long length = 0;
        for (final CigarElement element : mCigar.getCigarElements()) {
            if (element.getOperator().consumesReferenceBases()) {
                length += element.getLength();
            }
        }
        return length;
    }

    public int getMappingQuality() { return mMappingQuality; }

    public void setMappingQuality(final int value) { mMappingQuality = value; }

    public Cigar getCigar() { return mCigar; }

    public void setCigar(final Cigar cigar) { mCigar = Objects.requireNonNull(cigar, "cigar"); }

    public String getCigarString() { return TextCigarCodec.encode(mCigar); }

    public ReferenceBinding getMateReferenceBinding() { return mMateReferenceBinding; }

    public void setMateReferenceBinding(final ReferenceBinding binding) {
        mMateReferenceBinding = Objects.requireNonNull(binding, "binding");
    }

    public String getMateReferenceName() { return mMateReferenceBinding.getName(); }

    public int getMateReferenceIndex() { return mMateReferenceBinding.getIndex(); }

    /**
     * @return 0-based start of the mate's alignment, or {@link #NO_ALIGNMENT_START}.
     */
    public int getMateAlignmentStart() { return mMateAlignmentStart; }

    public void setMateAlignmentStart(final int value) { mMateAlignmentStart = value; }

    /** TLEN column. */
    public int getInferredInsertSize() { return mInferredInsertSize; }

    public void setInferredInsertSize(final int value) { mInferredInsertSize = value; }

    /**
     * @return read bases, or "*" if not stored.
     */
    public String getReadString() { return mReadString; }

    public void setReadString(final String value) { mReadString = value; }

    /**
     * @return number of stored read bases; 0 when SEQ is "*".
     */
    public int getReadLength() {
        return NULL_SEQUENCE_STRING.equals(mReadString) ? 0 : mReadString.length();
    }

    /**
     * @return phred+33 base qualities, or "*" if not stored.
     */
    public String getBaseQualityString() { return mBaseQualityString; }

    public void setBaseQualityString(final String value) { mBaseQualityString = value; }

    /** Optional fields in file order. */
    public List<OptionalField> getAttributes() {
        return Collections.unmodifiableList(mAttributes);
    }

    /**
     * @return the field with the given tag, or null.
     */
    public OptionalField getAttribute(final String tag) {
        for (final OptionalField field : mAttributes) {
            if (field.getTag().equals(tag)) {
                return field;
            }
        }
        return null;
    }

    /**
     * Sets an optional field, replacing any field with the same tag in place.
     */
    public void setAttribute(final OptionalField field) {
        for (int i = 0; i < mAttributes.size(); ++i) {
            if (mAttributes.get(i).getTag().equals(field.getTag())) {
                mAttributes.set(i, field);
                return;
            }
        }
        mAttributes.add(field);
    }

    /**
     * @return true if a field was removed.
     */
    public boolean removeAttribute(final String tag) {
        return mAttributes.removeIf(field -> field.getTag().equals(tag));
    }

    /**
     * Bin this record falls into in a BAM-style index.
     *
     * @return {@link #UNMAPPED_READ_BIN} for an unmapped read, {@link #NO_BIN} if the start or end cannot be
     * represented in an index, otherwise the bin of [start, end).
     */
    public int computeIndexingBin() {
        if (getReadUnmappedFlag() || mAlignmentStart == NO_ALIGNMENT_START) {
            return UNMAPPED_READ_BIN;
        }
        // A record that covers no reference bases still occupies its start position.
        final long end = mAlignmentStart + Math.max(1L, getReferenceSpan());
        if (!FieldValidation.isValidIndexPosition(mAlignmentStart) || !FieldValidation.isValidIndexPosition(end)) {
            return NO_BIN;
        }
        return IndexBinning.reg2bin(mAlignmentStart, (int) end);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof SamTextRecord)) return false;

        final SamTextRecord that = (SamTextRecord) o;
        return mFlags == that.mFlags &&
                mAlignmentStart == that.mAlignmentStart &&
                mMappingQuality == that.mMappingQuality &&
                mMateAlignmentStart == that.mMateAlignmentStart &&
                mInferredInsertSize == that.mInferredInsertSize &&
                mReadName.equals(that.mReadName) &&
                mReferenceBinding.equals(that.mReferenceBinding) &&
                mCigar.equals(that.mCigar) &&
                mMateReferenceBinding.equals(that.mMateReferenceBinding) &&
                mReadString.equals(that.mReadString) &&
                mBaseQualityString.equals(that.mBaseQualityString) &&
                mAttributes.equals(that.mAttributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mReadName, mFlags, mReferenceBinding, mAlignmentStart, mCigar, mReadString);
    }

    @Override
    public String toString() {
        return mReadName + " " + getReferenceName() + ":" + (mAlignmentStart + 1) + " " + getCigarString();
    }
}
