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
 * What the RNAME or RNEXT column of a record refers to: either nothing (unmapped, written as "*") or a
 * {@link SequenceRecord}.
 *
 * A mapped binding decoded without a header holds a sequence that is not yet registered in any header;
 * {@link SamTextReader} replaces it with the registered instance before handing the record out.
 */
public final class ReferenceBinding {

    /** Text value of RNAME/RNEXT for an unmapped read. */
    public static final String NO_ALIGNMENT_REFERENCE_NAME = "*";

    public static final ReferenceBinding UNMAPPED = new ReferenceBinding(null);

    private final SequenceRecord sequence;

    private ReferenceBinding(final SequenceRecord sequence) {
        this.sequence = sequence;
    }

    public static ReferenceBinding mapped(final SequenceRecord sequence) {
        if (sequence == null) {
            throw new IllegalArgumentException("A mapped binding needs a sequence; use UNMAPPED instead");
        }
        return new ReferenceBinding(sequence);
    }

    /**
     * Binding to a sequence known only by name, as produced when decoding without a header.
     */
    public static ReferenceBinding unresolved(final String name) {
        return new ReferenceBinding(new SequenceRecord(name, SequenceRecord.UNKNOWN_SEQUENCE_LENGTH));
    }

    public boolean isMapped() {
        return sequence != null;
    }

    /**
     * @return true if unmapped, or mapped to a sequence registered in a header.
     */
    public boolean isResolved() {
        return sequence == null || sequence.isRegistered();
    }

    /**
     * @return the bound sequence, or null if unmapped.
     */
    public SequenceRecord getSequence() {
        return sequence;
    }

    /**
     * @return the sequence name, or "*" if unmapped.
     */
    public String getName() {
        return sequence == null ? NO_ALIGNMENT_REFERENCE_NAME : sequence.getSequenceName();
    }

    /**
     * @return the header index of the bound sequence, or -1.
     */
    public int getIndex() {
        return sequence == null ? SequenceRecord.UNREGISTERED_INDEX : sequence.getSequenceIndex();
    }

    /**
     * True if both bindings are unmapped, or both name the same sequence.
     */
    public boolean refersToSameSequence(final ReferenceBinding that) {
        if (that == null) return false;
        if (sequence == null || that.sequence == null) return sequence == that.sequence;
        return sequence == that.sequence || sequence.getSequenceName().equals(that.sequence.getSequenceName());
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof ReferenceBinding)) return false;
        final ReferenceBinding that = (ReferenceBinding) o;
        return sequence == null ? that.sequence == null : sequence.equals(that.sequence);
    }

    @Override
    public int hashCode() {
        return sequence == null ? 0 : sequence.hashCode();
    }

    @Override
    public String toString() {
        return getName();
    }
}
