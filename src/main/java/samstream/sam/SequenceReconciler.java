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

import htsjdk.samtools.util.Log;

/**
 * Builds up a sequence dictionary from the records of a headerless SAM stream.
 *
 * Each reference name seen in RNAME or RNEXT is registered in the header the first time it appears, with
 * unknown length, and every later mention is rebound to that registered instance.  The first sighting wins;
 * later sightings are never checked against it.
 */
class SequenceReconciler {
    private static final Log log = Log.getInstance(SequenceReconciler.class);

    private final SamTextHeader header;

    SequenceReconciler(final SamTextHeader header) {
        this.header = header;
    }

    /**
     * Replace unresolved bindings in the record with bindings to registered sequences.
     */
    void reconcile(final SamTextRecord record) {
        final ReferenceBinding reference = resolve(record.getReferenceBinding());
        record.setReferenceBinding(reference);

        final ReferenceBinding mateReference = record.getMateReferenceBinding();
        if (mateReference.refersToSameSequence(reference)) {
            record.setMateReferenceBinding(reference);
        } else {
            record.setMateReferenceBinding(resolve(mateReference));
        }
    }

    private ReferenceBinding resolve(final ReferenceBinding binding) {
        if (binding.isResolved()) {
            return binding;
        }
        final String name = binding.getName();
        SequenceRecord sequence = header.getSequence(name);
        if (sequence == null) {
            sequence = header.addSequence(binding.getSequence());
            log.debug("Discovered reference sequence ", name, " at index ", sequence.getSequenceIndex());
        }
        return ReferenceBinding.mapped(sequence);
    }
}
