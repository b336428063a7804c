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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Header information from a SAM text file: @HD tags, the reference sequence dictionary, read groups,
 * program records and comments.
 *
 * The dictionary is ordered and name-unique.  Indices are handed out in insertion order and never reassigned,
 * so downstream sorting and indexing can rely on them.
 */
public class SamTextHeader {
    public static final String VERSION_TAG = "VN";
    public static final String SORT_ORDER_TAG = "SO";
    public static final String GROUP_ORDER_TAG = "GO";
    public static final String CURRENT_VERSION = "1.6";

    public static final String READ_GROUP_TYPE = "RG";
    public static final String PROGRAM_TYPE = "PG";

    private final Map<String, String> mAttributes = new LinkedHashMap<>();
    private final List<SequenceRecord> mSequences = new ArrayList<>();
    private final Map<String, SequenceRecord> mSequenceMap = new HashMap<>();
    private final List<HeaderRecord> mReadGroups = new ArrayList<>();
    private final List<HeaderRecord> mProgramRecords = new ArrayList<>();
    private final List<String> mComments = new ArrayList<>();

    /**
     * Creates an empty header; it has no @HD line until an attribute is set.
     */
    public SamTextHeader() {
    }

    public String getVersion() {
        return getAttribute(VERSION_TAG);
    }

    public String getSortOrder() {
        return getAttribute(SORT_ORDER_TAG);
    }

    public String getAttribute(final String tag) {
        return mAttributes.get(tag);
    }

    /** @HD tags in file order. */
    public Map<String, String> getAttributes() {
        return Collections.unmodifiableMap(mAttributes);
    }

    public void setAttribute(final String tag, final String value) {
        if (value == null) {
            mAttributes.remove(tag);
        } else {
            mAttributes.put(tag, value);
        }
    }

    /**
     * Adds a sequence to the end of the dictionary.
     * @return the registered instance, which carries the assigned index.  Callers must use it in place of the argument.
     * @throws DuplicateSequenceException if a sequence with the same name is present.
     */
    public SequenceRecord addSequence(final SequenceRecord sequence) {
        if (mSequenceMap.containsKey(sequence.getSequenceName())) {
            throw new DuplicateSequenceException(sequence.getSequenceName());
        }
        final SequenceRecord registered = sequence.withIndex(mSequences.size());
        mSequences.add(registered);
        mSequenceMap.put(registered.getSequenceName(), registered);
        return registered;
    }

    /**
     * @return the sequence with the given name, or null.
     */
    public SequenceRecord getSequence(final String name) {
        return mSequenceMap.get(name);
    }

    /**
     * @return the sequence at the given index, or null if out of range.
     */
    public SequenceRecord getSequence(final int sequenceIndex) {
        if (sequenceIndex < 0 || sequenceIndex >= mSequences.size()) {
            return null;
        }
        return mSequences.get(sequenceIndex);
    }

    /**
     * @return index of the named sequence, or -1 if absent.
     */
    public int getSequenceIndex(final String name) {
        final SequenceRecord sequence = mSequenceMap.get(name);
        return sequence == null ? SequenceRecord.UNREGISTERED_INDEX : sequence.getSequenceIndex();
    }

    /** Sequences in index order. */
    public List<SequenceRecord> getSequences() {
        return Collections.unmodifiableList(mSequences);
    }

    public int getSequenceCount() {
        return mSequences.size();
    }

    public void addReadGroup(final HeaderRecord readGroup) {
        addIdentifiedRecord(readGroup, READ_GROUP_TYPE, mReadGroups);
    }

    public List<HeaderRecord> getReadGroups() {
        return Collections.unmodifiableList(mReadGroups);
    }

    public HeaderRecord getReadGroup(final String id) {
        return findById(mReadGroups, id);
    }

    public void addProgramRecord(final HeaderRecord programRecord) {
        addIdentifiedRecord(programRecord, PROGRAM_TYPE, mProgramRecords);
    }

    public List<HeaderRecord> getProgramRecords() {
        return Collections.unmodifiableList(mProgramRecords);
    }

    public HeaderRecord getProgramRecord(final String id) {
        return findById(mProgramRecords, id);
    }

    /**
     * @param comment text of an @CO line, without the leading "@CO" and tab.
     */
    public void addComment(final String comment) {
        mComments.add(comment);
    }

    public List<String> getComments() {
        return Collections.unmodifiableList(mComments);
    }

    /**
     * @return true if this header would serialize to nothing.
     */
    public boolean isEmpty() {
        return mAttributes.isEmpty() && mSequences.isEmpty() && mReadGroups.isEmpty() &&
                mProgramRecords.isEmpty() && mComments.isEmpty();
    }

    private static void addIdentifiedRecord(final HeaderRecord record, final String expectedType, final List<HeaderRecord> records) {
        if (!expectedType.equals(record.getRecordType())) {
            throw new IllegalArgumentException("Expected an @" + expectedType + " record but got @" + record.getRecordType());
        }
        if (findById(records, record.getId()) != null) {
            throw new SAMException("Header already contains an @" + expectedType + " record with ID " + record.getId());
        }
        records.add(record);
    }

    private static HeaderRecord findById(final List<HeaderRecord> records, final String id) {
        for (final HeaderRecord record : records) {
            if (record.getId().equals(id)) {
                return record;
            }
        }
        return null;
    }
}
