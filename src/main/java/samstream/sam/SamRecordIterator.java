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
 * Pull-style iteration over any {@link SamRecordSource}.
 *
 * <pre>
 *     final SamRecordIterator it = new SamRecordIterator(reader);
 *     while (it.next()) {
 *         process(it.getRecord());
 *     }
 *     if (it.getError() != null) {
 *         throw it.getError();
 *     }
 * </pre>
 *
 * Once the source reports end of stream or fails, the iterator stays in that state and never calls the
 * source again.
 */
public class SamRecordIterator {

    public enum State {
        /** The last call to next() produced a record, or next() has not been called yet. */
        RUNNING,
        /** The source was cleanly exhausted. */
        EXHAUSTED,
        /** The source threw; see {@link #getError()}. */
        FAILED
    }

    private final SamRecordSource source;
    private State state = State.RUNNING;
    private SamTextRecord record;
    private RuntimeException error;

    public SamRecordIterator(final SamRecordSource source) {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        this.source = source;
    }

    /**
     * Reads the next record from the source.
     * @return true if a record is available from {@link #getRecord()}; false at end of stream or on failure.
     */
    public boolean next() {
        if (state != State.RUNNING) {
            return false;
        }
        final SamTextRecord next;
        try {
            next = source.read();
        } catch (final RuntimeException e) {
            error = e;
            record = null;
            state = State.FAILED;
            return false;
        }
        if (next == null) {
            record = null;
            state = State.EXHAUSTED;
            return false;
        }
        record = next;
        return true;
    }

    /**
     * @return the record read by the last successful {@link #next()}.  Only meaningful right after next() returned true.
     */
    public SamTextRecord getRecord() {
        return record;
    }

    /**
     * @return what the source threw, or null if it has not failed.  Clean exhaustion is not an error.
     */
    public RuntimeException getError() {
        return error;
    }

    public State getState() {
        return state;
    }
}
