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
import htsjdk.samtools.ValidationStringency;
import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.RuntimeIOException;
import samstream.Defaults;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads SAM text from a stream, one record per call to {@link #read()}.
 *
 * If the stream starts with '@' the header is parsed up front and records are bound to its sequences.
 * Otherwise the reader starts with an empty header and fills in its dictionary as reference names show up in
 * records, so that every record naming the same reference shares one {@link SequenceRecord}.
 * An empty stream is read as a headerless file with no records.
 *
 * Line terminators are '\n', optionally preceded by '\r'.  The last line of the stream need not be terminated,
 * except in the header, where that is reported as a {@link TruncatedHeaderException}.
 */
public class SamTextReader implements SamRecordSource, Closeable {
    private static final Log log = Log.getInstance(SamTextReader.class);

    private static final int LINE_FEED = '\n';
    private static final int CARRIAGE_RETURN = '\r';

    private InputStream mStream;
    private final SamTextHeader mFileHeader;
    private final boolean mHasHeader;
    private final SamLineCodec mLineCodec;
    private final SequenceReconciler mReconciler;
    private final ByteArrayOutputStream mLineBuffer = new ByteArrayOutputStream(512);

    // Whether the line most recently returned by readLine() ended in a line feed.
    private boolean mLineTerminated;
    private long mLineNumber = 0;

    /**
     * Prepare to read a SAM text file.  Any header is consumed before this returns.
     * @param stream Need not be buffered, as this class provides buffered reading.
     */
    public SamTextReader(final InputStream stream) {
        this(stream, Defaults.VALIDATION_STRINGENCY);
    }

    public SamTextReader(final InputStream stream, final ValidationStringency validationStringency) {
        if (stream == null) {
            throw new IllegalArgumentException("stream must not be null");
        }
        mStream = new BufferedInputStream(stream, Defaults.BUFFER_SIZE);
        mLineCodec = new SamLineCodec(validationStringency);

        mHasHeader = peek() == '@';
        if (mHasHeader) {
            mFileHeader = readHeader(validationStringency);
            mReconciler = null;
            log.debug("Read SAM header with ", mFileHeader.getSequenceCount(), " reference sequences");
        } else {
            mFileHeader = new SamTextHeader();
            mReconciler = new SequenceReconciler(mFileHeader);
            log.debug("No SAM header; reference sequences will be collected from records");
        }
    }

    /**
     * True if the stream began with a header.  When false, {@link #getFileHeader()} returns the dictionary
     * discovered from the records read so far.
     */
    public boolean hasHeader() {
        return mHasHeader;
    }

    /**
     * The header this reader binds records to.  For a headerless stream it grows as records are read.
     */
    public SamTextHeader getFileHeader() {
        return mFileHeader;
    }

    /**
     * @return 1-based number of the last line read.
     */
    public long getLineNumber() {
        return mLineNumber;
    }

    @Override
    public SamTextRecord read() {
        if (mStream == null) {
            throw new IllegalStateException("File reader is closed");
        }
        final String line = readLine();
        if (line == null) {
            return null;
        }
        if (line.isEmpty()) {
            throw new SAMFormatException("Error parsing text SAM record. Empty line; Line " + mLineNumber);
        }
        final SamTextRecord record = mLineCodec.decode(mHasHeader ? mFileHeader : null, line, mLineNumber);
        if (mReconciler != null) {
            mReconciler.reconcile(record);
        }
        return record;
    }

    @Override
    public void close() {
        if (mStream != null) {
            try {
                mStream.close();
            } catch (final IOException e) {
                throw new RuntimeIOException(e);
            } finally {
                mStream = null;
            }
        }
    }

    private SamTextHeader readHeader(final ValidationStringency validationStringency) {
        final List<String> headerLines = new ArrayList<>();
        while (peek() == '@') {
            final String line = readLine();
            if (!mLineTerminated) {
                throw new TruncatedHeaderException("Unexpected end of stream in SAM header; Line " + mLineNumber +
                        "\nLine: " + line);
            }
            headerLines.add(line);
        }
        return new SamTextHeaderCodec(validationStringency).decode(headerLines);
    }

    private int peek() {
        try {
            mStream.mark(1);
            final int c = mStream.read();
            mStream.reset();
            return c;
        } catch (final IOException e) {
            throw new RuntimeIOException(e);
        }
    }

    /**
     * @return next line without its terminator, or null at end of stream.
     */
    private String readLine() {
        mLineBuffer.reset();
        try {
            int c = mStream.read();
            if (c == -1) {
                return null;
            }
            while (c != -1 && c != LINE_FEED) {
                mLineBuffer.write(c);
                c = mStream.read();
            }
            mLineTerminated = c == LINE_FEED;
        } catch (final IOException e) {
            throw new RuntimeIOException(e);
        }
        ++mLineNumber;
        String line = mLineBuffer.toString(StandardCharsets.UTF_8);
        if (!line.isEmpty() && line.charAt(line.length() - 1) == CARRIAGE_RETURN) {
            line = line.substring(0, line.length() - 1);
        }
        return line;
    }
}
