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

import htsjdk.samtools.util.RuntimeIOException;
import samstream.Defaults;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Writes SAM text: the header when constructed, then one line per call to {@link #writeAlignment(SamTextRecord)}.
 *
 * Nothing is buffered here; each record goes to the destination in a single write call.  If that fails the
 * destination may hold part of a line, and the writer should not be used further.
 */
public class SamTextWriter implements Closeable {
    private static final char LINE_TERMINATOR = '\n';

    private final OutputStream out;
    private final FlagFormat flagFormat;
    private final SamLineCodec lineCodec = new SamLineCodec();

    /**
     * Writes the header using the default flag format.
     */
    public SamTextWriter(final OutputStream stream, final SamTextHeader header) {
        this(stream, header, Defaults.FLAG_FORMAT);
    }

    /**
     * @param flagFormatCode one of the {@link FlagFormat} codes.  Checked before anything is written.
     * @throws IllegalArgumentException if the code is out of range.
     */
    public SamTextWriter(final OutputStream stream, final SamTextHeader header, final int flagFormatCode) {
        this(stream, header, FlagFormat.fromCode(flagFormatCode));
    }

    /**
     * Writes the header text to the stream before returning.  An empty header writes nothing.
     * @throws IllegalArgumentException if any argument is null; nothing is written in that case.
     */
    public SamTextWriter(final OutputStream stream, final SamTextHeader header, final FlagFormat flagFormat) {
        if (stream == null) {
            throw new IllegalArgumentException("stream must not be null");
        }
        if (header == null) {
            throw new IllegalArgumentException("header must not be null");
        }
        if (flagFormat == null) {
            throw new IllegalArgumentException("flagFormat must not be null");
        }
        this.out = stream;
        this.flagFormat = flagFormat;

        final String headerText = new SamTextHeaderCodec().encode(header);
        if (!headerText.isEmpty()) {
            write(headerText);
        }
    }

    public FlagFormat getFlagFormat() {
        return flagFormat;
    }

    /**
     * Encodes the record and writes it, with its line terminator, to the stream.
     * @throws IllegalArgumentException if the record's flags cannot be rendered in this writer's format.
     * @throws RuntimeIOException if the stream fails.
     */
    public void writeAlignment(final SamTextRecord alignment) {
        final String line = lineCodec.encode(alignment, flagFormat);
        write(line + LINE_TERMINATOR);
    }

    public void flush() {
        try {
            out.flush();
        } catch (final IOException e) {
            throw new RuntimeIOException(e);
        }
    }

    /**
     * Flushes and closes the underlying stream.
     */
    @Override
    public void close() {
        try {
            out.close();
        } catch (final IOException e) {
            throw new RuntimeIOException(e);
        }
    }

    private void write(final String text) {
        try {
            out.write(text.getBytes(StandardCharsets.UTF_8));
        } catch (final IOException e) {
            throw new RuntimeIOException(e);
        }
    }
}
