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

import htsjdk.samtools.TextCigarCodec;
import htsjdk.samtools.ValidationStringency;
import htsjdk.samtools.util.RuntimeIOException;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class SamTextWriterTest {

    /** Counts the write calls that reach the destination. */
    private static class CountingOutputStream extends ByteArrayOutputStream {
        int writes = 0;

        @Override
        public synchronized void write(final byte[] b, final int off, final int len) {
            ++writes;
            super.write(b, off, len);
        }

        @Override
        public synchronized void write(final int b) {
            ++writes;
            super.write(b);
        }
    }

    private static SamTextHeader makeHeader() {
        final SamTextHeader header = new SamTextHeader();
        header.setAttribute(SamTextHeader.VERSION_TAG, SamTextHeader.CURRENT_VERSION);
        header.addSequence(new SequenceRecord("chr1", 1000));
        header.addSequence(new SequenceRecord("chr2", 2000));
        return header;
    }

    private static SamTextRecord makeRecord(final SamTextHeader header, final String name, final int flags) {
        final SamTextRecord rec = new SamTextRecord();
        rec.setReadName(name);
        rec.setFlags(flags);
        rec.setReferenceBinding(ReferenceBinding.mapped(header.getSequence("chr1")));
        rec.setAlignmentStart(99);
        rec.setMappingQuality(60);
        rec.setCigar(TextCigarCodec.decode("4M"));
        rec.setMateReferenceBinding(ReferenceBinding.mapped(header.getSequence("chr1")));
        rec.setMateAlignmentStart(199);
        rec.setInferredInsertSize(104);
        rec.setReadString("ACGT");
        rec.setBaseQualityString("IIII");
        rec.setAttribute(OptionalField.ofString("RG", "L1"));
        return rec;
    }

    @DataProvider(name = "badFormatCodes")
    public Object[][] badFormatCodes() {
        return new Object[][]{{-1}, {3}, {Integer.MAX_VALUE}};
    }

    @Test(dataProvider = "badFormatCodes")
    public void testBadFormatWritesNothing(final int code) {
        final CountingOutputStream out = new CountingOutputStream();
        try {
            new SamTextWriter(out, makeHeader(), code);
            Assert.fail("Expected flag format code " + code + " to be rejected");
        } catch (final IllegalArgumentException e) {
            Assert.assertEquals(out.size(), 0);
            Assert.assertEquals(out.writes, 0);
        }
    }

    @Test
    public void testNullFormatWritesNothing() {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            new SamTextWriter(out, makeHeader(), (FlagFormat) null);
            Assert.fail("Expected a null flag format to be rejected");
        } catch (final IllegalArgumentException e) {
            Assert.assertEquals(out.size(), 0);
        }
    }

    @Test
    public void testHeaderWrittenAtConstruction() {
        final CountingOutputStream out = new CountingOutputStream();
        final SamTextWriter writer = new SamTextWriter(out, makeHeader(), FlagFormat.DECIMAL);
        Assert.assertEquals(out.toString(StandardCharsets.UTF_8),
                "@HD\tVN:1.6\n@SQ\tSN:chr1\tLN:1000\n@SQ\tSN:chr2\tLN:2000\n");
        Assert.assertEquals(out.writes, 1);
        Assert.assertEquals(writer.getFlagFormat(), FlagFormat.DECIMAL);
    }

    @Test
    public void testEmptyHeaderWritesNothing() {
        final CountingOutputStream out = new CountingOutputStream();
        new SamTextWriter(out, new SamTextHeader(), FlagFormat.DECIMAL);
        Assert.assertEquals(out.size(), 0);
        Assert.assertEquals(out.writes, 0);
    }

    @Test
    public void testOneWritePerRecord() {
        final SamTextHeader header = makeHeader();
        final CountingOutputStream out = new CountingOutputStream();
        final SamTextWriter writer = new SamTextWriter(out, header, FlagFormat.fromCode(2));
        final int headerBytes = out.size();

        writer.writeAlignment(makeRecord(header, "r1", 99));
        Assert.assertEquals(out.writes, 2);
        writer.writeAlignment(makeRecord(header, "r2", 147));
        Assert.assertEquals(out.writes, 3);

        final String records = out.toString(StandardCharsets.UTF_8).substring(headerBytes);
        Assert.assertEquals(records,
                "r1\tpP---R1-----\tchr1\t100\t60\t4M\t=\t200\t104\tACGT\tIIII\tRG:Z:L1\n" +
                "r2\tpP--r--2----\tchr1\t100\t60\t4M\t=\t200\t104\tACGT\tIIII\tRG:Z:L1\n");
    }

    @Test
    public void testRecordsReadBack() {
        final SamTextHeader header = makeHeader();
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        final SamTextWriter writer = new SamTextWriter(out, header, FlagFormat.HEX);
        final List<SamTextRecord> written = new ArrayList<>();
        written.add(makeRecord(header, "r1", 99));
        final SamTextRecord other = makeRecord(header, "r2", 0x853);
        other.setMateReferenceBinding(ReferenceBinding.mapped(header.getSequence("chr2")));
        written.add(other);
        for (final SamTextRecord rec : written) {
            writer.writeAlignment(rec);
        }
        writer.flush();

        final SamTextReader reader = new SamTextReader(new ByteArrayInputStream(out.toByteArray()), ValidationStringency.STRICT);
        Assert.assertEquals(reader.getFileHeader().getSequences(), header.getSequences());
        for (final SamTextRecord expected : written) {
            Assert.assertEquals(reader.read(), expected);
        }
        Assert.assertNull(reader.read());
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testUnrenderableFlags() {
        final SamTextHeader header = makeHeader();
        final SamTextWriter writer = new SamTextWriter(new ByteArrayOutputStream(), header, FlagFormat.STRING);
        writer.writeAlignment(makeRecord(header, "r1", 0x1001));
    }

    @Test(expectedExceptions = RuntimeIOException.class)
    public void testWriteFailure() {
        final OutputStream failing = new OutputStream() {
            @Override
            public void write(final int b) throws IOException {
                throw new IOException("disk full");
            }
        };
        // nothing to write for an empty header, so construction succeeds
        final SamTextWriter writer = new SamTextWriter(failing, new SamTextHeader(), FlagFormat.DECIMAL);
        writer.writeAlignment(makeRecord(makeHeader(), "r1", 0));
    }
}
