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
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

public class SamRecordIteratorTest {

    /** Hands out the given records, then end of stream, counting calls. */
    private static class CountingSource implements SamRecordSource {
        private final Deque<SamTextRecord> records;
        private final RuntimeException failure;
        int calls = 0;

        CountingSource(final RuntimeException failure, final SamTextRecord... records) {
            this.records = new ArrayDeque<>(Arrays.asList(records));
            this.failure = failure;
        }

        @Override
        public SamTextRecord read() {
            ++calls;
            if (!records.isEmpty()) {
                return records.removeFirst();
            }
            if (failure != null) {
                throw failure;
            }
            return null;
        }
    }

    private static SamTextRecord record(final String name) {
        final SamTextRecord rec = new SamTextRecord();
        rec.setReadName(name);
        return rec;
    }

    @Test
    public void testExhaustion() {
        final SamTextRecord a = record("a");
        final SamTextRecord b = record("b");
        final CountingSource source = new CountingSource(null, a, b);
        final SamRecordIterator iterator = new SamRecordIterator(source);

        Assert.assertEquals(iterator.getState(), SamRecordIterator.State.RUNNING);
        Assert.assertTrue(iterator.next());
        Assert.assertSame(iterator.getRecord(), a);
        Assert.assertTrue(iterator.next());
        Assert.assertSame(iterator.getRecord(), b);

        Assert.assertFalse(iterator.next());
        Assert.assertNull(iterator.getError());
        Assert.assertEquals(iterator.getState(), SamRecordIterator.State.EXHAUSTED);
        Assert.assertEquals(source.calls, 3);

        // the source is not consulted again
        Assert.assertFalse(iterator.next());
        Assert.assertFalse(iterator.next());
        Assert.assertEquals(source.calls, 3);
        Assert.assertNull(iterator.getError());
    }

    @Test
    public void testFailureIsSticky() {
        final SAMFormatException failure = new SAMFormatException("bad line");
        final CountingSource source = new CountingSource(failure, record("a"));
        final SamRecordIterator iterator = new SamRecordIterator(source);

        Assert.assertTrue(iterator.next());
        Assert.assertFalse(iterator.next());
        Assert.assertSame(iterator.getError(), failure);
        Assert.assertEquals(iterator.getState(), SamRecordIterator.State.FAILED);
        Assert.assertNull(iterator.getRecord());

        Assert.assertFalse(iterator.next());
        Assert.assertEquals(source.calls, 2);
        Assert.assertSame(iterator.getError(), failure);
    }

    @Test
    public void testEmptySource() {
        final CountingSource source = new CountingSource(null);
        final SamRecordIterator iterator = new SamRecordIterator(source);
        Assert.assertFalse(iterator.next());
        Assert.assertNull(iterator.getError());
        Assert.assertEquals(source.calls, 1);
    }

    @Test
    public void testOverReader() {
        final String samText = "@SQ\tSN:chr1\tLN:100\n" +
                "r1\t0\tchr1\t1\t30\t4M\t*\t0\t0\tACGT\tIIII\n" +
                "r2\t0\tchr1\t5\t30\t4M\t*\t0\t0\tACGT\tIIII\n" +
                "r3\t0\tchr9\t5\t30\t4M\t*\t0\t0\tACGT\tIIII\n";
        final SamTextReader reader = new SamTextReader(
                new ByteArrayInputStream(samText.getBytes(StandardCharsets.UTF_8)), ValidationStringency.STRICT);
        final SamRecordIterator iterator = new SamRecordIterator(reader);

        int count = 0;
        while (iterator.next()) {
            ++count;
        }
        Assert.assertEquals(count, 2);
        Assert.assertTrue(iterator.getError() instanceof SAMFormatException);
        Assert.assertTrue(iterator.getError().getMessage().contains("chr9"));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNullSource() {
        new SamRecordIterator(null);
    }
}
