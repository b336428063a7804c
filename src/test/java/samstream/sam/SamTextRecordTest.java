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
import htsjdk.samtools.CigarOperator;
import htsjdk.samtools.TextCigarCodec;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;

public class SamTextRecordTest {

    private static SamTextRecord mappedRecord(final int start, final String cigar) {
        final SamTextRecord rec = new SamTextRecord();
        rec.setReadName("r1");
        rec.setReferenceBinding(ReferenceBinding.mapped(new SequenceRecord("chr1", 1000000)));
        rec.setAlignmentStart(start);
        rec.setCigar(TextCigarCodec.decode(cigar));
        return rec;
    }

    @Test
    public void testDefaults() {
        final SamTextRecord rec = new SamTextRecord();
        Assert.assertEquals(rec.getReferenceName(), "*");
        Assert.assertEquals(rec.getMateReferenceName(), "*");
        Assert.assertEquals(rec.getAlignmentStart(), SamTextRecord.NO_ALIGNMENT_START);
        Assert.assertEquals(rec.getAlignmentEnd(), SamTextRecord.NO_ALIGNMENT_START);
        Assert.assertEquals(rec.getCigarString(), "*");
        Assert.assertEquals(rec.getReadLength(), 0);
        Assert.assertTrue(rec.getAttributes().isEmpty());
    }

    @Test
    public void testIndexingBin() {
        Assert.assertEquals(mappedRecord(99, "10M").computeIndexingBin(), 4681);
        Assert.assertEquals(mappedRecord(16380, "10M").computeIndexingBin(), 585);
        // no reference span still occupies the start position
        Assert.assertEquals(mappedRecord(16384, "*").computeIndexingBin(), 4682);
        Assert.assertEquals(mappedRecord(16384, "5I").computeIndexingBin(), 4682);
    }

    @Test
    public void testIndexingBinUnmapped() {
        final SamTextRecord rec = mappedRecord(99, "10M");
        rec.setFlag(SamFlag.READ_UNMAPPED, true);
        Assert.assertEquals(rec.computeIndexingBin(), SamTextRecord.UNMAPPED_READ_BIN);
        Assert.assertEquals(SamTextRecord.UNMAPPED_READ_BIN, 4680);
        Assert.assertEquals(new SamTextRecord().computeIndexingBin(), 4680);
    }

    @Test
    public void testIndexingBinOutsideIndexRange() {
        Assert.assertEquals(mappedRecord(1 << 29, "10M").computeIndexingBin(), SamTextRecord.NO_BIN);
        // start fits but end does not
        Assert.assertEquals(mappedRecord((1 << 29) - 5, "10M").computeIndexingBin(), SamTextRecord.NO_BIN);
        Assert.assertEquals(mappedRecord((1 << 29) - 12, "10M").computeIndexingBin(), 4681 + (((1 << 29) - 12) >> 14));
    }

    @Test
    public void testReferenceSpan() {
        final SamTextRecord rec = mappedRecord(99, "5S10M1D25M2I3N4=1X2H");
        // M, D, N, =, X
        Assert.assertEquals(rec.getReferenceSpan(), 10 + 1 + 25 + 3 + 4 + 1);
        Assert.assertEquals(rec.getAlignmentEnd(), 99 + 44);
        Assert.assertEquals(rec.getCigarString(), "5S10M1D25M2I3N4=1X2H");
    }

    @Test
    public void testSpanBeyondIntRange() {
        final SamTextRecord rec = mappedRecord(1, "*");
        rec.setCigar(new Cigar(Arrays.asList(new CigarElement(Integer.MAX_VALUE, CigarOperator.M))));
        Assert.assertEquals(rec.getAlignmentEnd(), 1L + Integer.MAX_VALUE);
        Assert.assertEquals(rec.computeIndexingBin(), SamTextRecord.NO_BIN);

        rec.setAlignmentStart(0);
        rec.setCigar(new Cigar(Arrays.asList(new CigarElement(Integer.MAX_VALUE, CigarOperator.M),
                new CigarElement(Integer.MAX_VALUE, CigarOperator.M))));
        Assert.assertEquals(rec.getReferenceSpan(), 2L * Integer.MAX_VALUE);
        Assert.assertEquals(rec.getAlignmentEnd(), 2L * Integer.MAX_VALUE);
        Assert.assertEquals(rec.computeIndexingBin(), SamTextRecord.NO_BIN);
    }

    @Test
    public void testFlags() {
        final SamTextRecord rec = new SamTextRecord();
        rec.setFlag(SamFlag.READ_PAIRED, true);
        rec.setFlag(SamFlag.MATE_UNMAPPED, true);
        Assert.assertEquals(rec.getFlags(), 9);
        Assert.assertTrue(rec.getMateUnmappedFlag());
        rec.setFlag(SamFlag.MATE_UNMAPPED, false);
        Assert.assertEquals(rec.getFlags(), 1);
        Assert.assertFalse(rec.getReadNegativeStrandFlag());
    }

    @Test
    public void testAttributes() {
        final SamTextRecord rec = new SamTextRecord();
        rec.setAttribute(OptionalField.ofInt("NM", 1));
        rec.setAttribute(OptionalField.ofString("RG", "L1"));
        rec.setAttribute(OptionalField.ofInt("NM", 2));

        Assert.assertEquals(rec.getAttributes().size(), 2);
        // replaced in place
        Assert.assertEquals(rec.getAttributes().get(0), OptionalField.ofInt("NM", 2));
        Assert.assertTrue(rec.removeAttribute("NM"));
        Assert.assertFalse(rec.removeAttribute("NM"));
        Assert.assertNull(rec.getAttribute("NM"));
        Assert.assertEquals(rec.getAttribute("RG").getValue(), "L1");
    }

    @Test(expectedExceptions = UnsupportedOperationException.class)
    public void testAttributeListIsReadOnly() {
        new SamTextRecord().getAttributes().add(OptionalField.ofInt("NM", 0));
    }
}
