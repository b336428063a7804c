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

import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.ProgressLogger;
import htsjdk.samtools.util.RuntimeIOException;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.barclay.help.DocumentedFeature;
import samstream.cmdline.CommandLineProgram;
import samstream.cmdline.StandardOptionDefinitions;
import samstream.cmdline.programgroups.SamTextProgramGroup;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Writes the header of a SAM text file, including the reference sequences it uses.
 *
 * <p>For a file without a header the reference sequences are collected from the RNAME and RNEXT columns in order
 * of first appearance, and written without lengths.</p>
 *
 * <h4>Usage example: </h4>
 * <pre>
 *     java -jar samstream.jar ExtractSequenceDictionary \
 *          --INPUT headerless.sam \
 *          --OUTPUT header.sam
 * </pre>
 */
@CommandLineProgramProperties(
        summary = ExtractSequenceDictionary.USAGE_DETAILS,
        oneLineSummary = ExtractSequenceDictionary.USAGE_SUMMARY,
        programGroup = SamTextProgramGroup.class)
@DocumentedFeature
public class ExtractSequenceDictionary extends CommandLineProgram {

    static final String USAGE_SUMMARY = "Writes the header of a SAM text file, discovering references if it has none";
    static final String USAGE_DETAILS = "Reads every record of a SAM text file and writes out its header. If the " +
            "input has no header, one is built from the reference names found in the records, in order of first " +
            "appearance and with unknown lengths.";

    private static final Log log = Log.getInstance(ExtractSequenceDictionary.class);

    @Argument(shortName = StandardOptionDefinitions.INPUT_SHORT_NAME, doc = "The SAM text file to read.")
    public File INPUT;

    @Argument(shortName = StandardOptionDefinitions.OUTPUT_SHORT_NAME, doc = "Where to write the header text.")
    public File OUTPUT;

    @Override
    protected int doWork() {
        IOUtil.assertFileIsReadable(INPUT);
        IOUtil.assertFileIsWritable(OUTPUT);

        final ProgressLogger progress = new ProgressLogger(log, 1_000_000, "Read");
        final SamTextHeader header;
        try (InputStream in = IOUtil.openFileForReading(INPUT);
             SamTextReader reader = new SamTextReader(in, VALIDATION_STRINGENCY)) {
            final SamRecordIterator iterator = new SamRecordIterator(reader);
            while (iterator.next()) {
                final SamTextRecord record = iterator.getRecord();
                progress.record(record.getReferenceName(), record.getAlignmentStart() + 1);
            }
            if (iterator.getError() != null) {
                throw iterator.getError();
            }
            header = reader.getFileHeader();
            if (!reader.hasHeader()) {
                log.info("No header in " + INPUT + "; found " + header.getSequenceCount() + " reference sequences in " +
                        progress.getCount() + " records");
            }
        } catch (final IOException e) {
            throw new RuntimeIOException("Error closing " + INPUT, e);
        }

        try (OutputStream out = IOUtil.openFileForWriting(OUTPUT);
             SamTextWriter writer = new SamTextWriter(out, header)) {
            writer.flush();
        } catch (final IOException e) {
            throw new RuntimeIOException("Error closing " + OUTPUT, e);
        }
        return 0;
    }
}
