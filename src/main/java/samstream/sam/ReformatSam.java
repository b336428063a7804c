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
import samstream.Defaults;
import samstream.cmdline.CommandLineProgram;
import samstream.cmdline.StandardOptionDefinitions;
import samstream.cmdline.programgroups.SamTextProgramGroup;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Rewrites a SAM text file, rendering the FLAG column in the requested format.
 *
 * <p>The input may or may not have a header.  If it has one, the output repeats it; if it does not, the output
 * has no header either, since the dictionary is only complete once every record has been read.</p>
 *
 * <h4>Usage example: </h4>
 * <pre>
 *     java -jar samstream.jar ReformatSam \
 *          --INPUT input.sam \
 *          --OUTPUT output.sam \
 *          --FLAG_FORMAT STRING
 * </pre>
 */
@CommandLineProgramProperties(
        summary = ReformatSam.USAGE_DETAILS,
        oneLineSummary = ReformatSam.USAGE_SUMMARY,
        programGroup = SamTextProgramGroup.class)
@DocumentedFeature
public class ReformatSam extends CommandLineProgram {

    static final String USAGE_SUMMARY = "Rewrites a SAM text file with a chosen FLAG rendering";
    static final String USAGE_DETAILS = "Reads SAM text, with or without a header, and writes every record back out " +
            "with the FLAG column rendered as decimal, hexadecimal or letter string. A header present in the input " +
            "is copied to the output.";

    private static final Log log = Log.getInstance(ReformatSam.class);

    @Argument(shortName = StandardOptionDefinitions.INPUT_SHORT_NAME, doc = "The SAM text file to read.")
    public File INPUT;

    @Argument(shortName = StandardOptionDefinitions.OUTPUT_SHORT_NAME, doc = "The SAM text file to write.")
    public File OUTPUT;

    @Argument(shortName = StandardOptionDefinitions.FLAG_FORMAT_SHORT_NAME, doc = "How to render the FLAG column.")
    public FlagFormat FLAG_FORMAT = Defaults.FLAG_FORMAT;

    @Override
    protected int doWork() {
        IOUtil.assertFileIsReadable(INPUT);
        IOUtil.assertFileIsWritable(OUTPUT);

        final ProgressLogger progress = new ProgressLogger(log, 1_000_000, "Wrote");
        try (InputStream in = IOUtil.openFileForReading(INPUT);
             SamTextReader reader = new SamTextReader(in, VALIDATION_STRINGENCY);
             OutputStream out = IOUtil.openFileForWriting(OUTPUT);
             SamTextWriter writer = new SamTextWriter(out, reader.getFileHeader(), FLAG_FORMAT)) {

            final SamRecordIterator iterator = new SamRecordIterator(reader);
            while (iterator.next()) {
                final SamTextRecord record = iterator.getRecord();
                writer.writeAlignment(record);
                progress.record(record.getReferenceName(), record.getAlignmentStart() + 1);
            }
            if (iterator.getError() != null) {
                throw iterator.getError();
            }
        } catch (final IOException e) {
            throw new RuntimeIOException("Error closing " + INPUT + " or " + OUTPUT, e);
        }

        log.info("Wrote " + progress.getCount() + " records to " + OUTPUT);
        return 0;
    }
}
