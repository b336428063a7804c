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
package samstream.cmdline;

import htsjdk.samtools.ValidationStringency;
import htsjdk.samtools.util.Log;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.ArgumentCollection;
import org.broadinstitute.barclay.argparser.CommandLineArgumentParser;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineParser;
import org.broadinstitute.barclay.argparser.CommandLineParserOptions;
import org.broadinstitute.barclay.argparser.SpecialArgumentsCollection;
import samstream.Defaults;

import java.text.DecimalFormat;
import java.util.Collections;

/**
 * Base class of the samstream tools.
 *
 * A tool is annotated with @CommandLineProgramProperties, declares its own @Argument fields next to the common
 * ones below, and implements {@link #doWork()}.  Unchecked exceptions thrown from doWork() reach the caller of
 * {@link #instanceMain(String[])}.
 */
public abstract class CommandLineProgram {
    private static final Log log = Log.getInstance(CommandLineProgram.class);

    /** Longest oneLineSummary that keeps the program listing of {@link SamStreamCommandLine} on one line. */
    public static final int MAX_ALLOWABLE_ONE_LINE_SUMMARY_LENGTH = 120;

    @Argument(doc = "Control verbosity of logging.", common = true)
    public Log.LogLevel VERBOSITY = Log.LogLevel.INFO;

    @Argument(doc = "Whether to suppress the command line and elapsed time log lines.", common = true)
    public Boolean QUIET = false;

    @Argument(doc = "Validation stringency for all SAM text read by this program.  Under LENIENT and SILENT, " +
            "out-of-range field values are accepted; malformed lines are always rejected.", common = true)
    public ValidationStringency VALIDATION_STRINGENCY = Defaults.VALIDATION_STRINGENCY;

    // --help and --version
    @ArgumentCollection(doc = "Arguments handled by the argument parser itself.")
    public Object specialArgumentsCollection = new SpecialArgumentsCollection();

    /**
     * Runs the tool once its arguments are set.
     * @return exit status.
     */
    protected abstract int doWork();

    /**
     * Parses the tool's arguments and runs it.
     * @return 1 if the arguments do not parse or only help or version was requested, otherwise what
     * {@link #doWork()} returns.
     */
    public int instanceMain(final String[] argv) {
        final CommandLineParser parser = new CommandLineArgumentParser(this, Collections.emptyList(),
                Collections.singleton(CommandLineParserOptions.APPEND_TO_COLLECTIONS));
        try {
            if (!parser.parseArguments(System.err, argv)) {
                return 1;
            }
        } catch (final CommandLineException e) {
            System.err.println(parser.usage(false, false));
            System.err.println(e.getMessage());
            return 1;
        }

        Log.setGlobalLogLevel(VERBOSITY);
        if (!QUIET) {
            log.info(parser.getCommandLine());
        }
        final long startMillis = System.currentTimeMillis();
        try {
            return doWork();
        } finally {
            if (!QUIET) {
                final double elapsedMinutes = (System.currentTimeMillis() - startMillis) / (1000d * 60d);
                log.info(getClass().getSimpleName(), " done. Elapsed time: ",
                        new DecimalFormat("#,##0.00").format(elapsedMinutes), " minutes.");
            }
        }
    }
}
