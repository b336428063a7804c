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
import htsjdk.samtools.SAMFormatException;
import htsjdk.samtools.ValidationStringency;
import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.RuntimeIOException;
import htsjdk.samtools.util.StringUtil;
import samstream.Defaults;
import samstream.util.FieldValidation;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parser for a SAM text header, and a generator of SAM text header.
 *
 * Problems that leave a line unusable (unknown record type, missing required tag, malformed TAG:value pair)
 * are handled per the validation stringency: thrown as {@link SAMFormatException} under STRICT, logged and
 * the offending line or pair dropped under LENIENT, dropped quietly under SILENT.
 */
public class SamTextHeaderCodec {
    private static final Log log = Log.getInstance(SamTextHeaderCodec.class);

    public static final String HEADER_LINE_START = "@";

    private static final char TAG_KEY_VALUE_SEPARATOR_CHAR = ':';
    private static final String FIELD_SEPARATOR = "\t";
    private static final char FIELD_SEPARATOR_CHAR = '\t';
    private static final Pattern FIELD_SEPARATOR_RE = Pattern.compile(FIELD_SEPARATOR);

    public static final String COMMENT_PREFIX = HEADER_LINE_START + HeaderRecordType.CO.name() + FIELD_SEPARATOR;

    private final ValidationStringency validationStringency;

    // These attributes are populated when parsing text
    private SamTextHeader mFileHeader;
    private String mCurrentLine;
    private long mCurrentLineNumber;

    public SamTextHeaderCodec() {
        this(Defaults.VALIDATION_STRINGENCY);
    }

    public SamTextHeaderCodec(final ValidationStringency validationStringency) {
        if (validationStringency == null) {
            throw new IllegalArgumentException("The validationStringency must be set");
        }
        this.validationStringency = validationStringency;
    }

    /**
     * Parses header text, one header line per text line.  A trailing line feed is optional.
     */
    public SamTextHeader decode(final String text) {
        if (text.isEmpty()) {
            return new SamTextHeader();
        }
        final String body = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
        return decode(List.of(body.split("\n", -1)));
    }

    /**
     * Parses header lines, which must have had their line terminators removed.  The first line is line 1 for
     * error messages.
     * @return complete header object.
     */
    public SamTextHeader decode(final List<String> lines) {
        mFileHeader = new SamTextHeader();
        mCurrentLineNumber = 0;
        for (final String line : lines) {
            mCurrentLine = line;
            ++mCurrentLineNumber;
            if (!line.startsWith(HEADER_LINE_START)) {
                throw new SAMFormatException(makeErrorString("Header line does not start with " + HEADER_LINE_START));
            }
            final ParsedHeaderLine parsedHeaderLine = new ParsedHeaderLine(line);
            if (!parsedHeaderLine.isLineValid()) {
                continue;
            }
            switch (parsedHeaderLine.getHeaderRecordType()) {
                case HD:
                    parseHDLine(parsedHeaderLine);
                    break;
                case SQ:
                    parseSQLine(parsedHeaderLine);
                    break;
                case RG:
                    parseIdentifiedLine(parsedHeaderLine);
                    break;
                case PG:
                    parseIdentifiedLine(parsedHeaderLine);
                    break;
                case CO:
                    mFileHeader.addComment(line.length() > COMMENT_PREFIX.length() ? line.substring(COMMENT_PREFIX.length()) : "");
                    break;
                default:
                    throw new IllegalStateException("Unrecognized header record type: " +
                            parsedHeaderLine.getHeaderRecordType());
            }
        }
        return mFileHeader;
    }

    private void parseHDLine(final ParsedHeaderLine parsedHeaderLine) {
        if (!parsedHeaderLine.requireTag(SamTextHeader.VERSION_TAG)) {
            return;
        }
        for (final Map.Entry<String, String> entry : parsedHeaderLine.mKeyValuePairs.entrySet()) {
            mFileHeader.setAttribute(entry.getKey(), entry.getValue());
        }
    }

    private void parseSQLine(final ParsedHeaderLine parsedHeaderLine) {
        if (!parsedHeaderLine.requireTag(SequenceRecord.SEQUENCE_NAME_TAG)) {
            return;
        }
        final String sequenceName = SequenceRecord.truncateSequenceName(
                parsedHeaderLine.removeValue(SequenceRecord.SEQUENCE_NAME_TAG));

        int length = SequenceRecord.UNKNOWN_SEQUENCE_LENGTH;
        final String lengthText = parsedHeaderLine.removeValue(SequenceRecord.SEQUENCE_LENGTH_TAG);
        if (lengthText != null) {
            final long parsed;
            try {
                parsed = Long.parseLong(lengthText);
            } catch (final NumberFormatException e) {
                reportErrorParsingLine(SequenceRecord.SEQUENCE_LENGTH_TAG + " is not numeric: " + lengthText);
                return;
            }
            if (FieldValidation.isValidLength(parsed)) {
                length = (int) parsed;
            } else {
                reportErrorParsingLine("Sequence length out of range: " + lengthText);
            }
        }

        final SequenceRecord sequence;
        try {
            sequence = new SequenceRecord(sequenceName, length, parsedHeaderLine.mKeyValuePairs);
        } catch (final SAMException e) {
            reportErrorParsingLine(e.getMessage());
            return;
        }
        mFileHeader.addSequence(sequence);
    }

    private void parseIdentifiedLine(final ParsedHeaderLine parsedHeaderLine) {
        if (!parsedHeaderLine.requireTag(HeaderRecord.ID_TAG)) {
            return;
        }
        final String type = parsedHeaderLine.getHeaderRecordType().name();
        final HeaderRecord record = new HeaderRecord(type,
                parsedHeaderLine.removeValue(HeaderRecord.ID_TAG), parsedHeaderLine.mKeyValuePairs);
        try {
            if (parsedHeaderLine.getHeaderRecordType() == HeaderRecordType.RG) {
                mFileHeader.addReadGroup(record);
            } else {
                mFileHeader.addProgramRecord(record);
            }
        } catch (final SAMException e) {
            reportErrorParsingLine(e.getMessage());
        }
    }

    private void reportErrorParsingLine(final String reason) {
        final String errorMessage = makeErrorString(reason);
        if (validationStringency == ValidationStringency.STRICT) {
            throw new SAMFormatException(errorMessage);
        } else if (validationStringency == ValidationStringency.LENIENT) {
            log.warn("Ignoring SAM header validation error due to lenient parsing: " + errorMessage);
        }
    }

    private String makeErrorString(final String reason) {
        return "Error parsing SAM header. " + reason + "; Line " + mCurrentLineNumber + "\nLine: " + mCurrentLine;
    }

    private enum HeaderRecordType {
        HD, SQ, RG, PG, CO
    }

    /**
     * Takes a header line as a String and converts it into a HeaderRecordType, and a map of key:value strings.
     * If the line does not contain a recognized HeaderRecordType, then the line is considered invalid, and will
     * not have any key:value pairs.
     */
    private class ParsedHeaderLine {
        private HeaderRecordType mHeaderRecordType;
        private final Map<String, String> mKeyValuePairs = new LinkedHashMap<>();
        private boolean lineValid = false;

        ParsedHeaderLine(final String line) {
            String[] fields = new String[1024];
            int numFields = StringUtil.split(line, fields, FIELD_SEPARATOR_CHAR);
            if (numFields == fields.length) {
                // Lots of fields, so fall back
                fields = FIELD_SEPARATOR_RE.split(line);
                numFields = fields.length;
            }

            try {
                mHeaderRecordType = HeaderRecordType.valueOf(fields[0].substring(HEADER_LINE_START.length()));
            } catch (final IllegalArgumentException e) {
                reportErrorParsingLine("Unrecognized header record type");
                mHeaderRecordType = null;
                return;
            }

            // Do not parse key:value pairs for comment lines.
            if (mHeaderRecordType == HeaderRecordType.CO) {
                lineValid = true;
                return;
            }

            final String[] keyAndValue = new String[2];
            for (int i = 1; i < numFields; ++i) {
                if (StringUtil.splitConcatenateExcessTokens(fields[i], keyAndValue, TAG_KEY_VALUE_SEPARATOR_CHAR) != 2) {
                    reportErrorParsingLine("Problem parsing " + HEADER_LINE_START + mHeaderRecordType +
                            " key:value pair");
                    continue;
                }
                if (mKeyValuePairs.containsKey(keyAndValue[0]) &&
                        !mKeyValuePairs.get(keyAndValue[0]).equals(keyAndValue[1])) {
                    reportErrorParsingLine("Problem parsing " + HEADER_LINE_START + mHeaderRecordType +
                            " key:value pair " + keyAndValue[0] + ":" + keyAndValue[1] +
                            " clashes with " + keyAndValue[0] + ":" + mKeyValuePairs.get(keyAndValue[0]));
                    continue;
                }
                mKeyValuePairs.put(keyAndValue[0], keyAndValue[1]);
            }
            lineValid = true;
        }

        /**
         * True if the line is recognized as one of the valid HeaderRecordTypes.
         */
        boolean isLineValid() {
            return lineValid;
        }

        /**
         * If the tag is not present, and stringency is strict, an exception is thrown.
         * If stringency is not strict, false is returned.
         */
        boolean requireTag(final String tag) {
            if (!mKeyValuePairs.containsKey(tag)) {
                reportErrorParsingLine(HEADER_LINE_START + mHeaderRecordType + " line missing " + tag + " tag");
                return false;
            }
            return true;
        }

        HeaderRecordType getHeaderRecordType() {
            return mHeaderRecordType;
        }

        String removeValue(final String key) {
            return mKeyValuePairs.remove(key);
        }
    }

    /**
     * Convert a header to its text representation.
     * @return header text, each line terminated by a line feed; the empty string for an empty header.
     */
    public String encode(final SamTextHeader header) {
        final StringWriter writer = new StringWriter();
        encode(writer, header);
        return writer.toString();
    }

    /**
     * Convert a header to its text representation.
     * @param writer where to write the header text.  Not flushed or closed.
     */
    public void encode(final Writer writer, final SamTextHeader header) {
        if (!header.getAttributes().isEmpty()) {
            writeTaggedLine(writer, HeaderRecordType.HD, header.getAttributes());
        }
        for (final SequenceRecord sequence : header.getSequences()) {
            final Map<String, String> tags = new LinkedHashMap<>();
            tags.put(SequenceRecord.SEQUENCE_NAME_TAG, sequence.getSequenceName());
            if (sequence.hasKnownLength()) {
                tags.put(SequenceRecord.SEQUENCE_LENGTH_TAG, Integer.toString(sequence.getSequenceLength()));
            }
            tags.putAll(sequence.getAttributes());
            writeTaggedLine(writer, HeaderRecordType.SQ, tags);
        }
        for (final HeaderRecord readGroup : header.getReadGroups()) {
            writeIdentifiedLine(writer, HeaderRecordType.RG, readGroup);
        }
        for (final HeaderRecord programRecord : header.getProgramRecords()) {
            writeIdentifiedLine(writer, HeaderRecordType.PG, programRecord);
        }
        for (final String comment : header.getComments()) {
            println(writer, COMMENT_PREFIX + comment);
        }
    }

    private void writeIdentifiedLine(final Writer writer, final HeaderRecordType type, final HeaderRecord record) {
        final Map<String, String> tags = new LinkedHashMap<>();
        tags.put(HeaderRecord.ID_TAG, record.getId());
        tags.putAll(record.getAttributes());
        writeTaggedLine(writer, type, tags);
    }

    private void writeTaggedLine(final Writer writer, final HeaderRecordType type, final Map<String, String> tags) {
        final StringBuilder sb = new StringBuilder(HEADER_LINE_START).append(type.name());
        for (final Map.Entry<String, String> entry : tags.entrySet()) {
            sb.append(FIELD_SEPARATOR).append(entry.getKey()).append(TAG_KEY_VALUE_SEPARATOR_CHAR).append(entry.getValue());
        }
        println(writer, sb.toString());
    }

    private static void println(final Writer writer, final String s) {
        try {
            writer.append(s);
            writer.append("\n");
        } catch (final IOException e) {
            throw new RuntimeIOException(e);
        }
    }
}
