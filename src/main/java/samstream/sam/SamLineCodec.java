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
import htsjdk.samtools.SAMException;
import htsjdk.samtools.SAMFormatException;
import htsjdk.samtools.TextCigarCodec;
import htsjdk.samtools.ValidationStringency;
import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.StringUtil;
import samstream.Defaults;
import samstream.util.FieldValidation;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between a single line of SAM text and a {@link SamTextRecord}.
 *
 * Decoding against a header binds RNAME and RNEXT to the header's sequences, and a name missing from the
 * header is an error.  Decoding without a header yields unresolved bindings that carry only the name; it is
 * up to the caller to reconcile them (see {@link SequenceReconciler}).
 *
 * Lexical problems (too few columns, non-numeric integers, bad CIGAR, malformed optional fields) always throw
 * {@link SAMFormatException}.
 * Values that parse but fall outside the ranges in {@link FieldValidation} are handled per the validation
 * stringency.
 *
 * Not thread-safe; it reuses a field buffer between lines.
 */
public class SamLineCodec {
    private static final Log log = Log.getInstance(SamLineCodec.class);

    // Mandatory columns, in file order
    private static final int QNAME_COL = 0;
    private static final int FLAG_COL = 1;
    private static final int RNAME_COL = 2;
    private static final int POS_COL = 3;
    private static final int MAPQ_COL = 4;
    private static final int CIGAR_COL = 5;
    private static final int MRNM_COL = 6;
    private static final int MPOS_COL = 7;
    private static final int ISIZE_COL = 8;
    private static final int SEQ_COL = 9;
    private static final int QUAL_COL = 10;

    private static final int NUM_REQUIRED_FIELDS = 11;

    private static final char FIELD_SEPARATOR = '\t';

    private static final int MAX_MAPPING_QUALITY = 255;

    private static final String NO_ALIGNMENT_CIGAR = "*";
    private static final Pattern CIGAR_ELEMENT = Pattern.compile("([0-9]+)[MIDNSHP=X]");

    /**
     * Allocate this once rather than for every line.  The size is arbitrary -- merely large enough to handle the
     * maximum number of fields we might expect from a reasonable SAM file.
     */
    private final String[] mFields = new String[10000];

    private final ValidationStringency validationStringency;

    private long currentLineNumber;
    private String currentLine;

    public SamLineCodec() {
        this(Defaults.VALIDATION_STRINGENCY);
    }

    public SamLineCodec(final ValidationStringency validationStringency) {
        if (validationStringency == null) {
            throw new IllegalArgumentException("The validationStringency must be set");
        }
        this.validationStringency = validationStringency;
    }

    public ValidationStringency getValidationStringency() {
        return validationStringency;
    }

    /**
     * Parse a SAM line.
     * @param header header to bind references against, or null to produce unresolved bindings.
     * @param line line to parse, without line terminator.
     * @param lineNumber 1-based line number for error messages, or &lt;= 0 if not known.
     * @return a new record
     */
    public SamTextRecord decode(final SamTextHeader header, final String line, final long lineNumber) {
        this.currentLineNumber = lineNumber;
        this.currentLine = line;

        final int numFields = StringUtil.split(line, mFields, FIELD_SEPARATOR);
        if (numFields < NUM_REQUIRED_FIELDS) {
            throw reportFatalErrorParsingLine("Not enough fields");
        }
        if (numFields == mFields.length) {
            reportErrorParsingLine("Too many fields in SAM text record.");
        }
        for (int i = 0; i < numFields; ++i) {
            if (mFields[i].isEmpty()) {
                reportErrorParsingLine("Empty field at position " + i + " (zero-based)");
            }
        }

        final SamTextRecord samRecord = new SamTextRecord();
        samRecord.setReadName(mFields[QNAME_COL]);

        try {
            samRecord.setFlags(SamFlag.parseFlags(mFields[FLAG_COL]));
        } catch (final SAMFormatException e) {
            throw reportFatalErrorParsingLine(e.getMessage());
        }

        final String rname = mFields[RNAME_COL];
        if (ReferenceBinding.NO_ALIGNMENT_REFERENCE_NAME.equals(rname)) {
            if (!samRecord.getReadUnmappedFlag()) {
                reportErrorParsingLine("RNAME is not specified but flags indicate mapped");
            }
        } else {
            samRecord.setReferenceBinding(resolveReference(header, rname, "RNAME"));
        }

        samRecord.setAlignmentStart(parsePosition(mFields[POS_COL], "POS"));

        final int mapq = parseInt(mFields[MAPQ_COL], "MAPQ");
        if (mapq < 0 || mapq > MAX_MAPPING_QUALITY) {
            reportErrorParsingLine("MAPQ out of range: " + mapq);
        }
        samRecord.setMappingQuality(mapq);

        samRecord.setCigar(parseCigar(mFields[CIGAR_COL]));
        if (samRecord.getAlignmentStart() != SamTextRecord.NO_ALIGNMENT_START &&
                !FieldValidation.isValidPosition(samRecord.getAlignmentEnd() - 1)) {
            reportErrorParsingLine("Alignment end out of range: " + samRecord.getAlignmentEnd());
        }

        final String mateRName = mFields[MRNM_COL];
        if (SequenceRecord.RESERVED_MRNM_SEQUENCE_NAME.equals(mateRName)) {
            if (!samRecord.getReferenceBinding().isMapped()) {
                reportErrorParsingLine("RNEXT is '=', but RNAME is not set");
            }
            samRecord.setMateReferenceBinding(samRecord.getReferenceBinding());
        } else if (!ReferenceBinding.NO_ALIGNMENT_REFERENCE_NAME.equals(mateRName)) {
            samRecord.setMateReferenceBinding(resolveReference(header, mateRName, "RNEXT"));
        }

        samRecord.setMateAlignmentStart(parsePosition(mFields[MPOS_COL], "PNEXT"));

        final long isize = parseLong(mFields[ISIZE_COL], "TLEN");
        if (!FieldValidation.isValidTemplateLength(isize)) {
            throw reportFatalErrorParsingLine("TLEN out of range: " + isize);
        }
        samRecord.setInferredInsertSize((int) isize);

        final String readString = mFields[SEQ_COL];
        if (!SamTextRecord.NULL_SEQUENCE_STRING.equals(readString)) {
            validateReadBases(readString);
            if (!FieldValidation.isValidLength(readString.length())) {
                reportErrorParsingLine("SEQ length out of range: " + readString.length());
            }
        }
        samRecord.setReadString(readString);

        final String qualString = mFields[QUAL_COL];
        if (!SamTextRecord.NULL_QUALS_STRING.equals(qualString)) {
            if (SamTextRecord.NULL_SEQUENCE_STRING.equals(readString)) {
                reportErrorParsingLine("QUAL should not be specified if SEQ is not specified");
            } else if (readString.length() != qualString.length()) {
                reportErrorParsingLine("length(QUAL) != length(SEQ)");
            }
        }
        samRecord.setBaseQualityString(qualString);

        for (int i = NUM_REQUIRED_FIELDS; i < numFields; ++i) {
            parseTag(samRecord, mFields[i]);
        }
        return samRecord;
    }

    /**
     * Convert a record to a line of SAM text, without line terminator.
     * @param flagFormat how to render the FLAG column.
     * @throws IllegalArgumentException if the flags cannot be rendered in the requested format.
     */
    public String encode(final SamTextRecord alignment, final FlagFormat flagFormat) {
        final StringBuilder out = new StringBuilder(256);
        out.append(alignment.getReadName()).append(FIELD_SEPARATOR);
        out.append(flagFormat.format(alignment.getFlags())).append(FIELD_SEPARATOR);
        out.append(alignment.getReferenceName()).append(FIELD_SEPARATOR);
        out.append(alignment.getAlignmentStart() + 1).append(FIELD_SEPARATOR);
        out.append(alignment.getMappingQuality()).append(FIELD_SEPARATOR);
        out.append(alignment.getCigarString()).append(FIELD_SEPARATOR);

        final ReferenceBinding mateBinding = alignment.getMateReferenceBinding();
        if (mateBinding.isMapped() && mateBinding.refersToSameSequence(alignment.getReferenceBinding())) {
            out.append(SequenceRecord.RESERVED_MRNM_SEQUENCE_NAME);
        } else {
            out.append(mateBinding.getName());
        }
        out.append(FIELD_SEPARATOR);
        out.append(alignment.getMateAlignmentStart() + 1).append(FIELD_SEPARATOR);
        out.append(alignment.getInferredInsertSize()).append(FIELD_SEPARATOR);
        out.append(alignment.getReadString()).append(FIELD_SEPARATOR);
        out.append(alignment.getBaseQualityString());
        for (final OptionalField field : alignment.getAttributes()) {
            out.append(FIELD_SEPARATOR).append(field.encode());
        }
        return out.toString();
    }

    private ReferenceBinding resolveReference(final SamTextHeader header, final String name, final String fieldName) {
        if (header == null) {
            try {
                return ReferenceBinding.unresolved(name);
            } catch (final SAMException e) {
                throw reportFatalErrorParsingLine(fieldName + ": " + e.getMessage());
            }
        }
        final SequenceRecord sequence = header.getSequence(name);
        if (sequence == null) {
            throw reportFatalErrorParsingLine(fieldName + " '" + name + "' not found in any SQ record");
        }
        return ReferenceBinding.mapped(sequence);
    }

    /**
     * Parse a 1-based text position into a 0-based position.
     */
    private int parsePosition(final String s, final String fieldName) {
        final long position = parseLong(s, fieldName) - 1;
        if (!FieldValidation.isValidInt32(position)) {
            throw reportFatalErrorParsingLine(fieldName + " out of range: " + s);
        }
        if (!FieldValidation.isValidPosition(position)) {
            reportErrorParsingLine(fieldName + " out of range: " + s);
        }
        return (int) position;
    }

    private int parseInt(final String s, final String fieldName) {
        final long value = parseLong(s, fieldName);
        if (!FieldValidation.isValidInt32(value)) {
            throw reportFatalErrorParsingLine(fieldName + " does not fit in 32 bits: " + s);
        }
        return (int) value;
    }

    private long parseLong(final String s, final String fieldName) {
        try {
            return Long.parseLong(s);
        } catch (final NumberFormatException e) {
            throw reportFatalErrorParsingLine("Non-numeric value in " + fieldName + " column");
        }
    }

    private void validateReadBases(final String bases) {
        for (int i = 0; i < bases.length(); ++i) {
            if (!isValidReadBase(bases.charAt(i))) {
                reportErrorParsingLine("Invalid character in read bases");
                return;
            }
        }
    }

    private static boolean isValidReadBase(final char base) {
        switch (base) {
            case 'a': case 'c': case 'm': case 'g': case 'r': case 's': case 'v': case 't':
            case 'w': case 'y': case 'h': case 'k': case 'd': case 'b': case 'n':
            case 'A': case 'C': case 'M': case 'G': case 'R': case 'S': case 'V': case 'T':
            case 'W': case 'Y': case 'H': case 'K': case 'D': case 'B': case 'N':
            case '.': case '=':
                return true;
            default:
                return false;
        }
    }

    /**
     * htsjdk's decoder assumes a well-formed CIGAR and does not check element lengths for overflow, so the
     * text is checked here first.
     */
    private Cigar parseCigar(final String textCigar) {
        if (NO_ALIGNMENT_CIGAR.equals(textCigar)) {
            return TextCigarCodec.decode(textCigar);
        }
        final Matcher matcher = CIGAR_ELEMENT.matcher(textCigar);
        int end = 0;
        while (matcher.find() && matcher.start() == end) {
            final String length = matcher.group(1);
            if (length.length() > 10 || Long.parseLong(length) > Integer.MAX_VALUE) {
                throw reportFatalErrorParsingLine("CIGAR element length too large in " + textCigar);
            }
            end = matcher.end();
        }
        if (end == 0 || end != textCigar.length()) {
            throw reportFatalErrorParsingLine("Malformed CIGAR string: " + textCigar);
        }
        try {
            return TextCigarCodec.decode(textCigar);
        } catch (final IllegalArgumentException e) {
            throw reportFatalErrorParsingLine(e.getMessage());
        }
    }

    private void parseTag(final SamTextRecord samRecord, final String tag) {
        final OptionalField field;
        try {
            field = OptionalField.decode(tag);
        } catch (final SAMFormatException e) {
            throw reportFatalErrorParsingLine(e.getMessage());
        }
        if (field.getType() == OptionalField.INTEGER_TYPE &&
                !FieldValidation.isValidInt32(((Number) field.getValue()).longValue())) {
            reportErrorParsingLine("Tag " + field.getTag() + " of type i is out of 32-bit range: " + field.getText());
        }
        if (samRecord.getAttribute(field.getTag()) != null) {
            reportErrorParsingLine("Tag " + field.getTag() + " appears more than once");
        }
        samRecord.setAttribute(field);
    }

    //
    // Error methods
    //

    private SAMFormatException reportFatalErrorParsingLine(final String reason) {
        return new SAMFormatException(makeErrorString(reason));
    }

    private void reportErrorParsingLine(final String reason) {
        final String errorMessage = makeErrorString(reason);

        if (validationStringency == ValidationStringency.STRICT) {
            throw new SAMFormatException(errorMessage);
        } else if (validationStringency == ValidationStringency.LENIENT) {
            log.warn("Ignoring SAM validation error due to lenient parsing: " + errorMessage);
        }
    }

    private String makeErrorString(final String reason) {
        return "Error parsing text SAM record. " + reason + "; Line " +
                (this.currentLineNumber <= 0 ? "unknown" : this.currentLineNumber) +
                "\nLine: " + this.currentLine;
    }
}
