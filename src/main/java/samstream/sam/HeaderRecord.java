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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An @RG or @PG header line: a record type, an ID and the remaining tags in file order.
 */
public final class HeaderRecord {
    public static final String ID_TAG = "ID";

    private final String recordType;
    private final String id;
    private final Map<String, String> attributes;

    /**
     * @param recordType two-letter record type, e.g. "RG".
     * @param id value of the ID tag.
     * @param attributes tags other than ID, in the given order.
     */
    public HeaderRecord(final String recordType, final String id, final Map<String, String> attributes) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("@" + recordType + " record requires an ID");
        }
        this.recordType = recordType;
        this.id = id;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public String getRecordType() { return recordType; }

    public String getId() { return id; }

    public String getAttribute(final String tag) { return attributes.get(tag); }

    public Map<String, String> getAttributes() { return attributes; }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof HeaderRecord)) return false;
        final HeaderRecord that = (HeaderRecord) o;
        return recordType.equals(that.recordType) && id.equals(that.id) && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(recordType, id);
    }
}
