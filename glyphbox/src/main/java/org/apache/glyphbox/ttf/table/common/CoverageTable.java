/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.glyphbox.ttf.table.common;

import java.io.IOException;

import org.apache.glyphbox.ttf.InvalidFontFileException;
import org.apache.glyphbox.ttf.TTFDataStream;

/**
 * This class models the
 * <a href="https://docs.microsoft.com/en-us/typography/opentype/spec/chapter2#coverage-table">Coverage table</a>
 * in the Open Type layout common tables. A coverage table is a sorted set of glyph ids; the
 * coverage index of a glyph is its position in that set and is used to index the parallel arrays
 * of the subtable owning the coverage.
 */
public abstract class CoverageTable
{
    private final int coverageFormat;

    protected CoverageTable(int coverageFormat)
    {
        this.coverageFormat = coverageFormat;
    }

    /**
     * Reads a coverage table of either format.
     *
     * @param data the font data
     * @param offset the absolute offset of the coverage table
     * @return the coverage table
     * @throws IOException if the data is truncated or the format is unknown
     */
    public static CoverageTable read(TTFDataStream data, long offset) throws IOException
    {
        data.seek(offset);
        int coverageFormat = data.readUnsignedShort();
        switch (coverageFormat)
        {
        case 1:
        {
            int glyphCount = data.readUnsignedShort();
            int[] glyphArray = data.readUnsignedShortArray(glyphCount);
            return new CoverageTableFormat1(coverageFormat, glyphArray);
        }
        case 2:
        {
            int rangeCount = data.readUnsignedShort();
            data.requireAvailable(6L * rangeCount, "RangeRecord[" + rangeCount + "]");
            RangeRecord[] rangeRecords = new RangeRecord[rangeCount];
            for (int i = 0; i < rangeCount; i++)
            {
                int startGlyphID = data.readUnsignedShort();
                int endGlyphID = data.readUnsignedShort();
                int startCoverageIndex = data.readUnsignedShort();
                rangeRecords[i] = new RangeRecord(startGlyphID, endGlyphID, startCoverageIndex);
            }
            return new CoverageTableFormat2(coverageFormat, rangeRecords);
        }
        default:
            throw InvalidFontFileException.invalidFormat("coverageFormat", coverageFormat,
                    "'1' or '2'");
        }
    }

    /**
     * Returns the index of the given glyph in this coverage.
     *
     * @param gid the glyph id
     * @return the coverage index, or -1 if the glyph is not covered
     */
    public abstract int getCoverageIndex(int gid);

    /**
     * @param index a coverage index
     * @return the glyph id at the given coverage index
     */
    public abstract int getGlyphId(int index);

    /**
     * @return the number of covered glyphs
     */
    public abstract int getSize();

    public int getCoverageFormat()
    {
        return coverageFormat;
    }

}
