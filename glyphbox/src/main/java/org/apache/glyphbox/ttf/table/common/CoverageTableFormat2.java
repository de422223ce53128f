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

import java.util.Arrays;

/**
 * This class models the
 * <a href="https://docs.microsoft.com/en-us/typography/opentype/spec/chapter2#coverage-format-2">Coverage format 2</a>
 * in the Open Type layout common tables: a sorted list of glyph ranges, each carrying the
 * coverage index of its first glyph.
 */
public class CoverageTableFormat2 extends CoverageTable
{
    private final RangeRecord[] rangeRecords;
    private final int size;

    public CoverageTableFormat2(int coverageFormat, RangeRecord[] rangeRecords)
    {
        super(coverageFormat);
        this.rangeRecords = rangeRecords;
        int count = 0;
        for (RangeRecord rangeRecord : rangeRecords)
        {
            count = Math.max(count, rangeRecord.getStartCoverageIndex()
                    + rangeRecord.getEndGlyphID() - rangeRecord.getStartGlyphID() + 1);
        }
        this.size = count;
    }

    @Override
    public int getCoverageIndex(int gid)
    {
        int low = 0;
        int high = rangeRecords.length - 1;
        while (low <= high)
        {
            int mid = (low + high) >>> 1;
            RangeRecord rangeRecord = rangeRecords[mid];
            if (gid < rangeRecord.getStartGlyphID())
            {
                high = mid - 1;
            }
            else if (gid > rangeRecord.getEndGlyphID())
            {
                low = mid + 1;
            }
            else
            {
                return rangeRecord.getStartCoverageIndex() + gid - rangeRecord.getStartGlyphID();
            }
        }
        return -1;
    }

    @Override
    public int getGlyphId(int index)
    {
        for (RangeRecord rangeRecord : rangeRecords)
        {
            int relative = index - rangeRecord.getStartCoverageIndex();
            if (relative >= 0
                    && relative <= rangeRecord.getEndGlyphID() - rangeRecord.getStartGlyphID())
            {
                return rangeRecord.getStartGlyphID() + relative;
            }
        }
        throw new IndexOutOfBoundsException("coverage index " + index + " not in " + this);
    }

    @Override
    public int getSize()
    {
        return size;
    }

    public RangeRecord[] getRangeRecords()
    {
        return rangeRecords;
    }

    @Override
    public String toString()
    {
        return String.format("CoverageTableFormat2[coverageFormat=%d,rangeRecords=%s]",
                getCoverageFormat(), Arrays.toString(rangeRecords));
    }
}
