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


package org.apache.glyphbox.ttf.table.gpos;

import org.apache.glyphbox.ttf.shaping.GlyphPositioningCollection;
import org.apache.glyphbox.ttf.table.common.CoverageTable;
import org.apache.glyphbox.ttf.table.common.LookupContext;
import org.apache.glyphbox.ttf.table.common.LookupSubTable;

/**
 * This class models the
 * <a href="https://docs.microsoft.com/en-us/typography/opentype/spec/gpos#pair-adjustment-positioning-format-1-adjustments-for-glyph-pairs">Pair
 * Adjustment Positioning Format 1</a>: adjustments for individual glyph pairs.
 */
public class LookupTypePairPosFormat1 extends LookupSubTable<GlyphPositioningCollection>
{
    private final PairSetTable[] pairSetTables;

    public LookupTypePairPosFormat1(int posFormat, CoverageTable coverageTable,
            PairSetTable[] pairSetTables)
    {
        super(posFormat, coverageTable);
        this.pairSetTables = pairSetTables;
    }

    @Override
    public boolean apply(LookupContext<GlyphPositioningCollection> context, int index)
    {
        GlyphPositioningCollection positions = context.getGlyphs();
        int coverageIndex = getCoverageIndex(positions, index);
        if (coverageIndex < 0 || coverageIndex >= pairSetTables.length
                || index + 1 >= positions.size())
        {
            return false;
        }
        PairValueRecord record = pairSetTables[coverageIndex]
                .getPairValueRecord(positions.getGlyphId(index + 1));
        if (record == null)
        {
            return false;
        }
        record.getValueRecord1().apply(positions, index);
        record.getValueRecord2().apply(positions, index + 1);
        return true;
    }

    public PairSetTable[] getPairSetTables()
    {
        return pairSetTables;
    }

    @Override
    public String toString()
    {
        return String.format("LookupTypePairPosFormat1[posFormat=%d,pairSetCount=%d]",
                getFormat(), pairSetTables.length);
    }
}
