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
 * <a href="https://docs.microsoft.com/en-us/typography/opentype/spec/gpos#single-adjustment-positioning-format-1-single-positioning-value">Single
 * Adjustment Positioning Format 1</a>: one value record for every covered glyph.
 */
public class LookupTypeSinglePosFormat1 extends LookupSubTable<GlyphPositioningCollection>
{
    private final ValueRecord valueRecord;

    public LookupTypeSinglePosFormat1(int posFormat, CoverageTable coverageTable,
            ValueRecord valueRecord)
    {
        super(posFormat, coverageTable);
        this.valueRecord = valueRecord;
    }

    @Override
    public boolean apply(LookupContext<GlyphPositioningCollection> context, int index)
    {
        GlyphPositioningCollection positions = context.getGlyphs();
        if (getCoverageIndex(positions, index) < 0)
        {
            return false;
        }
        valueRecord.apply(positions, index);
        return true;
    }

    public ValueRecord getValueRecord()
    {
        return valueRecord;
    }

    @Override
    public String toString()
    {
        return String.format("LookupTypeSinglePosFormat1[posFormat=%d,valueRecord=%s]",
                getFormat(), valueRecord);
    }
}
