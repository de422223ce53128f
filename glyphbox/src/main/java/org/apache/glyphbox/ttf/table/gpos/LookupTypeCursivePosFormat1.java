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
 * <a href="https://docs.microsoft.com/en-us/typography/opentype/spec/gpos#cursive-attachment-positioning-format1-cursive-attachment">Cursive
 * Attachment Positioning Format 1</a>. The exit anchor of the glyph at the slot is joined to the
 * entry anchor of the following glyph, for left-to-right runs.
 */
public class LookupTypeCursivePosFormat1 extends LookupSubTable<GlyphPositioningCollection>
{
    private final EntryExitRecord[] entryExitRecords;

    public LookupTypeCursivePosFormat1(int posFormat, CoverageTable coverageTable,
            EntryExitRecord[] entryExitRecords)
    {
        super(posFormat, coverageTable);
        this.entryExitRecords = entryExitRecords;
    }

    @Override
    public boolean apply(LookupContext<GlyphPositioningCollection> context, int index)
    {
        GlyphPositioningCollection positions = context.getGlyphs();
        int exitIndex = getCoverageIndex(positions, index);
        if (exitIndex < 0 || exitIndex >= entryExitRecords.length)
        {
            return false;
        }
        AnchorTable exit = entryExitRecords[exitIndex].getExitAnchor();
        if (exit == null)
        {
            return false;
        }
        int entryIndex = getCoverageIndex(positions, index + 1);
        if (entryIndex < 0 || entryIndex >= entryExitRecords.length)
        {
            return false;
        }
        AnchorTable entry = entryExitRecords[entryIndex].getEntryAnchor();
        if (entry == null)
        {
            return false;
        }

        int dx = entry.getXCoordinate();
        int dy = entry.getYCoordinate() - exit.getYCoordinate();

        // the pen leaves the first glyph at its exit point
        positions.setAdvance(index, exit.getXCoordinate() + positions.getXOffset(index),
                positions.getYAdvance(index));

        int next = index + 1;
        positions.addOffset(next, -dx, 0);
        positions.addAdvance(next, -dx, 0);
        positions.setOffset(next, positions.getXOffset(next), positions.getYOffset(index) - dy);
        return true;
    }

    public EntryExitRecord[] getEntryExitRecords()
    {
        return entryExitRecords;
    }

    @Override
    public String toString()
    {
        return String.format("LookupTypeCursivePosFormat1[posFormat=%d,entryExitCount=%d]",
                getFormat(), entryExitRecords.length);
    }
}
