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
 * Common part of the mark attachment subtables (mark-to-base, mark-to-ligature and mark-to-mark).
 * The coverage of the subtable is the mark coverage, and the mark records are indexed by mark
 * coverage index.
 */
public abstract class MarkAttachmentSubTable extends LookupSubTable<GlyphPositioningCollection>
{
    private final MarkRecord[] markRecords;

    protected MarkAttachmentSubTable(int posFormat, CoverageTable markCoverageTable,
            MarkRecord[] markRecords)
    {
        super(posFormat, markCoverageTable);
        this.markRecords = markRecords;
    }

    /**
     * Returns the mark record of the mark at the given slot.
     *
     * @return the mark record or {@code null} if the slot is not a covered mark
     */
    protected MarkRecord getMarkRecord(GlyphPositioningCollection positions, int index)
    {
        int markIndex = getCoverageIndex(positions, index);
        if (markIndex < 0 || markIndex >= markRecords.length)
        {
            return null;
        }
        return markRecords[markIndex];
    }

    /**
     * Walks back from a mark to the glyph it attaches to, skipping the marks in between.
     *
     * @return the slot index of the base glyph, or -1 if there is none
     */
    protected int findBase(LookupContext<GlyphPositioningCollection> context, int markIndex)
    {
        GlyphPositioningCollection positions = context.getGlyphs();
        boolean useGlyphClasses = context.hasGlyphClassDefinitions();
        for (int i = markIndex - 1; i >= 0; i--)
        {
            int gid = positions.getGlyphId(i);
            boolean isMark = useGlyphClasses
                    ? context.isMark(gid)
                    : getCoverageTable().getCoverageIndex(gid) >= 0;
            if (!isMark)
            {
                return i;
            }
        }
        return -1;
    }

    /**
     * Moves a mark so that its anchor lies on the anchor of the glyph it attaches to. The mark's
     * offset is replaced; the advances between the two glyphs are compensated.
     *
     * @param positions the glyph positions
     * @param baseIndex the slot of the glyph the mark attaches to
     * @param baseAnchor the anchor on that glyph
     * @param markIndex the slot of the mark
     * @param markAnchor the anchor on the mark
     */
    protected static void attach(GlyphPositioningCollection positions, int baseIndex,
            AnchorTable baseAnchor, int markIndex, AnchorTable markAnchor)
    {
        int xOffset = baseAnchor.getXCoordinate() - markAnchor.getXCoordinate()
                + positions.getXOffset(baseIndex);
        for (int i = baseIndex; i < markIndex; i++)
        {
            xOffset -= positions.getXAdvance(i);
        }
        int yOffset = baseAnchor.getYCoordinate() - markAnchor.getYCoordinate()
                + positions.getYOffset(baseIndex);
        positions.setOffset(markIndex, xOffset, yOffset);
    }

    public MarkRecord[] getMarkRecords()
    {
        return markRecords;
    }
}
