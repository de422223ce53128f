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

/**
 * This class models the
 * <a href="https://docs.microsoft.com/en-us/typography/opentype/spec/gpos#mark-to-base-attachment-positioning-format-1-mark-to-base-attachment-point">Mark-to-Base
 * Attachment Positioning Format 1</a>. Base anchors are indexed {@code [baseIndex][markClass]}.
 */
public class LookupTypeMarkBasePosFormat1 extends MarkAttachmentSubTable
{
    private final CoverageTable baseCoverageTable;
    private final AnchorTable[][] baseAnchors;

    public LookupTypeMarkBasePosFormat1(int posFormat, CoverageTable markCoverageTable,
            CoverageTable baseCoverageTable, MarkRecord[] markRecords, AnchorTable[][] baseAnchors)
    {
        super(posFormat, markCoverageTable, markRecords);
        this.baseCoverageTable = baseCoverageTable;
        this.baseAnchors = baseAnchors;
    }

    @Override
    public boolean apply(LookupContext<GlyphPositioningCollection> context, int index)
    {
        GlyphPositioningCollection positions = context.getGlyphs();
        MarkRecord markRecord = getMarkRecord(positions, index);
        if (markRecord == null)
        {
            return false;
        }
        int baseIndex = findBase(context, index);
        if (baseIndex < 0)
        {
            return false;
        }
        int baseCoverageIndex = baseCoverageTable.getCoverageIndex(positions.getGlyphId(baseIndex));
        if (baseCoverageIndex < 0 || baseCoverageIndex >= baseAnchors.length)
        {
            return false;
        }
        AnchorTable[] anchors = baseAnchors[baseCoverageIndex];
        int markClass = markRecord.getMarkClass();
        if (markClass >= anchors.length || anchors[markClass] == null)
        {
            return false;
        }
        attach(positions, baseIndex, anchors[markClass], index, markRecord.getMarkAnchor());
        return true;
    }

    public CoverageTable getBaseCoverageTable()
    {
        return baseCoverageTable;
    }

    @Override
    public String toString()
    {
        return String.format("LookupTypeMarkBasePosFormat1[posFormat=%d,markCount=%d,baseCount=%d]",
                getFormat(), getMarkRecords().length, baseAnchors.length);
    }
}
