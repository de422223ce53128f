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
 * <a href="https://docs.microsoft.com/en-us/typography/opentype/spec/gpos#mark-to-mark-attachment-positioning-format-1-mark-to-mark-attachment">Mark-to-Mark
 * Attachment Positioning Format 1</a>. The attaching mark (mark1) combines with the mark directly
 * before it (mark2); mark2 anchors are indexed {@code [mark2Index][markClass]}.
 */
public class LookupTypeMarkMarkPosFormat1 extends MarkAttachmentSubTable
{
    private final CoverageTable mark2CoverageTable;
    private final AnchorTable[][] mark2Anchors;

    public LookupTypeMarkMarkPosFormat1(int posFormat, CoverageTable mark1CoverageTable,
            CoverageTable mark2CoverageTable, MarkRecord[] mark1Records,
            AnchorTable[][] mark2Anchors)
    {
        super(posFormat, mark1CoverageTable, mark1Records);
        this.mark2CoverageTable = mark2CoverageTable;
        this.mark2Anchors = mark2Anchors;
    }

    @Override
    public boolean apply(LookupContext<GlyphPositioningCollection> context, int index)
    {
        GlyphPositioningCollection positions = context.getGlyphs();
        MarkRecord markRecord = getMarkRecord(positions, index);
        if (markRecord == null || index == 0)
        {
            return false;
        }
        int mark2Index = index - 1;
        int mark2CoverageIndex = mark2CoverageTable
                .getCoverageIndex(positions.getGlyphId(mark2Index));
        if (mark2CoverageIndex < 0 || mark2CoverageIndex >= mark2Anchors.length)
        {
            return false;
        }
        AnchorTable[] anchors = mark2Anchors[mark2CoverageIndex];
        int markClass = markRecord.getMarkClass();
        if (markClass >= anchors.length || anchors[markClass] == null)
        {
            return false;
        }
        attach(positions, mark2Index, anchors[markClass], index, markRecord.getMarkAnchor());
        return true;
    }

    public CoverageTable getMark2CoverageTable()
    {
        return mark2CoverageTable;
    }

    @Override
    public String toString()
    {
        return String.format("LookupTypeMarkMarkPosFormat1[posFormat=%d,mark1Count=%d,"
                + "mark2Count=%d]", getFormat(), getMarkRecords().length, mark2Anchors.length);
    }
}
