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
 * <a href="https://docs.microsoft.com/en-us/typography/opentype/spec/gpos#mark-to-ligature-attachment-positioning-format-1-mark-to-ligature-attachment">Mark-to-Ligature
 * Attachment Positioning Format 1</a>. Ligature anchors are indexed
 * {@code [ligatureIndex][component][markClass]}. Ligatures are formed from adjacent slots, so a
 * mark following one always belongs to its last component.
 */
public class LookupTypeMarkLigaturePosFormat1 extends MarkAttachmentSubTable
{
    private final CoverageTable ligatureCoverageTable;
    private final AnchorTable[][][] ligatureAnchors;

    public LookupTypeMarkLigaturePosFormat1(int posFormat, CoverageTable markCoverageTable,
            CoverageTable ligatureCoverageTable, MarkRecord[] markRecords,
            AnchorTable[][][] ligatureAnchors)
    {
        super(posFormat, markCoverageTable, markRecords);
        this.ligatureCoverageTable = ligatureCoverageTable;
        this.ligatureAnchors = ligatureAnchors;
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
        int ligatureIndex = findBase(context, index);
        if (ligatureIndex < 0)
        {
            return false;
        }
        int ligatureCoverageIndex = ligatureCoverageTable
                .getCoverageIndex(positions.getGlyphId(ligatureIndex));
        if (ligatureCoverageIndex < 0 || ligatureCoverageIndex >= ligatureAnchors.length)
        {
            return false;
        }
        AnchorTable[][] components = ligatureAnchors[ligatureCoverageIndex];
        if (components.length == 0)
        {
            return false;
        }
        int markClass = markRecord.getMarkClass();
        AnchorTable[] anchors = components[components.length - 1];
        if (markClass >= anchors.length || anchors[markClass] == null)
        {
            return false;
        }
        attach(positions, ligatureIndex, anchors[markClass], index, markRecord.getMarkAnchor());
        return true;
    }

    public CoverageTable getLigatureCoverageTable()
    {
        return ligatureCoverageTable;
    }

    @Override
    public String toString()
    {
        return String.format("LookupTypeMarkLigaturePosFormat1[posFormat=%d,markCount=%d,"
                + "ligatureCount=%d]", getFormat(), getMarkRecords().length,
                ligatureAnchors.length);
    }
}
