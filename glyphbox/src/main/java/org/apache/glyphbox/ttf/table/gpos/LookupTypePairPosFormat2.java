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
import org.apache.glyphbox.ttf.table.common.ClassDefinitionTable;
import org.apache.glyphbox.ttf.table.common.CoverageTable;
import org.apache.glyphbox.ttf.table.common.LookupContext;
import org.apache.glyphbox.ttf.table.common.LookupSubTable;

/**
 * This class models the
 * <a href="https://docs.microsoft.com/en-us/typography/opentype/spec/gpos#pair-adjustment-positioning-format-2-class-pair-adjustment">Pair
 * Adjustment Positioning Format 2</a>: adjustments for pairs of glyph classes. The records are
 * indexed {@code [class1][class2]} and each holds the two value records of the pair.
 */
public class LookupTypePairPosFormat2 extends LookupSubTable<GlyphPositioningCollection>
{
    private final ClassDefinitionTable classDef1;
    private final ClassDefinitionTable classDef2;
    private final ValueRecord[][][] classRecords;

    public LookupTypePairPosFormat2(int posFormat, CoverageTable coverageTable,
            ClassDefinitionTable classDef1, ClassDefinitionTable classDef2,
            ValueRecord[][][] classRecords)
    {
        super(posFormat, coverageTable);
        this.classDef1 = classDef1;
        this.classDef2 = classDef2;
        this.classRecords = classRecords;
    }

    @Override
    public boolean apply(LookupContext<GlyphPositioningCollection> context, int index)
    {
        GlyphPositioningCollection positions = context.getGlyphs();
        if (getCoverageIndex(positions, index) < 0 || index + 1 >= positions.size())
        {
            return false;
        }
        int secondGlyph = positions.getGlyphId(index + 1);
        if (secondGlyph == 0)
        {
            return false;
        }
        int class1 = classDef1.getClassIndex(positions.getGlyphId(index));
        int class2 = classDef2.getClassIndex(secondGlyph);
        if (class1 >= classRecords.length || class2 >= classRecords[class1].length)
        {
            return false;
        }
        ValueRecord[] pair = classRecords[class1][class2];
        if (pair[0].isEmpty() && pair[1].isEmpty())
        {
            return false;
        }
        pair[0].apply(positions, index);
        pair[1].apply(positions, index + 1);
        return true;
    }

    public ClassDefinitionTable getClassDef1()
    {
        return classDef1;
    }

    public ClassDefinitionTable getClassDef2()
    {
        return classDef2;
    }

    @Override
    public String toString()
    {
        return String.format("LookupTypePairPosFormat2[posFormat=%d,class1Count=%d]",
                getFormat(), classRecords.length);
    }
}
