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

package org.apache.glyphbox.ttf.table.gsub;

import java.util.Arrays;

import org.apache.glyphbox.ttf.shaping.GlyphSubstitutionCollection;
import org.apache.glyphbox.ttf.table.common.CoverageTable;
import org.apache.glyphbox.ttf.table.common.LookupContext;
import org.apache.glyphbox.ttf.table.common.LookupSubTable;

/**
 * This class models the
 * <a href="https://docs.microsoft.com/en-us/typography/opentype/spec/gsub#12-single-substitution-format-2">Single
 * Substitution Format 2</a>: one substitute glyph per coverage index.
 */
public class LookupTypeSingleSubstFormat2 extends LookupSubTable<GlyphSubstitutionCollection>
{
    private final int[] substituteGlyphIDs;

    public LookupTypeSingleSubstFormat2(int substFormat, CoverageTable coverageTable,
            int[] substituteGlyphIDs)
    {
        super(substFormat, coverageTable);
        this.substituteGlyphIDs = substituteGlyphIDs;
    }

    @Override
    public boolean apply(LookupContext<GlyphSubstitutionCollection> context, int index)
    {
        GlyphSubstitutionCollection glyphs = context.getGlyphs();
        int coverageIndex = getCoverageIndex(glyphs, index);
        if (coverageIndex < 0 || coverageIndex >= substituteGlyphIDs.length)
        {
            return false;
        }
        glyphs.setGlyphId(index, doSubstitution(glyphs.getGlyphId(index), coverageIndex));
        return true;
    }

    public int doSubstitution(int gid, int coverageIndex)
    {
        return coverageIndex < 0 ? gid : substituteGlyphIDs[coverageIndex];
    }

    public int[] getSubstituteGlyphIDs()
    {
        return substituteGlyphIDs;
    }

    @Override
    public String toString()
    {
        return String.format("LookupTypeSingleSubstFormat2[substFormat=%d,substituteGlyphIDs=%s]",
                getFormat(), Arrays.toString(substituteGlyphIDs));
    }
}
