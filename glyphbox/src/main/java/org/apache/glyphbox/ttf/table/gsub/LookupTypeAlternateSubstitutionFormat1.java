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

import org.apache.glyphbox.ttf.shaping.GlyphSubstitutionCollection;
import org.apache.glyphbox.ttf.table.common.CoverageTable;
import org.apache.glyphbox.ttf.table.common.LookupContext;
import org.apache.glyphbox.ttf.table.common.LookupSubTable;

/**
 * This class models the
 * <a href="https://docs.microsoft.com/en-us/typography/opentype/spec/gsub#31-alternate-substitution-format-1">Alternate
 * Substitution Format 1</a>. The alternate is chosen by the index configured on the lookup
 * context, 0 by default; an index beyond the end of an alternate set selects its last entry.
 */
public class LookupTypeAlternateSubstitutionFormat1
        extends LookupSubTable<GlyphSubstitutionCollection>
{
    private final int[][] alternateSets;

    /**
     * @param alternateSets the alternate glyph ids, one array per coverage index
     */
    public LookupTypeAlternateSubstitutionFormat1(int substFormat, CoverageTable coverageTable,
            int[][] alternateSets)
    {
        super(substFormat, coverageTable);
        this.alternateSets = alternateSets;
    }

    @Override
    public boolean apply(LookupContext<GlyphSubstitutionCollection> context, int index)
    {
        GlyphSubstitutionCollection glyphs = context.getGlyphs();
        int coverageIndex = getCoverageIndex(glyphs, index);
        if (coverageIndex < 0 || coverageIndex >= alternateSets.length)
        {
            return false;
        }
        int[] alternates = alternateSets[coverageIndex];
        if (alternates.length == 0)
        {
            return false;
        }
        int alternateIndex = Math.max(0, Math.min(context.getAlternateIndex(),
                alternates.length - 1));
        glyphs.setGlyphId(index, alternates[alternateIndex]);
        return true;
    }

    public int[] getAlternates(int coverageIndex)
    {
        return alternateSets[coverageIndex];
    }

    @Override
    public String toString()
    {
        return String.format("LookupTypeAlternateSubstitutionFormat1[substFormat=%d,"
                + "alternateSetCount=%d]", getFormat(), alternateSets.length);
    }
}
