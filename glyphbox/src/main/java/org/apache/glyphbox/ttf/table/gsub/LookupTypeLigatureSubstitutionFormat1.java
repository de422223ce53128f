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
import org.apache.glyphbox.ttf.table.common.SequenceMatcher;

/**
 * This class models the
 * <a href="https://docs.microsoft.com/en-us/typography/opentype/spec/gsub#41-ligature-substitution-format-1">Ligature
 * Substitution Format 1</a>. The first ligature whose components follow the covered glyph
 * replaces them all with a single slot.
 */
public class LookupTypeLigatureSubstitutionFormat1
        extends LookupSubTable<GlyphSubstitutionCollection>
{
    private final LigatureSetTable[] ligatureSetTables;

    public LookupTypeLigatureSubstitutionFormat1(int substFormat, CoverageTable coverageTable,
            LigatureSetTable[] ligatureSetTables)
    {
        super(substFormat, coverageTable);
        this.ligatureSetTables = ligatureSetTables;
    }

    @Override
    public boolean apply(LookupContext<GlyphSubstitutionCollection> context, int index)
    {
        GlyphSubstitutionCollection glyphs = context.getGlyphs();
        int coverageIndex = getCoverageIndex(glyphs, index);
        if (coverageIndex < 0 || coverageIndex >= ligatureSetTables.length)
        {
            return false;
        }
        for (LigatureTable ligatureTable : ligatureSetTables[coverageIndex].getLigatureTables())
        {
            if (SequenceMatcher.matchSequence(glyphs, index + 1,
                    ligatureTable.getComponentGlyphIDs()))
            {
                glyphs.replace(index, ligatureTable.getComponentCount(),
                        ligatureTable.getLigatureGlyph());
                return true;
            }
        }
        return false;
    }

    public LigatureSetTable[] getLigatureSetTables()
    {
        return ligatureSetTables;
    }

    @Override
    public String toString()
    {
        return String.format("LookupTypeLigatureSubstitutionFormat1[substFormat=%d,"
                + "ligatureSetCount=%d]", getFormat(), ligatureSetTables.length);
    }
}
