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
 * <a href="https://learn.microsoft.com/en-us/typography/opentype/spec/gsub#21-multiple-substitution-format-1">Multiple
 * Substitution Format 1</a>: one glyph is replaced by a sequence of glyphs, which all keep the
 * features of the replaced glyph.
 */
public class LookupTypeMultipleSubstitutionFormat1
        extends LookupSubTable<GlyphSubstitutionCollection>
{
    private final SequenceTable[] sequenceTables;

    public LookupTypeMultipleSubstitutionFormat1(int substFormat, CoverageTable coverageTable,
            SequenceTable[] sequenceTables)
    {
        super(substFormat, coverageTable);
        this.sequenceTables = sequenceTables;
    }

    @Override
    public boolean apply(LookupContext<GlyphSubstitutionCollection> context, int index)
    {
        GlyphSubstitutionCollection glyphs = context.getGlyphs();
        int coverageIndex = getCoverageIndex(glyphs, index);
        if (coverageIndex < 0 || coverageIndex >= sequenceTables.length)
        {
            return false;
        }
        glyphs.replace(index, 1, sequenceTables[coverageIndex].getSubstituteGlyphIDs());
        return true;
    }

    public SequenceTable[] getSequenceTables()
    {
        return sequenceTables;
    }

    @Override
    public String toString()
    {
        return String.format("LookupTypeMultipleSubstitutionFormat1[substFormat=%d,"
                + "sequenceCount=%d]", getFormat(), sequenceTables.length);
    }
}
