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
 * <a href="https://docs.microsoft.com/en-us/typography/opentype/spec/gsub#81-reverse-chaining-contextual-single-substitution-format-1-coverage-based-glyph-contexts">Reverse
 * Chaining Contextual Single Substitution Format 1</a>. Lookups of this type are processed from the
 * end of the glyph run towards its start, so the context after the current glyph has already been
 * substituted.
 */
public class LookupTypeReverseChainSingleSubstFormat1
        extends LookupSubTable<GlyphSubstitutionCollection>
{
    private final CoverageTable[] backtrackCoverageTables;
    private final CoverageTable[] lookaheadCoverageTables;
    private final int[] substituteGlyphIDs;

    public LookupTypeReverseChainSingleSubstFormat1(int substFormat, CoverageTable coverageTable,
            CoverageTable[] backtrackCoverageTables, CoverageTable[] lookaheadCoverageTables,
            int[] substituteGlyphIDs)
    {
        super(substFormat, coverageTable);
        this.backtrackCoverageTables = backtrackCoverageTables;
        this.lookaheadCoverageTables = lookaheadCoverageTables;
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
        if (!SequenceMatcher.matchBacktrackCoverageSequence(glyphs, index,
                backtrackCoverageTables)
                || !SequenceMatcher.matchCoverageSequence(glyphs, index + 1,
                        lookaheadCoverageTables))
        {
            return false;
        }
        glyphs.setGlyphId(index, substituteGlyphIDs[coverageIndex]);
        return true;
    }

    @Override
    public String toString()
    {
        return String.format("LookupTypeReverseChainSingleSubstFormat1[backtrackGlyphCount=%d,"
                + "lookaheadGlyphCount=%d,glyphCount=%d]", backtrackCoverageTables.length,
                lookaheadCoverageTables.length, substituteGlyphIDs.length);
    }
}
