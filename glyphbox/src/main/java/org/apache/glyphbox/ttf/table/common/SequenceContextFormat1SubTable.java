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

package org.apache.glyphbox.ttf.table.common;

import java.io.IOException;

import org.apache.glyphbox.ttf.InvalidFontFileException;

/**
 * Sequence context format 1: rules of explicit glyph ids, grouped by the coverage index of the
 * first input glyph.
 *
 * @param <T> the kind of glyph collection
 */
public class SequenceContextFormat1SubTable<T extends GlyphSequence> extends LookupSubTable<T>
{
    private final SequenceRuleSetTable[] seqRuleSetTables;

    public SequenceContextFormat1SubTable(int format, CoverageTable coverageTable,
            SequenceRuleSetTable[] seqRuleSetTables)
    {
        super(format, coverageTable);
        this.seqRuleSetTables = seqRuleSetTables;
    }

    @Override
    public boolean apply(LookupContext<T> context, int index) throws IOException
    {
        T glyphs = context.getGlyphs();
        int coverageIndex = getCoverageIndex(glyphs, index);
        if (coverageIndex < 0 || coverageIndex >= seqRuleSetTables.length
                || seqRuleSetTables[coverageIndex] == null)
        {
            return false;
        }
        for (SequenceRuleTable rule : seqRuleSetTables[coverageIndex].getSequenceRuleTables())
        {
            if (SequenceMatcher.matchSequence(glyphs, index + 1, rule.getInputSequence()))
            {
                return SequenceMatcher.applyLookupRecords(context, index,
                        rule.getSeqLookupRecords(), true);
            }
        }
        return false;
    }

    @Override
    public void validateLookupIndices(int lookupCount) throws InvalidFontFileException
    {
        for (SequenceRuleSetTable ruleSet : seqRuleSetTables)
        {
            if (ruleSet != null)
            {
                for (SequenceRuleTable rule : ruleSet.getSequenceRuleTables())
                {
                    SequenceMatcher.validate(rule.getSeqLookupRecords(), lookupCount, toString());
                }
            }
        }
    }

    public SequenceRuleSetTable[] getSeqRuleSetTables()
    {
        return seqRuleSetTables;
    }

    @Override
    public String toString()
    {
        return String.format("SequenceContextFormat1SubTable[seqRuleSetCount=%d]",
                seqRuleSetTables.length);
    }
}
