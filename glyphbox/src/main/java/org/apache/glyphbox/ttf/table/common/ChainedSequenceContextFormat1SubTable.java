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
 * Chained sequence context format 1: rules of explicit backtrack, input and lookahead glyph ids,
 * grouped by the coverage index of the first input glyph.
 *
 * @param <T> the kind of glyph collection
 */
public class ChainedSequenceContextFormat1SubTable<T extends GlyphSequence>
        extends LookupSubTable<T>
{
    private final ChainedSequenceRuleSetTable[] chainedSeqRuleSetTables;

    public ChainedSequenceContextFormat1SubTable(int format, CoverageTable coverageTable,
            ChainedSequenceRuleSetTable[] chainedSeqRuleSetTables)
    {
        super(format, coverageTable);
        this.chainedSeqRuleSetTables = chainedSeqRuleSetTables;
    }

    @Override
    public boolean apply(LookupContext<T> context, int index) throws IOException
    {
        T glyphs = context.getGlyphs();
        int coverageIndex = getCoverageIndex(glyphs, index);
        if (coverageIndex < 0 || coverageIndex >= chainedSeqRuleSetTables.length
                || chainedSeqRuleSetTables[coverageIndex] == null)
        {
            return false;
        }
        ChainedSequenceRuleTable[] rules =
                chainedSeqRuleSetTables[coverageIndex].getChainedSequenceRuleTables();
        for (ChainedSequenceRuleTable rule : rules)
        {
            int[] input = rule.getInputSequence();
            if (SequenceMatcher.matchBacktrackSequence(glyphs, index, rule.getBacktrackSequence())
                    && SequenceMatcher.matchSequence(glyphs, index + 1, input)
                    && SequenceMatcher.matchSequence(glyphs, index + 1 + input.length,
                            rule.getLookaheadSequence()))
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
        for (ChainedSequenceRuleSetTable ruleSet : chainedSeqRuleSetTables)
        {
            if (ruleSet != null)
            {
                for (ChainedSequenceRuleTable rule : ruleSet.getChainedSequenceRuleTables())
                {
                    SequenceMatcher.validate(rule.getSeqLookupRecords(), lookupCount, toString());
                }
            }
        }
    }

    @Override
    public String toString()
    {
        return String.format("ChainedSequenceContextFormat1SubTable[chainedSeqRuleSetCount=%d]",
                chainedSeqRuleSetTables.length);
    }
}
