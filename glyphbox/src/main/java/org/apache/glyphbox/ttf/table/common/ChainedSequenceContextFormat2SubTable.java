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
 * Chained sequence context format 2: rules of glyph classes. Backtrack, input and lookahead each
 * have their own class definition; rules are grouped by the input class of the first glyph.
 *
 * @param <T> the kind of glyph collection
 */
public class ChainedSequenceContextFormat2SubTable<T extends GlyphSequence>
        extends LookupSubTable<T>
{
    private final ClassDefinitionTable backtrackClassDefinitionTable;
    private final ClassDefinitionTable inputClassDefinitionTable;
    private final ClassDefinitionTable lookaheadClassDefinitionTable;
    private final ChainedSequenceRuleSetTable[] chainedClassSeqRuleSetTables;

    public ChainedSequenceContextFormat2SubTable(int format, CoverageTable coverageTable,
            ClassDefinitionTable backtrackClassDefinitionTable,
            ClassDefinitionTable inputClassDefinitionTable,
            ClassDefinitionTable lookaheadClassDefinitionTable,
            ChainedSequenceRuleSetTable[] chainedClassSeqRuleSetTables)
    {
        super(format, coverageTable);
        this.backtrackClassDefinitionTable = backtrackClassDefinitionTable;
        this.inputClassDefinitionTable = inputClassDefinitionTable;
        this.lookaheadClassDefinitionTable = lookaheadClassDefinitionTable;
        this.chainedClassSeqRuleSetTables = chainedClassSeqRuleSetTables;
    }

    @Override
    public boolean apply(LookupContext<T> context, int index) throws IOException
    {
        T glyphs = context.getGlyphs();
        if (getCoverageIndex(glyphs, index) < 0)
        {
            return false;
        }
        int classId = inputClassDefinitionTable.getClassIndex(glyphs.getGlyphId(index));
        if (classId >= chainedClassSeqRuleSetTables.length
                || chainedClassSeqRuleSetTables[classId] == null)
        {
            return false;
        }
        ChainedSequenceRuleTable[] rules =
                chainedClassSeqRuleSetTables[classId].getChainedSequenceRuleTables();
        for (ChainedSequenceRuleTable rule : rules)
        {
            int[] input = rule.getInputSequence();
            if (SequenceMatcher.matchBacktrackClassSequence(glyphs, index,
                        rule.getBacktrackSequence(), backtrackClassDefinitionTable)
                    && SequenceMatcher.matchClassSequence(glyphs, index + 1, input,
                        inputClassDefinitionTable)
                    && SequenceMatcher.matchClassSequence(glyphs, index + 1 + input.length,
                        rule.getLookaheadSequence(), lookaheadClassDefinitionTable))
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
        for (ChainedSequenceRuleSetTable ruleSet : chainedClassSeqRuleSetTables)
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
        return String.format(
                "ChainedSequenceContextFormat2SubTable[chainedClassSeqRuleSetCount=%d]",
                chainedClassSeqRuleSetTables.length);
    }
}
