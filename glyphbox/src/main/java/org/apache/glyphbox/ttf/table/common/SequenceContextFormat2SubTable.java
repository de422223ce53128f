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
 * Sequence context format 2: rules of glyph classes, grouped by the class of the first input
 * glyph. The first glyph must also be covered by the coverage table.
 *
 * @param <T> the kind of glyph collection
 */
public class SequenceContextFormat2SubTable<T extends GlyphSequence> extends LookupSubTable<T>
{
    private final ClassDefinitionTable classDefinitionTable;
    private final SequenceRuleSetTable[] classSeqRuleSetTables;

    public SequenceContextFormat2SubTable(int format, CoverageTable coverageTable,
            ClassDefinitionTable classDefinitionTable,
            SequenceRuleSetTable[] classSeqRuleSetTables)
    {
        super(format, coverageTable);
        this.classDefinitionTable = classDefinitionTable;
        this.classSeqRuleSetTables = classSeqRuleSetTables;
    }

    @Override
    public boolean apply(LookupContext<T> context, int index) throws IOException
    {
        T glyphs = context.getGlyphs();
        if (getCoverageIndex(glyphs, index) < 0)
        {
            return false;
        }
        int classId = classDefinitionTable.getClassIndex(glyphs.getGlyphId(index));
        if (classId >= classSeqRuleSetTables.length || classSeqRuleSetTables[classId] == null)
        {
            return false;
        }
        for (SequenceRuleTable rule : classSeqRuleSetTables[classId].getSequenceRuleTables())
        {
            if (SequenceMatcher.matchClassSequence(glyphs, index + 1, rule.getInputSequence(),
                    classDefinitionTable))
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
        for (SequenceRuleSetTable ruleSet : classSeqRuleSetTables)
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

    @Override
    public String toString()
    {
        return String.format("SequenceContextFormat2SubTable[classSeqRuleSetCount=%d]",
                classSeqRuleSetTables.length);
    }
}
