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
import org.apache.glyphbox.ttf.TTFDataStream;

/**
 * Reads the
 * <a href="https://docs.microsoft.com/en-us/typography/opentype/spec/chapter2#sequence-context-format-1-simple-glyph-contexts">Sequence
 * Context</a> and
 * <a href="https://docs.microsoft.com/en-us/typography/opentype/spec/chapter2#chained-sequence-context-format-1-simple-glyph-contexts">Chained
 * Sequence Context</a> subtables. They have the same layout in GSUB (lookup types 5 and 6) and
 * GPOS (lookup types 7 and 8).
 */
public final class SequenceContextReader
{
    private SequenceContextReader()
    {
    }

    /**
     * Reads a sequence context subtable of format 1, 2 or 3.
     *
     * @param data the font data
     * @param offset absolute offset of the subtable
     * @return the subtable
     * @throws IOException if the data is truncated or the format is unknown
     */
    public static <T extends GlyphSequence> LookupSubTable<T> readSequenceContext(
            TTFDataStream data, long offset) throws IOException
    {
        data.seek(offset);
        int format = data.readUnsignedShort();
        switch (format)
        {
        case 1:
        {
            int coverageOffset = data.readOffset16();
            int seqRuleSetCount = data.readUnsignedShort();
            int[] seqRuleSetOffsets = data.readUnsignedShortArray(seqRuleSetCount);
            SequenceRuleSetTable[] seqRuleSets = readSequenceRuleSets(data, offset,
                    seqRuleSetOffsets);
            CoverageTable coverageTable = CoverageTable.read(data, offset + coverageOffset);
            return new SequenceContextFormat1SubTable<T>(format, coverageTable, seqRuleSets);
        }
        case 2:
        {
            int coverageOffset = data.readOffset16();
            int classDefOffset = data.readOffset16();
            int classSeqRuleSetCount = data.readUnsignedShort();
            int[] classSeqRuleSetOffsets = data.readUnsignedShortArray(classSeqRuleSetCount);
            SequenceRuleSetTable[] classSeqRuleSets = readSequenceRuleSets(data, offset,
                    classSeqRuleSetOffsets);
            CoverageTable coverageTable = CoverageTable.read(data, offset + coverageOffset);
            ClassDefinitionTable classDefinitionTable =
                    readClassDefinitionTable(data, offset, classDefOffset);
            return new SequenceContextFormat2SubTable<T>(format, coverageTable,
                    classDefinitionTable, classSeqRuleSets);
        }
        case 3:
        {
            int glyphCount = data.readUnsignedShort();
            int seqLookupCount = data.readUnsignedShort();
            int[] coverageOffsets = data.readUnsignedShortArray(glyphCount);
            SequenceLookupRecord[] seqLookupRecords = readSequenceLookupRecords(data,
                    seqLookupCount);
            CoverageTable[] coverageTables = readCoverageTables(data, offset, coverageOffsets);
            return new SequenceContextFormat3SubTable<T>(format, coverageTables,
                    seqLookupRecords);
        }
        default:
            throw InvalidFontFileException.invalidFormat("format", format, "'1', '2' or '3'");
        }
    }

    /**
     * Reads a chained sequence context subtable of format 1, 2 or 3.
     *
     * @param data the font data
     * @param offset absolute offset of the subtable
     * @return the subtable
     * @throws IOException if the data is truncated or the format is unknown
     */
    public static <T extends GlyphSequence> LookupSubTable<T> readChainedSequenceContext(
            TTFDataStream data, long offset) throws IOException
    {
        data.seek(offset);
        int format = data.readUnsignedShort();
        switch (format)
        {
        case 1:
        {
            int coverageOffset = data.readOffset16();
            int chainedSeqRuleSetCount = data.readUnsignedShort();
            int[] chainedSeqRuleSetOffsets = data.readUnsignedShortArray(chainedSeqRuleSetCount);
            ChainedSequenceRuleSetTable[] chainedSeqRuleSets = readChainedSequenceRuleSets(data,
                    offset, chainedSeqRuleSetOffsets);
            CoverageTable coverageTable = CoverageTable.read(data, offset + coverageOffset);
            return new ChainedSequenceContextFormat1SubTable<T>(format, coverageTable,
                    chainedSeqRuleSets);
        }
        case 2:
        {
            int coverageOffset = data.readOffset16();
            int backtrackClassDefOffset = data.readOffset16();
            int inputClassDefOffset = data.readOffset16();
            int lookaheadClassDefOffset = data.readOffset16();
            int chainedClassSeqRuleSetCount = data.readUnsignedShort();
            int[] chainedClassSeqRuleSetOffsets =
                    data.readUnsignedShortArray(chainedClassSeqRuleSetCount);
            ChainedSequenceRuleSetTable[] chainedClassSeqRuleSets = readChainedSequenceRuleSets(
                    data, offset, chainedClassSeqRuleSetOffsets);
            CoverageTable coverageTable = CoverageTable.read(data, offset + coverageOffset);
            ClassDefinitionTable backtrackClassDef =
                    readClassDefinitionTable(data, offset, backtrackClassDefOffset);
            ClassDefinitionTable inputClassDef =
                    readClassDefinitionTable(data, offset, inputClassDefOffset);
            ClassDefinitionTable lookaheadClassDef =
                    readClassDefinitionTable(data, offset, lookaheadClassDefOffset);
            return new ChainedSequenceContextFormat2SubTable<T>(format, coverageTable,
                    backtrackClassDef, inputClassDef, lookaheadClassDef, chainedClassSeqRuleSets);
        }
        case 3:
        {
            int backtrackGlyphCount = data.readUnsignedShort();
            int[] backtrackCoverageOffsets = data.readUnsignedShortArray(backtrackGlyphCount);
            int inputGlyphCount = data.readUnsignedShort();
            int[] inputCoverageOffsets = data.readUnsignedShortArray(inputGlyphCount);
            int lookaheadGlyphCount = data.readUnsignedShort();
            int[] lookaheadCoverageOffsets = data.readUnsignedShortArray(lookaheadGlyphCount);
            int seqLookupCount = data.readUnsignedShort();
            SequenceLookupRecord[] seqLookupRecords = readSequenceLookupRecords(data,
                    seqLookupCount);
            CoverageTable[] backtrackCoverages = readCoverageTables(data, offset,
                    backtrackCoverageOffsets);
            CoverageTable[] inputCoverages = readCoverageTables(data, offset,
                    inputCoverageOffsets);
            CoverageTable[] lookaheadCoverages = readCoverageTables(data, offset,
                    lookaheadCoverageOffsets);
            return new ChainedSequenceContextFormat3SubTable<T>(format, backtrackCoverages,
                    inputCoverages, lookaheadCoverages, seqLookupRecords);
        }
        default:
            throw InvalidFontFileException.invalidFormat("format", format, "'1', '2' or '3'");
        }
    }

    /**
     * Reads the coverage tables whose offsets are relative to {@code offset}.
     */
    public static CoverageTable[] readCoverageTables(TTFDataStream data, long offset,
            int[] coverageOffsets) throws IOException
    {
        CoverageTable[] coverageTables = new CoverageTable[coverageOffsets.length];
        for (int i = 0; i < coverageOffsets.length; i++)
        {
            coverageTables[i] = CoverageTable.read(data, offset + coverageOffsets[i]);
        }
        return coverageTables;
    }

    // a NULL offset assigns every glyph to class 0
    private static ClassDefinitionTable readClassDefinitionTable(TTFDataStream data, long offset,
            int classDefOffset) throws IOException
    {
        if (classDefOffset == 0)
        {
            return new ClassDefinitionTableFormat2(2, new ClassRangeRecord[0]);
        }
        return ClassDefinitionTable.read(data, offset + classDefOffset);
    }

    static SequenceLookupRecord[] readSequenceLookupRecords(TTFDataStream data, int count)
            throws IOException
    {
        data.requireAvailable(4L * count, "SequenceLookupRecord[" + count + "]");
        SequenceLookupRecord[] records = new SequenceLookupRecord[count];
        for (int i = 0; i < count; i++)
        {
            int sequenceIndex = data.readUnsignedShort();
            int lookupListIndex = data.readUnsignedShort();
            records[i] = new SequenceLookupRecord(sequenceIndex, lookupListIndex);
        }
        return records;
    }

    // rule sets with a NULL offset stay null: no rule starts with that glyph or class
    private static SequenceRuleSetTable[] readSequenceRuleSets(TTFDataStream data, long offset,
            int[] ruleSetOffsets) throws IOException
    {
        SequenceRuleSetTable[] ruleSets = new SequenceRuleSetTable[ruleSetOffsets.length];
        for (int i = 0; i < ruleSetOffsets.length; i++)
        {
            if (ruleSetOffsets[i] == 0)
            {
                continue;
            }
            long ruleSetOffset = offset + ruleSetOffsets[i];
            data.seek(ruleSetOffset);
            int ruleCount = data.readUnsignedShort();
            int[] ruleOffsets = data.readUnsignedShortArray(ruleCount);
            SequenceRuleTable[] rules = new SequenceRuleTable[ruleCount];
            for (int j = 0; j < ruleCount; j++)
            {
                data.seek(ruleSetOffset + ruleOffsets[j]);
                int glyphCount = data.readUnsignedShort();
                int seqLookupCount = data.readUnsignedShort();
                int[] inputSequence = data.readUnsignedShortArray(Math.max(0, glyphCount - 1));
                SequenceLookupRecord[] records = readSequenceLookupRecords(data, seqLookupCount);
                rules[j] = new SequenceRuleTable(inputSequence, records);
            }
            ruleSets[i] = new SequenceRuleSetTable(rules);
        }
        return ruleSets;
    }

    private static ChainedSequenceRuleSetTable[] readChainedSequenceRuleSets(TTFDataStream data,
            long offset, int[] ruleSetOffsets) throws IOException
    {
        ChainedSequenceRuleSetTable[] ruleSets =
                new ChainedSequenceRuleSetTable[ruleSetOffsets.length];
        for (int i = 0; i < ruleSetOffsets.length; i++)
        {
            if (ruleSetOffsets[i] == 0)
            {
                continue;
            }
            long ruleSetOffset = offset + ruleSetOffsets[i];
            data.seek(ruleSetOffset);
            int ruleCount = data.readUnsignedShort();
            int[] ruleOffsets = data.readUnsignedShortArray(ruleCount);
            ChainedSequenceRuleTable[] rules = new ChainedSequenceRuleTable[ruleCount];
            for (int j = 0; j < ruleCount; j++)
            {
                data.seek(ruleSetOffset + ruleOffsets[j]);
                int backtrackGlyphCount = data.readUnsignedShort();
                int[] backtrackSequence = data.readUnsignedShortArray(backtrackGlyphCount);
                int inputGlyphCount = data.readUnsignedShort();
                int[] inputSequence = data.readUnsignedShortArray(
                        Math.max(0, inputGlyphCount - 1));
                int lookaheadGlyphCount = data.readUnsignedShort();
                int[] lookaheadSequence = data.readUnsignedShortArray(lookaheadGlyphCount);
                int seqLookupCount = data.readUnsignedShort();
                SequenceLookupRecord[] records = readSequenceLookupRecords(data, seqLookupCount);
                rules[j] = new ChainedSequenceRuleTable(backtrackSequence, inputSequence,
                        lookaheadSequence, records);
            }
            ruleSets[i] = new ChainedSequenceRuleSetTable(rules);
        }
        return ruleSets;
    }
}
