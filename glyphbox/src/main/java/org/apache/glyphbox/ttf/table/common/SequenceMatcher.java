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
 * Sequence matching shared by the contextual lookups. A position whose glyph id is 0, or that lies
 * outside of the collection, never matches. Matching never modifies the collection.
 */
public final class SequenceMatcher
{
    private SequenceMatcher()
    {
    }

    /**
     * Matches glyph ids left to right, starting at {@code start}.
     */
    public static boolean matchSequence(GlyphSequence glyphs, int start, int[] sequence)
    {
        for (int i = 0; i < sequence.length; i++)
        {
            int gid = glyphAt(glyphs, start + i);
            if (gid <= 0 || gid != sequence[i])
            {
                return false;
            }
        }
        return true;
    }

    /**
     * Matches glyph ids right to left, ending immediately before {@code index}. The first entry
     * of the sequence is the glyph nearest to {@code index}.
     */
    public static boolean matchBacktrackSequence(GlyphSequence glyphs, int index, int[] sequence)
    {
        for (int i = 0; i < sequence.length; i++)
        {
            int gid = glyphAt(glyphs, index - 1 - i);
            if (gid <= 0 || gid != sequence[i])
            {
                return false;
            }
        }
        return true;
    }

    public static boolean matchClassSequence(GlyphSequence glyphs, int start, int[] classes,
            ClassDefinitionTable classDefinitionTable)
    {
        for (int i = 0; i < classes.length; i++)
        {
            int gid = glyphAt(glyphs, start + i);
            if (gid <= 0 || classDefinitionTable.getClassIndex(gid) != classes[i])
            {
                return false;
            }
        }
        return true;
    }

    public static boolean matchBacktrackClassSequence(GlyphSequence glyphs, int index,
            int[] classes, ClassDefinitionTable classDefinitionTable)
    {
        for (int i = 0; i < classes.length; i++)
        {
            int gid = glyphAt(glyphs, index - 1 - i);
            if (gid <= 0 || classDefinitionTable.getClassIndex(gid) != classes[i])
            {
                return false;
            }
        }
        return true;
    }

    public static boolean matchCoverageSequence(GlyphSequence glyphs, int start,
            CoverageTable[] coverageTables)
    {
        for (int i = 0; i < coverageTables.length; i++)
        {
            int gid = glyphAt(glyphs, start + i);
            if (gid <= 0 || coverageTables[i].getCoverageIndex(gid) < 0)
            {
                return false;
            }
        }
        return true;
    }

    public static boolean matchBacktrackCoverageSequence(GlyphSequence glyphs, int index,
            CoverageTable[] coverageTables)
    {
        for (int i = 0; i < coverageTables.length; i++)
        {
            int gid = glyphAt(glyphs, index - 1 - i);
            if (gid <= 0 || coverageTables[i].getCoverageIndex(gid) < 0)
            {
                return false;
            }
        }
        return true;
    }

    /**
     * Applies the lookup records of a matched rule. Records are applied in their stored order;
     * when a nested substitution changes the number of slots, the positions of the following
     * records are shifted by the same amount.
     *
     * @param context the lookup context
     * @param index the slot of the first input glyph
     * @param records the lookup records of the matched rule
     * @param stopAtFirstChange whether to return as soon as one nested lookup changed something
     * @return true if any nested lookup changed the collection
     * @throws IOException if a nested lookup cannot be applied
     */
    public static <T extends GlyphSequence> boolean applyLookupRecords(LookupContext<T> context,
            int index, SequenceLookupRecord[] records, boolean stopAtFirstChange)
            throws IOException
    {
        GlyphSequence glyphs = context.getGlyphs();
        boolean hasChanged = false;
        int shift = 0;
        for (SequenceLookupRecord record : records)
        {
            int position = index + record.getSequenceIndex() + shift;
            if (position < 0 || position >= glyphs.size())
            {
                continue;
            }
            int sizeBefore = glyphs.size();
            boolean applied = context.applyNestedLookup(record.getLookupListIndex(), position);
            shift += glyphs.size() - sizeBefore;
            if (applied)
            {
                hasChanged = true;
                if (stopAtFirstChange)
                {
                    return true;
                }
            }
        }
        return hasChanged;
    }

    /**
     * Checks the lookup list indices of lookup records.
     */
    static void validate(SequenceLookupRecord[] records, int lookupCount, String owner)
            throws InvalidFontFileException
    {
        for (SequenceLookupRecord record : records)
        {
            if (record.getLookupListIndex() >= lookupCount)
            {
                throw new InvalidFontFileException(owner
                        + " refers to lookup " + record.getLookupListIndex()
                        + ", the lookup list has " + lookupCount + " entries");
            }
        }
    }

    private static int glyphAt(GlyphSequence glyphs, int index)
    {
        if (index < 0 || index >= glyphs.size())
        {
            return -1;
        }
        return glyphs.getGlyphId(index);
    }
}
