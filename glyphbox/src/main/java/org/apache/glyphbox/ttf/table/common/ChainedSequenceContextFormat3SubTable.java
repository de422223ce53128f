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
 * Chained sequence context format 3: a single rule given as coverage tables for every backtrack,
 * input and lookahead position. All lookup records are applied.
 *
 * @param <T> the kind of glyph collection
 */
public class ChainedSequenceContextFormat3SubTable<T extends GlyphSequence>
        extends LookupSubTable<T>
{
    private final CoverageTable[] backtrackCoverageTables;
    private final CoverageTable[] inputCoverageTables;
    private final CoverageTable[] lookaheadCoverageTables;
    private final SequenceLookupRecord[] seqLookupRecords;

    public ChainedSequenceContextFormat3SubTable(int format,
            CoverageTable[] backtrackCoverageTables, CoverageTable[] inputCoverageTables,
            CoverageTable[] lookaheadCoverageTables, SequenceLookupRecord[] seqLookupRecords)
    {
        super(format, inputCoverageTables.length > 0 ? inputCoverageTables[0] : null);
        this.backtrackCoverageTables = backtrackCoverageTables;
        this.inputCoverageTables = inputCoverageTables;
        this.lookaheadCoverageTables = lookaheadCoverageTables;
        this.seqLookupRecords = seqLookupRecords;
    }

    @Override
    public boolean apply(LookupContext<T> context, int index) throws IOException
    {
        T glyphs = context.getGlyphs();
        if (inputCoverageTables.length == 0)
        {
            return false;
        }
        if (!SequenceMatcher.matchCoverageSequence(glyphs, index, inputCoverageTables)
                || !SequenceMatcher.matchBacktrackCoverageSequence(glyphs, index,
                        backtrackCoverageTables)
                || !SequenceMatcher.matchCoverageSequence(glyphs,
                        index + inputCoverageTables.length, lookaheadCoverageTables))
        {
            return false;
        }
        return SequenceMatcher.applyLookupRecords(context, index, seqLookupRecords, false);
    }

    @Override
    public void validateLookupIndices(int lookupCount) throws InvalidFontFileException
    {
        SequenceMatcher.validate(seqLookupRecords, lookupCount, toString());
    }

    @Override
    public String toString()
    {
        return String.format("ChainedSequenceContextFormat3SubTable[backtrackGlyphCount=%d,"
                + "inputGlyphCount=%d,lookaheadGlyphCount=%d]", backtrackCoverageTables.length,
                inputCoverageTables.length, lookaheadCoverageTables.length);
    }
}
