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
 * Sequence context format 3: a single rule given as one coverage table per input position. All
 * lookup records are applied.
 *
 * @param <T> the kind of glyph collection
 */
public class SequenceContextFormat3SubTable<T extends GlyphSequence> extends LookupSubTable<T>
{
    private final CoverageTable[] coverageTables;
    private final SequenceLookupRecord[] seqLookupRecords;

    public SequenceContextFormat3SubTable(int format, CoverageTable[] coverageTables,
            SequenceLookupRecord[] seqLookupRecords)
    {
        super(format, coverageTables.length > 0 ? coverageTables[0] : null);
        this.coverageTables = coverageTables;
        this.seqLookupRecords = seqLookupRecords;
    }

    @Override
    public boolean apply(LookupContext<T> context, int index) throws IOException
    {
        T glyphs = context.getGlyphs();
        if (coverageTables.length == 0
                || !SequenceMatcher.matchCoverageSequence(glyphs, index, coverageTables))
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
        return String.format("SequenceContextFormat3SubTable[glyphCount=%d,seqLookupCount=%d]",
                coverageTables.length, seqLookupRecords.length);
    }
}
