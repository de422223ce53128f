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
 * This class models the
 * <a href="https://docs.microsoft.com/en-us/typography/opentype/spec/chapter2#lookup-table">Lookup Sub-Table</a>
 * in the Open Type layout common tables. Each concrete class implements one format of one lookup
 * type; the format is chosen once, when the subtable is read.
 *
 * @param <T> the kind of glyph collection this subtable rewrites
 */
public abstract class LookupSubTable<T extends GlyphSequence>
{
    private final int format;
    private final CoverageTable coverageTable;

    /**
     * @param format the substFormat or posFormat of this subtable
     * @param coverageTable the coverage of the first input glyph, or {@code null} for formats
     * that carry their coverages inline
     */
    protected LookupSubTable(int format, CoverageTable coverageTable)
    {
        this.format = format;
        this.coverageTable = coverageTable;
    }

    /**
     * Tries to apply this subtable at the given slot.
     *
     * @param context the context of the lookup application
     * @param index the slot index
     * @return true if the subtable matched and changed the collection
     * @throws IOException if nested lookups cannot be applied
     */
    public abstract boolean apply(LookupContext<T> context, int index) throws IOException;

    /**
     * Checks that every lookup list index referenced by this subtable lies inside the lookup list.
     * Subtables without nested lookups have nothing to check.
     *
     * @param lookupCount the number of lookups in the lookup list
     * @throws InvalidFontFileException if an index is out of range
     */
    public void validateLookupIndices(int lookupCount) throws InvalidFontFileException
    {
    }

    public int getFormat()
    {
        return format;
    }

    public CoverageTable getCoverageTable()
    {
        return coverageTable;
    }

    /**
     * Returns the coverage index of the glyph at the given slot, treating glyph 0 as uncovered.
     *
     * @param glyphs the glyphs
     * @param index the slot index
     * @return the coverage index or -1
     */
    protected int getCoverageIndex(GlyphSequence glyphs, int index)
    {
        if (index < 0 || index >= glyphs.size())
        {
            return -1;
        }
        int gid = glyphs.getGlyphId(index);
        if (gid == 0)
        {
            return -1;
        }
        return coverageTable.getCoverageIndex(gid);
    }
}
