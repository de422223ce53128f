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

import org.apache.glyphbox.ttf.GlyphDefinitionTable;
import org.apache.glyphbox.ttf.InvalidFontFileException;

/**
 * The state of one pass of a lookup over a glyph collection. Contextual subtables use it to
 * invoke the lookups named in their lookup records; the nesting depth of those invocations is
 * bounded because nothing in the font format prevents lookups from referring to each other in a
 * cycle.
 * <p>
 * A context belongs to a single shaping request and is not thread-safe.
 *
 * @param <T> the kind of glyph collection
 */
public class LookupContext<T extends GlyphSequence>
{
    public static final int DEFAULT_MAX_NESTING_LEVEL = 32;

    private final LookupList<T> lookupList;
    private final T glyphs;
    private final GlyphDefinitionTable glyphDefinitionTable;
    private int maxNestingLevel = DEFAULT_MAX_NESTING_LEVEL;
    private int alternateIndex = 0;
    private int nestingLevel = 0;

    /**
     * @param lookupList the lookups nested lookup records refer to
     * @param glyphs the glyph collection being rewritten
     * @param glyphDefinitionTable the GDEF table of the font, may be {@code null}
     */
    public LookupContext(LookupList<T> lookupList, T glyphs,
            GlyphDefinitionTable glyphDefinitionTable)
    {
        this.lookupList = lookupList;
        this.glyphs = glyphs;
        this.glyphDefinitionTable = glyphDefinitionTable;
    }

    /**
     * Applies a nested lookup at the given slot.
     *
     * @param lookupListIndex index of the lookup in the lookup list
     * @param index the slot index
     * @return true if the lookup changed the collection
     * @throws IOException if the index is invalid or the nesting limit is exceeded
     */
    public boolean applyNestedLookup(int lookupListIndex, int index) throws IOException
    {
        if (nestingLevel >= maxNestingLevel)
        {
            throw new InvalidFontFileException("Nested lookups exceed the maximum depth of "
                    + maxNestingLevel + " at lookup " + lookupListIndex
                    + ", the font probably contains a lookup cycle");
        }
        LookupTable<T> lookup = lookupList.getLookup(lookupListIndex);
        nestingLevel++;
        try
        {
            return lookup.apply(this, index);
        }
        finally
        {
            nestingLevel--;
        }
    }

    /**
     * Tells whether a glyph is a mark according to the GDEF glyph class definition.
     *
     * @param gid the glyph id
     * @return true for mark glyphs, false for other glyphs or when there is no GDEF table
     */
    public boolean isMark(int gid)
    {
        return glyphDefinitionTable != null && glyphDefinitionTable.isMarkGlyph(gid);
    }

    public boolean hasGlyphClassDefinitions()
    {
        return glyphDefinitionTable != null && glyphDefinitionTable.hasGlyphClassDefinitions();
    }

    public T getGlyphs()
    {
        return glyphs;
    }

    public LookupList<T> getLookupList()
    {
        return lookupList;
    }

    public int getNestingLevel()
    {
        return nestingLevel;
    }

    public int getMaxNestingLevel()
    {
        return maxNestingLevel;
    }

    public void setMaxNestingLevel(int maxNestingLevel)
    {
        if (maxNestingLevel < 1)
        {
            throw new IllegalArgumentException("maxNestingLevel must be positive: "
                    + maxNestingLevel);
        }
        this.maxNestingLevel = maxNestingLevel;
    }

    /**
     * @return the alternate chosen by alternate substitution lookups
     */
    public int getAlternateIndex()
    {
        return alternateIndex;
    }

    public void setAlternateIndex(int alternateIndex)
    {
        this.alternateIndex = alternateIndex;
    }
}
