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
import java.util.Collections;
import java.util.List;

/**
 * This class models the
 * <a href="https://docs.microsoft.com/en-us/typography/opentype/spec/chapter2#lookup-table">Lookup Table</a>
 * in the Open Type layout common tables: an ordered list of subtables of one lookup type.
 *
 * @param <T> the kind of glyph collection the subtables rewrite
 */
public class LookupTable<T extends GlyphSequence>
{
    public static final int FLAG_RIGHT_TO_LEFT = 0x0001;
    public static final int FLAG_IGNORE_BASE_GLYPHS = 0x0002;
    public static final int FLAG_IGNORE_LIGATURES = 0x0004;
    public static final int FLAG_IGNORE_MARKS = 0x0008;
    public static final int FLAG_USE_MARK_FILTERING_SET = 0x0010;

    private final int lookupType;
    private final int lookupFlag;
    private final int markFilteringSet;
    private final List<LookupSubTable<T>> subTables;

    public LookupTable(int lookupType, int lookupFlag, int markFilteringSet,
            List<LookupSubTable<T>> subTables)
    {
        this.lookupType = lookupType;
        this.lookupFlag = lookupFlag;
        this.markFilteringSet = markFilteringSet;
        this.subTables = Collections.unmodifiableList(subTables);
    }

    /**
     * Tries the subtables in order; the first one that applies wins.
     *
     * @param context the context of the lookup application
     * @param index the slot index
     * @return true if a subtable was applied
     * @throws IOException if a nested lookup cannot be applied
     */
    public boolean apply(LookupContext<T> context, int index) throws IOException
    {
        for (LookupSubTable<T> subTable : subTables)
        {
            if (subTable.apply(context, index))
            {
                return true;
            }
        }
        return false;
    }

    public int getLookupType()
    {
        return lookupType;
    }

    public int getLookupFlag()
    {
        return lookupFlag;
    }

    public int getMarkFilteringSet()
    {
        return markFilteringSet;
    }

    public List<LookupSubTable<T>> getSubTables()
    {
        return subTables;
    }

    @Override
    public String toString()
    {
        return String.format("LookupTable[lookupType=%d,lookupFlag=%d,markFilteringSet=%d]",
                lookupType, lookupFlag, markFilteringSet);
    }
}
