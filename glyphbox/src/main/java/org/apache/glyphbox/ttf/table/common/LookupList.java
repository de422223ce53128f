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

import java.util.Collections;
import java.util.List;

import org.apache.glyphbox.ttf.InvalidFontFileException;

/**
 * This class models the
 * <a href="https://docs.microsoft.com/en-us/typography/opentype/spec/chapter2#lookup-list-table">Lookup List table</a>
 * in the Open Type layout common tables. Features and contextual rules refer to lookups by their
 * index in this list.
 *
 * @param <T> the kind of glyph collection the lookups rewrite
 */
public class LookupList<T extends GlyphSequence>
{
    private final List<LookupTable<T>> lookupTables;

    public LookupList(List<LookupTable<T>> lookupTables)
    {
        this.lookupTables = Collections.unmodifiableList(lookupTables);
    }

    /**
     * @param lookupListIndex the index of the lookup
     * @return the lookup
     * @throws InvalidFontFileException if the index lies outside of the list
     */
    public LookupTable<T> getLookup(int lookupListIndex) throws InvalidFontFileException
    {
        if (lookupListIndex < 0 || lookupListIndex >= lookupTables.size())
        {
            throw new InvalidFontFileException("Lookup list index " + lookupListIndex
                    + " is out of range, the lookup list has " + lookupTables.size() + " entries");
        }
        return lookupTables.get(lookupListIndex);
    }

    public List<LookupTable<T>> getLookupTables()
    {
        return lookupTables;
    }

    public int size()
    {
        return lookupTables.size();
    }

    /**
     * Checks that the features and all nested lookup records only refer to existing lookups.
     *
     * @param featureList the feature list of the same table
     * @throws InvalidFontFileException if an index is out of range
     */
    public void validateLookupIndices(FeatureList featureList) throws InvalidFontFileException
    {
        for (FeatureListTable featureListTable : featureList.getFeatureListTables())
        {
            for (int lookupListIndex : featureListTable.getLookupListIndices())
            {
                if (lookupListIndex >= lookupTables.size())
                {
                    throw new InvalidFontFileException("Feature '"
                            + featureListTable.getFeatureTag() + "' refers to lookup "
                            + lookupListIndex + ", the lookup list has " + lookupTables.size()
                            + " entries");
                }
            }
        }
        for (LookupTable<T> lookupTable : lookupTables)
        {
            for (LookupSubTable<T> subTable : lookupTable.getSubTables())
            {
                subTable.validateLookupIndices(lookupTables.size());
            }
        }
    }
}
