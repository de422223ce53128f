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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.glyphbox.ttf.TTFDataStream;

/**
 * This class models the
 * <a href="https://docs.microsoft.com/en-us/typography/opentype/spec/chapter2#feature-list-table">Feature List table</a>
 * in the Open Type layout common tables. The records are sorted alphabetically by tag, which says
 * nothing about the order features are applied in: lookups are applied in lookup list order.
 */
public class FeatureList
{
    private static final Log LOG = LogFactory.getLog(FeatureList.class);

    private final List<FeatureListTable> featureListTables;

    public FeatureList(List<FeatureListTable> featureListTables)
    {
        this.featureListTables = Collections.unmodifiableList(featureListTables);
    }

    /**
     * Reads the feature list. The feature tables are read after all records, so that the records
     * are read in one sequential pass.
     *
     * @param data the font data
     * @param offset absolute offset of the feature list
     * @return the feature list
     * @throws IOException if the data is truncated
     */
    public static FeatureList read(TTFDataStream data, long offset) throws IOException
    {
        data.seek(offset);
        int featureCount = data.readUnsignedShort();
        data.requireAvailable(6L * featureCount, "FeatureRecord[" + featureCount + "]");
        String[] featureTags = new String[featureCount];
        int[] featureOffsets = new int[featureCount];
        String prevFeatureTag = "";
        for (int i = 0; i < featureCount; i++)
        {
            String featureTag = data.readTag();
            if (i > 0 && featureTag.compareTo(prevFeatureTag) < 0)
            {
                // catch corrupt file
                // https://docs.microsoft.com/en-us/typography/opentype/spec/chapter2#flTbl
                if (featureTag.matches("\\w{4}") && prevFeatureTag.matches("\\w{4}"))
                {
                    // some fonts aren't sorted but aren't corrupt either, so we assume that only
                    // strings with trash characters indicate real corruption
                    LOG.debug("FeatureRecord array not alphabetically sorted by FeatureTag: " +
                               featureTag + " < " + prevFeatureTag);
                }
                else
                {
                    LOG.warn("FeatureRecord array not alphabetically sorted by FeatureTag: " +
                               featureTag + " < " + prevFeatureTag);
                    return new FeatureList(Collections.<FeatureListTable>emptyList());
                }
            }
            featureOffsets[i] = data.readOffset16();
            featureTags[i] = featureTag;
            prevFeatureTag = featureTag;
        }
        FeatureListTable[] featureListTables = new FeatureListTable[featureCount];
        for (int i = 0; i < featureCount; i++)
        {
            featureListTables[i] = FeatureListTable.read(featureTags[i], data,
                    offset + featureOffsets[i]);
        }
        return new FeatureList(Arrays.asList(featureListTables));
    }

    public List<FeatureListTable> getFeatureListTables()
    {
        return featureListTables;
    }

    /**
     * @param featureIndex a feature index as used by LangSys tables
     * @return the feature, or {@code null} if the index is out of range
     */
    public FeatureListTable getFeature(int featureIndex)
    {
        if (featureIndex < 0 || featureIndex >= featureListTables.size())
        {
            return null;
        }
        return featureListTables.get(featureIndex);
    }

    public int size()
    {
        return featureListTables.size();
    }
}
