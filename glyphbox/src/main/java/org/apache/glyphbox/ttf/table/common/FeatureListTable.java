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

import org.apache.glyphbox.ttf.TTFDataStream;

/**
 * This class models the
 * <a href="https://docs.microsoft.com/en-us/typography/opentype/spec/chapter2#feature-table">Feature table</a>
 * in the Open Type layout common tables, together with the tag of its feature record.
 */
public class FeatureListTable
{
    private final String featureTag;
    private final int featureParamsOffset;
    private final int[] lookupListIndices;

    public FeatureListTable(String featureTag, int featureParamsOffset, int[] lookupListIndices)
    {
        this.featureTag = featureTag;
        this.featureParamsOffset = featureParamsOffset;
        this.lookupListIndices = lookupListIndices;
    }

    static FeatureListTable read(String featureTag, TTFDataStream data, long offset)
            throws IOException
    {
        data.seek(offset);
        // feature parameters are only defined for a handful of features (size, ssXX, cvXX)
        // and don't influence shaping
        int featureParamsOffset = data.readOffset16();
        int lookupIndexCount = data.readUnsignedShort();
        int[] lookupListIndices = data.readUnsignedShortArray(lookupIndexCount);
        return new FeatureListTable(featureTag, featureParamsOffset, lookupListIndices);
    }

    public String getFeatureTag()
    {
        return featureTag;
    }

    public int getFeatureParamsOffset()
    {
        return featureParamsOffset;
    }

    public int[] getLookupListIndices()
    {
        return lookupListIndices;
    }

    @Override
    public String toString()
    {
        return String.format("FeatureListTable[featureTag=%s,lookupListIndicesCount=%d]",
                featureTag, lookupListIndices.length);
    }
}
