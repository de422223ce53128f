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


package org.apache.glyphbox.ttf;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds a GSUB or GPOS table with the scripts 'DFLT' and 'latn', whose default language systems
 * list every feature. Features must be added in tag order, as fonts store them.
 */
public class LayoutTableFixture
{
    /**
     * Writes one subtable at the current position of the builder; offsets inside the subtable are
     * relative to that position.
     */
    public interface SubTableWriter
    {
        void write(FontDataBuilder builder);
    }

    private final List<String> featureTags = new ArrayList<String>();
    private final List<int[]> featureLookups = new ArrayList<int[]>();
    private final List<Integer> lookupTypes = new ArrayList<Integer>();
    private final List<SubTableWriter> subTableWriters = new ArrayList<SubTableWriter>();
    private int requiredFeatureIndex = 0xFFFF;

    public LayoutTableFixture feature(String featureTag, int... lookupListIndices)
    {
        featureTags.add(featureTag);
        featureLookups.add(lookupListIndices);
        return this;
    }

    public LayoutTableFixture requiredFeature(int featureIndex)
    {
        requiredFeatureIndex = featureIndex;
        return this;
    }

    public LayoutTableFixture lookup(int lookupType, SubTableWriter writer)
    {
        lookupTypes.add(lookupType);
        subTableWriters.add(writer);
        return this;
    }

    public byte[] build()
    {
        FontDataBuilder b = new FontDataBuilder();
        b.uint16(1, 0);
        int scriptList = b.offset16();
        int featureList = b.offset16();
        int lookupList = b.offset16();

        b.patchOffset16(scriptList, 0);
        int scriptListStart = b.position();
        b.uint16(2);
        b.tag(OpenTypeScript.TAG_DEFAULT);
        int dflt = b.offset16();
        b.tag("latn");
        int latn = b.offset16();
        for (int script : new int[] { dflt, latn })
        {
            b.patchOffset16(script, scriptListStart);
            int scriptStart = b.position();
            int defaultLangSys = b.offset16();
            b.uint16(0);
            b.patchOffset16(defaultLangSys, scriptStart);
            b.uint16(0, requiredFeatureIndex, featureTags.size());
            for (int i = 0; i < featureTags.size(); i++)
            {
                b.uint16(i);
            }
        }

        b.patchOffset16(featureList, 0);
        int featureListStart = b.position();
        b.uint16(featureTags.size());
        int[] features = new int[featureTags.size()];
        for (int i = 0; i < features.length; i++)
        {
            b.tag(featureTags.get(i));
            features[i] = b.offset16();
        }
        for (int i = 0; i < features.length; i++)
        {
            b.patchOffset16(features[i], featureListStart);
            b.uint16(0, featureLookups.get(i).length);
            b.uint16(featureLookups.get(i));
        }

        b.patchOffset16(lookupList, 0);
        int lookupListStart = b.position();
        b.uint16(lookupTypes.size());
        int[] lookups = new int[lookupTypes.size()];
        for (int i = 0; i < lookups.length; i++)
        {
            lookups[i] = b.offset16();
        }
        for (int i = 0; i < lookups.length; i++)
        {
            b.patchOffset16(lookups[i], lookupListStart);
            int lookupStart = b.position();
            b.uint16(lookupTypes.get(i), 0, 1);
            int subTable = b.offset16();
            b.patchOffset16(subTable, lookupStart);
            subTableWriters.get(i).write(b);
        }
        return b.toByteArray();
    }

    public GlyphSubstitutionTable readGsub() throws IOException
    {
        GlyphSubstitutionTable gsub = new GlyphSubstitutionTable();
        gsub.setOffset(0);
        gsub.read(new MemoryTTFDataStream(build()));
        return gsub;
    }

    public GlyphPositioningTable readGpos() throws IOException
    {
        GlyphPositioningTable gpos = new GlyphPositioningTable();
        gpos.setOffset(0);
        gpos.read(new MemoryTTFDataStream(build()));
        return gpos;
    }
}
