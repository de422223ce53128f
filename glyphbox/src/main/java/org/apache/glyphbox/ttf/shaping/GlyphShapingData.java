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

package org.apache.glyphbox.ttf.shaping;

import java.util.Arrays;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * One slot of a glyph collection: the current glyph id, the code point it was created from, the
 * feature tags enabled for it and, for ligatures, the glyph ids of its components.
 */
public class GlyphShapingData
{
    private int glyphId;
    private final int codePoint;
    private final Set<String> features;
    private int[] componentGlyphIds;

    public GlyphShapingData(int glyphId, int codePoint)
    {
        this.glyphId = glyphId;
        this.codePoint = codePoint;
        this.features = new TreeSet<String>();
        this.componentGlyphIds = new int[] { glyphId };
    }

    /**
     * Copy constructor, used when a substitution creates new slots from an existing one.
     *
     * @param source the slot to copy
     * @param glyphId the glyph id of the new slot
     */
    public GlyphShapingData(GlyphShapingData source, int glyphId)
    {
        this.glyphId = glyphId;
        this.codePoint = source.codePoint;
        this.features = new TreeSet<String>(source.features);
        this.componentGlyphIds = new int[] { glyphId };
    }

    public int getGlyphId()
    {
        return glyphId;
    }

    void setGlyphId(int glyphId)
    {
        this.glyphId = glyphId;
    }

    public int getCodePoint()
    {
        return codePoint;
    }

    public Set<String> getFeatures()
    {
        return Collections.unmodifiableSet(features);
    }

    public boolean hasFeature(String featureTag)
    {
        return features.contains(featureTag);
    }

    void enableFeature(String featureTag)
    {
        features.add(featureTag);
    }

    void disableFeature(String featureTag)
    {
        features.remove(featureTag);
    }

    /**
     * @return the glyph ids this slot was formed from; a single entry unless the slot is a
     * ligature
     */
    public int[] getComponentGlyphIds()
    {
        return componentGlyphIds.clone();
    }

    void setComponentGlyphIds(int[] componentGlyphIds)
    {
        this.componentGlyphIds = componentGlyphIds;
    }

    public int getComponentCount()
    {
        return componentGlyphIds.length;
    }

    public boolean isLigature()
    {
        return componentGlyphIds.length > 1;
    }

    @Override
    public String toString()
    {
        return String.format("GlyphShapingData[glyphId=%d,codePoint=U+%04X,features=%s,"
                + "components=%s]", glyphId, codePoint, features,
                Arrays.toString(componentGlyphIds));
    }
}
