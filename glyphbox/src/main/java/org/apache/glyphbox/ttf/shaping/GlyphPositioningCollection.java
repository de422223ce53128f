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

import java.util.Set;

/**
 * The glyph run adjusted by glyph positioning: per slot advance and placement offset, in font
 * design units. Positioning never changes the number of slots.
 * <p>
 * Adjustments are additive unless a method says otherwise. Instances are created per shaping
 * request and are not thread-safe.
 */
public class GlyphPositioningCollection implements ShapingGlyphSequence
{
    private final GlyphShapingData[] glyphs;
    private final int[] xAdvances;
    private final int[] yAdvances;
    private final int[] xOffsets;
    private final int[] yOffsets;

    /**
     * Creates the collection from the result of glyph substitution. Each slot starts with the
     * advance width of its glyph and no offset.
     *
     * @param substitutions the substituted glyphs, including their assigned features
     * @param metrics the glyph metrics of the font
     */
    public GlyphPositioningCollection(GlyphSubstitutionCollection substitutions,
            GlyphMetrics metrics)
    {
        int size = substitutions.size();
        glyphs = new GlyphShapingData[size];
        xAdvances = new int[size];
        yAdvances = new int[size];
        xOffsets = new int[size];
        yOffsets = new int[size];
        for (int i = 0; i < size; i++)
        {
            GlyphShapingData data = substitutions.getGlyphShapingData(i);
            glyphs[i] = data;
            xAdvances[i] = metrics.getAdvanceWidth(data.getGlyphId());
        }
    }

    @Override
    public int size()
    {
        return glyphs.length;
    }

    @Override
    public int getGlyphId(int index)
    {
        return glyphs[index].getGlyphId();
    }

    @Override
    public GlyphShapingData getGlyphShapingData(int index)
    {
        return glyphs[index];
    }

    @Override
    public boolean hasFeature(int index, String featureTag)
    {
        return glyphs[index].hasFeature(featureTag);
    }

    public Set<String> getFeatures(int index)
    {
        return glyphs[index].getFeatures();
    }

    public int getXAdvance(int index)
    {
        return xAdvances[index];
    }

    public int getYAdvance(int index)
    {
        return yAdvances[index];
    }

    public int getXOffset(int index)
    {
        return xOffsets[index];
    }

    public int getYOffset(int index)
    {
        return yOffsets[index];
    }

    public void addAdvance(int index, int dx, int dy)
    {
        xAdvances[index] += dx;
        yAdvances[index] += dy;
    }

    /**
     * Overwrites the advance of a slot.
     */
    public void setAdvance(int index, int x, int y)
    {
        xAdvances[index] = x;
        yAdvances[index] = y;
    }

    public void addOffset(int index, int dx, int dy)
    {
        xOffsets[index] += dx;
        yOffsets[index] += dy;
    }

    /**
     * Overwrites the offset of a slot, used by mark attachment which places a mark absolutely
     * relative to its base.
     */
    public void setOffset(int index, int x, int y)
    {
        xOffsets[index] = x;
        yOffsets[index] = y;
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder("GlyphPositioningCollection[");
        for (int i = 0; i < glyphs.length; i++)
        {
            if (i > 0)
            {
                sb.append(", ");
            }
            sb.append(String.format("%d:adv=(%d,%d),off=(%d,%d)", glyphs[i].getGlyphId(),
                    xAdvances[i], yAdvances[i], xOffsets[i], yOffsets[i]));
        }
        return sb.append(']').toString();
    }
}
