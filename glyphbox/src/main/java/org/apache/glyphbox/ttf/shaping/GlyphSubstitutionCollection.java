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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * The glyph run rewritten by glyph substitution. Substitutions replace a range of slots with new
 * slots, so the size changes: ligatures shrink the collection, multiple substitutions grow it.
 * Slot indices held across a call to {@link #replace(int, int, int...)} are stale afterwards.
 * <p>
 * Instances are created per shaping request and are not thread-safe.
 */
public class GlyphSubstitutionCollection implements ShapingGlyphSequence
{
    private final List<GlyphShapingData> glyphs = new ArrayList<GlyphShapingData>();
    private int deletedSlotCount;

    public GlyphSubstitutionCollection()
    {
    }

    /**
     * Creates a collection from glyph ids without code points.
     *
     * @param glyphIds the glyph ids
     */
    public GlyphSubstitutionCollection(int... glyphIds)
    {
        for (int glyphId : glyphIds)
        {
            addGlyph(glyphId, 0);
        }
    }

    /**
     * Appends a glyph.
     *
     * @param glyphId the glyph id from the cmap
     * @param codePoint the code point the glyph was mapped from
     */
    public void addGlyph(int glyphId, int codePoint)
    {
        glyphs.add(new GlyphShapingData(glyphId, codePoint));
    }

    @Override
    public int size()
    {
        return glyphs.size();
    }

    @Override
    public int getGlyphId(int index)
    {
        return glyphs.get(index).getGlyphId();
    }

    public void setGlyphId(int index, int glyphId)
    {
        GlyphShapingData data = glyphs.get(index);
        data.setGlyphId(glyphId);
        if (!data.isLigature())
        {
            data.setComponentGlyphIds(new int[] { glyphId });
        }
    }

    @Override
    public GlyphShapingData getGlyphShapingData(int index)
    {
        return glyphs.get(index);
    }

    public int getCodePoint(int index)
    {
        return glyphs.get(index).getCodePoint();
    }

    /**
     * Replaces the slots {@code [index, index + count)} with one new slot per glyph id. The new
     * slots inherit code point and features of the slot at {@code index}. Replacing several
     * slots with a single glyph forms a ligature, which remembers the glyph ids it was formed
     * from.
     *
     * @param index the first slot to replace
     * @param count the number of slots to replace
     * @param glyphIds the glyph ids of the new slots; may be empty to delete slots
     */
    public void replace(int index, int count, int... glyphIds)
    {
        if (index < 0 || count < 1 || index + count > glyphs.size())
        {
            throw new IndexOutOfBoundsException("cannot replace " + count + " slots at "
                    + index + ", size is " + glyphs.size());
        }
        GlyphShapingData first = glyphs.get(index);
        if (count == 1 && glyphIds.length == 1)
        {
            setGlyphId(index, glyphIds[0]);
            return;
        }
        List<GlyphShapingData> replaced = glyphs.subList(index, index + count);
        if (glyphIds.length == 0)
        {
            deletedSlotCount += count;
        }
        List<GlyphShapingData> replacements = new ArrayList<GlyphShapingData>(glyphIds.length);
        if (glyphIds.length == 1)
        {
            GlyphShapingData ligature = new GlyphShapingData(first, glyphIds[0]);
            List<Integer> components = new ArrayList<Integer>();
            for (GlyphShapingData component : replaced)
            {
                for (int gid : component.getComponentGlyphIds())
                {
                    components.add(gid);
                }
            }
            int[] componentGlyphIds = new int[components.size()];
            for (int i = 0; i < componentGlyphIds.length; i++)
            {
                componentGlyphIds[i] = components.get(i);
            }
            ligature.setComponentGlyphIds(componentGlyphIds);
            replacements.add(ligature);
        }
        else
        {
            for (int glyphId : glyphIds)
            {
                replacements.add(new GlyphShapingData(first, glyphId));
            }
        }
        replaced.clear();
        glyphs.addAll(index, replacements);
    }

    /**
     * @return the number of slots deleted by {@link #replace(int, int, int...)} with no glyph
     * ids, since this collection was created
     */
    public int getDeletedSlotCount()
    {
        return deletedSlotCount;
    }

    /**
     * Enables a feature for a range of slots.
     */
    public void enableFeature(int index, int count, String featureTag)
    {
        for (int i = index; i < index + count; i++)
        {
            glyphs.get(i).enableFeature(featureTag);
        }
    }

    public void disableFeature(int index, int count, String featureTag)
    {
        for (int i = index; i < index + count; i++)
        {
            glyphs.get(i).disableFeature(featureTag);
        }
    }

    @Override
    public boolean hasFeature(int index, String featureTag)
    {
        return glyphs.get(index).hasFeature(featureTag);
    }

    public Set<String> getFeatures(int index)
    {
        return glyphs.get(index).getFeatures();
    }

    public int[] getGlyphIds()
    {
        int[] glyphIds = new int[glyphs.size()];
        for (int i = 0; i < glyphIds.length; i++)
        {
            glyphIds[i] = glyphs.get(i).getGlyphId();
        }
        return glyphIds;
    }

    @Override
    public String toString()
    {
        return "GlyphSubstitutionCollection" + glyphs;
    }
}
