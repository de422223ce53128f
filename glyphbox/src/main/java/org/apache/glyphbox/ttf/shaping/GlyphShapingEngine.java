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

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.glyphbox.ttf.AdvancedTypographicTable;
import org.apache.glyphbox.ttf.GlyphDefinitionTable;
import org.apache.glyphbox.ttf.GlyphPositioningTable;
import org.apache.glyphbox.ttf.GlyphSubstitutionTable;
import org.apache.glyphbox.ttf.OpenTypeScript;
import org.apache.glyphbox.ttf.table.common.FeatureListTable;
import org.apache.glyphbox.ttf.table.common.LookupContext;
import org.apache.glyphbox.ttf.table.common.LookupTable;

/**
 * Applies the GSUB and GPOS lookups of a font to a run of glyphs of one script.
 * <p>
 * A shaper first assigns feature tags to the slots. The features of the script and language are
 * then resolved to lookups, which are applied in lookup list order. Each lookup walks the slots
 * from left to right, or from right to left for reverse chaining substitutions, and applies at
 * every slot that carries one of the features the lookup belongs to; the first matching subtable
 * wins.
 * <p>
 * The tables are only read; an engine may be shared, but its settings are not synchronized.
 */
public class GlyphShapingEngine
{
    private static final Log LOG = LogFactory.getLog(GlyphShapingEngine.class);

    /**
     * System property overriding the default ceiling for nested lookups.
     */
    public static final String MAX_NESTING_LEVEL_PROPERTY =
            "org.apache.glyphbox.shaping.maxNestingLevel";

    private final GlyphSubstitutionTable gsub;
    private final GlyphPositioningTable gpos;
    private final GlyphDefinitionTable gdef;
    private int maxNestingLevel = getDefaultMaxNestingLevel();
    private int alternateIndex = 0;

    /**
     * @param gsub the GSUB table, may be {@code null}
     * @param gpos the GPOS table, may be {@code null}
     * @param gdef the GDEF table, may be {@code null}
     */
    public GlyphShapingEngine(GlyphSubstitutionTable gsub, GlyphPositioningTable gpos,
            GlyphDefinitionTable gdef)
    {
        this.gsub = gsub;
        this.gpos = gpos;
        this.gdef = gdef;
    }

    private static int getDefaultMaxNestingLevel()
    {
        String value = System.getProperty(MAX_NESTING_LEVEL_PROPERTY);
        if (value == null)
        {
            return LookupContext.DEFAULT_MAX_NESTING_LEVEL;
        }
        try
        {
            int level = Integer.parseInt(value.trim());
            if (level > 0)
            {
                return level;
            }
        }
        catch (NumberFormatException e)
        {
            LOG.debug("Couldn't parse " + MAX_NESTING_LEVEL_PROPERTY + " value '" + value + "'", e);
        }
        LOG.warn("Ignoring invalid " + MAX_NESTING_LEVEL_PROPERTY + " value '" + value
                + "', using " + LookupContext.DEFAULT_MAX_NESTING_LEVEL);
        return LookupContext.DEFAULT_MAX_NESTING_LEVEL;
    }

    /**
     * Assigns features to the slots of the collection and applies the GSUB lookups.
     *
     * @param collection the glyphs to substitute, modified in place
     * @param scriptTags candidate OpenType script tags in order of preference; 'DFLT' if none
     * @param languageTag the OpenType language system tag, or {@code null} for the default
     * @param enabledFeatures the features to apply, or {@code null} for the shaper's defaults
     * @throws IOException if a lookup of the font is invalid
     */
    public void substitute(GlyphSubstitutionCollection collection, String[] scriptTags,
            String languageTag, List<String> enabledFeatures) throws IOException
    {
        scriptTags = orDefaultScript(scriptTags);
        BaseShaper shaper = ShaperFactory.getShaper(scriptTags[0], enabledFeatures);
        shaper.assignFeatures(collection, 0, collection.size());
        if (gsub == null)
        {
            return;
        }
        applyLookups(gsub, collection, scriptTags, languageTag, shaper.getFeatureTags(),
                GlyphSubstitutionTable.LOOKUP_TYPE_REVERSE_CHAINED_SINGLE);
    }

    /**
     * Applies the GPOS lookups. The features of the slots are those assigned during substitution.
     *
     * @param positions the glyph positions, modified in place
     * @param scriptTags candidate OpenType script tags in order of preference; 'DFLT' if none
     * @param languageTag the OpenType language system tag, or {@code null} for the default
     * @param enabledFeatures the features to apply, or {@code null} for the shaper's defaults
     * @throws IOException if a lookup of the font is invalid
     */
    public void position(GlyphPositioningCollection positions, String[] scriptTags,
            String languageTag, List<String> enabledFeatures) throws IOException
    {
        if (gpos == null)
        {
            return;
        }
        scriptTags = orDefaultScript(scriptTags);
        BaseShaper shaper = ShaperFactory.getShaper(scriptTags[0], enabledFeatures);
        applyLookups(gpos, positions, scriptTags, languageTag, shaper.getFeatureTags(), -1);
    }

    /**
     * Substitutes and positions a run of glyphs.
     *
     * @param collection the glyphs to shape, modified in place by substitution
     * @param metrics the glyph metrics of the font
     * @param scriptTags candidate OpenType script tags in order of preference; 'DFLT' if none
     * @param languageTag the OpenType language system tag, or {@code null} for the default
     * @param enabledFeatures the features to apply, or {@code null} for the shaper's defaults
     * @return the positioned glyphs
     * @throws IOException if a lookup of the font is invalid
     */
    public GlyphPositioningCollection shape(GlyphSubstitutionCollection collection,
            GlyphMetrics metrics, String[] scriptTags, String languageTag,
            List<String> enabledFeatures) throws IOException
    {
        substitute(collection, scriptTags, languageTag, enabledFeatures);
        GlyphPositioningCollection positions = new GlyphPositioningCollection(collection, metrics);
        position(positions, scriptTags, languageTag, enabledFeatures);
        return positions;
    }

    /**
     * Shapes a run of glyphs, choosing the script from its first code point that has one.
     *
     * @param collection the glyphs to shape, with their code points
     * @param metrics the glyph metrics of the font
     * @return the positioned glyphs
     * @throws IOException if a lookup of the font is invalid
     */
    public GlyphPositioningCollection shape(GlyphSubstitutionCollection collection,
            GlyphMetrics metrics) throws IOException
    {
        return shape(collection, metrics, getScriptTags(collection), null, null);
    }

    private static String[] orDefaultScript(String[] scriptTags)
    {
        if (scriptTags == null || scriptTags.length == 0)
        {
            return new String[] { OpenTypeScript.TAG_DEFAULT };
        }
        return scriptTags;
    }

    private static String[] getScriptTags(GlyphSubstitutionCollection collection)
    {
        for (int i = 0; i < collection.size(); i++)
        {
            int codePoint = collection.getCodePoint(i);
            if (codePoint < 0 || !Character.isValidCodePoint(codePoint))
            {
                continue;
            }
            String[] tags = OpenTypeScript.getScriptTags(codePoint);
            if (!OpenTypeScript.TAG_DEFAULT.equals(tags[0])
                    && !OpenTypeScript.INHERITED.equals(tags[0]))
            {
                return tags;
            }
        }
        return new String[] { OpenTypeScript.TAG_DEFAULT };
    }

    private <T extends ShapingGlyphSequence> void applyLookups(AdvancedTypographicTable<T> table,
            T glyphs, String[] scriptTags, String languageTag, List<String> featureTags,
            int reverseLookupType) throws IOException
    {
        List<FeatureListTable> features = table.getFeatures(scriptTags, languageTag,
                featureTags);
        for (String requiredTag : table.getRequiredFeatureTags(scriptTags, languageTag))
        {
            for (int i = 0; i < glyphs.size(); i++)
            {
                glyphs.getGlyphShapingData(i).enableFeature(requiredTag);
            }
        }

        // lookups apply in lookup list order, whatever the order of the features
        Map<Integer, Set<String>> lookupFeatures = new TreeMap<Integer, Set<String>>();
        for (FeatureListTable feature : features)
        {
            for (int lookupListIndex : feature.getLookupListIndices())
            {
                Set<String> tags = lookupFeatures.get(lookupListIndex);
                if (tags == null)
                {
                    tags = new TreeSet<String>();
                    lookupFeatures.put(lookupListIndex, tags);
                }
                tags.add(feature.getFeatureTag());
            }
        }

        LookupContext<T> context = new LookupContext<T>(table.getLookupList(), glyphs, gdef);
        context.setMaxNestingLevel(maxNestingLevel);
        context.setAlternateIndex(alternateIndex);
        for (Map.Entry<Integer, Set<String>> entry : lookupFeatures.entrySet())
        {
            LookupTable<T> lookup = table.getLookupList().getLookup(entry.getKey());
            Set<String> tags = entry.getValue();
            if (lookup.getSubTables().isEmpty())
            {
                LOG.debug("Skipping " + table.getTag() + " lookup " + entry.getKey()
                        + " without supported subtables");
                continue;
            }
            if (lookup.getLookupType() == reverseLookupType)
            {
                for (int i = glyphs.size() - 1; i >= 0; i--)
                {
                    if (hasAnyFeature(glyphs, i, tags))
                    {
                        lookup.apply(context, i);
                    }
                }
            }
            else
            {
                int i = 0;
                while (i < glyphs.size())
                {
                    if (hasAnyFeature(glyphs, i, tags))
                    {
                        int size = glyphs.size();
                        int deleted = getDeletedSlotCount(glyphs);
                        if (lookup.apply(context, i))
                        {
                            // step over the slots produced; a deletion pulls the next glyph
                            // into slot i, which is then visited without moving
                            int produced = 1 + Math.max(0, glyphs.size() - size)
                                    - (getDeletedSlotCount(glyphs) - deleted);
                            if (produced < 1 && glyphs.size() >= size)
                            {
                                produced = 1;
                            }
                            i += Math.max(0, produced);
                            continue;
                        }
                    }
                    i++;
                }
            }
        }
    }

    private static int getDeletedSlotCount(ShapingGlyphSequence glyphs)
    {
        if (glyphs instanceof GlyphSubstitutionCollection)
        {
            return ((GlyphSubstitutionCollection) glyphs).getDeletedSlotCount();
        }
        return 0;
    }

    private static boolean hasAnyFeature(ShapingGlyphSequence glyphs, int index, Set<String> tags)
    {
        for (String tag : tags)
        {
            if (glyphs.hasFeature(index, tag))
            {
                return true;
            }
        }
        return false;
    }

    public int getMaxNestingLevel()
    {
        return maxNestingLevel;
    }

    /**
     * Sets the maximum depth of nested lookups invoked by contextual lookups. Shaping fails with
     * an {@link org.apache.glyphbox.ttf.InvalidFontFileException} when a font exceeds it.
     *
     * @param maxNestingLevel the ceiling, at least 1
     */
    public void setMaxNestingLevel(int maxNestingLevel)
    {
        if (maxNestingLevel < 1)
        {
            throw new IllegalArgumentException("maxNestingLevel must be positive: "
                    + maxNestingLevel);
        }
        this.maxNestingLevel = maxNestingLevel;
    }

    public int getAlternateIndex()
    {
        return alternateIndex;
    }

    /**
     * Sets the alternate chosen by alternate substitution lookups; it is clamped to the
     * alternates a glyph has.
     */
    public void setAlternateIndex(int alternateIndex)
    {
        this.alternateIndex = alternateIndex;
    }
}
