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
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.glyphbox.ttf.table.common.FeatureList;
import org.apache.glyphbox.ttf.table.common.FeatureListTable;
import org.apache.glyphbox.ttf.table.common.GlyphSequence;
import org.apache.glyphbox.ttf.table.common.LangSysTable;
import org.apache.glyphbox.ttf.table.common.LookupList;
import org.apache.glyphbox.ttf.table.common.LookupSubTable;
import org.apache.glyphbox.ttf.table.common.LookupTable;
import org.apache.glyphbox.ttf.table.common.ScriptList;
import org.apache.glyphbox.ttf.table.common.ScriptTable;

/**
 * The parts shared by the 'GSUB' and 'GPOS' tables: header, script list, feature list and lookup
 * list, and the resolution of a script and language to the features that apply. Once read, the
 * table is immutable and may be shared between threads.
 *
 * @param <T> the kind of glyph collection the lookups of this table rewrite
 */
public abstract class AdvancedTypographicTable<T extends GlyphSequence> extends TTFTable
{
    private static final Log LOG = LogFactory.getLog(AdvancedTypographicTable.class);

    private ScriptList scriptList;
    private FeatureList featureList;
    private LookupList<T> lookupList;

    @Override
    public void read(TTFDataStream data) throws IOException
    {
        long start = getOffset();
        data.seek(start);
        int majorVersion = data.readUnsignedShort();
        int minorVersion = data.readUnsignedShort();
        if (majorVersion != 1)
        {
            throw InvalidFontFileException.invalidFormat("majorVersion", majorVersion, "'1'");
        }
        int scriptListOffset = data.readOffset16();
        int featureListOffset = data.readOffset16();
        int lookupListOffset = data.readOffset16();
        @SuppressWarnings("unused")
        long featureVariationsOffset = -1L;
        if (minorVersion == 1)
        {
            featureVariationsOffset = data.readOffset32();
        }

        scriptList = scriptListOffset == 0
                ? new ScriptList(new LinkedHashMap<String, ScriptTable>())
                : ScriptList.read(data, start + scriptListOffset);
        featureList = featureListOffset == 0
                ? new FeatureList(Collections.<FeatureListTable>emptyList())
                : FeatureList.read(data, start + featureListOffset);
        lookupList = lookupListOffset == 0
                ? new LookupList<T>(Collections.<LookupTable<T>>emptyList())
                : readLookupList(data, start + lookupListOffset);
        lookupList.validateLookupIndices(featureList);

        initialized = true;
    }

    LookupList<T> readLookupList(TTFDataStream data, long offset) throws IOException
    {
        data.seek(offset);
        int lookupCount = data.readUnsignedShort();
        int[] lookups = data.readUnsignedShortArray(lookupCount);
        List<LookupTable<T>> lookupTables = new ArrayList<LookupTable<T>>(lookupCount);
        for (int i = 0; i < lookupCount; i++)
        {
            lookupTables.add(readLookupTable(data, offset + lookups[i]));
        }
        return new LookupList<T>(lookupTables);
    }

    LookupTable<T> readLookupTable(TTFDataStream data, long offset) throws IOException
    {
        data.seek(offset);
        int lookupType = data.readUnsignedShort();
        int lookupFlag = data.readUnsignedShort();
        int subTableCount = data.readUnsignedShort();
        int[] subTableOffsets = data.readUnsignedShortArray(subTableCount);

        int markFilteringSet = 0;
        if ((lookupFlag & LookupTable.FLAG_USE_MARK_FILTERING_SET) != 0)
        {
            markFilteringSet = data.readUnsignedShort();
        }
        List<LookupSubTable<T>> subTables = new ArrayList<LookupSubTable<T>>(subTableCount);
        int resolvedLookupType = lookupType;
        for (int i = 0; i < subTableCount; i++)
        {
            long subTableOffset = offset + subTableOffsets[i];
            if (lookupType == getExtensionLookupType())
            {
                // the extension subtable wraps a subtable of another type with a 32-bit offset
                data.seek(subTableOffset);
                int extensionFormat = data.readUnsignedShort();
                if (extensionFormat != 1)
                {
                    throw InvalidFontFileException.invalidFormat("extensionFormat",
                            extensionFormat, "'1'");
                }
                resolvedLookupType = data.readUnsignedShort();
                long extensionOffset = data.readOffset32();
                subTableOffset += extensionOffset;
            }
            LookupSubTable<T> subTable = readLookupSubtable(data, subTableOffset,
                    resolvedLookupType);
            if (subTable != null)
            {
                subTables.add(subTable);
            }
        }
        return new LookupTable<T>(resolvedLookupType, lookupFlag, markFilteringSet, subTables);
    }

    /**
     * Reads one subtable of the given lookup type.
     *
     * @param data the font data
     * @param offset the absolute offset of the subtable
     * @param lookupType the lookup type, never the extension type
     * @return the subtable, or {@code null} if the lookup type is not supported
     * @throws IOException if the data is truncated or the format is invalid
     */
    protected abstract LookupSubTable<T> readLookupSubtable(TTFDataStream data, long offset,
            int lookupType) throws IOException;

    /**
     * @return the lookup type of extension subtables in this table
     */
    protected abstract int getExtensionLookupType();

    /**
     * Choose from one of the supplied OpenType script tags, depending on what the font supports.
     *
     * @param tags the candidate tags, in order of preference
     * @return The best OpenType script tag
     */
    String selectScriptTag(String[] tags)
    {
        if (tags.length == 1)
        {
            String tag = tags[0];
            if (OpenTypeScript.INHERITED.equals(tag)
                    || (OpenTypeScript.TAG_DEFAULT.equals(tag) && !scriptList.containsScript(tag)))
            {
                // We don't know what script this should be.
                if (scriptList.containsScript(OpenTypeScript.TAG_DEFAULT))
                {
                    return OpenTypeScript.TAG_DEFAULT;
                }
                if (!scriptList.getScriptTables().isEmpty())
                {
                    return scriptList.getScriptTables().keySet().iterator().next();
                }
                return tag;
            }
        }
        for (String tag : tags)
        {
            if (scriptList.containsScript(tag))
            {
                // Use the first recognized tag. We assume a single font only recognizes one version ("ver. 2")
                // of a single script, or if it recognizes more than one that it prefers the latest one.
                return tag;
            }
        }
        if (scriptList.containsScript(OpenTypeScript.TAG_DEFAULT))
        {
            return OpenTypeScript.TAG_DEFAULT;
        }
        return tags[0];
    }

    private Collection<LangSysTable> getLangSysTables(String scriptTag, String languageTag)
    {
        Collection<LangSysTable> result = Collections.emptyList();
        ScriptTable scriptTable = scriptList.getScriptTable(scriptTag);
        if (scriptTable != null)
        {
            LangSysTable langSysTable = languageTag == null
                    ? null : scriptTable.getLangSysTables().get(languageTag);
            if (langSysTable != null)
            {
                result = Collections.singletonList(langSysTable);
            }
            else if (scriptTable.getDefaultLangSysTable() != null)
            {
                result = Collections.singletonList(scriptTable.getDefaultLangSysTable());
            }
            else
            {
                result = scriptTable.getLangSysTables().values();
            }
        }
        return result;
    }

    /**
     * Get the features that apply to the given script and language. Optionally filter the returned
     * features by supplying a list of allowed feature tags in {@code enabledFeatures}.
     *
     * Note that features listed as required ({@code LangSysTable#requiredFeatureIndex}) will be
     * included even if not explicitly enabled.
     *
     * @param scriptTags candidate script tags in order of preference (see {@link OpenTypeScript})
     * @param languageTag the OpenType language system tag, or {@code null} for the default
     * @param enabledFeatures An optional list of feature tags ({@code null} to allow all)
     * @return The indicated features, ordered like {@code enabledFeatures}
     */
    public List<FeatureListTable> getFeatures(String[] scriptTags, String languageTag,
            final List<String> enabledFeatures)
    {
        Collection<LangSysTable> langSysTables = getLangSysTables(selectScriptTag(scriptTags),
                languageTag);
        if (langSysTables.isEmpty())
        {
            return Collections.emptyList();
        }
        List<FeatureListTable> result = new ArrayList<FeatureListTable>();
        for (LangSysTable langSysTable : langSysTables)
        {
            FeatureListTable required = getRequiredFeature(langSysTable);
            if (required != null && !result.contains(required))
            {
                result.add(required);
            }
            for (int featureIndex : langSysTable.getFeatureIndices())
            {
                FeatureListTable feature = featureList.getFeature(featureIndex);
                if (feature != null && !result.contains(feature) &&
                        (enabledFeatures == null ||
                         enabledFeatures.contains(feature.getFeatureTag())))
                {
                    result.add(feature);
                }
            }
        }

        // 'vrt2' supersedes 'vert' and they should not be used together
        // https://www.microsoft.com/typography/otspec/features_uz.htm
        if (containsFeature(result, "vrt2"))
        {
            removeFeature(result, "vert");
        }

        if (enabledFeatures != null && result.size() > 1)
        {
            Collections.sort(result, new Comparator<FeatureListTable>()
            {
                @Override
                public int compare(FeatureListTable o1, FeatureListTable o2)
                {
                    int i1 = enabledFeatures.indexOf(o1.getFeatureTag());
                    int i2 = enabledFeatures.indexOf(o2.getFeatureTag());
                    return i1 < i2 ? -1 : i1 == i2 ? 0 : 1;
                }
            });
        }

        return result;
    }

    /**
     * Get the tags of the required features of the given script and language. Required features
     * apply to every glyph, whatever features a shaper enabled.
     *
     * @param scriptTags candidate script tags in order of preference
     * @param languageTag the OpenType language system tag, or {@code null} for the default
     * @return the tags of the required features, possibly empty
     */
    public List<String> getRequiredFeatureTags(String[] scriptTags, String languageTag)
    {
        List<String> result = new ArrayList<String>();
        for (LangSysTable langSysTable : getLangSysTables(selectScriptTag(scriptTags),
                languageTag))
        {
            FeatureListTable required = getRequiredFeature(langSysTable);
            if (required != null && !result.contains(required.getFeatureTag()))
            {
                result.add(required.getFeatureTag());
            }
        }
        return result;
    }

    private FeatureListTable getRequiredFeature(LangSysTable langSysTable)
    {
        int required = langSysTable.getRequiredFeatureIndex();
        if (required == LangSysTable.NO_REQUIRED_FEATURE)
        {
            return null;
        }
        FeatureListTable feature = featureList.getFeature(required);
        if (feature == null)
        {
            LOG.debug("Required feature index " + required + " is out of range, ignored");
        }
        return feature;
    }

    private boolean containsFeature(List<FeatureListTable> features, String featureTag)
    {
        for (FeatureListTable feature : features)
        {
            if (feature.getFeatureTag().equals(featureTag))
            {
                return true;
            }
        }
        return false;
    }

    private void removeFeature(List<FeatureListTable> features, String featureTag)
    {
        Iterator<FeatureListTable> iter = features.iterator();
        while (iter.hasNext())
        {
            if (iter.next().getFeatureTag().equals(featureTag))
            {
                iter.remove();
            }
        }
    }

    public ScriptList getScriptList()
    {
        return scriptList;
    }

    public FeatureList getFeatureList()
    {
        return featureList;
    }

    public LookupList<T> getLookupList()
    {
        return lookupList;
    }
}
