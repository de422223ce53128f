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
import java.util.Collections;
import java.util.List;

/**
 * Assigns feature tags to the slots of a glyph collection before the lookups are applied. A
 * shaper knows the features a script needs; subclasses add features that depend on the context of
 * a glyph, such as Arabic positional forms.
 */
public abstract class BaseShaper
{
    private final List<String> features;

    /**
     * @param defaultFeatures the features assigned to every slot by default
     * @param enabledFeatures the features requested by the caller, or {@code null} for the
     * defaults
     */
    protected BaseShaper(List<String> defaultFeatures, List<String> enabledFeatures)
    {
        List<String> list = enabledFeatures != null ? enabledFeatures : defaultFeatures;
        this.features = Collections.unmodifiableList(new ArrayList<String>(list));
    }

    /**
     * Assigns the substitution and positioning features to each glyph within the collection.
     *
     * @param collection the glyph substitution collection
     * @param index the zero-based index of the first slot to assign
     * @param count the number of slots to assign
     */
    public abstract void assignFeatures(GlyphSubstitutionCollection collection, int index,
            int count);

    /**
     * @return the features this shaper assigns to every slot when the caller requests none
     */
    public abstract List<String> getDefaultFeatures();

    /**
     * @return the features assigned to every slot
     */
    public List<String> getFeatures()
    {
        return features;
    }

    /**
     * @return every feature tag this shaper may assign to a slot
     */
    public List<String> getFeatureTags()
    {
        List<String> contextual = getContextualFeatures();
        if (contextual.isEmpty())
        {
            return features;
        }
        List<String> tags = new ArrayList<String>(contextual);
        for (String feature : features)
        {
            if (!tags.contains(feature))
            {
                tags.add(feature);
            }
        }
        return tags;
    }

    /**
     * @return the features assigned to individual slots depending on their neighbours
     */
    protected List<String> getContextualFeatures()
    {
        return Collections.emptyList();
    }

    protected void assignGlobalFeatures(GlyphSubstitutionCollection collection, int index,
            int count)
    {
        for (String feature : features)
        {
            collection.enableFeature(index, count, feature);
        }
    }
}
