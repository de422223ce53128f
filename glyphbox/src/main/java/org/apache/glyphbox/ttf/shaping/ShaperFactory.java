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

import java.util.List;

/**
 * Chooses the shaper for an OpenType script tag.
 */
public final class ShaperFactory
{
    private ShaperFactory()
    {
    }

    public static BaseShaper getShaper(String scriptTag)
    {
        return getShaper(scriptTag, null);
    }

    /**
     * @param scriptTag the OpenType script tag
     * @param enabledFeatures the features requested by the caller, or {@code null} for the
     * defaults of the shaper
     * @return a new shaper
     */
    public static BaseShaper getShaper(String scriptTag, List<String> enabledFeatures)
    {
        if (ArabicShaper.SCRIPT_TAG.equals(scriptTag) || "syrc".equals(scriptTag)
                || "nko ".equals(scriptTag))
        {
            return new ArabicShaper(enabledFeatures);
        }
        if (LatinShaper.SCRIPT_TAG.equals(scriptTag))
        {
            return new LatinShaper(enabledFeatures);
        }
        return new DefaultShaper(enabledFeatures);
    }
}
