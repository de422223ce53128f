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
import java.util.List;

/**
 * The shaper for the Latin script. Standard ligatures are on by default, and so is kerning.
 */
public class LatinShaper extends DefaultShaper
{
    public static final String SCRIPT_TAG = "latn";

    public static final List<String> LATIN_FEATURES = Collections.unmodifiableList(
            Arrays.asList("ccmp", "locl", "rlig", "rclt", "calt", "liga", "clig", "kern", "mark",
                    "mkmk", "curs", "dist"));

    public LatinShaper()
    {
        this(null);
    }

    public LatinShaper(List<String> enabledFeatures)
    {
        super(LATIN_FEATURES, enabledFeatures);
    }

    @Override
    public List<String> getDefaultFeatures()
    {
        return LATIN_FEATURES;
    }
}
