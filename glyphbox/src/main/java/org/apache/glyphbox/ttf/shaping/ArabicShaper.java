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

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.lang.UProperty;

/**
 * The shaper for Arabic and other scripts that join cursively. Each slot gets one of the
 * positional features isol, init, medi or fina, chosen from the Unicode joining types of the slot
 * and of its nearest non-transparent neighbours; marks and other transparent characters are
 * skipped when looking for neighbours and get no positional feature.
 */
public class ArabicShaper extends BaseShaper
{
    public static final String SCRIPT_TAG = "arab";

    public static final String ISOLATED = "isol";
    public static final String INITIAL = "init";
    public static final String MEDIAL = "medi";
    public static final String FINAL = "fina";

    public static final List<String> ARABIC_FEATURES = Collections.unmodifiableList(
            Arrays.asList("ccmp", "locl", "rlig", "calt", "liga", "mset", "curs", "kern", "mark",
                    "mkmk"));

    private static final List<String> POSITIONAL_FEATURES = Collections.unmodifiableList(
            Arrays.asList(ISOLATED, INITIAL, MEDIAL, FINAL));

    public ArabicShaper()
    {
        this(null);
    }

    public ArabicShaper(List<String> enabledFeatures)
    {
        super(ARABIC_FEATURES, enabledFeatures);
    }

    @Override
    public void assignFeatures(GlyphSubstitutionCollection collection, int index, int count)
    {
        assignGlobalFeatures(collection, index, count);

        int end = index + count;
        for (int i = index; i < end; i++)
        {
            int joiningType = getJoiningType(collection.getCodePoint(i));
            if (joiningType == UCharacter.JoiningType.TRANSPARENT
                    || joiningType == UCharacter.JoiningType.NON_JOINING)
            {
                continue;
            }
            int previous = findNeighbour(collection, i - 1, index - 1, -1);
            int next = findNeighbour(collection, i + 1, end, 1);
            boolean joinsPrevious = joinsTowardsPrevious(joiningType)
                    && previous >= 0
                    && joinsTowardsNext(getJoiningType(collection.getCodePoint(previous)));
            boolean joinsNext = joinsTowardsNext(joiningType)
                    && next >= 0
                    && joinsTowardsPrevious(getJoiningType(collection.getCodePoint(next)));

            String feature;
            if (joinsPrevious && joinsNext)
            {
                feature = MEDIAL;
            }
            else if (joinsPrevious)
            {
                feature = FINAL;
            }
            else if (joinsNext)
            {
                feature = INITIAL;
            }
            else
            {
                feature = ISOLATED;
            }
            collection.enableFeature(i, 1, feature);
        }
    }

    @Override
    public List<String> getDefaultFeatures()
    {
        return ARABIC_FEATURES;
    }

    @Override
    protected List<String> getContextualFeatures()
    {
        return POSITIONAL_FEATURES;
    }

    /**
     * Finds the nearest slot in logical order whose character is not transparent.
     *
     * @return the slot index, or -1 if the run ends first
     */
    private static int findNeighbour(GlyphSubstitutionCollection collection, int from, int limit,
            int step)
    {
        for (int i = from; i != limit; i += step)
        {
            if (getJoiningType(collection.getCodePoint(i)) != UCharacter.JoiningType.TRANSPARENT)
            {
                return i;
            }
        }
        return -1;
    }

    static int getJoiningType(int codePoint)
    {
        if (codePoint < 0)
        {
            return UCharacter.JoiningType.NON_JOINING;
        }
        return UCharacter.getIntPropertyValue(codePoint, UProperty.JOINING_TYPE);
    }

    // in logical order, the "previous" character lies to the right in an RTL run
    private static boolean joinsTowardsPrevious(int joiningType)
    {
        return joiningType == UCharacter.JoiningType.RIGHT_JOINING
                || joiningType == UCharacter.JoiningType.DUAL_JOINING
                || joiningType == UCharacter.JoiningType.JOIN_CAUSING;
    }

    private static boolean joinsTowardsNext(int joiningType)
    {
        return joiningType == UCharacter.JoiningType.LEFT_JOINING
                || joiningType == UCharacter.JoiningType.DUAL_JOINING
                || joiningType == UCharacter.JoiningType.JOIN_CAUSING;
    }
}
