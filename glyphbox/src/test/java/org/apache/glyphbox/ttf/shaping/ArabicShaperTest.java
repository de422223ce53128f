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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.ibm.icu.lang.UCharacter;
import org.junit.jupiter.api.Test;

class ArabicShaperTest
{
    private static final int BEH = 0x0628;
    private static final int SEEN = 0x0633;
    private static final int MEEM = 0x0645;
    private static final int ALEF = 0x0627;
    private static final int LAM = 0x0644;
    private static final int FATHA = 0x064E;

    private static GlyphSubstitutionCollection assign(BaseShaper shaper, int... codePoints)
    {
        GlyphSubstitutionCollection collection = new GlyphSubstitutionCollection();
        for (int codePoint : codePoints)
        {
            collection.addGlyph(codePoint & 0xff, codePoint);
        }
        shaper.assignFeatures(collection, 0, collection.size());
        return collection;
    }

    private static List<String> forms(GlyphSubstitutionCollection collection)
    {
        List<String> forms = new ArrayList<String>();
        for (int i = 0; i < collection.size(); i++)
        {
            String form = "-";
            for (String feature : Arrays.asList(ArabicShaper.ISOLATED, ArabicShaper.INITIAL,
                    ArabicShaper.MEDIAL, ArabicShaper.FINAL))
            {
                if (collection.hasFeature(i, feature))
                {
                    form = feature;
                }
            }
            forms.add(form);
        }
        return forms;
    }

    @Test
    void testDualJoiningWord()
    {
        assertEquals(Arrays.asList("init", "medi", "fina"),
                forms(assign(new ArabicShaper(), BEH, SEEN, MEEM)));
        assertEquals(Collections.singletonList("isol"), forms(assign(new ArabicShaper(), BEH)));
    }

    @Test
    void testRightJoiningLetterBreaksTheJoin()
    {
        // alef does not join to the following letter
        assertEquals(Arrays.asList("isol", "isol"),
                forms(assign(new ArabicShaper(), ALEF, LAM)));
        assertEquals(Arrays.asList("init", "fina"),
                forms(assign(new ArabicShaper(), LAM, ALEF)));
        assertEquals(Arrays.asList("init", "fina", "isol"),
                forms(assign(new ArabicShaper(), BEH, ALEF, BEH)));
    }

    @Test
    void testMarksAreTransparent()
    {
        assertEquals(Arrays.asList("init", "-", "fina"),
                forms(assign(new ArabicShaper(), BEH, FATHA, BEH)));
    }

    @Test
    void testNonJoiningCharactersSplitWords()
    {
        assertEquals(Arrays.asList("isol", "-", "init", "fina"),
                forms(assign(new ArabicShaper(), BEH, ' ', BEH, BEH)));
    }

    @Test
    void testGlobalFeatures()
    {
        GlyphSubstitutionCollection defaults = assign(new ArabicShaper(), BEH, BEH);
        assertTrue(defaults.hasFeature(0, "rlig"));
        assertTrue(defaults.hasFeature(1, "mkmk"));
        assertFalse(defaults.hasFeature(0, "smcp"));

        // positional features are assigned whatever the caller enabled
        GlyphSubstitutionCollection restricted = assign(
                new ArabicShaper(Collections.singletonList("liga")), BEH, BEH);
        assertTrue(restricted.hasFeature(0, "liga"));
        assertFalse(restricted.hasFeature(0, "rlig"));
        assertTrue(restricted.hasFeature(0, ArabicShaper.INITIAL));
        assertEquals(Arrays.asList("isol", "init", "medi", "fina", "liga"),
                new ArabicShaper(Collections.singletonList("liga")).getFeatureTags());
    }

    @Test
    void testJoiningTypes()
    {
        assertEquals(UCharacter.JoiningType.DUAL_JOINING, ArabicShaper.getJoiningType(BEH));
        assertEquals(UCharacter.JoiningType.RIGHT_JOINING, ArabicShaper.getJoiningType(ALEF));
        assertEquals(UCharacter.JoiningType.TRANSPARENT, ArabicShaper.getJoiningType(FATHA));
        assertEquals(UCharacter.JoiningType.NON_JOINING, ArabicShaper.getJoiningType('a'));
        assertEquals(UCharacter.JoiningType.NON_JOINING, ArabicShaper.getJoiningType(-1));
    }

    @Test
    void testShaperFactory()
    {
        assertTrue(ShaperFactory.getShaper("arab") instanceof ArabicShaper);
        assertTrue(ShaperFactory.getShaper("syrc") instanceof ArabicShaper);
        assertTrue(ShaperFactory.getShaper("latn") instanceof LatinShaper);
        assertEquals(DefaultShaper.class, ShaperFactory.getShaper("cyrl").getClass());
        assertEquals(DefaultShaper.DEFAULT_FEATURES, ShaperFactory.getShaper("DFLT").getFeatures());
    }
}
