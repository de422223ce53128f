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


package org.apache.glyphbox.ttf.table.gsub;

import static org.apache.glyphbox.ttf.table.gsub.SubstitutionTestUtil.context;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.apache.glyphbox.ttf.shaping.GlyphSubstitutionCollection;
import org.apache.glyphbox.ttf.table.common.CoverageTableFormat1;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LookupTypeLigatureSubstitutionFormat1Test
{
    private static final int A = 10;
    private static final int B = 11;
    private static final int C = 12;
    private static final int LIG_ABC = 100;
    private static final int LIG_AB = 101;

    private LookupTypeLigatureSubstitutionFormat1 subTable;

    @BeforeEach
    void setUp()
    {
        // the longer ligature comes first, as fonts order them
        LigatureSetTable ligatureSet = new LigatureSetTable(new LigatureTable[] {
                new LigatureTable(LIG_ABC, new int[] { B, C }),
                new LigatureTable(LIG_AB, new int[] { B }) });
        subTable = new LookupTypeLigatureSubstitutionFormat1(1,
                new CoverageTableFormat1(1, new int[] { A }),
                new LigatureSetTable[] { ligatureSet });
    }

    @Test
    void testThreeComponentLigature()
    {
        GlyphSubstitutionCollection glyphs = new GlyphSubstitutionCollection(A, B, C, 50);
        assertTrue(subTable.apply(context(glyphs), 0));
        assertEquals(2, glyphs.size());
        assertArrayEquals(new int[] { LIG_ABC, 50 }, glyphs.getGlyphIds());
        assertTrue(glyphs.getGlyphShapingData(0).isLigature());
        assertArrayEquals(new int[] { A, B, C },
                glyphs.getGlyphShapingData(0).getComponentGlyphIds());
    }

    @Test
    void testFallsBackToShorterLigature()
    {
        GlyphSubstitutionCollection glyphs = new GlyphSubstitutionCollection(A, B, 50);
        assertTrue(subTable.apply(context(glyphs), 0));
        assertArrayEquals(new int[] { LIG_AB, 50 }, glyphs.getGlyphIds());
        assertEquals(2, glyphs.getGlyphShapingData(0).getComponentCount());
    }

    @Test
    void testNoMatch()
    {
        GlyphSubstitutionCollection glyphs = new GlyphSubstitutionCollection(A, C, B);
        assertFalse(subTable.apply(context(glyphs), 0));
        assertArrayEquals(new int[] { A, C, B }, glyphs.getGlyphIds());

        // not covered
        assertFalse(subTable.apply(context(glyphs), 1));

        // the last slot has no following component
        glyphs = new GlyphSubstitutionCollection(50, A);
        assertFalse(subTable.apply(context(glyphs), 1));
    }

    @Test
    void testGlyphZeroNeverMatches()
    {
        GlyphSubstitutionCollection glyphs = new GlyphSubstitutionCollection(0, B, C);
        assertFalse(subTable.apply(context(glyphs), 0));
        glyphs = new GlyphSubstitutionCollection(A, 0, C);
        assertFalse(subTable.apply(context(glyphs), 0));
        assertArrayEquals(new int[] { A, 0, C }, glyphs.getGlyphIds());
    }
}
