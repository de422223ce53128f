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
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.apache.glyphbox.ttf.shaping.GlyphSubstitutionCollection;
import org.apache.glyphbox.ttf.table.common.CoverageTableFormat1;
import org.apache.glyphbox.ttf.table.common.CoverageTableFormat2;
import org.apache.glyphbox.ttf.table.common.LookupContext;
import org.apache.glyphbox.ttf.table.common.RangeRecord;
import org.junit.jupiter.api.Test;

class SingleAndAlternateSubstitutionTest
{
    @Test
    void testDeltaSubstitution()
    {
        LookupTypeSingleSubstFormat1 subTable = new LookupTypeSingleSubstFormat1(1,
                new CoverageTableFormat2(2, new RangeRecord[] { new RangeRecord(2, 10, 0) }),
                (short) -3);
        GlyphSubstitutionCollection glyphs = new GlyphSubstitutionCollection(10, 2, 11);
        assertTrue(subTable.apply(context(glyphs), 0));
        assertEquals(7, glyphs.getGlyphId(0));
        // addition is modulo 65536
        assertTrue(subTable.apply(context(glyphs), 1));
        assertEquals(65535, glyphs.getGlyphId(1));
        assertFalse(subTable.apply(context(glyphs), 2));
        assertEquals(11, glyphs.getGlyphId(2));
    }

    @Test
    void testArraySubstitution()
    {
        LookupTypeSingleSubstFormat2 subTable = new LookupTypeSingleSubstFormat2(2,
                new CoverageTableFormat1(1, new int[] { 4, 8 }), new int[] { 40, 80 });
        GlyphSubstitutionCollection glyphs = new GlyphSubstitutionCollection(8, 4);
        assertTrue(subTable.apply(context(glyphs), 0));
        assertTrue(subTable.apply(context(glyphs), 1));
        assertEquals(80, glyphs.getGlyphId(0));
        assertEquals(40, glyphs.getGlyphId(1));
    }

    @Test
    void testAlternateSelection()
    {
        LookupTypeAlternateSubstitutionFormat1 subTable = new LookupTypeAlternateSubstitutionFormat1(
                1, new CoverageTableFormat1(1, new int[] { 10 }),
                new int[][] { { 30, 31, 32 } });

        GlyphSubstitutionCollection glyphs = new GlyphSubstitutionCollection(10);
        assertTrue(subTable.apply(context(glyphs), 0));
        assertEquals(30, glyphs.getGlyphId(0));

        glyphs = new GlyphSubstitutionCollection(10);
        LookupContext<GlyphSubstitutionCollection> context = context(glyphs);
        context.setAlternateIndex(1);
        assertTrue(subTable.apply(context, 0));
        assertEquals(31, glyphs.getGlyphId(0));

        // an index past the end selects the last alternate
        glyphs = new GlyphSubstitutionCollection(10);
        context = context(glyphs);
        context.setAlternateIndex(7);
        assertTrue(subTable.apply(context, 0));
        assertEquals(32, glyphs.getGlyphId(0));
    }
}
