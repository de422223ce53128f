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
import org.junit.jupiter.api.Test;

class LookupTypeMultipleSubstitutionFormat1Test
{
    @Test
    void testGlyphIsDecomposed()
    {
        LookupTypeMultipleSubstitutionFormat1 subTable = new LookupTypeMultipleSubstitutionFormat1(
                1, new CoverageTableFormat1(1, new int[] { 10, 15 }),
                new SequenceTable[] {
                        new SequenceTable(3, new int[] { 20, 21, 22 }),
                        new SequenceTable(2, new int[] { 30, 31 }) });

        GlyphSubstitutionCollection glyphs = new GlyphSubstitutionCollection();
        glyphs.addGlyph(9, 'a');
        glyphs.addGlyph(10, 'b');
        glyphs.addGlyph(11, 'c');
        glyphs.enableFeature(1, 1, "ccmp");

        assertTrue(subTable.apply(context(glyphs), 1));
        assertEquals(5, glyphs.size());
        assertArrayEquals(new int[] { 9, 20, 21, 22, 11 }, glyphs.getGlyphIds());
        // the new slots inherit code point and features of the replaced slot
        for (int i = 1; i <= 3; i++)
        {
            assertEquals('b', glyphs.getCodePoint(i));
            assertTrue(glyphs.hasFeature(i, "ccmp"));
        }
        assertFalse(glyphs.hasFeature(4, "ccmp"));

        // the second coverage index selects the second sequence
        glyphs = new GlyphSubstitutionCollection(15);
        assertTrue(subTable.apply(context(glyphs), 0));
        assertArrayEquals(new int[] { 30, 31 }, glyphs.getGlyphIds());

        assertFalse(subTable.apply(context(glyphs), 1));
    }
}
