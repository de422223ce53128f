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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.apache.glyphbox.ttf.shaping.GlyphSubstitutionCollection;
import org.apache.glyphbox.ttf.table.common.CoverageTable;
import org.apache.glyphbox.ttf.table.common.CoverageTableFormat1;
import org.junit.jupiter.api.Test;

class LookupTypeReverseChainSingleSubstFormat1Test
{
    @Test
    void testSubstituteBetweenContext()
    {
        // 20 becomes 21 when preceded by 10 and followed by 30
        LookupTypeReverseChainSingleSubstFormat1 subTable =
                new LookupTypeReverseChainSingleSubstFormat1(1,
                        new CoverageTableFormat1(1, new int[] { 20 }),
                        new CoverageTable[] { new CoverageTableFormat1(1, new int[] { 10 }) },
                        new CoverageTable[] { new CoverageTableFormat1(1, new int[] { 30 }) },
                        new int[] { 21 });

        GlyphSubstitutionCollection glyphs = new GlyphSubstitutionCollection(10, 20, 30);
        assertTrue(subTable.apply(context(glyphs), 1));
        assertArrayEquals(new int[] { 10, 21, 30 }, glyphs.getGlyphIds());

        glyphs = new GlyphSubstitutionCollection(10, 20, 20);
        assertFalse(subTable.apply(context(glyphs), 1));
        glyphs = new GlyphSubstitutionCollection(20, 30);
        assertFalse(subTable.apply(context(glyphs), 0));
    }
}
