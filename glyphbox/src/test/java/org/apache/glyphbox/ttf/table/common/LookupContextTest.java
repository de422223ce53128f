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


package org.apache.glyphbox.ttf.table.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.glyphbox.ttf.InvalidFontFileException;
import org.apache.glyphbox.ttf.shaping.GlyphSubstitutionCollection;
import org.junit.jupiter.api.Test;

class LookupContextTest
{
    @Test
    void testLookupCycleHitsNestingCeiling()
    {
        // lookup 0 is a context lookup that invokes itself at the same slot
        LookupList<GlyphSubstitutionCollection> lookupList = lookupList(
                contextLookup(5, new SequenceLookupRecord(0, 0)));
        final LookupContext<GlyphSubstitutionCollection> context =
                new LookupContext<GlyphSubstitutionCollection>(lookupList,
                        new GlyphSubstitutionCollection(5, 6), null);
        InvalidFontFileException ex = assertThrows(InvalidFontFileException.class,
                () -> context.applyNestedLookup(0, 0));
        assertTrue(ex.getMessage().contains("maximum depth of 32"), ex.getMessage());
        assertEquals(0, context.getNestingLevel());
    }

    @Test
    void testConfiguredCeiling() throws IOException
    {
        // lookup 0 -> lookup 1 -> lookup 2 (single substitution)
        List<LookupTable<GlyphSubstitutionCollection>> lookups =
                new ArrayList<LookupTable<GlyphSubstitutionCollection>>();
        lookups.add(contextLookup(5, new SequenceLookupRecord(0, 1)));
        lookups.add(contextLookup(5, new SequenceLookupRecord(0, 2)));
        lookups.add(ChainedSequenceContextTest.singleSubstitution(5, 9));
        LookupList<GlyphSubstitutionCollection> lookupList =
                new LookupList<GlyphSubstitutionCollection>(lookups);

        GlyphSubstitutionCollection glyphs = new GlyphSubstitutionCollection(5);
        final LookupContext<GlyphSubstitutionCollection> shallow =
                new LookupContext<GlyphSubstitutionCollection>(lookupList, glyphs, null);
        shallow.setMaxNestingLevel(2);
        assertThrows(InvalidFontFileException.class, () -> shallow.applyNestedLookup(0, 0));
        assertEquals(5, glyphs.getGlyphId(0));

        LookupContext<GlyphSubstitutionCollection> deep =
                new LookupContext<GlyphSubstitutionCollection>(lookupList, glyphs, null);
        deep.setMaxNestingLevel(3);
        assertTrue(deep.applyNestedLookup(0, 0));
        assertEquals(9, glyphs.getGlyphId(0));
    }

    @Test
    void testNestedLookupIndexOutOfRange()
    {
        final LookupContext<GlyphSubstitutionCollection> context =
                new LookupContext<GlyphSubstitutionCollection>(
                        lookupList(ChainedSequenceContextTest.singleSubstitution(5, 9)),
                        new GlyphSubstitutionCollection(5), null);
        assertThrows(InvalidFontFileException.class, () -> context.applyNestedLookup(1, 0));
    }

    @Test
    void testValidateLookupIndicesOfRecords()
    {
        final LookupList<GlyphSubstitutionCollection> lookupList = lookupList(
                contextLookup(5, new SequenceLookupRecord(0, 3)));
        final FeatureList featureList = new FeatureList(
                Collections.<FeatureListTable>emptyList());
        InvalidFontFileException ex = assertThrows(InvalidFontFileException.class,
                () -> lookupList.validateLookupIndices(featureList));
        assertTrue(ex.getMessage().contains("lookup 3"), ex.getMessage());
    }

    @Test
    void testValidateLookupIndicesOfFeatures()
    {
        final LookupList<GlyphSubstitutionCollection> lookupList = lookupList(
                ChainedSequenceContextTest.singleSubstitution(5, 9));
        final FeatureList featureList = new FeatureList(Collections.singletonList(
                new FeatureListTable("liga", 0, new int[] { 0, 1 })));
        InvalidFontFileException ex = assertThrows(InvalidFontFileException.class,
                () -> lookupList.validateLookupIndices(featureList));
        assertTrue(ex.getMessage().contains("'liga'"), ex.getMessage());
    }

    @Test
    void testInvalidCeiling()
    {
        final LookupContext<GlyphSubstitutionCollection> context =
                new LookupContext<GlyphSubstitutionCollection>(lookupList(),
                        new GlyphSubstitutionCollection(), null);
        assertThrows(IllegalArgumentException.class, () -> context.setMaxNestingLevel(0));
    }

    private static LookupTable<GlyphSubstitutionCollection> contextLookup(int gid,
            SequenceLookupRecord record)
    {
        LookupSubTable<GlyphSubstitutionCollection> subTable =
                new SequenceContextFormat3SubTable<GlyphSubstitutionCollection>(3,
                        new CoverageTable[] { new CoverageTableFormat1(1, new int[] { gid }) },
                        new SequenceLookupRecord[] { record });
        return new LookupTable<GlyphSubstitutionCollection>(5, 0, 0,
                Collections.singletonList(subTable));
    }

    @SafeVarargs
    private static LookupList<GlyphSubstitutionCollection> lookupList(
            LookupTable<GlyphSubstitutionCollection>... lookups)
    {
        List<LookupTable<GlyphSubstitutionCollection>> list =
                new ArrayList<LookupTable<GlyphSubstitutionCollection>>();
        Collections.addAll(list, lookups);
        return new LookupList<GlyphSubstitutionCollection>(list);
    }
}
