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


package org.apache.glyphbox.ttf;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.glyphbox.ttf.shaping.GlyphShapingEngine;
import org.apache.glyphbox.ttf.shaping.GlyphSubstitutionCollection;
import org.apache.glyphbox.ttf.table.common.FeatureListTable;
import org.apache.glyphbox.ttf.table.common.LookupTable;
import org.apache.glyphbox.ttf.table.gsub.LookupTypeLigatureSubstitutionFormat1;
import org.junit.jupiter.api.Test;

/**
 * Reads a complete GSUB table, stored behind 4 bytes of other data, with a single substitution
 * for 'smcp' and a ligature wrapped in an extension subtable for 'liga'.
 */
class GlyphSubstitutionTableTest
{
    private static final int GID_F = 73;
    private static final int GID_I = 76;
    private static final int GID_A = 68;
    private static final int GID_A_SMALL_CAP = 36;
    private static final int GID_FI = 200;

    private static byte[] buildGsub(int majorVersion, int singleSubstFormat, int ligaLookupIndex)
    {
        FontDataBuilder b = new FontDataBuilder();
        b.uint16(0xAAAA, 0xAAAA);
        int start = b.position();
        b.uint16(majorVersion, 0);
        int scriptList = b.offset16();
        int featureList = b.offset16();
        int lookupList = b.offset16();

        b.patchOffset16(scriptList, start);
        int scriptListStart = b.position();
        b.uint16(2);
        b.tag("DFLT");
        int dflt = b.offset16();
        b.tag("latn");
        int latn = b.offset16();

        b.patchOffset16(dflt, scriptListStart);
        int dfltStart = b.position();
        int dfltDefault = b.offset16();
        b.uint16(0);
        b.patchOffset16(dfltDefault, dfltStart);
        b.uint16(0, 0xFFFF, 1, 0);

        // latn: default language with both features, Turkish with 'smcp' required
        b.patchOffset16(latn, scriptListStart);
        int latnStart = b.position();
        int latnDefault = b.offset16();
        b.uint16(1);
        b.tag("TRK ");
        int trk = b.offset16();
        b.patchOffset16(latnDefault, latnStart);
        b.uint16(0, 0xFFFF, 2, 0, 1);
        b.patchOffset16(trk, latnStart);
        b.uint16(0, 1, 1, 0);

        b.patchOffset16(featureList, start);
        int featureListStart = b.position();
        b.uint16(2);
        b.tag("liga");
        int liga = b.offset16();
        b.tag("smcp");
        int smcp = b.offset16();
        b.patchOffset16(liga, featureListStart);
        b.uint16(0, 1, ligaLookupIndex);
        b.patchOffset16(smcp, featureListStart);
        b.uint16(0, 1, 0);

        b.patchOffset16(lookupList, start);
        int lookupListStart = b.position();
        b.uint16(2);
        int lookup0 = b.offset16();
        int lookup1 = b.offset16();

        b.patchOffset16(lookup0, lookupListStart);
        int lookup0Start = b.position();
        b.uint16(GlyphSubstitutionTable.LOOKUP_TYPE_SINGLE, 0, 1);
        int single = b.offset16();
        b.patchOffset16(single, lookup0Start);
        int singleStart = b.position();
        b.uint16(singleSubstFormat);
        int singleCoverage = b.offset16();
        b.uint16(1, GID_A_SMALL_CAP);
        b.patchOffset16(singleCoverage, singleStart);
        b.coverage(GID_A);

        b.patchOffset16(lookup1, lookupListStart);
        int lookup1Start = b.position();
        b.uint16(GlyphSubstitutionTable.LOOKUP_TYPE_EXTENSION, 0, 1);
        int extension = b.offset16();
        b.patchOffset16(extension, lookup1Start);
        int extensionStart = b.position();
        b.uint16(1, GlyphSubstitutionTable.LOOKUP_TYPE_LIGATURE);
        int extensionOffset = b.offset32();
        b.uint16(0xBBBB);
        b.patchOffset32(extensionOffset, extensionStart);
        int ligatureStart = b.position();
        b.uint16(1);
        int ligatureCoverage = b.offset16();
        b.uint16(1);
        int ligatureSet = b.offset16();
        b.patchOffset16(ligatureSet, ligatureStart);
        int ligatureSetStart = b.position();
        b.uint16(1);
        int ligature = b.offset16();
        b.patchOffset16(ligature, ligatureSetStart);
        b.uint16(GID_FI, 2, GID_I);
        b.patchOffset16(ligatureCoverage, ligatureStart);
        b.coverage(GID_F);
        return b.toByteArray();
    }

    private static GlyphSubstitutionTable read(byte[] bytes) throws IOException
    {
        GlyphSubstitutionTable gsub = new GlyphSubstitutionTable();
        gsub.setOffset(4);
        gsub.read(new MemoryTTFDataStream(bytes));
        return gsub;
    }

    private static GlyphSubstitutionTable readValid() throws IOException
    {
        return read(buildGsub(1, 2, 1));
    }

    private static List<String> tags(List<FeatureListTable> features)
    {
        List<String> tags = new ArrayList<String>();
        for (FeatureListTable feature : features)
        {
            tags.add(feature.getFeatureTag());
        }
        return tags;
    }

    @Test
    void testReadsScriptsFeaturesAndLookups() throws IOException
    {
        GlyphSubstitutionTable gsub = readValid();

        assertEquals(Arrays.asList("DFLT", "latn"),
                new ArrayList<String>(gsub.getScriptList().getScriptTables().keySet()));
        assertEquals(2, gsub.getFeatureList().size());
        assertEquals(2, gsub.getLookupList().size());

        LookupTable<GlyphSubstitutionCollection> extension = gsub.getLookupList().getLookup(1);
        assertEquals(GlyphSubstitutionTable.LOOKUP_TYPE_LIGATURE, extension.getLookupType());
        assertEquals(1, extension.getSubTables().size());
        assertTrue(extension.getSubTables().get(0) instanceof LookupTypeLigatureSubstitutionFormat1);
    }

    @Test
    void testFeaturesOfScriptAndLanguage() throws IOException
    {
        GlyphSubstitutionTable gsub = readValid();

        assertEquals(Arrays.asList("liga", "smcp"),
                tags(gsub.getFeatures(new String[] { "latn" }, null, null)));
        assertEquals(Collections.singletonList("liga"),
                tags(gsub.getFeatures(new String[] { "latn" }, null,
                        Collections.singletonList("liga"))));
        assertEquals(Collections.singletonList("liga"),
                tags(gsub.getFeatures(new String[] { "cyrl" }, null, null)));
        assertEquals(Collections.<String>emptyList(),
                gsub.getRequiredFeatureTags(new String[] { "latn" }, null));
    }

    @Test
    void testRequiredFeatureIsIncludedEvenIfNotEnabled() throws IOException
    {
        GlyphSubstitutionTable gsub = readValid();

        assertEquals(Arrays.asList("smcp", "liga"),
                tags(gsub.getFeatures(new String[] { "latn" }, "TRK ",
                        Collections.singletonList("liga"))));
        assertEquals(Collections.singletonList("smcp"),
                gsub.getRequiredFeatureTags(new String[] { "latn" }, "TRK "));
    }

    @Test
    void testSubstituteThroughEngine() throws IOException
    {
        GlyphShapingEngine engine = new GlyphShapingEngine(readValid(), null, null);

        GlyphSubstitutionCollection defaults = new GlyphSubstitutionCollection();
        defaults.addGlyph(GID_F, 'f');
        defaults.addGlyph(GID_I, 'i');
        defaults.addGlyph(GID_A, 'a');
        engine.substitute(defaults, new String[] { "latn" }, null, null);
        assertArrayEquals(new int[] { GID_FI, GID_A }, defaults.getGlyphIds());

        GlyphSubstitutionCollection turkish = new GlyphSubstitutionCollection();
        turkish.addGlyph(GID_F, 'f');
        turkish.addGlyph(GID_I, 'i');
        turkish.addGlyph(GID_A, 'a');
        engine.substitute(turkish, new String[] { "latn" }, "TRK ", null);
        assertArrayEquals(new int[] { GID_FI, GID_A_SMALL_CAP }, turkish.getGlyphIds());
    }

    @Test
    void testUnknownSubstFormat()
    {
        InvalidFontFileException ex = assertThrows(InvalidFontFileException.class,
                () -> read(buildGsub(1, 3, 1)));
        assertEquals("Invalid value for 'substFormat' 3. Should be '1' or '2'.", ex.getMessage());
    }

    @Test
    void testFeatureLookupIndexOutOfRange()
    {
        InvalidFontFileException ex = assertThrows(InvalidFontFileException.class,
                () -> read(buildGsub(1, 2, 5)));
        assertTrue(ex.getMessage().contains("'liga'"), ex.getMessage());
        assertTrue(ex.getMessage().contains("lookup 5"), ex.getMessage());
    }

    @Test
    void testUnsupportedMajorVersion()
    {
        InvalidFontFileException ex = assertThrows(InvalidFontFileException.class,
                () -> read(buildGsub(2, 2, 1)));
        assertEquals("Invalid value for 'majorVersion' 2. Should be '1'.", ex.getMessage());
    }

    @Test
    void testTruncatedTable()
    {
        byte[] bytes = buildGsub(1, 2, 1);
        assertThrows(MalformedFontException.class,
                () -> read(Arrays.copyOf(bytes, bytes.length - 4)));
    }

    @Test
    void testUnsupportedLookupTypeIsSkipped() throws IOException
    {
        GlyphSubstitutionTable gsub = new LayoutTableFixture()
                .feature("liga", 0)
                .lookup(9, b -> b.uint16(1, 2, 3))
                .readGsub();

        assertTrue(gsub.getLookupList().getLookup(0).getSubTables().isEmpty());

        GlyphSubstitutionCollection glyphs = new GlyphSubstitutionCollection(1, 2, 3);
        new GlyphShapingEngine(gsub, null, null).substitute(glyphs, new String[] { "latn" },
                null, null);
        assertArrayEquals(new int[] { 1, 2, 3 }, glyphs.getGlyphIds());
    }
}
