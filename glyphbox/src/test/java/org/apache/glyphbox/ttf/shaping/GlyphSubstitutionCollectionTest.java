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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class GlyphSubstitutionCollectionTest
{
    private static GlyphSubstitutionCollection abc()
    {
        GlyphSubstitutionCollection collection = new GlyphSubstitutionCollection();
        collection.addGlyph(1, 'a');
        collection.addGlyph(2, 'b');
        collection.addGlyph(3, 'c');
        collection.enableFeature(0, 3, "liga");
        collection.enableFeature(1, 1, "smcp");
        return collection;
    }

    @Test
    void testReplaceOneGlyphKeepsSlot()
    {
        GlyphSubstitutionCollection collection = abc();
        collection.replace(1, 1, 20);

        assertArrayEquals(new int[] { 1, 20, 3 }, collection.getGlyphIds());
        assertEquals('b', collection.getCodePoint(1));
        assertTrue(collection.hasFeature(1, "smcp"));
        assertArrayEquals(new int[] { 20 },
                collection.getGlyphShapingData(1).getComponentGlyphIds());
    }

    @Test
    void testLigatureRemembersComponents()
    {
        GlyphSubstitutionCollection collection = abc();
        collection.replace(1, 2, 100);

        assertArrayEquals(new int[] { 1, 100 }, collection.getGlyphIds());
        GlyphShapingData ligature = collection.getGlyphShapingData(1);
        assertTrue(ligature.isLigature());
        assertArrayEquals(new int[] { 2, 3 }, ligature.getComponentGlyphIds());
        assertEquals('b', ligature.getCodePoint());

        // a ligature of a ligature flattens the components
        collection.replace(0, 2, 200);
        assertArrayEquals(new int[] { 1, 2, 3 },
                collection.getGlyphShapingData(0).getComponentGlyphIds());
        assertEquals(3, collection.getGlyphShapingData(0).getComponentCount());
    }

    @Test
    void testReplaceWithSeveralGlyphs()
    {
        GlyphSubstitutionCollection collection = abc();
        collection.replace(1, 1, 21, 22, 23);

        assertArrayEquals(new int[] { 1, 21, 22, 23, 3 }, collection.getGlyphIds());
        for (int i = 1; i <= 3; i++)
        {
            assertEquals('b', collection.getCodePoint(i));
            assertTrue(collection.hasFeature(i, "smcp"));
            assertFalse(collection.getGlyphShapingData(i).isLigature());
        }
        assertFalse(collection.hasFeature(4, "smcp"));
    }

    @Test
    void testDeleteSlots()
    {
        GlyphSubstitutionCollection collection = abc();
        collection.replace(0, 2);

        assertArrayEquals(new int[] { 3 }, collection.getGlyphIds());
        assertEquals('c', collection.getCodePoint(0));
    }

    @Test
    void testReplaceOutOfRange()
    {
        GlyphSubstitutionCollection collection = abc();

        assertThrows(IndexOutOfBoundsException.class, () -> collection.replace(2, 2, 9));
        assertThrows(IndexOutOfBoundsException.class, () -> collection.replace(-1, 1, 9));
        assertThrows(IndexOutOfBoundsException.class, () -> collection.replace(0, 0, 9));
        assertArrayEquals(new int[] { 1, 2, 3 }, collection.getGlyphIds());
    }

    @Test
    void testFeatures()
    {
        GlyphSubstitutionCollection collection = abc();
        collection.disableFeature(0, 2, "liga");

        assertFalse(collection.hasFeature(0, "liga"));
        assertFalse(collection.hasFeature(1, "liga"));
        assertTrue(collection.hasFeature(2, "liga"));
        assertEquals(1, collection.getFeatures(1).size());
        assertThrows(UnsupportedOperationException.class,
                () -> collection.getFeatures(2).add("kern"));
    }

    @Test
    void testPositioningCollectionStartsFromMetrics()
    {
        GlyphSubstitutionCollection collection = abc();
        GlyphPositioningCollection positions = new GlyphPositioningCollection(collection,
                new FixedGlyphMetrics(500).withAdvance(2, 250));

        assertEquals(3, positions.size());
        assertEquals(250, positions.getXAdvance(1));
        assertEquals(0, positions.getYAdvance(1));
        assertTrue(positions.hasFeature(1, "smcp"));

        positions.addAdvance(1, 10, 5);
        positions.addOffset(1, -3, 4);
        positions.addOffset(1, 1, 1);
        assertEquals(260, positions.getXAdvance(1));
        assertEquals(5, positions.getYAdvance(1));
        assertEquals(-2, positions.getXOffset(1));
        assertEquals(5, positions.getYOffset(1));

        positions.setOffset(1, 7, 8);
        assertEquals(7, positions.getXOffset(1));
        assertEquals(8, positions.getYOffset(1));
    }
}
