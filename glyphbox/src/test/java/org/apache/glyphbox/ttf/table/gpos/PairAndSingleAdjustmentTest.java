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


package org.apache.glyphbox.ttf.table.gpos;

import static org.apache.glyphbox.ttf.table.gpos.PositioningTestUtil.ADVANCE;
import static org.apache.glyphbox.ttf.table.gpos.PositioningTestUtil.context;
import static org.apache.glyphbox.ttf.table.gpos.PositioningTestUtil.positions;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.apache.glyphbox.ttf.shaping.GlyphPositioningCollection;
import org.apache.glyphbox.ttf.table.common.ClassDefinitionTableFormat1;
import org.apache.glyphbox.ttf.table.common.CoverageTableFormat1;
import org.junit.jupiter.api.Test;

class PairAndSingleAdjustmentTest
{
    private static final int GID_A = 36;
    private static final int GID_V = 57;
    private static final int GID_W = 58;

    @Test
    void testPairKerningFormat1()
    {
        PairSetTable pairSet = new PairSetTable(new PairValueRecord[] {
                new PairValueRecord(GID_V, new ValueRecord(0, 0, -80, 0), ValueRecord.EMPTY),
                new PairValueRecord(GID_W, new ValueRecord(0, 0, -60, 0), ValueRecord.EMPTY) });
        LookupTypePairPosFormat1 subTable = new LookupTypePairPosFormat1(1,
                new CoverageTableFormat1(1, new int[] { GID_A }), new PairSetTable[] { pairSet });

        GlyphPositioningCollection positions = positions(GID_A, GID_V, GID_A, GID_W, GID_A);
        assertTrue(subTable.apply(context(positions), 0));
        assertTrue(subTable.apply(context(positions), 2));
        assertFalse(subTable.apply(context(positions), 4));
        assertEquals(ADVANCE - 80, positions.getXAdvance(0));
        assertEquals(ADVANCE, positions.getXAdvance(1));
        assertEquals(ADVANCE - 60, positions.getXAdvance(2));
        assertEquals(ADVANCE, positions.getXAdvance(4));
    }

    @Test
    void testPairAdjustmentFormat2()
    {
        // class 1 for A; V and W are class 1 in the second class definition
        ValueRecord[][][] records = new ValueRecord[2][2][];
        for (int i = 0; i < 2; i++)
        {
            for (int j = 0; j < 2; j++)
            {
                records[i][j] = new ValueRecord[] { ValueRecord.EMPTY, ValueRecord.EMPTY };
            }
        }
        records[1][1] = new ValueRecord[] { new ValueRecord(0, 0, -70, 0),
                new ValueRecord(5, 0, 0, 0) };
        LookupTypePairPosFormat2 subTable = new LookupTypePairPosFormat2(2,
                new CoverageTableFormat1(1, new int[] { GID_A }),
                new ClassDefinitionTableFormat1(1, GID_A, new int[] { 1 }),
                new ClassDefinitionTableFormat1(1, GID_V, new int[] { 1, 1 }),
                records);

        GlyphPositioningCollection positions = positions(GID_A, GID_W, GID_A, GID_A);
        assertTrue(subTable.apply(context(positions), 0));
        assertEquals(ADVANCE - 70, positions.getXAdvance(0));
        assertEquals(5, positions.getXOffset(1));

        // class 0 pairs carry empty records
        assertFalse(subTable.apply(context(positions), 2));
        assertEquals(ADVANCE, positions.getXAdvance(2));
    }

    @Test
    void testSingleAdjustmentAccumulates()
    {
        LookupTypeSinglePosFormat1 raise = new LookupTypeSinglePosFormat1(1,
                new CoverageTableFormat1(1, new int[] { GID_A }), new ValueRecord(10, 20, 30, 0));
        LookupTypeSinglePosFormat2 perGlyph = new LookupTypeSinglePosFormat2(2,
                new CoverageTableFormat1(1, new int[] { GID_A, GID_V }),
                new ValueRecord[] { new ValueRecord(1, 0, 0, 0), new ValueRecord(0, 0, 0, 9) });

        GlyphPositioningCollection positions = positions(GID_A, GID_V);
        assertTrue(raise.apply(context(positions), 0));
        assertTrue(perGlyph.apply(context(positions), 0));
        assertTrue(perGlyph.apply(context(positions), 1));
        assertFalse(raise.apply(context(positions), 1));
        assertEquals(11, positions.getXOffset(0));
        assertEquals(20, positions.getYOffset(0));
        assertEquals(ADVANCE + 30, positions.getXAdvance(0));
        assertEquals(9, positions.getYAdvance(1));
    }
}
