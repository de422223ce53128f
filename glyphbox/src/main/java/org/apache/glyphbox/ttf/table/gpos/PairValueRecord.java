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

/**
 * A pair value record of a PairSet table: the second glyph of the pair and the adjustments of
 * both glyphs.
 */
public class PairValueRecord
{
    private final int secondGlyph;
    private final ValueRecord valueRecord1;
    private final ValueRecord valueRecord2;

    public PairValueRecord(int secondGlyph, ValueRecord valueRecord1, ValueRecord valueRecord2)
    {
        this.secondGlyph = secondGlyph;
        this.valueRecord1 = valueRecord1;
        this.valueRecord2 = valueRecord2;
    }

    public int getSecondGlyph()
    {
        return secondGlyph;
    }

    public ValueRecord getValueRecord1()
    {
        return valueRecord1;
    }

    public ValueRecord getValueRecord2()
    {
        return valueRecord2;
    }

    @Override
    public String toString()
    {
        return String.format("PairValueRecord[secondGlyph=%d,valueRecord1=%s,valueRecord2=%s]",
                secondGlyph, valueRecord1, valueRecord2);
    }
}
