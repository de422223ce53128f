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

import java.io.IOException;

import org.apache.glyphbox.ttf.TTFDataStream;
import org.apache.glyphbox.ttf.shaping.GlyphPositioningCollection;

/**
 * This class models the
 * <a href="https://docs.microsoft.com/en-us/typography/opentype/spec/gpos#value-record">Value
 * Record</a> in the GPOS table. Only the fields named in the value format are present in the
 * font data; the device table offsets are skipped.
 */
public class ValueRecord
{
    public static final int X_PLACEMENT = 0x0001;
    public static final int Y_PLACEMENT = 0x0002;
    public static final int X_ADVANCE = 0x0004;
    public static final int Y_ADVANCE = 0x0008;
    public static final int X_PLACEMENT_DEVICE = 0x0010;
    public static final int Y_PLACEMENT_DEVICE = 0x0020;
    public static final int X_ADVANCE_DEVICE = 0x0040;
    public static final int Y_ADVANCE_DEVICE = 0x0080;

    public static final ValueRecord EMPTY = new ValueRecord(0, 0, 0, 0);

    private final int xPlacement;
    private final int yPlacement;
    private final int xAdvance;
    private final int yAdvance;

    public ValueRecord(int xPlacement, int yPlacement, int xAdvance, int yAdvance)
    {
        this.xPlacement = xPlacement;
        this.yPlacement = yPlacement;
        this.xAdvance = xAdvance;
        this.yAdvance = yAdvance;
    }

    /**
     * Returns the number of bytes a value record of the given format occupies in the font data.
     *
     * @param valueFormat the bit set of the fields present
     * @return the size in bytes
     */
    public static int size(int valueFormat)
    {
        return 2 * Integer.bitCount(valueFormat & 0xFF);
    }

    /**
     * Reads a value record at the current position of the stream.
     *
     * @param data the font data
     * @param valueFormat the bit set of the fields present
     * @return the value record
     * @throws IOException if the data is truncated
     */
    public static ValueRecord read(TTFDataStream data, int valueFormat) throws IOException
    {
        if (valueFormat == 0)
        {
            return EMPTY;
        }
        int xPlacement = (valueFormat & X_PLACEMENT) != 0 ? data.readSignedShort() : 0;
        int yPlacement = (valueFormat & Y_PLACEMENT) != 0 ? data.readSignedShort() : 0;
        int xAdvance = (valueFormat & X_ADVANCE) != 0 ? data.readSignedShort() : 0;
        int yAdvance = (valueFormat & Y_ADVANCE) != 0 ? data.readSignedShort() : 0;
        // device tables only matter for hinted rendering at specific ppem sizes
        for (int flag = X_PLACEMENT_DEVICE; flag <= Y_ADVANCE_DEVICE; flag <<= 1)
        {
            if ((valueFormat & flag) != 0)
            {
                data.readOffset16();
            }
        }
        return new ValueRecord(xPlacement, yPlacement, xAdvance, yAdvance);
    }

    /**
     * Adds this record to the placement and advance of a slot.
     *
     * @param positions the glyph positions
     * @param index the slot index
     */
    public void apply(GlyphPositioningCollection positions, int index)
    {
        positions.addOffset(index, xPlacement, yPlacement);
        positions.addAdvance(index, xAdvance, yAdvance);
    }

    public boolean isEmpty()
    {
        return xPlacement == 0 && yPlacement == 0 && xAdvance == 0 && yAdvance == 0;
    }

    public int getXPlacement()
    {
        return xPlacement;
    }

    public int getYPlacement()
    {
        return yPlacement;
    }

    public int getXAdvance()
    {
        return xAdvance;
    }

    public int getYAdvance()
    {
        return yAdvance;
    }

    @Override
    public String toString()
    {
        return String.format("ValueRecord[xPlacement=%d,yPlacement=%d,xAdvance=%d,yAdvance=%d]",
                xPlacement, yPlacement, xAdvance, yAdvance);
    }
}
