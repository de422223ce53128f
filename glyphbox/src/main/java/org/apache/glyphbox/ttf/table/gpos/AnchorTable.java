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

import org.apache.glyphbox.ttf.InvalidFontFileException;
import org.apache.glyphbox.ttf.TTFDataStream;

/**
 * This class models the
 * <a href="https://docs.microsoft.com/en-us/typography/opentype/spec/gpos#anchor-tables">Anchor
 * Table</a> in the GPOS table. Format 2 contour points and format 3 device tables are read but not
 * used, so every format resolves to its design-unit coordinates.
 */
public class AnchorTable
{
    private final int anchorFormat;
    private final int xCoordinate;
    private final int yCoordinate;

    public AnchorTable(int anchorFormat, int xCoordinate, int yCoordinate)
    {
        this.anchorFormat = anchorFormat;
        this.xCoordinate = xCoordinate;
        this.yCoordinate = yCoordinate;
    }

    /**
     * Reads an anchor table.
     *
     * @param data the font data
     * @param offset the absolute offset of the anchor table
     * @return the anchor table
     * @throws IOException if the data is truncated or the format is unknown
     */
    public static AnchorTable read(TTFDataStream data, long offset) throws IOException
    {
        data.seek(offset);
        int anchorFormat = data.readUnsignedShort();
        int xCoordinate = data.readSignedShort();
        int yCoordinate = data.readSignedShort();
        switch (anchorFormat)
        {
        case 1:
            break;
        case 2:
            // anchorPoint
            data.readUnsignedShort();
            break;
        case 3:
            // xDeviceOffset, yDeviceOffset
            data.readOffset16();
            data.readOffset16();
            break;
        default:
            throw InvalidFontFileException.invalidFormat("anchorFormat", anchorFormat,
                    "'1', '2' or '3'");
        }
        return new AnchorTable(anchorFormat, xCoordinate, yCoordinate);
    }

    /**
     * Reads an anchor table from an offset that may be NULL.
     *
     * @param data the font data
     * @param base the absolute offset the anchor offset is relative to
     * @param anchorOffset the anchor offset, 0 for none
     * @return the anchor table, or {@code null} for a NULL offset
     * @throws IOException if the data is truncated or the format is unknown
     */
    public static AnchorTable read(TTFDataStream data, long base, int anchorOffset)
            throws IOException
    {
        return anchorOffset == 0 ? null : read(data, base + anchorOffset);
    }

    public int getAnchorFormat()
    {
        return anchorFormat;
    }

    public int getXCoordinate()
    {
        return xCoordinate;
    }

    public int getYCoordinate()
    {
        return yCoordinate;
    }

    @Override
    public String toString()
    {
        return String.format("AnchorTable[anchorFormat=%d,x=%d,y=%d]", anchorFormat,
                xCoordinate, yCoordinate);
    }
}
