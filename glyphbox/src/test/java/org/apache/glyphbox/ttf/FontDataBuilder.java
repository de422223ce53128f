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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Assembles big-endian font data for tests. Offsets are written as placeholders and patched once
 * the target position is known, so fixtures read like the table layouts they encode.
 */
public class FontDataBuilder
{
    private byte[] data = new byte[64];
    private int size = 0;

    public int position()
    {
        return size;
    }

    public FontDataBuilder uint8(int value)
    {
        ensureCapacity(1);
        data[size++] = (byte) value;
        return this;
    }

    public FontDataBuilder uint16(int... values)
    {
        for (int value : values)
        {
            uint8(value >> 8);
            uint8(value);
        }
        return this;
    }

    public FontDataBuilder int16(int value)
    {
        return uint16(value & 0xFFFF);
    }

    public FontDataBuilder uint32(long value)
    {
        uint16((int) (value >>> 16) & 0xFFFF);
        return uint16((int) value & 0xFFFF);
    }

    public FontDataBuilder tag(String tag)
    {
        for (byte b : tag.getBytes(StandardCharsets.ISO_8859_1))
        {
            uint8(b);
        }
        return this;
    }

    /**
     * Writes a zero Offset16 and returns its position, for {@link #patchOffset16(int, int)}.
     */
    public int offset16()
    {
        int position = size;
        uint16(0);
        return position;
    }

    public int offset32()
    {
        int position = size;
        uint32(0);
        return position;
    }

    /**
     * Points the placeholder at {@code placeholder} to the current position, relative to
     * {@code base}.
     */
    public FontDataBuilder patchOffset16(int placeholder, int base)
    {
        int value = size - base;
        data[placeholder] = (byte) (value >> 8);
        data[placeholder + 1] = (byte) value;
        return this;
    }

    public FontDataBuilder patchOffset32(int placeholder, int base)
    {
        long value = size - base;
        data[placeholder] = (byte) (value >>> 24);
        data[placeholder + 1] = (byte) (value >>> 16);
        data[placeholder + 2] = (byte) (value >>> 8);
        data[placeholder + 3] = (byte) value;
        return this;
    }

    /**
     * Writes a coverage table of format 1 at the current position.
     */
    public FontDataBuilder coverage(int... glyphIds)
    {
        uint16(1, glyphIds.length);
        return uint16(glyphIds);
    }

    /**
     * Writes a coverage table of format 2 with one range.
     */
    public FontDataBuilder coverageRange(int startGlyphID, int endGlyphID)
    {
        return uint16(2, 1, startGlyphID, endGlyphID, 0);
    }

    /**
     * Writes a class definition table of format 1.
     */
    public FontDataBuilder classDef(int startGlyphID, int... classValues)
    {
        uint16(1, startGlyphID, classValues.length);
        return uint16(classValues);
    }

    public byte[] toByteArray()
    {
        return Arrays.copyOf(data, size);
    }

    public MemoryTTFDataStream toStream()
    {
        return new MemoryTTFDataStream(toByteArray());
    }

    private void ensureCapacity(int extra)
    {
        if (size + extra > data.length)
        {
            data = Arrays.copyOf(data, Math.max(data.length * 2, size + extra));
        }
    }
}
