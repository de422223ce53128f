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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.IOException;

import org.junit.jupiter.api.Test;

class MemoryTTFDataStreamTest
{
    @Test
    void testReadBigEndianValues() throws IOException
    {
        byte[] bytes = new FontDataBuilder()
                .uint16(0x0102)
                .int16(-2)
                .uint32(0xFFFFFFFEL)
                .tag("GSUB")
                .toByteArray();
        MemoryTTFDataStream data = new MemoryTTFDataStream(bytes);
        assertEquals(0x0102, data.readUnsignedShort());
        assertEquals(-2, data.readSignedShort());
        assertEquals(0xFFFFFFFEL, data.readUnsignedInt());
        assertEquals("GSUB", data.readTag());
        assertEquals(12, data.getCurrentPosition());
    }

    @Test
    void testSeekIsAbsolute() throws IOException
    {
        MemoryTTFDataStream data = new FontDataBuilder().uint16(1, 2, 3, 4).toStream();
        data.seek(6);
        assertEquals(4, data.readUnsignedShort());
        data.seek(2);
        assertEquals(2, data.readUnsignedShort());
        assertEquals(8, data.getOriginalDataSize());
    }

    @Test
    void testReadPastEndFails() throws IOException
    {
        MemoryTTFDataStream data = new FontDataBuilder().uint16(1, 2, 3).toStream();
        data.seek(4);
        MalformedFontException ex = assertThrows(MalformedFontException.class,
                data::readUnsignedInt);
        assertTrue(ex.getMessage().contains("offset 4"), ex.getMessage());
        // the failed read consumed nothing
        assertEquals(4, data.getCurrentPosition());
        assertEquals(3, data.readUnsignedShort());
    }

    @Test
    void testSeekOutsideDataFails()
    {
        MemoryTTFDataStream data = new MemoryTTFDataStream(new byte[4]);
        assertThrows(MalformedFontException.class, () -> data.seek(5));
        assertThrows(MalformedFontException.class, () -> data.seek(-1));
    }

    @Test
    void testArrayLongerThanDataFails() throws IOException
    {
        MemoryTTFDataStream data = new FontDataBuilder().uint16(1, 2).toStream();
        assertThrows(MalformedFontException.class, () -> data.readUnsignedShortArray(3));
        assertEquals(2, data.readUnsignedShortArray(2)[1]);
    }

    @Test
    void testReadFromInputStream() throws IOException
    {
        byte[] bytes = new FontDataBuilder().uint16(7, 8).toByteArray();
        MemoryTTFDataStream data = new MemoryTTFDataStream(new ByteArrayInputStream(bytes));
        data.seek(2);
        assertEquals(8, data.readUnsignedShort());
    }
}
