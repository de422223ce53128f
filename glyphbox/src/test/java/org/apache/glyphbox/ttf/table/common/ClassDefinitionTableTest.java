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

import java.io.IOException;

import org.apache.glyphbox.ttf.FontDataBuilder;
import org.apache.glyphbox.ttf.InvalidFontFileException;
import org.apache.glyphbox.ttf.MalformedFontException;
import org.junit.jupiter.api.Test;

class ClassDefinitionTableTest
{
    @Test
    void testFormat1() throws IOException
    {
        ClassDefinitionTable classDef = ClassDefinitionTable.read(
                new FontDataBuilder().classDef(10, 1, 2, 0, 3).toStream(), 0);
        assertEquals(1, classDef.getClassFormat());
        assertEquals(1, classDef.getClassIndex(10));
        assertEquals(2, classDef.getClassIndex(11));
        assertEquals(0, classDef.getClassIndex(12));
        assertEquals(3, classDef.getClassIndex(13));
        assertEquals(0, classDef.getClassIndex(9));
        assertEquals(0, classDef.getClassIndex(14));
    }

    @Test
    void testFormat2() throws IOException
    {
        ClassDefinitionTable classDef = ClassDefinitionTable.read(
                new FontDataBuilder().uint16(2, 2, 5, 8, 4, 100, 100, 1).toStream(), 0);
        assertEquals(2, classDef.getClassFormat());
        assertEquals(4, classDef.getClassIndex(5));
        assertEquals(4, classDef.getClassIndex(8));
        assertEquals(1, classDef.getClassIndex(100));
        assertEquals(0, classDef.getClassIndex(9));
        assertEquals(0, classDef.getClassIndex(0));
    }

    @Test
    void testUnknownFormat()
    {
        assertThrows(InvalidFontFileException.class, () -> ClassDefinitionTable.read(
                new FontDataBuilder().uint16(0, 0, 0).toStream(), 0));
    }

    @Test
    void testTruncatedRangeRecords()
    {
        // claims 3 ranges but holds one
        assertThrows(MalformedFontException.class, () -> ClassDefinitionTable.read(
                new FontDataBuilder().uint16(2, 3, 1, 2, 1).toStream(), 0));
    }
}
