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

import java.io.IOException;

import org.apache.glyphbox.ttf.InvalidFontFileException;
import org.apache.glyphbox.ttf.TTFDataStream;

/**
 * This class models the
 * <a href="https://docs.microsoft.com/en-us/typography/opentype/spec/chapter2#class-definition-table">Class
 * Definition table</a> in the Open Type layout common tables. Any glyph not assigned to a class
 * belongs to class 0.
 */
public abstract class ClassDefinitionTable
{
    private final int classFormat;

    protected ClassDefinitionTable(int classFormat)
    {
        this.classFormat = classFormat;
    }

    /**
     * Reads a class definition table of either format.
     *
     * @param data the font data
     * @param offset the absolute offset of the class definition table
     * @return the class definition table
     * @throws IOException if the data is truncated or the format is unknown
     */
    public static ClassDefinitionTable read(TTFDataStream data, long offset) throws IOException
    {
        data.seek(offset);
        int classFormat = data.readUnsignedShort();
        switch (classFormat)
        {
        case 1:
        {
            int startGlyphID = data.readUnsignedShort();
            int glyphCount = data.readUnsignedShort();
            int[] classValueArray = data.readUnsignedShortArray(glyphCount);
            return new ClassDefinitionTableFormat1(classFormat, startGlyphID, classValueArray);
        }
        case 2:
        {
            int classRangeCount = data.readUnsignedShort();
            data.requireAvailable(6L * classRangeCount,
                    "ClassRangeRecord[" + classRangeCount + "]");
            ClassRangeRecord[] classRangeRecords = new ClassRangeRecord[classRangeCount];
            for (int i = 0; i < classRangeCount; i++)
            {
                int startGlyphID = data.readUnsignedShort();
                int endGlyphID = data.readUnsignedShort();
                int classValue = data.readUnsignedShort();
                classRangeRecords[i] = new ClassRangeRecord(startGlyphID, endGlyphID, classValue);
            }
            return new ClassDefinitionTableFormat2(classFormat, classRangeRecords);
        }
        default:
            throw InvalidFontFileException.invalidFormat("classFormat", classFormat,
                    "'1' or '2'");
        }
    }

    /**
     * Returns the class of the given glyph.
     *
     * @param gid the glyph id
     * @return the class value, 0 if the glyph is not assigned to a class
     */
    public abstract int getClassIndex(int gid);

    /**
     * Returns the highest class value assigned by this table.
     *
     * @return the highest class value, 0 if no glyph is assigned to a class
     */
    public abstract int getMaxClassIndex();

    public int getClassFormat()
    {
        return classFormat;
    }
}
