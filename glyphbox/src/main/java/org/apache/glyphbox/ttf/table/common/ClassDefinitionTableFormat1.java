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

/**
 * Class definition format 1: a contiguous run of glyphs starting at {@code startGlyphID}, with
 * one class value per glyph.
 */
public class ClassDefinitionTableFormat1 extends ClassDefinitionTable
{
    private final int startGlyphID;
    private final int[] classValueArray;

    public ClassDefinitionTableFormat1(int classFormat, int startGlyphID, int[] classValueArray)
    {
        super(classFormat);
        this.startGlyphID = startGlyphID;
        this.classValueArray = classValueArray;
    }

    @Override
    public int getClassIndex(int gid)
    {
        int index = gid - startGlyphID;
        if (index < 0 || index >= classValueArray.length)
        {
            return 0;
        }
        return classValueArray[index];
    }

    @Override
    public int getMaxClassIndex()
    {
        int max = 0;
        for (int classValue : classValueArray)
        {
            max = Math.max(max, classValue);
        }
        return max;
    }

    @Override
    public String toString()
    {
        return String.format("ClassDefinitionTableFormat1[startGlyphID=%d,glyphCount=%d]",
                startGlyphID, classValueArray.length);
    }
}
