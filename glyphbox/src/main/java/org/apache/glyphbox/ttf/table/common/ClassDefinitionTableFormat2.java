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
 * Class definition format 2: sorted, non-overlapping glyph ranges, each mapped to one class.
 */
public class ClassDefinitionTableFormat2 extends ClassDefinitionTable
{
    private final ClassRangeRecord[] classRangeRecords;

    public ClassDefinitionTableFormat2(int classFormat, ClassRangeRecord[] classRangeRecords)
    {
        super(classFormat);
        this.classRangeRecords = classRangeRecords;
    }

    @Override
    public int getClassIndex(int gid)
    {
        int low = 0;
        int high = classRangeRecords.length - 1;
        while (low <= high)
        {
            int mid = (low + high) >>> 1;
            ClassRangeRecord classRangeRecord = classRangeRecords[mid];
            if (gid < classRangeRecord.getStartGlyphID())
            {
                high = mid - 1;
            }
            else if (gid > classRangeRecord.getEndGlyphID())
            {
                low = mid + 1;
            }
            else
            {
                return classRangeRecord.getClassValue();
            }
        }
        return 0;
    }

    @Override
    public int getMaxClassIndex()
    {
        int max = 0;
        for (ClassRangeRecord classRangeRecord : classRangeRecords)
        {
            max = Math.max(max, classRangeRecord.getClassValue());
        }
        return max;
    }

    public ClassRangeRecord[] getClassRangeRecords()
    {
        return classRangeRecords;
    }

    @Override
    public String toString()
    {
        return String.format("ClassDefinitionTableFormat2[classRangeCount=%d]",
                classRangeRecords.length);
    }
}
