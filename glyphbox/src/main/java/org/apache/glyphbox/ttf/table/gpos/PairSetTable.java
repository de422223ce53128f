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
 * The pair value records of one first glyph, ordered by the glyph id of the second glyph.
 */
public class PairSetTable
{
    private final PairValueRecord[] pairValueRecords;

    public PairSetTable(PairValueRecord[] pairValueRecords)
    {
        this.pairValueRecords = pairValueRecords;
    }

    /**
     * Finds the record for the given second glyph.
     *
     * @param secondGlyph the glyph id of the second glyph
     * @return the record, or {@code null} if the pair is not adjusted
     */
    public PairValueRecord getPairValueRecord(int secondGlyph)
    {
        int low = 0;
        int high = pairValueRecords.length - 1;
        while (low <= high)
        {
            int mid = (low + high) >>> 1;
            int gid = pairValueRecords[mid].getSecondGlyph();
            if (secondGlyph < gid)
            {
                high = mid - 1;
            }
            else if (secondGlyph > gid)
            {
                low = mid + 1;
            }
            else
            {
                return pairValueRecords[mid];
            }
        }
        return null;
    }

    public PairValueRecord[] getPairValueRecords()
    {
        return pairValueRecords;
    }

    @Override
    public String toString()
    {
        return String.format("PairSetTable[pairValueCount=%d]", pairValueRecords.length);
    }
}
