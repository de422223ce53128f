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
 * A SequenceRule (format 1) or ClassSequenceRule (format 2). The input sequence excludes the first
 * glyph, which is matched through the coverage table; depending on the format the values are
 * glyph ids or class values.
 */
public class SequenceRuleTable
{
    private final int[] inputSequence;
    private final SequenceLookupRecord[] seqLookupRecords;

    public SequenceRuleTable(int[] inputSequence, SequenceLookupRecord[] seqLookupRecords)
    {
        this.inputSequence = inputSequence;
        this.seqLookupRecords = seqLookupRecords;
    }

    public int[] getInputSequence()
    {
        return inputSequence;
    }

    public SequenceLookupRecord[] getSeqLookupRecords()
    {
        return seqLookupRecords;
    }
}
