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

package org.apache.glyphbox.ttf.table.gsub;

import java.util.Arrays;

/**
 * A Ligature table: the ligature glyph and the components following the first, covered glyph.
 */
public class LigatureTable
{
    private final int ligatureGlyph;
    private final int[] componentGlyphIDs;

    public LigatureTable(int ligatureGlyph, int[] componentGlyphIDs)
    {
        this.ligatureGlyph = ligatureGlyph;
        this.componentGlyphIDs = componentGlyphIDs;
    }

    public int getLigatureGlyph()
    {
        return ligatureGlyph;
    }

    /**
     * @return the component glyph ids, starting with the second component
     */
    public int[] getComponentGlyphIDs()
    {
        return componentGlyphIDs;
    }

    /**
     * @return the number of components including the first glyph
     */
    public int getComponentCount()
    {
        return componentGlyphIDs.length + 1;
    }

    @Override
    public String toString()
    {
        return String.format("LigatureTable[ligatureGlyph=%d,componentGlyphIDs=%s]",
                ligatureGlyph, Arrays.toString(componentGlyphIDs));
    }
}
