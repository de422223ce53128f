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

import java.io.IOException;

import org.apache.glyphbox.ttf.table.common.ClassDefinitionTable;

/**
 * The glyph definition 'GDEF' table of an OpenType font. Only the glyph class definition and the
 * mark attachment class definition are read; mark attachment positioning uses them to tell
 * marks from base glyphs.
 */
public class GlyphDefinitionTable extends TTFTable
{
    public static final String TAG = "GDEF";

    public static final int GLYPH_CLASS_BASE = 1;
    public static final int GLYPH_CLASS_LIGATURE = 2;
    public static final int GLYPH_CLASS_MARK = 3;
    public static final int GLYPH_CLASS_COMPONENT = 4;

    private ClassDefinitionTable glyphClassDef;
    private ClassDefinitionTable markAttachClassDef;

    public GlyphDefinitionTable()
    {
        setTag(TAG);
    }

    @Override
    public void read(TTFDataStream data) throws IOException
    {
        long start = getOffset();
        data.seek(start);
        int majorVersion = data.readUnsignedShort();
        int minorVersion = data.readUnsignedShort();
        if (majorVersion != 1)
        {
            throw InvalidFontFileException.invalidFormat("majorVersion", majorVersion, "'1'");
        }
        int glyphClassDefOffset = data.readOffset16();
        @SuppressWarnings("unused")
        int attachListOffset = data.readOffset16();
        @SuppressWarnings("unused")
        int ligCaretListOffset = data.readOffset16();
        int markAttachClassDefOffset = data.readOffset16();
        if (minorVersion >= 2)
        {
            @SuppressWarnings("unused")
            int markGlyphSetsDefOffset = data.readOffset16();
        }
        if (glyphClassDefOffset != 0)
        {
            glyphClassDef = ClassDefinitionTable.read(data, start + glyphClassDefOffset);
        }
        if (markAttachClassDefOffset != 0)
        {
            markAttachClassDef = ClassDefinitionTable.read(data, start + markAttachClassDefOffset);
        }
        initialized = true;
    }

    /**
     * @param gid the glyph id
     * @return the glyph class (1 base, 2 ligature, 3 mark, 4 component) or 0 if unknown
     */
    public int getGlyphClass(int gid)
    {
        return glyphClassDef == null ? 0 : glyphClassDef.getClassIndex(gid);
    }

    public boolean isMarkGlyph(int gid)
    {
        return getGlyphClass(gid) == GLYPH_CLASS_MARK;
    }

    public boolean hasGlyphClassDefinitions()
    {
        return glyphClassDef != null;
    }

    /**
     * @param gid the glyph id
     * @return the mark attachment class, 0 if none
     */
    public int getMarkAttachmentClass(int gid)
    {
        return markAttachClassDef == null ? 0 : markAttachClassDef.getClassIndex(gid);
    }
}
