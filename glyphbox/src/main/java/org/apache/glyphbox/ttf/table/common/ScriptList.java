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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.glyphbox.ttf.TTFDataStream;

/**
 * This class models the
 * <a href="https://docs.microsoft.com/en-us/typography/opentype/spec/chapter2#script-list-table-and-script-record">Script
 * List table</a> in the Open Type layout common tables.
 */
public class ScriptList
{
    private final Map<String, ScriptTable> scriptTables;

    public ScriptList(LinkedHashMap<String, ScriptTable> scriptTables)
    {
        this.scriptTables = Collections.unmodifiableMap(scriptTables);
    }

    public static ScriptList read(TTFDataStream data, long offset) throws IOException
    {
        data.seek(offset);
        int scriptCount = data.readUnsignedShort();
        data.requireAvailable(6L * scriptCount, "ScriptRecord[" + scriptCount + "]");
        String[] scriptTags = new String[scriptCount];
        int[] scriptOffsets = new int[scriptCount];
        for (int i = 0; i < scriptCount; i++)
        {
            scriptTags[i] = data.readTag();
            scriptOffsets[i] = data.readOffset16();
        }
        LinkedHashMap<String, ScriptTable> resultScriptList =
                new LinkedHashMap<String, ScriptTable>(scriptCount);
        for (int i = 0; i < scriptCount; i++)
        {
            resultScriptList.put(scriptTags[i], readScriptTable(data, offset + scriptOffsets[i]));
        }
        return new ScriptList(resultScriptList);
    }

    static ScriptTable readScriptTable(TTFDataStream data, long offset) throws IOException
    {
        data.seek(offset);
        int defaultLangSys = data.readOffset16();
        int langSysCount = data.readUnsignedShort();
        data.requireAvailable(6L * langSysCount, "LangSysRecord[" + langSysCount + "]");
        String[] langSysTags = new String[langSysCount];
        int[] langSysOffsets = new int[langSysCount];
        String prevLangSysTag = "";
        for (int i = 0; i < langSysCount; i++)
        {
            String langSysTag = data.readTag();
            if (i > 0 && langSysTag.compareTo(prevLangSysTag) <= 0)
            {
                // catch corrupt file
                // https://docs.microsoft.com/en-us/typography/opentype/spec/chapter2#slTbl_sRec
                throw new IOException("LangSysRecords not alphabetically sorted by LangSys tag: " +
                          langSysTag + " <= " + prevLangSysTag);
            }
            langSysOffsets[i] = data.readOffset16();
            langSysTags[i] = langSysTag;
            prevLangSysTag = langSysTag;
        }
        LangSysTable defaultLangSysTable = null;
        if (defaultLangSys != 0)
        {
            defaultLangSysTable = readLangSysTable(data, offset + defaultLangSys);
        }
        LinkedHashMap<String, LangSysTable> langSysTables =
                new LinkedHashMap<String, LangSysTable>(langSysCount);
        for (int i = 0; i < langSysCount; i++)
        {
            langSysTables.put(langSysTags[i], readLangSysTable(data, offset + langSysOffsets[i]));
        }
        return new ScriptTable(defaultLangSysTable, langSysTables);
    }

    static LangSysTable readLangSysTable(TTFDataStream data, long offset) throws IOException
    {
        data.seek(offset);
        @SuppressWarnings("unused")
        int lookupOrder = data.readOffset16();
        int requiredFeatureIndex = data.readUnsignedShort();
        int featureIndexCount = data.readUnsignedShort();
        int[] featureIndices = data.readUnsignedShortArray(featureIndexCount);
        return new LangSysTable(requiredFeatureIndex, featureIndices);
    }

    /**
     * @param scriptTag the script tag
     * @return the script table, or {@code null} if the script is not supported
     */
    public ScriptTable getScriptTable(String scriptTag)
    {
        return scriptTables.get(scriptTag);
    }

    public boolean containsScript(String scriptTag)
    {
        return scriptTables.containsKey(scriptTag);
    }

    /**
     * @return the script tables in the order of the font's script records
     */
    public Map<String, ScriptTable> getScriptTables()
    {
        return scriptTables;
    }
}
