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

import java.util.EnumMap;
import java.util.Map;

/**
 * A class for mapping Unicode code points to OpenType script tags.
 *
 * @see <a href="https://docs.microsoft.com/en-us/typography/opentype/spec/scripttags">Microsoft Typography:
 * Script Tags</a>
 */
public final class OpenTypeScript
{
    public static final String INHERITED = "Inherited";
    public static final String UNKNOWN = "Unknown";
    public static final String TAG_DEFAULT = "DFLT";

    private static final Map<Character.UnicodeScript, String[]> UNICODE_SCRIPT_TO_OPENTYPE_TAG_MAP;

    static
    {
        Map<Character.UnicodeScript, String[]> map =
                new EnumMap<Character.UnicodeScript, String[]>(Character.UnicodeScript.class);
        map.put(Character.UnicodeScript.ARABIC, new String[] { "arab" });
        map.put(Character.UnicodeScript.ARMENIAN, new String[] { "armn" });
        map.put(Character.UnicodeScript.BENGALI, new String[] { "bng2", "beng" });
        map.put(Character.UnicodeScript.BOPOMOFO, new String[] { "bopo" });
        map.put(Character.UnicodeScript.CYRILLIC, new String[] { "cyrl" });
        map.put(Character.UnicodeScript.DEVANAGARI, new String[] { "dev2", "deva" });
        map.put(Character.UnicodeScript.ETHIOPIC, new String[] { "ethi" });
        map.put(Character.UnicodeScript.GEORGIAN, new String[] { "geor" });
        map.put(Character.UnicodeScript.GREEK, new String[] { "grek" });
        map.put(Character.UnicodeScript.GUJARATI, new String[] { "gjr2", "gujr" });
        map.put(Character.UnicodeScript.GURMUKHI, new String[] { "gur2", "guru" });
        map.put(Character.UnicodeScript.HAN, new String[] { "hani" });
        map.put(Character.UnicodeScript.HANGUL, new String[] { "hang" });
        map.put(Character.UnicodeScript.HEBREW, new String[] { "hebr" });
        map.put(Character.UnicodeScript.HIRAGANA, new String[] { "kana" });
        map.put(Character.UnicodeScript.KANNADA, new String[] { "knd2", "knda" });
        map.put(Character.UnicodeScript.KATAKANA, new String[] { "kana" });
        map.put(Character.UnicodeScript.KHMER, new String[] { "khmr" });
        map.put(Character.UnicodeScript.LAO, new String[] { "lao " });
        map.put(Character.UnicodeScript.LATIN, new String[] { "latn" });
        map.put(Character.UnicodeScript.MALAYALAM, new String[] { "mlm2", "mlym" });
        map.put(Character.UnicodeScript.MONGOLIAN, new String[] { "mong" });
        map.put(Character.UnicodeScript.MYANMAR, new String[] { "mym2", "mymr" });
        map.put(Character.UnicodeScript.NKO, new String[] { "nko " });
        map.put(Character.UnicodeScript.ORIYA, new String[] { "ory2", "orya" });
        map.put(Character.UnicodeScript.SINHALA, new String[] { "sinh" });
        map.put(Character.UnicodeScript.SYRIAC, new String[] { "syrc" });
        map.put(Character.UnicodeScript.TAMIL, new String[] { "tml2", "taml" });
        map.put(Character.UnicodeScript.TELUGU, new String[] { "tel2", "telu" });
        map.put(Character.UnicodeScript.THAANA, new String[] { "thaa" });
        map.put(Character.UnicodeScript.THAI, new String[] { "thai" });
        map.put(Character.UnicodeScript.TIBETAN, new String[] { "tibt" });
        map.put(Character.UnicodeScript.COMMON, new String[] { TAG_DEFAULT });
        map.put(Character.UnicodeScript.INHERITED, new String[] { INHERITED });
        map.put(Character.UnicodeScript.UNKNOWN, new String[] { TAG_DEFAULT });
        UNICODE_SCRIPT_TO_OPENTYPE_TAG_MAP = map;
    }

    private OpenTypeScript()
    {
    }

    /**
     * Obtain the OpenType script tags associated with the given code point. Scripts with two
     * generations of shaping (the Indic scripts) return the newer tag first.
     *
     * @param codePoint the Unicode code point
     * @return the script tags, never empty
     * @throws IllegalArgumentException if the code point is not valid
     */
    public static String[] getScriptTags(int codePoint)
    {
        if (!Character.isValidCodePoint(codePoint))
        {
            throw new IllegalArgumentException("Invalid codepoint: " + codePoint);
        }
        Character.UnicodeScript unicodeScript = Character.UnicodeScript.of(codePoint);
        String[] tags = UNICODE_SCRIPT_TO_OPENTYPE_TAG_MAP.get(unicodeScript);
        if (tags == null)
        {
            return new String[] { TAG_DEFAULT };
        }
        return tags.clone();
    }
}
