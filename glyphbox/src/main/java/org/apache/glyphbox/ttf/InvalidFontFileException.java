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

/**
 * Thrown when font data is structurally invalid: a format identifier outside of the values the
 * OpenType specification enumerates, a lookup index that points outside the lookup list, or
 * lookups that reference each other deeper than the nesting limit.
 */
public class InvalidFontFileException extends IOException
{
    private static final long serialVersionUID = 1L;

    public InvalidFontFileException(String message)
    {
        super(message);
    }

    /**
     * Creates an exception for an unexpected format identifier.
     *
     * @param field the name of the format field, e.g. "substFormat"
     * @param value the value found in the font
     * @param expected a description of the allowed values, e.g. "1 or 2"
     * @return the exception
     */
    public static InvalidFontFileException invalidFormat(String field, int value, String expected)
    {
        return new InvalidFontFileException("Invalid value for '" + field + "' " + value
                + ". Should be " + expected + ".");
    }
}
