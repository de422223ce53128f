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

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.glyphbox.ttf.shaping.GlyphSubstitutionCollection;
import org.apache.glyphbox.ttf.table.common.CoverageTable;
import org.apache.glyphbox.ttf.table.common.LookupSubTable;
import org.apache.glyphbox.ttf.table.common.SequenceContextReader;
import org.apache.glyphbox.ttf.table.gsub.LigatureSetTable;
import org.apache.glyphbox.ttf.table.gsub.LigatureTable;
import org.apache.glyphbox.ttf.table.gsub.LookupTypeAlternateSubstitutionFormat1;
import org.apache.glyphbox.ttf.table.gsub.LookupTypeLigatureSubstitutionFormat1;
import org.apache.glyphbox.ttf.table.gsub.LookupTypeMultipleSubstitutionFormat1;
import org.apache.glyphbox.ttf.table.gsub.LookupTypeReverseChainSingleSubstFormat1;
import org.apache.glyphbox.ttf.table.gsub.LookupTypeSingleSubstFormat1;
import org.apache.glyphbox.ttf.table.gsub.LookupTypeSingleSubstFormat2;
import org.apache.glyphbox.ttf.table.gsub.SequenceTable;

/**
 * A glyph substitution 'GSUB' table in a TrueType or OpenType font.
 */
public class GlyphSubstitutionTable extends AdvancedTypographicTable<GlyphSubstitutionCollection>
{
    private static final Log LOG = LogFactory.getLog(GlyphSubstitutionTable.class);

    public static final String TAG = "GSUB";

    public static final int LOOKUP_TYPE_SINGLE = 1;
    public static final int LOOKUP_TYPE_MULTIPLE = 2;
    public static final int LOOKUP_TYPE_ALTERNATE = 3;
    public static final int LOOKUP_TYPE_LIGATURE = 4;
    public static final int LOOKUP_TYPE_CONTEXT = 5;
    public static final int LOOKUP_TYPE_CHAINED_CONTEXT = 6;
    public static final int LOOKUP_TYPE_EXTENSION = 7;
    public static final int LOOKUP_TYPE_REVERSE_CHAINED_SINGLE = 8;

    public GlyphSubstitutionTable()
    {
        setTag(TAG);
    }

    @Override
    protected int getExtensionLookupType()
    {
        return LOOKUP_TYPE_EXTENSION;
    }

    @Override
    protected LookupSubTable<GlyphSubstitutionCollection> readLookupSubtable(TTFDataStream data,
            long offset, int lookupType) throws IOException
    {
        switch (lookupType)
        {
            case LOOKUP_TYPE_SINGLE:
                // Single Substitution Subtable
                // https://docs.microsoft.com/en-us/typography/opentype/spec/gsub#SS
                return readSingleLookupSubTable(data, offset);
            case LOOKUP_TYPE_MULTIPLE:
                // Multiple Substitution Subtable
                // https://learn.microsoft.com/en-us/typography/opentype/spec/gsub#lookuptype-2-multiple-substitution-subtable
                return readMultipleSubstitutionSubtable(data, offset);
            case LOOKUP_TYPE_ALTERNATE:
                // Alternate Substitution Subtable
                // https://docs.microsoft.com/en-us/typography/opentype/spec/gsub#AS
                return readAlternateSubstitutionSubtable(data, offset);
            case LOOKUP_TYPE_LIGATURE:
                // Ligature Substitution Subtable
                // https://docs.microsoft.com/en-us/typography/opentype/spec/gsub#LS
                return readLigatureSubstitutionSubtable(data, offset);
            case LOOKUP_TYPE_CONTEXT:
                // Contextual Substitution Subtable
                // https://docs.microsoft.com/en-us/typography/opentype/spec/gsub#CS
                return SequenceContextReader.readSequenceContext(data, offset);
            case LOOKUP_TYPE_CHAINED_CONTEXT:
                // Chained Contexts Substitution Subtable
                // https://learn.microsoft.com/en-us/typography/opentype/spec/gsub#lookuptype-6-chained-contexts-substitution-subtable
                return SequenceContextReader.readChainedSequenceContext(data, offset);
            case LOOKUP_TYPE_REVERSE_CHAINED_SINGLE:
                // Reverse Chaining Contextual Single Substitution Subtable
                // https://docs.microsoft.com/en-us/typography/opentype/spec/gsub#RCCS
                return readReverseChainSingleSubstitutionSubtable(data, offset);
            default:
                // Other lookup types are not supported
                LOG.debug("Type " + lookupType
                        + " GSUB lookup table is not supported and will be ignored");
                return null;
        }
    }

    private LookupSubTable<GlyphSubstitutionCollection> readSingleLookupSubTable(
            TTFDataStream data, long offset) throws IOException
    {
        data.seek(offset);
        int substFormat = data.readUnsignedShort();
        switch (substFormat)
        {
        case 1:
        {
            // LookupType 1: Single Substitution Subtable
            // https://docs.microsoft.com/en-us/typography/opentype/spec/gsub#11-single-substitution-format-1
            int coverageOffset = data.readOffset16();
            short deltaGlyphID = data.readSignedShort();
            CoverageTable coverageTable = CoverageTable.read(data, offset + coverageOffset);
            return new LookupTypeSingleSubstFormat1(substFormat, coverageTable, deltaGlyphID);
        }
        case 2:
        {
            // Single Substitution Format 2
            // https://docs.microsoft.com/en-us/typography/opentype/spec/gsub#12-single-substitution-format-2
            int coverageOffset = data.readOffset16();
            int glyphCount = data.readUnsignedShort();
            int[] substituteGlyphIDs = data.readUnsignedShortArray(glyphCount);
            CoverageTable coverageTable = CoverageTable.read(data, offset + coverageOffset);
            return new LookupTypeSingleSubstFormat2(substFormat, coverageTable, substituteGlyphIDs);
        }
        default:
            throw InvalidFontFileException.invalidFormat("substFormat", substFormat,
                    "'1' or '2'");
        }
    }

    private LookupSubTable<GlyphSubstitutionCollection> readMultipleSubstitutionSubtable(
            TTFDataStream data, long offset) throws IOException
    {
        data.seek(offset);
        int substFormat = data.readUnsignedShort();
        if (substFormat != 1)
        {
            throw InvalidFontFileException.invalidFormat("substFormat", substFormat, "'1'");
        }

        int coverageOffset = data.readOffset16();
        int sequenceCount = data.readUnsignedShort();
        int[] sequenceOffsets = data.readUnsignedShortArray(sequenceCount);

        CoverageTable coverageTable = CoverageTable.read(data, offset + coverageOffset);
        if (sequenceCount != coverageTable.getSize())
        {
            throw new InvalidFontFileException("According to the OpenType specification, the "
                    + "coverage count (" + coverageTable.getSize()
                    + ") should be equal to the number of SequenceTables (" + sequenceCount + ")");
        }

        SequenceTable[] sequenceTables = new SequenceTable[sequenceCount];
        for (int i = 0; i < sequenceCount; i++)
        {
            data.seek(offset + sequenceOffsets[i]);
            int glyphCount = data.readUnsignedShort();
            int[] substituteGlyphIDs = data.readUnsignedShortArray(glyphCount);
            sequenceTables[i] = new SequenceTable(glyphCount, substituteGlyphIDs);
        }

        return new LookupTypeMultipleSubstitutionFormat1(substFormat, coverageTable,
                sequenceTables);
    }

    private LookupSubTable<GlyphSubstitutionCollection> readAlternateSubstitutionSubtable(
            TTFDataStream data, long offset) throws IOException
    {
        data.seek(offset);
        int substFormat = data.readUnsignedShort();
        if (substFormat != 1)
        {
            throw InvalidFontFileException.invalidFormat("substFormat", substFormat, "'1'");
        }

        int coverageOffset = data.readOffset16();
        int alternateSetCount = data.readUnsignedShort();
        int[] alternateSetOffsets = data.readUnsignedShortArray(alternateSetCount);

        int[][] alternateSets = new int[alternateSetCount][];
        for (int i = 0; i < alternateSetCount; i++)
        {
            data.seek(offset + alternateSetOffsets[i]);
            int glyphCount = data.readUnsignedShort();
            alternateSets[i] = data.readUnsignedShortArray(glyphCount);
        }
        CoverageTable coverageTable = CoverageTable.read(data, offset + coverageOffset);
        return new LookupTypeAlternateSubstitutionFormat1(substFormat, coverageTable,
                alternateSets);
    }

    private LookupSubTable<GlyphSubstitutionCollection> readLigatureSubstitutionSubtable(
            TTFDataStream data, long offset) throws IOException
    {
        data.seek(offset);
        int substFormat = data.readUnsignedShort();
        if (substFormat != 1)
        {
            throw InvalidFontFileException.invalidFormat("substFormat", substFormat, "'1'");
        }

        int coverageOffset = data.readOffset16();
        int ligatureSetCount = data.readUnsignedShort();
        int[] ligatureSetOffsets = data.readUnsignedShortArray(ligatureSetCount);

        LigatureSetTable[] ligatureSetTables = new LigatureSetTable[ligatureSetCount];
        for (int i = 0; i < ligatureSetCount; i++)
        {
            // ligature offsets are relative to the start of their LigatureSet table
            long ligatureSetOffset = offset + ligatureSetOffsets[i];
            data.seek(ligatureSetOffset);
            int ligatureCount = data.readUnsignedShort();
            int[] ligatureOffsets = data.readUnsignedShortArray(ligatureCount);
            LigatureTable[] ligatureTables = new LigatureTable[ligatureCount];
            for (int j = 0; j < ligatureCount; j++)
            {
                data.seek(ligatureSetOffset + ligatureOffsets[j]);
                int ligatureGlyph = data.readUnsignedShort();
                int componentCount = data.readUnsignedShort();
                if (componentCount == 0)
                {
                    throw new InvalidFontFileException("Ligature " + ligatureGlyph
                            + " has a componentCount of 0");
                }
                int[] componentGlyphIDs = data.readUnsignedShortArray(componentCount - 1);
                ligatureTables[j] = new LigatureTable(ligatureGlyph, componentGlyphIDs);
            }
            ligatureSetTables[i] = new LigatureSetTable(ligatureTables);
        }
        CoverageTable coverageTable = CoverageTable.read(data, offset + coverageOffset);
        return new LookupTypeLigatureSubstitutionFormat1(substFormat, coverageTable,
                ligatureSetTables);
    }

    private LookupSubTable<GlyphSubstitutionCollection> readReverseChainSingleSubstitutionSubtable(
            TTFDataStream data, long offset) throws IOException
    {
        data.seek(offset);
        int substFormat = data.readUnsignedShort();
        if (substFormat != 1)
        {
            throw InvalidFontFileException.invalidFormat("substFormat", substFormat, "'1'");
        }

        int coverageOffset = data.readOffset16();
        int backtrackGlyphCount = data.readUnsignedShort();
        int[] backtrackCoverageOffsets = data.readUnsignedShortArray(backtrackGlyphCount);
        int lookaheadGlyphCount = data.readUnsignedShort();
        int[] lookaheadCoverageOffsets = data.readUnsignedShortArray(lookaheadGlyphCount);
        int glyphCount = data.readUnsignedShort();
        int[] substituteGlyphIDs = data.readUnsignedShortArray(glyphCount);

        CoverageTable coverageTable = CoverageTable.read(data, offset + coverageOffset);
        CoverageTable[] backtrackCoverageTables = SequenceContextReader.readCoverageTables(data,
                offset, backtrackCoverageOffsets);
        CoverageTable[] lookaheadCoverageTables = SequenceContextReader.readCoverageTables(data,
                offset, lookaheadCoverageOffsets);
        return new LookupTypeReverseChainSingleSubstFormat1(substFormat, coverageTable,
                backtrackCoverageTables, lookaheadCoverageTables, substituteGlyphIDs);
    }
}
