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
import org.apache.glyphbox.ttf.shaping.GlyphPositioningCollection;
import org.apache.glyphbox.ttf.table.common.ClassDefinitionTable;
import org.apache.glyphbox.ttf.table.common.CoverageTable;
import org.apache.glyphbox.ttf.table.common.LookupSubTable;
import org.apache.glyphbox.ttf.table.common.SequenceContextReader;
import org.apache.glyphbox.ttf.table.gpos.AnchorTable;
import org.apache.glyphbox.ttf.table.gpos.EntryExitRecord;
import org.apache.glyphbox.ttf.table.gpos.LookupTypeCursivePosFormat1;
import org.apache.glyphbox.ttf.table.gpos.LookupTypeMarkBasePosFormat1;
import org.apache.glyphbox.ttf.table.gpos.LookupTypeMarkLigaturePosFormat1;
import org.apache.glyphbox.ttf.table.gpos.LookupTypeMarkMarkPosFormat1;
import org.apache.glyphbox.ttf.table.gpos.LookupTypePairPosFormat1;
import org.apache.glyphbox.ttf.table.gpos.LookupTypePairPosFormat2;
import org.apache.glyphbox.ttf.table.gpos.LookupTypeSinglePosFormat1;
import org.apache.glyphbox.ttf.table.gpos.LookupTypeSinglePosFormat2;
import org.apache.glyphbox.ttf.table.gpos.MarkRecord;
import org.apache.glyphbox.ttf.table.gpos.PairSetTable;
import org.apache.glyphbox.ttf.table.gpos.PairValueRecord;
import org.apache.glyphbox.ttf.table.gpos.ValueRecord;

/**
 * A glyph positioning 'GPOS' table in a TrueType or OpenType font.
 */
public class GlyphPositioningTable extends AdvancedTypographicTable<GlyphPositioningCollection>
{
    private static final Log LOG = LogFactory.getLog(GlyphPositioningTable.class);

    public static final String TAG = "GPOS";

    public static final int LOOKUP_TYPE_SINGLE = 1;
    public static final int LOOKUP_TYPE_PAIR = 2;
    public static final int LOOKUP_TYPE_CURSIVE = 3;
    public static final int LOOKUP_TYPE_MARK_TO_BASE = 4;
    public static final int LOOKUP_TYPE_MARK_TO_LIGATURE = 5;
    public static final int LOOKUP_TYPE_MARK_TO_MARK = 6;
    public static final int LOOKUP_TYPE_CONTEXT = 7;
    public static final int LOOKUP_TYPE_CHAINED_CONTEXT = 8;
    public static final int LOOKUP_TYPE_EXTENSION = 9;

    public GlyphPositioningTable()
    {
        setTag(TAG);
    }

    @Override
    protected int getExtensionLookupType()
    {
        return LOOKUP_TYPE_EXTENSION;
    }

    @Override
    protected LookupSubTable<GlyphPositioningCollection> readLookupSubtable(TTFDataStream data,
            long offset, int lookupType) throws IOException
    {
        switch (lookupType)
        {
            case LOOKUP_TYPE_SINGLE:
                // https://docs.microsoft.com/en-us/typography/opentype/spec/gpos#lookup-type-1-single-adjustment-positioning-subtable
                return readSingleAdjustmentSubtable(data, offset);
            case LOOKUP_TYPE_PAIR:
                // https://docs.microsoft.com/en-us/typography/opentype/spec/gpos#lookup-type-2-pair-adjustment-positioning-subtable
                return readPairAdjustmentSubtable(data, offset);
            case LOOKUP_TYPE_CURSIVE:
                // https://docs.microsoft.com/en-us/typography/opentype/spec/gpos#lookup-type-3-cursive-attachment-positioning-subtable
                return readCursiveAttachmentSubtable(data, offset);
            case LOOKUP_TYPE_MARK_TO_BASE:
                // https://docs.microsoft.com/en-us/typography/opentype/spec/gpos#lookup-type-4-mark-to-base-attachment-positioning-subtable
                return readMarkToBaseSubtable(data, offset);
            case LOOKUP_TYPE_MARK_TO_LIGATURE:
                // https://docs.microsoft.com/en-us/typography/opentype/spec/gpos#lookup-type-5-mark-to-ligature-attachment-positioning-subtable
                return readMarkToLigatureSubtable(data, offset);
            case LOOKUP_TYPE_MARK_TO_MARK:
                // https://docs.microsoft.com/en-us/typography/opentype/spec/gpos#lookup-type-6-mark-to-mark-attachment-positioning-subtable
                return readMarkToMarkSubtable(data, offset);
            case LOOKUP_TYPE_CONTEXT:
                // https://docs.microsoft.com/en-us/typography/opentype/spec/gpos#lookup-type-7-contextual-positioning-subtables
                return SequenceContextReader.readSequenceContext(data, offset);
            case LOOKUP_TYPE_CHAINED_CONTEXT:
                // https://docs.microsoft.com/en-us/typography/opentype/spec/gpos#lookup-type-8-chained-contexts-positioning-subtable
                return SequenceContextReader.readChainedSequenceContext(data, offset);
            default:
                LOG.debug("Type " + lookupType
                        + " GPOS lookup table is not supported and will be ignored");
                return null;
        }
    }

    private LookupSubTable<GlyphPositioningCollection> readSingleAdjustmentSubtable(
            TTFDataStream data, long offset) throws IOException
    {
        data.seek(offset);
        int posFormat = data.readUnsignedShort();
        int coverageOffset = data.readOffset16();
        int valueFormat = data.readUnsignedShort();
        switch (posFormat)
        {
        case 1:
        {
            ValueRecord valueRecord = ValueRecord.read(data, valueFormat);
            CoverageTable coverageTable = CoverageTable.read(data, offset + coverageOffset);
            return new LookupTypeSinglePosFormat1(posFormat, coverageTable, valueRecord);
        }
        case 2:
        {
            int valueCount = data.readUnsignedShort();
            ValueRecord[] valueRecords = new ValueRecord[valueCount];
            for (int i = 0; i < valueCount; i++)
            {
                valueRecords[i] = ValueRecord.read(data, valueFormat);
            }
            CoverageTable coverageTable = CoverageTable.read(data, offset + coverageOffset);
            return new LookupTypeSinglePosFormat2(posFormat, coverageTable, valueRecords);
        }
        default:
            throw InvalidFontFileException.invalidFormat("posFormat", posFormat, "'1' or '2'");
        }
    }

    private LookupSubTable<GlyphPositioningCollection> readPairAdjustmentSubtable(
            TTFDataStream data, long offset) throws IOException
    {
        data.seek(offset);
        int posFormat = data.readUnsignedShort();
        int coverageOffset = data.readOffset16();
        int valueFormat1 = data.readUnsignedShort();
        int valueFormat2 = data.readUnsignedShort();
        switch (posFormat)
        {
        case 1:
        {
            int pairSetCount = data.readUnsignedShort();
            int[] pairSetOffsets = data.readUnsignedShortArray(pairSetCount);
            PairSetTable[] pairSetTables = new PairSetTable[pairSetCount];
            for (int i = 0; i < pairSetCount; i++)
            {
                data.seek(offset + pairSetOffsets[i]);
                int pairValueCount = data.readUnsignedShort();
                data.requireAvailable((long) pairValueCount
                        * (2 + ValueRecord.size(valueFormat1) + ValueRecord.size(valueFormat2)),
                        "PairValueRecord[" + pairValueCount + "]");
                PairValueRecord[] pairValueRecords = new PairValueRecord[pairValueCount];
                for (int j = 0; j < pairValueCount; j++)
                {
                    int secondGlyph = data.readUnsignedShort();
                    ValueRecord valueRecord1 = ValueRecord.read(data, valueFormat1);
                    ValueRecord valueRecord2 = ValueRecord.read(data, valueFormat2);
                    pairValueRecords[j] = new PairValueRecord(secondGlyph, valueRecord1,
                            valueRecord2);
                }
                pairSetTables[i] = new PairSetTable(pairValueRecords);
            }
            CoverageTable coverageTable = CoverageTable.read(data, offset + coverageOffset);
            return new LookupTypePairPosFormat1(posFormat, coverageTable, pairSetTables);
        }
        case 2:
        {
            int classDef1Offset = data.readOffset16();
            int classDef2Offset = data.readOffset16();
            int class1Count = data.readUnsignedShort();
            int class2Count = data.readUnsignedShort();
            int recordSize = ValueRecord.size(valueFormat1) + ValueRecord.size(valueFormat2);
            ValueRecord[][][] classRecords;
            if (recordSize > 0)
            {
                data.requireAvailable((long) class1Count * class2Count * recordSize,
                        "Class1Record[" + class1Count + "][" + class2Count + "]");
                classRecords = new ValueRecord[class1Count][class2Count][];
                for (int i = 0; i < class1Count; i++)
                {
                    for (int j = 0; j < class2Count; j++)
                    {
                        ValueRecord valueRecord1 = ValueRecord.read(data, valueFormat1);
                        ValueRecord valueRecord2 = ValueRecord.read(data, valueFormat2);
                        classRecords[i][j] = new ValueRecord[] { valueRecord1, valueRecord2 };
                    }
                }
            }
            else
            {
                // every record is empty and never adjusts a pair
                classRecords = new ValueRecord[0][][];
            }
            CoverageTable coverageTable = CoverageTable.read(data, offset + coverageOffset);
            ClassDefinitionTable classDef1 = ClassDefinitionTable.read(data,
                    offset + classDef1Offset);
            ClassDefinitionTable classDef2 = ClassDefinitionTable.read(data,
                    offset + classDef2Offset);
            if (recordSize == 0)
            {
                // no record bytes bound the counts, so the class definitions must
                checkClassCount("class1Count", class1Count, classDef1);
                checkClassCount("class2Count", class2Count, classDef2);
            }
            return new LookupTypePairPosFormat2(posFormat, coverageTable, classDef1, classDef2,
                    classRecords);
        }
        default:
            throw InvalidFontFileException.invalidFormat("posFormat", posFormat, "'1' or '2'");
        }
    }

    private static void checkClassCount(String field, int classCount,
            ClassDefinitionTable classDefinitionTable) throws MalformedFontException
    {
        int maxClassIndex = classDefinitionTable.getMaxClassIndex();
        if (classCount > maxClassIndex + 1)
        {
            throw new MalformedFontException(field + " " + classCount
                    + " exceeds the classes of its class definition (highest class "
                    + maxClassIndex + ")");
        }
    }

    private LookupSubTable<GlyphPositioningCollection> readCursiveAttachmentSubtable(
            TTFDataStream data, long offset) throws IOException
    {
        data.seek(offset);
        int posFormat = data.readUnsignedShort();
        if (posFormat != 1)
        {
            throw InvalidFontFileException.invalidFormat("posFormat", posFormat, "'1'");
        }
        int coverageOffset = data.readOffset16();
        int entryExitCount = data.readUnsignedShort();
        int[] anchorOffsets = data.readUnsignedShortArray(2 * entryExitCount);
        EntryExitRecord[] entryExitRecords = new EntryExitRecord[entryExitCount];
        for (int i = 0; i < entryExitCount; i++)
        {
            AnchorTable entryAnchor = AnchorTable.read(data, offset, anchorOffsets[2 * i]);
            AnchorTable exitAnchor = AnchorTable.read(data, offset, anchorOffsets[2 * i + 1]);
            entryExitRecords[i] = new EntryExitRecord(entryAnchor, exitAnchor);
        }
        CoverageTable coverageTable = CoverageTable.read(data, offset + coverageOffset);
        return new LookupTypeCursivePosFormat1(posFormat, coverageTable, entryExitRecords);
    }

    private LookupSubTable<GlyphPositioningCollection> readMarkToBaseSubtable(
            TTFDataStream data, long offset) throws IOException
    {
        data.seek(offset);
        int posFormat = data.readUnsignedShort();
        if (posFormat != 1)
        {
            throw InvalidFontFileException.invalidFormat("posFormat", posFormat, "'1'");
        }
        int markCoverageOffset = data.readOffset16();
        int baseCoverageOffset = data.readOffset16();
        int markClassCount = data.readUnsignedShort();
        int markArrayOffset = data.readOffset16();
        int baseArrayOffset = data.readOffset16();

        CoverageTable markCoverage = CoverageTable.read(data, offset + markCoverageOffset);
        CoverageTable baseCoverage = CoverageTable.read(data, offset + baseCoverageOffset);
        MarkRecord[] markRecords = readMarkArray(data, offset + markArrayOffset);
        AnchorTable[][] baseAnchors = readAnchorMatrix(data, offset + baseArrayOffset,
                markClassCount);
        return new LookupTypeMarkBasePosFormat1(posFormat, markCoverage, baseCoverage,
                markRecords, baseAnchors);
    }

    private LookupSubTable<GlyphPositioningCollection> readMarkToLigatureSubtable(
            TTFDataStream data, long offset) throws IOException
    {
        data.seek(offset);
        int posFormat = data.readUnsignedShort();
        if (posFormat != 1)
        {
            throw InvalidFontFileException.invalidFormat("posFormat", posFormat, "'1'");
        }
        int markCoverageOffset = data.readOffset16();
        int ligatureCoverageOffset = data.readOffset16();
        int markClassCount = data.readUnsignedShort();
        int markArrayOffset = data.readOffset16();
        int ligatureArrayOffset = data.readOffset16();

        CoverageTable markCoverage = CoverageTable.read(data, offset + markCoverageOffset);
        CoverageTable ligatureCoverage = CoverageTable.read(data, offset + ligatureCoverageOffset);
        MarkRecord[] markRecords = readMarkArray(data, offset + markArrayOffset);

        long ligatureArrayStart = offset + ligatureArrayOffset;
        data.seek(ligatureArrayStart);
        int ligatureCount = data.readUnsignedShort();
        int[] ligatureAttachOffsets = data.readUnsignedShortArray(ligatureCount);
        AnchorTable[][][] ligatureAnchors = new AnchorTable[ligatureCount][][];
        for (int i = 0; i < ligatureCount; i++)
        {
            // each LigatureAttach table has the layout of a BaseArray: one record per component
            ligatureAnchors[i] = readAnchorMatrix(data,
                    ligatureArrayStart + ligatureAttachOffsets[i], markClassCount);
        }
        return new LookupTypeMarkLigaturePosFormat1(posFormat, markCoverage, ligatureCoverage,
                markRecords, ligatureAnchors);
    }

    private LookupSubTable<GlyphPositioningCollection> readMarkToMarkSubtable(
            TTFDataStream data, long offset) throws IOException
    {
        data.seek(offset);
        int posFormat = data.readUnsignedShort();
        if (posFormat != 1)
        {
            throw InvalidFontFileException.invalidFormat("posFormat", posFormat, "'1'");
        }
        int mark1CoverageOffset = data.readOffset16();
        int mark2CoverageOffset = data.readOffset16();
        int markClassCount = data.readUnsignedShort();
        int mark1ArrayOffset = data.readOffset16();
        int mark2ArrayOffset = data.readOffset16();

        CoverageTable mark1Coverage = CoverageTable.read(data, offset + mark1CoverageOffset);
        CoverageTable mark2Coverage = CoverageTable.read(data, offset + mark2CoverageOffset);
        MarkRecord[] mark1Records = readMarkArray(data, offset + mark1ArrayOffset);
        AnchorTable[][] mark2Anchors = readAnchorMatrix(data, offset + mark2ArrayOffset,
                markClassCount);
        return new LookupTypeMarkMarkPosFormat1(posFormat, mark1Coverage, mark2Coverage,
                mark1Records, mark2Anchors);
    }

    private MarkRecord[] readMarkArray(TTFDataStream data, long offset) throws IOException
    {
        data.seek(offset);
        int markCount = data.readUnsignedShort();
        int[] markRecordData = data.readUnsignedShortArray(2 * markCount);
        MarkRecord[] markRecords = new MarkRecord[markCount];
        for (int i = 0; i < markCount; i++)
        {
            AnchorTable markAnchor = AnchorTable.read(data, offset + markRecordData[2 * i + 1]);
            markRecords[i] = new MarkRecord(markRecordData[2 * i], markAnchor);
        }
        return markRecords;
    }

    /**
     * Reads a BaseArray, Mark2Array or LigatureAttach table: a count followed by that many
     * records of {@code markClassCount} anchor offsets, relative to the start of the table.
     */
    private AnchorTable[][] readAnchorMatrix(TTFDataStream data, long offset, int markClassCount)
            throws IOException
    {
        data.seek(offset);
        int recordCount = data.readUnsignedShort();
        int[] anchorOffsets = data.readUnsignedShortArray(recordCount * markClassCount);
        AnchorTable[][] anchors = new AnchorTable[recordCount][markClassCount];
        for (int i = 0; i < recordCount; i++)
        {
            for (int j = 0; j < markClassCount; j++)
            {
                anchors[i][j] = AnchorTable.read(data, offset,
                        anchorOffsets[i * markClassCount + j]);
            }
        }
        return anchors;
    }
}
