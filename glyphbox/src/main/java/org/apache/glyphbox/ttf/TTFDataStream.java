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
import java.nio.charset.StandardCharsets;

/**
 * An abstract class to read big-endian font data. All positions are absolute, i.e. relative to
 * the start of the font data; offsets stored inside a table must be added to the table's own
 * start before seeking.
 */
public abstract class TTFDataStream
{
    TTFDataStream()
    {
    }

    /**
     * Read a 4 byte ASCII tag, e.g. a feature or script tag.
     *
     * @return The 4 character tag.
     * @throws IOException If there is an error reading the data.
     */
    public String readTag() throws IOException
    {
        return readString(4);
    }

    /**
     * Read a fixed length ASCII string. Each byte maps to exactly one character, so tags compare
     * byte for byte.
     *
     * @param length The length of the string to read.
     * @return A string of the desired length.
     * @throws IOException If there is an error reading the data.
     */
    public String readString(int length) throws IOException
    {
        return new String(read(length), StandardCharsets.ISO_8859_1);
    }

    /**
     * Read an unsigned byte.
     *
     * @return An unsigned byte.
     * @throws IOException If there is an error reading the data.
     */
    public int readUnsignedByte() throws IOException
    {
        int unsignedByte = read();
        if (unsignedByte == -1)
        {
            throw new MalformedFontException("unexpected end of data reading a byte at "
                    + getCurrentPosition());
        }
        return unsignedByte;
    }

    /**
     * Read an unsigned short (uint16).
     *
     * @return An unsigned short.
     * @throws IOException If there is an error reading the data.
     */
    public int readUnsignedShort() throws IOException
    {
        requireAvailable(2, "uint16");
        int b1 = read();
        int b2 = read();
        return (b1 << 8) + b2;
    }

    /**
     * Read a signed short (int16).
     *
     * @return A signed short.
     * @throws IOException If there is an error reading the data.
     */
    public short readSignedShort() throws IOException
    {
        return (short) readUnsignedShort();
    }

    /**
     * Read an unsigned integer (uint32).
     *
     * @return An unsigned integer.
     * @throws IOException If there is an error reading the data.
     */
    public long readUnsignedInt() throws IOException
    {
        requireAvailable(4, "uint32");
        long byte1 = read();
        long byte2 = read();
        long byte3 = read();
        long byte4 = read();
        return (byte1 << 24) + (byte2 << 16) + (byte3 << 8) + byte4;
    }

    /**
     * Read an Offset16, an offset relative to the start of the enclosing table.
     *
     * @return The offset.
     * @throws IOException If there is an error reading the data.
     */
    public int readOffset16() throws IOException
    {
        return readUnsignedShort();
    }

    /**
     * Read an Offset32, an offset relative to the start of the enclosing table.
     *
     * @return The offset.
     * @throws IOException If there is an error reading the data.
     */
    public long readOffset32() throws IOException
    {
        return readUnsignedInt();
    }

    /**
     * Read an unsigned short array.
     *
     * @param length The length of the array to read.
     * @return An unsigned short array.
     * @throws IOException If there is an error reading the data.
     */
    public int[] readUnsignedShortArray(int length) throws IOException
    {
        requireAvailable(2L * length, "uint16[" + length + "]");
        int[] array = new int[length];
        for (int i = 0; i < length; i++)
        {
            array[i] = readUnsignedShort();
        }
        return array;
    }

    /**
     * Read a number of bytes.
     *
     * @param numberOfBytes the number of bytes to be read
     * @return the bytes
     * @throws IOException If there is an error reading the data.
     */
    public byte[] read(int numberOfBytes) throws IOException
    {
        requireAvailable(numberOfBytes, "byte[" + numberOfBytes + "]");
        byte[] data = new byte[numberOfBytes];
        int amountRead = 0;
        int totalAmountRead = 0;
        while (totalAmountRead < numberOfBytes
                && (amountRead = read(data, totalAmountRead, numberOfBytes - totalAmountRead)) != -1)
        {
            totalAmountRead += amountRead;
        }
        if (totalAmountRead != numberOfBytes)
        {
            throw new MalformedFontException("unexpected end of data reading " + numberOfBytes
                    + " bytes");
        }
        return data;
    }

    /**
     * Throws a {@link MalformedFontException} if fewer than the given number of bytes remain
     * from the current position.
     *
     * @param numberOfBytes the number of bytes the caller is about to read
     * @param what a description of the value being read, used in the message
     * @throws IOException if the data is too short
     */
    public void requireAvailable(long numberOfBytes, String what) throws IOException
    {
        long position = getCurrentPosition();
        if (numberOfBytes < 0 || position + numberOfBytes > getOriginalDataSize())
        {
            throw new MalformedFontException("cannot read " + what + " at offset " + position
                    + ": only " + (getOriginalDataSize() - position) + " bytes remain");
        }
    }

    /**
     * Read an unsigned byte, returning -1 at the end of the data.
     *
     * @return The byte that was read, or -1.
     * @throws IOException If there is an error reading the data.
     */
    public abstract int read() throws IOException;

    /**
     * Seek into the datasource.
     *
     * @param pos The absolute position to seek to.
     * @throws IOException If the position lies outside of the data.
     */
    public abstract void seek(long pos) throws IOException;

    /**
     * @see java.io.InputStream#read(byte[], int, int)
     *
     * @param b The buffer to write to.
     * @param off The offset into the buffer.
     * @param len The length into the buffer.
     *
     * @return The number of bytes read, or -1 at the end of the stream
     *
     * @throws IOException If there is an error reading from the stream.
     */
    public abstract int read(byte[] b, int off, int len) throws IOException;

    /**
     * Get the current position in the stream.
     *
     * @return The current position in the stream.
     * @throws IOException If an error occurs while reading the stream.
     */
    public abstract long getCurrentPosition() throws IOException;

    /**
     * @return the size of the underlying data
     */
    public abstract long getOriginalDataSize();
}
