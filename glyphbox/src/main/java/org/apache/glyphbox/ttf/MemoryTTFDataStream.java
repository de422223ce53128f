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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * A {@link TTFDataStream} over font data that is completely resident in memory.
 */
public class MemoryTTFDataStream extends TTFDataStream
{
    private final byte[] data;
    private int currentPosition = 0;

    /**
     * Constructor.
     *
     * @param data the font data; it is not copied and must not be modified afterwards
     */
    public MemoryTTFDataStream(byte[] data)
    {
        if (data == null)
        {
            throw new IllegalArgumentException("data must not be null");
        }
        this.data = data;
    }

    /**
     * Constructor, reads the whole input stream into memory.
     *
     * @param is The stream to read from. It will <b>not</b> be closed.
     * @throws IOException If an error occurs while reading from the stream.
     */
    public MemoryTTFDataStream(InputStream is) throws IOException
    {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        byte[] buffer = new byte[4096];
        int read;
        while ((read = is.read(buffer)) != -1)
        {
            output.write(buffer, 0, read);
        }
        this.data = output.toByteArray();
    }

    @Override
    public int read() throws IOException
    {
        if (currentPosition >= data.length)
        {
            return -1;
        }
        return data[currentPosition++] & 0xff;
    }

    @Override
    public void seek(long pos) throws IOException
    {
        if (pos < 0 || pos > data.length)
        {
            throw new MalformedFontException("seek position " + pos
                    + " is outside of the data (length " + data.length + ")");
        }
        currentPosition = (int) pos;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException
    {
        if (currentPosition >= data.length)
        {
            return -1;
        }
        int bytesToRead = Math.min(len, data.length - currentPosition);
        System.arraycopy(data, currentPosition, b, off, bytesToRead);
        currentPosition += bytesToRead;
        return bytesToRead;
    }

    @Override
    public long getCurrentPosition() throws IOException
    {
        return currentPosition;
    }

    @Override
    public long getOriginalDataSize()
    {
        return data.length;
    }
}
