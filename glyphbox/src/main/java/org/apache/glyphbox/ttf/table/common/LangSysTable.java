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
 * A language system table: the required feature and the optional features, both as indices into
 * the feature list.
 */
public class LangSysTable
{
    /**
     * requiredFeatureIndex value meaning there is no required feature.
     */
    public static final int NO_REQUIRED_FEATURE = 0xFFFF;

    private final int requiredFeatureIndex;
    private final int[] featureIndices;

    public LangSysTable(int requiredFeatureIndex, int[] featureIndices)
    {
        this.requiredFeatureIndex = requiredFeatureIndex;
        this.featureIndices = featureIndices;
    }

    public int getRequiredFeatureIndex()
    {
        return requiredFeatureIndex;
    }

    public int[] getFeatureIndices()
    {
        return featureIndices;
    }

    @Override
    public String toString()
    {
        return String.format("LangSysTable[requiredFeatureIndex=%d]", requiredFeatureIndex);
    }
}
