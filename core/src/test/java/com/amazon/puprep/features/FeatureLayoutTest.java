/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.puprep.features;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashSet;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.amazon.puprep.config.WindowScale;

public class FeatureLayoutTest {

    @Test
    public void testLayout() {
        List<String> names = FeatureLayout.featureNames();

        assertEquals(41, FeatureLayout.DIMENSIONS);
        assertEquals(41, names.size());
        assertEquals(41, new HashSet<>(names).size());
        assertEquals("v1", FeatureLayout.VERSION);

        assertEquals(5, FeatureLayout.windowOffset(WindowScale.SHORT));
        assertEquals(15, FeatureLayout.windowOffset(WindowScale.MEDIUM));
        assertEquals(25, FeatureLayout.windowOffset(WindowScale.LONG));
        assertEquals(35, FeatureLayout.CROSS_RATIO_OFFSET);

        assertEquals("wattage_total", FeatureLayout.featureName(4));
        assertEquals("short_mean", FeatureLayout.featureName(5));
        assertEquals("medium_iqr", FeatureLayout.featureName(24));
        assertEquals("long_high_power_count", FeatureLayout.featureName(30));
        assertEquals("short_medium_mean_ratio", FeatureLayout.featureName(35));
        assertEquals("short_long_std_ratio", FeatureLayout.featureName(40));
    }

    @Test
    public void testNamesAreReadOnly() {
        assertThrows(UnsupportedOperationException.class, () -> FeatureLayout.featureNames().add("extra"));
        assertThrows(IllegalArgumentException.class, () -> FeatureLayout.featureName(41));
    }
}
