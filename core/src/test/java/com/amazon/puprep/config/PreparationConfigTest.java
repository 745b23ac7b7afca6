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

package com.amazon.puprep.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

public class PreparationConfigTest {

    @Test
    public void testDefaults() {
        PreparationConfig config = PreparationConfig.builder().build();

        assertEquals(30, config.getShortWindowMinutes());
        assertEquals(60, config.getMediumWindowMinutes());
        assertEquals(240, config.getLongWindowMinutes());
        assertEquals(3, config.getMinimumWindowSamples());
        assertEquals(SplitConfig.defaults(), config.getSplitConfig());
        assertEquals(42L, config.getRandomSeed());
        assertTrue(config.isShuffleBeforeSplit());
        assertEquals(10, config.getUnlabeledToPositiveRatio());
        assertEquals(PriorMethod.MEDIAN, config.getPriorMethod());
        assertEquals(0.5, config.getKernelBandwidth());
        assertTrue(config.isStandardizeFeatures());

        assertEquals(Duration.ofMinutes(30), config.getWindow(WindowScale.SHORT));
        assertEquals(Duration.ofMinutes(60), config.getWindow(WindowScale.MEDIUM));
        assertEquals(Duration.ofHours(4), config.getWindow(WindowScale.LONG));
    }

    @Test
    public void testBuilder() {
        PreparationConfig config = PreparationConfig.builder().shortWindowMinutes(10).mediumWindowMinutes(10)
                .longWindowMinutes(90).splitRatios(60, 25, 15).randomSeed(7L).shuffleBeforeSplit(false)
                .priorMethod(PriorMethod.MEAN).kernelBandwidth(1.5).standardizeFeatures(false)
                .unlabeledToPositiveRatio(4).minimumWindowSamples(2).build();

        assertEquals(10, config.getShortWindowMinutes());
        assertEquals(90, config.getLongWindowMinutes());
        assertEquals(new SplitConfig(60, 25, 15), config.getSplitConfig());
        assertEquals(7L, config.getRandomSeed());
        assertFalse(config.isShuffleBeforeSplit());
        assertEquals(PriorMethod.MEAN, config.getPriorMethod());
        assertEquals(1.5, config.getKernelBandwidth());
        assertFalse(config.isStandardizeFeatures());
        assertEquals(4, config.getUnlabeledToPositiveRatio());

        PreparationConfig copy = config.toBuilder().randomSeed(8L).build();
        assertEquals(8L, copy.getRandomSeed());
        assertEquals(config.getSplitConfig(), copy.getSplitConfig());
        assertEquals(config.getMinimumWindowSamples(), copy.getMinimumWindowSamples());
    }

    @ParameterizedTest
    @CsvSource({ "0, 60, 240", "-5, 60, 240", "30, 20, 240", "30, 60, 59" })
    public void testInvalidWindows(int shortWindow, int mediumWindow, int longWindow) {
        assertThrows(IllegalArgumentException.class, () -> PreparationConfig.builder()
                .shortWindowMinutes(shortWindow).mediumWindowMinutes(mediumWindow).longWindowMinutes(longWindow)
                .build());
    }

    @ParameterizedTest
    @ValueSource(doubles = { 0.0, -0.5, Double.NaN, Double.POSITIVE_INFINITY })
    public void testInvalidBandwidth(double bandwidth) {
        assertThrows(IllegalArgumentException.class,
                () -> PreparationConfig.builder().kernelBandwidth(bandwidth).build());
    }

    @Test
    public void testInvalidValues() {
        assertThrows(IllegalArgumentException.class,
                () -> PreparationConfig.builder().unlabeledToPositiveRatio(0).build());
        assertThrows(IllegalArgumentException.class, () -> PreparationConfig.builder().minimumWindowSamples(0).build());
        assertThrows(IllegalArgumentException.class, () -> PreparationConfig.builder().priorMethod(null).build());
        assertThrows(IllegalArgumentException.class, () -> PreparationConfig.builder().splitConfig(null).build());
    }

    @Test
    public void testPriorMethodNames() {
        assertEquals(PriorMethod.MEAN, PriorMethod.fromName("mean"));
        assertEquals(PriorMethod.MEDIAN, PriorMethod.fromName(" Median "));
        assertEquals("median", PriorMethod.MEDIAN.getLabel());
        assertThrows(IllegalArgumentException.class, () -> PriorMethod.fromName("mode"));
        assertThrows(IllegalArgumentException.class, () -> PriorMethod.fromName(null));
    }
}
