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
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.puprep.ValidationException;

public class SplitConfigTest {

    @Test
    public void testDefaults() {
        SplitConfig config = SplitConfig.defaults();
        assertEquals(0.7, config.getTrainRatio());
        assertEquals(0.2, config.getValidationRatio());
        assertEquals(0.1, config.getTestRatio());
        assertTrue(config.isNormalized());
        assertSame(config, config.normalize());
    }

    @ParameterizedTest
    @CsvSource({ "70, 20, 10", "7, 2, 1", "0.35, 0.1, 0.05", "60, 25, 15", "1, 1, 1", "0, 0, 5" })
    public void testNormalize(double train, double validation, double test) {
        SplitConfig normalized = new SplitConfig(train, validation, test).normalize();
        assertEquals(1.0, normalized.sum(), 1e-6);
        assertTrue(normalized.isNormalized());
        double total = train + validation + test;
        assertEquals(train / total, normalized.getTrainRatio(), 1e-9);
        assertEquals(test / total, normalized.getTestRatio(), 1e-9);
    }

    @Test
    public void testPercentagesSumToOne() {
        SplitConfig normalized = new SplitConfig(70, 20, 10).normalize();
        assertEquals(1.0, normalized.sum(), 1e-6);
        assertFalse(new SplitConfig(70, 20, 10).isNormalized());
        assertEquals(new SplitConfig(70, 20, 10), new SplitConfig(70, 20, 10));
    }

    @ParameterizedTest
    @ValueSource(doubles = { -1.0, Double.NaN, Double.POSITIVE_INFINITY })
    public void testInvalidRatio(double ratio) {
        assertThrows(ValidationException.class, () -> new SplitConfig(ratio, 0.5, 0.5).normalize());
        assertThrows(ValidationException.class, () -> new SplitConfig(0.5, ratio, 0.5).normalize());
        assertThrows(ValidationException.class, () -> new SplitConfig(0.5, 0.5, ratio).normalize());
    }

    @Test
    public void testAllZero() {
        assertThrows(ValidationException.class, () -> new SplitConfig(0, 0, 0).normalize());
    }
}
