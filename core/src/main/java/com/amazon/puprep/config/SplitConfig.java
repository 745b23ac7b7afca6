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

import lombok.Data;

import com.amazon.puprep.ValidationException;

/**
 * Train/validation/test proportions. Callers may pass fractions (0.7, 0.2,
 * 0.1) or whole percentages (70, 20, 10); {@link #normalize()} turns either
 * form into fractions summing to 1.
 */
@Data
public class SplitConfig {

    public static final double DEFAULT_TRAIN_RATIO = 0.7;

    public static final double DEFAULT_VALIDATION_RATIO = 0.2;

    public static final double DEFAULT_TEST_RATIO = 0.1;

    // ratios summing to 1 within this tolerance are used as given
    public static final double NORMALIZATION_TOLERANCE = 1e-6;

    private final double trainRatio;

    private final double validationRatio;

    private final double testRatio;

    public SplitConfig(double trainRatio, double validationRatio, double testRatio) {
        this.trainRatio = trainRatio;
        this.validationRatio = validationRatio;
        this.testRatio = testRatio;
    }

    public static SplitConfig defaults() {
        return new SplitConfig(DEFAULT_TRAIN_RATIO, DEFAULT_VALIDATION_RATIO, DEFAULT_TEST_RATIO);
    }

    public double sum() {
        return trainRatio + validationRatio + testRatio;
    }

    public boolean isNormalized() {
        return Math.abs(sum() - 1.0) <= NORMALIZATION_TOLERANCE;
    }

    /**
     * Returns an equivalent configuration whose ratios sum to 1.
     *
     * @return this object if it is already normalized, otherwise a new
     *         configuration with every ratio divided by the sum
     * @throws ValidationException if a ratio is negative or not finite, or if all
     *                             ratios are zero
     */
    public SplitConfig normalize() {
        check("train", trainRatio);
        check("validation", validationRatio);
        check("test", testRatio);
        double total = sum();
        if (total <= 0) {
            throw new ValidationException("split ratios must not all be zero");
        }
        if (isNormalized()) {
            return this;
        }
        return new SplitConfig(trainRatio / total, validationRatio / total, testRatio / total);
    }

    private static void check(String name, double ratio) {
        if (!Double.isFinite(ratio) || ratio < 0) {
            throw new ValidationException(name + " ratio must be a non-negative number, found " + ratio);
        }
    }
}
