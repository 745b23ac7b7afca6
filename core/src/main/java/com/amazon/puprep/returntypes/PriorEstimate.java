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

package com.amazon.puprep.returntypes;

import lombok.Getter;

import com.amazon.puprep.config.PriorMethod;

/**
 * An estimate of the class prior, the fraction of hidden positives in the
 * unlabeled pool, together with the method and the pool counts it came from.
 * Estimates are per run and are never shared across datasets.
 */
@Getter
public class PriorEstimate {

    private final double value;

    private final PriorMethod method;

    private final int positiveCount;

    private final int unlabeledCount;

    // the mean or median of the density ratios before clipping
    private final double rawStatistic;

    public PriorEstimate(double value, PriorMethod method, int positiveCount, int unlabeledCount,
            double rawStatistic) {
        this.value = value;
        this.method = method;
        this.positiveCount = positiveCount;
        this.unlabeledCount = unlabeledCount;
        this.rawStatistic = rawStatistic;
    }

    /**
     * @return true if the raw statistic fell outside the clip band
     */
    public boolean isClipped() {
        return rawStatistic != value;
    }

    @Override
    public String toString() {
        return "PriorEstimate(value=" + value + ", method=" + method.getLabel() + ", positive=" + positiveCount
                + ", unlabeled=" + unlabeledCount + ")";
    }
}
