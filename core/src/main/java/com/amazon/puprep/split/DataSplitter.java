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

package com.amazon.puprep.split;

import static com.amazon.puprep.CommonUtils.checkNotNull;

import lombok.extern.slf4j.Slf4j;

import com.amazon.puprep.config.SplitConfig;
import com.amazon.puprep.returntypes.SamplePool;
import com.amazon.puprep.returntypes.SplitResult;

/**
 * Partitions a pool into train, validation and test by contiguous index ranges.
 * With N entries, train holds {@code [0, floor(N * train))}, validation the
 * next {@code floor(N * validation)} entries and test the remainder. Positive
 * and unlabeled entries are split together. The splitter never reorders the
 * pool; callers that want a random split shuffle first.
 */
@Slf4j
public class DataSplitter {

    // absorbs representation error such as 55 * 0.6 = 32.999999999999996
    static final double FLOOR_TOLERANCE = 1e-9;

    /**
     * @param pool   the pool to partition
     * @param config the ratios, normalized here if needed
     * @return the three partitions and the test ids
     * @throws com.amazon.puprep.ValidationException if the ratios are invalid
     */
    public SplitResult split(SamplePool pool, SplitConfig config) {
        checkNotNull(pool, "pool must not be null");
        checkNotNull(config, "split config must not be null");
        SplitConfig normalized = config.normalize();
        int n = pool.size();
        int trainEnd = boundedFloor(n, normalized.getTrainRatio(), n);
        int validationEnd = trainEnd + boundedFloor(n, normalized.getValidationRatio(), n - trainEnd);
        SplitResult result = new SplitResult(pool.slice(0, trainEnd), pool.slice(trainEnd, validationEnd),
                pool.slice(validationEnd, n), normalized);
        log.info("split {} samples into train={}, validation={}, test={}", n, result.getTrain().size(),
                result.getValidation().size(), result.getTest().size());
        return result;
    }

    static int boundedFloor(int n, double ratio, int limit) {
        int value = (int) Math.floor(n * ratio + FLOOR_TOLERANCE);
        return Math.max(0, Math.min(value, limit));
    }
}
