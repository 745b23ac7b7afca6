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

import static com.amazon.puprep.CommonUtils.checkNotNull;

import java.util.Collections;
import java.util.List;

import lombok.Getter;

import com.amazon.puprep.config.SplitConfig;

/**
 * The three disjoint slices of a pool. The test ids are the only part meant to
 * outlive a training run: a later evaluation job re-fetches exactly those
 * samples instead of re-deriving the split.
 */
@Getter
public class SplitResult {

    private final SamplePool train;

    private final SamplePool validation;

    private final SamplePool test;

    private final List<String> testIds;

    // the normalized ratios the split was computed with
    private final SplitConfig splitConfig;

    public SplitResult(SamplePool train, SamplePool validation, SamplePool test, SplitConfig splitConfig) {
        this.train = checkNotNull(train, "train must not be null");
        this.validation = checkNotNull(validation, "validation must not be null");
        this.test = checkNotNull(test, "test must not be null");
        this.splitConfig = checkNotNull(splitConfig, "split config must not be null");
        this.testIds = Collections.unmodifiableList(test.ids());
    }

    public int totalSize() {
        return train.size() + validation.size() + test.size();
    }

    @Override
    public String toString() {
        return "SplitResult(train=" + train.size() + ", validation=" + validation.size() + ", test=" + test.size()
                + ")";
    }
}
