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

package com.amazon.puprep.state;

import static com.amazon.puprep.CommonUtils.checkNotNull;

import java.time.Clock;
import java.util.ArrayList;

import com.amazon.puprep.config.SplitConfig;
import com.amazon.puprep.features.FeatureLayout;
import com.amazon.puprep.returntypes.SplitResult;

/**
 * Builds the persisted holdout of a run from its split. The split itself cannot
 * be rebuilt from the holdout, so there is no inverse mapping.
 */
public class HoldoutMapper {

    private final Clock clock;

    public HoldoutMapper() {
        this(Clock.systemUTC());
    }

    public HoldoutMapper(Clock clock) {
        this.clock = checkNotNull(clock, "clock must not be null");
    }

    public HoldoutState toState(String runId, SplitResult split, long randomSeed) {
        checkNotNull(runId, "runId must not be null");
        checkNotNull(split, "split must not be null");
        SplitConfig ratios = split.getSplitConfig();
        HoldoutState state = new HoldoutState();
        state.setRunId(runId);
        state.setFeatureLayoutVersion(FeatureLayout.VERSION);
        state.setRandomSeed(randomSeed);
        state.setTrainRatio(ratios.getTrainRatio());
        state.setValidationRatio(ratios.getValidationRatio());
        state.setTestRatio(ratios.getTestRatio());
        state.setTestIds(new ArrayList<>(split.getTestIds()));
        state.setCreatedAt(clock.millis());
        return state;
    }
}
