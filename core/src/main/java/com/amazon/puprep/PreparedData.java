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

package com.amazon.puprep;

import static com.amazon.puprep.CommonUtils.checkNotNull;

import java.util.Optional;

import lombok.Getter;

import com.amazon.puprep.features.FeatureLayout;
import com.amazon.puprep.preprocessor.FeatureScaler;
import com.amazon.puprep.returntypes.FeatureMatrix;
import com.amazon.puprep.returntypes.PriorEstimate;
import com.amazon.puprep.returntypes.SplitResult;

/**
 * Everything a trainer needs from one preparation run: the three partitions,
 * the class prior and, when standardization is enabled, the scaler fitted on
 * the training partition.
 */
@Getter
public class PreparedData {

    private final SplitResult splitResult;

    private final PriorEstimate priorEstimate;

    private final String featureLayoutVersion;

    private final String runId;

    // null when features are not standardized
    private final FeatureScaler scaler;

    public PreparedData(SplitResult splitResult, PriorEstimate priorEstimate, FeatureScaler scaler, String runId) {
        this.splitResult = checkNotNull(splitResult, "split result must not be null");
        this.priorEstimate = checkNotNull(priorEstimate, "prior estimate must not be null");
        this.scaler = scaler;
        this.runId = runId;
        this.featureLayoutVersion = FeatureLayout.VERSION;
    }

    public Optional<FeatureScaler> getScaler() {
        return Optional.ofNullable(scaler);
    }

    public double getPrior() {
        return priorEstimate.getValue();
    }

    public FeatureMatrix trainMatrix() {
        return FeatureMatrix.of(splitResult.getTrain(), scaler);
    }

    public FeatureMatrix validationMatrix() {
        return FeatureMatrix.of(splitResult.getValidation(), scaler);
    }

    public FeatureMatrix testMatrix() {
        return FeatureMatrix.of(splitResult.getTest(), scaler);
    }
}
