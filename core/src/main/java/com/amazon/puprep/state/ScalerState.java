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

import static com.amazon.puprep.state.Version.V1_0;

import lombok.Data;

/**
 * A data object representing the state of a fitted
 * {@link com.amazon.puprep.preprocessor.FeatureScaler}.
 */
@Data
public class ScalerState {
    /**
     * a version string for extensibility
     */
    private String version = V1_0;
    /**
     * layout of the feature vectors the scaler was fitted on
     */
    private String featureLayoutVersion;
    /**
     * per column means
     */
    private double[] means;
    /**
     * per column divisors
     */
    private double[] scales;

    private long samplesSeen;
}
