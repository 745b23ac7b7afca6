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

import java.util.List;

import lombok.Data;

/**
 * A data object holding the test ids of one preparation run, kept so that a
 * later evaluation can load exactly that holdout without recomputing the split.
 */
@Data
public class HoldoutState {

    private String version = V1_0;

    private String runId;

    private String featureLayoutVersion;

    private long randomSeed;

    private double trainRatio;

    private double validationRatio;

    private double testRatio;

    private List<String> testIds;

    /**
     * creation time in milliseconds since the epoch
     */
    private long createdAt;
}
