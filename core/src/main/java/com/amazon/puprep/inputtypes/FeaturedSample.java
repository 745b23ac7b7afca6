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

package com.amazon.puprep.inputtypes;

import static com.amazon.puprep.CommonUtils.checkNotNull;

import lombok.Getter;

import com.amazon.puprep.returntypes.FeatureVector;

/**
 * A sample id together with its extracted feature vector, before the sample
 * has been tagged as positive or unlabeled.
 */
@Getter
public class FeaturedSample {

    private final String id;

    private final String datasetId;

    private final FeatureVector vector;

    public FeaturedSample(String id, String datasetId, FeatureVector vector) {
        this.id = checkNotNull(id, "id must not be null");
        this.datasetId = datasetId;
        this.vector = checkNotNull(vector, "vector must not be null");
    }
}
