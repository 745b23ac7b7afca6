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

import lombok.Getter;

import com.amazon.puprep.inputtypes.FeaturedSample;

@Getter
public class PoolEntry {

    private final String id;

    private final String datasetId;

    private final FeatureVector vector;

    private final Label label;

    public PoolEntry(String id, String datasetId, FeatureVector vector, Label label) {
        this.id = checkNotNull(id, "id must not be null");
        this.datasetId = datasetId;
        this.vector = checkNotNull(vector, "vector must not be null");
        this.label = checkNotNull(label, "label must not be null");
    }

    public static PoolEntry of(FeaturedSample sample, Label label) {
        return new PoolEntry(sample.getId(), sample.getDatasetId(), sample.getVector(), label);
    }

    public boolean isPositive() {
        return label == Label.POSITIVE;
    }

    @Override
    public String toString() {
        return "PoolEntry(id=" + id + ", label=" + label + ")";
    }
}
