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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

import com.amazon.puprep.preprocessor.FeatureScaler;

/**
 * The trainer-facing form of a pool: a feature matrix with one row per entry, a
 * parallel label vector (1 for positive, 0 for unlabeled) and the parallel
 * list of sample ids. The matrix is immutable: the array getters return
 * copies.
 */
public class FeatureMatrix {

    private final double[][] features;

    private final int[] labels;

    @Getter
    private final List<String> ids;

    protected FeatureMatrix(double[][] features, int[] labels, List<String> ids) {
        this.features = features;
        this.labels = labels;
        this.ids = Collections.unmodifiableList(ids);
    }

    /**
     * @param pool   the pool to convert
     * @param scaler a fitted scaler applied to every row, or null to keep the
     *               extracted values
     * @return the matrix view of the pool
     */
    public static FeatureMatrix of(SamplePool pool, FeatureScaler scaler) {
        checkNotNull(pool, "pool must not be null");
        double[][] rows = pool.vectors();
        if (scaler != null && rows.length > 0) {
            rows = scaler.transform(rows);
        }
        int[] labels = pool.getEntries().stream().mapToInt(e -> e.getLabel().getValue()).toArray();
        return new FeatureMatrix(rows, labels, pool.ids());
    }

    /**
     * @return a copy of the feature rows
     */
    public double[][] getFeatures() {
        double[][] answer = new double[features.length][];
        for (int i = 0; i < features.length; i++) {
            answer[i] = Arrays.copyOf(features[i], features[i].length);
        }
        return answer;
    }

    /**
     * @return a copy of the label vector
     */
    public int[] getLabels() {
        return Arrays.copyOf(labels, labels.length);
    }

    public int getRows() {
        return features.length;
    }

    public int getColumns() {
        return (features.length == 0) ? 0 : features[0].length;
    }
}
