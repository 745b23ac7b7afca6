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

package com.amazon.puprep.preprocessor;

import static com.amazon.puprep.CommonUtils.checkArgument;
import static com.amazon.puprep.CommonUtils.checkNotNull;
import static com.amazon.puprep.CommonUtils.checkState;

import java.util.Arrays;

import lombok.extern.slf4j.Slf4j;

import com.amazon.puprep.util.ArrayUtils;

/**
 * Column standardization: every feature is shifted by its mean and divided by
 * its population standard deviation, as observed when the scaler was fitted.
 * A constant column has a deviation of 0 and is scaled by 1 instead, so it maps
 * to 0.
 *
 * A scaler belongs to the caller that fitted it. Each preparation run creates
 * its own instance, so concurrent runs over different datasets never share
 * fitted statistics. Fit on training data only, then reuse the same instance
 * for validation, test and inference data.
 */
@Slf4j
public class FeatureScaler {

    private double[] means;

    private double[] scales;

    private long samplesSeen;

    public FeatureScaler() {
    }

    /**
     * Restores a fitted scaler, typically from its persisted state.
     *
     * @param means       per column means
     * @param scales      per column divisors, all positive
     * @param samplesSeen the number of rows the scaler was fitted on
     */
    public FeatureScaler(double[] means, double[] scales, long samplesSeen) {
        checkNotNull(means, "means must not be null");
        checkNotNull(scales, "scales must not be null");
        checkArgument(means.length == scales.length, "means and scales must have the same length");
        checkArgument(means.length > 0, "a scaler needs at least one column");
        for (double scale : scales) {
            checkArgument(scale > 0 && Double.isFinite(scale), "scales must be positive");
        }
        this.means = Arrays.copyOf(means, means.length);
        this.scales = Arrays.copyOf(scales, scales.length);
        this.samplesSeen = samplesSeen;
    }

    /**
     * Computes the per-column statistics. Refitting replaces earlier statistics.
     *
     * @param rows a non-empty matrix with rows of equal length
     * @return this scaler
     */
    public FeatureScaler fit(double[][] rows) {
        checkNotNull(rows, "rows must not be null");
        checkArgument(rows.length > 0, "cannot fit a scaler on no rows");
        int width = rows[0].length;
        checkArgument(width > 0, "cannot fit a scaler on empty rows");
        double[] column = new double[rows.length];
        double[] newMeans = new double[width];
        double[] newScales = new double[width];
        for (int j = 0; j < width; j++) {
            for (int i = 0; i < rows.length; i++) {
                checkArgument(rows[i].length == width, "row " + i + " has length " + rows[i].length
                        + ", expected " + width);
                column[i] = rows[i][j];
            }
            newMeans[j] = ArrayUtils.mean(column);
            double deviation = ArrayUtils.standardDeviation(column);
            newScales[j] = (deviation > 0 && Double.isFinite(deviation)) ? deviation : 1.0;
        }
        means = newMeans;
        scales = newScales;
        samplesSeen = rows.length;
        return this;
    }

    public boolean isFitted() {
        return means != null;
    }

    public double[] transform(double[] row) {
        checkState(isFitted(), "scaler has not been fitted");
        checkNotNull(row, "row must not be null");
        checkArgument(row.length == means.length, "row has " + row.length + " features, scaler expects "
                + means.length);
        double[] answer = new double[row.length];
        for (int j = 0; j < row.length; j++) {
            answer[j] = (row[j] - means[j]) / scales[j];
        }
        int replaced = ArrayUtils.replaceNonFinite(answer);
        if (replaced > 0) {
            log.warn("replaced {} non-finite scaled values by 0", replaced);
        }
        return answer;
    }

    public double[][] transform(double[][] rows) {
        checkNotNull(rows, "rows must not be null");
        double[][] answer = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            answer[i] = transform(rows[i]);
        }
        return answer;
    }

    /**
     * Convenience for fitting on a matrix and standardizing it in one call.
     *
     * @param rows the rows to fit on and transform
     * @return the standardized rows
     */
    public double[][] fitTransform(double[][] rows) {
        return fit(rows).transform(rows);
    }

    public int getDimensions() {
        checkState(isFitted(), "scaler has not been fitted");
        return means.length;
    }

    public double[] getMeans() {
        checkState(isFitted(), "scaler has not been fitted");
        return Arrays.copyOf(means, means.length);
    }

    public double[] getScales() {
        checkState(isFitted(), "scaler has not been fitted");
        return Arrays.copyOf(scales, scales.length);
    }

    public long getSamplesSeen() {
        return samplesSeen;
    }
}
