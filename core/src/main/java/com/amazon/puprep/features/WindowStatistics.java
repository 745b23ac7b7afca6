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

package com.amazon.puprep.features;

import static com.amazon.puprep.CommonUtils.checkArgument;
import static com.amazon.puprep.CommonUtils.guardedRatio;

import java.util.Arrays;
import java.util.List;

import com.amazon.puprep.inputtypes.RawSample;
import com.amazon.puprep.util.ArrayUtils;

/**
 * The ten statistics of one window, in the order of
 * {@link FeatureLayout#STAT_NAMES}: mean, standard deviation, max, min and
 * median of the total wattage, the number of readings above
 * {@link #HIGH_POWER_FACTOR} times the mean, mean(L1) - mean(L2), the sum of
 * squared consecutive differences of the total, the 110V/220V channel ratio and
 * the interquartile range of the total.
 */
public class WindowStatistics {

    public static final double HIGH_POWER_FACTOR = 1.5;

    static final int MEAN = 0;

    static final int STD = 1;

    private final double[] values;

    private final boolean populated;

    protected WindowStatistics(double[] values, boolean populated) {
        this.values = values;
        this.populated = populated;
    }

    /**
     * @param window the samples of the window, in time order, not empty
     * @return the statistics computed over the window
     */
    public static WindowStatistics of(List<RawSample> window) {
        checkArgument(!window.isEmpty(), "cannot compute statistics of an empty window");
        int n = window.size();
        double[] total = new double[n];
        double[] l1 = new double[n];
        double[] l2 = new double[n];
        double[] low = new double[n];
        double[] high = new double[n];
        for (int i = 0; i < n; i++) {
            RawSample sample = window.get(i);
            total[i] = sample.totalOrZero();
            l1[i] = sample.l1OrZero();
            l2[i] = sample.l2OrZero();
            low[i] = sample.wattage110vOrZero();
            high[i] = sample.wattage220vOrZero();
        }
        double mean = ArrayUtils.mean(total);
        double threshold = HIGH_POWER_FACTOR * mean;
        int highPowerCount = 0;
        for (double value : total) {
            if (value > threshold) {
                highPowerCount++;
            }
        }
        double[] values = new double[FeatureLayout.STATS_PER_WINDOW];
        values[MEAN] = mean;
        values[STD] = ArrayUtils.standardDeviation(total);
        values[2] = ArrayUtils.max(total);
        values[3] = ArrayUtils.min(total);
        values[4] = ArrayUtils.median(total);
        values[5] = highPowerCount;
        values[6] = ArrayUtils.mean(l1) - ArrayUtils.mean(l2);
        values[7] = ArrayUtils.sumOfSquaredDifferences(total);
        values[8] = guardedRatio(ArrayUtils.mean(low), ArrayUtils.mean(high));
        values[9] = ArrayUtils.percentile(total, 75) - ArrayUtils.percentile(total, 25);
        return new WindowStatistics(values, true);
    }

    /**
     * The block used when a window holds too few readings: a flat window made of
     * the current reading alone, that is
     * {@code [total, 0, total, total, total, 0, L1 - L2, 0, 110V / max(220V, 1), 0]}.
     *
     * @param sample the current reading
     * @return the fallback statistics
     */
    public static WindowStatistics fallback(RawSample sample) {
        double total = sample.totalOrZero();
        double[] values = new double[] { total, 0.0, total, total, total, 0.0, sample.l1OrZero() - sample.l2OrZero(),
                0.0, guardedRatio(sample.wattage110vOrZero(), sample.wattage220vOrZero()), 0.0 };
        return new WindowStatistics(values, false);
    }

    /**
     * @return false if these are fallback values
     */
    public boolean isPopulated() {
        return populated;
    }

    public double getMean() {
        return values[MEAN];
    }

    public double getStandardDeviation() {
        return values[STD];
    }

    public double[] getValues() {
        return Arrays.copyOf(values, values.length);
    }

    void copyInto(double[] target, int offset) {
        System.arraycopy(values, 0, target, offset, values.length);
    }
}
