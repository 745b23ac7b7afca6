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

package com.amazon.puprep.util;

import static com.amazon.puprep.CommonUtils.checkArgument;
import static com.amazon.puprep.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * A utility class for data arrays. The summary statistics follow the usual
 * numerical conventions: the standard deviation is the population deviation
 * and percentiles interpolate linearly between order statistics.
 */
public class ArrayUtils {

    private ArrayUtils() {
    }

    public static double mean(double[] values) {
        checkArgument(values.length > 0, "mean of an empty array");
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    /**
     * @param values a non-empty array
     * @return the population standard deviation (divisor n)
     */
    public static double standardDeviation(double[] values) {
        double mean = mean(values);
        double sum = 0;
        for (double value : values) {
            double d = value - mean;
            sum += d * d;
        }
        return Math.sqrt(sum / values.length);
    }

    public static double max(double[] values) {
        checkArgument(values.length > 0, "max of an empty array");
        double answer = values[0];
        for (double value : values) {
            answer = Math.max(answer, value);
        }
        return answer;
    }

    public static double min(double[] values) {
        checkArgument(values.length > 0, "min of an empty array");
        double answer = values[0];
        for (double value : values) {
            answer = Math.min(answer, value);
        }
        return answer;
    }

    public static double median(double[] values) {
        return percentile(values, 50);
    }

    /**
     * Percentile with linear interpolation between the two nearest ranks: the
     * value at fractional rank {@code (n - 1) * q / 100} of the sorted input.
     *
     * @param values a non-empty array, not modified
     * @param q      the percentile in [0, 100]
     * @return the interpolated percentile
     */
    public static double percentile(double[] values, double q) {
        checkArgument(values.length > 0, "percentile of an empty array");
        checkArgument(q >= 0 && q <= 100, "percentile must be in [0, 100]");
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        double rank = (sorted.length - 1) * q / 100.0;
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (rank - lower) * (sorted[upper] - sorted[lower]);
    }

    /**
     * @param values an array
     * @return the sum of squared differences of consecutive values, 0 for fewer
     *         than two values
     */
    public static double sumOfSquaredDifferences(double[] values) {
        double sum = 0;
        for (int i = 1; i < values.length; i++) {
            double d = values[i] - values[i - 1];
            sum += d * d;
        }
        return sum;
    }

    /**
     * Replaces every NaN or infinite entry by 0, in place.
     *
     * @param values the array to clean
     * @return the number of entries replaced
     */
    public static int replaceNonFinite(double[] values) {
        checkNotNull(values, "values must not be null");
        int replaced = 0;
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                values[i] = 0.0;
                replaced++;
            }
        }
        return replaced;
    }

    /**
     * Returns a clean deep copy of the point. Current clean-ups include changing
     * negative zero -0.0 to positive zero 0.0.
     *
     * @param point The original data point.
     * @return a clean deep copy of the original point.
     */
    public static double[] cleanCopy(double[] point) {
        double[] pointCopy = Arrays.copyOf(point, point.length);
        for (int i = 0; i < point.length; i++) {
            if (pointCopy[i] == 0.0) {
                pointCopy[i] = 0.0;
            }
        }
        return pointCopy;
    }
}
