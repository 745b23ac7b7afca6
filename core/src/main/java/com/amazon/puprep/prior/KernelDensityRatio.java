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

package com.amazon.puprep.prior;

import static com.amazon.puprep.CommonUtils.checkArgument;
import static com.amazon.puprep.CommonUtils.checkNotNull;

/**
 * Ratio of two Gaussian kernel density estimates with a shared bandwidth h,
 * {@code p_P(x) / p_U(x)} with {@code p_S(x) = (1/|S|) sum exp(-|x - s|^2 / (2 h^2))}.
 * The kernel normalizing constant is common to both estimates and cancels.
 * Densities are handled in log space so that points far from every reference
 * point do not produce 0 / 0.
 */
public class KernelDensityRatio {

    private final double[][] numerator;

    private final double[][] denominator;

    private final double bandwidth;

    public KernelDensityRatio(double[][] numerator, double[][] denominator, double bandwidth) {
        checkNotNull(numerator, "numerator points must not be null");
        checkNotNull(denominator, "denominator points must not be null");
        checkArgument(numerator.length > 0, "numerator density needs at least one point");
        checkArgument(denominator.length > 0, "denominator density needs at least one point");
        checkArgument(bandwidth > 0 && Double.isFinite(bandwidth), "bandwidth must be positive");
        this.numerator = numerator;
        this.denominator = denominator;
        this.bandwidth = bandwidth;
    }

    /**
     * @param point a point of the same dimension as the reference points
     * @return the density ratio at the point; NaN if both densities underflow
     *         in log space
     */
    public double ratio(double[] point) {
        return Math.exp(logDensity(numerator, point) - logDensity(denominator, point));
    }

    /**
     * @param points points to evaluate
     * @return the density ratio at each point
     */
    public double[] ratios(double[][] points) {
        double[] answer = new double[points.length];
        for (int i = 0; i < points.length; i++) {
            answer[i] = ratio(points[i]);
        }
        return answer;
    }

    /**
     * @return log of the (unnormalized) kernel density of the reference points
     *         at x, computed with the log-sum-exp shift
     */
    double logDensity(double[][] reference, double[] x) {
        double scale = 2 * bandwidth * bandwidth;
        double[] exponents = new double[reference.length];
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < reference.length; i++) {
            exponents[i] = -squaredDistance(reference[i], x) / scale;
            max = Math.max(max, exponents[i]);
        }
        if (max == Double.NEGATIVE_INFINITY) {
            return max;
        }
        double sum = 0;
        for (double exponent : exponents) {
            sum += Math.exp(exponent - max);
        }
        return max + Math.log(sum) - Math.log(reference.length);
    }

    static double squaredDistance(double[] a, double[] b) {
        checkArgument(a.length == b.length, "points have different dimensions");
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return sum;
    }
}
