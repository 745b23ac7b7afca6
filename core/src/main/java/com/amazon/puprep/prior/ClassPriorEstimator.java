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

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.puprep.PriorEstimationException;
import com.amazon.puprep.config.PriorMethod;
import com.amazon.puprep.preprocessor.FeatureScaler;
import com.amazon.puprep.returntypes.Label;
import com.amazon.puprep.returntypes.PriorEstimate;
import com.amazon.puprep.returntypes.SamplePool;
import com.amazon.puprep.util.ArrayUtils;

/**
 * Estimates the class prior of an assembled pool from the density ratio
 * {@code p_P(x) / p_U(x)} evaluated at every unlabeled vector. The vectors are
 * standardized with a scaler fitted on the whole pool, the ratios are reduced
 * with the mean or the median, and the result is clipped to
 * {@code [MIN_PRIOR, MAX_PRIOR]}. A true prior outside that band cannot be
 * estimated.
 */
@Slf4j
public class ClassPriorEstimator {

    public static final double MIN_PRIOR = 0.1;

    public static final double MAX_PRIOR = 0.9;

    public static final double DEFAULT_BANDWIDTH = 0.5;

    public static final int MINIMUM_POSITIVE_SAMPLES = 2;

    @Getter
    private final double bandwidth;

    public ClassPriorEstimator() {
        this(DEFAULT_BANDWIDTH);
    }

    public ClassPriorEstimator(double bandwidth) {
        checkArgument(bandwidth > 0 && Double.isFinite(bandwidth), "bandwidth must be positive");
        this.bandwidth = bandwidth;
    }

    /**
     * @param pool   the assembled pool, before any split
     * @param method how the per-sample ratios are reduced
     * @return the clipped prior with the counts it was computed from
     * @throws PriorEstimationException with fewer than two positive or no
     *                                  unlabeled entries
     */
    public PriorEstimate estimate(SamplePool pool, PriorMethod method) {
        checkNotNull(pool, "pool must not be null");
        checkNotNull(method, "method must not be null");
        int positives = pool.getPositiveCount();
        int unlabeled = pool.getUnlabeledCount();
        if (positives < MINIMUM_POSITIVE_SAMPLES) {
            throw new PriorEstimationException("prior estimation needs at least " + MINIMUM_POSITIVE_SAMPLES
                    + " positive samples, found " + positives);
        }
        if (unlabeled == 0) {
            throw new PriorEstimationException("prior estimation needs unlabeled samples, found 0");
        }

        FeatureScaler scaler = new FeatureScaler().fit(pool.vectors());
        double[][] positiveVectors = scaler.transform(pool.vectors(Label.POSITIVE));
        double[][] unlabeledVectors = scaler.transform(pool.vectors(Label.UNLABELED));
        double[] ratios = new KernelDensityRatio(positiveVectors, unlabeledVectors, bandwidth)
                .ratios(unlabeledVectors);

        double statistic = (method == PriorMethod.MEAN) ? ArrayUtils.mean(ratios) : ArrayUtils.median(ratios);
        if (Double.isNaN(statistic)) {
            throw new PriorEstimationException("density ratio is undefined for this pool");
        }
        double value = clip(statistic);
        PriorEstimate estimate = new PriorEstimate(value, method, positives, unlabeled, statistic);
        if (estimate.isClipped()) {
            log.info("prior statistic {} clipped to {}", statistic, value);
        }
        log.info("estimated class prior {} with method {} from {} positive and {} unlabeled samples", value,
                method.getLabel(), positives, unlabeled);
        return estimate;
    }

    static double clip(double value) {
        return Math.max(MIN_PRIOR, Math.min(MAX_PRIOR, value));
    }
}
