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

package com.amazon.puprep.config;

import static com.amazon.puprep.CommonUtils.checkArgument;

import java.time.Duration;

import lombok.Getter;

/**
 * Typed configuration of one preparation run. Instances are immutable and are
 * created through {@link #builder()}; every field has a documented default so
 * that {@code PreparationConfig.builder().build()} is a usable configuration.
 */
@Getter
public class PreparationConfig {

    public static final int DEFAULT_SHORT_WINDOW_MINUTES = 30;

    public static final int DEFAULT_MEDIUM_WINDOW_MINUTES = 60;

    public static final int DEFAULT_LONG_WINDOW_MINUTES = 240;

    // fewer samples than this in a window triggers the current-value fallback
    public static final int DEFAULT_MINIMUM_WINDOW_SAMPLES = 3;

    public static final long DEFAULT_RANDOM_SEED = 42L;

    public static final boolean DEFAULT_SHUFFLE_BEFORE_SPLIT = true;

    // upper bound on |U| as a multiple of |P|
    public static final int DEFAULT_UNLABELED_TO_POSITIVE_RATIO = 10;

    public static final PriorMethod DEFAULT_PRIOR_METHOD = PriorMethod.MEDIAN;

    public static final double DEFAULT_KERNEL_BANDWIDTH = 0.5;

    public static final boolean DEFAULT_STANDARDIZE_FEATURES = true;

    private final int shortWindowMinutes;

    private final int mediumWindowMinutes;

    private final int longWindowMinutes;

    private final int minimumWindowSamples;

    private final SplitConfig splitConfig;

    private final long randomSeed;

    private final boolean shuffleBeforeSplit;

    private final int unlabeledToPositiveRatio;

    private final PriorMethod priorMethod;

    private final double kernelBandwidth;

    private final boolean standardizeFeatures;

    protected PreparationConfig(Builder<?> builder) {
        checkArgument(builder.shortWindowMinutes > 0, "short window must be positive");
        checkArgument(builder.mediumWindowMinutes >= builder.shortWindowMinutes,
                "medium window must not be shorter than the short window");
        checkArgument(builder.longWindowMinutes >= builder.mediumWindowMinutes,
                "long window must not be shorter than the medium window");
        checkArgument(builder.minimumWindowSamples > 0, "minimum window samples must be positive");
        checkArgument(builder.splitConfig != null, "split config required");
        checkArgument(builder.unlabeledToPositiveRatio > 0, "unlabeled to positive ratio must be positive");
        checkArgument(builder.priorMethod != null, "prior method required");
        checkArgument(builder.kernelBandwidth > 0 && Double.isFinite(builder.kernelBandwidth),
                "kernel bandwidth must be a positive number");

        shortWindowMinutes = builder.shortWindowMinutes;
        mediumWindowMinutes = builder.mediumWindowMinutes;
        longWindowMinutes = builder.longWindowMinutes;
        minimumWindowSamples = builder.minimumWindowSamples;
        splitConfig = builder.splitConfig;
        randomSeed = builder.randomSeed;
        shuffleBeforeSplit = builder.shuffleBeforeSplit;
        unlabeledToPositiveRatio = builder.unlabeledToPositiveRatio;
        priorMethod = builder.priorMethod;
        kernelBandwidth = builder.kernelBandwidth;
        standardizeFeatures = builder.standardizeFeatures;
    }

    /**
     * @return a new builder holding the default values
     */
    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * @param scale a window scale
     * @return the configured length of the window for that scale
     */
    public Duration getWindow(WindowScale scale) {
        switch (scale) {
        case SHORT:
            return Duration.ofMinutes(shortWindowMinutes);
        case MEDIUM:
            return Duration.ofMinutes(mediumWindowMinutes);
        case LONG:
            return Duration.ofMinutes(longWindowMinutes);
        default:
            throw new IllegalArgumentException("unknown scale " + scale);
        }
    }

    /**
     * @return a builder initialized with the values of this configuration
     */
    public Builder<?> toBuilder() {
        return new Builder<>().shortWindowMinutes(shortWindowMinutes).mediumWindowMinutes(mediumWindowMinutes)
                .longWindowMinutes(longWindowMinutes).minimumWindowSamples(minimumWindowSamples)
                .splitConfig(splitConfig).randomSeed(randomSeed).shuffleBeforeSplit(shuffleBeforeSplit)
                .unlabeledToPositiveRatio(unlabeledToPositiveRatio).priorMethod(priorMethod)
                .kernelBandwidth(kernelBandwidth).standardizeFeatures(standardizeFeatures);
    }

    public static class Builder<T extends Builder<T>> {

        private int shortWindowMinutes = DEFAULT_SHORT_WINDOW_MINUTES;
        private int mediumWindowMinutes = DEFAULT_MEDIUM_WINDOW_MINUTES;
        private int longWindowMinutes = DEFAULT_LONG_WINDOW_MINUTES;
        private int minimumWindowSamples = DEFAULT_MINIMUM_WINDOW_SAMPLES;
        private SplitConfig splitConfig = SplitConfig.defaults();
        private long randomSeed = DEFAULT_RANDOM_SEED;
        private boolean shuffleBeforeSplit = DEFAULT_SHUFFLE_BEFORE_SPLIT;
        private int unlabeledToPositiveRatio = DEFAULT_UNLABELED_TO_POSITIVE_RATIO;
        private PriorMethod priorMethod = DEFAULT_PRIOR_METHOD;
        private double kernelBandwidth = DEFAULT_KERNEL_BANDWIDTH;
        private boolean standardizeFeatures = DEFAULT_STANDARDIZE_FEATURES;

        public PreparationConfig build() {
            return new PreparationConfig(this);
        }

        public T shortWindowMinutes(int shortWindowMinutes) {
            this.shortWindowMinutes = shortWindowMinutes;
            return (T) this;
        }

        public T mediumWindowMinutes(int mediumWindowMinutes) {
            this.mediumWindowMinutes = mediumWindowMinutes;
            return (T) this;
        }

        public T longWindowMinutes(int longWindowMinutes) {
            this.longWindowMinutes = longWindowMinutes;
            return (T) this;
        }

        public T minimumWindowSamples(int minimumWindowSamples) {
            this.minimumWindowSamples = minimumWindowSamples;
            return (T) this;
        }

        public T splitConfig(SplitConfig splitConfig) {
            this.splitConfig = splitConfig;
            return (T) this;
        }

        public T splitRatios(double trainRatio, double validationRatio, double testRatio) {
            this.splitConfig = new SplitConfig(trainRatio, validationRatio, testRatio);
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return (T) this;
        }

        public T shuffleBeforeSplit(boolean shuffleBeforeSplit) {
            this.shuffleBeforeSplit = shuffleBeforeSplit;
            return (T) this;
        }

        public T unlabeledToPositiveRatio(int unlabeledToPositiveRatio) {
            this.unlabeledToPositiveRatio = unlabeledToPositiveRatio;
            return (T) this;
        }

        public T priorMethod(PriorMethod priorMethod) {
            this.priorMethod = priorMethod;
            return (T) this;
        }

        public T kernelBandwidth(double kernelBandwidth) {
            this.kernelBandwidth = kernelBandwidth;
            return (T) this;
        }

        public T standardizeFeatures(boolean standardizeFeatures) {
            this.standardizeFeatures = standardizeFeatures;
            return (T) this;
        }
    }
}
