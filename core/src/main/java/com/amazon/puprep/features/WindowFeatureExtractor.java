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

import static com.amazon.puprep.CommonUtils.checkNotNull;
import static com.amazon.puprep.CommonUtils.guardedRatio;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.puprep.config.PreparationConfig;
import com.amazon.puprep.config.WindowScale;
import com.amazon.puprep.inputtypes.FeaturedSample;
import com.amazon.puprep.inputtypes.RawSample;
import com.amazon.puprep.returntypes.FeatureVector;
import com.amazon.puprep.util.ArrayUtils;

/**
 * Turns one reading, together with the timeline of its dataset, into a
 * {@link FeatureVector} laid out as described by {@link FeatureLayout}.
 *
 * Extraction never fails for a single bad sample. A window with fewer than
 * {@code minimumWindowSamples} readings falls back to
 * {@link WindowStatistics#fallback(RawSample)}; a sample that cannot be located
 * in its timeline gets the default vector; non-finite values are replaced by 0.
 * The extractor holds no mutable state and may be shared between threads.
 */
@Slf4j
public class WindowFeatureExtractor {

    // value of every cross ratio when some window fell back
    public static final double DEFAULT_CROSS_RATIO = 1.0;

    private final Map<WindowScale, Duration> windows;

    @Getter
    private final int minimumWindowSamples;

    public WindowFeatureExtractor() {
        this(PreparationConfig.builder().build());
    }

    public WindowFeatureExtractor(PreparationConfig config) {
        checkNotNull(config, "config must not be null");
        windows = new EnumMap<>(WindowScale.class);
        for (WindowScale scale : WindowScale.values()) {
            windows.put(scale, config.getWindow(scale));
        }
        minimumWindowSamples = config.getMinimumWindowSamples();
    }

    public Duration getWindow(WindowScale scale) {
        return windows.get(scale);
    }

    /**
     * @param sample   the reading to describe
     * @param timeline the timeline of the dataset the reading belongs to
     * @return a vector of {@link FeatureLayout#DIMENSIONS} finite values
     */
    public FeatureVector extract(RawSample sample, DatasetTimeline timeline) {
        checkNotNull(sample, "sample must not be null");
        double[] values;
        if (timeline == null || timeline.isEmpty() || !timeline.contains(sample)) {
            log.warn("sample {} not found in the timeline of dataset {}, using default features", sample.getId(),
                    sample.getDatasetId());
            values = defaultValues(sample);
        } else {
            values = computeValues(sample, timeline);
        }
        int replaced = ArrayUtils.replaceNonFinite(values);
        if (replaced > 0) {
            log.warn("sample {}: replaced {} non-finite feature values by 0", sample.getId(), replaced);
        }
        return new FeatureVector(values);
    }

    /**
     * Extracts the features of every sample, each against the timeline of its own
     * dataset.
     *
     * @param samples   the readings to describe
     * @param timelines timelines keyed by dataset id, as built by
     *                  {@link DatasetTimeline#group}
     * @return one featured sample per input, in input order
     */
    public List<FeaturedSample> extractAll(List<RawSample> samples, Map<String, DatasetTimeline> timelines) {
        checkNotNull(samples, "samples must not be null");
        checkNotNull(timelines, "timelines must not be null");
        List<FeaturedSample> answer = new ArrayList<>(samples.size());
        for (RawSample sample : samples) {
            FeatureVector vector = extract(sample, timelines.get(sample.getDatasetId()));
            answer.add(new FeaturedSample(sample.getId(), sample.getDatasetId(), vector));
        }
        return Collections.unmodifiableList(answer);
    }

    double[] computeValues(RawSample sample, DatasetTimeline timeline) {
        double[] values = new double[FeatureLayout.DIMENSIONS];
        writeCurrent(sample, values);
        Map<WindowScale, WindowStatistics> blocks = new EnumMap<>(WindowScale.class);
        for (WindowScale scale : WindowScale.values()) {
            List<RawSample> window = timeline.window(sample.getTimestamp(), windows.get(scale));
            WindowStatistics statistics;
            if (window.size() >= minimumWindowSamples) {
                statistics = WindowStatistics.of(window);
            } else {
                log.debug("sample {}: {} window holds {} readings, using current values", sample.getId(),
                        scale.getPrefix(), window.size());
                statistics = WindowStatistics.fallback(sample);
            }
            statistics.copyInto(values, FeatureLayout.windowOffset(scale));
            blocks.put(scale, statistics);
        }
        writeCrossRatios(blocks, values);
        return values;
    }

    double[] defaultValues(RawSample sample) {
        double[] values = new double[FeatureLayout.DIMENSIONS];
        writeCurrent(sample, values);
        WindowStatistics fallback = WindowStatistics.fallback(sample);
        for (WindowScale scale : WindowScale.values()) {
            fallback.copyInto(values, FeatureLayout.windowOffset(scale));
        }
        for (int i = 0; i < FeatureLayout.CROSS_RATIO_FEATURES; i++) {
            values[FeatureLayout.CROSS_RATIO_OFFSET + i] = DEFAULT_CROSS_RATIO;
        }
        return values;
    }

    private static void writeCurrent(RawSample sample, double[] values) {
        int offset = FeatureLayout.CURRENT_OFFSET;
        values[offset] = sample.l1OrZero();
        values[offset + 1] = sample.l2OrZero();
        values[offset + 2] = sample.wattage110vOrZero();
        values[offset + 3] = sample.wattage220vOrZero();
        values[offset + 4] = sample.totalOrZero();
    }

    private static void writeCrossRatios(Map<WindowScale, WindowStatistics> blocks, double[] values) {
        int offset = FeatureLayout.CROSS_RATIO_OFFSET;
        boolean allPopulated = blocks.values().stream().allMatch(WindowStatistics::isPopulated);
        if (!allPopulated) {
            for (int i = 0; i < FeatureLayout.CROSS_RATIO_FEATURES; i++) {
                values[offset + i] = DEFAULT_CROSS_RATIO;
            }
            return;
        }
        WindowStatistics shortWindow = blocks.get(WindowScale.SHORT);
        WindowStatistics mediumWindow = blocks.get(WindowScale.MEDIUM);
        WindowStatistics longWindow = blocks.get(WindowScale.LONG);
        values[offset] = guardedRatio(shortWindow.getMean(), mediumWindow.getMean());
        values[offset + 1] = guardedRatio(mediumWindow.getMean(), longWindow.getMean());
        values[offset + 2] = guardedRatio(shortWindow.getMean(), longWindow.getMean());
        values[offset + 3] = guardedRatio(shortWindow.getStandardDeviation(), mediumWindow.getStandardDeviation());
        values[offset + 4] = guardedRatio(mediumWindow.getStandardDeviation(), longWindow.getStandardDeviation());
        values[offset + 5] = guardedRatio(shortWindow.getStandardDeviation(), longWindow.getStandardDeviation());
    }
}
