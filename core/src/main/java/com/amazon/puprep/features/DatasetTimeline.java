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
import static com.amazon.puprep.CommonUtils.checkNotNull;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.puprep.inputtypes.RawSample;

/**
 * The time-keyed view of the samples of a single dataset. Window queries never
 * return samples of another dataset. Two samples of the same dataset with the
 * same timestamp cannot both be kept; the one added last wins.
 */
@Slf4j
public class DatasetTimeline {

    @Getter
    private final String datasetId;

    private final NavigableMap<Instant, RawSample> samples;

    public DatasetTimeline(String datasetId, Collection<RawSample> samples) {
        this.datasetId = checkNotNull(datasetId, "datasetId must not be null");
        checkNotNull(samples, "samples must not be null");
        this.samples = new TreeMap<>();
        int collisions = 0;
        for (RawSample sample : samples) {
            checkArgument(datasetId.equals(sample.getDatasetId()),
                    "sample " + sample.getId() + " belongs to dataset " + sample.getDatasetId() + ", not " + datasetId);
            if (this.samples.put(sample.getTimestamp(), sample) != null) {
                collisions++;
            }
        }
        if (collisions > 0) {
            log.warn("dataset {}: {} samples shared a timestamp with another sample and were replaced", datasetId,
                    collisions);
        }
    }

    /**
     * Builds one timeline per dataset id, in order of first appearance.
     *
     * @param samples samples of any number of datasets
     * @return the timelines keyed by dataset id
     */
    public static Map<String, DatasetTimeline> group(Collection<RawSample> samples) {
        checkNotNull(samples, "samples must not be null");
        Map<String, List<RawSample>> byDataset = new LinkedHashMap<>();
        for (RawSample sample : samples) {
            checkNotNull(sample, "samples must not contain null");
            byDataset.computeIfAbsent(sample.getDatasetId(), k -> new ArrayList<>()).add(sample);
        }
        Map<String, DatasetTimeline> timelines = new LinkedHashMap<>();
        for (Map.Entry<String, List<RawSample>> entry : byDataset.entrySet()) {
            timelines.put(entry.getKey(), new DatasetTimeline(entry.getKey(), entry.getValue()));
        }
        return timelines;
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    /**
     * @param sample a sample
     * @return true if the sample belongs to this dataset and a reading exists at
     *         its timestamp
     */
    public boolean contains(RawSample sample) {
        return datasetId.equals(sample.getDatasetId()) && samples.containsKey(sample.getTimestamp());
    }

    /**
     * Returns the samples whose timestamp lies in {@code [end - length, end]},
     * both ends included, in time order.
     *
     * @param end    the last instant of the window
     * @param length the length of the window
     * @return the samples in the window
     */
    public List<RawSample> window(Instant end, Duration length) {
        checkNotNull(end, "end must not be null");
        checkArgument(!length.isNegative(), "window length must not be negative");
        Collection<RawSample> values = samples.subMap(end.minus(length), true, end, true).values();
        return Collections.unmodifiableList(new ArrayList<>(values));
    }
}
