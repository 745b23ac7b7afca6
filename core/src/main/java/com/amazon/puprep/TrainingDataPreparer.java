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

package com.amazon.puprep;

import static com.amazon.puprep.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.puprep.config.PreparationConfig;
import com.amazon.puprep.features.DatasetTimeline;
import com.amazon.puprep.features.WindowFeatureExtractor;
import com.amazon.puprep.inputtypes.FeaturedSample;
import com.amazon.puprep.inputtypes.RawSample;
import com.amazon.puprep.preprocessor.FeatureScaler;
import com.amazon.puprep.prior.ClassPriorEstimator;
import com.amazon.puprep.returntypes.PriorEstimate;
import com.amazon.puprep.returntypes.SamplePool;
import com.amazon.puprep.returntypes.SplitResult;
import com.amazon.puprep.sampler.SampleSetAssembler;
import com.amazon.puprep.split.DataSplitter;
import com.amazon.puprep.state.HoldoutMapper;
import com.amazon.puprep.state.HoldoutStore;

/**
 * Runs one preparation: feature extraction for every raw sample, assembly of
 * the positive and unlabeled pools, prior estimation on the whole assembled
 * pool, the optional seeded shuffle, the split, and the scaler fit on the
 * training partition. With a run id and a {@link HoldoutStore}, the test ids
 * are saved as the run's holdout.
 *
 * A preparer keeps no state between calls. Concurrent calls are independent as
 * long as the holdout store is thread safe.
 */
@Slf4j
public class TrainingDataPreparer {

    @Getter
    private final HoldoutStore holdoutStore;

    private final HoldoutMapper holdoutMapper;

    public TrainingDataPreparer() {
        this(null);
    }

    /**
     * @param holdoutStore where test ids are saved, may be null
     */
    public TrainingDataPreparer(HoldoutStore holdoutStore) {
        this(holdoutStore, new HoldoutMapper());
    }

    TrainingDataPreparer(HoldoutStore holdoutStore, HoldoutMapper holdoutMapper) {
        this.holdoutStore = holdoutStore;
        this.holdoutMapper = checkNotNull(holdoutMapper, "holdout mapper must not be null");
    }

    public PreparedData prepare(List<RawSample> positives, List<RawSample> unlabeled, PreparationConfig config) {
        return prepare(null, positives, unlabeled, config, config.getRandomSeed());
    }

    public PreparedData prepare(List<RawSample> positives, List<RawSample> unlabeled, PreparationConfig config,
            long seed) {
        return prepare(null, positives, unlabeled, config, seed);
    }

    /**
     * @param runId     identifier of the run, used as the holdout key; may be
     *                  null when nothing should be persisted
     * @param positives raw positive samples
     * @param unlabeled raw unlabeled samples
     * @param config    the run configuration
     * @param seed      seed of the unlabeled subset draw and of the shuffle
     * @return the prepared data
     * @throws InsufficientPositiveSamplesException   if there is no positive
     *                                                sample
     * @throws InsufficientUnlabeledSamplesException if no unlabeled sample
     *                                                survives overlap removal
     * @throws PriorEstimationException               if the prior is undefined
     * @throws ValidationException                    if the split ratios are
     *                                                invalid
     * @throws IllegalStateException                  if a holdout already exists
     *                                                for the run id
     */
    public PreparedData prepare(String runId, List<RawSample> positives, List<RawSample> unlabeled,
            PreparationConfig config, long seed) {
        checkNotNull(positives, "positives must not be null");
        checkNotNull(unlabeled, "unlabeled must not be null");
        checkNotNull(config, "config must not be null");
        // fail before any work is done
        config.getSplitConfig().normalize();
        if (runId != null && holdoutStore != null && holdoutStore.contains(runId)) {
            throw new IllegalStateException("a holdout already exists for run " + runId);
        }
        log.info("preparing {} positive and {} unlabeled raw samples", positives.size(), unlabeled.size());

        Map<String, DatasetTimeline> timelines = DatasetTimeline.group(distinctById(positives, unlabeled));
        WindowFeatureExtractor extractor = new WindowFeatureExtractor(config);
        List<FeaturedSample> positiveFeatures = extractor.extractAll(positives, timelines);
        List<FeaturedSample> unlabeledFeatures = extractor.extractAll(unlabeled, timelines);

        SamplePool pool = new SampleSetAssembler(config.getUnlabeledToPositiveRatio()).assemble(positiveFeatures,
                unlabeledFeatures, seed);
        PriorEstimate prior = new ClassPriorEstimator(config.getKernelBandwidth()).estimate(pool,
                config.getPriorMethod());

        SamplePool ordered = config.isShuffleBeforeSplit() ? pool.shuffled(seed) : pool;
        SplitResult split = new DataSplitter().split(ordered, config.getSplitConfig());

        FeatureScaler scaler = null;
        if (config.isStandardizeFeatures()) {
            if (split.getTrain().isEmpty()) {
                log.warn("training partition is empty, features are left unscaled");
            } else {
                scaler = new FeatureScaler().fit(split.getTrain().vectors());
            }
        }

        if (runId != null) {
            if (holdoutStore == null) {
                log.warn("run {} has no holdout store, test ids are not persisted", runId);
            } else {
                holdoutStore.save(runId, holdoutMapper.toState(runId, split, seed));
                log.info("saved {} holdout ids for run {}", split.getTestIds().size(), runId);
            }
        }
        return new PreparedData(split, prior, scaler, runId);
    }

    // the same sample may be listed in both pools; the timeline needs it once
    static List<RawSample> distinctById(List<RawSample> positives, List<RawSample> unlabeled) {
        Map<String, RawSample> byId = new LinkedHashMap<>();
        for (RawSample sample : positives) {
            byId.putIfAbsent(sample.getId(), sample);
        }
        for (RawSample sample : unlabeled) {
            byId.putIfAbsent(sample.getId(), sample);
        }
        return new ArrayList<>(byId.values());
    }
}
