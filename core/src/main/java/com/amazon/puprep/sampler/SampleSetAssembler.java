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

package com.amazon.puprep.sampler;

import static com.amazon.puprep.CommonUtils.checkArgument;
import static com.amazon.puprep.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.puprep.InsufficientPositiveSamplesException;
import com.amazon.puprep.InsufficientUnlabeledSamplesException;
import com.amazon.puprep.config.PreparationConfig;
import com.amazon.puprep.inputtypes.FeaturedSample;
import com.amazon.puprep.returntypes.Label;
import com.amazon.puprep.returntypes.PoolEntry;
import com.amazon.puprep.returntypes.SamplePool;

/**
 * Merges a positive and an unlabeled pool into one {@link SamplePool}.
 * Repeated ids within either input keep their first occurrence only, and
 * unlabeled samples whose id is also positive are removed. If more than
 * {@code unlabeledToPositiveRatio * |P|} unlabeled samples remain, a uniform
 * random subset of exactly that size is kept. The subset depends only on the
 * unlabeled input and the seed, and keeps the input order.
 */
@Slf4j
public class SampleSetAssembler {

    @Getter
    private final int unlabeledToPositiveRatio;

    public SampleSetAssembler() {
        this(PreparationConfig.DEFAULT_UNLABELED_TO_POSITIVE_RATIO);
    }

    public SampleSetAssembler(int unlabeledToPositiveRatio) {
        checkArgument(unlabeledToPositiveRatio > 0, "unlabeled to positive ratio must be positive");
        this.unlabeledToPositiveRatio = unlabeledToPositiveRatio;
    }

    /**
     * @param positives confirmed positive samples
     * @param unlabeled samples of unknown status
     * @param seed      seed of the subset draw
     * @return positives tagged POSITIVE followed by the kept unlabeled samples
     *         tagged UNLABELED
     * @throws InsufficientPositiveSamplesException   if there is no positive
     *                                                sample
     * @throws InsufficientUnlabeledSamplesException if no unlabeled sample is
     *                                                left after overlap removal
     */
    public SamplePool assemble(List<FeaturedSample> positives, List<FeaturedSample> unlabeled, long seed) {
        checkNotNull(positives, "positives must not be null");
        checkNotNull(unlabeled, "unlabeled must not be null");
        if (positives.isEmpty()) {
            throw new InsufficientPositiveSamplesException("at least one positive sample is required, found 0");
        }

        List<FeaturedSample> distinctPositives = distinctById(positives, "positive");
        List<FeaturedSample> distinctUnlabeled = distinctById(unlabeled, "unlabeled");

        Set<String> positiveIds = new HashSet<>();
        for (FeaturedSample sample : distinctPositives) {
            positiveIds.add(sample.getId());
        }
        List<FeaturedSample> candidates = new ArrayList<>(distinctUnlabeled.size());
        for (FeaturedSample sample : distinctUnlabeled) {
            if (!positiveIds.contains(sample.getId())) {
                candidates.add(sample);
            }
        }
        int dropped = distinctUnlabeled.size() - candidates.size();
        if (dropped > 0) {
            log.warn("dropped {} unlabeled samples that are also positive", dropped);
        }
        if (candidates.isEmpty()) {
            throw new InsufficientUnlabeledSamplesException("no unlabeled sample left after removing "
                    + dropped + " overlapping with " + distinctPositives.size() + " positive samples");
        }

        long cap = (long) unlabeledToPositiveRatio * distinctPositives.size();
        List<FeaturedSample> kept = candidates;
        if (candidates.size() > cap) {
            kept = drawSubset(candidates, (int) cap, seed);
            log.info("capped unlabeled samples from {} to {}", candidates.size(), kept.size());
        }

        List<PoolEntry> entries = new ArrayList<>(distinctPositives.size() + kept.size());
        for (FeaturedSample sample : distinctPositives) {
            entries.add(PoolEntry.of(sample, Label.POSITIVE));
        }
        for (FeaturedSample sample : kept) {
            entries.add(PoolEntry.of(sample, Label.UNLABELED));
        }
        SamplePool pool = new SamplePool(entries);
        log.info("assembled pool of {} samples ({} positive, {} unlabeled)", pool.size(), pool.getPositiveCount(),
                pool.getUnlabeledCount());
        return pool;
    }

    /**
     * @param samples samples that may repeat an id
     * @param kind    name of the pool, for logging
     * @return the first sample of every id, in input order
     */
    static List<FeaturedSample> distinctById(List<FeaturedSample> samples, String kind) {
        Set<String> seen = new HashSet<>();
        List<FeaturedSample> answer = new ArrayList<>(samples.size());
        for (FeaturedSample sample : samples) {
            checkNotNull(sample, kind + " samples must not be null");
            if (seen.add(sample.getId())) {
                answer.add(sample);
            }
        }
        int repeated = samples.size() - answer.size();
        if (repeated > 0) {
            log.warn("dropped {} {} samples with a repeated id", repeated, kind);
        }
        return answer;
    }

    /**
     * Draws {@code size} distinct elements uniformly at random with a partial
     * Fisher-Yates shuffle of the indices.
     *
     * @param samples the population
     * @param size    the number of elements to draw, at most the population size
     * @param seed    the random seed
     * @return the drawn elements in population order
     */
    static <T> List<T> drawSubset(List<T> samples, int size, long seed) {
        checkArgument(size >= 0 && size <= samples.size(), "incorrect subset size " + size);
        Random random = new Random(seed);
        int[] indices = new int[samples.size()];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(indices.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        int[] chosen = Arrays.copyOf(indices, size);
        Arrays.sort(chosen);
        List<T> answer = new ArrayList<>(size);
        for (int index : chosen) {
            answer.add(samples.get(index));
        }
        return answer;
    }
}
