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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.amazon.puprep.config.PreparationConfig;
import com.amazon.puprep.config.PriorMethod;
import com.amazon.puprep.features.FeatureLayout;
import com.amazon.puprep.inputtypes.RawSample;
import com.amazon.puprep.prior.ClassPriorEstimator;
import com.amazon.puprep.returntypes.FeatureMatrix;
import com.amazon.puprep.returntypes.Label;
import com.amazon.puprep.returntypes.SamplePool;
import com.amazon.puprep.returntypes.SplitResult;
import com.amazon.puprep.state.HoldoutState;
import com.amazon.puprep.state.HoldoutStore;
import com.amazon.puprep.state.InMemoryHoldoutStore;

@ExtendWith(MockitoExtension.class)
public class TrainingDataPreparerTest {

    @Mock
    private HoldoutStore holdoutStore;

    private List<RawSample> positives;

    private List<RawSample> unlabeled;

    private PreparationConfig config;

    @BeforeEach
    public void setUp() {
        positives = new ArrayList<>();
        unlabeled = new ArrayList<>();
        List<RawSample> series = TestSamples.series("meter", 65, 11L);
        for (int i = 0; i < series.size(); i++) {
            RawSample sample = series.get(i);
            if (i % 13 == 0) {
                positives.add(new RawSample(sample.getId(), sample.getDatasetId(), sample.getTimestamp(),
                        sample.getRawWattageL1(), sample.getRawWattageL2(), sample.getWattage110v(),
                        sample.getWattage220v(), 5 * sample.getWattageTotal(), true));
            } else {
                unlabeled.add(sample);
            }
        }
        config = PreparationConfig.builder().splitRatios(0.6, 0.25, 0.15).build();
    }

    @Test
    public void testPrepareFivePositivesSixtyUnlabeled() {
        TrainingDataPreparer preparer = new TrainingDataPreparer(holdoutStore);

        PreparedData data = preparer.prepare("run-7", positives, unlabeled, config, 7L);

        SplitResult split = data.getSplitResult();
        assertEquals(55, split.totalSize());
        assertEquals(33, split.getTrain().size());
        assertEquals(13, split.getValidation().size());
        assertEquals(9, split.getTest().size());
        int positiveCount = split.getTrain().getPositiveCount() + split.getValidation().getPositiveCount()
                + split.getTest().getPositiveCount();
        assertEquals(5, positiveCount);

        assertEquals(5, data.getPriorEstimate().getPositiveCount());
        assertEquals(50, data.getPriorEstimate().getUnlabeledCount());
        assertEquals(PriorMethod.MEDIAN, data.getPriorEstimate().getMethod());
        assertThat(data.getPrior(), allOf(greaterThanOrEqualTo(ClassPriorEstimator.MIN_PRIOR),
                lessThanOrEqualTo(ClassPriorEstimator.MAX_PRIOR)));

        assertTrue(data.getScaler().isPresent());
        assertEquals(33, data.getScaler().get().getSamplesSeen());
        assertEquals(FeatureLayout.VERSION, data.getFeatureLayoutVersion());
        assertEquals("run-7", data.getRunId());

        ArgumentCaptor<HoldoutState> captor = ArgumentCaptor.forClass(HoldoutState.class);
        verify(holdoutStore).save(eq("run-7"), captor.capture());
        assertEquals(split.getTestIds(), captor.getValue().getTestIds());
        assertEquals(7L, captor.getValue().getRandomSeed());
    }

    @Test
    public void testMatricesUseTrainStatistics() {
        PreparedData data = new TrainingDataPreparer().prepare(positives, unlabeled, config, 7L);

        FeatureMatrix train = data.trainMatrix();
        FeatureMatrix test = data.testMatrix();
        assertEquals(33, train.getRows());
        assertEquals(FeatureLayout.DIMENSIONS, train.getColumns());
        assertEquals(9, test.getRows());
        assertEquals(13, data.validationMatrix().getRows());
        assertEquals(data.getSplitResult().getTestIds(), test.getIds());
        int[] labels = train.getLabels();
        for (int i = 0; i < train.getRows(); i++) {
            String id = train.getIds().get(i);
            int expected = id.equals("meter-0") || id.equals("meter-13") || id.equals("meter-26")
                    || id.equals("meter-39") || id.equals("meter-52") ? 1 : 0;
            assertEquals(expected, labels[i]);
        }
        // standardized with train statistics: every train column has mean 0
        double[][] features = train.getFeatures();
        for (int j = 0; j < train.getColumns(); j++) {
            double sum = 0;
            for (double[] row : features) {
                sum += row[j];
            }
            assertEquals(0.0, sum / train.getRows(), 1e-6);
        }
    }

    @Test
    public void testSameSeedReproducesSplit() {
        TrainingDataPreparer preparer = new TrainingDataPreparer();
        PreparedData first = preparer.prepare(positives, unlabeled, config, 3L);
        PreparedData second = preparer.prepare(positives, unlabeled, config, 3L);

        assertEquals(first.getSplitResult().getTestIds(), second.getSplitResult().getTestIds());
        assertEquals(first.getSplitResult().getTrain().ids(), second.getSplitResult().getTrain().ids());
        assertEquals(first.getPrior(), second.getPrior());
    }

    @Test
    public void testWithoutShuffleSplitFollowsPoolOrder() {
        PreparationConfig ordered = config.toBuilder().shuffleBeforeSplit(false).standardizeFeatures(false).build();

        PreparedData data = new TrainingDataPreparer().prepare(positives, unlabeled, ordered);

        List<String> train = data.getSplitResult().getTrain().ids();
        assertEquals(data.getSplitResult().getTrain().ids(Label.POSITIVE), train.subList(0, 5));
        assertFalse(data.getScaler().isPresent());
        assertEquals(42L, ordered.getRandomSeed());
    }

    @Test
    public void testOverlapIsRemovedBeforeAssembly() {
        List<RawSample> overlapping = new ArrayList<>(unlabeled);
        overlapping.addAll(positives);

        PreparedData data = new TrainingDataPreparer().prepare(positives, overlapping, config, 7L);

        Set<String> positiveIds = new HashSet<>();
        Set<String> unlabeledIds = new HashSet<>();
        SplitResult split = data.getSplitResult();
        for (SamplePool pool : new SamplePool[] {
                split.getTrain(), split.getValidation(), split.getTest() }) {
            positiveIds.addAll(pool.ids(Label.POSITIVE));
            unlabeledIds.addAll(pool.ids(Label.UNLABELED));
        }
        positiveIds.retainAll(unlabeledIds);
        assertThat(positiveIds, empty());
        assertEquals(55, split.totalSize());
    }

    @Test
    public void testFailures() {
        TrainingDataPreparer preparer = new TrainingDataPreparer(holdoutStore);
        assertThrows(InsufficientPositiveSamplesException.class,
                () -> preparer.prepare(Collections.emptyList(), unlabeled, config, 1L));
        assertThrows(InsufficientUnlabeledSamplesException.class,
                () -> preparer.prepare(positives, Collections.emptyList(), config, 1L));
        assertThrows(PriorEstimationException.class,
                () -> preparer.prepare(positives.subList(0, 1), unlabeled, config, 1L));
        PreparationConfig badRatios = config.toBuilder().splitRatios(0, 0, 0).build();
        assertThrows(ValidationException.class, () -> preparer.prepare("bad", positives, unlabeled, badRatios, 1L));
        verify(holdoutStore, never()).save(anyString(), any());
    }

    @Test
    public void testExistingHoldoutIsNotOverwritten() {
        InMemoryHoldoutStore store = new InMemoryHoldoutStore();
        TrainingDataPreparer preparer = new TrainingDataPreparer(store);
        PreparedData data = preparer.prepare("run-1", positives, unlabeled, config, 7L);

        assertEquals(data.getSplitResult().getTestIds(), store.load("run-1").get().getTestIds());
        assertThrows(IllegalStateException.class, () -> preparer.prepare("run-1", positives, unlabeled, config, 8L));
        assertEquals(1, store.size());
    }

    @Test
    public void testExistingHoldoutIsCheckedFirst() {
        when(holdoutStore.contains("taken")).thenReturn(true);
        TrainingDataPreparer preparer = new TrainingDataPreparer(holdoutStore);
        assertThrows(IllegalStateException.class, () -> preparer.prepare("taken", positives, unlabeled, config, 1L));
        verify(holdoutStore, never()).save(anyString(), any());
    }

    @Test
    public void testDistinctById() {
        List<RawSample> merged = TrainingDataPreparer.distinctById(positives, unlabeled);
        assertEquals(65, merged.size());
        List<RawSample> again = TrainingDataPreparer.distinctById(positives, merged);
        assertEquals(65, again.size());
        assertTrue(again.get(0).isPositiveLabel());
    }
}
