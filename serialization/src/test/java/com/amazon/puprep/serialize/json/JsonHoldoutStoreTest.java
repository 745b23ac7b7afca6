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

package com.amazon.puprep.serialize.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.puprep.PreparedData;
import com.amazon.puprep.TrainingDataPreparer;
import com.amazon.puprep.config.PreparationConfig;
import com.amazon.puprep.inputtypes.RawSample;
import com.amazon.puprep.state.HoldoutState;
import com.amazon.puprep.testutils.MeterDataSets;

public class JsonHoldoutStoreTest {

    @TempDir
    Path directory;

    private JsonHoldoutStore store;

    @BeforeEach
    public void setUp() {
        store = new JsonHoldoutStore(directory.resolve("holdouts"));
    }

    private static HoldoutState state(String runId, String... ids) {
        HoldoutState state = new HoldoutState();
        state.setRunId(runId);
        state.setFeatureLayoutVersion("v1");
        state.setRandomSeed(7L);
        state.setTrainRatio(0.6);
        state.setValidationRatio(0.25);
        state.setTestRatio(0.15);
        state.setTestIds(Arrays.asList(ids));
        state.setCreatedAt(1_700_000_000_000L);
        return state;
    }

    @Test
    public void testSaveAndLoad() {
        HoldoutState state = state("run-1", "a", "b", "c");

        store.save("run-1", state);

        assertTrue(store.contains("run-1"));
        assertTrue(Files.exists(directory.resolve("holdouts").resolve("run-1.json")));
        Optional<HoldoutState> loaded = store.load("run-1");
        assertTrue(loaded.isPresent());
        assertEquals(state, loaded.get());
        assertFalse(store.load("run-2").isPresent());
    }

    @Test
    public void testHoldoutIsWrittenOnce() throws IOException {
        store.save("run-1", state("run-1", "a"));
        assertThrows(IllegalStateException.class, () -> store.save("run-1", state("run-1", "b")));
        assertEquals(Arrays.asList("a"), store.load("run-1").get().getTestIds());
        try (Stream<Path> files = Files.list(directory.resolve("holdouts"))) {
            assertEquals(1, files.count());
        }
    }

    @Test
    public void testFailedWriteLeavesNoHoldout() throws IOException {
        HoldoutState unwritable = new HoldoutState() {
            @Override
            public List<String> getTestIds() {
                throw new IllegalStateException("device full");
            }
        };
        unwritable.setRunId("run-1");

        assertThrows(UncheckedIOException.class, () -> store.save("run-1", unwritable));

        assertFalse(store.contains("run-1"));
        assertFalse(store.load("run-1").isPresent());
        try (Stream<Path> files = Files.list(directory.resolve("holdouts"))) {
            assertEquals(0, files.count());
        }

        store.save("run-1", state("run-1", "a", "b"));
        assertEquals(Arrays.asList("a", "b"), store.load("run-1").get().getTestIds());
    }

    @ParameterizedTest
    @ValueSource(strings = { "../escape", "a/b", "", ".hidden", "run 1" })
    public void testRunIdMustBeAFileName(String runId) {
        assertThrows(IllegalArgumentException.class, () -> store.save(runId, state(runId)));
    }

    @Test
    public void testCorruptFile() throws IOException {
        Path base = directory.resolve("holdouts");
        Files.createDirectories(base);
        Files.write(base.resolve("broken.json"), "{ not json".getBytes(StandardCharsets.UTF_8));
        assertThrows(UncheckedIOException.class, () -> store.load("broken"));
    }

    @Test
    public void testPreparerWritesHoldout() {
        MeterDataSets.MeterSeries series = new MeterDataSets().generate(120, Instant.parse("2024-03-01T00:00:00Z")
                .toEpochMilli(), 5L);
        List<RawSample> positives = new ArrayList<>();
        List<RawSample> unlabeled = new ArrayList<>();
        for (int i = 0; i < series.size(); i++) {
            double[] c = series.getChannels()[i];
            boolean positive = i % 10 == 0;
            RawSample sample = new RawSample("m-" + i, "m", Instant.ofEpochMilli(series.getTimestamps()[i]), c[0],
                    c[1], c[2], c[3], c[4], positive);
            (positive ? positives : unlabeled).add(sample);
        }

        TrainingDataPreparer preparer = new TrainingDataPreparer(store);
        PreparedData data = preparer.prepare("exp-42", positives, unlabeled, PreparationConfig.builder().build(), 42L);

        HoldoutState saved = store.load("exp-42").get();
        assertEquals(data.getSplitResult().getTestIds(), saved.getTestIds());
        assertEquals("v1", saved.getFeatureLayoutVersion());
        assertEquals(0.7, saved.getTrainRatio(), 1e-9);
        assertThrows(IllegalStateException.class,
                () -> preparer.prepare("exp-42", positives, unlabeled, PreparationConfig.builder().build(), 42L));
    }
}
