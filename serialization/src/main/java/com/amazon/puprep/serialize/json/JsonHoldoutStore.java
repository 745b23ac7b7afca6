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

import static com.amazon.puprep.CommonUtils.checkArgument;
import static com.amazon.puprep.CommonUtils.checkNotNull;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.regex.Pattern;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.puprep.state.HoldoutState;
import com.amazon.puprep.state.HoldoutStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * A {@link HoldoutStore} writing one JSON document per run, named
 * {@code <runId>.json}, under a base directory. A document is first written
 * to a temporary file in the same directory and then moved to its final name
 * without replacing, so a failed write leaves no holdout behind and an
 * existing holdout is never overwritten even by a concurrent writer.
 */
@Slf4j
public class JsonHoldoutStore implements HoldoutStore {

    static final String SUFFIX = ".json";

    static final String TEMPORARY_SUFFIX = ".tmp";

    private static final Pattern RUN_ID = Pattern.compile("[A-Za-z0-9._-]+");

    @Getter
    private final Path baseDirectory;

    private final ObjectMapper mapper;

    public JsonHoldoutStore(Path baseDirectory) {
        this.baseDirectory = checkNotNull(baseDirectory, "base directory must not be null");
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void save(String runId, HoldoutState state) {
        checkNotNull(state, "state must not be null");
        Path file = fileFor(runId);
        if (Files.exists(file)) {
            throw new IllegalStateException("a holdout already exists for run " + runId);
        }
        Path temporary = null;
        try {
            Files.createDirectories(baseDirectory);
            temporary = Files.createTempFile(baseDirectory, runId + "-", TEMPORARY_SUFFIX);
            try (Writer writer = Files.newBufferedWriter(temporary, StandardCharsets.UTF_8,
                    StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                mapper.writeValue(writer, state);
            }
            Files.move(temporary, file);
            temporary = null;
        } catch (FileAlreadyExistsException e) {
            throw new IllegalStateException("a holdout already exists for run " + runId, e);
        } catch (IOException e) {
            throw new UncheckedIOException("could not write holdout " + file, e);
        } finally {
            if (temporary != null) {
                discard(temporary);
            }
        }
        log.debug("wrote holdout of run {} to {}", runId, file);
    }

    private static void discard(Path temporary) {
        try {
            Files.deleteIfExists(temporary);
        } catch (IOException e) {
            log.warn("could not delete temporary holdout {}", temporary, e);
        }
    }

    @Override
    public Optional<HoldoutState> load(String runId) {
        Path file = fileFor(runId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), HoldoutState.class));
        } catch (IOException e) {
            throw new UncheckedIOException("could not read holdout " + file, e);
        }
    }

    @Override
    public boolean contains(String runId) {
        return Files.exists(fileFor(runId));
    }

    Path fileFor(String runId) {
        checkNotNull(runId, "runId must not be null");
        checkArgument(RUN_ID.matcher(runId).matches() && !runId.startsWith("."),
                "run id must be made of letters, digits, '.', '_' or '-' and not start with '.': " + runId);
        return baseDirectory.resolve(runId + SUFFIX);
    }
}
