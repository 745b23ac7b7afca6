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

import static com.amazon.puprep.CommonUtils.checkNotNull;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

import com.amazon.puprep.preprocessor.FeatureScaler;
import com.amazon.puprep.state.ScalerMapper;
import com.amazon.puprep.state.ScalerState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Converts a fitted {@link FeatureScaler} to and from JSON through its
 * {@link ScalerState}, so that inference can standardize with the statistics
 * of the training partition.
 */
public class ScalerJsonConverter {

    private final ObjectMapper mapper = new ObjectMapper();

    private final ScalerMapper scalerMapper = new ScalerMapper();

    public String toJson(FeatureScaler scaler) {
        try {
            return mapper.writeValueAsString(scalerMapper.toState(scaler));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("could not serialize scaler", e);
        }
    }

    public FeatureScaler fromJson(String json) {
        checkNotNull(json, "json must not be null");
        try {
            return scalerMapper.toModel(mapper.readValue(json, ScalerState.class));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("could not parse scaler state", e);
        }
    }

    public void write(FeatureScaler scaler, Path file) {
        checkNotNull(file, "file must not be null");
        try {
            mapper.writeValue(file.toFile(), scalerMapper.toState(scaler));
        } catch (IOException e) {
            throw new UncheckedIOException("could not write scaler to " + file, e);
        }
    }

    public FeatureScaler read(Path file) {
        checkNotNull(file, "file must not be null");
        try {
            return scalerMapper.toModel(mapper.readValue(file.toFile(), ScalerState.class));
        } catch (IOException e) {
            throw new UncheckedIOException("could not read scaler from " + file, e);
        }
    }
}
