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

package com.amazon.puprep.state;

import static com.amazon.puprep.CommonUtils.checkArgument;
import static com.amazon.puprep.CommonUtils.checkNotNull;

import com.amazon.puprep.features.FeatureLayout;
import com.amazon.puprep.preprocessor.FeatureScaler;

public class ScalerMapper implements IStateMapper<FeatureScaler, ScalerState> {

    @Override
    public ScalerState toState(FeatureScaler model) {
        checkNotNull(model, "scaler must not be null");
        checkArgument(model.isFitted(), "only a fitted scaler has a state");
        ScalerState state = new ScalerState();
        state.setFeatureLayoutVersion(FeatureLayout.VERSION);
        state.setMeans(model.getMeans());
        state.setScales(model.getScales());
        state.setSamplesSeen(model.getSamplesSeen());
        return state;
    }

    @Override
    public FeatureScaler toModel(ScalerState state) {
        checkNotNull(state, "state must not be null");
        checkArgument(Version.V1_0.equals(state.getVersion()), "unsupported scaler state version "
                + state.getVersion());
        checkArgument(FeatureLayout.VERSION.equals(state.getFeatureLayoutVersion()),
                "scaler was fitted on feature layout " + state.getFeatureLayoutVersion() + ", current layout is "
                        + FeatureLayout.VERSION);
        return new FeatureScaler(state.getMeans(), state.getScales(), state.getSamplesSeen());
    }
}
