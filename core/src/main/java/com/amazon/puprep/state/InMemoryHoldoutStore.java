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

import static com.amazon.puprep.CommonUtils.checkNotNull;
import static com.amazon.puprep.CommonUtils.checkState;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * A {@link HoldoutStore} kept in memory, for tests and single-process use.
 */
public class InMemoryHoldoutStore implements HoldoutStore {

    private final ConcurrentMap<String, HoldoutState> holdouts = new ConcurrentHashMap<>();

    @Override
    public void save(String runId, HoldoutState state) {
        checkNotNull(runId, "runId must not be null");
        checkNotNull(state, "state must not be null");
        HoldoutState previous = holdouts.putIfAbsent(runId, state);
        checkState(previous == null, "a holdout already exists for run " + runId);
    }

    @Override
    public Optional<HoldoutState> load(String runId) {
        checkNotNull(runId, "runId must not be null");
        return Optional.ofNullable(holdouts.get(runId));
    }

    @Override
    public boolean contains(String runId) {
        return holdouts.containsKey(runId);
    }

    public int size() {
        return holdouts.size();
    }
}
