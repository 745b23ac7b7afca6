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

import java.util.Optional;

/**
 * Durable storage of holdout test ids, one entry per run id. A holdout is
 * written once: implementations reject a second save for the same run id with
 * an {@link IllegalStateException}.
 */
public interface HoldoutStore {

    void save(String runId, HoldoutState state);

    Optional<HoldoutState> load(String runId);

    boolean contains(String runId);
}
