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

package com.amazon.puprep.config;

import static com.amazon.puprep.CommonUtils.checkArgument;

import java.util.Locale;

/**
 * How the per-sample density ratios over the unlabeled pool are reduced to a
 * single class prior.
 */
public enum PriorMethod {

    /**
     * arithmetic mean of the density ratios; unstable when the ratio distribution
     * is heavy-tailed and tends to saturate at the upper clip
     */
    MEAN,
    /**
     * median of the density ratios; the preferred choice
     */
    MEDIAN;

    /**
     * Maps a loosely typed method name ("mean", "median", any case) to the enum.
     *
     * @param name the method name
     * @return the matching method
     */
    public static PriorMethod fromName(String name) {
        checkArgument(name != null, "prior method name must not be null");
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (PriorMethod method : values()) {
            if (method.name().equals(normalized)) {
                return method;
            }
        }
        throw new IllegalArgumentException("unknown prior method " + name);
    }

    /**
     * @return the lower case name used in job payloads and persisted records
     */
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
