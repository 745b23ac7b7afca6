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

/**
 * The three time scales over which window statistics are computed. The
 * declaration order is the order of the statistic blocks in a feature vector.
 */
public enum WindowScale {

    SHORT("short"),

    MEDIUM("medium"),

    LONG("long");

    private final String prefix;

    WindowScale(String prefix) {
        this.prefix = prefix;
    }

    /**
     * @return the prefix used for feature names of this scale
     */
    public String getPrefix() {
        return prefix;
    }
}
