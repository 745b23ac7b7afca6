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

package com.amazon.puprep.returntypes;

/**
 * The PU label of a pool entry. There is no negative class: an unlabeled entry
 * may still be a hidden positive.
 */
public enum Label {

    POSITIVE(1),

    UNLABELED(0);

    private final int value;

    Label(int value) {
        this.value = value;
    }

    /**
     * @return the numeric label handed to the trainer, 1 for positive and 0 for
     *         unlabeled
     */
    public int getValue() {
        return value;
    }
}
