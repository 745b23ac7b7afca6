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

import static com.amazon.puprep.CommonUtils.checkArgument;
import static com.amazon.puprep.CommonUtils.checkNotNull;

import java.util.Arrays;

import com.amazon.puprep.util.ArrayUtils;

/**
 * An immutable, ordered sequence of feature values produced for one sample.
 * The ordering of the values is described by
 * {@link com.amazon.puprep.features.FeatureLayout}.
 */
public class FeatureVector {

    private final double[] values;

    public FeatureVector(double[] values) {
        checkNotNull(values, "values must not be null");
        checkArgument(values.length > 0, "a feature vector cannot be empty");
        this.values = ArrayUtils.cleanCopy(values);
    }

    /**
     * @return a copy of the values
     */
    public double[] getValues() {
        return Arrays.copyOf(values, values.length);
    }

    public double get(int index) {
        checkArgument(index >= 0 && index < values.length, "incorrect index " + index);
        return values[index];
    }

    public int size() {
        return values.length;
    }

    /**
     * @param from start position, inclusive
     * @param to   end position, exclusive
     * @return a copy of the values in [from, to)
     */
    public double[] slice(int from, int to) {
        checkArgument(from >= 0 && from <= to && to <= values.length, "incorrect range");
        return Arrays.copyOfRange(values, from, to);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FeatureVector)) {
            return false;
        }
        return Arrays.equals(values, ((FeatureVector) other).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector" + Arrays.toString(values);
    }
}
