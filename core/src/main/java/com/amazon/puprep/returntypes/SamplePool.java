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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An ordered collection of labeled feature vectors. Every id appears at most
 * once, so no id can be both {@link Label#POSITIVE} and {@link Label#UNLABELED};
 * the constructor rejects repeated ids. A pool is never modified: slicing and
 * shuffling return new pools.
 */
public class SamplePool {

    private final List<PoolEntry> entries;

    private final int positiveCount;

    public SamplePool(List<PoolEntry> entries) {
        checkNotNull(entries, "entries must not be null");
        Set<String> ids = new HashSet<>();
        int positives = 0;
        for (PoolEntry entry : entries) {
            checkNotNull(entry, "pool entries must not be null");
            checkArgument(ids.add(entry.getId()), "id " + entry.getId() + " is listed more than once");
            if (entry.isPositive()) {
                positives++;
            }
        }
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
        this.positiveCount = positives;
    }

    public static SamplePool empty() {
        return new SamplePool(Collections.emptyList());
    }

    public List<PoolEntry> getEntries() {
        return entries;
    }

    public PoolEntry get(int index) {
        return entries.get(index);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int getPositiveCount() {
        return positiveCount;
    }

    public int getUnlabeledCount() {
        return entries.size() - positiveCount;
    }

    /**
     * @return the ids of all entries, in pool order
     */
    public List<String> ids() {
        return entries.stream().map(PoolEntry::getId).collect(Collectors.toList());
    }

    /**
     * @param label a label
     * @return the ids carrying that label, in pool order
     */
    public List<String> ids(Label label) {
        return entries.stream().filter(e -> e.getLabel() == label).map(PoolEntry::getId)
                .collect(Collectors.toList());
    }

    /**
     * @param label a label
     * @return the feature values of the entries carrying that label, one row per
     *         entry
     */
    public double[][] vectors(Label label) {
        return entries.stream().filter(e -> e.getLabel() == label).map(e -> e.getVector().getValues())
                .toArray(double[][]::new);
    }

    /**
     * @return the feature values of all entries, one row per entry
     */
    public double[][] vectors() {
        return entries.stream().map(e -> e.getVector().getValues()).toArray(double[][]::new);
    }

    /**
     * @param from start index, inclusive
     * @param to   end index, exclusive
     * @return a pool holding the entries in [from, to) in the same order
     */
    public SamplePool slice(int from, int to) {
        checkArgument(0 <= from && from <= to && to <= entries.size(),
                "incorrect slice [" + from + ", " + to + ") of a pool of size " + entries.size());
        return new SamplePool(entries.subList(from, to));
    }

    /**
     * Returns a pool with the same entries in a random order. The same seed
     * always produces the same order for the same pool.
     *
     * @param seed the random seed
     * @return the reordered pool
     */
    public SamplePool shuffled(long seed) {
        List<PoolEntry> copy = new ArrayList<>(entries);
        Collections.shuffle(copy, new Random(seed));
        return new SamplePool(copy);
    }

    @Override
    public String toString() {
        return "SamplePool(size=" + entries.size() + ", positive=" + positiveCount + ", unlabeled="
                + getUnlabeledCount() + ")";
    }
}
