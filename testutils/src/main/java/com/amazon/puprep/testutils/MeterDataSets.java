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

package com.amazon.puprep.testutils;

import java.util.Arrays;
import java.util.Random;

/**
 * Generates synthetic power-meter series: irregularly spaced readings of a base
 * load with Gaussian noise on both lines, and occasional spikes where the load
 * jumps by a large factor. The channels of a reading are, in order, raw L1, raw
 * L2, 110V wattage, 220V wattage and total wattage; the total is the sum of the
 * 110V and 220V channels.
 */
public class MeterDataSets {

    public static final int CHANNELS = 5;

    private final double baseLoad;
    private final double noiseSigma;
    private final double spikeFactor;
    private final double spikeProbability;
    private final long meanStepMillis;

    public MeterDataSets(double baseLoad, double noiseSigma, double spikeFactor, double spikeProbability,
            long meanStepMillis) {
        this.baseLoad = baseLoad;
        this.noiseSigma = noiseSigma;
        this.spikeFactor = spikeFactor;
        this.spikeProbability = spikeProbability;
        this.meanStepMillis = meanStepMillis;
    }

    public MeterDataSets() {
        this(400.0, 25.0, 4.0, 0.05, 60_000L);
    }

    /**
     * @param numberOfReadings the number of readings
     * @param startMillis      timestamp of the first reading
     * @param seed             random seed; the same seed gives the same series
     * @return the generated series
     */
    public MeterSeries generate(int numberOfReadings, long startMillis, long seed) {
        Random random = new Random(seed);
        long[] timestamps = new long[numberOfReadings];
        double[][] channels = new double[numberOfReadings][CHANNELS];
        int[] spikes = new int[numberOfReadings];
        int numberOfSpikes = 0;

        long time = startMillis;
        for (int i = 0; i < numberOfReadings; i++) {
            timestamps[i] = time;
            boolean spike = random.nextDouble() < spikeProbability;
            double load = baseLoad * (spike ? spikeFactor : 1.0);
            if (spike) {
                spikes[numberOfSpikes++] = i;
            }
            double l1 = Math.max(0, load / 2 + noiseSigma * random.nextGaussian());
            double l2 = Math.max(0, load / 2 + noiseSigma * random.nextGaussian());
            double low = 0.3 * (l1 + l2);
            double high = 0.7 * (l1 + l2);
            channels[i] = new double[] { l1, l2, low, high, low + high };
            // irregular sampling: steps between half and one and a half mean steps
            time += meanStepMillis / 2 + (long) (random.nextDouble() * meanStepMillis);
        }
        return new MeterSeries(timestamps, channels, Arrays.copyOf(spikes, numberOfSpikes));
    }

    public static class MeterSeries {

        private final long[] timestamps;
        private final double[][] channels;
        private final int[] spikeIndices;

        public MeterSeries(long[] timestamps, double[][] channels, int[] spikeIndices) {
            this.timestamps = timestamps;
            this.channels = channels;
            this.spikeIndices = spikeIndices;
        }

        public int size() {
            return timestamps.length;
        }

        /**
         * @return reading times in milliseconds since the epoch, increasing
         */
        public long[] getTimestamps() {
            return timestamps;
        }

        public double[][] getChannels() {
            return channels;
        }

        /**
         * @return indices of the readings that carry a spike, increasing
         */
        public int[] getSpikeIndices() {
            return spikeIndices;
        }
    }
}
