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

package com.amazon.puprep.features;

import static com.amazon.puprep.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.amazon.puprep.config.WindowScale;

/**
 * The fixed ordering of the extracted features. A vector is laid out as the
 * five current-sample readings, one block of window statistics per
 * {@link WindowScale} in declaration order, and finally the six cross-window
 * ratios. Any change to this layout must change {@link #VERSION}.
 */
public class FeatureLayout {

    /**
     * version of the layout, compared by consumers of persisted feature data
     */
    public static final String VERSION = "v1";

    public static final int CURRENT_FEATURES = 5;

    public static final int STATS_PER_WINDOW = 10;

    public static final int CROSS_RATIO_FEATURES = 6;

    public static final int CURRENT_OFFSET = 0;

    public static final int CROSS_RATIO_OFFSET = CURRENT_FEATURES + STATS_PER_WINDOW * WindowScale.values().length;

    public static final int DIMENSIONS = CROSS_RATIO_OFFSET + CROSS_RATIO_FEATURES;

    static final String[] CURRENT_NAMES = { "raw_l1", "raw_l2", "wattage_110v", "wattage_220v", "wattage_total" };

    static final String[] STAT_NAMES = { "mean", "std", "max", "min", "median", "high_power_count", "l1_l2_diff",
            "volatility", "voltage_ratio", "iqr" };

    static final String[] CROSS_RATIO_NAMES = { "short_medium_mean_ratio", "medium_long_mean_ratio",
            "short_long_mean_ratio", "short_medium_std_ratio", "medium_long_std_ratio", "short_long_std_ratio" };

    private static final List<String> NAMES = buildNames();

    private FeatureLayout() {
    }

    /**
     * @param scale a window scale
     * @return the index of the first statistic of that scale's block
     */
    public static int windowOffset(WindowScale scale) {
        return CURRENT_FEATURES + scale.ordinal() * STATS_PER_WINDOW;
    }

    /**
     * @return the feature names, in vector order
     */
    public static List<String> featureNames() {
        return NAMES;
    }

    public static String featureName(int index) {
        checkArgument(index >= 0 && index < DIMENSIONS, "feature index " + index + " out of range");
        return NAMES.get(index);
    }

    private static List<String> buildNames() {
        List<String> names = new ArrayList<>(DIMENSIONS);
        Collections.addAll(names, CURRENT_NAMES);
        for (WindowScale scale : WindowScale.values()) {
            for (String stat : STAT_NAMES) {
                names.add(scale.getPrefix() + "_" + stat);
            }
        }
        Collections.addAll(names, CROSS_RATIO_NAMES);
        return Collections.unmodifiableList(names);
    }
}
