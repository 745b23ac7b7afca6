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

package com.amazon.puprep.inputtypes;

import static com.amazon.puprep.CommonUtils.checkNotNull;
import static com.amazon.puprep.CommonUtils.valueOrZero;

import java.time.Instant;

import lombok.Getter;

/**
 * One timestamped power-meter reading as delivered by the ingestion layer. The
 * channel readings may be missing (null); the total is expected to be close to
 * the sum of the 110V and 220V channels but this is not checked here.
 */
@Getter
public class RawSample {

    private final String id;

    private final String datasetId;

    private final Instant timestamp;

    private final Double rawWattageL1;

    private final Double rawWattageL2;

    private final Double wattage110v;

    private final Double wattage220v;

    private final Double wattageTotal;

    private final boolean positiveLabel;

    public RawSample(String id, String datasetId, Instant timestamp, Double rawWattageL1, Double rawWattageL2,
            Double wattage110v, Double wattage220v, Double wattageTotal, boolean positiveLabel) {
        this.id = checkNotNull(id, "id must not be null");
        this.datasetId = checkNotNull(datasetId, "datasetId must not be null");
        this.timestamp = checkNotNull(timestamp, "timestamp must not be null");
        this.rawWattageL1 = rawWattageL1;
        this.rawWattageL2 = rawWattageL2;
        this.wattage110v = wattage110v;
        this.wattage220v = wattage220v;
        this.wattageTotal = wattageTotal;
        this.positiveLabel = positiveLabel;
    }

    public double l1OrZero() {
        return valueOrZero(rawWattageL1);
    }

    public double l2OrZero() {
        return valueOrZero(rawWattageL2);
    }

    public double wattage110vOrZero() {
        return valueOrZero(wattage110v);
    }

    public double wattage220vOrZero() {
        return valueOrZero(wattage220v);
    }

    public double totalOrZero() {
        return valueOrZero(wattageTotal);
    }

    @Override
    public String toString() {
        return "RawSample(id=" + id + ", datasetId=" + datasetId + ", timestamp=" + timestamp + ")";
    }
}
