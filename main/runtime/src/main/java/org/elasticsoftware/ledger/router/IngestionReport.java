/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.ledger.router;

import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;

/**
 * Outcome of routing commands: how many were accepted, how many rejected and why.
 *
 * @param rejections number of rejected commands per error event type
 */
public record IngestionReport(long accepted, long rejected, Map<String, Long> rejections) {
    public static final IngestionReport EMPTY = new IngestionReport(0L, 0L, Map.of());

    public IngestionReport {
        rejections = Map.copyOf(rejections);
    }

    public long processed() {
        return accepted + rejected;
    }

    public static IngestionReport merge(Collection<IngestionReport> reports) {
        long accepted = 0L;
        long rejected = 0L;
        Map<String, Long> rejections = new TreeMap<>();
        for (IngestionReport report : reports) {
            accepted += report.accepted();
            rejected += report.rejected();
            report.rejections().forEach((type, count) -> rejections.merge(type, count, Long::sum));
        }
        return new IngestionReport(accepted, rejected, rejections);
    }
}
