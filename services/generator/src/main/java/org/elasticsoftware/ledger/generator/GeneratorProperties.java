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

package org.elasticsoftware.ledger.generator;

import jakarta.annotation.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param clients      client ids are drawn from {@code 1 .. clients-1}
 * @param transactions number of transactions to write
 * @param seed         seed for reproducible output, random when not set
 */
@ConfigurationProperties(prefix = "ledger.generator")
public record GeneratorProperties(
        @DefaultValue("65535") int clients,
        @DefaultValue("4294967295") long transactions,
        @Nullable Long seed
) {
}
