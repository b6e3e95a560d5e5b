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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class PartitionUtilsTests {
    @Test
    public void testResolvePartition() {
        assertEquals(0, PartitionUtils.resolvePartition(0, 4));
        assertEquals(1, PartitionUtils.resolvePartition(5, 4));
        assertEquals(3, PartitionUtils.resolvePartition(65535, 4));
        assertEquals(0, PartitionUtils.resolvePartition(65535, 1));
    }

    @Test
    public void testInvalidPartitionCount() {
        assertThrows(IllegalArgumentException.class, () -> PartitionUtils.resolvePartition(1, 0));
    }
}
