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

package org.elasticsoftware.ledger.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point helpers for currency amounts. All amounts in the ledger carry exactly {@link #SCALE}
 * fractional digits so that {@link BigDecimal#equals(Object)} can be used for structural comparison.
 */
public final class Amounts {
    public static final int SCALE = 4;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private Amounts() {
    }

    public static BigDecimal of(long unscaledValue) {
        return BigDecimal.valueOf(unscaledValue, SCALE);
    }

    /**
     * Normalizes the amount to {@link #SCALE} fractional digits.
     *
     * @throws ArithmeticException when the amount has more significant fractional digits than allowed
     */
    public static BigDecimal normalize(BigDecimal amount) {
        return amount.setScale(SCALE, RoundingMode.UNNECESSARY);
    }

    public static boolean isRepresentable(BigDecimal amount) {
        return amount.stripTrailingZeros().scale() <= SCALE;
    }

    public static BigDecimal parse(String value) {
        return normalize(new BigDecimal(value.trim()));
    }

    public static String format(BigDecimal amount) {
        return normalize(amount).toPlainString();
    }
}
