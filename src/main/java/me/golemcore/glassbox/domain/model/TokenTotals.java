package me.golemcore.glassbox.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Cumulative prompt/completion token counters of an execution.
 */
public record TokenTotals(long tokensIn, long tokensOut) {

    public static final TokenTotals ZERO = new TokenTotals(0, 0);

    public TokenTotals plus(long in, long out) {
        return new TokenTotals(tokensIn + Math.max(0, in), tokensOut + Math.max(0, out));
    }

    /**
     * Component-wise maximum; used so that stored counters never go backwards.
     */
    public TokenTotals max(TokenTotals other) {
        return new TokenTotals(Math.max(tokensIn, other.tokensIn), Math.max(tokensOut, other.tokensOut));
    }
}
