package io.mobilitytools.algorithms.text;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Rabin–Karp substring search with a rolling polynomial hash.
///
/// # Hash
///
/// Base [#BASE] over UTF-16 code units, reduced modulo [#MODULUS]:
///
/// ```text
///   hash(s[i, i+m)) = (s[i]·B^(m-1) + s[i+1]·B^(m-2) + ... + s[i+m-1])  mod Q
///
///   next = (B · (hash - s[i]·B^(m-1)) + s[i+m])  mod Q
/// ```
///
/// The modulus is small, so equal hashes are common; every hash hit is confirmed
/// character by character before its index is reported. Expected time is
/// O(n + m), worst case O(n·m).
public final class RabinKarp {

    /// Alphabet radix.
    public static final int BASE = 256;
    /// Prime modulus for window hashes.
    public static final int MODULUS = 101;

    private RabinKarp() {
        // Utility class
    }

    /// Finds every starting index of `pattern` in `text`, overlapping matches included.
    ///
    /// @return ascending match indices; empty when either string is empty or the
    ///     pattern is longer than the text
    public static List<Integer> search(String text, String pattern) {
        Objects.requireNonNull(text, "text cannot be null");
        Objects.requireNonNull(pattern, "pattern cannot be null");
        List<Integer> matches = new ArrayList<>();
        int n = text.length();
        int m = pattern.length();
        if (m == 0 || n == 0 || m > n) {
            return matches;
        }

        // BASE^(m-1) mod MODULUS, the weight of a window's leading character
        long leadWeight = 1;
        for (int i = 0; i < m - 1; i++) {
            leadWeight = (leadWeight * BASE) % MODULUS;
        }

        long patternHash = 0;
        long windowHash = 0;
        for (int i = 0; i < m; i++) {
            patternHash = (BASE * patternHash + pattern.charAt(i)) % MODULUS;
            windowHash = (BASE * windowHash + text.charAt(i)) % MODULUS;
        }

        for (int i = 0; i <= n - m; i++) {
            if (patternHash == windowHash && text.regionMatches(i, pattern, 0, m)) {
                matches.add(i);
            }
            if (i < n - m) {
                windowHash = Math.floorMod(
                    BASE * (windowHash - text.charAt(i) * leadWeight) + text.charAt(i + m), (long) MODULUS);
            }
        }
        return matches;
    }
}
