/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.episim.simulation;

import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Derives an independent random stream for every trial.
///
/// A trial's stream depends only on the top-level seed, the identifiers in its seed set
/// and its trial index. Where the seed set sits in the enumeration, which thread runs the
/// trial and how many trials ran before it have no influence on its outcome.
///
/// Streams are XoShiRo256++ generators from Apache Commons RNG.
public final class RandomStreams {

    private static final RandomSource SOURCE = RandomSource.XO_SHI_RO_256_PP;

    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private RandomStreams() {
    }

    /// Creates the stream for one trial.
    public static RestorableUniformRandomProvider forTrial(long topSeed, List<String> seeds, int trialIndex) {
        return SOURCE.create(trialSeed(topSeed, seeds, trialIndex));
    }

    /// The 64-bit seed of a trial's stream.
    public static long trialSeed(long topSeed, List<String> seeds, int trialIndex) {
        long z = mix(topSeed);
        z = mix(z ^ seedSetKey(seeds));
        return mix(z + trialIndex);
    }

    /// A stable hash of the seed set that ignores the order its members were given in.
    static long seedSetKey(List<String> seeds) {
        List<String> sorted = new ArrayList<>(seeds);
        Collections.sort(sorted);
        long hash = FNV_OFFSET;
        for (String seed : sorted) {
            for (byte b : seed.getBytes(StandardCharsets.UTF_8)) {
                hash ^= (b & 0xff);
                hash *= FNV_PRIME;
            }
            // separator, so {"ab"} and {"a", "b"} differ
            hash ^= 0xff;
            hash *= FNV_PRIME;
        }
        return hash;
    }

    /// Stafford's variant 13 of the SplitMix64 finalizer.
    private static long mix(long z) {
        z += 0x9e3779b97f4a7c15L;
        z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
        z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
        return z ^ (z >>> 31);
    }
}
