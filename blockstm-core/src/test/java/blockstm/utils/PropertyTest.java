/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package blockstm.utils;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import blockstm.utils.Property.PropertyError;

import static blockstm.utils.Property.qt;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class PropertyTest
{
    @Test
    void sameSeedGeneratesSameExamples()
    {
        List<Long> first = new ArrayList<>(), second = new ArrayList<>();
        qt().withSeed(42).withExamples(20).forAll(Gens.longs().between(0, 1000)).check(first::add);
        qt().withSeed(42).withExamples(20).forAll(Gens.longs().between(0, 1000)).check(second::add);

        assertThat(first).hasSize(20).isEqualTo(second);
        assertThat(first).allSatisfy(v -> assertThat(v).isBetween(0L, 1000L));
    }

    @Test
    void failureReportsTheSeedThatReplaysIt()
    {
        List<List<Integer>> seen = new ArrayList<>();
        PropertyError error = catchThrowableOfType(() -> qt().withSeed(7).forAll(Gens.lists(Gens.ints().between(0, 99)).ofSize(3)).check(list -> {
            seen.add(list);
            assertThat(list).allSatisfy(v -> assertThat(v).isLessThan(90));
        }), PropertyError.class);

        assertThat(error).isNotNull();
        assertThat(error.getMessage()).contains("Seed = " + error.seed);
        List<Integer> failing = seen.get(seen.size() - 1);

        List<List<Integer>> replayed = new ArrayList<>();
        qt().withSeed(error.seed).withExamples(1).forAll(Gens.lists(Gens.ints().between(0, 99)).ofSize(3)).check(replayed::add);
        assertThat(replayed).containsExactly(failing);
    }
}
