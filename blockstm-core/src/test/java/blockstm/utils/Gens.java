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

public class Gens
{
    private Gens()
    {
    }

    public static Ints ints()
    {
        return new Ints();
    }

    public static Longs longs()
    {
        return new Longs();
    }

    public static <T> Lists<T> lists(Gen<T> elements)
    {
        return new Lists<>(elements);
    }

    public static class Ints
    {
        /** inclusive of both bounds */
        public Gen.IntGen between(int min, int max)
        {
            Invariants.checkArgument(min <= max, "Empty range [%s, %s]", min, max);
            return random -> (int) random.nextLong(min, (long) max + 1);
        }
    }

    public static class Longs
    {
        /** inclusive of both bounds */
        public Gen.LongGen between(long min, long max)
        {
            Invariants.checkArgument(min <= max, "Empty range [%s, %s]", min, max);
            if (max < Long.MAX_VALUE)
                return random -> random.nextLong(min, max + 1);
            return random -> {
                long value;
                do value = random.nextLong();
                while (value < min);
                return value;
            };
        }
    }

    public static class Lists<T>
    {
        private final Gen<T> elements;

        Lists(Gen<T> elements)
        {
            this.elements = elements;
        }

        public Gen<List<T>> ofSize(int size)
        {
            return random -> {
                List<T> list = new ArrayList<>(size);
                for (int i = 0; i < size; ++i)
                    list.add(elements.next(random));
                return list;
            };
        }
    }
}
