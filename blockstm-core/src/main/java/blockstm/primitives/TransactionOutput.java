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

package blockstm.primitives;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;

import static blockstm.utils.Invariants.checkArgument;
import static blockstm.utils.Invariants.nonNull;

/**
 * What one execution of a transaction produced: full writes, aggregator deltas and events, plus the gas and output
 * size the block limits are charged with. Keys must be {@link Comparable} so write sets iterate deterministically;
 * a key is never both written and updated by a delta.
 */
public final class TransactionOutput<K, V, E>
{
    private static final TransactionOutput<?, ?, ?> EMPTY = new TransactionOutput<>(ImmutableSortedMap.of(), ImmutableSortedMap.of(), ImmutableList.of(), 0, 0, 0);

    public final ImmutableSortedMap<K, WriteOp<V>> writes;
    public final ImmutableSortedMap<K, DeltaOp> deltas;
    public final ImmutableList<E> events;
    public final long executionGas;
    public final long ioGas;
    public final long outputSize;

    public TransactionOutput(ImmutableSortedMap<K, WriteOp<V>> writes, ImmutableSortedMap<K, DeltaOp> deltas, ImmutableList<E> events,
                             long executionGas, long ioGas, long outputSize)
    {
        checkArgument(executionGas >= 0 && ioGas >= 0 && outputSize >= 0, "Negative gas or output size");
        for (K key : deltas.keySet())
            checkArgument(!writes.containsKey(key), "Key %s is both written and updated by a delta", key);
        this.writes = writes;
        this.deltas = deltas;
        this.events = events;
        this.executionGas = executionGas;
        this.ioGas = ioGas;
        this.outputSize = outputSize;
    }

    @SuppressWarnings("unchecked")
    public static <K, V, E> TransactionOutput<K, V, E> empty()
    {
        return (TransactionOutput<K, V, E>) EMPTY;
    }

    public static <K, V, E> Builder<K, V, E> builder()
    {
        return new Builder<>();
    }

    public long totalGas()
    {
        return executionGas + ioGas;
    }

    public ImmutableSet<K> modifiedKeys()
    {
        return ImmutableSet.<K>builder().addAll(writes.keySet()).addAll(deltas.keySet()).build();
    }

    @Override
    public String toString()
    {
        return "{writes:" + writes + ", deltas:" + deltas + ", events:" + events + ", gas:" + executionGas + '+' + ioGas + '}';
    }

    public static class Builder<K, V, E>
    {
        private final Map<K, WriteOp<V>> writes = new TreeMap<>();
        private final Map<K, DeltaOp> deltas = new TreeMap<>();
        private final List<E> events = new ArrayList<>();
        private long executionGas, ioGas;
        private long outputSize = -1;

        public Builder<K, V, E> write(K key, V value)
        {
            writes.put(nonNull(key), WriteOp.value(value));
            return this;
        }

        public Builder<K, V, E> delete(K key)
        {
            writes.put(nonNull(key), WriteOp.deletion());
            return this;
        }

        public Builder<K, V, E> delta(K key, DeltaOp delta)
        {
            deltas.put(nonNull(key), nonNull(delta));
            return this;
        }

        public Builder<K, V, E> event(E event)
        {
            events.add(nonNull(event));
            return this;
        }

        public Builder<K, V, E> executionGas(long executionGas)
        {
            this.executionGas = executionGas;
            return this;
        }

        public Builder<K, V, E> ioGas(long ioGas)
        {
            this.ioGas = ioGas;
            return this;
        }

        public Builder<K, V, E> outputSize(long outputSize)
        {
            this.outputSize = outputSize;
            return this;
        }

        /**
         * If no output size was given, one unit is charged for every write, delta and event.
         */
        public TransactionOutput<K, V, E> build()
        {
            long size = outputSize >= 0 ? outputSize : writes.size() + deltas.size() + events.size();
            return new TransactionOutput<>(ImmutableSortedMap.copyOf(writes), ImmutableSortedMap.copyOf(deltas), ImmutableList.copyOf(events),
                                           executionGas, ioGas, size);
        }
    }
}
