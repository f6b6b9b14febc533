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

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

/**
 * The outcome of executing a block: one {@link TransactionResult} per transaction in block order, the union of all
 * committed writes (later transactions overriding earlier ones) and every committed event in block order.
 */
public final class BlockOutput<K, V, E>
{
    public final ImmutableList<TransactionResult<K, V, E>> results;
    public final ImmutableSortedMap<K, WriteOp<V>> writes;
    public final ImmutableList<E> events;
    public final ExecutionMode mode;
    public final BlockExecutionStats stats;

    private BlockOutput(ImmutableList<TransactionResult<K, V, E>> results, ImmutableSortedMap<K, WriteOp<V>> writes, ImmutableList<E> events,
                        ExecutionMode mode, BlockExecutionStats stats)
    {
        this.results = results;
        this.writes = writes;
        this.events = events;
        this.mode = mode;
        this.stats = stats;
    }

    public static <K, V, E> BlockOutput<K, V, E> of(List<TransactionResult<K, V, E>> results, ExecutionMode mode, BlockExecutionStats stats)
    {
        Map<K, WriteOp<V>> writes = new TreeMap<>();
        ImmutableList.Builder<E> events = ImmutableList.builder();
        for (TransactionResult<K, V, E> result : results)
        {
            writes.putAll(result.writes);
            events.addAll(result.events);
        }
        return new BlockOutput<>(ImmutableList.copyOf(results), ImmutableSortedMap.copyOf(writes), events.build(), mode, stats);
    }

    public TransactionResult<K, V, E> result(int txnIndex)
    {
        return results.get(txnIndex);
    }

    public int committedCount()
    {
        int count = 0;
        while (count < results.size() && results.get(count).kind.isCommitted())
            ++count;
        return count;
    }

    @Override
    public String toString()
    {
        return mode + "{results:" + results + ", writes:" + writes + '}';
    }
}
