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

package blockstm.impl;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import blockstm.api.AggregatorCodec;
import blockstm.api.Agent;
import blockstm.api.BaseStateView;
import blockstm.api.BlockExecutionException;
import blockstm.api.ExecutorConfig;
import blockstm.api.FatalVMError;
import blockstm.api.StateView;
import blockstm.api.Transaction;
import blockstm.primitives.BlockExecutionStats;
import blockstm.primitives.BlockOutput;
import blockstm.primitives.DeltaApplicationException;
import blockstm.primitives.DeltaApplicationException.Failure;
import blockstm.primitives.DeltaOp;
import blockstm.primitives.ExecutionMode;
import blockstm.primitives.ExecutionResult;
import blockstm.primitives.WriteOp;

/**
 * Executes a block one transaction at a time, in order. This defines the result parallel execution must reproduce,
 * and is the fallback when a parallel run cannot be trusted.
 */
class SequentialExecution<K, V, E>
{
    private static final Logger logger = LoggerFactory.getLogger(SequentialExecution.class);

    private final List<? extends Transaction<K, V, E>> block;
    private final BaseStateView<K, V> base;
    private final ExecutorConfig config;
    private final Agent agent;
    private final AggregatorCodec<V> codec;

    // the writes of every transaction committed so far
    private final Map<K, WriteOp<V>> state = new HashMap<>();

    SequentialExecution(List<? extends Transaction<K, V, E>> block, BaseStateView<K, V> base, ExecutorConfig config, Agent agent, AggregatorCodec<V> codec)
    {
        this.block = block;
        this.base = base;
        this.config = config;
        this.agent = agent;
        this.codec = codec;
    }

    BlockOutput<K, V, E> run(ExecutionMode mode, @Nullable BlockExecutionStats parallelStats)
    {
        CommittedResults<K, V, E> committed = new CommittedResults<>(block.size(), config, agent, mode);
        int executed = 0;
        for (int txnIndex = 0; txnIndex < block.size(); ++txnIndex)
        {
            View view = new View();
            ExecutionResult<K, V, E> result;
            try
            {
                result = block.get(txnIndex).execute(view);
            }
            catch (FatalVMError e)
            {
                throw new BlockExecutionException(txnIndex, "Fatal VM error executing transaction " + txnIndex, e);
            }
            catch (RuntimeException e)
            {
                throw new BlockExecutionException(txnIndex, "Transaction " + txnIndex + " failed during sequential execution", e);
            }
            ++executed;

            result = checkDeltas(result);
            if (committed.commit(txnIndex, result, apply(result), view.readKeys()))
                break;
        }

        BlockExecutionStats stats = parallelStats != null ? parallelStats
                                                           : new BlockExecutionStats(executed, 0, 0, 0, 0, null);
        logger.debug("Executed {} of {} transactions sequentially ({})", executed, block.size(), mode);
        return committed.finish(mode, stats);
    }

    private WriteOp<V> current(K key)
    {
        WriteOp<V> write = state.get(key);
        return write != null ? write : WriteOp.of(base.get(key));
    }

    @Nullable
    private Failure check(K key, DeltaOp delta)
    {
        WriteOp<V> current = current(key);
        if (current.isDeletion())
            return Failure.MissingValue;
        return delta.validate(codec.decode(current.value()));
    }

    private ExecutionResult<K, V, E> checkDeltas(ExecutionResult<K, V, E> result)
    {
        if (result.output == null)
            return result;

        for (Map.Entry<K, DeltaOp> e : result.output.deltas.entrySet())
        {
            Failure failure = check(e.getKey(), e.getValue());
            if (failure != null)
                return ExecutionResult.abort(DeltaApplicationException.abortReason(e.getKey(), failure));
        }
        return result;
    }

    /**
     * Apply the output of a committed transaction to the running state.
     *
     * @return its writes, with every delta replaced by the value it produced
     */
    private ImmutableSortedMap<K, WriteOp<V>> apply(ExecutionResult<K, V, E> result)
    {
        if (result.output == null)
            return ImmutableSortedMap.of();

        Map<K, WriteOp<V>> writes = new TreeMap<>(result.output.writes);
        for (Map.Entry<K, DeltaOp> e : result.output.deltas.entrySet())
        {
            long value;
            try
            {
                value = e.getValue().applyTo(codec.decode(current(e.getKey()).value()));
            }
            catch (DeltaApplicationException ex)
            {
                throw new IllegalStateException("Delta on " + e.getKey() + " failed after it was checked", ex);
            }
            writes.put(e.getKey(), WriteOp.value(codec.encode(value)));
        }
        state.putAll(writes);
        return ImmutableSortedMap.copyOf(writes);
    }

    private class View implements StateView<K, V>
    {
        private final Set<K> readKeys = new LinkedHashSet<>();

        @Nullable
        @Override
        public V read(K key)
        {
            readKeys.add(key);
            return current(key).value();
        }

        Set<K> readKeys()
        {
            return ImmutableSet.copyOf(readKeys);
        }
    }
}
