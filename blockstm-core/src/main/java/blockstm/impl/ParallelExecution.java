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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

import com.google.common.collect.ImmutableSortedMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import blockstm.api.AggregatorCodec;
import blockstm.api.Agent;
import blockstm.api.BaseStateView;
import blockstm.api.BlockExecutionException;
import blockstm.api.ExecutorConfig;
import blockstm.api.Transaction;
import blockstm.local.ExecutionRecord;
import blockstm.local.LastInputOutput;
import blockstm.local.MultiVersionStore;
import blockstm.local.Scheduler;
import blockstm.primitives.BlockExecutionStats;
import blockstm.primitives.BlockOutput;
import blockstm.primitives.DeltaOp;
import blockstm.primitives.ExecutionMode;
import blockstm.primitives.ExecutionResult;
import blockstm.primitives.TransactionOutput;
import blockstm.primitives.Version;
import blockstm.primitives.WriteOp;

import static blockstm.utils.Invariants.checkState;
import static blockstm.utils.Invariants.illegalState;

/**
 * The shared state of one parallel execution of a block, and the commit and failure handling its workers share.
 */
class ParallelExecution<K, V, E>
{
    private static final Logger logger = LoggerFactory.getLogger(ParallelExecution.class);

    final List<? extends Transaction<K, V, E>> block;
    final BaseStateView<K, V> base;
    final Agent agent;
    final AggregatorCodec<V> codec;
    final MultiVersionStore<K, V> store;
    final Scheduler scheduler;
    final LastInputOutput<K, V, E> lastInputOutput;
    final BlockExecutionStats.Collector stats = new BlockExecutionStats.Collector();
    final int maxIncarnations;
    final long dependencyWaitNanos;

    // guarded by the scheduler's commit lock
    private final CommittedResults<K, V, E> committed;
    private volatile BlockExecutionException fatal;
    private final AtomicReference<Throwable> failure = new AtomicReference<>();

    ParallelExecution(List<? extends Transaction<K, V, E>> block, BaseStateView<K, V> base, ExecutorConfig config, Agent agent, AggregatorCodec<V> codec)
    {
        this.block = block;
        this.base = base;
        this.agent = agent;
        this.codec = codec;
        this.store = new MultiVersionStore<>(codec);
        this.scheduler = new Scheduler(block.size());
        this.lastInputOutput = new LastInputOutput<>(block.size());
        this.committed = new CommittedResults<>(block.size(), config, agent, ExecutionMode.Parallel);
        this.maxIncarnations = config.maxIncarnations(block.size());
        this.dependencyWaitNanos = config.dependencyWaitTimeout().toNanos();
    }

    BlockOutput<K, V, E> run(ExecutorService pool, int workers) throws ParallelExecutionFailure
    {
        List<Future<?>> futures = new ArrayList<>(workers);
        for (int i = 0; i < workers; ++i)
            futures.add(pool.submit(new Worker<>(this)));

        for (Future<?> future : futures)
        {
            try
            {
                future.get();
            }
            catch (InterruptedException e)
            {
                scheduler.halt();
                Thread.currentThread().interrupt();
                throw new BlockExecutionException("Interrupted while executing a block of " + block.size() + " transactions", e);
            }
            catch (ExecutionException e)
            {
                onWorkerFailure(e.getCause());
            }
        }

        Throwable cause = failure.get();
        if (cause != null)
            throw new ParallelExecutionFailure(cause);
        if (fatal != null)
            throw fatal;

        checkState(scheduler.isDone(), "Workers finished before the block was done");
        BlockOutput<K, V, E> output = committed.finish(ExecutionMode.Parallel, stats.snapshot());
        if (logger.isDebugEnabled())
            logger.debug("Executed {} of {} transactions in parallel: {}", committed.committed(), block.size(), output.stats);
        return output;
    }

    Transaction<K, V, E> transaction(int txnIndex)
    {
        return block.get(txnIndex);
    }

    BlockExecutionStats stats()
    {
        return stats.snapshot();
    }

    /**
     * Commit every transaction that is ready, for as long as this worker can claim the commit lock.
     */
    void coordinateCommits()
    {
        while (scheduler.tryLockCommits())
        {
            try
            {
                Version committed;
                while ((committed = scheduler.tryCommit()) != null)
                    onCommit(committed);
            }
            finally
            {
                scheduler.unlockCommits();
            }
        }
    }

    private void onCommit(Version version)
    {
        int txnIndex = version.txnIndex;
        ExecutionRecord<K, V, E> record = lastInputOutput.takeOutput(txnIndex);
        checkState(record.incarnation == version.incarnation, "Committed %s but recorded incarnation %s", version, record.incarnation);

        switch (record.outcome)
        {
            default: throw new AssertionError("Unhandled outcome: " + record.outcome);
            case SpeculativeFailure:
                throw illegalState("Committed " + version + " observed state inconsistent with in-order execution");

            case Fatal:
                fatal = new BlockExecutionException(txnIndex, "Fatal VM error executing transaction " + txnIndex, record.failure);
                scheduler.halt();
                return;

            case Failed:
                fatal = new BlockExecutionException(txnIndex, "Transaction " + txnIndex + " failed during parallel execution", record.failure);
                scheduler.halt();
                return;

            case Completed:
                ExecutionResult<K, V, E> result = record.result;
                if (committed.commit(txnIndex, result, materialize(txnIndex, result.outputOrEmpty()), record.reads.readKeys()))
                    scheduler.halt();
        }
    }

    private ImmutableSortedMap<K, WriteOp<V>> materialize(int txnIndex, TransactionOutput<K, V, E> output)
    {
        if (output.deltas.isEmpty())
            return output.writes;

        Map<K, WriteOp<V>> writes = new TreeMap<>(output.writes);
        for (Map.Entry<K, DeltaOp> e : output.deltas.entrySet())
            writes.put(e.getKey(), WriteOp.value(codec.encode(store.materializeDelta(e.getKey(), txnIndex))));
        return ImmutableSortedMap.copyOf(writes);
    }

    void onWorkerFailure(Throwable t)
    {
        if (failure.compareAndSet(null, t))
        {
            logger.error("Worker failed executing block of {} transactions; halting", block.size(), t);
            agent.onUncaughtException(t);
        }
        else
        {
            failure.get().addSuppressed(t);
        }
        scheduler.halt();
    }
}
