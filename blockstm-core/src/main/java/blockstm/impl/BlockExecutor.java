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

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import blockstm.api.AggregatorCodec;
import blockstm.api.Agent;
import blockstm.api.BaseStateView;
import blockstm.api.BlockExecutionException;
import blockstm.api.ExecutorConfig;
import blockstm.api.Transaction;
import blockstm.primitives.BlockExecutionStats;
import blockstm.primitives.BlockOutput;
import blockstm.primitives.ExecutionMode;

import static blockstm.utils.Invariants.checkArgument;

/**
 * Executes blocks of transactions with the result of executing them one at a time in block order, using a fixed
 * pool of worker threads to run them optimistically in parallel.
 * <p>
 * Per-transaction VM aborts are recorded in the block's output. A {@link blockstm.api.FatalVMError} or any other
 * exception raised by a committed execution fails the block with a {@link BlockExecutionException}; one raised by an
 * execution that is later invalidated is discarded with it. Any other failure of a parallel run
 * (a broken invariant, a stalled dependency, a transaction re-executed too often) abandons it, discarding all of its
 * speculative state, and the block is executed again sequentially.
 * <p>
 * Blocks are executed one at a time; a single executor must not be used to execute blocks concurrently.
 */
public class BlockExecutor<K, V, E> implements AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(BlockExecutor.class);

    private final ExecutorConfig config;
    private final Agent agent;
    private final AggregatorCodec<V> codec;
    private final int concurrency;
    @Nullable private final ExecutorService workers;

    public BlockExecutor(ExecutorConfig config, Agent agent, AggregatorCodec<V> codec)
    {
        this.config = config;
        this.agent = agent;
        this.codec = codec;
        this.concurrency = checkArgument(config.concurrencyLevel(), level -> level >= 1, "Concurrency level must be positive");
        this.workers = concurrency == 1 ? null
                                        : Executors.newFixedThreadPool(concurrency, new ThreadFactoryBuilder().setNameFormat("blockstm-worker-%d")
                                                                                                              .setDaemon(true)
                                                                                                              .build());
    }

    public BlockExecutor(ExecutorConfig config, AggregatorCodec<V> codec)
    {
        this(config, DefaultAgent.INSTANCE, codec);
    }

    public BlockOutput<K, V, E> execute(List<? extends Transaction<K, V, E>> block, BaseStateView<K, V> base)
    {
        if (block.isEmpty())
            return BlockOutput.of(ImmutableList.of(), workers == null ? ExecutionMode.Sequential : ExecutionMode.Parallel, BlockExecutionStats.NONE);

        if (workers == null)
            return new SequentialExecution<>(block, base, config, agent, codec).run(ExecutionMode.Sequential, null);

        ParallelExecution<K, V, E> parallel = new ParallelExecution<>(block, base, config, agent, codec);
        try
        {
            return parallel.run(workers, Math.min(concurrency, block.size()));
        }
        catch (ParallelExecutionFailure e)
        {
            Throwable cause = e.getCause();
            if (!config.allowSequentialFallback())
                throw new BlockExecutionException("Parallel execution of a block of " + block.size() + " transactions failed", cause);

            logger.warn("Parallel execution of a block of {} transactions failed; re-executing it sequentially", block.size(), cause);
            agent.onSequentialFallback(block.size(), cause);
            return new SequentialExecution<>(block, base, config, agent, codec).run(ExecutionMode.SequentialFallback, parallel.stats().withFallbackCause(cause));
        }
    }

    @Override
    public void close()
    {
        if (workers == null)
            return;

        workers.shutdown();
        try
        {
            if (!workers.awaitTermination(1, TimeUnit.MINUTES))
                logger.warn("Block executor workers did not terminate within a minute");
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }
}
