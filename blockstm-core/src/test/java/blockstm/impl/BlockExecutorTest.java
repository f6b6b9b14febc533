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
import java.util.concurrent.TimeUnit;

import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.Uninterruptibles;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import blockstm.api.AggregatorCodec;
import blockstm.api.Agent;
import blockstm.api.BlockExecutionException;
import blockstm.api.ExecutorConfig;
import blockstm.api.FatalVMError;
import blockstm.api.Transaction;
import blockstm.primitives.BlockOutput;
import blockstm.primitives.DeltaApplicationException;
import blockstm.primitives.DeltaApplicationException.Failure;
import blockstm.primitives.DeltaOp;
import blockstm.primitives.ExecutionMode;
import blockstm.primitives.ExecutionResult;
import blockstm.primitives.TransactionOutput;
import blockstm.primitives.TransactionResult;
import blockstm.primitives.WriteOp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class BlockExecutorTest
{
    private static final long LIMIT = 1000;

    static class TestConfig implements ExecutorConfig
    {
        final int concurrency;
        long blockGasLimit = NO_LIMIT;
        int maxIncarnations = -1;
        boolean allowSequentialFallback = true;

        TestConfig(int concurrency)
        {
            this.concurrency = concurrency;
        }

        @Override
        public int concurrencyLevel()
        {
            return concurrency;
        }

        @Override
        public long blockGasLimit()
        {
            return blockGasLimit;
        }

        @Override
        public int maxIncarnations(int blockSize)
        {
            return maxIncarnations >= 0 ? maxIncarnations : ExecutorConfig.super.maxIncarnations(blockSize);
        }

        @Override
        public boolean allowSequentialFallback()
        {
            return allowSequentialFallback;
        }
    }

    private static TransactionOutput.Builder<String, Long, String> output()
    {
        return TransactionOutput.builder();
    }

    private static Transaction<String, Long, String> write(String key, long value)
    {
        return view -> ExecutionResult.success(TransactionOutput.<String, Long, String>builder().write(key, value).build());
    }

    private static BlockOutput<String, Long, String> execute(ExecutorConfig config, Agent agent, Map<String, Long> base, List<Transaction<String, Long, String>> block)
    {
        try (BlockExecutor<String, Long, String> executor = new BlockExecutor<>(config, agent, AggregatorCodec.LONGS))
        {
            return executor.execute(block, new InMemoryStateView<>(base));
        }
    }

    private static BlockOutput<String, Long, String> execute(int concurrency, Map<String, Long> base, List<Transaction<String, Long, String>> block)
    {
        return execute(new TestConfig(concurrency), DefaultAgent.INSTANCE, base, block);
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 4 })
    void readsObserveEarlierWritesAndDeltas(int concurrency)
    {
        List<Transaction<String, Long, String>> block = List.of(
            write("A", 1),
            view -> ExecutionResult.success(output().delta("A", DeltaOp.plus(1, LIMIT)).event("T1 read " + view.read("A")).build()),
            view -> ExecutionResult.success(output().event("T2 read " + view.read("A")).build())
        );

        for (int i = 0; i < 20; ++i)
        {
            BlockOutput<String, Long, String> output = execute(concurrency, ImmutableMap.of(), block);
            assertThat(output.result(1).writes).containsEntry("A", WriteOp.value(2L));
            assertThat(output.writes).containsExactly(Map.entry("A", WriteOp.value(2L)));
            assertThat(output.events).containsExactly("T1 read 1", "T2 read 2");
        }
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 4 })
    void gasLimitSkipsTheRestOfTheBlock(int concurrency)
    {
        List<Transaction<String, Long, String>> block = new ArrayList<>();
        for (int i = 0; i < 10; ++i)
        {
            String key = "k" + i;
            block.add(view -> ExecutionResult.success(output().write(key, 1L).executionGas(10).build()));
        }

        TestConfig config = new TestConfig(concurrency);
        config.blockGasLimit = 30;
        Agent agent = mock(Agent.class);
        BlockOutput<String, Long, String> output = execute(config, agent, ImmutableMap.of(), block);

        assertThat(output.committedCount()).isEqualTo(3);
        for (int i = 0; i < 10; ++i)
            assertThat(output.result(i).kind).isEqualTo(i < 3 ? TransactionResult.Kind.Success : TransactionResult.Kind.Skipped);
        assertThat(output.result(2).gasUsed).isEqualTo(10);
        assertThat(output.writes).containsOnlyKeys("k0", "k1", "k2");
        verify(agent).onBlockLimitReached(3, 10);
        verify(agent, never()).onSequentialFallback(anyInt(), any());
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 4 })
    void skipRestEndsTheBlock(int concurrency)
    {
        List<Transaction<String, Long, String>> block = List.of(
            write("a", 1),
            write("b", 2),
            view -> ExecutionResult.skipRest(output().write("c", view.read("a")).build()),
            write("d", 4),
            view -> { throw new FatalVMError("never committed"); }
        );

        BlockOutput<String, Long, String> output = execute(concurrency, ImmutableMap.of(), block);
        assertThat(output.result(2).kind).isEqualTo(TransactionResult.Kind.SkipRest);
        assertThat(output.result(3).kind).isEqualTo(TransactionResult.Kind.Skipped);
        assertThat(output.result(4).kind).isEqualTo(TransactionResult.Kind.Skipped);
        assertThat(output.writes).containsOnlyKeys("a", "b", "c");
        assertThat(output.writes.get("c")).isEqualTo(WriteOp.value(1L));
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 4 })
    void abortedTransactionsHaveNoEffect(int concurrency)
    {
        List<Transaction<String, Long, String>> block = List.of(
            write("a", 1),
            view -> ExecutionResult.abort("rejected"),
            view -> ExecutionResult.success(output().write("b", view.read("a") + 1).build())
        );

        BlockOutput<String, Long, String> output = execute(concurrency, ImmutableMap.of(), block);
        assertThat(output.result(1).kind).isEqualTo(TransactionResult.Kind.Aborted);
        assertThat(output.result(1).abortReason).isEqualTo("rejected");
        assertThat(output.result(1).writes).isEmpty();
        assertThat(output.result(2).kind).isEqualTo(TransactionResult.Kind.Success);
        assertThat(output.writes).containsEntry("b", WriteOp.value(2L));
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 4 })
    void failedDeltasAbort(int concurrency)
    {
        List<Transaction<String, Long, String>> block = List.of(
            view -> ExecutionResult.success(output().delta("A", DeltaOp.plus(5, 100)).build()),
            view -> ExecutionResult.success(output().delta("A", DeltaOp.plus(1, 100)).build()),
            view -> ExecutionResult.success(output().delta("missing", DeltaOp.plus(1, 100)).build()),
            view -> ExecutionResult.success(output().delete("A").build()),
            view -> ExecutionResult.success(output().delta("A", DeltaOp.plus(1, 100)).write("b", 1L).build()),
            view -> ExecutionResult.success(output().delta("B", DeltaOp.minus(11, 100)).build())
        );

        BlockOutput<String, Long, String> output = execute(concurrency, ImmutableMap.of("A", 99L, "B", 10L), block);
        assertThat(output.result(0).kind).isEqualTo(TransactionResult.Kind.Aborted);
        assertThat(output.result(0).abortReason).isEqualTo(DeltaApplicationException.abortReason("A", Failure.Overflow));
        assertThat(output.result(1).writes).containsEntry("A", WriteOp.value(100L));
        assertThat(output.result(2).abortReason).isEqualTo(DeltaApplicationException.abortReason("missing", Failure.MissingValue));
        assertThat(output.result(3).writes).containsEntry("A", WriteOp.deletion());
        assertThat(output.result(4).abortReason).isEqualTo(DeltaApplicationException.abortReason("A", Failure.MissingValue));
        assertThat(output.result(5).abortReason).isEqualTo(DeltaApplicationException.abortReason("B", Failure.Underflow));
        assertThat(output.writes).containsOnlyKeys("A");
        assertThat(output.writes.get("A").isDeletion()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 4 })
    void deletionsAreVisible(int concurrency)
    {
        List<Transaction<String, Long, String>> block = List.of(
            view -> ExecutionResult.success(output().delete("a").build()),
            view -> ExecutionResult.success(output().event("a=" + view.read("a")).build())
        );

        BlockOutput<String, Long, String> output = execute(concurrency, ImmutableMap.of("a", 1L), block);
        assertThat(output.writes).containsEntry("a", WriteOp.deletion());
        assertThat(output.events).containsExactly("a=null");
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 8 })
    void contendedCounter(int concurrency)
    {
        List<Transaction<String, Long, String>> block = new ArrayList<>();
        for (int i = 0; i < 100; ++i)
        {
            block.add(view -> {
                Long count = view.read("count");
                return ExecutionResult.success(output().write("count", count == null ? 1L : count + 1).build());
            });
        }

        BlockOutput<String, Long, String> output = execute(concurrency, ImmutableMap.of(), block);
        assertThat(output.writes).containsEntry("count", WriteOp.value(100L));
        assertThat(output.committedCount()).isEqualTo(100);
        assertThat(output.mode).isEqualTo(concurrency == 1 ? ExecutionMode.Sequential : ExecutionMode.Parallel);
        assertThat(output.stats.executions).isGreaterThanOrEqualTo(100);
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 4 })
    void fatalErrorFailsTheBlock(int concurrency)
    {
        List<Transaction<String, Long, String>> block = List.of(
            write("a", 1),
            write("b", 1),
            view -> { throw new FatalVMError("invariant violated in the VM"); },
            write("c", 1)
        );

        Agent agent = mock(Agent.class);
        Throwable thrown = catchThrowable(() -> execute(new TestConfig(concurrency), agent, ImmutableMap.of(), block));
        assertThat(thrown).isInstanceOf(BlockExecutionException.class).hasCauseInstanceOf(FatalVMError.class);
        assertThat(((BlockExecutionException) thrown).txnIndex).isEqualTo(2);
        verify(agent, never()).onSequentialFallback(anyInt(), any());
    }

    @Test
    void engineFailureFallsBackToSequential()
    {
        List<Transaction<String, Long, String>> block = new ArrayList<>();
        for (int i = 0; i < 5; ++i)
            block.add(write("k" + i, i));
        block.set(3, view -> {
            if (Thread.currentThread().getName().startsWith("blockstm-worker"))
                throw new AssertionError("injected failure");
            return ExecutionResult.success(output().write("k3", 3L).build());
        });

        Agent agent = mock(Agent.class);
        BlockOutput<String, Long, String> output = execute(new TestConfig(4), agent, ImmutableMap.of(), block);

        assertThat(output.mode).isEqualTo(ExecutionMode.SequentialFallback);
        assertThat(output.stats.fallbackCause).isInstanceOf(AssertionError.class).hasMessage("injected failure");
        assertThat(output.committedCount()).isEqualTo(5);
        for (int i = 0; i < 5; ++i)
            assertThat(output.writes).containsEntry("k" + i, WriteOp.value((long) i));
        verify(agent).onUncaughtException(any(AssertionError.class));
        verify(agent).onSequentialFallback(eq(5), any(AssertionError.class));
    }

    @Test
    void fallbackCanBeDisabled()
    {
        List<Transaction<String, Long, String>> block = List.of(
            write("a", 1),
            view -> { throw new AssertionError("injected failure"); }
        );

        TestConfig config = new TestConfig(4);
        config.allowSequentialFallback = false;
        Agent agent = mock(Agent.class);
        Throwable thrown = catchThrowable(() -> execute(config, agent, ImmutableMap.of(), block));
        assertThat(thrown).isInstanceOf(BlockExecutionException.class).hasCauseInstanceOf(AssertionError.class);
        assertThat(((BlockExecutionException) thrown).txnIndex).isEqualTo(BlockExecutionException.NO_TRANSACTION);
        verify(agent, never()).onSequentialFallback(anyInt(), any());
    }

    @Test
    void incarnationCapFallsBackToSequential()
    {
        List<Transaction<String, Long, String>> block = List.of(write("a", 1), write("b", 2));

        TestConfig config = new TestConfig(2);
        config.maxIncarnations = 0;
        BlockOutput<String, Long, String> output = execute(config, mock(Agent.class), ImmutableMap.of(), block);

        assertThat(output.mode).isEqualTo(ExecutionMode.SequentialFallback);
        assertThat(output.stats.fallbackCause).isInstanceOf(IllegalStateException.class).hasMessageContaining("incarnation 0");
        assertThat(output.writes).containsOnlyKeys("a", "b");
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 4 })
    void committedTransactionFailureIsReported(int concurrency)
    {
        List<Transaction<String, Long, String>> block = List.of(
            write("a", 1),
            view -> { throw new IllegalArgumentException("bad transaction"); },
            write("b", 1)
        );

        Agent agent = mock(Agent.class);
        Throwable thrown = catchThrowable(() -> execute(new TestConfig(concurrency), agent, ImmutableMap.of(), block));
        assertThat(thrown).isInstanceOf(BlockExecutionException.class).hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(((BlockExecutionException) thrown).txnIndex).isEqualTo(1);
        verify(agent, never()).onSequentialFallback(anyInt(), any());
        verify(agent, never()).onUncaughtException(any());
    }

    /**
     * T2 reads A before T1 has written B, so it sees A=1 and B=0, a pair that never occurs in order. The exception
     * it raises must be discarded when T1's write invalidates it.
     */
    @ParameterizedTest
    @ValueSource(ints = { 1, 4 })
    void exceptionFromInvalidatedExecutionIsDiscarded(int concurrency)
    {
        List<Transaction<String, Long, String>> block = List.of(
            write("A", 1),
            view -> {
                Long a = view.read("A");
                Uninterruptibles.sleepUninterruptibly(300, TimeUnit.MILLISECONDS);
                return ExecutionResult.success(output().write("B", a).build());
            },
            view -> {
                Uninterruptibles.sleepUninterruptibly(100, TimeUnit.MILLISECONDS);
                Long a = view.read("A"), b = view.read("B");
                if (!a.equals(b))
                    throw new ArithmeticException("inconsistent " + a + '/' + b);
                return ExecutionResult.success(output().event("A=B=" + a).build());
            }
        );

        Agent agent = mock(Agent.class);
        BlockOutput<String, Long, String> output = execute(new TestConfig(concurrency), agent, ImmutableMap.of("A", 0L, "B", 0L), block);

        assertThat(output.mode).isEqualTo(concurrency == 1 ? ExecutionMode.Sequential : ExecutionMode.Parallel);
        assertThat(output.committedCount()).isEqualTo(3);
        assertThat(output.writes).containsEntry("B", WriteOp.value(1L));
        assertThat(output.events).containsExactly("A=B=1");
        verify(agent, never()).onSequentialFallback(anyInt(), any());
        verify(agent, never()).onUncaughtException(any());
    }

    @Test
    void emptyBlock()
    {
        BlockOutput<String, Long, String> output = execute(4, ImmutableMap.of(), List.of());
        assertThat(output.results).isEmpty();
        assertThat(output.writes).isEmpty();
        assertThat(output.mode).isEqualTo(ExecutionMode.Parallel);
    }
}
