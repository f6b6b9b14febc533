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

import java.util.Map;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;

import blockstm.api.StateView;
import blockstm.local.CapturedReads;
import blockstm.local.DependencyCondition;
import blockstm.local.MultiVersionStore;
import blockstm.local.ReadResult;
import blockstm.primitives.DeltaApplicationException;
import blockstm.primitives.DeltaApplicationException.Failure;
import blockstm.primitives.DeltaOp;
import blockstm.primitives.ExecutionResult;
import blockstm.primitives.ReadDescriptor;
import blockstm.primitives.WriteOp;

/**
 * The view one incarnation executes against during parallel execution. Reads go through the
 * {@link MultiVersionStore}, falling back to the base state, and are captured for later validation.
 * A read that meets an estimate parks the worker until the writer finishes executing.
 */
class SpeculativeView<K, V> implements StateView<K, V>
{
    private final int txnIndex;
    private final ParallelExecution<K, V, ?> run;
    private final MultiVersionStore<K, V> store;
    private final CapturedReads<K, V> reads = new CapturedReads<>();

    private boolean speculativeFailure;
    @Nullable private RuntimeException engineFailure;

    SpeculativeView(int txnIndex, ParallelExecution<K, V, ?> run)
    {
        this.txnIndex = txnIndex;
        this.run = run;
        this.store = run.store;
    }

    @Nullable
    @Override
    public V read(K key)
    {
        if (reads.contains(key))
            return reads.value(key);

        while (true)
        {
            ReadResult<V> result = store.read(key, txnIndex);
            switch (result.kind)
            {
                default: throw new AssertionError("Unhandled kind: " + result.kind);
                case NotFound:
                case Unresolved:
                    fetchBaseValue(key);
                    break;

                case Dependency:
                    waitFor(result.dependency);
                    break;

                case Storage:
                    reads.capture(key, ReadDescriptor.storage(), result.write.value());
                    return result.write.value();

                case Versioned:
                    reads.capture(key, ReadDescriptor.versioned(result.version), result.write.value());
                    return result.write.value();

                case Resolved:
                    V value = store.codec().encode(result.resolved);
                    reads.capture(key, ReadDescriptor.resolved(result.resolved), value);
                    return value;

                case DeltaFailure:
                    reads.capture(key, ReadDescriptor.resolutionFailure(result.failure), null);
                    throw speculativeFailure("Resolving " + key + " failed: " + result.failure);
            }
        }
    }

    /**
     * Check every delta of {@code result} against the value below this transaction, exactly as in-order execution
     * would apply it. If any fails the execution becomes an abort; either way the outcome of each check is captured
     * so that validation only fails if an outcome changes.
     */
    <E> ExecutionResult<K, V, E> checkDeltas(ExecutionResult<K, V, E> result)
    {
        if (result.output == null || result.output.deltas.isEmpty())
            return result;

        Failure firstFailure = null;
        K failedKey = null;
        for (Map.Entry<K, DeltaOp> e : result.output.deltas.entrySet())
        {
            Failure outcome = CapturedReads.checkDelta(e.getValue(), resolveBelow(e.getKey()), store.codec());
            reads.captureDeltaBounds(e.getKey(), e.getValue(), outcome);
            if (outcome != null && firstFailure == null)
            {
                firstFailure = outcome;
                failedKey = e.getKey();
            }
        }

        if (firstFailure == null)
            return result;
        return ExecutionResult.abort(DeltaApplicationException.abortReason(failedKey, firstFailure));
    }

    private ReadResult<V> resolveBelow(K key)
    {
        while (true)
        {
            ReadResult<V> result = store.read(key, txnIndex);
            switch (result.kind)
            {
                case NotFound:
                case Unresolved:
                    fetchBaseValue(key);
                    break;

                case Dependency:
                    waitFor(result.dependency);
                    break;

                case DeltaFailure:
                    if (!reads.contains(key))
                        reads.capture(key, ReadDescriptor.resolutionFailure(result.failure), null);
                    throw speculativeFailure("Resolving " + key + " failed: " + result.failure);

                default:
                    return result;
            }
        }
    }

    private void fetchBaseValue(K key)
    {
        store.setBaseValue(key, WriteOp.of(run.base.get(key)));
    }

    private void waitFor(int dependency)
    {
        run.stats.onDependencyWait();
        DependencyCondition condition = run.scheduler.waitForDependency(txnIndex, dependency);
        DependencyCondition.State state;
        try
        {
            state = condition.await(run.dependencyWaitNanos, TimeUnit.NANOSECONDS);
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            throw engineFailure(new IllegalStateException("Interrupted while transaction " + txnIndex + " waited on " + dependency, e));
        }

        switch (state)
        {
            default: throw new AssertionError("Unhandled state: " + state);
            case Resolved:
                return;
            case Halted:
                throw new ExecutionHaltedException(txnIndex);
            case Unresolved:
                throw engineFailure(new IllegalStateException("Transaction " + txnIndex + " waited on transaction " + dependency
                                                              + " for longer than " + TimeUnit.NANOSECONDS.toMillis(run.dependencyWaitNanos) + "ms"));
        }
    }

    private SpeculativeExecutionException speculativeFailure(String message)
    {
        speculativeFailure = true;
        return new SpeculativeExecutionException(message);
    }

    private RuntimeException engineFailure(RuntimeException failure)
    {
        if (engineFailure == null)
            engineFailure = failure;
        return failure;
    }

    CapturedReads<K, V> reads()
    {
        return reads;
    }

    /**
     * @return true if the incarnation observed state that cannot occur in order, even if the transaction
     *         swallowed the exception raised for it
     */
    boolean hasSpeculativeFailure()
    {
        return speculativeFailure;
    }

    /**
     * @return a failure of the engine raised inside this execution, even if the transaction swallowed it
     */
    @Nullable
    RuntimeException engineFailure()
    {
        return engineFailure;
    }
}
