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

package blockstm.local;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableSet;

import blockstm.api.FatalVMError;
import blockstm.primitives.ExecutionResult;

import static blockstm.utils.Invariants.nonNull;

/**
 * Everything one incarnation of a transaction read and produced.
 */
public final class ExecutionRecord<K, V, E>
{
    public enum Outcome
    {
        /** the transaction returned a result (which may be a VM abort) */
        Completed,
        /** the transaction raised a {@link FatalVMError} */
        Fatal,
        /** the transaction raised some other exception, which only fails the block if this incarnation commits */
        Failed,
        /** the incarnation observed speculative state that cannot occur in order, and produced nothing */
        SpeculativeFailure
    }

    public final int incarnation;
    public final CapturedReads<K, V> reads;
    public final Outcome outcome;
    @Nullable public final ExecutionResult<K, V, E> result;
    /** the exception raised by a {@link Outcome#Fatal} or {@link Outcome#Failed} incarnation */
    @Nullable public final RuntimeException failure;
    /** the keys the incarnation published a write or delta for */
    public final ImmutableSet<K> modifiedKeys;

    private ExecutionRecord(int incarnation, CapturedReads<K, V> reads, Outcome outcome, @Nullable ExecutionResult<K, V, E> result, @Nullable RuntimeException failure)
    {
        this.incarnation = incarnation;
        this.reads = nonNull(reads);
        this.outcome = outcome;
        this.result = result;
        this.failure = failure;
        this.modifiedKeys = result == null ? ImmutableSet.of() : result.outputOrEmpty().modifiedKeys();
    }

    public static <K, V, E> ExecutionRecord<K, V, E> completed(int incarnation, CapturedReads<K, V> reads, ExecutionResult<K, V, E> result)
    {
        return new ExecutionRecord<>(incarnation, reads, Outcome.Completed, nonNull(result), null);
    }

    public static <K, V, E> ExecutionRecord<K, V, E> fatal(int incarnation, CapturedReads<K, V> reads, FatalVMError fatal)
    {
        return new ExecutionRecord<>(incarnation, reads, Outcome.Fatal, null, nonNull(fatal));
    }

    public static <K, V, E> ExecutionRecord<K, V, E> failed(int incarnation, CapturedReads<K, V> reads, RuntimeException failure)
    {
        return new ExecutionRecord<>(incarnation, reads, Outcome.Failed, null, nonNull(failure));
    }

    public static <K, V, E> ExecutionRecord<K, V, E> speculativeFailure(int incarnation, CapturedReads<K, V> reads)
    {
        return new ExecutionRecord<>(incarnation, reads, Outcome.SpeculativeFailure, null, null);
    }

    @Override
    public String toString()
    {
        return outcome + "@" + incarnation + (result == null ? "" : "(" + result + ')') + (failure == null ? "" : "(" + failure + ')') + " reads:" + reads;
    }
}
