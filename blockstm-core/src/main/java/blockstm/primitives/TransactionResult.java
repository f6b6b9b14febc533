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

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import static blockstm.utils.Invariants.illegalArgument;
import static blockstm.utils.Invariants.nonNull;

/**
 * The final, committed outcome of one transaction of a block, with any aggregator deltas already converted to the
 * values they produced.
 */
public final class TransactionResult<K, V, E>
{
    public enum Kind
    {
        Success, SkipRest, Aborted, Skipped;

        public boolean isCommitted()
        {
            return this != Skipped;
        }
    }

    private static final TransactionResult<?, ?, ?> SKIPPED = new TransactionResult<>(Kind.Skipped, ImmutableSortedMap.of(), ImmutableList.of(), 0, null);

    public final Kind kind;
    public final ImmutableSortedMap<K, WriteOp<V>> writes;
    public final ImmutableList<E> events;
    public final long gasUsed;
    @Nullable
    public final String abortReason;

    private TransactionResult(Kind kind, ImmutableSortedMap<K, WriteOp<V>> writes, ImmutableList<E> events, long gasUsed, @Nullable String abortReason)
    {
        this.kind = kind;
        this.writes = writes;
        this.events = events;
        this.gasUsed = gasUsed;
        this.abortReason = abortReason;
    }

    public static <K, V, E> TransactionResult<K, V, E> committed(ExecutionStatus status, ImmutableSortedMap<K, WriteOp<V>> writes, ImmutableList<E> events, long gasUsed)
    {
        switch (status)
        {
            default: throw new AssertionError("Unhandled status: " + status);
            case SUCCESS: return new TransactionResult<>(Kind.Success, writes, events, gasUsed, null);
            case SKIP_REST: return new TransactionResult<>(Kind.SkipRest, writes, events, gasUsed, null);
            case ABORT: throw illegalArgument("Use aborted() for aborted transactions");
        }
    }

    public static <K, V, E> TransactionResult<K, V, E> aborted(String reason)
    {
        return new TransactionResult<>(Kind.Aborted, ImmutableSortedMap.of(), ImmutableList.of(), 0, nonNull(reason));
    }

    @SuppressWarnings("unchecked")
    public static <K, V, E> TransactionResult<K, V, E> skipped()
    {
        return (TransactionResult<K, V, E>) SKIPPED;
    }

    @Override
    public String toString()
    {
        switch (kind)
        {
            default: throw new AssertionError("Unhandled kind: " + kind);
            case Skipped: return "Skipped";
            case Aborted: return "Aborted(" + abortReason + ')';
            case Success:
            case SkipRest:
                return kind + "{writes:" + writes + ", events:" + events + ", gas:" + gasUsed + '}';
        }
    }
}
