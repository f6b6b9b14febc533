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

import blockstm.primitives.DeltaApplicationException.Failure;
import blockstm.primitives.DeltaOp;
import blockstm.primitives.Version;
import blockstm.primitives.WriteOp;

import static blockstm.utils.Invariants.nonNull;

/**
 * The answer of {@link MultiVersionStore#read} for one key below one transaction index.
 */
public final class ReadResult<V>
{
    public enum Kind
    {
        /** nothing below the index, and no base value cached: the caller must consult the base state */
        NotFound,
        /** the cached base value */
        Storage,
        /** a full write by an earlier transaction */
        Versioned,
        /** deltas resolved against a full write or the base value */
        Resolved,
        /** deltas that reach the bottom of the chain without any value to apply them to */
        Unresolved,
        /** the nearest entry is an estimate of the transaction at {@link #dependency} */
        Dependency,
        /** resolving deltas failed */
        DeltaFailure
    }

    private static final ReadResult<?> NOT_FOUND = new ReadResult<>(Kind.NotFound, null, null, 0, null, -1, null);

    public final Kind kind;
    @Nullable public final Version version;
    @Nullable public final WriteOp<V> write;
    public final long resolved;
    @Nullable public final DeltaOp unresolved;
    public final int dependency;
    @Nullable public final Failure failure;

    private ReadResult(Kind kind, @Nullable Version version, @Nullable WriteOp<V> write, long resolved, @Nullable DeltaOp unresolved, int dependency, @Nullable Failure failure)
    {
        this.kind = kind;
        this.version = version;
        this.write = write;
        this.resolved = resolved;
        this.unresolved = unresolved;
        this.dependency = dependency;
        this.failure = failure;
    }

    @SuppressWarnings("unchecked")
    static <V> ReadResult<V> notFound()
    {
        return (ReadResult<V>) NOT_FOUND;
    }

    static <V> ReadResult<V> storage(WriteOp<V> write)
    {
        return new ReadResult<>(Kind.Storage, null, nonNull(write), 0, null, -1, null);
    }

    static <V> ReadResult<V> versioned(Version version, WriteOp<V> write)
    {
        return new ReadResult<>(Kind.Versioned, nonNull(version), nonNull(write), 0, null, -1, null);
    }

    static <V> ReadResult<V> resolved(long value)
    {
        return new ReadResult<>(Kind.Resolved, null, null, value, null, -1, null);
    }

    static <V> ReadResult<V> unresolved(DeltaOp delta)
    {
        return new ReadResult<>(Kind.Unresolved, null, null, 0, nonNull(delta), -1, null);
    }

    static <V> ReadResult<V> dependency(int txnIndex)
    {
        return new ReadResult<>(Kind.Dependency, null, null, 0, null, txnIndex, null);
    }

    static <V> ReadResult<V> deltaFailure(Failure failure)
    {
        return new ReadResult<>(Kind.DeltaFailure, null, null, 0, null, -1, nonNull(failure));
    }

    @Override
    public String toString()
    {
        switch (kind)
        {
            default: throw new AssertionError("Unhandled kind: " + kind);
            case NotFound: return "NotFound";
            case Storage: return "Storage(" + write + ')';
            case Versioned: return "Versioned" + version + '(' + write + ')';
            case Resolved: return "Resolved(" + resolved + ')';
            case Unresolved: return "Unresolved(" + unresolved + ')';
            case Dependency: return "Dependency(" + dependency + ')';
            case DeltaFailure: return "DeltaFailure(" + failure + ')';
        }
    }
}
