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

import java.util.Objects;
import javax.annotation.Nullable;

import blockstm.primitives.DeltaApplicationException.Failure;

import static blockstm.utils.Invariants.nonNull;

/**
 * Records what one incarnation observed for one key, so that validation can later decide whether the incarnation
 * would still observe the same thing.
 */
public final class ReadDescriptor
{
    public enum Kind
    {
        /** the value written by a specific incarnation of an earlier transaction */
        Versioned,
        /** no earlier transaction of the block wrote the key; the value came from the base state */
        Storage,
        /** a value produced by resolving aggregator deltas */
        Resolved,
        /** resolving aggregator deltas failed, which can only happen against speculative state */
        ResolutionFailure,
        /** the transaction's own delta was checked against the value below it */
        DeltaBounds
    }

    private static final ReadDescriptor STORAGE = new ReadDescriptor(Kind.Storage, null, 0, null, null);

    public final Kind kind;
    @Nullable
    public final Version version;
    public final long resolvedValue;
    @Nullable
    public final DeltaOp delta;
    /** for {@link Kind#ResolutionFailure} the failure seen; for {@link Kind#DeltaBounds} the outcome of the check, null if it passed */
    @Nullable
    public final Failure failure;

    private ReadDescriptor(Kind kind, @Nullable Version version, long resolvedValue, @Nullable DeltaOp delta, @Nullable Failure failure)
    {
        this.kind = kind;
        this.version = version;
        this.resolvedValue = resolvedValue;
        this.delta = delta;
        this.failure = failure;
    }

    public static ReadDescriptor versioned(Version version)
    {
        return new ReadDescriptor(Kind.Versioned, nonNull(version), 0, null, null);
    }

    public static ReadDescriptor storage()
    {
        return STORAGE;
    }

    public static ReadDescriptor resolved(long value)
    {
        return new ReadDescriptor(Kind.Resolved, null, value, null, null);
    }

    public static ReadDescriptor resolutionFailure(Failure failure)
    {
        return new ReadDescriptor(Kind.ResolutionFailure, null, 0, null, nonNull(failure));
    }

    public static ReadDescriptor deltaBounds(DeltaOp delta, @Nullable Failure outcome)
    {
        return new ReadDescriptor(Kind.DeltaBounds, null, 0, nonNull(delta), outcome);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReadDescriptor that = (ReadDescriptor) o;
        return kind == that.kind && resolvedValue == that.resolvedValue && Objects.equals(version, that.version)
               && Objects.equals(delta, that.delta) && failure == that.failure;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(kind, version, resolvedValue, delta, failure);
    }

    @Override
    public String toString()
    {
        switch (kind)
        {
            default: throw new AssertionError("Unhandled kind: " + kind);
            case Versioned: return "Versioned" + version;
            case Storage: return "Storage";
            case Resolved: return "Resolved(" + resolvedValue + ')';
            case ResolutionFailure: return "ResolutionFailure(" + failure + ')';
            case DeltaBounds: return "DeltaBounds(" + delta + (failure == null ? "" : " -> " + failure) + ')';
        }
    }
}
