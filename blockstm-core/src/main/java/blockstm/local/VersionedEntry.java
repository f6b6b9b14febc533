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

import blockstm.primitives.DeltaOp;
import blockstm.primitives.WriteOp;

import static blockstm.utils.Invariants.checkState;
import static blockstm.utils.Invariants.nonNull;

/**
 * An immutable entry of a key's version chain. Entries are replaced, never mutated, so a reader always observes
 * a complete entry.
 */
final class VersionedEntry<V>
{
    enum Kind { Base, Write, Delta }

    final Kind kind;
    final int incarnation;
    @Nullable final WriteOp<V> write;
    @Nullable final DeltaOp delta;
    final boolean estimate;
    // the value the delta produced, recorded once the owning transaction committed
    final boolean hasShortcut;
    final long shortcut;

    private VersionedEntry(Kind kind, int incarnation, @Nullable WriteOp<V> write, @Nullable DeltaOp delta, boolean estimate, boolean hasShortcut, long shortcut)
    {
        this.kind = kind;
        this.incarnation = incarnation;
        this.write = write;
        this.delta = delta;
        this.estimate = estimate;
        this.hasShortcut = hasShortcut;
        this.shortcut = shortcut;
    }

    static <V> VersionedEntry<V> base(WriteOp<V> value)
    {
        return new VersionedEntry<>(Kind.Base, -1, nonNull(value), null, false, false, 0);
    }

    static <V> VersionedEntry<V> write(int incarnation, WriteOp<V> write)
    {
        return new VersionedEntry<>(Kind.Write, incarnation, nonNull(write), null, false, false, 0);
    }

    static <V> VersionedEntry<V> delta(DeltaOp delta)
    {
        return new VersionedEntry<>(Kind.Delta, -1, null, nonNull(delta), false, false, 0);
    }

    VersionedEntry<V> asEstimate()
    {
        checkState(kind != Kind.Base, "The base value cannot be marked as an estimate");
        return new VersionedEntry<>(kind, incarnation, write, delta, true, hasShortcut, shortcut);
    }

    VersionedEntry<V> withShortcut(long value)
    {
        checkState(kind == Kind.Delta && !estimate, "Only published deltas can be materialized");
        return new VersionedEntry<>(kind, incarnation, write, delta, false, true, value);
    }

    @Override
    public String toString()
    {
        String s;
        switch (kind)
        {
            default: throw new AssertionError("Unhandled kind: " + kind);
            case Base: s = "Base(" + write + ')'; break;
            case Write: s = write + "@" + incarnation; break;
            case Delta: s = "Delta(" + delta + (hasShortcut ? "=" + shortcut : "") + ')'; break;
        }
        return estimate ? "Estimate(" + s + ')' : s;
    }
}
