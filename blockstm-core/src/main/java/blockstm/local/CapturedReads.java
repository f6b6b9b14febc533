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

import java.util.HashMap;
import java.util.Map;
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableSet;

import blockstm.api.AggregatorCodec;
import blockstm.primitives.DeltaApplicationException.Failure;
import blockstm.primitives.DeltaOp;
import blockstm.primitives.ReadDescriptor;

import static blockstm.utils.Invariants.checkState;
import static blockstm.utils.Invariants.illegalArgument;

/**
 * The reads made by a single incarnation, built afresh for every execution attempt and never patched.
 * <p>
 * Values are cached alongside their descriptors so that repeated reads of a key within the incarnation return the
 * same answer. Not thread safe while the incarnation executes; read-only once it has been recorded.
 */
public class CapturedReads<K, V>
{
    private static class Captured<V>
    {
        final ReadDescriptor descriptor;
        @Nullable final V value;

        Captured(ReadDescriptor descriptor, @Nullable V value)
        {
            this.descriptor = descriptor;
            this.value = value;
        }
    }

    private final Map<K, Captured<V>> reads = new HashMap<>();
    private final Map<K, ReadDescriptor> deltaChecks = new HashMap<>();

    public boolean contains(K key)
    {
        return reads.containsKey(key);
    }

    @Nullable
    public V value(K key)
    {
        Captured<V> captured = reads.get(key);
        checkState(captured != null, "%s has not been read", key);
        return captured.value;
    }

    public void capture(K key, ReadDescriptor descriptor, @Nullable V value)
    {
        checkState(descriptor.kind != ReadDescriptor.Kind.DeltaBounds);
        Captured<V> prev = reads.putIfAbsent(key, new Captured<>(descriptor, value));
        checkState(prev == null, "%s has already been read", key);
    }

    public void captureDeltaBounds(K key, DeltaOp delta, @Nullable Failure outcome)
    {
        deltaChecks.put(key, ReadDescriptor.deltaBounds(delta, outcome));
    }

    @Nullable
    public ReadDescriptor deltaCheck(K key)
    {
        return deltaChecks.get(key);
    }

    public ImmutableSet<K> readKeys()
    {
        return ImmutableSet.copyOf(reads.keySet());
    }

    /**
     * @return true iff reading every captured key below {@code txnIndex} now would observe what this incarnation observed
     */
    public boolean validate(MultiVersionStore<K, V> store, int txnIndex)
    {
        for (Map.Entry<K, Captured<V>> e : reads.entrySet())
        {
            if (!isStillValid(e.getValue().descriptor, store.read(e.getKey(), txnIndex), store.codec()))
                return false;
        }
        for (Map.Entry<K, ReadDescriptor> e : deltaChecks.entrySet())
        {
            if (!isStillValid(e.getValue(), store.read(e.getKey(), txnIndex), store.codec()))
                return false;
        }
        return true;
    }

    static <V> boolean isStillValid(ReadDescriptor descriptor, ReadResult<V> current, AggregatorCodec<V> codec)
    {
        switch (descriptor.kind)
        {
            default: throw new AssertionError("Unhandled kind: " + descriptor.kind);
            case Versioned:
                return current.kind == ReadResult.Kind.Versioned && current.version.equals(descriptor.version);
            case Storage:
                return current.kind == ReadResult.Kind.Storage || current.kind == ReadResult.Kind.NotFound;
            case Resolved:
                return current.kind == ReadResult.Kind.Resolved && current.resolved == descriptor.resolvedValue;
            case ResolutionFailure:
                return current.kind == ReadResult.Kind.DeltaFailure && current.failure == descriptor.failure;
            case DeltaBounds:
                switch (current.kind)
                {
                    case Storage:
                    case Versioned:
                    case Resolved:
                        return checkDelta(descriptor.delta, current, codec) == descriptor.failure;
                    default:
                        return false;
                }
        }
    }

    /**
     * @return the reason {@code delta} cannot be applied to the value {@code below} holds, or null if it can
     */
    @Nullable
    public static <V> Failure checkDelta(DeltaOp delta, ReadResult<V> below, AggregatorCodec<V> codec)
    {
        switch (below.kind)
        {
            default: throw illegalArgument("No concrete value to check against: " + below);
            case Resolved:
                return delta.validate(below.resolved);
            case Storage:
            case Versioned:
                if (below.write.isDeletion())
                    return Failure.MissingValue;
                return delta.validate(codec.decode(below.write.value()));
        }
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder("{");
        reads.forEach((k, c) -> sb.append(k).append(':').append(c.descriptor).append(", "));
        deltaChecks.forEach((k, d) -> sb.append(k).append(':').append(d).append(", "));
        if (sb.length() > 1) sb.setLength(sb.length() - 2);
        return sb.append('}').toString();
    }
}
