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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;

import blockstm.api.AggregatorCodec;
import blockstm.primitives.DeltaApplicationException;
import blockstm.primitives.DeltaApplicationException.Failure;
import blockstm.primitives.DeltaOp;
import blockstm.primitives.Version;
import blockstm.primitives.WriteOp;

import static blockstm.utils.Invariants.checkArgument;
import static blockstm.utils.Invariants.checkState;
import static blockstm.utils.Invariants.illegalState;

/**
 * The shared, multi-versioned view of every key touched during one block.
 * <p>
 * Each key maps to a chain of entries ordered by the index of the transaction that produced them; the value cached
 * from the base state lives below every transaction at {@link #BASE_INDEX}. Operations on different keys never
 * contend, and entries are published by atomically replacing them so readers never observe a partial update.
 * <p>
 * A read on behalf of transaction {@code i} only ever considers entries of transactions strictly below {@code i}.
 * Aggregator deltas are accumulated backwards until a full value is found and are then applied in transaction
 * order, one at a time, so a failure is reported exactly where in-order application would report it.
 */
public class MultiVersionStore<K, V>
{
    public static final int BASE_INDEX = -1;

    private final Map<K, ConcurrentSkipListMap<Integer, VersionedEntry<V>>> data = new ConcurrentHashMap<>();
    private final AggregatorCodec<V> codec;

    public MultiVersionStore(AggregatorCodec<V> codec)
    {
        this.codec = codec;
    }

    public AggregatorCodec<V> codec()
    {
        return codec;
    }

    private ConcurrentSkipListMap<Integer, VersionedEntry<V>> versions(K key)
    {
        return data.computeIfAbsent(key, ignore -> new ConcurrentSkipListMap<>());
    }

    /**
     * Publish a full write of {@code key} by incarnation {@code incarnation} of transaction {@code txnIndex},
     * replacing whatever an earlier incarnation left there.
     */
    public void write(K key, int txnIndex, int incarnation, WriteOp<V> write)
    {
        checkArgument(txnIndex >= 0);
        VersionedEntry<V> prev = versions(key).put(txnIndex, VersionedEntry.write(incarnation, write));
        checkState(prev == null || prev.kind != VersionedEntry.Kind.Write || prev.incarnation < incarnation,
                   "Write of %s by incarnation %s does not supersede the existing entry", key, incarnation);
    }

    public void addDelta(K key, int txnIndex, DeltaOp delta)
    {
        checkArgument(txnIndex >= 0);
        versions(key).put(txnIndex, VersionedEntry.delta(delta));
    }

    /**
     * Warn readers above {@code txnIndex} that its entry for {@code key} is about to be rewritten.
     */
    public void markEstimate(K key, int txnIndex)
    {
        ConcurrentSkipListMap<Integer, VersionedEntry<V>> versions = data.get(key);
        VersionedEntry<V> marked = versions == null ? null : versions.computeIfPresent(txnIndex, (i, entry) -> entry.asEstimate());
        if (marked == null)
            throw illegalState("No entry to mark as an estimate for " + key + " at " + txnIndex);
    }

    /**
     * Remove the entry of {@code key} left by an earlier incarnation of {@code txnIndex} that the latest one no longer writes.
     */
    public void remove(K key, int txnIndex)
    {
        ConcurrentSkipListMap<Integer, VersionedEntry<V>> versions = data.get(key);
        if (versions == null || versions.remove(txnIndex) == null)
            throw illegalState("No entry to remove for " + key + " at " + txnIndex);
    }

    /**
     * Record the value {@code key} had before the block. Only the first value recorded for a key is kept, so every
     * reader resolves against the same base.
     */
    public void setBaseValue(K key, WriteOp<V> value)
    {
        versions(key).putIfAbsent(BASE_INDEX, VersionedEntry.base(value));
    }

    public ReadResult<V> read(K key, int txnIndex)
    {
        ConcurrentSkipListMap<Integer, VersionedEntry<V>> versions = data.get(key);
        if (versions == null)
            return ReadResult.notFound();

        // deltas met on the way down, highest index first
        List<DeltaOp> pending = null;
        for (Map.Entry<Integer, VersionedEntry<V>> e : versions.headMap(txnIndex).descendingMap().entrySet())
        {
            VersionedEntry<V> entry = e.getValue();
            if (entry.estimate)
                return ReadResult.dependency(e.getKey());

            switch (entry.kind)
            {
                default: throw new AssertionError("Unhandled kind: " + entry.kind);
                case Write:
                    if (pending == null)
                        return ReadResult.versioned(new Version(e.getKey(), entry.incarnation), entry.write);
                    return resolve(entry.write, pending);

                case Base:
                    if (pending == null)
                        return ReadResult.storage(entry.write);
                    return resolve(entry.write, pending);

                case Delta:
                    if (entry.hasShortcut)
                        return pending == null ? ReadResult.resolved(entry.shortcut) : resolve(entry.shortcut, pending);
                    if (pending == null)
                        pending = new ArrayList<>(4);
                    pending.add(entry.delta);
            }
        }

        if (pending == null)
            return ReadResult.notFound();

        DeltaOp accumulated = pending.get(pending.size() - 1);
        try
        {
            for (int i = pending.size() - 2; i >= 0; --i)
                accumulated = accumulated.mergeWithNext(pending.get(i));
        }
        catch (DeltaApplicationException e)
        {
            return ReadResult.deltaFailure(e.failure);
        }
        return ReadResult.unresolved(accumulated);
    }

    private ReadResult<V> resolve(WriteOp<V> base, List<DeltaOp> pending)
    {
        if (base.isDeletion())
            return ReadResult.deltaFailure(Failure.MissingValue);
        return resolve(codec.decode(base.value()), pending);
    }

    private ReadResult<V> resolve(long base, List<DeltaOp> pending)
    {
        long value = base;
        try
        {
            for (int i = pending.size() - 1; i >= 0; --i)
                value = pending.get(i).applyTo(value);
        }
        catch (DeltaApplicationException e)
        {
            return ReadResult.deltaFailure(e.failure);
        }
        return ReadResult.resolved(value);
    }

    /**
     * Compute the value produced by the delta {@code txnIndex} published for {@code key}, and remember it so later
     * reads stop their search there. Must only be called once every transaction below {@code txnIndex} committed,
     * which is what makes the remembered value final.
     */
    public long materializeDelta(K key, int txnIndex)
    {
        ConcurrentSkipListMap<Integer, VersionedEntry<V>> versions = data.get(key);
        VersionedEntry<V> entry = versions == null ? null : versions.get(txnIndex);
        if (entry == null || entry.kind != VersionedEntry.Kind.Delta || entry.estimate)
            throw illegalState("No published delta for " + key + " at " + txnIndex + ": " + entry);
        if (entry.hasShortcut)
            return entry.shortcut;

        ReadResult<V> below = read(key, txnIndex);
        long base;
        switch (below.kind)
        {
            case Storage:
            case Versioned:
                if (below.write.isDeletion())
                    throw illegalState("Committed delta for " + key + " at " + txnIndex + " has no value to apply to");
                base = codec.decode(below.write.value());
                break;
            case Resolved:
                base = below.resolved;
                break;
            default:
                throw illegalState("Cannot materialize delta for " + key + " at " + txnIndex + ": " + below);
        }

        long value;
        try
        {
            value = entry.delta.applyTo(base);
        }
        catch (DeltaApplicationException e)
        {
            throw new IllegalStateException("Committed delta for " + key + " at " + txnIndex + " failed to apply", e);
        }
        checkState(versions.replace(txnIndex, entry, entry.withShortcut(value)), "Delta for %s at %s changed after commit", key, txnIndex);
        return value;
    }

    @VisibleForTesting
    @Nullable
    VersionedEntry<V> entry(K key, int txnIndex)
    {
        ConcurrentSkipListMap<Integer, VersionedEntry<V>> versions = data.get(key);
        return versions == null ? null : versions.get(txnIndex);
    }

    @VisibleForTesting
    public boolean hasShortcut(K key, int txnIndex)
    {
        VersionedEntry<V> entry = entry(key, txnIndex);
        return entry != null && entry.hasShortcut;
    }

    @VisibleForTesting
    public boolean isEstimate(K key, int txnIndex)
    {
        VersionedEntry<V> entry = entry(key, txnIndex);
        return entry != null && entry.estimate;
    }
}
