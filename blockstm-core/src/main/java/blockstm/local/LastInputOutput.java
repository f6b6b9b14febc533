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

import java.util.concurrent.atomic.AtomicIntegerArray;
import java.util.concurrent.atomic.AtomicReferenceArray;
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableSet;

import static blockstm.utils.Invariants.illegalState;

/**
 * The latest {@link ExecutionRecord} of every transaction in the block.
 * <p>
 * Recording atomically replaces the previous incarnation's record in full. Once a transaction commits its record
 * is taken exactly once; recording or taking again afterwards is a programming error.
 */
public class LastInputOutput<K, V, E>
{
    private final AtomicReferenceArray<ExecutionRecord<K, V, E>> records;
    private final AtomicIntegerArray taken;

    public LastInputOutput(int blockSize)
    {
        this.records = new AtomicReferenceArray<>(blockSize);
        this.taken = new AtomicIntegerArray(blockSize);
    }

    public void record(int txnIndex, ExecutionRecord<K, V, E> record)
    {
        if (taken.get(txnIndex) != 0)
            throw illegalState("Transaction " + txnIndex + " recorded after its output was taken");
        records.set(txnIndex, record);
    }

    @Nullable
    public ExecutionRecord<K, V, E> get(int txnIndex)
    {
        return records.get(txnIndex);
    }

    /**
     * @return the keys the latest incarnation of {@code txnIndex} published, empty if it has not been executed
     */
    public ImmutableSet<K> modifiedKeys(int txnIndex)
    {
        ExecutionRecord<K, V, E> record = records.get(txnIndex);
        return record == null ? ImmutableSet.of() : record.modifiedKeys;
    }

    public ExecutionRecord<K, V, E> takeOutput(int txnIndex)
    {
        if (!taken.compareAndSet(txnIndex, 0, 1))
            throw illegalState("Output of transaction " + txnIndex + " taken twice");
        ExecutionRecord<K, V, E> record = records.get(txnIndex);
        if (record == null)
            throw illegalState("Transaction " + txnIndex + " has no output to take");
        return record;
    }
}
