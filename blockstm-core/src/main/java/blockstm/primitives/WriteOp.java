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

import static blockstm.utils.Invariants.nonNull;

/**
 * A full write of a storage slot: either a new value, or a deletion.
 */
public final class WriteOp<V>
{
    private static final WriteOp<?> DELETION = new WriteOp<>(null);

    @Nullable
    private final V value;

    private WriteOp(@Nullable V value)
    {
        this.value = value;
    }

    public static <V> WriteOp<V> value(V value)
    {
        return new WriteOp<>(nonNull(value, "use WriteOp.deletion() to remove a value"));
    }

    @SuppressWarnings("unchecked")
    public static <V> WriteOp<V> deletion()
    {
        return (WriteOp<V>) DELETION;
    }

    /**
     * @return a write of {@code value}, or a deletion if it is {@code null}
     */
    public static <V> WriteOp<V> of(@Nullable V value)
    {
        return value == null ? deletion() : new WriteOp<>(value);
    }

    public boolean isDeletion()
    {
        return value == null;
    }

    @Nullable
    public V value()
    {
        return value;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(value, ((WriteOp<?>) o).value);
    }

    @Override
    public int hashCode()
    {
        return Objects.hashCode(value);
    }

    @Override
    public String toString()
    {
        return value == null ? "Deletion" : "Write(" + value + ')';
    }
}
