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

import com.google.common.annotations.VisibleForTesting;

import blockstm.primitives.DeltaApplicationException.Failure;

import static blockstm.utils.Invariants.checkArgument;

/**
 * A partial, commutative update to an integer aggregator with values in {@code [0, limit]}.
 * <p>
 * Besides the net {@link #update} a delta remembers the largest positive ({@link #maxPositive}) and the largest
 * negative ({@link #minNegative}) excursion of the running total while it was built. Applying it to a base succeeds
 * only if every one of those intermediate values stayed in range, which is exactly what applying the underlying
 * sequence of additions and subtractions one at a time would have required.
 * <p>
 * Instances are immutable.
 */
public final class DeltaOp
{
    public final long limit;
    public final long maxPositive;
    public final long minNegative;
    /** signed net change; always within {@code [-minNegative, maxPositive]} */
    public final long update;

    public DeltaOp(long update, long maxPositive, long minNegative, long limit)
    {
        checkArgument(limit >= 0, "Negative limit %s", limit);
        checkArgument(maxPositive >= 0 && maxPositive <= limit, "maxPositive %s outside of [0, %s]", maxPositive, limit);
        checkArgument(minNegative >= 0 && minNegative <= limit, "minNegative %s outside of [0, %s]", minNegative, limit);
        checkArgument(update <= maxPositive && update >= -minNegative, "update %s outside of its history", update);
        this.limit = limit;
        this.maxPositive = maxPositive;
        this.minNegative = minNegative;
        this.update = update;
    }

    public static DeltaOp plus(long value, long limit)
    {
        checkArgument(value >= 0, "Negative addend %s", value);
        return new DeltaOp(value, value, 0, limit);
    }

    public static DeltaOp minus(long value, long limit)
    {
        checkArgument(value >= 0, "Negative subtrahend %s", value);
        return new DeltaOp(-value, 0, value, limit);
    }

    public static DeltaOp noop(long limit)
    {
        return new DeltaOp(0, 0, 0, limit);
    }

    /**
     * @return the reason applying this delta to {@code base} would fail, or {@code null} if it would succeed
     */
    @Nullable
    public Failure validate(long base)
    {
        if (base < 0)
            return Failure.Underflow;
        if (base > limit || maxPositive > limit - base)
            return Failure.Overflow;
        if (minNegative > base)
            return Failure.Underflow;
        return null;
    }

    public long applyTo(long base) throws DeltaApplicationException
    {
        Failure failure = validate(base);
        if (failure != null)
            throw new DeltaApplicationException(failure, failure + " applying " + this + " to " + base);
        return base + update;
    }

    /**
     * Compose this delta with {@code next}, which is applied after it. Applying the result to any base yields the
     * same value as applying this delta and then {@code next}, and fails whenever that sequence would fail.
     *
     * @throws DeltaApplicationException if no base can satisfy both histories
     */
    public DeltaOp mergeWithNext(DeltaOp next) throws DeltaApplicationException
    {
        checkArgument(limit == next.limit, "Cannot merge deltas with different limits %s and %s", limit, next.limit);

        long maxPositive = this.maxPositive;
        if (update >= 0)
        {
            if (next.maxPositive > limit - update)
                throw new DeltaApplicationException(Failure.Overflow, "Overflow merging " + this + " with " + next);
            maxPositive = Math.max(maxPositive, update + next.maxPositive);
        }
        else
        {
            maxPositive = Math.max(maxPositive, update + next.maxPositive);
        }

        long minNegative = this.minNegative;
        if (update <= 0)
        {
            if (next.minNegative > limit + update)
                throw new DeltaApplicationException(Failure.Underflow, "Underflow merging " + this + " with " + next);
            minNegative = Math.max(minNegative, next.minNegative - update);
        }
        else
        {
            minNegative = Math.max(minNegative, next.minNegative - update);
        }

        return new DeltaOp(update + next.update, maxPositive, minNegative, limit);
    }

    @VisibleForTesting
    public boolean isNoop()
    {
        return update == 0 && maxPositive == 0 && minNegative == 0;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeltaOp that = (DeltaOp) o;
        return limit == that.limit && maxPositive == that.maxPositive
               && minNegative == that.minNegative && update == that.update;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(limit, maxPositive, minNegative, update);
    }

    @Override
    public String toString()
    {
        return (update >= 0 ? "+" : "") + update + "{max:+" + maxPositive + ",min:-" + minNegative + ",limit:" + limit + '}';
    }
}
