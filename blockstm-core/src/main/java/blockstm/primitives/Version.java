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

/**
 * Identifies one execution attempt of a transaction: its position in the block and its incarnation.
 */
public final class Version implements Comparable<Version>
{
    public final int txnIndex;
    public final int incarnation;

    public Version(int txnIndex, int incarnation)
    {
        this.txnIndex = txnIndex;
        this.incarnation = incarnation;
    }

    @Override
    public int compareTo(Version that)
    {
        int c = Integer.compare(this.txnIndex, that.txnIndex);
        if (c == 0) c = Integer.compare(this.incarnation, that.incarnation);
        return c;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Version that = (Version) o;
        return txnIndex == that.txnIndex && incarnation == that.incarnation;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(txnIndex, incarnation);
    }

    @Override
    public String toString()
    {
        return "[" + txnIndex + ',' + incarnation + ']';
    }
}
