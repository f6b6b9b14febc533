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

/**
 * Thrown when a {@link DeltaOp} cannot be applied to a concrete value. The failure is deterministic for a
 * given delta and base, so parallel and sequential execution report the same reason.
 */
public class DeltaApplicationException extends Exception
{
    public enum Failure
    {
        /** Some intermediate value would have exceeded the aggregator's limit. */
        Overflow,
        /** Some intermediate value would have dropped below zero. */
        Underflow,
        /** The slot holds no value (absent or deleted) so there is nothing to apply the delta to. */
        MissingValue
    }

    public final Failure failure;

    /**
     * The abort reason reported for a transaction whose delta on {@code key} could not be applied.
     */
    public static String abortReason(Object key, Failure failure)
    {
        return "Delta application failure (" + failure + ") on " + key;
    }

    public DeltaApplicationException(Failure failure, String message)
    {
        super(message);
        this.failure = failure;
    }
}
