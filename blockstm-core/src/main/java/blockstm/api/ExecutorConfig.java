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

package blockstm.api;

import java.time.Duration;

/**
 * Tunables of the block executor. Every option has a default; override only what you need.
 */
public interface ExecutorConfig
{
    ExecutorConfig DEFAULT = new ExecutorConfig() {};

    long NO_LIMIT = Long.MAX_VALUE;

    /**
     * The number of worker threads. A level of one executes every block sequentially.
     */
    default int concurrencyLevel()
    {
        return Runtime.getRuntime().availableProcessors();
    }

    /**
     * Once the effective gas of the committed transactions reaches this limit the remaining transactions are skipped.
     */
    default long blockGasLimit()
    {
        return NO_LIMIT;
    }

    default long blockOutputLimit()
    {
        return NO_LIMIT;
    }

    default long maxTransactions()
    {
        return NO_LIMIT;
    }

    default long executionGasMultiplier()
    {
        return 1;
    }

    default long ioGasMultiplier()
    {
        return 1;
    }

    /**
     * When positive, a transaction's gas is multiplied by one plus the number of the preceding
     * {@code conflictPenaltyWindow - 1} transactions whose writes it read.
     */
    default int conflictPenaltyWindow()
    {
        return 0;
    }

    /**
     * The number of incarnations after which a transaction is assumed not to make progress, and the parallel run
     * is abandoned in favour of sequential execution.
     */
    default int maxIncarnations(int blockSize)
    {
        return Math.max(32, 2 * blockSize);
    }

    /**
     * How long a worker may wait on a dependency before the parallel run is considered stalled.
     */
    default Duration dependencyWaitTimeout()
    {
        return Duration.ofSeconds(30);
    }

    default boolean allowSequentialFallback()
    {
        return true;
    }
}
