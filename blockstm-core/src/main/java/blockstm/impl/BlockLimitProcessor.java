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

package blockstm.impl;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Set;

import com.google.common.math.LongMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import blockstm.api.ExecutorConfig;
import blockstm.primitives.ExecutionMode;
import blockstm.primitives.TransactionOutput;

import static blockstm.utils.Invariants.checkState;

/**
 * Accumulates the cost of committed transactions in block order and decides when the block must end.
 * <p>
 * Each transaction is charged {@code multiplier * (executionGas * executionGasMultiplier + ioGas * ioGasMultiplier)}.
 * When a conflict penalty window is configured, the multiplier is one plus the number of the preceding
 * {@code window - 1} transactions that wrote a key this transaction read, so that blocks of mutually conflicting
 * transactions fill up sooner.
 */
public class BlockLimitProcessor<K>
{
    private static final Logger logger = LoggerFactory.getLogger(BlockLimitProcessor.class);

    private final ExecutorConfig config;
    private final ExecutionMode mode;
    private final ArrayDeque<Set<K>> recentWrites = new ArrayDeque<>();

    private long accumulatedGas;
    private long accumulatedOutput;
    private int committed;
    private boolean limitReached;

    public BlockLimitProcessor(ExecutorConfig config, ExecutionMode mode)
    {
        this.config = config;
        this.mode = mode;
    }

    /**
     * Charge the next committed transaction. Aborted transactions are charged with an empty output.
     */
    public void accumulate(TransactionOutput<K, ?, ?> output, Set<K> readKeys)
    {
        checkState(!limitReached, "Transaction committed after the block limit was reached");
        ++committed;

        long gas = LongMath.saturatedAdd(LongMath.saturatedMultiply(output.executionGas, config.executionGasMultiplier()),
                                         LongMath.saturatedMultiply(output.ioGas, config.ioGasMultiplier()));

        int window = config.conflictPenaltyWindow();
        if (window > 0)
        {
            int conflicts = 0;
            for (Set<K> writes : recentWrites)
            {
                if (!Collections.disjoint(writes, readKeys))
                    ++conflicts;
            }
            gas = LongMath.saturatedMultiply(gas, 1 + conflicts);

            recentWrites.addLast(output.modifiedKeys());
            while (recentWrites.size() > window - 1)
                recentWrites.removeFirst();
        }

        accumulatedGas = LongMath.saturatedAdd(accumulatedGas, gas);
        accumulatedOutput = LongMath.saturatedAdd(accumulatedOutput, output.outputSize);
        limitReached = isLimitReached();
    }

    private boolean isLimitReached()
    {
        if (config.blockGasLimit() != ExecutorConfig.NO_LIMIT && accumulatedGas >= config.blockGasLimit())
        {
            logger.info("Execution ({}) halted early: accumulated block gas {} >= block gas limit {}", mode, accumulatedGas, config.blockGasLimit());
            return true;
        }
        if (config.blockOutputLimit() != ExecutorConfig.NO_LIMIT && accumulatedOutput >= config.blockOutputLimit())
        {
            logger.info("Execution ({}) halted early: accumulated output {} >= block output limit {}", mode, accumulatedOutput, config.blockOutputLimit());
            return true;
        }
        if (config.maxTransactions() != ExecutorConfig.NO_LIMIT && committed >= config.maxTransactions())
        {
            logger.info("Execution ({}) halted early: {} transactions committed, the maximum for a block", mode, committed);
            return true;
        }
        return false;
    }

    public boolean shouldEndBlock()
    {
        return limitReached;
    }

    public long accumulatedGas()
    {
        return accumulatedGas;
    }

    public long accumulatedOutput()
    {
        return accumulatedOutput;
    }

    public int committed()
    {
        return committed;
    }
}
