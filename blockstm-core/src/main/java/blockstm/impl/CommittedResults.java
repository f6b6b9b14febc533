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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableSortedMap;

import blockstm.api.Agent;
import blockstm.api.ExecutorConfig;
import blockstm.primitives.BlockExecutionStats;
import blockstm.primitives.BlockOutput;
import blockstm.primitives.ExecutionMode;
import blockstm.primitives.ExecutionResult;
import blockstm.primitives.ExecutionStatus;
import blockstm.primitives.TransactionOutput;
import blockstm.primitives.TransactionResult;
import blockstm.primitives.WriteOp;

import static blockstm.utils.Invariants.checkState;

/**
 * Collects the results of committed transactions in block order and applies the block-ending rules; shared by
 * parallel and sequential execution so both end a block at exactly the same transaction.
 * <p>
 * Not thread safe: during parallel execution only the holder of the scheduler's commit lock may use it.
 */
class CommittedResults<K, V, E>
{
    private final int blockSize;
    private final Agent agent;
    private final BlockLimitProcessor<K> limits;
    private final List<TransactionResult<K, V, E>> results;
    private boolean ended;

    CommittedResults(int blockSize, ExecutorConfig config, Agent agent, ExecutionMode mode)
    {
        this.blockSize = blockSize;
        this.agent = agent;
        this.limits = new BlockLimitProcessor<>(config, mode);
        this.results = new ArrayList<>(blockSize);
    }

    /**
     * @param writes the transaction's full writes together with the values its deltas produced
     * @return true if the block ends with this transaction
     */
    boolean commit(int txnIndex, ExecutionResult<K, V, E> result, ImmutableSortedMap<K, WriteOp<V>> writes, Set<K> readKeys)
    {
        checkState(!ended, "Transaction %s committed after the block ended", txnIndex);
        checkState(txnIndex == results.size(), "Transaction %s committed out of order", txnIndex);

        TransactionOutput<K, V, E> output = result.outputOrEmpty();
        if (result.status == ExecutionStatus.ABORT)
            results.add(TransactionResult.aborted(result.abortReason));
        else
            results.add(TransactionResult.committed(result.status, writes, output.events, output.totalGas()));

        limits.accumulate(output, readKeys);
        if (result.status == ExecutionStatus.SKIP_REST)
        {
            ended = true;
        }
        else if (limits.shouldEndBlock())
        {
            ended = true;
            if (results.size() < blockSize)
                agent.onBlockLimitReached(results.size(), blockSize);
        }
        return ended;
    }

    int committed()
    {
        return results.size();
    }

    BlockOutput<K, V, E> finish(ExecutionMode mode, BlockExecutionStats stats)
    {
        checkState(ended || results.size() == blockSize, "Block finished with only %s of its transactions committed", results.size());
        List<TransactionResult<K, V, E>> all = new ArrayList<>(results);
        while (all.size() < blockSize)
            all.add(TransactionResult.skipped());
        return BlockOutput.of(all, mode, stats);
    }
}
