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

import javax.annotation.Nullable;

import static blockstm.utils.Invariants.checkArgument;
import static blockstm.utils.Invariants.nonNull;

/**
 * The result a transaction returns from one execution: a status and, unless it aborted, its output.
 */
public final class ExecutionResult<K, V, E>
{
    public final ExecutionStatus status;
    @Nullable
    public final TransactionOutput<K, V, E> output;
    @Nullable
    public final String abortReason;

    private ExecutionResult(ExecutionStatus status, @Nullable TransactionOutput<K, V, E> output, @Nullable String abortReason)
    {
        checkArgument((status == ExecutionStatus.ABORT) == (output == null), "Only aborted executions have no output");
        this.status = status;
        this.output = output;
        this.abortReason = abortReason;
    }

    public static <K, V, E> ExecutionResult<K, V, E> success(TransactionOutput<K, V, E> output)
    {
        return new ExecutionResult<>(ExecutionStatus.SUCCESS, nonNull(output), null);
    }

    public static <K, V, E> ExecutionResult<K, V, E> skipRest(TransactionOutput<K, V, E> output)
    {
        return new ExecutionResult<>(ExecutionStatus.SKIP_REST, nonNull(output), null);
    }

    public static <K, V, E> ExecutionResult<K, V, E> abort(String reason)
    {
        return new ExecutionResult<>(ExecutionStatus.ABORT, null, nonNull(reason));
    }

    /**
     * @return the output, or an empty output if the execution aborted
     */
    public TransactionOutput<K, V, E> outputOrEmpty()
    {
        return output == null ? TransactionOutput.empty() : output;
    }

    @Override
    public String toString()
    {
        return status + (output == null ? "(" + abortReason + ')' : output.toString());
    }
}
