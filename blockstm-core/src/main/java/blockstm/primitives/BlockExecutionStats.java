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

import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nullable;

/**
 * Counters describing how much work a block execution took. For sequential execution every transaction up to the
 * end of the block is executed exactly once and never validated.
 */
public final class BlockExecutionStats
{
    public static final BlockExecutionStats NONE = new BlockExecutionStats(0, 0, 0, 0, 0, null);

    public final int executions;
    public final int validations;
    public final int validationAborts;
    public final int dependencyWaits;
    /** the highest incarnation any transaction reached */
    public final int maxIncarnation;
    /** why parallel execution was abandoned, if it was */
    @Nullable
    public final Throwable fallbackCause;

    public BlockExecutionStats(int executions, int validations, int validationAborts, int dependencyWaits, int maxIncarnation, @Nullable Throwable fallbackCause)
    {
        this.executions = executions;
        this.validations = validations;
        this.validationAborts = validationAborts;
        this.dependencyWaits = dependencyWaits;
        this.maxIncarnation = maxIncarnation;
        this.fallbackCause = fallbackCause;
    }

    public BlockExecutionStats withFallbackCause(Throwable cause)
    {
        return new BlockExecutionStats(executions, validations, validationAborts, dependencyWaits, maxIncarnation, cause);
    }

    @Override
    public String toString()
    {
        return "executions=" + executions + ", validations=" + validations + ", validationAborts=" + validationAborts
               + ", dependencyWaits=" + dependencyWaits + ", maxIncarnation=" + maxIncarnation
               + (fallbackCause == null ? "" : ", fallbackCause=" + fallbackCause);
    }

    /**
     * Thread safe accumulator shared by the workers of one block.
     */
    public static class Collector
    {
        private final AtomicInteger executions = new AtomicInteger();
        private final AtomicInteger validations = new AtomicInteger();
        private final AtomicInteger validationAborts = new AtomicInteger();
        private final AtomicInteger dependencyWaits = new AtomicInteger();
        private final AtomicInteger maxIncarnation = new AtomicInteger();

        public void onExecution(int incarnation)
        {
            executions.incrementAndGet();
            maxIncarnation.accumulateAndGet(incarnation, Math::max);
        }

        public void onValidation()
        {
            validations.incrementAndGet();
        }

        public void onValidationAbort()
        {
            validationAborts.incrementAndGet();
        }

        public void onDependencyWait()
        {
            dependencyWaits.incrementAndGet();
        }

        public BlockExecutionStats snapshot()
        {
            return new BlockExecutionStats(executions.get(), validations.get(), validationAborts.get(), dependencyWaits.get(), maxIncarnation.get(), null);
        }
    }
}
