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

import javax.annotation.Nullable;

import static blockstm.utils.Invariants.nonNull;

/**
 * A unit of work handed to a worker by the {@link Scheduler}.
 */
public final class SchedulerTask
{
    public enum Kind
    {
        /** execute incarnation {@link #incarnation} of {@link #txnIndex} */
        Execute,
        /** validate the reads of incarnation {@link #incarnation} of {@link #txnIndex} at {@link #wave} */
        Validate,
        /** let the worker suspended on {@link #condition} continue its execution */
        Wakeup,
        /** nothing to do right now */
        Retry,
        /** every transaction has been committed, or the block was halted */
        Done
    }

    public static final SchedulerTask RETRY = new SchedulerTask(Kind.Retry, -1, -1, -1, null);
    public static final SchedulerTask DONE = new SchedulerTask(Kind.Done, -1, -1, -1, null);

    public final Kind kind;
    public final int txnIndex;
    public final int incarnation;
    public final int wave;
    @Nullable public final DependencyCondition condition;

    private SchedulerTask(Kind kind, int txnIndex, int incarnation, int wave, @Nullable DependencyCondition condition)
    {
        this.kind = kind;
        this.txnIndex = txnIndex;
        this.incarnation = incarnation;
        this.wave = wave;
        this.condition = condition;
    }

    static SchedulerTask execute(int txnIndex, int incarnation)
    {
        return new SchedulerTask(Kind.Execute, txnIndex, incarnation, -1, null);
    }

    static SchedulerTask validate(int txnIndex, int incarnation, int wave)
    {
        return new SchedulerTask(Kind.Validate, txnIndex, incarnation, wave, null);
    }

    static SchedulerTask wakeup(int txnIndex, int incarnation, DependencyCondition condition)
    {
        return new SchedulerTask(Kind.Wakeup, txnIndex, incarnation, -1, nonNull(condition));
    }

    @Override
    public String toString()
    {
        switch (kind)
        {
            default: throw new AssertionError("Unhandled kind: " + kind);
            case Execute: return "Execute[" + txnIndex + ',' + incarnation + ']';
            case Validate: return "Validate[" + txnIndex + ',' + incarnation + "]@" + wave;
            case Wakeup: return "Wakeup[" + txnIndex + ',' + incarnation + ']';
            case Retry: return "Retry";
            case Done: return "Done";
        }
    }
}
