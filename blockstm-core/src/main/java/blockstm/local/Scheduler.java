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

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import org.agrona.collections.IntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import blockstm.primitives.Version;
import blockstm.utils.ArmedLock;

import static blockstm.utils.Invariants.checkArgument;
import static blockstm.utils.Invariants.checkState;
import static blockstm.utils.Invariants.illegalState;

/**
 * Coordinates the workers of one block: hands out execution and validation tasks, tracks dependencies between
 * transactions, and decides when the next transaction in block order may commit.
 * <p>
 * Two shared indices drive the work: the next transaction to execute, and the next transaction to validate
 * together with the current validation <em>wave</em>. Whenever an execution may have invalidated reads of later
 * transactions the validation index is moved back and the wave is bumped. A transaction commits once every
 * earlier transaction committed and it was validated in a wave at least as recent as any wave triggered at or
 * below it, which guarantees its reads were checked against the final writes of everything below it.
 * <p>
 * Per transaction state is guarded by monitors scoped to that transaction. Locks are always taken in the order
 * validation state, then dependents, then execution state, and at most one execution state is held at a time.
 */
public class Scheduler
{
    private static final Logger logger = LoggerFactory.getLogger(Scheduler.class);
    private static final int NO_WAVE = -1;

    private static final class ExecutionState
    {
        TxnStatus status = TxnStatus.ReadyToExecute;
        int incarnation;
        // set while Suspended, and while ReadyToExecute after a dependency was resolved
        @Nullable DependencyCondition condition;
    }

    private static final class ValidationState
    {
        // the wave that transactions after this one must be validated in
        int maxTriggeredWave;
        // the wave this transaction itself must be validated in
        int requiredWave;
        int maxValidatedWave = NO_WAVE;
    }

    private final int blockSize;
    private final ExecutionState[] execution;
    private final ValidationState[] validation;
    private final IntArrayList[] dependents;

    private final AtomicInteger executionIdx = new AtomicInteger();
    // wave in the high 32 bits, transaction index in the low 32 bits
    private final AtomicLong validationIdx = new AtomicLong();
    private final AtomicBoolean done = new AtomicBoolean();
    private final AtomicBoolean halted = new AtomicBoolean();

    private final ArmedLock commitLock = new ArmedLock();
    // guarded by commitLock
    private int commitIdx, commitWave;

    public Scheduler(int blockSize)
    {
        checkArgument(blockSize > 0, "Empty block");
        this.blockSize = blockSize;
        this.execution = new ExecutionState[blockSize];
        this.validation = new ValidationState[blockSize];
        this.dependents = new IntArrayList[blockSize];
        for (int i = 0; i < blockSize; ++i)
        {
            execution[i] = new ExecutionState();
            validation[i] = new ValidationState();
            dependents[i] = new IntArrayList();
        }
    }

    private static long pack(int txnIndex, int wave)
    {
        return ((long) wave << 32) | txnIndex;
    }

    private static int index(long packed)
    {
        return (int) packed;
    }

    private static int wave(long packed)
    {
        return (int) (packed >>> 32);
    }

    public boolean isDone()
    {
        return done.get();
    }

    public boolean isHalted()
    {
        return halted.get();
    }

    /**
     * Prefers validating the lowest transaction awaiting validation over executing the next transaction, as long as
     * the former is below the latter; either way lower indices are served first.
     */
    public SchedulerTask nextTask()
    {
        while (true)
        {
            if (done.get())
                return SchedulerTask.DONE;

            long packed = validationIdx.get();
            int toValidate = index(packed);
            int toExecute = executionIdx.get();
            boolean preferValidate = toValidate < Math.min(toExecute, blockSize) && !neverExecuted(toValidate);

            if (!preferValidate && toExecute >= blockSize)
                return done.get() ? SchedulerTask.DONE : SchedulerTask.RETRY;

            SchedulerTask task = preferValidate ? tryValidateNextVersion(toValidate, wave(packed))
                                                : tryExecuteNextVersion();
            if (task != null)
                return task;
        }
    }

    @Nullable
    private SchedulerTask tryValidateNextVersion(int txnIndex, int wave)
    {
        if (!validationIdx.compareAndSet(pack(txnIndex, wave), pack(txnIndex + 1, wave)))
            return null;

        int incarnation = executedIncarnation(txnIndex);
        return incarnation < 0 ? null : SchedulerTask.validate(txnIndex, incarnation, wave);
    }

    @Nullable
    private SchedulerTask tryExecuteNextVersion()
    {
        int txnIndex = executionIdx.getAndIncrement();
        if (txnIndex >= blockSize)
            return null;
        return tryIncarnate(txnIndex);
    }

    /**
     * Start the next incarnation of {@code txnIndex} if it is ready to execute. If the transaction was suspended on a
     * dependency that has since been resolved, the task instead wakes up the suspended execution.
     */
    @Nullable
    private SchedulerTask tryIncarnate(int txnIndex)
    {
        ExecutionState state = execution[txnIndex];
        synchronized (state)
        {
            if (state.status != TxnStatus.ReadyToExecute)
                return null;

            state.status = TxnStatus.Executing;
            DependencyCondition condition = state.condition;
            state.condition = null;
            return condition == null ? SchedulerTask.execute(txnIndex, state.incarnation)
                                     : SchedulerTask.wakeup(txnIndex, state.incarnation, condition);
        }
    }

    /**
     * Report that incarnation {@code incarnation} of {@code txnIndex} finished executing and published its output.
     *
     * @param revalidateSuffix true if the incarnation wrote a key its previous incarnation did not, so that reads of
     *                         every later transaction may have been invalidated
     * @return a validation task for the transaction itself, if the validation index has already passed it
     */
    public SchedulerTask finishExecution(int txnIndex, int incarnation, boolean revalidateSuffix)
    {
        ValidationState v = validation[txnIndex];
        synchronized (v)
        {
            if (!setExecuted(txnIndex, incarnation))
                return SchedulerTask.RETRY;

            wakeDependents(txnIndex);

            long packed = validationIdx.get();
            if (index(packed) > txnIndex)
            {
                int wave = wave(packed);
                if (revalidateSuffix)
                {
                    int triggered = decreaseValidationIdx(txnIndex + 1);
                    if (triggered != NO_WAVE)
                    {
                        v.maxTriggeredWave = Math.max(v.maxTriggeredWave, triggered);
                        wave = triggered;
                    }
                }
                v.requiredWave = Math.max(v.requiredWave, wave);
                return SchedulerTask.validate(txnIndex, incarnation, wave);
            }
        }
        return SchedulerTask.RETRY;
    }

    /**
     * Claim the right to abort incarnation {@code incarnation} of {@code txnIndex} after a failed validation.
     * Only one of several concurrent validations of the same incarnation succeeds.
     */
    public boolean tryValidationAbort(int txnIndex, int incarnation)
    {
        ExecutionState state = execution[txnIndex];
        synchronized (state)
        {
            if (state.status != TxnStatus.Executed || state.incarnation != incarnation)
                return false;
            state.status = TxnStatus.Aborting;
            return true;
        }
    }

    /**
     * Complete an abort claimed by {@link #tryValidationAbort}, once the incarnation's writes are marked as estimates.
     * Schedules revalidation of every later transaction, and returns the re-execution of this one if possible.
     */
    public SchedulerTask finishAbort(int txnIndex, int incarnation)
    {
        ValidationState v = validation[txnIndex];
        synchronized (v)
        {
            ExecutionState state = execution[txnIndex];
            synchronized (state)
            {
                if (state.status == TxnStatus.Halted)
                    return SchedulerTask.RETRY;
                checkState(state.status == TxnStatus.Aborting && state.incarnation == incarnation,
                           "Cannot finish abort of %s: %s", new Version(txnIndex, incarnation), state.status);
                state.status = TxnStatus.ReadyToExecute;
                state.incarnation = incarnation + 1;
            }
            v.maxValidatedWave = NO_WAVE;
            int triggered = decreaseValidationIdx(txnIndex + 1);
            if (triggered != NO_WAVE)
                v.maxTriggeredWave = Math.max(v.maxTriggeredWave, triggered);
        }

        if (logger.isTraceEnabled())
            logger.trace("Aborted {}, next incarnation {}", new Version(txnIndex, incarnation), incarnation + 1);

        if (executionIdx.get() > txnIndex)
        {
            SchedulerTask task = tryIncarnate(txnIndex);
            if (task != null)
                return task;
        }
        return SchedulerTask.RETRY;
    }

    /**
     * Record that incarnation {@code incarnation} of {@code txnIndex} passed validation in {@code wave}. Ignored if the
     * incarnation has been aborted in the meantime.
     */
    public void finishValidation(int txnIndex, int incarnation, int wave)
    {
        ValidationState v = validation[txnIndex];
        synchronized (v)
        {
            ExecutionState state = execution[txnIndex];
            synchronized (state)
            {
                if (state.status != TxnStatus.Executed || state.incarnation != incarnation)
                    return;
            }
            v.maxValidatedWave = Math.max(v.maxValidatedWave, wave);
        }
        commitLock.arm();
    }

    /**
     * Register that {@code txnIndex} read an estimate written by {@code dependency} and suspend it until the
     * dependency finishes executing.
     *
     * @return the condition to wait on; it is already resolved if the dependency finished executing in the meantime,
     *         and already halted if the block was halted
     */
    public DependencyCondition waitForDependency(int txnIndex, int dependency)
    {
        checkArgument(dependency < txnIndex, "Transaction %s cannot depend on %s", txnIndex, dependency);
        IntArrayList waiting = dependents[dependency];
        synchronized (waiting)
        {
            TxnStatus status = status(dependency);
            if (status == TxnStatus.Executed || status == TxnStatus.Committed)
                return DependencyCondition.resolved();
            if (status == TxnStatus.Halted)
                return DependencyCondition.halted();

            DependencyCondition condition = new DependencyCondition();
            if (!suspend(txnIndex, condition))
                return DependencyCondition.halted();

            waiting.addInt(txnIndex);
            return condition;
        }
    }

    public boolean tryLockCommits()
    {
        return commitLock.tryLock();
    }

    public void unlockCommits()
    {
        commitLock.unlock();
    }

    /**
     * Commit the next transaction in block order if it is ready. Must only be called while holding the commit lock.
     *
     * @return the committed version, or null if the next transaction cannot commit yet
     */
    @Nullable
    public Version tryCommit()
    {
        if (commitIdx == blockSize || halted.get())
            return null;

        int txnIndex = commitIdx;
        ValidationState v = validation[txnIndex];
        synchronized (v)
        {
            ExecutionState state = execution[txnIndex];
            synchronized (state)
            {
                if (state.status != TxnStatus.Executed)
                    return null;

                commitWave = Math.max(commitWave, v.maxTriggeredWave);
                if (v.maxValidatedWave == NO_WAVE || v.maxValidatedWave < Math.max(commitWave, v.requiredWave))
                    return null;

                state.status = TxnStatus.Committed;
                ++commitIdx;
                if (commitIdx == blockSize)
                    done.set(true);

                if (logger.isTraceEnabled())
                    logger.trace("Committed {} at wave {}", new Version(txnIndex, state.incarnation), v.maxValidatedWave);
                return new Version(txnIndex, state.incarnation);
            }
        }
    }

    /**
     * Stop the block: every transaction that has not committed becomes halted, and every suspended worker is released.
     *
     * @return true if this call halted the block, false if it was already halted
     */
    public boolean halt()
    {
        if (!halted.compareAndSet(false, true))
            return false;

        done.set(true);
        for (int i = 0; i < blockSize; ++i)
        {
            ExecutionState state = execution[i];
            synchronized (state)
            {
                if (state.status == TxnStatus.Committed)
                    continue;
                if (state.condition != null)
                {
                    state.condition.halt();
                    state.condition = null;
                }
                state.status = TxnStatus.Halted;
            }
        }
        return true;
    }

    private boolean setExecuted(int txnIndex, int incarnation)
    {
        ExecutionState state = execution[txnIndex];
        synchronized (state)
        {
            if (state.status == TxnStatus.Halted)
                return false;
            checkState(state.status == TxnStatus.Executing && state.incarnation == incarnation,
                       "Cannot finish execution of %s: %s", new Version(txnIndex, incarnation), state.status);
            state.status = TxnStatus.Executed;
            return true;
        }
    }

    private boolean suspend(int txnIndex, DependencyCondition condition)
    {
        ExecutionState state = execution[txnIndex];
        synchronized (state)
        {
            if (state.status == TxnStatus.Halted)
                return false;
            checkState(state.status == TxnStatus.Executing, "Cannot suspend %s: %s", txnIndex, state.status);
            state.status = TxnStatus.Suspended;
            state.condition = condition;
            return true;
        }
    }

    private void resume(int txnIndex)
    {
        ExecutionState state = execution[txnIndex];
        synchronized (state)
        {
            if (state.status == TxnStatus.Halted)
                return;
            if (state.status != TxnStatus.Suspended)
                throw illegalState("Cannot resume " + txnIndex + ": " + state.status);
            state.status = TxnStatus.ReadyToExecute;
        }
    }

    private void wakeDependents(int txnIndex)
    {
        int[] woken;
        IntArrayList waiting = dependents[txnIndex];
        synchronized (waiting)
        {
            if (waiting.isEmpty())
                return;
            woken = waiting.toIntArray();
            waiting.clear();
        }

        int min = Integer.MAX_VALUE;
        for (int dependent : woken)
        {
            resume(dependent);
            min = Math.min(min, dependent);
        }
        // the resumed transactions are picked up as wake-up tasks by the next worker to reach them
        executionIdx.accumulateAndGet(min, Math::min);
    }

    /**
     * @return the new wave if the validation index was moved back to {@code target}, or NO_WAVE if it was already there or below
     */
    private int decreaseValidationIdx(int target)
    {
        while (true)
        {
            long packed = validationIdx.get();
            if (index(packed) <= target)
                return NO_WAVE;
            int wave = wave(packed) + 1;
            if (validationIdx.compareAndSet(packed, pack(target, wave)))
                return wave;
        }
    }

    private boolean neverExecuted(int txnIndex)
    {
        ExecutionState state = execution[txnIndex];
        synchronized (state)
        {
            return state.status == TxnStatus.ReadyToExecute && state.incarnation == 0;
        }
    }

    private int executedIncarnation(int txnIndex)
    {
        ExecutionState state = execution[txnIndex];
        synchronized (state)
        {
            return state.status == TxnStatus.Executed ? state.incarnation : -1;
        }
    }

    public TxnStatus status(int txnIndex)
    {
        ExecutionState state = execution[txnIndex];
        synchronized (state)
        {
            return state.status;
        }
    }

    @VisibleForTesting
    public int incarnation(int txnIndex)
    {
        ExecutionState state = execution[txnIndex];
        synchronized (state)
        {
            return state.incarnation;
        }
    }

    @VisibleForTesting
    public int validationIndex()
    {
        return index(validationIdx.get());
    }

    @VisibleForTesting
    public int executionIndex()
    {
        return executionIdx.get();
    }
}
