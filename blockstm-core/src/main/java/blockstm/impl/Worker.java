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

import java.util.Map;

import com.google.common.collect.ImmutableSet;

import blockstm.api.FatalVMError;
import blockstm.local.CapturedReads;
import blockstm.local.ExecutionRecord;
import blockstm.local.MultiVersionStore;
import blockstm.local.Scheduler;
import blockstm.local.SchedulerTask;
import blockstm.primitives.DeltaOp;
import blockstm.primitives.ExecutionResult;
import blockstm.primitives.TransactionOutput;
import blockstm.primitives.WriteOp;

import static blockstm.utils.Invariants.illegalState;

/**
 * One worker of a parallel block execution: repeatedly commits what it can, then asks the scheduler for the next
 * task and performs it, until the block is done. An exception raised by a transaction is recorded with the
 * incarnation and left to validation; any other unexpected exception is handed to the {@link ParallelExecution},
 * which halts the block.
 */
class Worker<K, V, E> implements Runnable
{
    private final ParallelExecution<K, V, E> run;
    private final Scheduler scheduler;
    private final MultiVersionStore<K, V> store;

    Worker(ParallelExecution<K, V, E> run)
    {
        this.run = run;
        this.scheduler = run.scheduler;
        this.store = run.store;
    }

    @Override
    public void run()
    {
        try
        {
            SchedulerTask task = SchedulerTask.RETRY;
            while (task.kind != SchedulerTask.Kind.Done)
            {
                run.coordinateCommits();
                switch (task.kind)
                {
                    default: throw new AssertionError("Unhandled task: " + task);
                    case Execute:
                        task = execute(task.txnIndex, task.incarnation);
                        break;
                    case Validate:
                        task = validate(task.txnIndex, task.incarnation, task.wave);
                        break;
                    case Wakeup:
                        task.condition.resolve();
                        task = SchedulerTask.RETRY;
                        break;
                    case Retry:
                        task = scheduler.nextTask();
                        if (task.kind == SchedulerTask.Kind.Retry)
                            Thread.onSpinWait();
                }
            }
            run.coordinateCommits();
        }
        catch (Throwable t)
        {
            run.onWorkerFailure(t);
        }
    }

    private SchedulerTask execute(int txnIndex, int incarnation)
    {
        if (incarnation >= run.maxIncarnations)
            throw illegalState("Transaction " + txnIndex + " reached incarnation " + incarnation + " without committing");

        run.stats.onExecution(incarnation);
        SpeculativeView<K, V> view = new SpeculativeView<>(txnIndex, run);
        ExecutionResult<K, V, E> result = null;
        ExecutionRecord<K, V, E> record = null;
        try
        {
            result = run.transaction(txnIndex).execute(view);
        }
        catch (SpeculativeExecutionException e)
        {
            record = ExecutionRecord.speculativeFailure(incarnation, view.reads());
        }
        catch (ExecutionHaltedException e)
        {
            return SchedulerTask.RETRY;
        }
        catch (FatalVMError e)
        {
            record = ExecutionRecord.fatal(incarnation, view.reads(), e);
        }
        catch (RuntimeException e)
        {
            record = ExecutionRecord.failed(incarnation, view.reads(), e);
        }

        if (record == null && view.engineFailure() == null && !view.hasSpeculativeFailure())
        {
            try
            {
                record = ExecutionRecord.completed(incarnation, view.reads(), view.checkDeltas(result));
            }
            catch (SpeculativeExecutionException e)
            {
                record = ExecutionRecord.speculativeFailure(incarnation, view.reads());
            }
            catch (ExecutionHaltedException e)
            {
                return SchedulerTask.RETRY;
            }
        }

        if (view.engineFailure() != null)
            throw view.engineFailure();
        if (view.hasSpeculativeFailure())
            record = ExecutionRecord.speculativeFailure(incarnation, view.reads());

        boolean updatesOutside = publish(txnIndex, incarnation, record);
        run.lastInputOutput.record(txnIndex, record);
        return scheduler.finishExecution(txnIndex, incarnation, updatesOutside);
    }

    /**
     * Replace the entries left by the previous incarnation with this incarnation's output.
     *
     * @return true if a key was written that the previous incarnation did not write, or a previously written
     *         key was not written again
     */
    private boolean publish(int txnIndex, int incarnation, ExecutionRecord<K, V, E> record)
    {
        ImmutableSet<K> previous = run.lastInputOutput.modifiedKeys(txnIndex);
        boolean updatesOutside = false;
        if (record.result != null)
        {
            TransactionOutput<K, V, E> output = record.result.outputOrEmpty();
            for (Map.Entry<K, WriteOp<V>> e : output.writes.entrySet())
            {
                store.write(e.getKey(), txnIndex, incarnation, e.getValue());
                updatesOutside |= !previous.contains(e.getKey());
            }
            for (Map.Entry<K, DeltaOp> e : output.deltas.entrySet())
            {
                store.addDelta(e.getKey(), txnIndex, e.getValue());
                updatesOutside |= !previous.contains(e.getKey());
            }
        }

        for (K key : previous)
        {
            if (!record.modifiedKeys.contains(key))
            {
                store.remove(key, txnIndex);
                updatesOutside = true;
            }
        }
        return updatesOutside;
    }

    private SchedulerTask validate(int txnIndex, int incarnation, int wave)
    {
        run.stats.onValidation();
        ExecutionRecord<K, V, E> record = run.lastInputOutput.get(txnIndex);
        if (record == null || record.incarnation != incarnation)
            return SchedulerTask.RETRY;

        CapturedReads<K, V> reads = record.reads;
        if (reads.validate(store, txnIndex))
        {
            scheduler.finishValidation(txnIndex, incarnation, wave);
            return SchedulerTask.RETRY;
        }

        if (!scheduler.tryValidationAbort(txnIndex, incarnation))
            return SchedulerTask.RETRY;

        run.stats.onValidationAbort();
        for (K key : record.modifiedKeys)
            store.markEstimate(key, txnIndex);
        return scheduler.finishAbort(txnIndex, incarnation);
    }
}
