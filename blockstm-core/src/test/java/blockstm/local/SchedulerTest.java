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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import blockstm.primitives.Version;
import blockstm.utils.Gen;
import blockstm.utils.Gens;

import static blockstm.utils.Property.qt;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class SchedulerTest
{
    private static ExecutorService executor;

    @BeforeAll
    static void setup()
    {
        executor = Executors.newCachedThreadPool();
    }

    @AfterAll
    static void teardown() throws InterruptedException
    {
        executor.shutdownNow();
        executor.awaitTermination(10, TimeUnit.SECONDS);
    }

    @Test
    void executeValidateCommit()
    {
        Scheduler scheduler = new Scheduler(2);
        assertTask(scheduler.nextTask(), SchedulerTask.Kind.Execute, 0, 0);
        assertThat(scheduler.status(0)).isEqualTo(TxnStatus.Executing);
        assertThat(scheduler.finishExecution(0, 0, false).kind).isEqualTo(SchedulerTask.Kind.Retry);

        SchedulerTask validate = scheduler.nextTask();
        assertTask(validate, SchedulerTask.Kind.Validate, 0, 0);
        assertThat(validate.wave).isEqualTo(0);

        assertThat(scheduler.tryLockCommits()).isFalse();
        scheduler.finishValidation(0, 0, 0);
        assertThat(scheduler.tryLockCommits()).isTrue();
        assertThat(scheduler.tryCommit()).isEqualTo(new Version(0, 0));
        assertThat(scheduler.tryCommit()).isNull();
        scheduler.unlockCommits();
        assertThat(scheduler.status(0)).isEqualTo(TxnStatus.Committed);
        assertThat(scheduler.isDone()).isFalse();

        assertTask(scheduler.nextTask(), SchedulerTask.Kind.Execute, 1, 0);
        assertThat(scheduler.finishExecution(1, 0, false).kind).isEqualTo(SchedulerTask.Kind.Retry);
        assertTask(scheduler.nextTask(), SchedulerTask.Kind.Validate, 1, 0);
        scheduler.finishValidation(1, 0, 0);
        commitAll(scheduler);
        assertThat(scheduler.isDone()).isTrue();
        assertThat(scheduler.nextTask().kind).isEqualTo(SchedulerTask.Kind.Done);
    }

    @Test
    void abortReexecutesAndRevalidates()
    {
        Scheduler scheduler = new Scheduler(3);
        assertTask(scheduler.nextTask(), SchedulerTask.Kind.Execute, 0, 0);
        assertTask(scheduler.nextTask(), SchedulerTask.Kind.Execute, 1, 0);
        // the validation index has moved past 0 while it was executing
        assertTask(scheduler.finishExecution(0, 0, false), SchedulerTask.Kind.Validate, 0, 0);
        assertThat(scheduler.finishExecution(1, 0, false).kind).isEqualTo(SchedulerTask.Kind.Retry);
        scheduler.finishValidation(0, 0, 0);

        assertTask(scheduler.nextTask(), SchedulerTask.Kind.Validate, 1, 0);
        assertThat(scheduler.tryValidationAbort(1, 0)).isTrue();
        assertThat(scheduler.tryValidationAbort(1, 0)).isFalse();
        assertThat(scheduler.status(1)).isEqualTo(TxnStatus.Aborting);

        assertTask(scheduler.finishAbort(1, 0), SchedulerTask.Kind.Execute, 1, 1);
        assertThat(scheduler.incarnation(1)).isEqualTo(1);
        // a validation of the aborted incarnation that completes late is ignored
        scheduler.finishValidation(1, 0, 0);

        commitAll(scheduler);
        assertThat(scheduler.status(0)).isEqualTo(TxnStatus.Committed);
        assertThat(scheduler.status(1)).isEqualTo(TxnStatus.Executing);

        assertTask(scheduler.finishExecution(1, 1, false), SchedulerTask.Kind.Validate, 1, 1);
        scheduler.finishValidation(1, 1, 0);
        commitAll(scheduler);
        assertThat(scheduler.status(1)).isEqualTo(TxnStatus.Committed);
    }

    @Test
    void newWritesTriggerAHigherWave()
    {
        Scheduler scheduler = new Scheduler(3);
        for (int i = 0; i < 3; ++i)
            assertTask(scheduler.nextTask(), SchedulerTask.Kind.Execute, i, 0);
        assertTask(scheduler.finishExecution(1, 0, false), SchedulerTask.Kind.Validate, 1, 0);
        scheduler.finishValidation(1, 0, 0);
        assertThat(scheduler.finishExecution(2, 0, false).kind).isEqualTo(SchedulerTask.Kind.Retry);
        SchedulerTask validate = scheduler.nextTask();
        assertTask(validate, SchedulerTask.Kind.Validate, 2, 0);
        scheduler.finishValidation(2, 0, validate.wave);

        // transaction 0 finishes last and writes keys the others may have read
        validate = scheduler.finishExecution(0, 0, true);
        assertTask(validate, SchedulerTask.Kind.Validate, 0, 0);
        assertThat(validate.wave).isEqualTo(1);
        assertThat(scheduler.validationIndex()).isEqualTo(1);
        scheduler.finishValidation(0, 0, validate.wave);

        // 1 and 2 were validated in wave 0, before 0's writes, so cannot commit yet
        commitAll(scheduler);
        assertThat(scheduler.status(0)).isEqualTo(TxnStatus.Committed);
        assertThat(scheduler.status(1)).isEqualTo(TxnStatus.Executed);

        SchedulerTask revalidate = scheduler.nextTask();
        assertTask(revalidate, SchedulerTask.Kind.Validate, 1, 0);
        assertThat(revalidate.wave).isEqualTo(1);
        scheduler.finishValidation(1, 0, revalidate.wave);
        revalidate = scheduler.nextTask();
        assertTask(revalidate, SchedulerTask.Kind.Validate, 2, 0);
        scheduler.finishValidation(2, 0, revalidate.wave);
        commitAll(scheduler);
        assertThat(scheduler.isDone()).isTrue();
    }

    @Test
    void dependencyAlreadyExecuted()
    {
        Scheduler scheduler = new Scheduler(2);
        scheduler.nextTask();
        scheduler.nextTask();
        scheduler.finishExecution(0, 0, false);
        assertThat(scheduler.waitForDependency(1, 0).state()).isEqualTo(DependencyCondition.State.Resolved);
        assertThat(scheduler.status(1)).isEqualTo(TxnStatus.Executing);
        assertThatThrownBy(() -> scheduler.waitForDependency(0, 1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void suspendedExecutionIsWokenUp() throws Exception
    {
        Scheduler scheduler = new Scheduler(2);
        assertTask(scheduler.nextTask(), SchedulerTask.Kind.Execute, 0, 0);
        assertTask(scheduler.nextTask(), SchedulerTask.Kind.Execute, 1, 0);

        Future<DependencyCondition.State> waiter = executor.submit(() -> scheduler.waitForDependency(1, 0).await(1, TimeUnit.MINUTES));
        await().atMost(10, TimeUnit.SECONDS).until(() -> scheduler.status(1) == TxnStatus.Suspended);

        scheduler.finishExecution(0, 0, false);
        assertThat(scheduler.status(1)).isEqualTo(TxnStatus.ReadyToExecute);
        assertThat(scheduler.executionIndex()).isEqualTo(1);
        assertThat(waiter.isDone()).isFalse();

        SchedulerTask wakeup = nextNonValidationTask(scheduler);
        assertTask(wakeup, SchedulerTask.Kind.Wakeup, 1, 0);
        assertThat(scheduler.status(1)).isEqualTo(TxnStatus.Executing);
        wakeup.condition.resolve();
        assertThat(waiter.get(10, TimeUnit.SECONDS)).isEqualTo(DependencyCondition.State.Resolved);

        assertThat(scheduler.finishExecution(1, 0, false).kind).isEqualTo(SchedulerTask.Kind.Retry);
        assertThat(scheduler.status(1)).isEqualTo(TxnStatus.Executed);
    }

    @Test
    void haltReleasesSuspendedExecutions() throws Exception
    {
        Scheduler scheduler = new Scheduler(3);
        for (int i = 0; i < 3; ++i)
            scheduler.nextTask();

        Future<DependencyCondition.State> waiter = executor.submit(() -> scheduler.waitForDependency(2, 0).await(1, TimeUnit.MINUTES));
        await().atMost(10, TimeUnit.SECONDS).until(() -> scheduler.status(2) == TxnStatus.Suspended);

        assertThat(scheduler.halt()).isTrue();
        assertThat(scheduler.halt()).isFalse();
        assertThat(waiter.get(10, TimeUnit.SECONDS)).isEqualTo(DependencyCondition.State.Halted);
        assertThat(scheduler.isHalted()).isTrue();
        assertThat(scheduler.isDone()).isTrue();
        assertThat(scheduler.nextTask().kind).isEqualTo(SchedulerTask.Kind.Done);

        assertThat(scheduler.finishExecution(0, 0, false).kind).isEqualTo(SchedulerTask.Kind.Retry);
        assertThat(scheduler.waitForDependency(1, 0).state()).isEqualTo(DependencyCondition.State.Halted);
        for (int i = 0; i < 3; ++i)
            assertThat(scheduler.status(i)).isEqualTo(TxnStatus.Halted);
    }

    @Test
    void haltKeepsCommittedTransactions()
    {
        Scheduler scheduler = new Scheduler(2);
        scheduler.nextTask();
        scheduler.finishExecution(0, 0, false);
        SchedulerTask validate = scheduler.nextTask();
        scheduler.finishValidation(0, 0, validate.wave);
        commitAll(scheduler);

        scheduler.halt();
        assertThat(scheduler.status(0)).isEqualTo(TxnStatus.Committed);
        assertThat(scheduler.status(1)).isEqualTo(TxnStatus.Halted);
        assertThat(scheduler.tryLockCommits()).isFalse();
    }

    /**
     * Drive the scheduler from several threads, failing validations and waiting on dependencies at random,
     * and check that every transaction commits exactly once, in order, at its final incarnation.
     */
    @Test
    void concurrentCommitsAreOrdered()
    {
        Gen<Integer> blockSizes = Gens.ints().between(1, 40);
        Gen<Integer> threadCounts = Gens.ints().between(1, 6);
        qt().withExamples(50).check(random -> {
            int blockSize = blockSizes.next(random);
            int threads = threadCounts.next(random);
            long seed = random.nextLong();

            Scheduler scheduler = new Scheduler(blockSize);
            List<Version> commits = new ArrayList<>();
            List<Future<?>> drivers = new ArrayList<>();
            for (int i = 0; i < threads; ++i)
            {
                Gen.Random rs = new Gen.Random(seed + i);
                drivers.add(executor.submit(() -> {
                    drive(scheduler, rs, commits);
                    return null;
                }));
            }
            for (Future<?> driver : drivers)
                driver.get(1, TimeUnit.MINUTES);

            assertThat(scheduler.isDone()).isTrue();
            assertThat(commits).hasSize(blockSize);
            for (int i = 0; i < blockSize; ++i)
            {
                assertThat(commits.get(i).txnIndex).isEqualTo(i);
                assertThat(commits.get(i).incarnation).isEqualTo(scheduler.incarnation(i));
                assertThat(scheduler.status(i)).isEqualTo(TxnStatus.Committed);
            }
        });
    }

    private static void drive(Scheduler scheduler, Gen.Random random, List<Version> commits) throws InterruptedException
    {
        SchedulerTask task = SchedulerTask.RETRY;
        while (task.kind != SchedulerTask.Kind.Done)
        {
            while (scheduler.tryLockCommits())
            {
                try
                {
                    Version committed;
                    while ((committed = scheduler.tryCommit()) != null)
                        commits.add(committed);
                }
                finally
                {
                    scheduler.unlockCommits();
                }
            }

            switch (task.kind)
            {
                default: throw new AssertionError("Unhandled task: " + task);
                case Execute:
                    int dependency = task.txnIndex - 1;
                    if (dependency >= 0 && random.decide(0.2f) && scheduler.status(dependency) == TxnStatus.Executing)
                    {
                        DependencyCondition.State state = scheduler.waitForDependency(task.txnIndex, dependency).await(1, TimeUnit.MINUTES);
                        assertThat(state).isNotEqualTo(DependencyCondition.State.Unresolved);
                    }
                    task = scheduler.finishExecution(task.txnIndex, task.incarnation, random.decide(0.3f));
                    break;
                case Validate:
                    if (task.incarnation < 3 && random.decide(0.2f) && scheduler.tryValidationAbort(task.txnIndex, task.incarnation))
                    {
                        task = scheduler.finishAbort(task.txnIndex, task.incarnation);
                    }
                    else
                    {
                        scheduler.finishValidation(task.txnIndex, task.incarnation, task.wave);
                        task = SchedulerTask.RETRY;
                    }
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
    }

    private static SchedulerTask nextNonValidationTask(Scheduler scheduler)
    {
        SchedulerTask task;
        while ((task = scheduler.nextTask()).kind == SchedulerTask.Kind.Validate)
            scheduler.finishValidation(task.txnIndex, task.incarnation, task.wave);
        return task;
    }

    private static void commitAll(Scheduler scheduler)
    {
        while (scheduler.tryLockCommits())
        {
            try
            {
                while (scheduler.tryCommit() != null) {}
            }
            finally
            {
                scheduler.unlockCommits();
            }
        }
    }

    private static void assertTask(SchedulerTask task, SchedulerTask.Kind kind, int txnIndex, int incarnation)
    {
        assertThat(task.kind).isEqualTo(kind);
        assertThat(task.txnIndex).isEqualTo(txnIndex);
        assertThat(task.incarnation).isEqualTo(incarnation);
    }
}
