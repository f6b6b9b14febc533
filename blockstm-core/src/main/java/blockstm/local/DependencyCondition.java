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

import java.util.concurrent.TimeUnit;

/**
 * What a worker suspended on a dependency waits for: either the dependency is resolved and the suspended
 * execution may continue, or the block was halted and the execution must be abandoned.
 */
public class DependencyCondition
{
    public enum State { Unresolved, Resolved, Halted }

    private static final DependencyCondition RESOLVED = new DependencyCondition(State.Resolved);
    private static final DependencyCondition HALTED = new DependencyCondition(State.Halted);

    private State state;

    public DependencyCondition()
    {
        this(State.Unresolved);
    }

    private DependencyCondition(State state)
    {
        this.state = state;
    }

    static DependencyCondition resolved()
    {
        return RESOLVED;
    }

    static DependencyCondition halted()
    {
        return HALTED;
    }

    public synchronized void resolve()
    {
        if (state == State.Unresolved)
        {
            state = State.Resolved;
            notifyAll();
        }
    }

    public synchronized void halt()
    {
        if (state == State.Unresolved)
        {
            state = State.Halted;
            notifyAll();
        }
    }

    public synchronized State state()
    {
        return state;
    }

    /**
     * @return the state once it is no longer {@link State#Unresolved}, or {@link State#Unresolved} if the timeout elapsed first
     */
    public synchronized State await(long timeout, TimeUnit units) throws InterruptedException
    {
        long deadline = System.nanoTime() + units.toNanos(timeout);
        while (state == State.Unresolved)
        {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0)
                break;
            TimeUnit.NANOSECONDS.timedWait(this, remaining);
        }
        return state;
    }

    @Override
    public String toString()
    {
        return "DependencyCondition{" + state() + '}';
    }
}
