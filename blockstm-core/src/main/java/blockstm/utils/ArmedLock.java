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

package blockstm.utils;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A lock that can only be acquired once it has been armed, and which is disarmed by a successful acquisition.
 * Any number of threads may arm it concurrently; at most one thread holds it at a time. A holder that finds the
 * lock armed again after releasing it is expected to retry, so work published while the lock was held is never missed.
 */
public class ArmedLock
{
    private static final int ARMED = 0x1;
    private static final int UNLOCKED = 0x2;

    private final AtomicInteger state = new AtomicInteger(UNLOCKED);

    public boolean tryLock()
    {
        return state.compareAndSet(ARMED | UNLOCKED, 0);
    }

    public void unlock()
    {
        int prev = state.getAndUpdate(s -> s | UNLOCKED);
        Invariants.checkState((prev & UNLOCKED) == 0, "ArmedLock released while not held");
    }

    public void arm()
    {
        state.getAndUpdate(s -> s | ARMED);
    }

    public boolean isArmed()
    {
        return (state.get() & ARMED) != 0;
    }
}
