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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArmedLockTest
{
    @Test
    void onlyAcquiredWhenArmed()
    {
        ArmedLock lock = new ArmedLock();
        assertThat(lock.isArmed()).isFalse();
        assertThat(lock.tryLock()).isFalse();

        lock.arm();
        lock.arm();
        assertThat(lock.isArmed()).isTrue();
        assertThat(lock.tryLock()).isTrue();
        assertThat(lock.isArmed()).isFalse();
        assertThat(lock.tryLock()).isFalse();

        // armed while held: the holder reacquires after releasing
        lock.arm();
        assertThat(lock.tryLock()).isFalse();
        lock.unlock();
        assertThat(lock.tryLock()).isTrue();
        lock.unlock();
        assertThat(lock.tryLock()).isFalse();
    }

    @Test
    void unlockRequiresHolding()
    {
        ArmedLock lock = new ArmedLock();
        assertThatThrownBy(lock::unlock).isInstanceOf(IllegalStateException.class);
        lock.arm();
        assertThatThrownBy(lock::unlock).isInstanceOf(IllegalStateException.class);
    }
}
