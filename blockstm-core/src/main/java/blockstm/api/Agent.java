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

package blockstm.api;

/**
 * Facility for observing and reacting to notable events of block execution
 */
public interface Agent
{
    /**
     * Invoked when parallel execution of a block was abandoned and the block is about to be re-executed sequentially.
     */
    void onSequentialFallback(int blockSize, Throwable cause);

    /**
     * Invoked when a block limit ended the block early, after {@code committed} of {@code blockSize} transactions.
     */
    default void onBlockLimitReached(int committed, int blockSize) {}

    /**
     * Invoked with any unexpected exception raised by a worker, before the executor decides how to proceed.
     */
    void onUncaughtException(Throwable t);
}
