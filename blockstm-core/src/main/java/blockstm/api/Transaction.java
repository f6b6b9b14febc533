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

import blockstm.primitives.ExecutionResult;

/**
 * A transaction of the block, bound to the VM that interprets it.
 * <p>
 * Execution must be a pure function of the values returned by the {@link StateView}: the engine may execute a
 * transaction many times against different speculative states and keeps only the execution whose reads
 * are consistent with in-order execution of the block.
 */
public interface Transaction<K, V, E>
{
    /**
     * @throws FatalVMError if the VM failed in a way that makes the whole block invalid
     */
    ExecutionResult<K, V, E> execute(StateView<K, V> view);
}
