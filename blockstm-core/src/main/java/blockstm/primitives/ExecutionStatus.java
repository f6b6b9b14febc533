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

/**
 * The terminal outcome a transaction reports for one execution attempt.
 */
public enum ExecutionStatus
{
    /** the output is applied and execution of the block continues */
    SUCCESS,
    /** the output is applied and every later transaction in the block is skipped */
    SKIP_REST,
    /** the transaction aborted in the VM; it has no effect and the block continues */
    ABORT
}
