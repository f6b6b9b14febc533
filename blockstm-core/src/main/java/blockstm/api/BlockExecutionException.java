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
 * Thrown when a block could not be executed at all: a committed transaction raised a {@link FatalVMError}, or
 * execution failed in a way sequential re-execution could not recover from.
 */
public class BlockExecutionException extends RuntimeException
{
    public static final int NO_TRANSACTION = -1;

    /** the transaction that caused the failure, or {@link #NO_TRANSACTION} */
    public final int txnIndex;

    public BlockExecutionException(int txnIndex, String message, Throwable cause)
    {
        super(message, cause);
        this.txnIndex = txnIndex;
    }

    public BlockExecutionException(String message, Throwable cause)
    {
        this(NO_TRANSACTION, message, cause);
    }
}
