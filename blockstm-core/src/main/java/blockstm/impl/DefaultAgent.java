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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import blockstm.api.Agent;

public class DefaultAgent implements Agent
{
    private static final Logger logger = LoggerFactory.getLogger(DefaultAgent.class);

    public static final DefaultAgent INSTANCE = new DefaultAgent();

    @Override
    public void onSequentialFallback(int blockSize, Throwable cause)
    {
        logger.debug("Block of {} transactions re-executed sequentially", blockSize, cause);
    }

    @Override
    public void onBlockLimitReached(int committed, int blockSize)
    {
        logger.debug("Block limit reached after {} of {} transactions", committed, blockSize);
    }

    @Override
    public void onUncaughtException(Throwable t)
    {
        logger.debug("Uncaught exception reported", t);
    }
}
