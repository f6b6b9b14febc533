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
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableMap;

import blockstm.api.BaseStateView;

/**
 * A {@link BaseStateView} over an immutable map.
 */
public class InMemoryStateView<K, V> implements BaseStateView<K, V>
{
    private final ImmutableMap<K, V> state;

    public InMemoryStateView(Map<K, V> state)
    {
        this.state = ImmutableMap.copyOf(state);
    }

    public static <K, V> InMemoryStateView<K, V> empty()
    {
        return new InMemoryStateView<>(ImmutableMap.of());
    }

    @Nullable
    @Override
    public V get(K key)
    {
        return state.get(key);
    }

    @Override
    public String toString()
    {
        return state.toString();
    }
}
