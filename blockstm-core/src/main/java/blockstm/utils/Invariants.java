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

import java.util.function.Predicate;

import net.nicoulaj.compilecommand.annotations.Inline;

public class Invariants
{
    private Invariants() {}

    public static IllegalStateException illegalState(String msg)
    {
        throw new IllegalStateException(msg);
    }

    public static IllegalArgumentException illegalArgument(String msg)
    {
        throw new IllegalArgumentException(msg);
    }

    public static void checkState(boolean condition)
    {
        if (!condition)
            throw new IllegalStateException();
    }

    public static void checkState(boolean condition, String msg)
    {
        if (!condition)
            throw new IllegalStateException(msg);
    }

    public static void checkState(boolean condition, String fmt, int p1)
    {
        if (!condition)
            throw new IllegalStateException(String.format(fmt, p1));
    }

    public static void checkState(boolean condition, String fmt, Object p1)
    {
        if (!condition)
            throw new IllegalStateException(String.format(fmt, p1));
    }

    public static void checkState(boolean condition, String fmt, Object p1, Object p2)
    {
        if (!condition)
            throw new IllegalStateException(String.format(fmt, p1, p2));
    }

    public static <T> T nonNull(T param)
    {
        if (param == null)
            throw new NullPointerException();
        return param;
    }

    public static <T> T nonNull(T param, String msg)
    {
        if (param == null)
            throw new NullPointerException(msg);
        return param;
    }

    public static void checkArgument(boolean condition)
    {
        if (!condition)
            throw new IllegalArgumentException();
    }

    public static void checkArgument(boolean condition, String msg)
    {
        if (!condition)
            throw new IllegalArgumentException(msg);
    }

    public static void checkArgument(boolean condition, String fmt, long p1)
    {
        if (!condition)
            throw new IllegalArgumentException(String.format(fmt, p1));
    }

    public static void checkArgument(boolean condition, String fmt, Object p1)
    {
        if (!condition)
            throw new IllegalArgumentException(String.format(fmt, p1));
    }

    public static void checkArgument(boolean condition, String fmt, Object p1, Object p2)
    {
        if (!condition)
            throw new IllegalArgumentException(String.format(fmt, p1, p2));
    }

    @Inline
    public static <T> T checkArgument(T param, Predicate<T> condition, String msg)
    {
        if (!condition.test(param))
            throw new IllegalArgumentException(msg);
        return param;
    }
}
