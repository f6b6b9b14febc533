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

import java.util.ArrayList;
import java.util.List;

/**
 * A minimal property test runner. Each example is generated from its own seed, and a failure reports the seed of
 * the failing example so that {@code withSeed} replays it first.
 */
public class Property
{
    public interface FailingConsumer<A>
    {
        void accept(A value) throws Exception;
    }

    public interface FailingBiConsumer<A, B>
    {
        void accept(A a, B b) throws Exception;
    }

    private interface Example
    {
        void run(Gen.Random random, List<Object> generated) throws Exception;
    }

    public static abstract class Common<T extends Common<T>>
    {
        long seed = System.nanoTime();
        int examples = 1000;

        Common()
        {
        }

        Common(Common<?> copy)
        {
            this.seed = copy.seed;
            this.examples = copy.examples;
        }

        @SuppressWarnings("unchecked")
        public T withSeed(long seed)
        {
            this.seed = seed;
            return (T) this;
        }

        @SuppressWarnings("unchecked")
        public T withExamples(int examples)
        {
            Invariants.checkArgument(examples > 0, "Examples must be positive, got %s", examples);
            this.examples = examples;
            return (T) this;
        }

        void run(Example example)
        {
            Gen.Random random = new Gen.Random(seed);
            for (int i = 0; i < examples; ++i)
            {
                List<Object> generated = new ArrayList<>(2);
                try
                {
                    if (Thread.currentThread().isInterrupted())
                        throw new InterruptedException();
                    example.run(random, generated);
                }
                catch (Throwable t)
                {
                    throw new PropertyError(seed, i, generated, t);
                }
                seed = random.nextLong();
                random.setSeed(seed);
            }
        }
    }

    public static class ForBuilder extends Common<ForBuilder>
    {
        public void check(FailingConsumer<Gen.Random> fn)
        {
            run((random, generated) -> fn.accept(random));
        }

        public <A> SingleBuilder<A> forAll(Gen<A> gen)
        {
            return new SingleBuilder<>(this, gen);
        }

        public <A, B> DoubleBuilder<A, B> forAll(Gen<A> a, Gen<B> b)
        {
            return new DoubleBuilder<>(this, a, b);
        }
    }

    public static class SingleBuilder<A> extends Common<SingleBuilder<A>>
    {
        private final Gen<A> gen;

        SingleBuilder(Common<?> copy, Gen<A> gen)
        {
            super(copy);
            this.gen = Invariants.nonNull(gen);
        }

        public void check(FailingConsumer<A> fn)
        {
            run((random, generated) -> {
                A a = gen.next(random);
                generated.add(a);
                fn.accept(a);
            });
        }
    }

    public static class DoubleBuilder<A, B> extends Common<DoubleBuilder<A, B>>
    {
        private final Gen<A> aGen;
        private final Gen<B> bGen;

        DoubleBuilder(Common<?> copy, Gen<A> aGen, Gen<B> bGen)
        {
            super(copy);
            this.aGen = Invariants.nonNull(aGen);
            this.bGen = Invariants.nonNull(bGen);
        }

        public void check(FailingBiConsumer<A, B> fn)
        {
            run((random, generated) -> {
                A a = aGen.next(random);
                generated.add(a);
                B b = bGen.next(random);
                generated.add(b);
                fn.accept(a, b);
            });
        }
    }

    public static class PropertyError extends AssertionError
    {
        public final long seed;

        PropertyError(long seed, int example, List<Object> generated, Throwable cause)
        {
            super(describe(seed, example, generated, cause), cause);
            this.seed = seed;
        }

        private static String describe(long seed, int example, List<Object> generated, Throwable cause)
        {
            StringBuilder sb = new StringBuilder("Property error detected:\n");
            sb.append("Seed = ").append(seed).append('\n');
            sb.append("Example = ").append(example).append('\n');
            String message = cause.getMessage() == null ? cause.getClass().getName() : cause.getMessage();
            sb.append("Error: ").append(message.replace("\n", "\n\t")).append('\n');
            for (int i = 0; i < generated.size(); ++i)
                sb.append('\t').append(i).append(" = ").append(generated.get(i)).append('\n');
            return sb.toString();
        }
    }

    public static ForBuilder qt()
    {
        return new ForBuilder();
    }
}
