/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.assetscan.tools.cli;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Small command line parser.
 *
 * <pre>{@code
 * Args.match()
 *     .on(Args.options("-o", "--output"), (String dir) -> output = dir)
 *     .onValues(Args.options("-i", "--images"), dirs -> images.addAll(dirs))
 *     .on(Args.options("--metrics"), () -> metrics = true)
 *     .rest(unknown -> ...)
 *     .parse(argv);
 * }</pre>
 *
 * <p>An option taking several values consumes arguments up to the next one starting with
 * {@code -}. A {@code --} ends option parsing: every argument after it becomes a value of the
 * option before it, so {@code -i images -- -legacy} yields {@code [images, -legacy]}. Arguments no
 * handler consumed are passed to the {@link #rest} handler.
 */
public class Args {
    static final String END_OF_OPTIONS = "--";

    private final List<Matcher> matchers = new ArrayList<>();
    private Consumer<List<String>> restHandler = rest -> { };

    public static Args match() {
        return new Args();
    }

    public static Predicate<String> options(String... alternatives) {
        if (alternatives.length == 1) {
            return s -> alternatives[0].equals(s);
        }
        return s -> Arrays.stream(alternatives).anyMatch(alt -> alt.equals(s));
    }

    /** Flag without value. */
    public Args on(Predicate<String> test, Runnable handler) {
        matchers.add(args -> {
            boolean p = test.test(args.arg);
            if (p) {
                handler.run();
            }
            return p;
        });
        return this;
    }

    /** Option with exactly one value; a missing value is passed as null. */
    public Args on(Predicate<String> test, Consumer<String> handler) {
        matchers.add(args -> {
            boolean p = test.test(args.arg);
            if (p) {
                handler.accept(args.value());
            }
            return p;
        });
        return this;
    }

    /** Option with one or more values; no value gives an empty list. */
    public Args onValues(Predicate<String> test, Consumer<List<String>> handler) {
        matchers.add(args -> {
            boolean p = test.test(args.arg);
            if (p) {
                handler.accept(args.values());
            }
            return p;
        });
        return this;
    }

    /** Receives every argument left unconsumed, in order. */
    public Args rest(Consumer<List<String>> handler) {
        this.restHandler = handler;
        return this;
    }

    public void parse(String... someArgs) {
        ArgsIterator args = new ArgsIterator(someArgs);
        while (args.hasNext()) {
            args.matchNext(matchers);
        }
        restHandler.accept(args.rest());
    }

    interface Matcher {
        /** @return true if option was consumed **/
        boolean match(ArgsIterator args);
    }

    static class ArgsIterator {
        final String[] allArgs;
        final BitSet consumed;
        String arg;
        int current;

        ArgsIterator(String[] args) {
            this.allArgs = args;
            this.consumed = new BitSet(args.length);
            if (args.length > 0) {
                arg = args[0];
            }
        }

        String value() {
            int next = current + 1;
            if (next >= allArgs.length || consumed.get(next)) {
                return null;
            }
            consumed.set(next);
            return allArgs[next];
        }

        List<String> values() {
            List<String> values = new ArrayList<>();
            int next = current + 1;
            while (next < allArgs.length && !consumed.get(next) && !allArgs[next].startsWith("-")) {
                consumed.set(next);
                values.add(allArgs[next]);
                next++;
            }
            if (next < allArgs.length && !consumed.get(next) && END_OF_OPTIONS.equals(allArgs[next])) {
                consumed.set(next);
                for (next++; next < allArgs.length; next++) {
                    consumed.set(next);
                    values.add(allArgs[next]);
                }
            }
            return values;
        }

        List<String> rest() {
            return IntStream.range(0, allArgs.length)
                .filter(i -> !consumed.get(i))
                .mapToObj(i -> allArgs[i])
                .collect(Collectors.toList());
        }

        void matchNext(List<Matcher> matchers) {
            int currentOption = current;
            for (Matcher m : matchers) {
                if (m.match(this)) {
                    consumed.set(currentOption);
                    break;
                }
            }
            advance();
        }

        void advance() {
            current++;
            // skip values consumed by the previous option
            while (hasNext() && consumed.get(current)) {
                current++;
            }
            if (hasNext()) {
                arg = allArgs[current];
            }
        }

        boolean hasNext() {
            return current < allArgs.length;
        }
    }
}
