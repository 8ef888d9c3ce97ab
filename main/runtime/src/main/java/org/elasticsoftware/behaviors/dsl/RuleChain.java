/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.behaviors.dsl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Immutable, ordered list of rules. Lookups scan the rules in registration order and the first
 * rule whose matcher accepts the input wins, later rules are never consulted for that input.
 */
final class RuleChain<I, O> {
    private static final RuleChain<?, ?> EMPTY = new RuleChain<>(Collections.emptyList());

    private final List<Rule<I, O>> rules;

    private RuleChain(List<Rule<I, O>> rules) {
        this.rules = rules;
    }

    @SuppressWarnings("unchecked")
    static <I, O> RuleChain<I, O> empty() {
        return (RuleChain<I, O>) EMPTY;
    }

    static <I, O> RuleChain<I, O> catchAll(Function<? super I, ? extends O> action) {
        return RuleChain.<I, O>empty().append(input -> true, action);
    }

    RuleChain<I, O> append(Predicate<? super I> matcher, Function<? super I, ? extends O> action) {
        List<Rule<I, O>> appended = new ArrayList<>(rules.size() + 1);
        appended.addAll(rules);
        appended.add(new Rule<>(matcher, action));
        return new RuleChain<>(Collections.unmodifiableList(appended));
    }

    /**
     * Returns a chain that tries this chain first and the fallback only for inputs none of these
     * rules match.
     */
    RuleChain<I, O> orElse(RuleChain<I, O> fallback) {
        if (fallback.rules.isEmpty()) {
            return this;
        } else if (rules.isEmpty()) {
            return fallback;
        }
        List<Rule<I, O>> combined = new ArrayList<>(rules.size() + fallback.rules.size());
        combined.addAll(rules);
        combined.addAll(fallback.rules);
        return new RuleChain<>(Collections.unmodifiableList(combined));
    }

    /**
     * Transforms the output of every rule, the matchers stay as they are.
     */
    <R> RuleChain<I, R> map(BiFunction<? super I, ? super O, ? extends R> mapper) {
        List<Rule<I, R>> mapped = new ArrayList<>(rules.size());
        for (Rule<I, O> rule : rules) {
            mapped.add(new Rule<I, R>(rule.matcher(), input -> mapper.apply(input, rule.apply(input))));
        }
        return new RuleChain<>(Collections.unmodifiableList(mapped));
    }

    Optional<Rule<I, O>> lookup(I input) {
        for (Rule<I, O> rule : rules) {
            if (rule.matches(input)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    boolean isDefinedAt(I input) {
        return lookup(input).isPresent();
    }

    O apply(I input) {
        return lookup(input)
                .orElseThrow(() -> new NoSuchElementException("No rule matches " + input))
                .apply(input);
    }

    int size() {
        return rules.size();
    }

    record Rule<I, O>(Predicate<? super I> matcher, Function<? super I, ? extends O> action) {
        boolean matches(I input) {
            return matcher.test(input);
        }

        O apply(I input) {
            return action.apply(input);
        }
    }
}
