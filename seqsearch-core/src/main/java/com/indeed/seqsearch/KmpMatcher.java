/*
 * Copyright (C) 2018 Indeed Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the
 * License is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing permissions and
 * limitations under the License.
 */
 package com.indeed.seqsearch;

import com.google.common.base.Equivalence;
import com.google.common.base.Preconditions;

import java.util.List;

/**
 * Knuth-Morris-Pratt automaton for patterns of two or more elements.
 * The state is the number of pattern elements matched by the most recent source elements.
 */
class KmpMatcher<T> implements ElementMatcher<T> {
    private final List<? extends T> pattern;
    private final FailureTable kmpTable;
    private final Equivalence<? super T> equivalence;
    private int state = 0;

    KmpMatcher(final List<? extends T> pattern, final Equivalence<? super T> equivalence) {
        this(pattern, TableBuilder.buildTable(pattern, equivalence), equivalence);
    }

    KmpMatcher(final List<? extends T> pattern, final FailureTable kmpTable, final Equivalence<? super T> equivalence) {
        Preconditions.checkArgument(pattern.size() > 1, "pattern must have at least two elements");
        Preconditions.checkArgument(kmpTable.size() == pattern.size(), "table does not belong to the pattern");
        this.pattern = pattern;
        this.kmpTable = kmpTable;
        this.equivalence = equivalence;
    }

    @Override
    public int patternLength() {
        return pattern.size();
    }

    int state() {
        return state;
    }

    @Override
    public boolean accept(final T element) {
        while ((state >= 0) && !equivalence.equivalent(pattern.get(state), element)) {
            state = kmpTable.get(state);
        }
        ++state;
        if (state == pattern.size()) {
            // continue from the longest border so overlapping occurrences are found
            state = kmpTable.matchedBorder();
            return true;
        }
        return false;
    }
}
