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

import com.google.common.base.Preconditions;

import java.util.Arrays;

/**
 * Immutable KMP failure table for one pattern under one equivalence.
 * {@code get(i)} is the pattern index to resume matching from after a mismatch at {@code i};
 * it equals the length of the longest proper border of {@code pattern[0, i)}, and is -1 at index 0.
 *
 * @see TableBuilder
 */
public final class FailureTable {
    private final int[] table;
    private final int matchedBorder;

    FailureTable(final int[] table, final int matchedBorder) {
        Preconditions.checkArgument((table.length == 0) || (table[0] == -1), "table[0] must be -1");
        Preconditions.checkArgument((matchedBorder >= 0) && (matchedBorder < Math.max(1, table.length)),
                "matchedBorder out of range: %s", matchedBorder);
        this.table = table;
        this.matchedBorder = matchedBorder;
    }

    /**
     * @return the fallback index for pattern index {@code index}, in {@code [-1, index)}
     */
    public int get(final int index) {
        Preconditions.checkElementIndex(index, table.length);
        return table[index];
    }

    /**
     * @return the pattern length this table was built for
     */
    public int size() {
        return table.length;
    }

    /**
     * Length of the longest proper border of the whole pattern, i.e. the automaton state
     * to continue from right after a complete match. 0 for the empty pattern.
     */
    public int matchedBorder() {
        return matchedBorder;
    }

    public int[] toIntArray() {
        return table.clone();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if ((o == null) || (getClass() != o.getClass())) {
            return false;
        }
        final FailureTable that = (FailureTable) o;
        return (matchedBorder == that.matchedBorder) && Arrays.equals(table, that.table);
    }

    @Override
    public int hashCode() {
        return (31 * Arrays.hashCode(table)) + matchedBorder;
    }

    @Override
    public String toString() {
        return "FailureTable{" +
                "table=" + Arrays.toString(table) +
                ", matchedBorder=" + matchedBorder +
                '}';
    }
}
