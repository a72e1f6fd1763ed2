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

import javax.annotation.Nullable;
import java.util.List;

/**
 * Builds KMP failure tables for patterns of arbitrary element type.
 */
public class TableBuilder {
    private static final FailureTable EMPTY = new FailureTable(new int[0], 0);

    private TableBuilder() {
    }

    public static <T> FailureTable buildTable(final List<? extends T> pattern) {
        return buildTable(pattern, null);
    }

    /**
     * Build the failure table (non-strict border) for the given pattern.
     * Elements are compared with {@code equivalence}, or with {@link Object#equals} if it is null.
     * The pattern is only read through {@link List#size()} and {@link List#get(int)},
     * so it should be random access.
     */
    public static <T> FailureTable buildTable(final List<? extends T> pattern, @Nullable final Equivalence<? super T> equivalence) {
        Preconditions.checkNotNull(pattern, "pattern");
        final Equivalence<? super T> eq = (equivalence == null) ? Equivalence.equals() : equivalence;
        final int length = pattern.size();
        if (length == 0) {
            return EMPTY;
        }

        final int[] table = new int[length];
        table[0] = -1;
        int failureLink = -1;
        for (int i = 0; i < length; ++i) {
            final T element = pattern.get(i);
            while ((failureLink >= 0) && !eq.equivalent(element, pattern.get(failureLink))) {
                failureLink = table[failureLink];
            }
            ++failureLink;
            if ((i + 1) < length) {
                table[i + 1] = failureLink;
            }
        }
        // failureLink is now the border of the whole pattern
        return new FailureTable(table, failureLink);
    }
}
