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
import com.google.common.collect.Lists;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.apache.log4j.Logger;

import javax.annotation.Nullable;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Knuth-Morris-Pratt search of a random access pattern in a source that may only be traversed forward, once.
 *
 * <p>Sources are given either as an {@link Iterable}, in which case every call opens a fresh traversal,
 * or as a {@link SourceCursor}, which the call consumes and always closes.
 * Elements are compared with the given {@link Equivalence}, {@link Equivalence#equals()} when absent or null.
 *
 * <p>Arguments are validated before anything is read: a null source or pattern throws
 * {@link NullPointerException} and a negative {@code startIndex} throws {@link IllegalArgumentException},
 * also for the lazy {@code indexesOf} variants.
 *
 * <p>Reported indexes are zero based from the beginning of the source, not from {@code startIndex}.
 * Occurrences may overlap: {@code "aa"} occurs in {@code "aaa"} at 0 and 1.
 */
public class SequenceSearch {
    private static final Logger log = Logger.getLogger(SequenceSearch.class);

    private SequenceSearch() {
    }

    // indexOf

    public static <T> int indexOf(final Iterable<? extends T> source, final List<? extends T> pattern) {
        return indexOf(source, pattern, 0, null);
    }

    public static <T> int indexOf(final Iterable<? extends T> source, final List<? extends T> pattern, @Nullable final Equivalence<? super T> equivalence) {
        return indexOf(source, pattern, 0, equivalence);
    }

    public static <T> int indexOf(final Iterable<? extends T> source, final List<? extends T> pattern, final int startIndex) {
        return indexOf(source, pattern, startIndex, null);
    }

    /**
     * Returns the index of the first occurrence of {@code pattern} in {@code source} at or after {@code startIndex},
     * or -1 if there is none. An empty pattern is found at {@code startIndex}.
     */
    public static <T> int indexOf(
            final Iterable<? extends T> source,
            final List<? extends T> pattern,
            final int startIndex,
            @Nullable final Equivalence<? super T> equivalence) {
        validate(source, pattern, startIndex);
        if (pattern.isEmpty()) {
            return startIndex;
        }
        return first(search(SourceCursors.<T>forIterable(source), pattern, startIndex, equivalence));
    }

    public static <T> int indexOf(final SourceCursor<? extends T> source, final List<? extends T> pattern) {
        return indexOf(source, pattern, 0, null);
    }

    public static <T> int indexOf(final SourceCursor<? extends T> source, final List<? extends T> pattern, @Nullable final Equivalence<? super T> equivalence) {
        return indexOf(source, pattern, 0, equivalence);
    }

    public static <T> int indexOf(final SourceCursor<? extends T> source, final List<? extends T> pattern, final int startIndex) {
        return indexOf(source, pattern, startIndex, null);
    }

    /**
     * Same as {@link #indexOf(Iterable, List, int, Equivalence)} over an open cursor, which is closed before returning.
     */
    public static <T> int indexOf(
            final SourceCursor<? extends T> source,
            final List<? extends T> pattern,
            final int startIndex,
            @Nullable final Equivalence<? super T> equivalence) {
        validateOrClose(source, pattern, startIndex);
        if (pattern.isEmpty()) {
            SourceCursors.closeQuietly(source, log);
            return startIndex;
        }
        return first(search(source, pattern, startIndex, equivalence));
    }

    public static int indexOf(final CharSequence source, final CharSequence pattern) {
        return indexOf(source, pattern, 0);
    }

    public static int indexOf(final CharSequence source, final CharSequence pattern, final int startIndex) {
        Preconditions.checkNotNull(source, "source");
        Preconditions.checkNotNull(pattern, "pattern");
        return indexOf(SourceCursors.forCharSequence(source), Lists.charactersOf(pattern), startIndex, null);
    }

    // indexesOf

    public static <T> IndexIterator indexesOf(final Iterable<? extends T> source, final List<? extends T> pattern) {
        return indexesOf(source, pattern, 0, null);
    }

    public static <T> IndexIterator indexesOf(final Iterable<? extends T> source, final List<? extends T> pattern, @Nullable final Equivalence<? super T> equivalence) {
        return indexesOf(source, pattern, 0, equivalence);
    }

    public static <T> IndexIterator indexesOf(final Iterable<? extends T> source, final List<? extends T> pattern, final int startIndex) {
        return indexesOf(source, pattern, startIndex, null);
    }

    /**
     * Returns the indexes of all, possibly overlapping, occurrences of {@code pattern} in {@code source}
     * at or after {@code startIndex}. Nothing is read from the source until the result is iterated.
     * An empty pattern has no occurrences.
     * The caller should {@link IndexIterator#close() close} the result if it stops before exhausting it.
     */
    public static <T> IndexIterator indexesOf(
            final Iterable<? extends T> source,
            final List<? extends T> pattern,
            final int startIndex,
            @Nullable final Equivalence<? super T> equivalence) {
        validate(source, pattern, startIndex);
        if (pattern.isEmpty()) {
            return EmptyIndexIterator.INSTANCE;
        }
        return search(SourceCursors.<T>forIterable(source), pattern, startIndex, equivalence);
    }

    public static <T> IndexIterator indexesOf(final SourceCursor<? extends T> source, final List<? extends T> pattern) {
        return indexesOf(source, pattern, 0, null);
    }

    public static <T> IndexIterator indexesOf(final SourceCursor<? extends T> source, final List<? extends T> pattern, @Nullable final Equivalence<? super T> equivalence) {
        return indexesOf(source, pattern, 0, equivalence);
    }

    public static <T> IndexIterator indexesOf(final SourceCursor<? extends T> source, final List<? extends T> pattern, final int startIndex) {
        return indexesOf(source, pattern, startIndex, null);
    }

    /**
     * Same as {@link #indexesOf(Iterable, List, int, Equivalence)} over an open cursor.
     * The cursor is closed when the result is exhausted or closed.
     */
    public static <T> IndexIterator indexesOf(
            final SourceCursor<? extends T> source,
            final List<? extends T> pattern,
            final int startIndex,
            @Nullable final Equivalence<? super T> equivalence) {
        validateOrClose(source, pattern, startIndex);
        if (pattern.isEmpty()) {
            SourceCursors.closeQuietly(source, log);
            return EmptyIndexIterator.INSTANCE;
        }
        return search(source, pattern, startIndex, equivalence);
    }

    public static IndexIterator indexesOf(final CharSequence source, final CharSequence pattern) {
        return indexesOf(source, pattern, 0);
    }

    public static IndexIterator indexesOf(final CharSequence source, final CharSequence pattern, final int startIndex) {
        Preconditions.checkNotNull(source, "source");
        Preconditions.checkNotNull(pattern, "pattern");
        return indexesOf(SourceCursors.forCharSequence(source), Lists.charactersOf(pattern), startIndex, null);
    }

    // derived operations

    public static <T> boolean contains(final Iterable<? extends T> source, final List<? extends T> pattern) {
        return contains(source, pattern, null);
    }

    public static <T> boolean contains(final Iterable<? extends T> source, final List<? extends T> pattern, @Nullable final Equivalence<? super T> equivalence) {
        return indexOf(source, pattern, 0, equivalence) >= 0;
    }

    public static <T> int count(final Iterable<? extends T> source, final List<? extends T> pattern) {
        return count(source, pattern, 0, null);
    }

    /**
     * Returns the number of occurrences, overlapping ones included, at or after {@code startIndex}.
     */
    public static <T> int count(
            final Iterable<? extends T> source,
            final List<? extends T> pattern,
            final int startIndex,
            @Nullable final Equivalence<? super T> equivalence) {
        int count = 0;
        try (final IndexIterator indexes = indexesOf(source, pattern, startIndex, equivalence)) {
            while (indexes.hasNext()) {
                indexes.nextInt();
                ++count;
            }
        }
        return count;
    }

    /**
     * Drains {@code indexes} into a list and closes it.
     */
    public static IntList collect(final IndexIterator indexes) {
        Preconditions.checkNotNull(indexes, "indexes");
        final IntArrayList result = new IntArrayList();
        try {
            while (indexes.hasNext()) {
                result.add(indexes.nextInt());
            }
        } finally {
            indexes.close();
        }
        return result;
    }

    private static int first(final IndexIterator indexes) {
        try {
            return indexes.hasNext() ? indexes.nextInt() : -1;
        } finally {
            indexes.close();
        }
    }

    private static <T> SearchIterator<T> search(
            final SourceCursor<? extends T> cursor,
            final List<? extends T> pattern,
            final int startIndex,
            @Nullable final Equivalence<? super T> equivalence) {
        final Equivalence<? super T> eq = (equivalence == null) ? Equivalence.equals() : equivalence;
        final ElementMatcher<T> matcher;
        try {
            if (pattern.size() == 1) {
                matcher = new SingleElementMatcher<>(pattern.get(0), eq);
            } else {
                // builds the table, so the equivalence may already throw here
                matcher = new KmpMatcher<>(pattern, eq);
            }
        } catch (final RuntimeException | Error e) {
            SourceCursors.closeQuietly(cursor, log);
            throw e;
        }
        return new SearchIterator<>(cursor, matcher, startIndex);
    }

    private static void validate(final Object source, final List<?> pattern, final int startIndex) {
        Preconditions.checkNotNull(source, "source");
        Preconditions.checkNotNull(pattern, "pattern");
        Preconditions.checkArgument(startIndex >= 0, "startIndex is less than zero: %s", startIndex);
    }

    private static void validateOrClose(@Nullable final SourceCursor<?> source, final List<?> pattern, final int startIndex) {
        try {
            validate(source, pattern, startIndex);
        } catch (final RuntimeException e) {
            SourceCursors.closeQuietly(source, log);
            throw e;
        }
    }

    private enum EmptyIndexIterator implements IndexIterator {
        INSTANCE;

        @Override
        public boolean hasNext() {
            return false;
        }

        @Override
        public int nextInt() {
            throw new NoSuchElementException();
        }

        @Override
        public void close() {
        }
    }
}
