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
import com.google.common.primitives.Ints;
import it.unimi.dsi.fastutil.ints.AbstractIntIterator;
import org.apache.log4j.Logger;

import java.util.NoSuchElementException;

/**
 * Drives an {@link ElementMatcher} over a {@link SourceCursor}, producing match start indexes on demand.
 * Every source element is read at most once; the cursor is closed as soon as the search can produce nothing more.
 */
class SearchIterator<T> extends AbstractIntIterator implements IndexIterator {
    private static final Logger log = Logger.getLogger(SearchIterator.class);

    private enum State { NOT_STARTED, NOT_READY, READY, DONE }

    private final SourceCursor<? extends T> cursor;
    private final ElementMatcher<T> matcher;
    private final int startIndex;
    // absolute index of the next element the cursor will produce
    private long position;
    private int nextIndex;
    private int matchCount = 0;
    private State state = State.NOT_STARTED;

    SearchIterator(final SourceCursor<? extends T> cursor, final ElementMatcher<T> matcher, final int startIndex) {
        Preconditions.checkArgument(startIndex >= 0, "startIndex is less than zero: %s", startIndex);
        this.cursor = Preconditions.checkNotNull(cursor, "cursor");
        this.matcher = Preconditions.checkNotNull(matcher, "matcher");
        this.startIndex = startIndex;
    }

    @Override
    public boolean hasNext() {
        switch (state) {
            case READY:
                return true;
            case DONE:
                return false;
            default:
                return tryToComputeNext();
        }
    }

    @Override
    public int nextInt() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        state = State.NOT_READY;
        return nextIndex;
    }

    private boolean tryToComputeNext() {
        try {
            if (state == State.NOT_STARTED) {
                state = State.NOT_READY;
                if (cursor.skip(startIndex) < startIndex) {
                    finish();
                    return false;
                }
                position = startIndex;
            }
            final int patternLength = matcher.patternLength();
            while (cursor.next()) {
                final T element = cursor.current();
                ++position;
                if (matcher.accept(element)) {
                    // fails rather than wrapping once a match starts beyond Integer.MAX_VALUE
                    nextIndex = Ints.checkedCast(position - patternLength);
                    ++matchCount;
                    state = State.READY;
                    return true;
                }
            }
            finish();
            return false;
        } catch (final RuntimeException | Error e) {
            state = State.DONE;
            SourceCursors.closeQuietly(cursor, log);
            throw e;
        }
    }

    private void finish() {
        if (log.isDebugEnabled()) {
            log.debug("Search from " + startIndex + " finished at source position " + position +
                    " with " + matchCount + " match(es)");
        }
        close();
    }

    @Override
    public void close() {
        if (state != State.DONE) {
            state = State.DONE;
            SourceCursors.closeQuietly(cursor, log);
        }
    }
}
