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

import java.io.Closeable;

/**
 * Forward-only, single-use traversal of a source sequence.
 * Elements are consumed destructively; there is no way back to an element once {@link #next()} moved past it.
 *
 * @see SourceCursors
 */
public interface SourceCursor<T> extends Closeable {
    /**
     * @return true if the cursor successfully moves to the next element, false if the source is exhausted or the cursor is closed
     */
    boolean next();

    /**
     * @return the current element, invalid before next() is called or if next() returned false
     */
    T current();

    /**
     * Moves past up to {@code count} elements without looking at them.
     * After this call the element at the skipped position is not current; the following call to next() moves to it.
     *
     * @return how many elements were actually skipped, less than {@code count} only if the source ran out
     */
    default int skip(final int count) {
        int skipped = 0;
        while ((skipped < count) && next()) {
            ++skipped;
        }
        return skipped;
    }

    /**
     * release the underlying source, calling it more than once has no effect
     */
    @Override
    void close();
}
