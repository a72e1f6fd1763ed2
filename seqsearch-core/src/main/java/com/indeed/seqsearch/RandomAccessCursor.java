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

/**
 * Cursor over an index addressable source. {@link #skip(int)} is O(1).
 */
abstract class RandomAccessCursor<T> implements SourceCursor<T> {
    // index of the current element, -1 before the first call to next()
    private int index = -1;
    private boolean closed = false;

    protected abstract int size();

    protected abstract T elementAt(int index);

    @Override
    public boolean next() {
        if (closed) {
            return false;
        }
        final int size = size();
        if ((index + 1) < size) {
            ++index;
            return true;
        }
        index = size;
        return false;
    }

    @Override
    public T current() {
        Preconditions.checkState(!closed, "cursor is closed");
        Preconditions.checkState((index >= 0) && (index < size()), "no current element");
        return elementAt(index);
    }

    @Override
    public int skip(final int count) {
        Preconditions.checkArgument(count >= 0, "count is negative: %s", count);
        if (closed) {
            return 0;
        }
        final int skipped = Math.max(0, Math.min(count, size() - (index + 1)));
        index += skipped;
        return skipped;
    }

    @Override
    public void close() {
        closed = true;
    }
}
