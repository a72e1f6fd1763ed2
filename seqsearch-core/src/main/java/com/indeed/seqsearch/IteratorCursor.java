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
import com.google.common.base.Throwables;

import javax.annotation.Nullable;
import java.util.Iterator;

/**
 * Cursor over a one-shot {@link Iterator}. The iterator and the optional owner are closed along with the cursor
 * if they are {@link AutoCloseable}.
 */
class IteratorCursor<T> implements SourceCursor<T> {
    private final Iterator<? extends T> iterator;
    @Nullable
    private final AutoCloseable owner;
    private T current;
    private boolean hasCurrent = false;
    private boolean closed = false;

    IteratorCursor(final Iterator<? extends T> iterator, @Nullable final AutoCloseable owner) {
        this.iterator = Preconditions.checkNotNull(iterator, "iterator");
        this.owner = owner;
    }

    @Override
    public boolean next() {
        if (closed || !iterator.hasNext()) {
            hasCurrent = false;
            current = null;
            return false;
        }
        current = iterator.next();
        hasCurrent = true;
        return true;
    }

    @Override
    public T current() {
        Preconditions.checkState(hasCurrent, "no current element");
        return current;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        hasCurrent = false;
        current = null;
        Exception failure = null;
        if (iterator instanceof AutoCloseable) {
            failure = closeAndCollect((AutoCloseable) iterator, null);
        }
        if ((owner != null) && (owner != iterator)) {
            failure = closeAndCollect(owner, failure);
        }
        if (failure != null) {
            throw Throwables.propagate(failure);
        }
    }

    // the first failure wins, later ones are attached as suppressed
    @Nullable
    private static Exception closeAndCollect(final AutoCloseable closeable, @Nullable final Exception failure) {
        try {
            closeable.close();
            return failure;
        } catch (final Exception e) {
            if (failure == null) {
                return e;
            }
            failure.addSuppressed(e);
            return failure;
        }
    }
}
