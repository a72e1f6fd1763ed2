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
import org.apache.log4j.Logger;

import javax.annotation.Nullable;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.List;
import java.util.RandomAccess;
import java.util.stream.Stream;

/**
 * Factories for {@link SourceCursor}.
 */
public class SourceCursors {
    private SourceCursors() {
    }

    /**
     * Wraps a one-shot iterator. If the iterator is {@link AutoCloseable} it is closed together with the cursor.
     */
    public static <T> SourceCursor<T> forIterator(final Iterator<? extends T> iterator) {
        return new IteratorCursor<>(iterator, null);
    }

    /**
     * Opens a fresh traversal of {@code iterable}. Random access lists are traversed by index.
     */
    public static <T> SourceCursor<T> forIterable(final Iterable<? extends T> iterable) {
        Preconditions.checkNotNull(iterable, "iterable");
        if ((iterable instanceof List) && (iterable instanceof RandomAccess)) {
            return forList((List<? extends T>) iterable);
        }
        return new IteratorCursor<>(iterable.iterator(), null);
    }

    /**
     * Traverses {@code list} by index. The list must not be structurally modified while the cursor is in use.
     */
    public static <T> SourceCursor<T> forList(final List<? extends T> list) {
        Preconditions.checkNotNull(list, "list");
        return new RandomAccessCursor<T>() {
            @Override
            protected int size() {
                return list.size();
            }

            @Override
            protected T elementAt(final int index) {
                return list.get(index);
            }
        };
    }

    /**
     * Pulls elements from {@code stream}, which is closed when the cursor is closed.
     */
    public static <T> SourceCursor<T> forStream(final Stream<? extends T> stream) {
        Preconditions.checkNotNull(stream, "stream");
        return new IteratorCursor<>(stream.iterator(), stream);
    }

    public static SourceCursor<Character> forCharSequence(final CharSequence chars) {
        Preconditions.checkNotNull(chars, "chars");
        return new RandomAccessCursor<Character>() {
            @Override
            protected int size() {
                return chars.length();
            }

            @Override
            protected Character elementAt(final int index) {
                return chars.charAt(index);
            }
        };
    }

    public static SourceCursor<Byte> forBytes(final byte[] bytes) {
        Preconditions.checkNotNull(bytes, "bytes");
        return new RandomAccessCursor<Byte>() {
            @Override
            protected int size() {
                return bytes.length;
            }

            @Override
            protected Byte elementAt(final int index) {
                return bytes[index];
            }
        };
    }

    /**
     * Reads bytes from {@code in}, which is closed when the cursor is closed.
     * {@link IOException}s are rethrown unchecked.
     */
    public static SourceCursor<Byte> forInputStream(final InputStream in) {
        return forInputStream(in, InputStreamCursor.DEFAULT_BUFFER_SIZE);
    }

    public static SourceCursor<Byte> forInputStream(final InputStream in, final int bufferSize) {
        return new InputStreamCursor(in, bufferSize);
    }

    /**
     * Closes {@code closeable}, logging instead of throwing on failure.
     */
    static void closeQuietly(@Nullable final Closeable closeable, final Logger log) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (final IOException | RuntimeException e) {
            log.warn("Failed to close " + closeable, e);
        }
    }
}
