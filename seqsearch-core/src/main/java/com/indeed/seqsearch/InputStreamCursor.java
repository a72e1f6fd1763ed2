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

import java.io.IOException;
import java.io.InputStream;

/**
 * Byte cursor over an {@link InputStream}. Reads through an internal buffer and closes the stream with the cursor.
 * I/O failures surface as unchecked exceptions from {@link #next()} and {@link #skip(int)}.
 */
class InputStreamCursor implements SourceCursor<Byte> {
    static final int DEFAULT_BUFFER_SIZE = 8192;

    private final InputStream in;
    private final byte[] buffer;
    private int position = 0;
    private int limit = 0;
    private boolean hasCurrent = false;
    private boolean eof = false;
    private boolean closed = false;

    InputStreamCursor(final InputStream in, final int bufferSize) {
        Preconditions.checkArgument(bufferSize > 0, "bufferSize must be positive: %s", bufferSize);
        this.in = Preconditions.checkNotNull(in, "in");
        this.buffer = new byte[bufferSize];
    }

    private boolean fill() {
        if (eof || closed) {
            return false;
        }
        try {
            int read;
            do {
                read = in.read(buffer, 0, buffer.length);
            } while (read == 0);
            if (read < 0) {
                eof = true;
                return false;
            }
            position = 0;
            limit = read;
            return true;
        } catch (final IOException e) {
            throw Throwables.propagate(e);
        }
    }

    @Override
    public boolean next() {
        if (closed) {
            return false;
        }
        if (hasCurrent) {
            ++position;
        }
        if ((position >= limit) && !fill()) {
            hasCurrent = false;
            return false;
        }
        hasCurrent = true;
        return true;
    }

    @Override
    public Byte current() {
        Preconditions.checkState(hasCurrent && !closed, "no current element");
        return buffer[position];
    }

    @Override
    public int skip(final int count) {
        Preconditions.checkArgument(count >= 0, "count is negative: %s", count);
        if (closed) {
            return 0;
        }
        if (hasCurrent) {
            ++position;
            hasCurrent = false;
        }
        int skipped = 0;
        while (skipped < count) {
            if ((position >= limit) && !fill()) {
                break;
            }
            final int step = Math.min(count - skipped, limit - position);
            position += step;
            skipped += step;
        }
        return skipped;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        hasCurrent = false;
        try {
            in.close();
        } catch (final IOException e) {
            throw Throwables.propagate(e);
        }
    }
}
