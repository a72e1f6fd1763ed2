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

import it.unimi.dsi.fastutil.ints.IntIterator;

import java.io.Closeable;

/**
 * Lazy, single-use sequence of match indexes in strictly increasing order.
 * The underlying source is released once the iterator is exhausted or closed, whichever comes first.
 */
public interface IndexIterator extends IntIterator, Closeable {
    /**
     * stop the search and release the source, calling it more than once has no effect
     */
    @Override
    void close();
}
