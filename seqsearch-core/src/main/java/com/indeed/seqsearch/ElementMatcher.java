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

/**
 * Pattern matching automaton fed one source element at a time.
 */
interface ElementMatcher<T> {
    /**
     * @return the number of elements in the pattern, always positive
     */
    int patternLength();

    /**
     * Feeds the next source element.
     *
     * @return true iff a complete occurrence of the pattern ends at this element
     */
    boolean accept(T element);
}
