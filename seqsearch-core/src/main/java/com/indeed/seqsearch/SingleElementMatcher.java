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

/**
 * Matcher for a one element pattern; a plain comparison per source element.
 */
class SingleElementMatcher<T> implements ElementMatcher<T> {
    private final T target;
    private final Equivalence<? super T> equivalence;

    SingleElementMatcher(final T target, final Equivalence<? super T> equivalence) {
        this.target = target;
        this.equivalence = equivalence;
    }

    @Override
    public int patternLength() {
        return 1;
    }

    @Override
    public boolean accept(final T element) {
        return equivalence.equivalent(target, element);
    }
}
