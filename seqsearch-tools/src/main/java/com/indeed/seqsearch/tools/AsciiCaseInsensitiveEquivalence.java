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
 package com.indeed.seqsearch.tools;

import com.google.common.base.Ascii;
import com.google.common.base.Equivalence;

/**
 * Compares bytes ignoring the case of ASCII letters. Other bytes, including non-ASCII ones, must be equal.
 */
class AsciiCaseInsensitiveEquivalence extends Equivalence<Byte> {
    static final AsciiCaseInsensitiveEquivalence INSTANCE = new AsciiCaseInsensitiveEquivalence();

    private AsciiCaseInsensitiveEquivalence() {
    }

    private static char lower(final byte b) {
        return Ascii.toLowerCase((char) (b & 0xFF));
    }

    @Override
    protected boolean doEquivalent(final Byte a, final Byte b) {
        return lower(a) == lower(b);
    }

    @Override
    protected int doHash(final Byte b) {
        return lower(b);
    }
}
