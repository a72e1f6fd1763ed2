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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Charsets;
import com.google.common.base.Equivalence;
import com.google.common.base.Preconditions;
import com.google.common.primitives.Bytes;
import com.indeed.seqsearch.IndexIterator;
import com.indeed.seqsearch.SequenceSearch;
import com.indeed.seqsearch.SourceCursors;
import org.apache.log4j.Logger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

/**
 * Prints {@code file:offset} for every occurrence of a byte pattern in the given files.
 * Files are streamed, never loaded into memory.
 */
public class FindInFiles {
    private static final Logger log = Logger.getLogger(FindInFiles.class);

    static final int EXIT_MATCHED = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_NO_MATCH = 2;
    static final int EXIT_ERROR = 3;

    private static final String USAGE = "ARGS: pattern file1 file2 file3...\n" +
            "properties: -Dseqsearch.ignoreCase=false -Dseqsearch.firstOnly=false " +
            "-Dseqsearch.startIndex=0 -Dseqsearch.charset=UTF-8";

    private final Config config;
    private final PrintStream out;
    private int failedFiles = 0;

    public FindInFiles(final Config config, final PrintStream out) {
        this.config = Preconditions.checkNotNull(config, "config");
        this.out = Preconditions.checkNotNull(out, "out");
    }

    public static void main(final String[] args) {
        System.exit(run(args, System.getProperties(), System.out, System.err));
    }

    @VisibleForTesting
    static int run(final String[] args, final Properties properties, final PrintStream out, final PrintStream err) {
        if (args.length < 2) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        final Config config;
        try {
            config = Config.fromProperties(properties);
        } catch (final IllegalArgumentException e) {
            err.println("Invalid configuration: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        if (args[0].isEmpty()) {
            err.println("pattern must not be empty");
            return EXIT_USAGE;
        }

        final List<Path> files = new ArrayList<>(args.length - 1);
        for (final String file : Arrays.asList(args).subList(1, args.length)) {
            files.add(Paths.get(file));
        }
        final FindInFiles findInFiles = new FindInFiles(config, out);
        final long matches = findInFiles.search(args[0], files);
        if (findInFiles.getFailedFiles() > 0) {
            err.println(findInFiles.getFailedFiles() + " file(s) could not be searched");
            return EXIT_ERROR;
        }
        return (matches > 0) ? EXIT_MATCHED : EXIT_NO_MATCH;
    }

    /**
     * Files that cannot be read are logged, counted in {@link #getFailedFiles()} and skipped.
     *
     * @return the total number of matches printed
     */
    public long search(final String pattern, final List<Path> files) {
        final List<Byte> patternBytes = Bytes.asList(pattern.getBytes(config.getCharset()));
        long total = 0;
        for (final Path file : files) {
            try {
                total += search(patternBytes, file);
            } catch (final IOException | RuntimeException e) {
                ++failedFiles;
                log.error("Failed to search " + file, e);
            }
        }
        log.info("Found " + total + " match(es) in " + files.size() + " file(s)");
        return total;
    }

    int search(final List<Byte> pattern, final Path file) throws IOException {
        int matches = 0;
        try (final IndexIterator indexes = SequenceSearch.indexesOf(
                SourceCursors.forInputStream(Files.newInputStream(file)),
                pattern,
                config.getStartIndex(),
                config.getEquivalence())) {
            while (indexes.hasNext()) {
                out.println(file + ":" + indexes.nextInt());
                ++matches;
                if (config.isFirstOnly()) {
                    break;
                }
            }
        }
        log.debug("Searched " + file + ", " + matches + " match(es)");
        return matches;
    }

    public int getFailedFiles() {
        return failedFiles;
    }

    public static class Config {
        private boolean ignoreCase = false;
        private boolean firstOnly = false;
        private int startIndex = 0;
        private Charset charset = Charsets.UTF_8;

        public static Config fromProperties(final Properties properties) {
            return new Config()
                    .setIgnoreCase(Boolean.parseBoolean(properties.getProperty("seqsearch.ignoreCase", "false")))
                    .setFirstOnly(Boolean.parseBoolean(properties.getProperty("seqsearch.firstOnly", "false")))
                    .setStartIndex(Integer.parseInt(properties.getProperty("seqsearch.startIndex", "0").trim()))
                    .setCharset(Charset.forName(properties.getProperty("seqsearch.charset", "UTF-8").trim()));
        }

        public Config setIgnoreCase(final boolean ignoreCase) {
            this.ignoreCase = ignoreCase;
            return this;
        }

        public Config setFirstOnly(final boolean firstOnly) {
            this.firstOnly = firstOnly;
            return this;
        }

        public Config setStartIndex(final int startIndex) {
            Preconditions.checkArgument(startIndex >= 0, "startIndex is less than zero: %s", startIndex);
            this.startIndex = startIndex;
            return this;
        }

        public Config setCharset(final Charset charset) {
            this.charset = Preconditions.checkNotNull(charset, "charset");
            return this;
        }

        public boolean isIgnoreCase() {
            return ignoreCase;
        }

        public boolean isFirstOnly() {
            return firstOnly;
        }

        public int getStartIndex() {
            return startIndex;
        }

        public Charset getCharset() {
            return charset;
        }

        Equivalence<? super Byte> getEquivalence() {
            return ignoreCase ? AsciiCaseInsensitiveEquivalence.INSTANCE : Equivalence.equals();
        }
    }
}
