package com.indeed.seqsearch.tools;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.util.Properties;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;

public class FindInFilesTest {
    @Rule
    public final TemporaryFolder tempDir = new TemporaryFolder();

    private File first;
    private File second;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @Before
    public void setUp() throws IOException {
        first = tempDir.newFile("first.txt");
        second = tempDir.newFile("second.txt");
        Files.write(first.toPath(), "needle in a haystack, NEEDLE, needleneedle".getBytes(Charsets.UTF_8));
        Files.write(second.toPath(), "nothing to see here".getBytes(Charsets.UTF_8));
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(final Properties properties, final String... args) throws IOException {
        return FindInFiles.run(
                args,
                properties,
                new PrintStream(out, true, "UTF-8"),
                new PrintStream(err, true, "UTF-8"));
    }

    private String output() throws IOException {
        return out.toString("UTF-8");
    }

    private static String lines(final String... lines) {
        final StringBuilder sb = new StringBuilder();
        for (final String line : lines) {
            sb.append(line).append(System.lineSeparator());
        }
        return sb.toString();
    }

    @Test
    public void testFindsAllMatches() throws IOException {
        assertEquals(FindInFiles.EXIT_MATCHED, run(new Properties(), "needle", first.getPath(), second.getPath()));
        assertEquals(lines(first + ":0", first + ":30", first + ":36"), output());
    }

    @Test
    public void testIgnoreCaseAndFirstOnly() throws IOException {
        final Properties properties = new Properties();
        properties.setProperty("seqsearch.ignoreCase", "true");
        assertEquals(FindInFiles.EXIT_MATCHED, run(properties, "needle", first.getPath()));
        assertEquals(lines(first + ":0", first + ":22", first + ":30", first + ":36"), output());

        out.reset();
        properties.setProperty("seqsearch.firstOnly", "true");
        properties.setProperty("seqsearch.startIndex", "1");
        assertEquals(FindInFiles.EXIT_MATCHED, run(properties, "needle", first.getPath()));
        assertEquals(lines(first + ":22"), output());
    }

    @Test
    public void testNoMatch() throws IOException {
        assertEquals(FindInFiles.EXIT_NO_MATCH, run(new Properties(), "needle", second.getPath()));
        assertEquals("", output());
    }

    @Test
    public void testUsageErrors() throws IOException {
        assertEquals(FindInFiles.EXIT_USAGE, run(new Properties(), "needle"));
        assertEquals(FindInFiles.EXIT_USAGE, run(new Properties(), "", first.getPath()));

        final Properties negativeStart = new Properties();
        negativeStart.setProperty("seqsearch.startIndex", "-1");
        assertEquals(FindInFiles.EXIT_USAGE, run(negativeStart, "needle", first.getPath()));

        final Properties badCharset = new Properties();
        badCharset.setProperty("seqsearch.charset", "no-such-charset");
        assertEquals(FindInFiles.EXIT_USAGE, run(badCharset, "needle", first.getPath()));
        assertThat(err.toString("UTF-8"), containsString("ARGS:"));
    }

    @Test
    public void testMissingFileIsReportedAndSkipped() throws IOException {
        final String missing = new File(tempDir.getRoot(), "missing.txt").getPath();
        assertEquals(FindInFiles.EXIT_ERROR, run(new Properties(), "needle", missing, first.getPath()));
        assertEquals(lines(first + ":0", first + ":30", first + ":36"), output());
        assertThat(err.toString("UTF-8"), containsString("1 file(s) could not be searched"));
    }

    @Test
    public void testUnreadableFileIsReportedAndSkipped() throws IOException {
        // a directory either fails to open or fails on the first read, depending on the platform
        final File directory = tempDir.newFolder("not-a-file");
        final FindInFiles findInFiles = new FindInFiles(new FindInFiles.Config(), new PrintStream(out, true, "UTF-8"));
        assertEquals(3, findInFiles.search("needle", ImmutableList.of(directory.toPath(), first.toPath())));
        assertEquals(1, findInFiles.getFailedFiles());
        assertEquals(FindInFiles.EXIT_ERROR, run(new Properties(), "needle", directory.getPath()));
    }

    @Test
    public void testConfigFromProperties() {
        final FindInFiles.Config defaults = FindInFiles.Config.fromProperties(new Properties());
        assertEquals(false, defaults.isIgnoreCase());
        assertEquals(false, defaults.isFirstOnly());
        assertEquals(0, defaults.getStartIndex());
        assertEquals(Charsets.UTF_8, defaults.getCharset());

        final Properties properties = new Properties();
        properties.setProperty("seqsearch.startIndex", " 12 ");
        properties.setProperty("seqsearch.charset", "ISO-8859-1");
        final FindInFiles.Config config = FindInFiles.Config.fromProperties(properties);
        assertEquals(12, config.getStartIndex());
        assertEquals(Charsets.ISO_8859_1, config.getCharset());
    }

    @Test
    public void testSearchApi() throws IOException {
        final FindInFiles findInFiles = new FindInFiles(new FindInFiles.Config().setIgnoreCase(true), new PrintStream(out, true, "UTF-8"));
        assertEquals(4, findInFiles.search("NeEdLe", ImmutableList.of(first.toPath(), second.toPath())));
        assertEquals(0, findInFiles.getFailedFiles());
    }
}
