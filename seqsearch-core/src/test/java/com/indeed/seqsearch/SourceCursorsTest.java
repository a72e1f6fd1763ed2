package com.indeed.seqsearch;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Bytes;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SourceCursorsTest {
    private static <T> List<T> drain(final SourceCursor<T> cursor) {
        final List<T> result = new ArrayList<>();
        while (cursor.next()) {
            result.add(cursor.current());
        }
        return result;
    }

    private static void checkSkipSemantics(final SourceCursor<Character> cursor) {
        // source is "abcdefg"
        assertEquals(0, cursor.skip(0));
        assertTrue(cursor.next());
        assertEquals('a', (char) cursor.current());
        assertEquals(2, cursor.skip(2));
        assertTrue(cursor.next());
        assertEquals('d', (char) cursor.current());
        assertEquals(3, cursor.skip(10));
        assertFalse(cursor.next());
        assertEquals(0, cursor.skip(1));
        assertFalse(cursor.next());
        cursor.close();
    }

    @Test
    public void testSkip() {
        checkSkipSemantics(SourceCursors.forCharSequence("abcdefg"));
        checkSkipSemantics(SourceCursors.forList(ImmutableList.of('a', 'b', 'c', 'd', 'e', 'f', 'g')));
        checkSkipSemantics(SourceCursors.forIterable(new LinkedList<>(ImmutableList.of('a', 'b', 'c', 'd', 'e', 'f', 'g'))));
        checkSkipSemantics(SourceCursors.forStream(Stream.of('a', 'b', 'c', 'd', 'e', 'f', 'g')));
    }

    @Test
    public void testClosedCursorIsExhausted() {
        final SourceCursor<Character> chars = SourceCursors.forCharSequence("abc");
        assertTrue(chars.next());
        chars.close();
        assertFalse(chars.next());
        assertEquals(0, chars.skip(1));

        final SourceCursor<Integer> iterator = SourceCursors.forIterator(ImmutableList.of(1, 2).iterator());
        iterator.close();
        iterator.close();
        assertFalse(iterator.next());
    }

    @Test(expected = IllegalStateException.class)
    public void testCurrentBeforeNext() {
        SourceCursors.forList(ImmutableList.of(1)).current();
    }

    @Test
    public void testStreamIsClosedWithCursor() {
        final AtomicBoolean closed = new AtomicBoolean(false);
        final SourceCursor<Integer> cursor = SourceCursors.forStream(Stream.of(1, 2, 3).onClose(() -> closed.set(true)));
        assertEquals(ImmutableList.of(1, 2, 3), drain(cursor));
        assertFalse(closed.get());
        cursor.close();
        assertTrue(closed.get());
    }

    private static class CloseableIterator implements Iterator<String>, AutoCloseable {
        private final Iterator<String> delegate = ImmutableList.of("x").iterator();
        int closeCount = 0;

        @Override
        public boolean hasNext() {
            return delegate.hasNext();
        }

        @Override
        public String next() {
            return delegate.next();
        }

        @Override
        public void close() {
            ++closeCount;
        }
    }

    @Test
    public void testCloseableIteratorIsClosed() {
        final CloseableIterator iterator = new CloseableIterator();
        final SourceCursor<String> cursor = SourceCursors.forIterator(iterator);
        assertEquals(ImmutableList.of("x"), drain(cursor));
        cursor.close();
        cursor.close();
        assertEquals(1, iterator.closeCount);
    }

    private static class FailingCloseIterator extends CloseableIterator {
        @Override
        public void close() {
            super.close();
            throw new IllegalStateException("iterator close failed");
        }
    }

    @Test
    public void testOwnerClosedWhenIteratorCloseFails() {
        final FailingCloseIterator iterator = new FailingCloseIterator();
        final AtomicBoolean ownerClosed = new AtomicBoolean(false);
        final SourceCursor<String> cursor = new IteratorCursor<>(iterator, () -> ownerClosed.set(true));
        try {
            cursor.close();
            fail("expected IllegalStateException");
        } catch (final IllegalStateException e) {
            assertEquals("iterator close failed", e.getMessage());
        }
        assertEquals(1, iterator.closeCount);
        assertTrue(ownerClosed.get());
    }

    @Test
    public void testSecondCloseFailureIsSuppressed() {
        final FailingCloseIterator iterator = new FailingCloseIterator();
        final SourceCursor<String> cursor = new IteratorCursor<>(iterator, () -> {
            throw new IOException("owner close failed");
        });
        try {
            cursor.close();
            fail("expected IllegalStateException");
        } catch (final IllegalStateException e) {
            assertEquals(1, e.getSuppressed().length);
            assertEquals("owner close failed", e.getSuppressed()[0].getMessage());
        }
    }

    @Test
    public void testBytes() {
        final byte[] bytes = "kmp search".getBytes(Charsets.UTF_8);
        assertEquals(Bytes.asList(bytes), drain(SourceCursors.forBytes(bytes)));
        for (final int bufferSize : new int[]{1, 3, 7, 8192}) {
            assertEquals(Bytes.asList(bytes), drain(SourceCursors.forInputStream(new ByteArrayInputStream(bytes), bufferSize)));
        }
    }

    @Test
    public void testInputStreamSkipAcrossBuffers() {
        final byte[] bytes = "0123456789".getBytes(Charsets.UTF_8);
        final SourceCursor<Byte> cursor = SourceCursors.forInputStream(new ByteArrayInputStream(bytes), 3);
        assertEquals(4, cursor.skip(4));
        assertTrue(cursor.next());
        assertEquals('4', (char) (byte) cursor.current());
        assertEquals(3, cursor.skip(3));
        assertTrue(cursor.next());
        assertEquals('8', (char) (byte) cursor.current());
        assertEquals(1, cursor.skip(5));
        assertFalse(cursor.next());
        cursor.close();
    }

    private static class TrackingInputStream extends FilterInputStream {
        private boolean closed = false;
        private final boolean failOnRead;

        TrackingInputStream(final byte[] bytes, final boolean failOnRead) {
            super(new ByteArrayInputStream(bytes));
            this.failOnRead = failOnRead;
        }

        @Override
        public int read(final byte[] b, final int off, final int len) throws IOException {
            if (failOnRead) {
                throw new IOException("read failed");
            }
            return super.read(b, off, len);
        }

        @Override
        public void close() throws IOException {
            closed = true;
            super.close();
        }
    }

    @Test
    public void testInputStreamSearch() {
        final TrackingInputStream in = new TrackingInputStream("one two one two one".getBytes(Charsets.UTF_8), false);
        final List<Byte> pattern = Bytes.asList("one t".getBytes(Charsets.UTF_8));
        assertEquals(ImmutableList.of(0, 8), SequenceSearch.collect(SequenceSearch.indexesOf(SourceCursors.forInputStream(in, 4), pattern)));
        assertTrue(in.closed);
    }

    @Test
    public void testInputStreamFailureClosesStream() {
        final TrackingInputStream in = new TrackingInputStream(new byte[]{1, 2, 3}, true);
        try {
            SequenceSearch.indexOf(SourceCursors.forInputStream(in), Bytes.asList(new byte[]{2, 3}));
            fail("expected an exception");
        } catch (final RuntimeException e) {
            assertTrue(e.getCause() instanceof IOException);
        }
        assertTrue(in.closed);
    }
}
