package com.bgmarchive.util.io;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Objects;

/**
 * Splits a byte stream into physical lines on LF.
 *
 * <p>Lines are returned as raw bytes so that the caller decides how to decode them;
 * a malformed UTF-8 sequence therefore only affects the line that carries it.
 * A trailing CR is removed (CRLF input), and a UTF-8 byte order mark at the start
 * of the stream is skipped. A final line without a terminating LF is still returned;
 * the empty remainder after a final LF is not a line.
 *
 * <p>Not thread-safe. Closing the reader closes the underlying stream.
 */
public class LineReader implements Closeable {

    private static final int CHUNK_SIZE = 64 * 1024;
    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    private final InputStream in;
    private final byte[] chunk = new byte[CHUNK_SIZE];
    private int chunkPos;
    private int chunkLimit;

    private byte[] line = new byte[256];
    private int lineLength;

    private long lineNumber = -1;
    private boolean eof;
    private boolean closed;

    public LineReader(InputStream in) {
        this.in = Objects.requireNonNull(in, "in cannot be null");
    }

    /**
     * Reads the next physical line.
     *
     * @return the line's bytes without its terminator, or null at end of stream
     */
    public byte[] next() throws IOException {
        if (closed) {
            throw new IOException("LineReader is closed");
        }
        lineLength = 0;
        boolean pending = false;

        while (true) {
            if (chunkPos >= chunkLimit && !fill()) {
                return pending ? finishLine() : null;
            }
            pending = true;

            int lf = indexOfLf(chunkPos, chunkLimit);
            if (lf >= 0) {
                append(chunkPos, lf - chunkPos);
                chunkPos = lf + 1;
                return finishLine();
            }
            append(chunkPos, chunkLimit - chunkPos);
            chunkPos = chunkLimit;
        }
    }

    /**
     * Zero-based index of the line most recently returned by {@link #next()},
     * or -1 before the first call.
     */
    public long lineNumber() {
        return lineNumber;
    }

    @Override
    public void close() throws IOException {
        if (!closed) {
            closed = true;
            in.close();
        }
    }

    private boolean fill() throws IOException {
        if (eof) return false;
        int n;
        do {
            n = in.read(chunk, 0, chunk.length);
        } while (n == 0);
        if (n < 0) {
            eof = true;
            return false;
        }
        chunkPos = 0;
        chunkLimit = n;
        return true;
    }

    private int indexOfLf(int from, int to) {
        for (int i = from; i < to; i++) {
            if (chunk[i] == '\n') return i;
        }
        return -1;
    }

    private void append(int offset, int length) {
        if (length == 0) return;
        if (lineLength + length > line.length) {
            line = Arrays.copyOf(line, Math.max(line.length * 2, lineLength + length));
        }
        System.arraycopy(chunk, offset, line, lineLength, length);
        lineLength += length;
    }

    private byte[] finishLine() {
        lineNumber++;

        int from = 0;
        int to = lineLength;
        if (lineNumber == 0 && startsWithBom()) {
            from = UTF8_BOM.length;
        }
        if (to > from && line[to - 1] == '\r') {
            to--;
        }
        return Arrays.copyOfRange(line, from, to);
    }

    private boolean startsWithBom() {
        if (lineLength < UTF8_BOM.length) return false;
        for (int i = 0; i < UTF8_BOM.length; i++) {
            if (line[i] != UTF8_BOM[i]) return false;
        }
        return true;
    }
}
