package ch.so.agi.lspbridge.client;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * In-memory one-way byte stream between two threads. Unlike the JDK pipes it does not care which
 * threads read and write.
 */
public final class BytePipe {
    private static final byte[] EOF = new byte[0];

    private final LinkedBlockingQueue<byte[]> chunks = new LinkedBlockingQueue<>();
    private final Object writeLock = new Object();
    private volatile boolean closed;
    private boolean held;

    private final OutputStream sink = new OutputStream() {
        @Override
        public void write(int b) throws IOException {
            write(new byte[]{(byte) b}, 0, 1);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            awaitWritable();
            if (len > 0) chunks.add(Arrays.copyOfRange(b, off, off + len));
        }

        @Override
        public void close() {
            BytePipe.this.close();
        }
    };

    private final InputStream source = new InputStream() {
        private byte[] current;
        private int pos;

        @Override
        public int read() throws IOException {
            byte[] one = new byte[1];
            int n = read(one, 0, 1);
            return n < 0 ? -1 : one[0] & 0xff;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (len == 0) return 0;
            if (current == null || pos >= current.length) {
                try {
                    current = chunks.take();
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    throw new IOException("Interrupted", ex);
                }
                pos = 0;
                if (current == EOF) {
                    chunks.add(EOF);
                    return -1;
                }
            }
            int n = Math.min(len, current.length - pos);
            System.arraycopy(current, pos, b, off, n);
            pos += n;
            return n;
        }

        @Override
        public void close() {
            BytePipe.this.close();
        }
    };

    public OutputStream sink() {
        return sink;
    }

    public InputStream source() {
        return source;
    }

    /** Makes every further write block until the pipe is closed, like a reader that stopped reading. */
    public void holdWrites() {
        synchronized (writeLock) {
            held = true;
        }
    }

    public void close() {
        synchronized (writeLock) {
            if (closed) return;
            closed = true;
            writeLock.notifyAll();
        }
        chunks.add(EOF);
    }

    private void awaitWritable() throws IOException {
        synchronized (writeLock) {
            while (held && !closed) {
                try {
                    writeLock.wait();
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    throw new IOException("Interrupted", ex);
                }
            }
            if (closed) throw new IOException("Pipe closed");
        }
    }
}
