// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.prometheus;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.Objects;

/**
 * An unsynchronized variant of {@link java.io.ByteArrayOutputStream}, used to render a whole scrape response
 * in memory before any response header is sent.
 * It is not thread-safe, every request renders into its own instance.
 */
final class UnsynchronizedByteArrayOutputStream extends OutputStream {

    private byte[] buffer;
    private int size = 0;

    /**
     * @param capacity the initial capacity of the buffer
     * @throws IllegalArgumentException if the specified capacity is negative
     */
    UnsynchronizedByteArrayOutputStream(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity must not be negative");
        }
        buffer = new byte[capacity];
    }

    @Override
    public void write(@NonNull byte[] data) {
        write(data, 0, data.length);
    }

    @Override
    public void write(@NonNull byte[] data, int off, int len) {
        Objects.checkFromIndexSize(off, len, data.length);

        if (len != 0) {
            ensureCapacity(size + len);
            System.arraycopy(data, off, buffer, size, len);
            size += len;
        }
    }

    @Override
    public void write(int b) {
        ensureCapacity(size + 1);
        buffer[size++] = (byte) b;
    }

    /**
     * @return a copy of the written data
     */
    @NonNull
    byte[] toByteArray() {
        return Arrays.copyOf(buffer, size);
    }

    /**
     * Writes the contents of this stream to the specified output stream.
     *
     * @param out the output stream to write to
     * @throws IOException if an I/O error occurs
     */
    void writeTo(OutputStream out) throws IOException {
        out.write(buffer, 0, size);
    }

    /**
     * @return the number of bytes written
     */
    int size() {
        return size;
    }

    private void ensureCapacity(int requiredCapacity) {
        if (requiredCapacity > buffer.length) {
            byte[] copy = new byte[Math.max(2 * buffer.length, requiredCapacity)];
            System.arraycopy(buffer, 0, copy, 0, size);
            buffer = copy;
        }
    }
}
