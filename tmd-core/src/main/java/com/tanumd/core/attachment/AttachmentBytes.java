package com.tanumd.core.attachment;

import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

/**
 * Scoped, exclusive mutable view of one attachment's bytes.
 *
 * <p>Obtained from {@link AttachmentStore#mutateBytes(UUID)} and meant for try-with-resources.
 * Edits go to a private buffer; {@link #close()} hands the buffer back to the store, which
 * recomputes length and SHA-256 before anything else can touch the attachment. Any use after
 * close fails.
 *
 * <pre>{@code
 * try (AttachmentBytes bytes = store.mutateBytes(id)) {
 *     bytes.truncate(0);
 *     bytes.append("new content".getBytes(StandardCharsets.UTF_8));
 * }
 * }</pre>
 */
public final class AttachmentBytes implements AutoCloseable {

    private final AttachmentStore store;
    private final UUID id;
    private byte[] buffer;
    private int length;
    private boolean closed;

    AttachmentBytes(AttachmentStore store, UUID id, byte[] initial) {
        this.store = store;
        this.id = id;
        this.buffer = initial.clone();
        this.length = initial.length;
    }

    /**
     * Returns the attachment id being edited.
     *
     * @return attachment id
     */
    public UUID id() {
        return id;
    }

    /**
     * Returns the current length of the buffer.
     *
     * @return byte count
     */
    public int length() {
        ensureOpen();
        return length;
    }

    /**
     * Reads one byte.
     *
     * @param index position
     * @return byte at {@code index}
     */
    public byte get(int index) {
        ensureOpen();
        Objects.checkIndex(index, length);
        return buffer[index];
    }

    /**
     * Overwrites one byte.
     *
     * @param index position
     * @param value new value
     */
    public void set(int index, byte value) {
        ensureOpen();
        Objects.checkIndex(index, length);
        buffer[index] = value;
    }

    /**
     * Appends bytes to the end.
     *
     * @param bytes data to append
     */
    public void append(byte[] bytes) {
        ensureOpen();
        write(length, bytes);
    }

    /**
     * Writes bytes at an offset, growing the buffer if the write extends past the end.
     *
     * @param offset start position, at most {@link #length()}
     * @param bytes data to write
     */
    public void write(int offset, byte[] bytes) {
        ensureOpen();
        Objects.requireNonNull(bytes, "bytes must not be null");
        Objects.checkIndex(offset, length + 1);
        int end = Math.addExact(offset, bytes.length);
        ensureCapacity(end);
        System.arraycopy(bytes, 0, buffer, offset, bytes.length);
        length = Math.max(length, end);
    }

    /**
     * Replaces the whole content.
     *
     * @param bytes new content
     */
    public void replace(byte[] bytes) {
        ensureOpen();
        Objects.requireNonNull(bytes, "bytes must not be null");
        buffer = bytes.clone();
        length = bytes.length;
    }

    /**
     * Shortens the content.
     *
     * @param newLength new length, at most the current length
     */
    public void truncate(int newLength) {
        ensureOpen();
        Objects.checkIndex(newLength, length + 1);
        length = newLength;
    }

    /**
     * Copies the current content.
     *
     * @return copy of the buffer
     */
    public byte[] toByteArray() {
        ensureOpen();
        return Arrays.copyOf(buffer, length);
    }

    /**
     * Stores the buffer and refreshes length and digest. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        store.release(id, Arrays.copyOf(buffer, length));
        buffer = null;
    }

    private void ensureCapacity(int required) {
        if (required > buffer.length) {
            int grown = Math.max(required, buffer.length + (buffer.length >> 1) + 16);
            buffer = Arrays.copyOf(buffer, grown);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("attachment handle for " + id + " is closed");
        }
    }
}
