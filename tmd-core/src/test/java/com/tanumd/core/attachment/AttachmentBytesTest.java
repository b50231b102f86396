package com.tanumd.core.attachment;

import com.tanumd.core.model.AttachmentMeta;
import com.tanumd.core.util.Digests;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AttachmentBytes} and the edit lock it holds on {@link AttachmentStore}.
 */
class AttachmentBytesTest {

    private AttachmentStore store;
    private UUID id;

    @BeforeEach
    void setUp() {
        store = new AttachmentStore();
        id = store.insert(UUID.randomUUID(), "data/notes.txt", "text/plain", bytes("hello"));
    }

    @Test
    void close_recomputesLengthAndDigest() {
        // When
        try (AttachmentBytes data = store.mutateBytes(id)) {
            data.append(bytes(", world"));
        }

        // Then
        AttachmentMeta meta = store.lookupById(id).orElseThrow();
        assertThat(meta.length()).isEqualTo(12);
        assertThat(meta.sha256()).isEqualTo(Digests.sha256Hex(bytes("hello, world")));
    }

    @Test
    void editsAreInvisibleUntilClose() {
        AttachmentBytes data = store.mutateBytes(id);
        data.replace(bytes("bye"));

        assertThat(store.lookupById(id)).map(AttachmentMeta::length).contains(5L);
        assertThat(store.isEditing()).isTrue();

        data.close();

        assertThat(store.lookupById(id)).map(AttachmentMeta::length).contains(3L);
        assertThat(store.isEditing()).isFalse();
    }

    @Test
    void whileOpen_otherAccessFails() {
        try (AttachmentBytes ignored = store.mutateBytes(id)) {
            assertThatThrownBy(() -> store.read(id)).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> store.openStream(id)).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> store.mutateBytes(id)).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> store.rename(id, "data/other.txt")).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> store.remove(id)).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(store::deepCopy).isInstanceOf(IllegalStateException.class);
        }

        assertThat(store.read(id)).isPresent();
    }

    @Test
    void write_pastEndGrowsBuffer() {
        try (AttachmentBytes data = store.mutateBytes(id)) {
            data.write(3, bytes("p me"));

            assertThat(data.length()).isEqualTo(7);
            assertThat(new String(data.toByteArray(), StandardCharsets.US_ASCII)).isEqualTo("help me");
        }
    }

    @Test
    void write_offsetBeyondLength_throws() {
        try (AttachmentBytes data = store.mutateBytes(id)) {
            assertThatThrownBy(() -> data.write(6, bytes("x"))).isInstanceOf(IndexOutOfBoundsException.class);
        }
    }

    @Test
    void setAndTruncate_updateContent() {
        try (AttachmentBytes data = store.mutateBytes(id)) {
            data.set(0, (byte) 'j');
            data.truncate(4);
            assertThat(data.get(0)).isEqualTo((byte) 'j');
        }

        assertThat(store.lookupById(id)).map(AttachmentMeta::sha256).contains(Digests.sha256Hex(bytes("jell")));
    }

    @Test
    void useAfterClose_throws() {
        AttachmentBytes data = store.mutateBytes(id);
        data.close();
        data.close();

        assertThatThrownBy(data::length).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> data.append(bytes("x"))).isInstanceOf(IllegalStateException.class);
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.US_ASCII);
    }
}
