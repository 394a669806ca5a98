package com.libragraph.contentstore.util.buffer;

import com.libragraph.contentstore.util.ContentHash;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class RamBufferTest {

    private static final String ABC_SHA256 =
            "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";
    private static final String EMPTY_SHA256 =
            "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";

    @Test
    void shouldReadAndWrite() throws Exception {
        Buffer buf = Buffer.allocate(64);
        buf.write(ByteBuffer.wrap("Hello".getBytes()));

        assertThat(buf.size()).isEqualTo(5);

        buf.position(0);
        ByteBuffer dst = ByteBuffer.allocate(5);
        buf.read(dst);
        dst.flip();
        assertThat(new String(dst.array(), 0, dst.remaining())).isEqualTo("Hello");
    }

    @Test
    void shouldComputeSha256Incrementally() throws Exception {
        Buffer buf = Buffer.allocate(64);
        buf.write(ByteBuffer.wrap("a".getBytes(StandardCharsets.US_ASCII)));
        buf.write(ByteBuffer.wrap("bc".getBytes(StandardCharsets.US_ASCII)));

        ContentHash hash = buf.hash();
        assertThat(hash.toHex()).isEqualTo(ABC_SHA256);

        // Calling again returns cached value
        assertThat(buf.hash()).isEqualTo(hash);
    }

    @Test
    void emptyBufferHashesEmptyInput() {
        assertThat(Buffer.allocate(0).hash().toHex()).isEqualTo(EMPTY_SHA256);
    }

    @Test
    void wrappedArrayHashesContents() {
        RamBuffer buf = new RamBuffer("abc".getBytes(StandardCharsets.US_ASCII));
        assertThat(buf.size()).isEqualTo(3);
        assertThat(buf.hash().toHex()).isEqualTo(ABC_SHA256);
    }

    @Test
    void appendAfterHashExtendsDigest() throws Exception {
        Buffer buf = Buffer.allocate(8);
        buf.write(ByteBuffer.wrap("ab".getBytes(StandardCharsets.US_ASCII)));
        ContentHash partial = buf.hash();

        buf.write(ByteBuffer.wrap("c".getBytes(StandardCharsets.US_ASCII)));

        assertThat(buf.hash()).isNotEqualTo(partial);
        assertThat(buf.hash().toHex()).isEqualTo(ABC_SHA256);
    }

    @Test
    void rejectsWriteBeforeEnd() throws Exception {
        Buffer buf = Buffer.allocate(64);
        buf.write(ByteBuffer.wrap("Hello".getBytes()));
        ContentHash hash = buf.hash();

        buf.position(0);
        assertThatThrownBy(() -> buf.write(ByteBuffer.wrap("World".getBytes())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("append-only");

        assertThat(buf.size()).isEqualTo(5);
        assertThat(buf.hash()).isEqualTo(hash);
    }

    @Test
    void truncateIsUnsupported() throws Exception {
        Buffer buf = Buffer.allocate(64);
        buf.write(ByteBuffer.wrap("Hello, World!".getBytes()));

        assertThatThrownBy(() -> buf.truncate(5)).isInstanceOf(UnsupportedOperationException.class);
        assertThat(buf.size()).isEqualTo(13);
    }

    @Test
    void appendAfterReadContinuesHash() throws Exception {
        Buffer buf = Buffer.allocate(8);
        buf.write(ByteBuffer.wrap("ab".getBytes(StandardCharsets.US_ASCII)));

        buf.position(0);
        buf.read(ByteBuffer.allocate(1));
        buf.position(buf.size());
        buf.write(ByteBuffer.wrap("c".getBytes(StandardCharsets.US_ASCII)));

        assertThat(buf.hash().toHex()).isEqualTo(ABC_SHA256);
    }

    @Test
    void shouldGrowAutomatically() throws Exception {
        Buffer buf = Buffer.allocate(4);
        byte[] data = "Hello, this is longer than 4 bytes".getBytes();
        buf.write(ByteBuffer.wrap(data));

        assertThat(buf.size()).isEqualTo(data.length);

        buf.position(0);
        ByteBuffer dst = ByteBuffer.allocate(data.length);
        buf.read(dst);
        dst.flip();
        byte[] result = new byte[dst.remaining()];
        dst.get(result);
        assertThat(new String(result)).isEqualTo("Hello, this is longer than 4 bytes");
    }

    @Test
    void shouldReturnEofWhenExhausted() throws Exception {
        Buffer buf = Buffer.allocate(8);
        buf.write(ByteBuffer.wrap("AB".getBytes()));

        buf.position(0);
        ByteBuffer dst = ByteBuffer.allocate(2);
        assertThat(buf.read(dst)).isEqualTo(2);

        dst.clear();
        assertThat(buf.read(dst)).isEqualTo(-1);
    }

    @Test
    void inputStreamReadsFromOffset() throws Exception {
        Buffer buf = Buffer.allocate(8);
        buf.write(ByteBuffer.wrap("Hello".getBytes()));

        assertThat(new String(buf.inputStream(1).readAllBytes())).isEqualTo("ello");
    }
}
