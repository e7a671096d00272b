package fr.lapetina.embedding.accelerator.cache;

import fr.lapetina.embedding.accelerator.domain.exception.StorageUnavailableException;
import fr.lapetina.embedding.accelerator.domain.model.CacheEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.zip.GZIPOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VectorCodecTest {

    @Test
    @DisplayName("should decode exactly what was encoded")
    void shouldPreserveValues() {
        float[] vector = {0f, -0f, 1.5f, Float.MIN_VALUE, Float.MAX_VALUE, Float.NaN};

        float[] decoded = VectorCodec.decode(VectorCodec.encode(vector));

        assertThat(decoded).hasSize(vector.length);
        for (int i = 0; i < vector.length; i++) {
            assertThat(Float.floatToRawIntBits(decoded[i])).isEqualTo(Float.floatToRawIntBits(vector[i]));
        }
    }

    @Test
    @DisplayName("should compress repetitive vectors")
    void shouldCompress() {
        byte[] blob = VectorCodec.encode(new float[4096]);

        assertThat(blob.length).isLessThan(4096 * Float.BYTES);
    }

    @Test
    @DisplayName("should reject garbage blobs as storage failures")
    void shouldRejectGarbage() {
        assertThatThrownBy(() -> VectorCodec.decode(new byte[]{0, 1, 2, 3}))
                .isInstanceOf(StorageUnavailableException.class);
    }

    @Test
    @DisplayName("should carry the expiry deadline")
    void shouldCarryExpiry() {
        VectorCodec.Decoded decoded = VectorCodec.decodeEntry(VectorCodec.encode(new float[]{2f}, 123_456L));

        assertThat(decoded.expiresAt()).isEqualTo(123_456L);
        assertThat(decoded.vector()).containsExactly(2f);
    }

    @Test
    @DisplayName("should read blobs written before expiry was stored")
    void shouldReadLegacyBlobs() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(new GZIPOutputStream(bytes))) {
            out.writeInt(VectorCodec.MAGIC);
            out.writeInt(VectorCodec.LEGACY_VERSION);
            out.writeInt(2);
            out.writeFloat(1.5f);
            out.writeFloat(-2f);
        }

        VectorCodec.Decoded decoded = VectorCodec.decodeEntry(bytes.toByteArray());

        assertThat(decoded.vector()).containsExactly(1.5f, -2f);
        assertThat(decoded.expiresAt()).isEqualTo(CacheEntry.NO_EXPIRY);
    }
}
