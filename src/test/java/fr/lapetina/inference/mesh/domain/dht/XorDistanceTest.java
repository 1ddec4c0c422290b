package fr.lapetina.inference.mesh.domain.dht;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class XorDistanceTest {

    @Test
    @DisplayName("should be symmetric")
    void shouldBeSymmetric() {
        for (int i = 0; i < 20; i++) {
            String a = "node-" + i;
            String b = "peer-" + (i * 7);
            assertThat(XorDistance.distance(a, b)).isEqualTo(XorDistance.distance(b, a));
        }
    }

    @Test
    @DisplayName("should be zero only for identical ids")
    void shouldBeZeroForIdenticalIds() {
        assertThat(XorDistance.distance("node-1", "node-1")).isZero();
        assertThat(XorDistance.distance("node-1", "node-2")).isNotZero();
    }

    @Test
    @DisplayName("should hash deterministically")
    void shouldHashDeterministically() {
        assertThat(XorDistance.hash("node-1")).isEqualTo(XorDistance.hash("node-1"));
        assertThat(XorDistance.hash("node-1")).isNotEqualTo(XorDistance.hash("node-2"));
    }

    @Test
    @DisplayName("should map distances to bucket indexes by bit length")
    void shouldComputeBucketIndex() {
        assertThat(XorDistance.bucketIndex(0L)).isZero();
        assertThat(XorDistance.bucketIndex(1L)).isEqualTo(1);
        assertThat(XorDistance.bucketIndex(0b1000L)).isEqualTo(4);
        assertThat(XorDistance.bucketIndex(-1L)).isEqualTo(64);
    }
}
