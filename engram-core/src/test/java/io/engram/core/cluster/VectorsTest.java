package io.engram.core.cluster;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class VectorsTest {

    @Test
    void arrayAndListFormsShouldAgree() {
        List<Double> a = List.of(0.6, 0.8, 0.0);
        List<Double> b = List.of(1.0, 0.0, 0.0);

        assertThat(Vectors.cosine(a, b)).isCloseTo(0.6, within(1e-9));
        assertThat(Vectors.cosine(new double[] {0.6, 0.8, 0.0}, b)).isCloseTo(0.6, within(1e-9));
    }

    @Test
    void mismatchedOrEmptyVectorsShouldScoreZero() {
        assertThat(Vectors.cosine(new double[] {1.0, 0.0}, List.of(1.0, 0.0, 0.0))).isZero();
        assertThat(Vectors.cosine(new double[0], List.of())).isZero();
        assertThat(Vectors.cosine(new double[] {0.0, 0.0}, List.of(1.0, 1.0))).isZero();
    }

    @Test
    void clusterSimilarityShouldUseTheRunningCentroid() {
        ThematicCluster cluster = ThematicCluster.seed("c1", "Theme", "", "u1", List.of(1.0, 0.0), Instant.EPOCH);
        cluster.absorb("u2", List.of(0.0, 1.0), null, Instant.EPOCH);

        assertThat(cluster.similarityTo(List.of(1.0, 1.0))).isCloseTo(1.0, within(1e-9));
        assertThat(cluster.similarityTo(List.of(1.0, 0.0))).isCloseTo(Math.sqrt(0.5), within(1e-9));
    }
}
