package com.streamfirst.dataset.unpublish.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CompositeDatasetIdTest {

    @Test
    void parsesNameVersionAndNode() {
        var id = CompositeDatasetId.parse("cmip5.output1.tas.v20120101|esg.node.org", -1);

        assertThat(id.name()).isEqualTo("cmip5.output1.tas");
        assertThat(id.version()).isEqualTo(20120101);
        assertThat(id.getDataNode()).contains("esg.node.org");
    }

    @Test
    void acceptsVersionWithoutPrefix() {
        var id = CompositeDatasetId.parse("obs.radar.3|node", -1);

        assertThat(id.name()).isEqualTo("obs.radar");
        assertThat(id.version()).isEqualTo(3);
    }

    @Test
    void missingNodeStillParsesNameAndVersion() {
        var id = CompositeDatasetId.parse("obs.radar.v2", -1);

        assertThat(id.name()).isEqualTo("obs.radar");
        assertThat(id.version()).isEqualTo(2);
        assertThat(id.getDataNode()).isEmpty();
    }

    @Test
    void emptyNodeSegmentCountsAsMissing() {
        assertThat(CompositeDatasetId.parse("obs.radar.v2|", -1).getDataNode()).isEmpty();
    }

    @Test
    void keepsFallbackVersionWithoutNumericSuffix() {
        var id = CompositeDatasetId.parse("obs.radar.latest|node", 7);

        assertThat(id.name()).isEqualTo("obs.radar.latest");
        assertThat(id.version()).isEqualTo(7);
    }
}
