package com.streamfirst.dataset.unpublish.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatasetTest {

    @Test
    void ordersVersionsByNumber() {
        Dataset dataset =
                new Dataset(
                        "d",
                        List.of(
                                new DatasetVersion("d", 3),
                                new DatasetVersion("d", 1),
                                new DatasetVersion("d", 2)));

        assertThat(dataset.getVersions()).extracting(DatasetVersion::version).containsExactly(1, 2, 3);
        assertThat(dataset.latestVersionNumber()).isEqualTo(3);
        assertThat(dataset.isLatest(new DatasetVersion("d", 3))).isTrue();
        assertThat(dataset.isLatest(new DatasetVersion("d", 2))).isFalse();
    }

    @Test
    void gapsInNumberingDoNotMatter() {
        Dataset dataset = Dataset.of("d", 1, 5);

        assertThat(dataset.latestVersionNumber()).isEqualTo(5);
        assertThat(dataset.findVersion(3)).isEmpty();
        assertThat(dataset.findVersion(5)).contains(new DatasetVersion("d", 5));
    }

    @Test
    void rejectsVersionsOfOtherDatasets() {
        assertThatThrownBy(() -> new Dataset("d", List.of(new DatasetVersion("e", 1))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void versionNameCarriesNumber() {
        assertThat(new DatasetVersion("cmip5.tas", 4).versionName()).isEqualTo("cmip5.tas.v4");
    }
}
