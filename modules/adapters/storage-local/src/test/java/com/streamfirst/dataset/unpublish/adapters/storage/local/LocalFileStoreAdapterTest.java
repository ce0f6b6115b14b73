package com.streamfirst.dataset.unpublish.adapters.storage.local;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalFileStoreAdapterTest {

    @TempDir Path root;

    private LocalFileStoreAdapter store;

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(root.resolve("1"));
        Files.writeString(root.resolve("1/cmip5.output.tas.v1.xml"), "<catalog/>");
        store = new LocalFileStoreAdapter(root);
    }

    @Test
    void deletesExistingCatalogFile() {
        assertThat(store.exists("1/cmip5.output.tas.v1.xml")).isTrue();

        assertThat(store.delete("1/cmip5.output.tas.v1.xml")).isTrue();

        assertThat(store.exists("1/cmip5.output.tas.v1.xml")).isFalse();
        assertThat(Files.exists(root.resolve("1/cmip5.output.tas.v1.xml"))).isFalse();
    }

    @Test
    void deletingMissingFileIsNoOp() {
        assertThat(store.delete("1/missing.xml")).isFalse();
    }

    @Test
    void directoriesAreNotCatalogFiles() {
        assertThat(store.exists("1")).isFalse();
    }

    @Test
    void locationsMayNotEscapeRoot() {
        assertThatThrownBy(() -> store.delete("../outside.xml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("outside the store root");
    }
}
