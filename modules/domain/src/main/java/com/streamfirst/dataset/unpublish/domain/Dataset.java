package com.streamfirst.dataset.unpublish.domain;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * A published dataset as recorded in the local catalog. Versions are kept ordered by version
 * number; a dataset row only exists while at least one version was published for it.
 *
 * <p>Instances are snapshots: deleting versions through a catalog session does not change an
 * already loaded dataset.
 */
@Value
@EqualsAndHashCode(of = "name")
public class Dataset {
    /** Version number meaning "every version of the dataset". */
    public static final int ALL_VERSIONS = -1;

    @NonNull String name;

    /** Versions ordered by ascending version number */
    @NonNull List<DatasetVersion> versions;

    public Dataset(@NonNull String name, @NonNull List<DatasetVersion> versions) {
        for (DatasetVersion version : versions) {
            if (!version.datasetName().equals(name)) {
                throw new IllegalArgumentException(
                        "Version " + version + " does not belong to dataset " + name);
            }
        }
        this.name = name;
        this.versions =
                versions.stream().sorted(Comparator.comparingInt(DatasetVersion::version)).toList();
    }

    /** Creates a dataset with the given version numbers. */
    public static Dataset of(String name, int... versionNumbers) {
        List<DatasetVersion> versions =
                Arrays.stream(versionNumbers)
                        .mapToObj(number -> new DatasetVersion(name, number))
                        .toList();
        return new Dataset(name, versions);
    }

    public Optional<DatasetVersion> findVersion(int version) {
        return versions.stream().filter(v -> v.version() == version).findFirst();
    }

    /**
     * Returns the highest version number currently present, or {@link #ALL_VERSIONS} when the
     * dataset has no versions left.
     */
    public int latestVersionNumber() {
        return versions.isEmpty() ? ALL_VERSIONS : versions.get(versions.size() - 1).version();
    }

    public boolean isLatest(DatasetVersion version) {
        return !versions.isEmpty() && version.version() == latestVersionNumber();
    }

    public int versionCount() {
        return versions.size();
    }

    @Override
    public String toString() {
        return "Dataset{name='" + name + "', versions=" + versions + '}';
    }
}
