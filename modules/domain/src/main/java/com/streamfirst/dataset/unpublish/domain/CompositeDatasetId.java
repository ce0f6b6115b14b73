package com.streamfirst.dataset.unpublish.domain;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifier of the form {@code master_id.version|data_node} used by the search index of the
 * registry. The version segment may carry a leading "v".
 *
 * @param name the dataset name (master id)
 * @param version the parsed version, or the fallback passed to {@link #parse}
 * @param dataNode the data node, or null when the identifier has no node segment
 */
public record CompositeDatasetId(String name, int version, String dataNode) {
    private static final Pattern VERSION_SUFFIX = Pattern.compile("^(.+)\\.v?(\\d+)$");

    /**
     * Parses a composite identifier. When the dataset part has no numeric version suffix the whole
     * part is taken as the name and {@code fallbackVersion} is kept.
     */
    public static CompositeDatasetId parse(String identifier, int fallbackVersion) {
        String datasetPart = identifier;
        String node = null;
        int bar = identifier.indexOf('|');
        if (bar >= 0) {
            datasetPart = identifier.substring(0, bar);
            node = identifier.substring(bar + 1);
            if (node.isBlank()) {
                node = null;
            }
        }

        Matcher matcher = VERSION_SUFFIX.matcher(datasetPart);
        if (matcher.matches()) {
            try {
                return new CompositeDatasetId(matcher.group(1), Integer.parseInt(matcher.group(2)), node);
            } catch (NumberFormatException e) {
                // too many digits for a version number; treat the whole part as the name
                return new CompositeDatasetId(datasetPart, fallbackVersion, node);
            }
        }
        return new CompositeDatasetId(datasetPart, fallbackVersion, node);
    }

    public Optional<String> getDataNode() {
        return Optional.ofNullable(dataNode);
    }
}
