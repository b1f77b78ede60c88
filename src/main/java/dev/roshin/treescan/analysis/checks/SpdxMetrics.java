package dev.roshin.treescan.analysis.checks;

import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Iterables;
import dev.roshin.treescan.analysis.aggregate.MergeableMetrics;

import java.util.SortedSet;

/**
 * SPDX license tag findings.
 *
 * @param filesChecked           Files analyzed
 * @param filesWithSpdx          Files carrying at least one recognised SPDX tag
 * @param validIdentifiers       Current SPDX identifiers found
 * @param deprecatedIdentifiers  Deprecated SPDX identifiers found
 * @param unknownIdentifiers     Tag values that are not SPDX identifiers, at most {@value #LIST_LIMIT}
 * @param taggedFiles            Files with a recognised tag, the first {@value #LIST_LIMIT} by path
 */
public record SpdxMetrics(
        int filesChecked,
        int filesWithSpdx,
        SortedSet<String> validIdentifiers,
        SortedSet<String> deprecatedIdentifiers,
        SortedSet<String> unknownIdentifiers,
        SortedSet<String> taggedFiles
) implements MergeableMetrics<SpdxMetrics> {

    public static final int LIST_LIMIT = 20;

    public static final SpdxMetrics EMPTY = new SpdxMetrics(0, 0,
            ImmutableSortedSet.of(), ImmutableSortedSet.of(), ImmutableSortedSet.of(), ImmutableSortedSet.of());

    public SpdxMetrics {
        validIdentifiers = ImmutableSortedSet.copyOf(validIdentifiers);
        deprecatedIdentifiers = ImmutableSortedSet.copyOf(deprecatedIdentifiers);
        unknownIdentifiers = limit(unknownIdentifiers);
        taggedFiles = limit(taggedFiles);
    }

    @Override
    public SpdxMetrics merge(SpdxMetrics other) {
        return new SpdxMetrics(
                filesChecked + other.filesChecked,
                filesWithSpdx + other.filesWithSpdx,
                union(validIdentifiers, other.validIdentifiers),
                union(deprecatedIdentifiers, other.deprecatedIdentifiers),
                union(unknownIdentifiers, other.unknownIdentifiers),
                union(taggedFiles, other.taggedFiles)
        );
    }

    public boolean hasValidIdentifier() {
        return !validIdentifiers.isEmpty();
    }

    private static SortedSet<String> union(SortedSet<String> left, SortedSet<String> right) {
        return ImmutableSortedSet.<String>naturalOrder().addAll(left).addAll(right).build();
    }

    private static SortedSet<String> limit(SortedSet<String> values) {
        return ImmutableSortedSet.copyOf(Iterables.limit(ImmutableSortedSet.copyOf(values), LIST_LIMIT));
    }
}
