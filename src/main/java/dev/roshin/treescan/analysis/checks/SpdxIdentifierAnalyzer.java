package dev.roshin.treescan.analysis.checks;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import dev.roshin.treescan.analysis.core.FileAnalyzer;
import dev.roshin.treescan.analysis.core.FileContext;

import java.io.IOException;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds {@code SPDX-License-Identifier:} tags and classifies their values.
 */
public class SpdxIdentifierAnalyzer implements FileAnalyzer<SpdxMetrics> {

    private static final Pattern SPDX_TAG =
            Pattern.compile("SPDX-License-Identifier:\\s*([A-Za-z0-9.+\\-]+)", Pattern.CASE_INSENSITIVE);

    // subset of https://spdx.org/licenses/
    static final Set<String> SPDX_IDENTIFIERS = ImmutableSet.of(
            "MIT", "Apache-2.0", "GPL-3.0-only", "GPL-3.0-or-later", "GPL-2.0-only", "GPL-2.0-or-later",
            "LGPL-3.0-only", "LGPL-3.0-or-later", "LGPL-2.1-only", "LGPL-2.1-or-later",
            "BSD-3-Clause", "BSD-2-Clause", "MPL-2.0", "AGPL-3.0-only", "AGPL-3.0-or-later",
            "Unlicense", "CC0-1.0", "CC-BY-4.0", "CC-BY-SA-4.0", "ISC", "0BSD", "Zlib",
            "EPL-2.0", "EPL-1.0", "CDDL-1.0", "EUPL-1.2", "BSL-1.0"
    );

    static final Set<String> DEPRECATED_IDENTIFIERS = ImmutableSet.of(
            "GPL-3.0", "GPL-2.0", "LGPL-3.0", "LGPL-2.1", "AGPL-3.0"
    );

    @Override
    public String name() {
        return "spdx_identifiers";
    }

    @Override
    public SpdxMetrics empty() {
        return SpdxMetrics.EMPTY;
    }

    @Override
    public SpdxMetrics analyze(FileContext context) throws IOException {
        String content = context.readContent();
        Set<String> valid = new TreeSet<>();
        Set<String> deprecated = new TreeSet<>();
        Set<String> unknown = new TreeSet<>();

        Matcher matcher = SPDX_TAG.matcher(context.guard(content));
        while (matcher.find()) {
            String identifier = matcher.group(1);
            if (SPDX_IDENTIFIERS.contains(identifier)) {
                valid.add(identifier);
            } else if (DEPRECATED_IDENTIFIERS.contains(identifier)) {
                deprecated.add(identifier);
            } else {
                unknown.add(identifier);
            }
        }

        boolean tagged = !valid.isEmpty() || !deprecated.isEmpty();
        return new SpdxMetrics(
                1,
                tagged ? 1 : 0,
                ImmutableSortedSet.copyOf(valid),
                ImmutableSortedSet.copyOf(deprecated),
                ImmutableSortedSet.copyOf(unknown),
                tagged ? ImmutableSortedSet.of(context.file().relativePath()) : ImmutableSortedSet.of()
        );
    }
}
