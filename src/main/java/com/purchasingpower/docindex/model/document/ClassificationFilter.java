package com.purchasingpower.docindex.model.document;

import com.purchasingpower.docindex.configuration.DocumentsProperties;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Process-wide eligibility rules, fixed at startup.
 *
 * @param allowedExtensions lower-case extensions without the leading dot
 * @param level1            allowed first-level categories, empty for all
 * @param level2            allowed second-level categories, empty for all
 * @param maxDocs           discovery cap, 0 for unlimited
 */
public record ClassificationFilter(
        Set<String> allowedExtensions,
        Set<String> level1,
        Set<String> level2,
        int maxDocs
) {

    public ClassificationFilter {
        allowedExtensions = Set.copyOf(allowedExtensions);
        level1 = Set.copyOf(level1);
        level2 = Set.copyOf(level2);
        if (maxDocs < 0) {
            throw new IllegalArgumentException("maxDocs must be >= 0, was " + maxDocs);
        }
    }

    public static ClassificationFilter from(DocumentsProperties props) {
        Set<String> extensions = clean(props.getAllowedExtensions()).stream()
                .map(ext -> ext.startsWith(".") ? ext.substring(1) : ext)
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        return new ClassificationFilter(
                extensions,
                clean(props.getFilterLevel1()),
                clean(props.getFilterLevel2()),
                props.getMaxDocs());
    }

    public boolean allowsExtension(String extension) {
        return extension != null && allowedExtensions.contains(extension.toLowerCase(Locale.ROOT));
    }

    public boolean allowsLevel1(String category) {
        return level1.isEmpty() || level1.contains(category);
    }

    public boolean allowsLevel2(String category) {
        return level2.isEmpty() || level2.contains(category);
    }

    public boolean isCapped() {
        return maxDocs > 0;
    }

    private static Set<String> clean(Collection<String> values) {
        if (values == null) {
            return Set.of();
        }
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(String::trim)
                .collect(Collectors.toSet());
    }
}
