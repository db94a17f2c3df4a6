package com.purchasingpower.docindex.model.document;

import java.nio.file.Path;

/**
 * An eligible file together with the categories derived from its position under the root.
 *
 * @param relativeSubpath directory of the file relative to the level-2 directory, "" when the
 *                        file sits directly inside it
 */
public record ClassifiedFile(
        Path path,
        String fileName,
        String extension,
        String level1,
        String level2,
        String relativeSubpath
) {

    /**
     * File name without its extension.
     */
    public String stem() {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
