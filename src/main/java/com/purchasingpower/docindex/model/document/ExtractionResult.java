package com.purchasingpower.docindex.model.document;

/**
 * Output of the extraction service for one file.
 *
 * @param extracted false when the service was not called or did not answer
 */
public record ExtractionResult(
        String title,
        String content,
        String mediaType,
        boolean extracted
) {

    /**
     * Content-less result used when extraction is skipped or has failed.
     */
    public static ExtractionResult titleOnly(String title) {
        return new ExtractionResult(title, "", "", false);
    }
}
