package com.eyelevel.demandletter.dto.upload;

/**
 * A template/data pair that passed validation: sanitized filenames and decoded text.
 */
public record ValidatedUpload(String txtFilename, String csvFilename, String txtContent, String csvContent) {
}
