package com.eyelevel.demandletter.dto.download;

/**
 * A completed job's generated document.
 */
public record DocumentArtifact(String filename, byte[] content) {

    public static final String DOCX_MEDIA_TYPE =
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document";
}
