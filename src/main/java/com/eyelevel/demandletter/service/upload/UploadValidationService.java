package com.eyelevel.demandletter.service.upload;

import com.eyelevel.demandletter.config.DemandLetterConfig;
import com.eyelevel.demandletter.dto.upload.ValidatedUpload;
import com.eyelevel.demandletter.exception.UploadValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.Locale;
import java.util.Set;

/**
 * Checks an uploaded template/data pair before any job exists.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UploadValidationService {

    private final DemandLetterConfig config;

    /**
     * Validates both files and decodes their content.
     *
     * @param txtFile The template file part, possibly null when the part is missing.
     * @param csvFile The data file part, possibly null when the part is missing.
     * @return The sanitized filenames and decoded text.
     * @throws UploadValidationException describing the first check that failed.
     */
    public ValidatedUpload validate(final MultipartFile txtFile, final MultipartFile csvFile) {
        if (txtFile == null || csvFile == null) {
            throw new UploadValidationException("Both TXT and CSV files are required");
        }
        if (!StringUtils.hasText(txtFile.getOriginalFilename()) || !StringUtils.hasText(csvFile.getOriginalFilename())) {
            throw new UploadValidationException("Please select both files");
        }
        if (!hasAllowedExtension(txtFile.getOriginalFilename(), config.getTemplateExtensions())
                || !hasAllowedExtension(csvFile.getOriginalFilename(), config.getDataExtensions())) {
            throw new UploadValidationException("Invalid file types. Only TXT and CSV files are allowed");
        }
        if (txtFile.isEmpty() || csvFile.isEmpty()) {
            throw new UploadValidationException("Both files must be non-empty");
        }

        final long combinedSize = txtFile.getSize() + csvFile.getSize();
        if (combinedSize > config.getMaxUploadSize().toBytes()) {
            throw new UploadValidationException(String.format(
                    "Combined file size of %d bytes exceeds the limit of %d bytes",
                    combinedSize, config.getMaxUploadSize().toBytes()));
        }

        final ValidatedUpload upload = new ValidatedUpload(
                sanitizeFilename(txtFile.getOriginalFilename(), "template.txt"),
                sanitizeFilename(csvFile.getOriginalFilename(), "data.csv"),
                decodeUtf8(txtFile),
                decodeUtf8(csvFile));
        log.debug("Upload '{}' + '{}' passed validation ({} bytes).", upload.txtFilename(), upload.csvFilename(), combinedSize);
        return upload;
    }

    static boolean hasAllowedExtension(final String fileName, final Set<String> allowed) {
        final String extension = FilenameUtils.getExtension(FilenameUtils.getName(fileName));
        return StringUtils.hasText(extension) && allowed.contains(extension.toLowerCase(Locale.ROOT));
    }

    /**
     * Reduces a client-supplied name to a safe base name: the path is dropped, accents are stripped,
     * whitespace becomes {@code _} and anything outside {@code [A-Za-z0-9_.-]} is removed.
     */
    static String sanitizeFilename(final String fileName, final String fallback) {
        final String baseName = FilenameUtils.getName(fileName.replace('\\', '/'));
        final String ascii = Normalizer.normalize(baseName, Normalizer.Form.NFKD).replaceAll("\\p{M}", "");
        final String cleaned = ascii.trim()
                .replaceAll("\\s+", "_")
                .replaceAll("[^A-Za-z0-9_.-]", "")
                .replaceAll("^[._]+|[._]+$", "");
        return StringUtils.hasText(cleaned) ? cleaned : fallback;
    }

    private static String decodeUtf8(final MultipartFile file) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(file.getBytes()))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new UploadValidationException("File '" + file.getOriginalFilename() + "' is not valid UTF-8 text");
        } catch (IOException e) {
            throw new UploadValidationException("File '" + file.getOriginalFilename() + "' could not be read: " + e.getMessage());
        }
    }
}
