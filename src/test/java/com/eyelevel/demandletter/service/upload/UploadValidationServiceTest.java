package com.eyelevel.demandletter.service.upload;

import com.eyelevel.demandletter.config.DemandLetterConfig;
import com.eyelevel.demandletter.dto.upload.ValidatedUpload;
import com.eyelevel.demandletter.exception.UploadValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.util.unit.DataSize;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class UploadValidationServiceTest {

    private DemandLetterConfig config;
    private UploadValidationService service;

    @BeforeEach
    void setUp() {
        config = new DemandLetterConfig();
        service = new UploadValidationService(config);
    }

    private static MockMultipartFile txt(String name, String content) {
        return new MockMultipartFile("txt_file", name, "text/plain", content.getBytes(StandardCharsets.UTF_8));
    }

    private static MockMultipartFile csv(String name, String content) {
        return new MockMultipartFile("csv_file", name, "text/csv", content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void acceptsValidPairAndDecodesContent() {
        ValidatedUpload upload = service.validate(txt("template.txt", "Dear {{name}},"), csv("data.csv", "name\nAda"));

        assertEquals("template.txt", upload.txtFilename());
        assertEquals("data.csv", upload.csvFilename());
        assertEquals("Dear {{name}},", upload.txtContent());
        assertEquals("name\nAda", upload.csvContent());
    }

    @Test
    void extensionCheckIgnoresCase() {
        ValidatedUpload upload = service.validate(txt("LETTER.TXT", "x"), csv("Rows.Csv", "y"));
        assertEquals("LETTER.TXT", upload.txtFilename());
    }

    @Test
    void rejectsMissingPart() {
        UploadValidationException ex = assertThrows(UploadValidationException.class,
                () -> service.validate(txt("template.txt", "x"), null));
        assertEquals("Both TXT and CSV files are required", ex.getMessage());
        assertEquals(400, ex.getStatusCode());
    }

    @Test
    void rejectsBlankFilename() {
        UploadValidationException ex = assertThrows(UploadValidationException.class,
                () -> service.validate(txt("", "x"), csv("data.csv", "y")));
        assertEquals("Please select both files", ex.getMessage());
    }

    @Test
    void rejectsWrongExtensions() {
        UploadValidationException ex = assertThrows(UploadValidationException.class,
                () -> service.validate(txt("letter.pdf", "x"), csv("data.csv", "y")));
        assertEquals("Invalid file types. Only TXT and CSV files are allowed", ex.getMessage());

        assertThrows(UploadValidationException.class,
                () -> service.validate(txt("template.txt", "x"), csv("data.txt", "y")));
        assertThrows(UploadValidationException.class,
                () -> service.validate(txt("template", "x"), csv("data.csv", "y")));
    }

    @Test
    void rejectsEmptyFile() {
        UploadValidationException ex = assertThrows(UploadValidationException.class,
                () -> service.validate(txt("template.txt", ""), csv("data.csv", "y")));
        assertEquals("Both files must be non-empty", ex.getMessage());
    }

    @Test
    void rejectsOversizedPair() {
        config.setMaxUploadSize(DataSize.ofBytes(10));

        UploadValidationException ex = assertThrows(UploadValidationException.class,
                () -> service.validate(txt("template.txt", "123456"), csv("data.csv", "12345")));
        assertTrue(ex.getMessage().contains("exceeds the limit of 10 bytes"));
    }

    @Test
    void acceptsPairExactlyAtTheLimit() {
        config.setMaxUploadSize(DataSize.ofBytes(11));

        ValidatedUpload upload = service.validate(txt("template.txt", "123456"), csv("data.csv", "12345"));
        assertEquals("123456", upload.txtContent());
    }

    @Test
    void rejectsContentThatIsNotUtf8() {
        MockMultipartFile latin1 = new MockMultipartFile("csv_file", "data.csv", "text/csv",
                new byte[]{'n', 'a', 'm', 'e', '\n', (byte) 0xE9, (byte) 0xFF});

        UploadValidationException ex = assertThrows(UploadValidationException.class,
                () -> service.validate(txt("template.txt", "x"), latin1));
        assertEquals("File 'data.csv' is not valid UTF-8 text", ex.getMessage());
    }

    @Test
    void sanitizeFilenameStripsPathsAndUnsafeCharacters() {
        assertEquals("pass_wd.txt", UploadValidationService.sanitizeFilename("../../etc/pass wd.txt", "template.txt"));
        assertEquals("notes.txt", UploadValidationService.sanitizeFilename("C:\\Users\\ada\\notes.txt", "template.txt"));
        assertEquals("resume.csv", UploadValidationService.sanitizeFilename("résumé.csv", "data.csv"));
        assertEquals("data.csv", UploadValidationService.sanitizeFilename("???", "data.csv"));
    }
}
