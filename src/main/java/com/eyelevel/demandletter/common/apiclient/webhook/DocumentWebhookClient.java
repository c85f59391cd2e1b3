package com.eyelevel.demandletter.common.apiclient.webhook;

import com.eyelevel.demandletter.common.apiclient.ApiClient;
import com.eyelevel.demandletter.common.apiclient.authentication.Authentication;
import com.eyelevel.demandletter.common.apiclient.model.ApiRequest;
import com.eyelevel.demandletter.common.apiclient.model.ApiResponse;
import com.eyelevel.demandletter.exception.apiclient.ApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.charset.StandardCharsets;

/**
 * Client for the document-generation webhook.
 * <p>
 * The webhook may take arbitrarily long to render a letter, so requests carry no timeout. Callers
 * must never invoke this from a request-serving thread.
 */
@Slf4j
@Service
public class DocumentWebhookClient extends ApiClient {

    static final String TEMPLATE_PART = "txt_file";
    static final String DATA_PART = "csv_file";
    static final String TEMPLATE_FILENAME = "document.txt";
    static final String DATA_FILENAME = "data.csv";

    @Value("${app.webhook.document.path}")
    private String generatePath;

    public DocumentWebhookClient(
            @Qualifier("documentWebhookWebClient") final WebClient webClient,
            @Qualifier("webhookAuthentication") final Authentication authentication) {
        super(webClient, authentication);
    }

    /**
     * Sends the template and data to the webhook and waits, without a deadline, for the generated document.
     *
     * @param jobId       The job being processed, for logging.
     * @param txtContent  The template text.
     * @param csvContent  The CSV data.
     * @return The webhook's 2xx response; its body is the generated document.
     * @throws ApiException if the webhook is unreachable or answers with a non-2xx status.
     */
    public ApiResponse generateDocument(final long jobId, final String txtContent, final String csvContent) {
        final byte[] templateBytes = txtContent.getBytes(StandardCharsets.UTF_8);
        final byte[] dataBytes = csvContent.getBytes(StandardCharsets.UTF_8);
        log.info("Sending job {} to the document webhook ({} + {} bytes).", jobId,
                templateBytes.length, dataBytes.length);
        return call(ApiRequest.builder()
                .method(HttpMethod.POST)
                .path(generatePath)
                .body(buildMultipartBody(templateBytes, dataBytes))
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .acceptMediaType(MediaType.ALL)
                .build());
    }

    private static Object buildMultipartBody(final byte[] templateBytes, final byte[] dataBytes) {
        final MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part(TEMPLATE_PART, templateBytes)
                .filename(TEMPLATE_FILENAME)
                .contentType(MediaType.TEXT_PLAIN);
        builder.part(DATA_PART, dataBytes)
                .filename(DATA_FILENAME)
                .contentType(MediaType.parseMediaType("text/csv"));
        return builder.build();
    }
}
