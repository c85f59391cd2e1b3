package com.eyelevel.demandletter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.util.Set;

/**
 * Binds application properties under the "app.processing" prefix to a strongly-typed
 * configuration object covering uploads, dispatch, persistence retries and the history view.
 */
@Data
@ConfigurationProperties(prefix = "app.processing")
public class DemandLetterConfig {

    /**
     * Combined size cap for the template and data files.
     */
    private DataSize maxUploadSize = DataSize.ofMegabytes(16);
    private Set<String> templateExtensions = Set.of("txt");
    private Set<String> dataExtensions = Set.of("csv");

    /**
     * Name given to generated documents; {@code %d} is replaced by the job ID.
     */
    private String docxFilenamePattern = "demand_letter_%d.docx";

    private Dispatch dispatch = new Dispatch();
    private Store store = new Store();
    private History history = new History();

    @Data
    public static class RetryConfig {
        private int attempts;
        private long delayMs;
    }

    @Data
    public static class Dispatch {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 500;
    }

    @Data
    public static class Store {
        private RetryConfig retry = new RetryConfig();
    }

    @Data
    public static class History {
        private boolean caseSensitiveFilenameMatch = false;
        private int defaultLimit = 100;
        private int maxLimit = 1000;
    }

    public String docxFilenameFor(long jobId) {
        return String.format(docxFilenamePattern, jobId);
    }
}
