package com.eyelevel.demandletter.dto.history;

import com.eyelevel.demandletter.exception.apiclient.BadRequestException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * Columns the job history can be ordered by. The value is the entity attribute name.
 */
@Getter
@RequiredArgsConstructor
public enum HistorySortKey {
    UPLOAD_TIMESTAMP("uploadTimestamp"),
    ID("id"),
    TXT_FILENAME("txtFilename"),
    CSV_FILENAME("csvFilename"),
    STATUS("status");

    private final String attribute;

    /**
     * Resolves a sort key from either its attribute name ({@code uploadTimestamp}) or its constant name
     * ({@code UPLOAD_TIMESTAMP}), ignoring case.
     */
    public static HistorySortKey from(String value) {
        return Arrays.stream(values())
                .filter(key -> key.attribute.equalsIgnoreCase(value) || key.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new BadRequestException("Unsupported sort key '" + value + "'."));
    }
}
