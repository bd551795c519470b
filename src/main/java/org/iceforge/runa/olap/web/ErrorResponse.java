package org.iceforge.runa.olap.web;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private final Instant timestamp = Instant.now();
    private final String error;
    private final String detail;
    private final String dimension; // set for boundary errors only

    public ErrorResponse(String error, String detail) {
        this(error, detail, null);
    }

    public ErrorResponse(String error, String detail, String dimension) {
        this.error = error;
        this.detail = detail;
        this.dimension = dimension;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getError() {
        return error;
    }

    public String getDetail() {
        return detail;
    }

    public String getDimension() {
        return dimension;
    }
}
