package org.iceforge.runa.olap.web;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Conservative shape: Skadi may return more fields. Either the rows come back inline, or only a queryId whose
 * results are fetched separately.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SkadiQueryResponse {
    private String queryId;
    private List<String> columns;
    private List<List<Object>> rows;

    public String getQueryId() {
        return queryId;
    }

    public void setQueryId(String queryId) {
        this.queryId = queryId;
    }

    public List<String> getColumns() {
        return columns;
    }

    public void setColumns(List<String> columns) {
        this.columns = columns;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public void setRows(List<List<Object>> rows) {
        this.rows = rows;
    }

    public boolean hasRows() {
        return columns != null && rows != null;
    }
}
