package com.saludsync.reps.dto;

import java.util.List;
import java.util.Map;

public class RegistryPreviewResponse {
    private String fileName;
    private String kind;
    private int totalRows;
    private List<String> headers;
    private List<PreviewRow> rows;

    public RegistryPreviewResponse() {}

    public RegistryPreviewResponse(String fileName, String kind, int totalRows, List<String> headers, List<PreviewRow> rows) {
        this.fileName = fileName;
        this.kind = kind;
        this.totalRows = totalRows;
        this.headers = headers;
        this.rows = rows;
    }

    public String getFileName() { return fileName; }
    public void setFileName(String fileName) { this.fileName = fileName; }
    public String getKind() { return kind; }
    public void setKind(String kind) { this.kind = kind; }
    public int getTotalRows() { return totalRows; }
    public void setTotalRows(int totalRows) { this.totalRows = totalRows; }
    public List<String> getHeaders() { return headers; }
    public void setHeaders(List<String> headers) { this.headers = headers; }
    public List<PreviewRow> getRows() { return rows; }
    public void setRows(List<PreviewRow> rows) { this.rows = rows; }

    public static class PreviewRow {
        private int line;
        private String registryCode;
        private Map<String, String> values;
        private String status; // ok | error
        private String reason;

        public PreviewRow() {}

        public PreviewRow(int line, String registryCode, Map<String, String> values, String status, String reason) {
            this.line = line;
            this.registryCode = registryCode;
            this.values = values;
            this.status = status;
            this.reason = reason;
        }

        public int getLine() { return line; }
        public void setLine(int line) { this.line = line; }
        public String getRegistryCode() { return registryCode; }
        public void setRegistryCode(String registryCode) { this.registryCode = registryCode; }
        public Map<String, String> getValues() { return values; }
        public void setValues(Map<String, String> values) { this.values = values; }
        public String getStatus() { return status; }
        public void setStatus(String status) { this.status = status; }
        public String getReason() { return reason; }
        public void setReason(String reason) { this.reason = reason; }
    }
}
