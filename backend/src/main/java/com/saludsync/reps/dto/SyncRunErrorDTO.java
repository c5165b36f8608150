package com.saludsync.reps.dto;

public class SyncRunErrorDTO {
    private Long id;
    private String kind;
    private Integer rowNumber;
    private String errorMessage;
    private String rawData;

    public SyncRunErrorDTO() {}

    public SyncRunErrorDTO(Long id, String kind, Integer rowNumber, String errorMessage, String rawData) {
        this.id = id;
        this.kind = kind;
        this.rowNumber = rowNumber;
        this.errorMessage = errorMessage;
        this.rawData = rawData;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getKind() { return kind; }
    public void setKind(String kind) { this.kind = kind; }
    public Integer getRowNumber() { return rowNumber; }
    public void setRowNumber(Integer rowNumber) { this.rowNumber = rowNumber; }
    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
    public String getRawData() { return rawData; }
    public void setRawData(String rawData) { this.rawData = rawData; }
}
