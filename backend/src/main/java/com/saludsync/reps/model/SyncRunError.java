package com.saludsync.reps.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "sync_run_error")
public class SyncRunError {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "sync_run_id", foreignKey = @ForeignKey(name = "fk_sync_run_error_run"))
    private SyncRun syncRun;

    @Enumerated(EnumType.STRING)
    @Column(name = "row_kind", length = 16)
    private RowKind kind;

    @Column(name = "row_num")
    private Integer rowNumber;

    @Lob
    private String payload;

    @Column(length = 2000)
    private String reason;

    @Column(name = "created_at")
    private Instant createdAt;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public SyncRun getSyncRun() { return syncRun; }
    public void setSyncRun(SyncRun syncRun) { this.syncRun = syncRun; }
    public RowKind getKind() { return kind; }
    public void setKind(RowKind kind) { this.kind = kind; }
    public Integer getRowNumber() { return rowNumber; }
    public void setRowNumber(Integer rowNumber) { this.rowNumber = rowNumber; }
    public String getPayload() { return payload; }
    public void setPayload(String payload) { this.payload = payload; }
    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
