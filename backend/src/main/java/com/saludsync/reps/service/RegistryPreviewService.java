package com.saludsync.reps.service;

import com.saludsync.reps.dto.RawRow;
import com.saludsync.reps.dto.RegistryPreviewResponse;
import com.saludsync.reps.dto.RepsTable;
import com.saludsync.reps.dto.SyncFile;
import com.saludsync.reps.model.RowKind;
import com.saludsync.reps.service.RowValidator.RowValidationResult;
import com.saludsync.reps.util.RegistryCodeSanitizer;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Parses and validates the first rows of a REPS file without touching the database. */
@Service
public class RegistryPreviewService {

    static final int MAX_PREVIEW_ROWS = 20;

    private final RepsTableReader tableReader;
    private final RowValidator rowValidator;
    private final FacilityMapper facilityMapper;

    public RegistryPreviewService(RepsTableReader tableReader, RowValidator rowValidator, FacilityMapper facilityMapper) {
        this.tableReader = tableReader;
        this.rowValidator = rowValidator;
        this.facilityMapper = facilityMapper;
    }

    public RegistryPreviewResponse preview(RowKind kind, SyncFile file, int limit) {
        Objects.requireNonNull(file, "file must not be null");
        if (kind == null || kind == RowKind.RUN) {
            throw new IllegalArgumentException("Preview kind must be FACILITIES, SERVICES or CAPACITY");
        }
        int max = (limit <= 0 || limit > MAX_PREVIEW_ROWS) ? MAX_PREVIEW_ROWS : limit;
        RepsTable table = tableReader.read(file.content(), file.name());

        List<RegistryPreviewResponse.PreviewRow> rows = new ArrayList<>();
        for (RawRow raw : table) {
            if (rows.size() >= max) break;
            RowValidationResult result = rowValidator.validate(raw, kind);
            String status = "ok";
            String reason = null;
            String code = null;
            if (!result.isValid()) {
                status = "error";
                reason = "campos requeridos faltantes: " + String.join(", ", result.getErrors());
            } else {
                code = facilityMapper.naturalKey(result);
                if (!RegistryCodeSanitizer.isValid(code)) {
                    reason = RegistryCodeSanitizer.formatIssue(code);
                }
            }
            rows.add(new RegistryPreviewResponse.PreviewRow(result.getRowIndex(), code, result.getData(), status, reason));
        }
        return new RegistryPreviewResponse(table.getFileName(), kind.name(), table.size(), table.getHeaders(), rows);
    }
}
