package com.saludsync.reps.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.saludsync.reps.batch.SyncRunRegistry;
import com.saludsync.reps.dto.CapacityImportResult;
import com.saludsync.reps.dto.RepsTable;
import com.saludsync.reps.dto.SyncFile;
import com.saludsync.reps.exception.RepsParsingException;
import com.saludsync.reps.exception.RowCreationException;
import com.saludsync.reps.exception.SyncInProgressException;
import com.saludsync.reps.model.CapacityGroup;
import com.saludsync.reps.model.CapacityImportLog;
import com.saludsync.reps.model.CapacityImportStatus;
import com.saludsync.reps.model.FacilityLocation;
import com.saludsync.reps.model.InstalledCapacity;
import com.saludsync.reps.model.RowKind;
import com.saludsync.reps.repository.CapacityImportLogRepository;
import com.saludsync.reps.repository.FacilityLocationRepository;
import com.saludsync.reps.repository.HealthOrganizationRepository;
import com.saludsync.reps.repository.InstalledCapacityRepository;
import com.saludsync.reps.service.RowValidator.RowValidationResult;
import com.saludsync.reps.util.FieldNormalizer;
import com.saludsync.reps.util.RegistryCodeSanitizer;
import com.saludsync.reps.util.RepsColumns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Imports the REPS installed-capacity export (beds, rooms, ambulances...) onto the organization's existing
 * facilities. Unlike the registry sync, every row commits on its own: a bad row is reported and skipped
 * while the rest of the file still lands. Each import leaves a {@link CapacityImportLog}.
 */
@Service
public class CapacityImportService {

    private static final Logger log = LoggerFactory.getLogger(CapacityImportService.class);

    @Value("${reps.sync.max-reported-errors:50}")
    private int maxReportedErrors = 50;

    private final HealthOrganizationRepository organizationRepository;
    private final FacilityLocationRepository facilityRepository;
    private final InstalledCapacityRepository capacityRepository;
    private final CapacityImportLogRepository importLogRepository;
    private final RepsTableReader tableReader;
    private final RowValidator rowValidator;
    private final CapacityMapper capacityMapper;
    private final SyncRunRegistry runRegistry;
    private final AuditContext auditContext;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;

    public CapacityImportService(HealthOrganizationRepository organizationRepository,
                                 FacilityLocationRepository facilityRepository,
                                 InstalledCapacityRepository capacityRepository,
                                 CapacityImportLogRepository importLogRepository,
                                 RepsTableReader tableReader,
                                 RowValidator rowValidator,
                                 CapacityMapper capacityMapper,
                                 SyncRunRegistry runRegistry,
                                 AuditContext auditContext,
                                 ObjectMapper objectMapper,
                                 PlatformTransactionManager transactionManager) {
        this.organizationRepository = organizationRepository;
        this.facilityRepository = facilityRepository;
        this.capacityRepository = capacityRepository;
        this.importLogRepository = importLogRepository;
        this.tableReader = tableReader;
        this.rowValidator = rowValidator;
        this.capacityMapper = capacityMapper;
        this.runRegistry = runRegistry;
        this.auditContext = auditContext;
        this.objectMapper = objectMapper;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * @param validationOnly check every row, facility lookup included, without writing any capacity
     * @throws IllegalArgumentException when no file is given or the organization does not exist
     * @throws SyncInProgressException  when a sync or another import of the organization is running
     */
    public CapacityImportResult importCapacity(Long orgId, SyncFile file, boolean validationOnly, String requestedUser) {
        if (file == null) {
            throw new IllegalArgumentException("A REPS capacity file is required");
        }
        if (orgId == null || !organizationRepository.existsById(orgId)) {
            throw new IllegalArgumentException("Organization " + orgId + " does not exist");
        }
        // shares the sync guard: a force recreate would pull the facilities out from under the import
        if (!runRegistry.tryAcquire(orgId)) {
            throw new SyncInProgressException(orgId);
        }
        try {
            return execute(orgId, file, validationOnly, auditContext.actingUser(requestedUser));
        } finally {
            runRegistry.release(orgId);
        }
    }

    private CapacityImportResult execute(Long orgId, SyncFile file, boolean validationOnly, String actingUser) {
        ImportContext ctx = new ImportContext(startLog(orgId, file, validationOnly, actingUser), file.name(), actingUser);
        log.info("[REPS_CAPACITY] import={} org={} file={} started by {} (validationOnly={})",
                ctx.entry.getId(), orgId, file.name(), actingUser, validationOnly);

        List<RowValidationResult> rows = new ArrayList<>();
        try {
            RepsTable table = tableReader.read(file.content(), file.name());
            table.forEach(row -> rows.add(rowValidator.validate(row, RowKind.CAPACITY)));
        } catch (RepsParsingException e) {
            log.warn("[REPS_CAPACITY] import={} could not parse {}: {}", ctx.entry.getId(), file.name(), e.getMessage());
            return finish(ctx, CapacityImportStatus.FAILED, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[REPS_CAPACITY] import={} failed before any row: {}", ctx.entry.getId(), e.getMessage(), e);
            return finish(ctx, CapacityImportStatus.FAILED, e.getMessage());
        }

        ctx.entry.setTotalRows(rows.size());
        ctx.entry.setStatus(CapacityImportStatus.PROCESSING.name());
        ctx.entry = importLogRepository.save(ctx.entry);

        for (RowValidationResult row : rows) {
            processRow(ctx, orgId, row, validationOnly);
        }

        CapacityImportStatus status;
        if (ctx.failed == 0) {
            status = CapacityImportStatus.COMPLETED;
        } else if (ctx.successful > 0) {
            status = CapacityImportStatus.COMPLETED_WITH_ERRORS;
        } else {
            status = CapacityImportStatus.FAILED;
        }
        return finish(ctx, status, null);
    }

    private void processRow(ImportContext ctx, Long orgId, RowValidationResult row, boolean validationOnly) {
        if (!row.isValid()) {
            ctx.rowFailed(row, "campos requeridos faltantes: " + String.join(", ", row.getErrors()));
            return;
        }
        try {
            if (validationOnly) {
                resolveFacility(orgId, row);
                CapacityGroup group = capacityMapper.resolveGroup(row, ctx.warnings);
                capacityMapper.quantity(row, ctx.warnings);
                ctx.countGroup(group);
            } else {
                Boolean created = transactionTemplate.execute(status -> upsert(ctx, orgId, row));
                if (Boolean.TRUE.equals(created)) ctx.imported++;
                else ctx.updated++;
            }
            ctx.successful++;
        } catch (RowCreationException | DataAccessException | TransactionException e) {
            ctx.rowFailed(row, e.getMessage());
            log.warn("[REPS_CAPACITY] import={} row {} rejected: {}", ctx.entry.getId(), row.getRowIndex(), e.getMessage());
        }
    }

    /** @return true when a new capacity line was created, false when an existing one was updated */
    private boolean upsert(ImportContext ctx, Long orgId, RowValidationResult row) {
        FacilityLocation facility = resolveFacility(orgId, row);
        CapacityGroup group = capacityMapper.resolveGroup(row, ctx.warnings);
        String conceptCode = capacityMapper.conceptCode(row, group);
        String plate = capacityMapper.plateNumber(row);

        Optional<InstalledCapacity> existing =
                capacityRepository.findByFacilityIdAndConceptCodeAndPlateNumber(facility.getId(), conceptCode, plate);
        InstalledCapacity capacity;
        if (existing.isPresent()) {
            capacity = existing.get();
            capacityMapper.applyRow(capacity, row, group, ctx.fileName, ctx.actingUser, ctx.warnings);
        } else {
            capacity = capacityMapper.toCapacity(row, facility, group, ctx.fileName, ctx.actingUser, ctx.warnings);
        }
        capacityRepository.saveAndFlush(capacity);
        ctx.countGroup(group);
        return existing.isEmpty();
    }

    /**
     * Finds the active facility a capacity row belongs to: by natural key first, then among the provider's
     * facilities by site number ignoring leading zeros, then by site name when the row carries no site number.
     *
     * @throws RowCreationException when no single facility matches
     */
    FacilityLocation resolveFacility(Long orgId, RowValidationResult row) {
        String provider = RegistryCodeSanitizer.sanitize(row.get(RepsColumns.PROVIDER_CODE));
        String site = row.get(RepsColumns.SITE_NUMBER);
        if (!site.isEmpty()) {
            Optional<FacilityLocation> exact = facilityRepository.findByOrganizationIdAndRegistryCodeAndDeletedAtIsNull(
                    orgId, RegistryCodeSanitizer.naturalKey(provider, site));
            if (exact.isPresent()) return exact.get();
        }

        List<FacilityLocation> candidates = facilityRepository.findByOrganizationIdAndProviderCodeAndDeletedAtIsNull(orgId, provider);
        List<FacilityLocation> matches;
        if (!site.isEmpty()) {
            String wanted = withoutLeadingZeros(site);
            matches = candidates.stream().filter(f -> wanted.equals(withoutLeadingZeros(f.getSiteNumber()))).toList();
        } else if (candidates.size() == 1) {
            matches = candidates;
        } else {
            String name = nameKey(row.get(RepsColumns.SITE_NAME));
            matches = candidates.stream().filter(f -> name.equals(nameKey(f.getName()))).toList();
        }
        if (matches.size() == 1) return matches.get(0);
        if (matches.size() > 1) {
            throw new RowCreationException("la sede " + provider + "-" + site + " coincide con " + matches.size() + " sedes activas");
        }
        throw new RowCreationException("No se encontró sede coincidente para " + provider + "-" + site);
    }

    private static String withoutLeadingZeros(String siteNumber) {
        String t = FieldNormalizer.siteNumber(siteNumber).replaceFirst("^0+", "");
        return t.isEmpty() && siteNumber != null && !siteNumber.isBlank() ? "0" : t;
    }

    private static String nameKey(String name) {
        return FieldNormalizer.stripAccents(FieldNormalizer.repairEncoding(name))
                .toUpperCase(Locale.ROOT)
                .replaceAll("\\s+", " ");
    }

    private CapacityImportLog startLog(Long orgId, SyncFile file, boolean validationOnly, String actingUser) {
        CapacityImportLog entry = new CapacityImportLog();
        entry.setOrganizationId(orgId);
        entry.setFileName(file.name());
        entry.setFileSize((long) file.content().length);
        entry.setFileFormat(fileFormat(file.name()));
        entry.setValidationOnly(validationOnly);
        entry.setStatus(CapacityImportStatus.STARTED.name());
        entry.setStartedAt(Instant.now());
        entry.setCreatedBy(actingUser);
        return importLogRepository.save(entry);
    }

    static String fileFormat(String fileName) {
        String lower = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
        int dot = lower.lastIndexOf('.');
        String ext = dot < 0 ? "" : lower.substring(dot + 1);
        return switch (ext) {
            case "xls", "xlsx", "csv", "html" -> ext;
            case "htm" -> "html";
            default -> "unknown";
        };
    }

    private CapacityImportResult finish(ImportContext ctx, CapacityImportStatus status, String criticalError) {
        CapacityImportLog entry = ctx.entry;
        Instant end = Instant.now();
        List<String> errors = new ArrayList<>(ctx.errors);
        if (criticalError != null) errors.add("Error crítico: " + criticalError);

        Map<String, Object> statistics = new LinkedHashMap<>();
        int total = entry.getTotalRows() == null ? 0 : entry.getTotalRows();
        statistics.put("total_rows", total);
        statistics.put("successful_rows", ctx.successful);
        statistics.put("failed_rows", ctx.failed);
        statistics.put("success_rate", total > 0 ? ctx.successful * 100.0 / total : 0.0);
        statistics.put("imported_count", ctx.imported);
        statistics.put("updated_count", ctx.updated);
        statistics.put("warning_count", ctx.warnings.size());
        statistics.put("error_count", errors.size());
        statistics.put("processed_groups", ctx.byGroup);

        entry.setStatus(status.name());
        entry.setImportedCount(ctx.imported);
        entry.setUpdatedCount(ctx.updated);
        entry.setErrorCount(ctx.failed);
        entry.setErrors(toJson(errors));
        entry.setWarnings(toJson(ctx.warnings));
        entry.setStatistics(toJson(statistics));
        entry.setFinishedAt(end);
        entry.setDurationSeconds(Duration.between(entry.getStartedAt(), end).getSeconds());
        importLogRepository.save(entry);

        log.info("[REPS_CAPACITY] import={} org={} finished {}: total={} ok={} failed={} imported={} updated={} warnings={}",
                entry.getId(), entry.getOrganizationId(), status, total, ctx.successful, ctx.failed,
                ctx.imported, ctx.updated, ctx.warnings.size());

        return new CapacityImportResult(entry.getId(), entry.getOrganizationId(), entry.getFileName(), status,
                entry.isValidationOnly(), total, ctx.successful, ctx.failed, ctx.imported, ctx.updated,
                cap(errors), cap(ctx.warnings), Map.copyOf(ctx.byGroup), entry.getStartedAt(), end);
    }

    private List<String> cap(List<String> messages) {
        int limit = Math.max(0, maxReportedErrors);
        return messages.size() <= limit ? List.copyOf(messages) : List.copyOf(messages.subList(0, limit));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.debug("[REPS_CAPACITY] value not serializable: {}", e.getMessage());
            return String.valueOf(value);
        }
    }

    private static final class ImportContext {
        CapacityImportLog entry;
        final String fileName;
        final String actingUser;
        final List<String> errors = new ArrayList<>();
        final List<String> warnings = new ArrayList<>();
        final Map<String, Integer> byGroup = new LinkedHashMap<>();
        int successful;
        int failed;
        int imported;
        int updated;

        ImportContext(CapacityImportLog entry, String fileName, String actingUser) {
            this.entry = entry;
            this.fileName = fileName;
            this.actingUser = actingUser;
        }

        void rowFailed(RowValidationResult row, String reason) {
            failed++;
            errors.add("Fila " + row.getRowIndex() + ": " + reason);
        }

        void countGroup(CapacityGroup group) {
            byGroup.merge(group.getRepsLabel(), 1, Integer::sum);
        }
    }
}
