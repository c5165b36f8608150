package com.saludsync.reps.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.saludsync.reps.batch.SyncRunRegistry;
import com.saludsync.reps.dto.RepsTable;
import com.saludsync.reps.dto.SyncFile;
import com.saludsync.reps.dto.SyncRequest;
import com.saludsync.reps.dto.SyncRunResult;
import com.saludsync.reps.exception.RepsParsingException;
import com.saludsync.reps.exception.RowCreationException;
import com.saludsync.reps.exception.SyncInProgressException;
import com.saludsync.reps.model.EnabledService;
import com.saludsync.reps.model.FacilityLocation;
import com.saludsync.reps.model.HealthOrganization;
import com.saludsync.reps.model.RowKind;
import com.saludsync.reps.model.SyncRun;
import com.saludsync.reps.model.SyncRunError;
import com.saludsync.reps.model.SyncStatus;
import com.saludsync.reps.repository.EnabledServiceRepository;
import com.saludsync.reps.repository.FacilityLocationRepository;
import com.saludsync.reps.repository.HealthOrganizationRepository;
import com.saludsync.reps.repository.InstalledCapacityRepository;
import com.saludsync.reps.repository.SyncRunErrorRepository;
import com.saludsync.reps.repository.SyncRunRepository;
import com.saludsync.reps.service.RowValidator.RowValidationResult;
import com.saludsync.reps.util.RepsColumns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Runs one REPS synchronization for an organization: parse, optional backup, a single transaction of
 * upserts, integrity check, then commit or restore. Every run leaves a {@link SyncRun} row behind.
 */
@Service
public class RegistrySyncService {

    private static final Logger log = LoggerFactory.getLogger(RegistrySyncService.class);

    private enum Outcome { IMPORTED, UPDATED, SKIPPED }

    @Value("${reps.sync.max-reported-errors:50}")
    private int maxReportedErrors = 50;

    private final HealthOrganizationRepository organizationRepository;
    private final FacilityLocationRepository facilityRepository;
    private final EnabledServiceRepository serviceRepository;
    private final InstalledCapacityRepository capacityRepository;
    private final SyncRunRepository runRepository;
    private final SyncRunErrorRepository runErrorRepository;
    private final RepsTableReader tableReader;
    private final RowValidator rowValidator;
    private final FacilityMapper facilityMapper;
    private final ServiceMapper serviceMapper;
    private final ConflictPreprocessor conflictPreprocessor;
    private final BackupManager backupManager;
    private final SyncIntegrityVerifier integrityVerifier;
    private final SyncRunRegistry runRegistry;
    private final AuditContext auditContext;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;

    public RegistrySyncService(HealthOrganizationRepository organizationRepository,
                               FacilityLocationRepository facilityRepository,
                               EnabledServiceRepository serviceRepository,
                               InstalledCapacityRepository capacityRepository,
                               SyncRunRepository runRepository,
                               SyncRunErrorRepository runErrorRepository,
                               RepsTableReader tableReader,
                               RowValidator rowValidator,
                               FacilityMapper facilityMapper,
                               ServiceMapper serviceMapper,
                               ConflictPreprocessor conflictPreprocessor,
                               BackupManager backupManager,
                               SyncIntegrityVerifier integrityVerifier,
                               SyncRunRegistry runRegistry,
                               AuditContext auditContext,
                               ObjectMapper objectMapper,
                               PlatformTransactionManager transactionManager) {
        this.organizationRepository = organizationRepository;
        this.facilityRepository = facilityRepository;
        this.serviceRepository = serviceRepository;
        this.capacityRepository = capacityRepository;
        this.runRepository = runRepository;
        this.runErrorRepository = runErrorRepository;
        this.tableReader = tableReader;
        this.rowValidator = rowValidator;
        this.facilityMapper = facilityMapper;
        this.serviceMapper = serviceMapper;
        this.conflictPreprocessor = conflictPreprocessor;
        this.backupManager = backupManager;
        this.integrityVerifier = integrityVerifier;
        this.runRegistry = runRegistry;
        this.auditContext = auditContext;
        this.objectMapper = objectMapper;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * @throws IllegalArgumentException when no file is given or the organization does not exist
     * @throws SyncInProgressException  when the organization already has a run in progress
     */
    public SyncRunResult synchronize(SyncRequest request) {
        if (request == null || !request.hasAnyFile()) {
            throw new IllegalArgumentException("At least one REPS file (facilities or services) is required");
        }
        Long orgId = request.organizationId();
        if (orgId == null || !organizationRepository.existsById(orgId)) {
            throw new IllegalArgumentException("Organization " + orgId + " does not exist");
        }
        if (!runRegistry.tryAcquire(orgId)) {
            throw new SyncInProgressException(orgId);
        }
        try {
            return execute(request, auditContext.actingUser(request.actingUser()));
        } finally {
            runRegistry.release(orgId);
        }
    }

    private SyncRunResult execute(SyncRequest request, String actingUser) {
        Long orgId = request.organizationId();
        RunContext ctx = new RunContext(startRun(request, actingUser), actingUser);
        log.info("[REPS_SYNC] run={} org={} started by {} (backup={}, forceRecreate={})",
                ctx.run.getId(), orgId, actingUser, request.createBackup(), request.forceRecreate());

        RepsTable facilities;
        RepsTable services;
        List<RowValidationResult> facilityRows;
        List<RowValidationResult> serviceRows;
        try {
            facilities = parse(request.facilitiesFile());
            services = parse(request.servicesFile());
            // validation is read-only and runs before anything is captured or written
            facilityRows = validateAll(facilities, RowKind.FACILITIES);
            serviceRows = validateAll(services, RowKind.SERVICES);
        } catch (RepsParsingException e) {
            log.warn("[REPS_SYNC] run={} org={} could not parse {}: {}", ctx.run.getId(), orgId, e.getFileName(), e.getMessage());
            return finish(ctx, SyncStatus.FAILED, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[REPS_SYNC] run={} org={} failed before any change: {}", ctx.run.getId(), orgId, e.getMessage(), e);
            return finish(ctx, SyncStatus.FAILED, "Error inesperado preparando la sincronización: " + e.getMessage());
        }

        if (request.createBackup()) {
            try {
                ctx.backupId = backupManager.capture(orgId);
                ctx.run.setBackupId(ctx.backupId);
            } catch (RuntimeException e) {
                log.error("[REPS_SYNC] run={} org={} backup failed, nothing was changed", ctx.run.getId(), orgId, e);
                return finish(ctx, SyncStatus.FAILED, "No se pudo crear el respaldo: " + e.getMessage());
            }
        }

        try {
            transactionTemplate.executeWithoutResult(status -> {
                ctx.resetWrites();
                applyChanges(ctx, orgId, request.forceRecreate(), facilities, facilityRows, services, serviceRows);
            });
        } catch (RuntimeException e) {
            log.error("[REPS_SYNC] run={} org={} aborted: {}", ctx.run.getId(), orgId, e.getMessage(), e);
            String reason = "Error fatal durante la sincronización: " + e.getMessage();
            if (ctx.backupId == null) {
                return finish(ctx, SyncStatus.FAILED, reason);
            }
            try {
                backupManager.restore(ctx.backupId);
                log.warn("[REPS_SYNC] run={} org={} rolled back from backup {}", ctx.run.getId(), orgId, ctx.backupId);
                return finish(ctx, SyncStatus.ROLLED_BACK, reason);
            } catch (RuntimeException restoreFailure) {
                log.error("[REPS_SYNC][CRITICAL] run={} org={} restore of backup {} failed, manual intervention required",
                        ctx.run.getId(), orgId, ctx.backupId, restoreFailure);
                return finish(ctx, SyncStatus.CRITICAL_ERROR,
                        reason + "; la restauración del respaldo " + ctx.backupId + " falló: " + restoreFailure.getMessage());
            }
        }

        if (ctx.backupId != null) {
            try {
                backupManager.discard(ctx.backupId);
            } catch (RuntimeException e) {
                log.warn("[REPS_SYNC] run={} could not discard backup {}: {}", ctx.run.getId(), ctx.backupId, e.getMessage());
            }
        }
        return finish(ctx, SyncStatus.COMPLETED, null);
    }

    private SyncRun startRun(SyncRequest request, String actingUser) {
        SyncRun run = new SyncRun();
        run.setOrganizationId(request.organizationId());
        run.setCreatedBy(actingUser);
        run.setFacilitiesFile(request.facilitiesFile() != null ? request.facilitiesFile().name() : null);
        run.setServicesFile(request.servicesFile() != null ? request.servicesFile().name() : null);
        run.setCreateBackup(request.createBackup());
        run.setForceRecreate(request.forceRecreate());
        run.setStartedAt(Instant.now());
        run.setStatus(SyncStatus.PENDING.name());
        run = runRepository.save(run);
        run.setStatus(SyncStatus.RUNNING.name());
        return runRepository.save(run);
    }

    private RepsTable parse(SyncFile file) {
        return file == null ? null : tableReader.read(file.content(), file.name());
    }

    private List<RowValidationResult> validateAll(RepsTable table, RowKind kind) {
        if (table == null) return List.of();
        List<RowValidationResult> results = new ArrayList<>(table.size());
        table.forEach(row -> results.add(rowValidator.validate(row, kind)));
        return results;
    }

    private void applyChanges(RunContext ctx, Long orgId, boolean forceRecreate,
                              RepsTable facilities, List<RowValidationResult> facilityRows,
                              RepsTable services, List<RowValidationResult> serviceRows) {
        if (forceRecreate) {
            // capacity is not part of the REPS facility export; it has to be imported again afterwards
            int removedCapacities = capacityRepository.deleteAllByOrganization(orgId);
            int removedServices = serviceRepository.deleteAllByOrganization(orgId);
            int removedFacilities = facilityRepository.deleteAllByOrganization(orgId);
            log.info("[REPS_SYNC] run={} org={} force recreate removed {} facilities, {} services and {} capacities",
                    ctx.run.getId(), orgId, removedFacilities, removedServices, removedCapacities);
        }

        if (facilities != null) {
            if (!forceRecreate) {
                Set<String> keys = new LinkedHashSet<>();
                facilityRows.stream().filter(RowValidationResult::isValid).forEach(r -> keys.add(facilityMapper.naturalKey(r)));
                conflictPreprocessor.purgeFacilityTombstones(orgId, keys);
            }
            // bulk deletes clear the persistence context, load the organization afterwards
            HealthOrganization org = organizationRepository.findById(orgId)
                    .orElseThrow(() -> new IllegalStateException("Organization " + orgId + " disappeared during sync"));
            FileTally tally = ctx.file(facilities.getFileName(), RowKind.FACILITIES);
            for (RowValidationResult row : facilityRows) {
                processRow(ctx, tally, RowKind.FACILITIES, row, () -> upsertFacility(ctx, org, row));
            }
        }

        if (services != null) {
            if (!forceRecreate) {
                Map<String, Set<String>> byFacility = new LinkedHashMap<>();
                serviceRows.stream().filter(RowValidationResult::isValid).forEach(r ->
                        byFacility.computeIfAbsent(facilityMapper.naturalKey(r), k -> new HashSet<>())
                                .add(r.get(RepsColumns.SERVICE_CODE)));
                conflictPreprocessor.purgeServiceTombstones(orgId, byFacility);
            }
            FileTally tally = ctx.file(services.getFileName(), RowKind.SERVICES);
            for (RowValidationResult row : serviceRows) {
                processRow(ctx, tally, RowKind.SERVICES, row, () -> upsertService(ctx, orgId, row));
            }
        }

        integrityVerifier.verify(orgId, ctx.touchedServiceIds);
    }

    private void processRow(RunContext ctx, FileTally tally, RowKind kind, RowValidationResult row, RowUpsert upsert) {
        tally.total++;
        if (!row.isValid()) {
            tally.invalid++;
            ctx.rowError(kind, row, "campos requeridos faltantes: " + String.join(", ", row.getErrors()));
            return;
        }
        tally.valid++;
        try {
            switch (upsert.apply()) {
                case IMPORTED -> tally.imported++;
                case UPDATED -> tally.updated++;
                case SKIPPED -> tally.skipped++;
            }
        } catch (RowCreationException e) {
            tally.errors++;
            ctx.rowError(kind, row, e.getMessage());
            log.warn("[REPS_SYNC] run={} {} row {} rejected: {}", ctx.run.getId(), kind, row.getRowIndex(), e.getMessage());
        }
    }

    @FunctionalInterface
    private interface RowUpsert {
        Outcome apply();
    }

    private Outcome upsertFacility(RunContext ctx, HealthOrganization org, RowValidationResult row) {
        Long orgId = org.getId();
        String key = facilityMapper.naturalKey(row);
        FacilityLocation existing = facilityRepository.findByOrganizationIdAndRegistryCodeAndDeletedAtIsNull(orgId, key).orElse(null);
        if (existing != null) {
            facilityMapper.applyRow(existing, row, ctx.actingUser, ctx.warnings);
            checkFacilityLimits(existing);
            facilityRepository.save(existing);
            return Outcome.UPDATED;
        }
        String name = row.get(RepsColumns.SITE_NAME).strip().toLowerCase(Locale.ROOT);
        String address = row.get(RepsColumns.ADDRESS).strip().toLowerCase(Locale.ROOT);
        if (!facilityRepository.findActiveByNameAndAddress(orgId, name, address).isEmpty()) {
            return Outcome.SKIPPED;
        }
        if (facilityRepository.findByOrganizationIdAndRegistryCode(orgId, key).isPresent()) {
            throw new RowCreationException("el código de sede " + key + " está ocupado por un registro eliminado");
        }
        boolean anyFacility = facilityRepository.existsByOrganizationIdAndDeletedAtIsNull(orgId);
        boolean anyMain = facilityRepository.existsByOrganizationIdAndMainFacilityTrueAndDeletedAtIsNull(orgId);
        FacilityLocation created = facilityMapper.toFacility(row, org, anyFacility, anyMain, ctx.actingUser, ctx.warnings);
        checkFacilityLimits(created);
        facilityRepository.save(created);
        return Outcome.IMPORTED;
    }

    private Outcome upsertService(RunContext ctx, Long orgId, RowValidationResult row) {
        String facilityKey = facilityMapper.naturalKey(row);
        String code = row.get(RepsColumns.SERVICE_CODE);
        FacilityLocation parent = facilityRepository.findByOrganizationIdAndRegistryCodeAndDeletedAtIsNull(orgId, facilityKey)
                .orElseThrow(() -> new RowCreationException("la sede " + facilityKey + " no existe, el servicio " + code + " no se puede crear"));
        EnabledService existing = serviceRepository.findByFacilityIdAndServiceCodeAndDeletedAtIsNull(parent.getId(), code).orElse(null);
        if (existing != null) {
            serviceMapper.applyRow(existing, row, ctx.actingUser, ctx.warnings);
            checkServiceLimits(existing);
            ctx.touchedServiceIds.add(serviceRepository.save(existing).getId());
            return Outcome.UPDATED;
        }
        if (serviceRepository.findByFacilityIdAndServiceCode(parent.getId(), code).isPresent()) {
            throw new RowCreationException("el servicio " + code + " de la sede " + facilityKey + " está ocupado por un registro eliminado");
        }
        EnabledService created = serviceMapper.toService(row, parent, ctx.actingUser, ctx.warnings);
        checkServiceLimits(created);
        ctx.touchedServiceIds.add(serviceRepository.save(created).getId());
        return Outcome.IMPORTED;
    }

    private static void checkFacilityLimits(FacilityLocation f) {
        requireFits("código de sede", f.getRegistryCode(), 64);
        requireFits("código de prestador", f.getProviderCode(), 32);
        requireFits("número de sede", f.getSiteNumber(), 16);
        requireFits("nombre", f.getName(), 255);
        requireFits("departamento", f.getDepartmentName(), 100);
        requireFits("municipio", f.getMunicipalityName(), 100);
        requireFits("código de municipio", f.getMunicipalityCode(), 8);
        requireFits("dirección", f.getAddress(), 500);
    }

    private static void checkServiceLimits(EnabledService s) {
        requireFits("código de servicio", s.getServiceCode(), 32);
        requireFits("nombre de servicio", s.getServiceName(), 255);
        requireFits("código de grupo", s.getServiceGroupCode(), 32);
        requireFits("nombre de grupo", s.getServiceGroupName(), 255);
        requireFits("número distintivo", s.getDistinctiveCode(), 64);
    }

    private static void requireFits(String field, String value, int max) {
        if (value != null && value.length() > max) {
            throw new RowCreationException("el campo " + field + " excede " + max + " caracteres");
        }
    }

    private SyncRunResult finish(RunContext ctx, SyncStatus status, String failureReason) {
        SyncRun run = ctx.run;
        Instant end = Instant.now();
        int total = 0, valid = 0, invalid = 0, imported = 0, updated = 0, skipped = 0, creationErrors = 0;
        List<SyncRunResult.FileProcessed> files = new ArrayList<>();
        for (FileTally t : ctx.files.values()) {
            total += t.total;
            valid += t.valid;
            invalid += t.invalid;
            imported += t.imported;
            updated += t.updated;
            skipped += t.skipped;
            creationErrors += t.errors;
            files.add(new SyncRunResult.FileProcessed(t.file, t.kind, new SyncRunResult.FileStats(
                    t.total, t.valid, t.invalid, t.imported, t.updated, t.skipped, t.invalid + t.errors)));
        }
        int errorCount = invalid + creationErrors;

        run.setStatus(status.name());
        run.setRowsTotal(total);
        run.setRowsValid(valid);
        run.setRowsInvalid(invalid);
        run.setImportedCount(imported);
        run.setUpdatedCount(updated);
        run.setSkippedCount(skipped);
        run.setErrorCount(errorCount);
        run.setFailureReason(failureReason != null && failureReason.length() > 2000 ? failureReason.substring(0, 2000) : failureReason);
        run.setFinishedAt(end);
        runRepository.save(run);

        List<SyncRunError> errorRows = new ArrayList<>(ctx.pendingErrors);
        if (failureReason != null) {
            errorRows.add(0, newError(RowKind.RUN, null, null, failureReason));
        }
        errorRows.forEach(e -> e.setSyncRun(run));
        runErrorRepository.saveAll(errorRows);

        List<String> messages = new ArrayList<>();
        if (failureReason != null) messages.add(failureReason);
        messages.addAll(ctx.errorMessages);

        log.info("[REPS_SYNC] run={} org={} finished {}: total={} valid={} invalid={} imported={} updated={} skipped={} errors={} warnings={}",
                run.getId(), run.getOrganizationId(), status, total, valid, invalid, imported, updated, skipped,
                errorCount, ctx.warnings.size());

        return new SyncRunResult(run.getId(), run.getOrganizationId(), status,
                total, valid, invalid, imported, updated, skipped, errorCount,
                cap(messages), cap(ctx.warnings),
                ctx.backupId != null, ctx.backupId, files, run.getStartedAt(), end);
    }

    private List<String> cap(List<String> messages) {
        int limit = Math.max(0, maxReportedErrors);
        return messages.size() <= limit ? List.copyOf(messages) : List.copyOf(messages.subList(0, limit));
    }

    private SyncRunError newError(RowKind kind, Integer rowNumber, String payload, String reason) {
        SyncRunError err = new SyncRunError();
        err.setKind(kind);
        err.setRowNumber(rowNumber);
        err.setPayload(payload);
        err.setReason(reason.length() > 2000 ? reason.substring(0, 2000) : reason);
        err.setCreatedAt(Instant.now());
        return err;
    }

    private String payloadOf(RowValidationResult row) {
        try {
            return objectMapper.writeValueAsString(row.getData());
        } catch (JsonProcessingException e) {
            log.debug("[REPS_SYNC] row {} payload not serializable: {}", row.getRowIndex(), e.getMessage());
            return String.valueOf(row.getData());
        }
    }

    private final class RunContext {
        final SyncRun run;
        final String actingUser;
        final Map<RowKind, FileTally> files = new LinkedHashMap<>();
        final List<String> warnings = new ArrayList<>();
        final List<String> errorMessages = new ArrayList<>();
        final List<SyncRunError> pendingErrors = new ArrayList<>();
        final Set<Long> touchedServiceIds = new HashSet<>();
        String backupId;

        RunContext(SyncRun run, String actingUser) {
            this.run = run;
            this.actingUser = actingUser;
        }

        FileTally file(String name, RowKind kind) {
            return files.computeIfAbsent(kind, k -> new FileTally(name, k));
        }

        // a retried transaction callback starts from clean counters
        void resetWrites() {
            files.clear();
            warnings.clear();
            errorMessages.clear();
            pendingErrors.clear();
            touchedServiceIds.clear();
        }

        void rowError(RowKind kind, RowValidationResult row, String reason) {
            String message = "Fila " + row.getRowIndex() + " (" + kind + "): " + reason;
            errorMessages.add(message);
            pendingErrors.add(newError(kind, row.getRowIndex(), payloadOf(row), reason));
        }
    }

    private static final class FileTally {
        final String file;
        final RowKind kind;
        int total, valid, invalid, imported, updated, skipped, errors;

        FileTally(String file, RowKind kind) {
            this.file = file;
            this.kind = kind;
        }
    }
}
