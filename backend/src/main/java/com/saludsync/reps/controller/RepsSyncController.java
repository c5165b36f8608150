package com.saludsync.reps.controller;

import com.saludsync.reps.dto.CapacityImportLogDTO;
import com.saludsync.reps.dto.CapacityImportResult;
import com.saludsync.reps.dto.CleanupDiagnosis;
import com.saludsync.reps.dto.CleanupReport;
import com.saludsync.reps.dto.RegistryPreviewResponse;
import com.saludsync.reps.dto.SyncFile;
import com.saludsync.reps.dto.SyncRequest;
import com.saludsync.reps.dto.SyncRunErrorDTO;
import com.saludsync.reps.dto.SyncRunResult;
import com.saludsync.reps.dto.SyncRunSummaryDTO;
import com.saludsync.reps.exception.RepsParsingException;
import com.saludsync.reps.exception.SyncInProgressException;
import com.saludsync.reps.model.RowKind;
import com.saludsync.reps.model.SyncRun;
import com.saludsync.reps.repository.CapacityImportLogRepository;
import com.saludsync.reps.repository.HealthOrganizationRepository;
import com.saludsync.reps.repository.SyncRunErrorRepository;
import com.saludsync.reps.repository.SyncRunRepository;
import com.saludsync.reps.service.CapacityImportService;
import com.saludsync.reps.service.RegistryCleanupService;
import com.saludsync.reps.service.RegistryPreviewService;
import com.saludsync.reps.service.RegistrySyncService;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/reps")
public class RepsSyncController {

    private final RegistrySyncService syncService;
    private final RegistryPreviewService previewService;
    private final RegistryCleanupService cleanupService;
    private final CapacityImportService capacityImportService;
    private final HealthOrganizationRepository organizationRepository;
    private final SyncRunRepository syncRunRepository;
    private final SyncRunErrorRepository syncRunErrorRepository;
    private final CapacityImportLogRepository capacityImportLogRepository;

    public RepsSyncController(RegistrySyncService syncService,
                              RegistryPreviewService previewService,
                              RegistryCleanupService cleanupService,
                              CapacityImportService capacityImportService,
                              HealthOrganizationRepository organizationRepository,
                              SyncRunRepository syncRunRepository,
                              SyncRunErrorRepository syncRunErrorRepository,
                              CapacityImportLogRepository capacityImportLogRepository) {
        this.syncService = syncService;
        this.previewService = previewService;
        this.cleanupService = cleanupService;
        this.capacityImportService = capacityImportService;
        this.organizationRepository = organizationRepository;
        this.syncRunRepository = syncRunRepository;
        this.syncRunErrorRepository = syncRunErrorRepository;
        this.capacityImportLogRepository = capacityImportLogRepository;
    }

    @PostMapping(value = "/organizations/{orgId}/sync", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public SyncRunResult synchronize(@PathVariable("orgId") Long orgId,
                                     @RequestParam(value = "facilitiesFile", required = false) MultipartFile facilitiesFile,
                                     @RequestParam(value = "servicesFile", required = false) MultipartFile servicesFile,
                                     @RequestParam(value = "createBackup", defaultValue = "true") boolean createBackup,
                                     @RequestParam(value = "forceRecreate", defaultValue = "false") boolean forceRecreate,
                                     @RequestHeader(value = "X-User", required = false) String user) throws IOException {
        requireOrganization(orgId);
        SyncRequest request = new SyncRequest(orgId, SyncFile.of(facilitiesFile), SyncFile.of(servicesFile),
                createBackup, forceRecreate, user);
        if (!request.hasAnyFile()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "facilitiesFile or servicesFile is required");
        }
        try {
            return syncService.synchronize(request);
        } catch (SyncInProgressException ex) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, ex.getMessage(), ex);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }

    @PostMapping(value = "/organizations/{orgId}/capacity", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public CapacityImportResult importCapacity(@PathVariable("orgId") Long orgId,
                                               @RequestParam(value = "file", required = false) MultipartFile file,
                                               @RequestParam(value = "validateOnly", defaultValue = "false") boolean validateOnly,
                                               @RequestHeader(value = "X-User", required = false) String user) throws IOException {
        requireOrganization(orgId);
        SyncFile upload = SyncFile.of(file);
        if (upload == null) throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "file is required");
        try {
            return capacityImportService.importCapacity(orgId, upload, validateOnly, user);
        } catch (SyncInProgressException ex) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, ex.getMessage(), ex);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }

    @GetMapping("/organizations/{orgId}/capacity/imports")
    public List<CapacityImportLogDTO> listCapacityImports(@PathVariable("orgId") Long orgId,
                                                          @RequestParam(value = "size", defaultValue = "20") int size) {
        requireOrganization(orgId);
        return capacityImportLogRepository.findByOrganizationIdOrderByStartedAtDesc(orgId, PageRequest.of(0, Math.max(1, size)))
                .stream()
                .map(l -> new CapacityImportLogDTO(l.getId(), l.getFileName(), l.getFileFormat(), l.getStatus(),
                        l.isValidationOnly(), l.getTotalRows(), l.getImportedCount(), l.getUpdatedCount(),
                        l.getErrorCount(), l.getCreatedBy(), l.getStartedAt(), l.getFinishedAt()))
                .toList();
    }

    @PostMapping(value = "/preview", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public RegistryPreviewResponse preview(@RequestParam("file") MultipartFile file,
                                           @RequestParam(value = "kind", defaultValue = "FACILITIES") String kind,
                                           @RequestParam(value = "limit", required = false, defaultValue = "20") int limit) throws IOException {
        SyncFile upload = SyncFile.of(file);
        if (upload == null) throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "file is required");
        try {
            return previewService.preview(parseKind(kind), upload, limit);
        } catch (RepsParsingException | IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }

    @GetMapping("/runs")
    public List<SyncRunSummaryDTO> listRuns(@RequestParam(value = "page", defaultValue = "0") int page,
                                            @RequestParam(value = "size", defaultValue = "20") int size) {
        Page<SyncRun> p = syncRunRepository.findAllByOrderByStartedAtDesc(PageRequest.of(Math.max(0, page), Math.max(1, size)));
        return p.map(this::toDto).getContent();
    }

    @GetMapping("/runs/{id}/errors")
    public List<SyncRunErrorDTO> listErrors(@PathVariable("id") Long id) {
        if (!syncRunRepository.existsById(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found");
        }
        return syncRunErrorRepository.findBySyncRunIdOrderByIdAsc(id).stream().map(e -> new SyncRunErrorDTO(
                e.getId(),
                e.getKind() != null ? e.getKind().name() : null,
                e.getRowNumber(),
                e.getReason(),
                e.getPayload()
        )).toList();
    }

    @GetMapping("/organizations/{orgId}/cleanup/diagnosis")
    public CleanupDiagnosis diagnose(@PathVariable("orgId") Long orgId) {
        requireOrganization(orgId);
        return cleanupService.diagnose(orgId);
    }

    @PostMapping("/organizations/{orgId}/cleanup")
    public CleanupReport cleanup(@PathVariable("orgId") Long orgId,
                                 @RequestParam(value = "dryRun", defaultValue = "true") boolean dryRun) {
        requireOrganization(orgId);
        return cleanupService.cleanup(orgId, dryRun);
    }

    private void requireOrganization(Long orgId) {
        if (!organizationRepository.existsById(orgId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Organization not found");
        }
    }

    private static RowKind parseKind(String kind) {
        try {
            return RowKind.valueOf(kind.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "kind must be FACILITIES, SERVICES or CAPACITY", ex);
        }
    }

    private SyncRunSummaryDTO toDto(SyncRun run) {
        return new SyncRunSummaryDTO(
                run.getId(),
                run.getOrganizationId(),
                run.getStatus(),
                run.getRowsTotal(),
                run.getRowsValid(),
                run.getRowsInvalid(),
                run.getImportedCount(),
                run.getUpdatedCount(),
                run.getSkippedCount(),
                run.getErrorCount(),
                run.getFacilitiesFile(),
                run.getServicesFile(),
                run.getCreatedBy(),
                run.getStartedAt(),
                run.getFinishedAt()
        );
    }
}
