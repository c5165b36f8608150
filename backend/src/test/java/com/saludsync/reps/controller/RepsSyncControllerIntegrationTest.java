package com.saludsync.reps.controller;

import com.saludsync.reps.model.HealthOrganization;
import com.saludsync.reps.repository.FacilityLocationRepository;
import com.saludsync.reps.repository.SyncRunRepository;
import com.saludsync.reps.support.RegistryTestData;
import com.saludsync.reps.support.RepsHtml;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@ActiveProfiles("test")
@AutoConfigureMockMvc
@Import(RegistryTestData.class)
class RepsSyncControllerIntegrationTest {

    @Autowired private MockMvc mvc;
    @Autowired private RegistryTestData testData;
    @Autowired private FacilityLocationRepository facilityRepository;
    @Autowired private SyncRunRepository syncRunRepository;

    private HealthOrganization org;

    @BeforeEach
    void setUp() {
        testData.wipe();
        org = testData.organization("050010001");
    }

    private static MockMultipartFile facilitiesFile() {
        byte[] html = RepsHtml.bytes(RepsHtml.FACILITY_HEADERS, List.of(
                RepsHtml.facility("050010001", "1", "Sede A", "Principal", "Antioquia", "Medellín", "Calle 1"),
                RepsHtml.facility("050010001", "2", "Sede B", "", "", "Medellín", "Calle 2")));
        return new MockMultipartFile("facilitiesFile", "sedes.xls", "application/vnd.ms-excel", html);
    }

    @Test
    void sync_returnsRunResult_andRunIsListedWithItsErrors() throws Exception {
        mvc.perform(multipart("/api/reps/organizations/{orgId}/sync", org.getId())
                        .file(facilitiesFile())
                        .header("X-User", "auditor"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.status", is("COMPLETED")))
                .andExpect(jsonPath("$.totalRows", is(2)))
                .andExpect(jsonPath("$.importedCount", is(1)))
                .andExpect(jsonPath("$.invalidRows", is(1)))
                .andExpect(jsonPath("$.errors[0]", containsString("departamento")))
                .andExpect(jsonPath("$.filesProcessed[0].file", is("sedes.xls")));

        Long runId = syncRunRepository.findAll().get(0).getId();
        mvc.perform(get("/api/reps/runs").param("page", "0").param("size", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].createdBy", is("auditor")))
                .andExpect(jsonPath("$[0].facilitiesFile", is("sedes.xls")));
        mvc.perform(get("/api/reps/runs/{id}/errors", runId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].kind", is("FACILITIES")))
                .andExpect(jsonPath("$[0].rowNumber", is(2)));
    }

    @Test
    void sync_withoutFiles_isBadRequest() throws Exception {
        mvc.perform(multipart("/api/reps/organizations/{orgId}/sync", org.getId()))
                .andExpect(status().isBadRequest());
        assertEquals(0, syncRunRepository.count());
    }

    @Test
    void sync_unknownOrganization_isNotFound() throws Exception {
        mvc.perform(multipart("/api/reps/organizations/{orgId}/sync", org.getId() + 1000).file(facilitiesFile()))
                .andExpect(status().isNotFound());
    }

    @Test
    void preview_validatesRowsWithoutDbWrites() throws Exception {
        long facilitiesBefore = facilityRepository.count();
        long runsBefore = syncRunRepository.count();
        MockMultipartFile file = new MockMultipartFile("file", "sedes.xls", "application/vnd.ms-excel",
                facilitiesFile().getBytes());

        mvc.perform(multipart("/api/reps/preview").file(file).param("kind", "facilities").param("limit", "50"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.headers", hasItem("nombre_sede")))
                .andExpect(jsonPath("$.totalRows", is(2)))
                .andExpect(jsonPath("$.rows", hasSize(2)))
                .andExpect(jsonPath("$.rows[0].status", is("ok")))
                .andExpect(jsonPath("$.rows[0].registryCode", is("050010001_1")))
                .andExpect(jsonPath("$.rows[1].status", is("error")))
                .andExpect(jsonPath("$.rows[1].reason", containsString("departamento")));

        assertEquals(facilitiesBefore, facilityRepository.count(), "Facilities should be unchanged after preview");
        assertEquals(runsBefore, syncRunRepository.count(), "Sync runs should be unchanged after preview");
    }

    @Test
    void preview_rejectsUnknownKindAndBrokenFiles() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "x.xls", "application/vnd.ms-excel", "sin tabla".getBytes());
        mvc.perform(multipart("/api/reps/preview").file(file).param("kind", "FACILITIES"))
                .andExpect(status().isBadRequest());
        mvc.perform(multipart("/api/reps/preview").file(facilitiesFile()).param("kind", "RUN"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void cleanup_diagnosisAndDryRun() throws Exception {
        testData.facility(org, "050010001 1", "Con espacio", true);

        mvc.perform(get("/api/reps/organizations/{orgId}/cleanup/diagnosis", org.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalFacilities", is(1)))
                .andExpect(jsonPath("$.whitespaceIssues", contains("050010001 1")));
        mvc.perform(post("/api/reps/organizations/{orgId}/cleanup", org.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dryRun", is(true)))
                .andExpect(jsonPath("$.changes[0].to", is("0500100011")));
        mvc.perform(get("/api/reps/organizations/{orgId}/cleanup/diagnosis", org.getId() + 1000))
                .andExpect(status().isNotFound());
    }
}
