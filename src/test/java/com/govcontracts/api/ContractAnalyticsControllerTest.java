package com.govcontracts.api;

import com.govcontracts.domain.exception.ErrorKind;
import com.govcontracts.domain.exception.ValidationException;
import com.govcontracts.domain.model.ContractSearchResponse;
import com.govcontracts.domain.model.Pagination;
import com.govcontracts.domain.service.ContractQueryService;
import com.govcontracts.domain.service.ExportService;
import com.govcontracts.infrastructure.dataset.DatasetCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class ContractAnalyticsControllerTest {

    @Mock
    private ContractQueryService queryService;

    @Mock
    private ExportService exportService;

    @Mock
    private DatasetCatalog datasetCatalog;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new ContractAnalyticsController(queryService, exportService, datasetCatalog))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void testSearch_ReturnsPageOfRecords() throws Exception {
        // Given
        when(queryService.search(any())).thenReturn(ContractSearchResponse.builder()
                .success(true)
                .data(List.of())
                .pagination(Pagination.of(1, 20, 0))
                .build());

        // When / Then
        mockMvc.perform(post("/api/v1/contracts/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"contractors\":[\"acme\"],\"page\":1,\"page_size\":20}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.pagination.total_count").value(0))
                .andExpect(jsonPath("$.pagination.page_size").value(20));
    }

    @Test
    void testSearch_InvalidSortFieldIsBadRequest() throws Exception {
        // Given
        when(queryService.search(any())).thenThrow(
                new ValidationException(ErrorKind.INVALID_SORT_FIELD, "Invalid sort field 'password'"));

        // When / Then
        mockMvc.perform(post("/api/v1/contracts/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sortBy\":\"password\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("invalid_sort_field"));
    }

    @Test
    void testSearch_OversizedPageFailsBeanValidation() throws Exception {
        mockMvc.perform(post("/api/v1/contracts/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"page_size\":5000}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation"));

        verifyNoInteractions(queryService);
    }

    @Test
    void testSearch_MalformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/contracts/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed request body"));
    }

    @Test
    void testExport_StreamsCsvAttachment() throws Exception {
        // Given
        when(exportService.exportRecords(any(), any(), any(), any())).thenAnswer(invocation -> {
            OutputStream out = invocation.getArgument(1);
            out.write("reference_id,awardee_name\nC-1,Acme\n".getBytes(StandardCharsets.UTF_8));
            return null;
        });

        // When
        MvcResult result = mockMvc.perform(post("/api/v1/contracts/export")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        // Then
        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition",
                        "attachment; filename=" + ExportService.RECORDS_FILENAME))
                .andExpect(content().string("reference_id,awardee_name\nC-1,Acme\n"));
    }

    @Test
    void testHealth_ReportsPartitionCount() throws Exception {
        // Given
        when(datasetCatalog.partitions()).thenReturn(List.of());

        // When / Then
        mockMvc.perform(get("/api/v1/contracts/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("OK"))
                .andExpect(jsonPath("$.partitions").value(0));
    }
}
