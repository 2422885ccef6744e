package uk.gegc.accessgate.features.billing.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.accessgate.features.billing.application.CustomerRecordService;
import uk.gegc.accessgate.features.billing.domain.model.AccessState;
import uk.gegc.accessgate.features.billing.domain.model.CustomerRecord;
import uk.gegc.accessgate.shared.config.FeatureFlags;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Customer export endpoint")
class CustomerExportControllerTest {

    private static final String EXPORT_KEY = "test-export-key";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CustomerRecordService customerRecordService;

    @MockitoBean
    private FeatureFlags featureFlags;

    @BeforeEach
    void setUp() {
        when(featureFlags.isCustomerExport()).thenReturn(true);
    }

    @Test
    @DisplayName("Returns records in service order with a short public cache")
    void export_returnsRecords() throws Exception {
        // Given
        CustomerRecord newer = CustomerRecord.builder()
                .customerId("cus_2").email("b@x.com").access(AccessState.ACTIVE)
                .planKey("firstflame_pair").updatedAt(Instant.parse("2026-01-02T00:00:00Z")).build();
        CustomerRecord older = CustomerRecord.builder()
                .customerId("cus_1").email("a@x.com").access(AccessState.LOCKED)
                .updatedAt(Instant.parse("2026-01-01T00:00:00Z")).build();
        when(customerRecordService.listCanonical()).thenReturn(List.of(newer, older));

        // When & Then
        mockMvc.perform(get("/api/customers").header("x-export-key", EXPORT_KEY))
                .andExpect(status().isOk())
                .andExpect(header().string("Cache-Control", "max-age=30, public"))
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.generatedAt").isNotEmpty())
                .andExpect(jsonPath("$.customers[0].customerId").value("cus_2"))
                .andExpect(jsonPath("$.customers[0].access").value("active"))
                .andExpect(jsonPath("$.customers[1].customerId").value("cus_1"))
                .andExpect(jsonPath("$.customers[1].access").value("locked"));
    }

    @Test
    @DisplayName("Wrong export key returns 401")
    void wrongKey_returns401() throws Exception {
        mockMvc.perform(get("/api/customers").header("x-export-key", "guess"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.title").value("Unauthorized"));

        verifyNoInteractions(customerRecordService);
    }

    @Test
    @DisplayName("Missing export key returns 401")
    void missingKey_returns401() throws Exception {
        mockMvc.perform(get("/api/customers"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(customerRecordService);
    }

    @Test
    @DisplayName("Disabled export returns 404")
    void disabled_returns404() throws Exception {
        when(featureFlags.isCustomerExport()).thenReturn(false);

        mockMvc.perform(get("/api/customers").header("x-export-key", EXPORT_KEY))
                .andExpect(status().isNotFound());

        verifyNoInteractions(customerRecordService);
    }
}
