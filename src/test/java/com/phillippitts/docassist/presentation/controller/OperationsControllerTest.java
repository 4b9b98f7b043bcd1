package com.phillippitts.docassist.presentation.controller;

import com.phillippitts.docassist.domain.OperationCategory;
import com.phillippitts.docassist.service.admission.AdmissionController;
import com.phillippitts.docassist.service.admission.CategoryStatus;
import com.phillippitts.docassist.service.policy.PolicyStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class OperationsControllerTest {

    private AdmissionController admission;
    private PolicyStore policyStore;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        admission = mock(AdmissionController.class);
        policyStore = mock(PolicyStore.class);
        mvc = MockMvcBuilders.standaloneSetup(
                new OperationsController(admission, () -> List.of("m1", "m2"), policyStore)).build();
    }

    @Test
    void statusListsCategoriesCapabilitiesAndPin() throws Exception {
        Map<OperationCategory, CategoryStatus> status = new EnumMap<>(OperationCategory.class);
        status.put(OperationCategory.CONTENT_SUMMARIZATION, new CategoryStatus(2, 1));
        when(admission.getStatus()).thenReturn(status);
        when(policyStore.pinnedCapability()).thenReturn(Optional.of("m2"));

        mvc.perform(get("/api/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.categories['content-summarization'].active").value(2))
                .andExpect(jsonPath("$.categories['content-summarization'].queued").value(1))
                .andExpect(jsonPath("$.capabilities[1]").value("m2"))
                .andExpect(jsonPath("$.pinned").value("m2"));
    }

    @Test
    void cancelsByPathKey() throws Exception {
        when(admission.cancel(OperationCategory.INTERACTIVE_QUERY, "doc-1")).thenReturn(true);

        mvc.perform(delete("/api/operations/interactive-query/doc-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cancelled").value(1));
    }

    @Test
    void cancelsUrlKeyFromQueryParameter() throws Exception {
        when(admission.cancel(OperationCategory.CONTENT_INDEXING, "https://example.org/a?b=c")).thenReturn(true);

        mvc.perform(delete("/api/operations/content-indexing").param("key", "https://example.org/a?b=c"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cancelled").value(1));
    }

    @Test
    void cancelsWholeCategory() throws Exception {
        when(admission.cancelAll(OperationCategory.CONTENT_SUMMARIZATION)).thenReturn(3);

        mvc.perform(delete("/api/operations/content-summarization"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cancelled").value(3));
    }

    @Test
    void cancelsKeyAcrossCategories() throws Exception {
        when(admission.cancelForKey("doc-1")).thenReturn(true);

        mvc.perform(delete("/api/operations").param("key", "doc-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cancelled").value(true));
    }
}
