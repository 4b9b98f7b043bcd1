package com.phillippitts.docassist.presentation.controller;

import com.phillippitts.docassist.domain.OperationCategory;
import com.phillippitts.docassist.service.admission.AdmissionController;
import com.phillippitts.docassist.service.admission.CategoryStatus;
import com.phillippitts.docassist.service.capability.CapabilityProbe;
import com.phillippitts.docassist.service.policy.PolicyStore;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Admission status and cancellation.
 */
@RestController
@RequestMapping("/api")
class OperationsController {

    private final AdmissionController admission;
    private final CapabilityProbe probe;
    private final PolicyStore policyStore;

    OperationsController(AdmissionController admission, CapabilityProbe probe, PolicyStore policyStore) {
        this.admission = admission;
        this.probe = probe;
        this.policyStore = policyStore;
    }

    @GetMapping("/status")
    StatusResponse status() {
        Map<String, CategoryStatus> categories = new LinkedHashMap<>();
        admission.getStatus().forEach((category, status) -> categories.put(category.id(), status));
        return new StatusResponse(categories, probe.availableCapabilities(),
                policyStore.pinnedCapability().orElse(null));
    }

    @DeleteMapping("/operations/{category}/{key}")
    Map<String, Object> cancel(@PathVariable String category, @PathVariable String key) {
        return Map.of("cancelled", admission.cancel(OperationCategory.fromId(category), key) ? 1 : 0);
    }

    /**
     * Cancels one key when {@code key} is given (for keys that cannot be path segments, such
     * as URLs), otherwise everything in the category.
     */
    @DeleteMapping("/operations/{category}")
    Map<String, Object> cancelAll(@PathVariable String category,
                                  @RequestParam(name = "key", required = false) String key) {
        OperationCategory resolved = OperationCategory.fromId(category);
        if (key != null && !key.isBlank()) {
            return Map.of("cancelled", admission.cancel(resolved, key) ? 1 : 0);
        }
        return Map.of("cancelled", admission.cancelAll(resolved));
    }

    /**
     * Cancels a key in every category, e.g. when its source was closed.
     */
    @DeleteMapping("/operations")
    Map<String, Object> cancelForKey(@RequestParam("key") String key) {
        return Map.of("cancelled", admission.cancelForKey(key));
    }

    record StatusResponse(Map<String, CategoryStatus> categories, List<String> capabilities, String pinned) {}
}
