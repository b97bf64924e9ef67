package com.modelgate.modelgate_backend.controller;

import com.modelgate.modelgate_backend.model.domain.CallerIdentity;
import com.modelgate.modelgate_backend.model.dto.ModelsResult;
import com.modelgate.modelgate_backend.model.dto.Verbosity;
import com.modelgate.modelgate_backend.service.ModelsConfigService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/models")
public class ModelController {

    static final String USER_ID_HEADER = "X-User-Id";
    static final String USER_ROLE_HEADER = "X-User-Role";

    private final ModelsConfigService modelsConfigService;

    public ModelController(ModelsConfigService modelsConfigService) {
        this.modelsConfigService = modelsConfigService;
    }

    /**
     * GET /api/models: endpoint name to model ids.
     * GET /api/models?includeDetails=true: {@code {models, modelDetails}}.
     */
    @GetMapping
    public ResponseEntity<Object> getModels(
            @RequestParam(value = "includeDetails", required = false) String includeDetails,
            @RequestHeader(value = USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = USER_ROLE_HEADER, required = false) String userRole) {
        try {
            Verbosity verbosity = Verbosity.fromIncludeDetails("true".equals(includeDetails));
            ModelsResult result = modelsConfigService.loadModels(CallerIdentity.of(userId, userRole), verbosity);
            return ResponseEntity.ok(result);
        } catch (Exception e) {
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Error fetching models: {}", msg, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", msg));
        }
    }
}
