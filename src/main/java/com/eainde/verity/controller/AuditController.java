package com.eainde.verity.controller;

import com.eainde.verity.model.AuditRequest;
import com.eainde.verity.workflow.AuditPipeline;
import com.eainde.verity.workflow.AuditPipelineException;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@Log4j2
@RestController
@RequestMapping("/api/audit")
public class AuditController {

    private final AuditPipeline pipeline;

    public AuditController(AuditPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @PostMapping("/start")
    public AuditReport start(@RequestBody(required = false) AuditRequest request) {
        return AuditReport.from(pipeline.run(request == null ? AuditRequest.demo() : request));
    }

    @GetMapping("/demo")
    public AuditReport demo() {
        return AuditReport.from(pipeline.run(AuditRequest.demo()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(error("INVALID_REQUEST", e.getMessage(), null));
    }

    @ExceptionHandler(AuditPipelineException.class)
    public ResponseEntity<Map<String, Object>> pipelineFailure(AuditPipelineException e) {
        log.error("Audit {} failed", e.getAuditId(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(error("AUDIT_PIPELINE_FAILURE", e.getMessage(), e.getAuditId()));
    }

    private static Map<String, Object> error(String code, String message, String auditId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        if (auditId != null) {
            body.put("auditId", auditId);
        }
        return body;
    }
}
