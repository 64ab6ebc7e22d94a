package com.webdoc.dispatch.api;

import com.webdoc.core.model.PipelineConfig;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/config")
public class ConfigController {

    /**
     * GET /api/v1/config/example: A valid pipeline configuration to edit and submit.
     */
    @GetMapping("/example")
    public ResponseEntity<PipelineConfig> example() {
        return ResponseEntity.ok(PipelineConfig.example());
    }
}
