package com.example.shifthybrid.schedule;

import com.example.shifthybrid.common.ApiResponse;
import com.example.shifthybrid.constraint.ConstraintPriorityRegistry;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/schedule")
public class ScheduleController {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleController.class);

    private final ScheduleGenerationService generationService;
    private final ConstraintPriorityRegistry registry;

    public ScheduleController(ScheduleGenerationService generationService, ConstraintPriorityRegistry registry) {
        this.generationService = generationService;
        this.registry = registry;
    }

    // エラーは GlobalExceptionHandler で変換する
    @PostMapping("/generate")
    public ResponseEntity<ApiResponse<GenerationReport>> generate(@Valid @RequestBody GenerationRequest request) {
        GenerationReport report = generationService.generate(request);
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("method", report.method());
        meta.put("band", report.band());
        meta.put("preRepairViolations", report.preRepairViolations().size());
        meta.put("finalViolations", report.finalViolations().size());
        meta.put("lockedCells", report.lockedCellCount());
        logger.debug("シフトを返却します: {}", meta);
        return ResponseEntity.ok(ApiResponse.success("シフトを生成しました", report, meta));
    }

    @GetMapping("/registry")
    public ResponseEntity<ApiResponse<List<ConstraintPriorityRegistry.KindDescriptor>>> registry() {
        return ResponseEntity.ok(ApiResponse.success(registry.catalog()));
    }
}
