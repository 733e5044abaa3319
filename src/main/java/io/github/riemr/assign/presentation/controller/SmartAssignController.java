package io.github.riemr.assign.presentation.controller;

import io.github.riemr.assign.application.dto.AppliedAssignmentsResponse;
import io.github.riemr.assign.application.dto.ReoptimizeRequest;
import io.github.riemr.assign.application.dto.SmartAssignRequest;
import io.github.riemr.assign.application.service.SmartAssignmentService;
import io.github.riemr.assign.optimization.solution.OptimizationResult;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/sop/smart-assign")
public class SmartAssignController {
    private final SmartAssignmentService service;

    public SmartAssignController(SmartAssignmentService service) {
        this.service = service;
    }

    /** 割当案のみ（登録しない） */
    @GetMapping
    public ResponseEntity<?> recommend(@RequestParam(name = "restaurant", required = false) String restaurantId,
                                       @RequestParam(name = "sop_ids", required = false) String sopIds,
                                       @RequestParam(name = "priority", required = false) String priority) {
        List<String> ids = sopIds == null ? List.of() : Arrays.stream(sopIds.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        if (ids.isEmpty()) {
            return badRequest("At least one SOP ID is required");
        }
        if (restaurantId == null || restaurantId.isBlank()) {
            return badRequest("restaurant is required");
        }
        SmartAssignRequest req = new SmartAssignRequest();
        req.setRestaurantId(restaurantId);
        req.setSopIds(ids);
        req.setPriority(priority);
        OptimizationResult result = service.recommend(req);
        return ResponseEntity.ok(result);
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AppliedAssignmentsResponse> create(@Valid @RequestBody SmartAssignRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(service.createAssignments(req));
    }

    @PutMapping(path = "/optimize", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AppliedAssignmentsResponse> reoptimize(@Valid @RequestBody ReoptimizeRequest req) {
        return ResponseEntity.ok(service.reoptimize(req));
    }

    private static ResponseEntity<Map<String, Object>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message, "errorCode", "VALIDATION_ERROR"));
    }
}
