package com.automaker.dispatch.api;

import com.automaker.core.config.AutomakerProperties;
import com.automaker.core.engine.ApprovalOutcome;
import com.automaker.core.engine.FeatureExecutionController;
import com.automaker.core.engine.FeatureVerificationService;
import com.automaker.core.engine.RunningAgentInfo;
import com.automaker.core.errors.FeatureAlreadyRunningException;
import com.automaker.core.notification.Notification;
import com.automaker.core.notification.NotificationService;
import com.automaker.core.persistence.FeatureStore;
import com.automaker.core.scheduler.AutoLoopScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for auto mode: the per-project loop, single features, plan approval and events.
 */
@RestController
@RequestMapping("/api/v1/auto-mode")
public class AutoModeController {

    private static final Logger log = LoggerFactory.getLogger(AutoModeController.class);

    private final AutoLoopScheduler scheduler;
    private final FeatureExecutionController executionController;
    private final FeatureVerificationService verificationService;
    private final FeatureStore featureStore;
    private final NotificationService notifications;
    private final SseStreamingService sseStreamingService;
    private final boolean defaultUseWorktrees;

    public AutoModeController(AutoLoopScheduler scheduler,
                              FeatureExecutionController executionController,
                              FeatureVerificationService verificationService,
                              FeatureStore featureStore,
                              NotificationService notifications,
                              SseStreamingService sseStreamingService,
                              AutomakerProperties properties) {
        this.scheduler = scheduler;
        this.executionController = executionController;
        this.verificationService = verificationService;
        this.featureStore = featureStore;
        this.notifications = notifications;
        this.sseStreamingService = sseStreamingService;
        this.defaultUseWorktrees = properties.getAutoLoop().isUseWorktrees();
    }

    // -- loop ---

    @PostMapping("/start")
    public ResponseEntity<Map<String, Object>> start(@RequestBody StartAutoModeRequest request) {
        if (isBlank(request.projectPath())) {
            return badRequest("projectPath is required");
        }
        try {
            int ceiling = scheduler.start(request.projectPath(), request.maxConcurrency());
            return ResponseEntity.ok(Map.of("success", true,
                    "message", "Auto mode started with max " + ceiling + " concurrent features"));
        } catch (IllegalStateException e) {
            return error(HttpStatus.CONFLICT, e.getMessage());
        }
    }

    @PostMapping("/stop")
    public ResponseEntity<Map<String, Object>> stop(@RequestBody ProjectRequest request) {
        if (isBlank(request.projectPath())) {
            return badRequest("projectPath is required");
        }
        int stillRunning = scheduler.stop(request.projectPath());
        return ResponseEntity.ok(Map.of("success", true, "runningFeatures", stillRunning));
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status(@RequestParam(required = false) String projectPath) {
        if (isBlank(projectPath)) {
            return ResponseEntity.ok(Map.of(
                    "activeAutoLoopProjects", scheduler.getActiveAutoLoopProjects(),
                    "runningAgents", executionController.getRunningAgents().size()));
        }
        return ResponseEntity.ok(scheduler.getStatusForProject(projectPath));
    }

    @GetMapping("/running-agents")
    public ResponseEntity<List<RunningAgentInfo>> runningAgents() {
        return ResponseEntity.ok(executionController.getRunningAgents());
    }

    @GetMapping("/notifications")
    public ResponseEntity<List<Notification>> notifications(@RequestParam(required = false) String projectPath) {
        return ResponseEntity.ok(notifications.recent(projectPath));
    }

    // -- single features ---

    @PostMapping("/run-feature")
    public ResponseEntity<Map<String, Object>> runFeature(@RequestBody FeatureRequest request) {
        Optional<ResponseEntity<Map<String, Object>>> invalid = validateFeature(request.projectPath(), request.featureId());
        if (invalid.isPresent()) {
            return invalid.get();
        }
        try {
            executionController.executeFeatureAsync(request.projectPath(), request.featureId(),
                    request.worktreesOrDefault(defaultUseWorktrees), false, null);
            return ResponseEntity.accepted().body(Map.of("success", true));
        } catch (FeatureAlreadyRunningException e) {
            return error(HttpStatus.CONFLICT, e.getMessage());
        }
    }

    @PostMapping("/resume-feature")
    public ResponseEntity<Map<String, Object>> resumeFeature(@RequestBody FeatureRequest request) {
        Optional<ResponseEntity<Map<String, Object>>> invalid = validateFeature(request.projectPath(), request.featureId());
        if (invalid.isPresent()) {
            return invalid.get();
        }
        try {
            executionController.resumeFeatureAsync(request.projectPath(), request.featureId(),
                    request.worktreesOrDefault(defaultUseWorktrees));
            return ResponseEntity.accepted().body(Map.of("success", true));
        } catch (FeatureAlreadyRunningException e) {
            return error(HttpStatus.CONFLICT, e.getMessage());
        }
    }

    @PostMapping("/follow-up-feature")
    public ResponseEntity<Map<String, Object>> followUpFeature(@RequestBody FollowUpRequest request) {
        Optional<ResponseEntity<Map<String, Object>>> invalid = validateFeature(request.projectPath(), request.featureId());
        if (invalid.isPresent()) {
            return invalid.get();
        }
        if (isBlank(request.prompt())) {
            return badRequest("prompt is required");
        }
        try {
            executionController.followUpFeatureAsync(request.projectPath(), request.featureId(), request.prompt(),
                    request.imagePaths() != null ? request.imagePaths() : List.of(),
                    request.useWorktrees() != null ? request.useWorktrees() : defaultUseWorktrees);
            return ResponseEntity.accepted().body(Map.of("success", true));
        } catch (FeatureAlreadyRunningException e) {
            return error(HttpStatus.CONFLICT, e.getMessage());
        }
    }

    @PostMapping("/stop-feature")
    public ResponseEntity<Map<String, Object>> stopFeature(@RequestBody FeatureRequest request) {
        if (isBlank(request.featureId())) {
            return badRequest("featureId is required");
        }
        boolean stopped = executionController.stopFeature(request.featureId());
        return ResponseEntity.ok(Map.of("success", true, "stopped", stopped));
    }

    @PostMapping("/verify-feature")
    public ResponseEntity<Map<String, Object>> verifyFeature(@RequestBody FeatureRequest request) {
        Optional<ResponseEntity<Map<String, Object>>> invalid = validateFeature(request.projectPath(), request.featureId());
        if (invalid.isPresent()) {
            return invalid.get();
        }
        boolean passes = verificationService.verifyFeature(request.projectPath(), request.featureId());
        return ResponseEntity.ok(Map.of("success", true, "passes", passes));
    }

    @PostMapping("/commit-feature")
    public ResponseEntity<Map<String, Object>> commitFeature(@RequestBody FeatureRequest request) {
        Optional<ResponseEntity<Map<String, Object>>> invalid = validateFeature(request.projectPath(), request.featureId());
        if (invalid.isPresent()) {
            return invalid.get();
        }
        Optional<String> hash = verificationService.commitFeature(
                request.projectPath(), request.featureId(), request.worktreePath());
        Map<String, Object> body = new HashMap<>();
        body.put("success", true);
        body.put("hash", hash.orElse(null));
        return ResponseEntity.ok(body);
    }

    // -- plan approval ---

    @PostMapping("/approve-plan")
    public ResponseEntity<Map<String, Object>> approvePlan(@RequestBody ApprovePlanRequest request) {
        if (isBlank(request.featureId())) {
            return badRequest("featureId is required");
        }
        if (request.approved() == null) {
            return badRequest("approved is required");
        }
        log.info("Plan {} for feature {}", request.approved() ? "approved" : "rejected", request.featureId());
        ApprovalOutcome outcome = executionController.resolvePlanApproval(request.featureId(), request.approved(),
                request.editedPlan(), request.feedback(), request.projectPath());
        if (!outcome.success()) {
            return badRequest(outcome.error());
        }
        return ResponseEntity.ok(Map.of("success", true, "approved", request.approved()));
    }

    // -- events ---

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@RequestParam(required = false) String projectPath) {
        return sseStreamingService.createEmitter(isBlank(projectPath) ? null : projectPath);
    }

    // -- helpers ---

    private Optional<ResponseEntity<Map<String, Object>>> validateFeature(String projectPath, String featureId) {
        if (isBlank(projectPath) || isBlank(featureId)) {
            return Optional.of(badRequest("projectPath and featureId are required"));
        }
        if (featureStore.load(projectPath, featureId).isEmpty()) {
            return Optional.of(error(HttpStatus.NOT_FOUND, "Feature " + featureId + " not found"));
        }
        return Optional.empty();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static ResponseEntity<Map<String, Object>> badRequest(String message) {
        return error(HttpStatus.BAD_REQUEST, message);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
