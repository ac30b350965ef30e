package tech.noetzold.crisis_api.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.crisis_api.model.*;
import tech.noetzold.crisis_api.service.CrisisResponseComposer;
import tech.noetzold.crisis_api.service.SafetyAssessmentService;
import tech.noetzold.crisis_api.service.SafetyReportService;

@RestController
@RequestMapping("/safety")
public class SafetyController {

    private final SafetyAssessmentService assessmentService;
    private final CrisisResponseComposer responseComposer;
    private final SafetyReportService reportService;

    public SafetyController(SafetyAssessmentService assessmentService,
                            CrisisResponseComposer responseComposer,
                            SafetyReportService reportService) {
        this.assessmentService = assessmentService;
        this.responseComposer = responseComposer;
        this.reportService = reportService;
    }

    @Tag(name = "Safety")
    @Operation(summary = "Assess one inbound message for crisis risk")
    @PostMapping("/analyze")
    public SafetyVerdict analyze(@Valid @RequestBody AnalyzeRequest req) {
        return assessmentService.analyze(req.sessionId(), req.message(), req.emotionalState());
    }

    @Tag(name = "Safety")
    @Operation(summary = "Assess a message and compose the intervention response")
    @PostMapping("/intervene")
    public InterventionResult intervene(@Valid @RequestBody AnalyzeRequest req) {
        SafetyVerdict verdict = assessmentService.analyze(req.sessionId(), req.message(), req.emotionalState());
        return new InterventionResult(verdict, responseComposer.compose(verdict));
    }

    @Tag(name = "Safety")
    @GetMapping("/escalation")
    public EscalationAssessment escalation(@RequestParam("session_id") String sessionId,
                                           @RequestParam("crisis_level") int crisisLevel) {
        return assessmentService.checkEscalation(sessionId, crisisLevel);
    }

    @Tag(name = "Safety")
    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> endSession(@PathVariable("sessionId") String sessionId) {
        return assessmentService.endSession(sessionId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @Tag(name = "Reports")
    @GetMapping("/report")
    public SessionSafetyReport report(@RequestParam("session_id") String sessionId) {
        return reportService.report(sessionId);
    }

    @Tag(name = "Reports")
    @GetMapping("/statistics")
    public SafetyStatistics statistics(@RequestParam(value = "days", defaultValue = "30") int days) {
        return reportService.statistics(days);
    }

    @Tag(name = "Reports")
    @GetMapping("/health")
    public HealthStatus health() {
        return reportService.health();
    }
}
