package com.agentrelay.orchestrator.api;

import com.agentrelay.orchestrator.api.dto.RunResponse;
import com.agentrelay.orchestrator.api.dto.StageResponse;
import com.agentrelay.orchestrator.api.dto.SubmitRunRequest;
import com.agentrelay.orchestrator.model.RunRequest;
import com.agentrelay.orchestrator.model.RunResult;
import com.agentrelay.orchestrator.service.CapacityExceededException;
import com.agentrelay.orchestrator.service.ExecutionTracker;
import com.agentrelay.orchestrator.service.RunRecord;
import com.agentrelay.orchestrator.service.RunScheduler;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST API for runs.
 *
 * POST /runs               - submit a request to the agent pipeline (202, poll by id)
 * POST /runs?sync=true     - run on the request thread and return the full result
 * GET  /runs/{id}          - poll the state of a run
 * GET  /runs/{id}/stages   - list the stages executed so far
 */
@RestController
@RequestMapping("/runs")
public class RunController {

    private final RunScheduler     scheduler;
    private final ExecutionTracker tracker;

    public RunController(RunScheduler scheduler, ExecutionTracker tracker) {
        this.scheduler = scheduler;
        this.tracker   = tracker;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/runs \
     *     -H "Content-Type: application/json" \
     *     -d '{"userId":"u-1","message":"Our checkout API p95 is 2.4 s, how do we get it under 500 ms?"}'
     */
    @PostMapping
    public ResponseEntity<?> submit(@Valid @RequestBody SubmitRunRequest req,
                                    @RequestParam(defaultValue = "false") boolean sync) {
        RunRequest request;
        try {
            request = req.toRunRequest();
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
        try {
            if (sync) {
                RunResult result = scheduler.runSync(request);
                return ResponseEntity.ok(result);
            }
            RunRecord run = scheduler.submit(request);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(RunResponse.from(run));
        } catch (CapacityExceededException e) {
            throw new ResponseStatusException(HttpStatus.TOO_MANY_REQUESTS, e.getMessage(), e);
        }
    }

    /** Returns 404 if the run id is unknown or has been purged. */
    @GetMapping("/{id}")
    public RunResponse getRun(@PathVariable String id) {
        return RunResponse.from(find(id));
    }

    @GetMapping("/{id}/stages")
    public List<StageResponse> getStages(@PathVariable String id) {
        return find(id).stages().stream()
                .map(StageResponse::from)
                .toList();
    }

    private RunRecord find(String id) {
        return tracker.find(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + id));
    }
}
