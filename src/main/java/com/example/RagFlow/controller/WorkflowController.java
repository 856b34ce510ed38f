package com.example.RagFlow.controller;

import com.example.RagFlow.engine.WorkflowExecutionService;
import com.example.RagFlow.model.ValidationResult;
import com.example.RagFlow.model.WorkflowExecuteRequest;
import com.example.RagFlow.model.WorkflowExecuteResponse;
import com.example.RagFlow.model.WorkflowRequest;
import com.example.RagFlow.model.WorkflowResponse;
import com.example.RagFlow.service.SessionTurnGuard;
import com.example.RagFlow.service.WorkflowService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@Tag(name = "workflows")
@RequestMapping("/api/workflows")
@RequiredArgsConstructor
public class WorkflowController {

    private final WorkflowService workflowService;
    private final WorkflowExecutionService executionService;
    private final SessionTurnGuard turnGuard;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public WorkflowResponse create(@RequestBody WorkflowRequest request) {
        return workflowService.create(request);
    }

    @GetMapping
    public List<WorkflowResponse> list(@RequestParam(defaultValue = "0") int skip,
                                       @RequestParam(defaultValue = "100") int limit) {
        return workflowService.list(skip, limit);
    }

    @GetMapping("/{id}")
    public WorkflowResponse get(@PathVariable Long id) {
        return workflowService.get(id);
    }

    @PutMapping("/{id}")
    public WorkflowResponse update(@PathVariable Long id, @RequestBody WorkflowRequest request) {
        return workflowService.update(id, request);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable Long id) {
        workflowService.delete(id);
    }

    @PostMapping("/{id}/validate")
    public ValidationResult validate(@PathVariable Long id) {
        return workflowService.validate(id);
    }

    @PostMapping("/execute")
    public WorkflowExecuteResponse execute(@RequestBody WorkflowExecuteRequest request) {
        if (request.workflowId() == null) {
            throw new IllegalArgumentException("workflowId is required");
        }
        return turnGuard.runExclusive(request.sessionId(),
                () -> executionService.execute(request.workflowId(), request.query(), request.sessionId()));
    }
}
