package com.example.RagFlow.controller;

import com.example.RagFlow.model.ChatMessageResponse;
import com.example.RagFlow.model.ChatSessionRequest;
import com.example.RagFlow.model.ChatSessionResponse;
import com.example.RagFlow.service.ChatSessionService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@Tag(name = "chat")
@RequestMapping("/api/chat/sessions")
@RequiredArgsConstructor
public class ChatSessionController {

    private final ChatSessionService sessionService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ChatSessionResponse create(@RequestBody ChatSessionRequest request) {
        return sessionService.create(request);
    }

    @GetMapping
    public List<ChatSessionResponse> list(@RequestParam(required = false) Long workflowId,
                                          @RequestParam(defaultValue = "0") int skip,
                                          @RequestParam(defaultValue = "100") int limit) {
        return sessionService.list(workflowId, skip, limit);
    }

    @GetMapping("/{id}")
    public ChatSessionResponse get(@PathVariable Long id) {
        return sessionService.get(id);
    }

    @GetMapping("/{id}/messages")
    public List<ChatMessageResponse> messages(@PathVariable Long id,
                                              @RequestParam(defaultValue = "0") int skip,
                                              @RequestParam(defaultValue = "100") int limit) {
        return sessionService.listMessages(id, skip, limit);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable Long id) {
        sessionService.delete(id);
    }
}
