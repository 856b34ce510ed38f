package com.example.RagFlow.controller;

import com.example.RagFlow.model.DocumentResponse;
import com.example.RagFlow.service.DocumentIngestionService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@RestController
@Tag(name = "documents")
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class DocumentController {

    private final DocumentIngestionService ingestionService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public DocumentResponse upload(@RequestParam Long workflowId,
                                   @RequestParam("file") MultipartFile file) {
        return ingestionService.upload(workflowId, file);
    }

    @GetMapping
    public List<DocumentResponse> list(@RequestParam(required = false) Long workflowId) {
        return ingestionService.list(workflowId);
    }

    @GetMapping("/{id}")
    public DocumentResponse get(@PathVariable Long id) {
        return ingestionService.get(id);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable Long id) {
        ingestionService.delete(id);
    }
}
