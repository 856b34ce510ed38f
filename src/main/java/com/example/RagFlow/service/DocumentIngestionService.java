package com.example.RagFlow.service;

import com.example.RagFlow.config.IngestionProperties;
import com.example.RagFlow.exception.ResourceNotFoundException;
import com.example.RagFlow.model.DocumentResponse;
import com.example.RagFlow.model.KnowledgeDocument;
import com.example.RagFlow.repository.KnowledgeDocumentRepository;
import com.example.RagFlow.repository.WorkflowRepository;
import com.example.RagFlow.util.TextChunker;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Uploads plain-text documents into a workflow's knowledge base:
 * store the row, chunk the text, embed and index the chunks, then mark it processed.
 */
@Service
@RequiredArgsConstructor
public class DocumentIngestionService {

    private static final Logger log = LoggerFactory.getLogger(DocumentIngestionService.class);

    private final KnowledgeDocumentRepository documentRepository;
    private final WorkflowRepository workflowRepository;
    private final VectorIndex vectorIndex;
    private final IngestionProperties properties;

    public DocumentResponse upload(Long workflowId, MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Uploaded file is empty");
        }
        if (file.getSize() > properties.getMaxFileSize()) {
            throw new IllegalArgumentException("File exceeds maximum size of " + properties.getMaxFileSize() + " bytes");
        }
        String contentType = file.getContentType();
        if (contentType != null && !contentType.startsWith("text/")) {
            throw new IllegalArgumentException("Unsupported content type: " + contentType);
        }

        String text;
        try {
            text = new String(file.getBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read uploaded file", e);
        }
        String filename = file.getOriginalFilename() == null || file.getOriginalFilename().isBlank()
                ? "document.txt"
                : file.getOriginalFilename();
        return ingest(workflowId, filename, contentType, text);
    }

    public DocumentResponse ingest(Long workflowId, String filename, String contentType, String text) {
        if (workflowId != null && !workflowRepository.existsById(workflowId)) {
            throw ResourceNotFoundException.workflow(workflowId);
        }

        KnowledgeDocument document = new KnowledgeDocument();
        document.setWorkflowId(workflowId);
        document.setFilename(filename);
        document.setContentType(contentType);
        document.setFileSize(text.getBytes(StandardCharsets.UTF_8).length);
        document.setExtractedText(text);
        document.setProcessed(false);
        document = documentRepository.save(document);

        List<String> chunks = TextChunker.chunk(text, properties.getChunkSize(), properties.getChunkOverlap());
        int written = chunks.isEmpty()
                ? 0
                : vectorIndex.upsert(document.getId(), chunks, Map.of("filename", filename));

        document.setChunkCount(written);
        document.setProcessed(true);
        document = documentRepository.save(document);

        log.info("Ingested document {} ('{}') into workflow {} as {} chunk(s)",
                document.getId(), filename, workflowId, written);
        return DocumentResponse.from(document);
    }

    public List<DocumentResponse> list(Long workflowId) {
        List<KnowledgeDocument> documents = workflowId == null
                ? documentRepository.findAll()
                : documentRepository.findByWorkflowIdOrderByIdAsc(workflowId);
        return documents.stream().map(DocumentResponse::from).toList();
    }

    public DocumentResponse get(Long documentId) {
        return DocumentResponse.from(load(documentId));
    }

    public void delete(Long documentId) {
        KnowledgeDocument document = load(documentId);
        vectorIndex.deleteByDocument(documentId);
        documentRepository.delete(document);
        log.info("Deleted document {}", documentId);
    }

    private KnowledgeDocument load(Long documentId) {
        return documentRepository.findById(documentId)
                .orElseThrow(() -> ResourceNotFoundException.document(documentId));
    }
}
