package com.lanhub.collector.intake.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lanhub.collector.intake.model.Submission;
import com.lanhub.collector.intake.model.SubmissionReceipt;
import com.lanhub.collector.intake.model.SubmitterInfo;
import com.lanhub.collector.intake.model.TableSchema;
import com.lanhub.collector.intake.service.DataSubmissionService;
import com.lanhub.collector.intake.service.IngestionGate;
import com.lanhub.collector.intake.service.InvalidSubmissionException;
import com.lanhub.collector.intake.service.SubmissionService;
import com.lanhub.collector.intake.service.TaskService;
import com.lanhub.collector.intake.storage.IncomingFile;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class SubmissionController {
    private static final TypeReference<Map<String, Object>> FORM_DATA = new TypeReference<>() {
    };

    private final SubmissionService submissionService;
    private final DataSubmissionService dataSubmissionService;
    private final IngestionGate ingestionGate;
    private final TaskService taskService;
    private final ObjectMapper objectMapper;

    public SubmissionController(
        SubmissionService submissionService,
        DataSubmissionService dataSubmissionService,
        IngestionGate ingestionGate,
        TaskService taskService,
        ObjectMapper objectMapper
    ) {
        this.submissionService = submissionService;
        this.dataSubmissionService = dataSubmissionService;
        this.ingestionGate = ingestionGate;
        this.taskService = taskService;
        this.objectMapper = objectMapper;
    }

    @PostMapping(path = "/submit/{slug}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public SubmissionReceipt submitFile(
        @PathVariable("slug") String slug,
        @RequestParam("name") String name,
        @RequestParam("contact") String contact,
        @RequestParam("department") String department,
        @RequestParam(name = "password", required = false) String password,
        @RequestPart(name = "file", required = false) MultipartFile file,
        @RequestPart(name = "attachments", required = false) List<MultipartFile> attachments,
        HttpServletRequest httpRequest
    ) {
        if (file == null || file.isEmpty()) {
            throw new InvalidSubmissionException("A non-empty file is required");
        }
        return submissionService.submitFile(
            slug,
            password,
            new SubmitterInfo(name, contact, department, httpRequest.getRemoteAddr()),
            toIncoming(file),
            toIncomingFiles(attachments)
        );
    }

    @GetMapping("/template/{slug}")
    public ResponseEntity<Resource> downloadTemplate(
        @PathVariable("slug") String slug,
        @RequestHeader(name = "X-Password", required = false) String password
    ) {
        Path template = taskService.templateFile(slug, password)
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Task " + slug + " has no template"));
        ContentDisposition disposition = ContentDisposition.attachment()
            .filename(template.getFileName().toString(), StandardCharsets.UTF_8)
            .build();
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
            .contentType(MediaType.APPLICATION_OCTET_STREAM)
            .body(new FileSystemResource(template));
    }

    @PostMapping(path = "/distribution/{slug}/submit", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public SubmissionReceipt submitData(
        @PathVariable("slug") String slug,
        @RequestBody DataSubmitRequest request,
        HttpServletRequest httpRequest
    ) {
        return dataSubmissionService.submitRecord(
            slug,
            request.password(),
            new SubmitterInfo(request.name(), request.contact(), request.department(), httpRequest.getRemoteAddr()),
            request.data(),
            List.of()
        );
    }

    /**
     * Form variant of the data submission: the record arrives as a JSON {@code data} field next
     * to optional {@code attachment} file parts.
     */
    @PostMapping(path = "/distribution/{slug}/submit", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public SubmissionReceipt submitDataWithAttachments(
        @PathVariable("slug") String slug,
        @RequestParam("name") String name,
        @RequestParam("contact") String contact,
        @RequestParam("department") String department,
        @RequestParam(name = "password", required = false) String password,
        @RequestParam("data") String data,
        @RequestPart(name = "attachment", required = false) List<MultipartFile> attachments,
        HttpServletRequest httpRequest
    ) {
        Map<String, Object> fields;
        try {
            fields = objectMapper.readValue(data, FORM_DATA);
        } catch (JsonProcessingException e) {
            throw new InvalidSubmissionException("Form data is not a JSON object: " + e.getOriginalMessage());
        }
        return dataSubmissionService.submitRecord(
            slug,
            password,
            new SubmitterInfo(name, contact, department, httpRequest.getRemoteAddr()),
            fields,
            toIncomingFiles(attachments)
        );
    }

    @GetMapping("/distribution/{slug}/schema")
    public TableSchema getSchema(@PathVariable("slug") String slug) {
        return dataSubmissionService.getSchema(slug);
    }

    @DeleteMapping("/submissions/{id}")
    public Submission deleteSubmission(@PathVariable("id") long id) {
        return ingestionGate.deleteSubmission(id)
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Submission " + id + " not found"));
    }

    private List<IncomingFile> toIncomingFiles(List<MultipartFile> parts) {
        return parts == null
            ? List.of()
            : parts.stream().filter(part -> !part.isEmpty()).map(this::toIncoming).toList();
    }

    private IncomingFile toIncoming(MultipartFile part) {
        return new IncomingFile(part.getOriginalFilename(), part.getSize(), part);
    }
}
