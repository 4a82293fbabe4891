package uk.gegc.dolos.features.generation.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import uk.gegc.dolos.features.generation.api.dto.CreateDocumentRequest;
import uk.gegc.dolos.features.generation.api.dto.EditTimestampRequest;
import uk.gegc.dolos.features.generation.api.dto.SanitizeResultDto;
import uk.gegc.dolos.features.generation.api.dto.SanitizeStoredRequest;
import uk.gegc.dolos.features.generation.application.DocumentGenerationService;
import uk.gegc.dolos.features.metadata.api.dto.DocumentMetadataDto;
import uk.gegc.dolos.features.metadata.api.dto.SentenceMetadataDto;
import uk.gegc.dolos.features.revision.domain.model.SanitizeOptions;
import uk.gegc.dolos.shared.exception.DocumentStorageException;
import uk.gegc.dolos.shared.exception.EmptyInputException;
import uk.gegc.dolos.shared.util.TimestampParser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@RestController
@RequestMapping("/api/v1/documents")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Documents", description = "Generate, edit and sanitize word-processing packages with tracked-change history")
public class DocumentRevisionController {

    static final MediaType DOCX = MediaType.parseMediaType(
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document");

    private final DocumentGenerationService generationService;

    @Operation(
            summary = "Create document",
            description = "Segments the text (or takes the sentence list), synthesizes a timeline and writes a package "
                    + "where each sentence is an insertion revision"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "201",
                    description = "Document created",
                    content = @Content(schema = @Schema(implementation = DocumentMetadataDto.class))
            ),
            @ApiResponse(responseCode = "400", description = "Empty input, invalid interval, mode or start date")
    })
    @PostMapping
    public ResponseEntity<DocumentMetadataDto> createDocument(@Valid @RequestBody CreateDocumentRequest request) {
        DocumentMetadataDto created = generationService.createDocument(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @Operation(summary = "Download package")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Package bytes"),
            @ApiResponse(responseCode = "404", description = "No stored package with that name")
    })
    @GetMapping("/{filename}")
    public ResponseEntity<byte[]> downloadDocument(
            @Parameter(description = "Stored package name", required = true) @PathVariable String filename) {
        return packageResponse(filename, generationService.getPackage(filename));
    }

    @Operation(summary = "Get document metadata", description = "Document fields plus every sentence's timeline entry")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Metadata retrieved",
                    content = @Content(schema = @Schema(implementation = DocumentMetadataDto.class))
            ),
            @ApiResponse(responseCode = "404", description = "Document not found")
    })
    @GetMapping("/{filename}/metadata")
    public ResponseEntity<DocumentMetadataDto> getMetadata(
            @Parameter(description = "Stored package name", required = true) @PathVariable String filename) {
        return ResponseEntity.ok(generationService.getMetadata(filename));
    }

    @Operation(
            summary = "Edit sentence timestamp",
            description = "Moves one sentence's revision date and rebuilds the stored package in its current mode"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Sentence updated and package rebuilt",
                    content = @Content(schema = @Schema(implementation = SentenceMetadataDto.class))
            ),
            @ApiResponse(responseCode = "400", description = "Unparseable timestamp or unknown position"),
            @ApiResponse(responseCode = "404", description = "Document not found")
    })
    @PatchMapping("/{filename}/sentences/{position}")
    public ResponseEntity<SentenceMetadataDto> editTimestamp(
            @Parameter(description = "Stored package name", required = true) @PathVariable String filename,
            @Parameter(description = "Zero-based sentence position", required = true) @PathVariable int position,
            @Valid @RequestBody EditTimestampRequest request) {
        return ResponseEntity.ok(generationService.editTimestamp(
                filename, position, TimestampParser.parse(request.timestamp())));
    }

    @Operation(
            summary = "Sanitize uploaded package",
            description = "Accepts all revisions, removes rejected content and resets identifying metadata"
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Sanitized package bytes"),
            @ApiResponse(responseCode = "400", description = "Missing file or unparseable timestamp"),
            @ApiResponse(responseCode = "422", description = "Not a package, missing or malformed part")
    })
    @PostMapping(value = "/sanitize", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<byte[]> sanitizeUpload(
            @Parameter(description = "Package to sanitize", required = true) @RequestParam("file") MultipartFile file,
            @Parameter(description = "Neutral timestamp") @RequestParam(value = "neutralTimestamp", required = false) String neutralTimestamp,
            @Parameter(description = "Neutral author") @RequestParam(value = "author", required = false) String author,
            @Parameter(description = "Keep accepted body text") @RequestParam(value = "keepContent", required = false) Boolean keepContent) {
        if (file == null || file.isEmpty()) {
            throw new EmptyInputException("Package file is required");
        }
        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException e) {
            throw new DocumentStorageException("Failed to read uploaded file: " + e.getMessage(), e);
        }

        SanitizeOptions options = generationService.sanitizeOptions(author, keepContent, null);
        byte[] sanitized = generationService.sanitize(bytes, TimestampParser.parseOptional(neutralTimestamp), options);
        String name = file.getOriginalFilename() != null ? file.getOriginalFilename() : "document.docx";
        return packageResponse(name, sanitized);
    }

    @Operation(summary = "Sanitize stored package", description = "Writes the sanitized package in place or under a new name")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Package sanitized",
                    content = @Content(schema = @Schema(implementation = SanitizeResultDto.class))
            ),
            @ApiResponse(responseCode = "404", description = "No stored package with that name"),
            @ApiResponse(responseCode = "422", description = "Stored package is malformed")
    })
    @PostMapping("/{filename}/sanitize")
    public ResponseEntity<SanitizeResultDto> sanitizeStored(
            @Parameter(description = "Stored package name", required = true) @PathVariable String filename,
            @Valid @RequestBody(required = false) SanitizeStoredRequest request) {
        return ResponseEntity.ok(generationService.sanitizeStored(filename, request));
    }

    @Operation(summary = "Delete document", description = "Deletes the sentence timeline and the stored package")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Document deleted"),
            @ApiResponse(responseCode = "404", description = "Document not found")
    })
    @DeleteMapping("/{filename}")
    public ResponseEntity<Void> deleteDocument(
            @Parameter(description = "Stored package name", required = true) @PathVariable String filename) {
        generationService.deleteDocument(filename);
        return ResponseEntity.noContent().build();
    }

    private ResponseEntity<byte[]> packageResponse(String filename, byte[] bytes) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(DOCX);
        headers.setContentDisposition(ContentDisposition.attachment()
                .filename(filename, StandardCharsets.UTF_8)
                .build());
        headers.setContentLength(bytes.length);
        return new ResponseEntity<>(bytes, headers, HttpStatus.OK);
    }
}
