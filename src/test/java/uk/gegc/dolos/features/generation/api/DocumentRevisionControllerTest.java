package uk.gegc.dolos.features.generation.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.dolos.features.generation.api.dto.CreateDocumentRequest;
import uk.gegc.dolos.features.generation.api.dto.SanitizeResultDto;
import uk.gegc.dolos.features.generation.application.DocumentGenerationService;
import uk.gegc.dolos.features.metadata.api.dto.DocumentMetadataDto;
import uk.gegc.dolos.features.metadata.api.dto.SentenceMetadataDto;
import uk.gegc.dolos.features.packaging.domain.NotAPackageException;
import uk.gegc.dolos.features.revision.domain.model.SanitizeOptions;
import uk.gegc.dolos.features.timeline.domain.InvalidIntervalException;
import uk.gegc.dolos.shared.exception.DocumentNotFoundException;
import uk.gegc.dolos.shared.exception.DocumentStorageException;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DocumentRevisionController.class)
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("DocumentRevisionController")
class DocumentRevisionControllerTest {

    private static final String BASE = "/api/v1/documents";
    private static final Instant AT = Instant.parse("2025-01-01T09:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private DocumentGenerationService generationService;

    @Test
    @DisplayName("POST creates a document and returns 201 with its metadata")
    void create_returnsCreated() throws Exception {
        when(generationService.createDocument(any(CreateDocumentRequest.class))).thenReturn(metadata());

        mockMvc.perform(post(BASE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"filename": "essay.docx", "sentences": ["Alpha."], "mode": "final"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.filename").value("essay.docx"))
                .andExpect(jsonPath("$.sentenceCount").value(1))
                .andExpect(jsonPath("$.sentences[0].revisionId").value(1));
    }

    @Test
    @DisplayName("POST with a path separator in the filename fails validation")
    void create_invalidFilename_returnsFieldErrors() throws Exception {
        mockMvc.perform(post(BASE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"filename": "../essay.docx", "text": "Alpha."}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("https://dolos.gegc.uk/docs/errors/validation-failed"))
                .andExpect(jsonPath("$.fieldErrors[*].field", hasItem("filename")));

        verifyNoInteractions(generationService);
    }

    @Test
    @DisplayName("POST with a malformed body returns a malformed-json problem")
    void create_malformedJson() throws Exception {
        mockMvc.perform(post(BASE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"filename\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("https://dolos.gegc.uk/docs/errors/malformed-json"));
    }

    @Test
    @DisplayName("POST with min above max returns an invalid-interval problem")
    void create_invalidInterval() throws Exception {
        when(generationService.createDocument(any(CreateDocumentRequest.class)))
                .thenThrow(new InvalidIntervalException("Minimum interval 90 exceeds maximum interval 30"));

        mockMvc.perform(post(BASE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"filename": "essay.docx", "text": "Alpha.", "minIntervalSeconds": 90, "maxIntervalSeconds": 30}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("https://dolos.gegc.uk/docs/errors/invalid-interval"))
                .andExpect(jsonPath("$.detail", containsString("exceeds")));
    }

    @Test
    @DisplayName("POST rejected by a record invariant returns an invalid-argument problem, not 500")
    void create_illegalArgument_returnsBadRequest() throws Exception {
        when(generationService.createDocument(any(CreateDocumentRequest.class)))
                .thenThrow(new IllegalArgumentException("totalEditTimeMinutes must not be negative"));

        mockMvc.perform(post(BASE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"filename": "essay.docx", "text": "Alpha."}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("https://dolos.gegc.uk/docs/errors/invalid-argument"))
                .andExpect(jsonPath("$.detail", containsString("must not be negative")));
    }

    @Test
    @DisplayName("GET returns the package as an attachment")
    void download_returnsBytes() throws Exception {
        when(generationService.getPackage("essay.docx")).thenReturn(new byte[]{'P', 'K', 3, 4});

        mockMvc.perform(get(BASE + "/essay.docx"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(DocumentRevisionController.DOCX))
                .andExpect(header().string("Content-Disposition", containsString("essay.docx")))
                .andExpect(content().bytes(new byte[]{'P', 'K', 3, 4}));
    }

    @Test
    @DisplayName("GET of an unknown package returns 404")
    void download_unknown_returnsNotFound() throws Exception {
        when(generationService.getPackage("missing.docx"))
                .thenThrow(DocumentNotFoundException.forFilename("missing.docx"));

        mockMvc.perform(get(BASE + "/missing.docx"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.type").value("https://dolos.gegc.uk/docs/errors/document-not-found"))
                .andExpect(jsonPath("$.instance").value(BASE + "/missing.docx"));
    }

    @Test
    @DisplayName("GET metadata returns the stored timeline")
    void metadata_returnsTimeline() throws Exception {
        when(generationService.getMetadata("essay.docx")).thenReturn(metadata());

        mockMvc.perform(get(BASE + "/essay.docx/metadata"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sentences[0].text").value("Alpha."))
                .andExpect(jsonPath("$.sentences[0].author").value("Jane Doe"));
    }

    @Test
    @DisplayName("PATCH parses the timestamp and returns the updated sentence")
    void editTimestamp_returnsSentence() throws Exception {
        Instant edited = Instant.parse("2025-06-15T14:30:00Z");
        when(generationService.editTimestamp("essay.docx", 1, edited))
                .thenReturn(new SentenceMetadataDto(1, "Beta.", AT, edited, "Jane Doe", 2));

        mockMvc.perform(patch(BASE + "/essay.docx/sentences/1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"timestamp": "2025-06-15 14:30:00"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.position").value(1))
                .andExpect(jsonPath("$.revisionId").value(2));
    }

    @Test
    @DisplayName("PATCH with an unparseable timestamp returns an invalid-timestamp problem")
    void editTimestamp_badTimestamp() throws Exception {
        mockMvc.perform(patch(BASE + "/essay.docx/sentences/1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"timestamp": "next tuesday"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("https://dolos.gegc.uk/docs/errors/invalid-timestamp"));

        verifyNoInteractions(generationService);
    }

    @Test
    @DisplayName("PATCH with a non-numeric position returns a type-mismatch problem")
    void editTimestamp_badPosition() throws Exception {
        mockMvc.perform(patch(BASE + "/essay.docx/sentences/first")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"timestamp": "2025-06-15T14:30:00Z"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("https://dolos.gegc.uk/docs/errors/type-mismatch"))
                .andExpect(jsonPath("$.parameter").value("position"));
    }

    @Test
    @DisplayName("POST /sanitize returns the sanitized upload")
    void sanitizeUpload_returnsBytes() throws Exception {
        SanitizeOptions options = new SanitizeOptions("Anonymous", true, true);
        when(generationService.sanitizeOptions(isNull(), isNull(), isNull())).thenReturn(options);
        when(generationService.sanitize(any(byte[].class), eq(Instant.parse("2000-01-01T00:00:00Z")), eq(options)))
                .thenReturn(new byte[]{'P', 'K'});

        MockMultipartFile file = new MockMultipartFile("file", "upload.docx",
                DocumentRevisionController.DOCX.toString(), new byte[]{'P', 'K', 1});

        mockMvc.perform(multipart(BASE + "/sanitize")
                        .file(file)
                        .param("neutralTimestamp", "2000-01-01T00:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", containsString("upload.docx")))
                .andExpect(content().bytes(new byte[]{'P', 'K'}));
    }

    @Test
    @DisplayName("POST /sanitize with something that is not a package returns 422")
    void sanitizeUpload_notAPackage() throws Exception {
        when(generationService.sanitizeOptions(any(), any(), any())).thenReturn(SanitizeOptions.defaults());
        when(generationService.sanitize(any(byte[].class), any(), any()))
                .thenThrow(new NotAPackageException("Input is not a zip container"));

        MockMultipartFile file = new MockMultipartFile("file", "notes.txt", MediaType.TEXT_PLAIN_VALUE,
                "just text".getBytes());

        mockMvc.perform(multipart(BASE + "/sanitize").file(file))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.type").value("https://dolos.gegc.uk/docs/errors/not-a-package"));
    }

    @Test
    @DisplayName("POST /sanitize with an empty upload returns an empty-input problem")
    void sanitizeUpload_emptyFile() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "empty.docx",
                DocumentRevisionController.DOCX.toString(), new byte[0]);

        mockMvc.perform(multipart(BASE + "/sanitize").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("https://dolos.gegc.uk/docs/errors/empty-input"));

        verifyNoInteractions(generationService);
    }

    @Test
    @DisplayName("POST /{filename}/sanitize works without a body")
    void sanitizeStored_withoutBody() throws Exception {
        when(generationService.sanitizeStored(eq("essay.docx"), isNull()))
                .thenReturn(new SanitizeResultDto("essay.docx", "essay.docx", 1234));

        mockMvc.perform(post(BASE + "/essay.docx/sanitize"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outputFilename").value("essay.docx"))
                .andExpect(jsonPath("$.size").value(1234));
    }

    @Test
    @DisplayName("storage failures surface as 500 problems")
    void sanitizeStored_storageFailure() throws Exception {
        when(generationService.sanitizeStored(anyString(), any()))
                .thenThrow(new DocumentStorageException("Failed to store document essay.docx: disk full"));

        mockMvc.perform(post(BASE + "/essay.docx/sanitize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.type").value("https://dolos.gegc.uk/docs/errors/storage-error"));
    }

    @Test
    @DisplayName("DELETE returns 204 and 404 for unknown documents")
    void delete_results() throws Exception {
        doThrow(DocumentNotFoundException.forFilename("missing.docx"))
                .when(generationService).deleteDocument("missing.docx");

        mockMvc.perform(delete(BASE + "/essay.docx"))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete(BASE + "/missing.docx"))
                .andExpect(status().isNotFound());

        verify(generationService).deleteDocument("essay.docx");
    }

    private static DocumentMetadataDto metadata() {
        return new DocumentMetadataDto(UUID.randomUUID(), "essay.docx", AT, AT, "Jane Doe", "Jane Doe", 1,
                List.of(new SentenceMetadataDto(0, "Alpha.", AT, AT, "Jane Doe", 1)));
    }
}
