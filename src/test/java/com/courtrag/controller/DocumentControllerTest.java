package com.courtrag.controller;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.courtrag.dto.response.DocumentView;
import com.courtrag.dto.response.IngestionReport;
import com.courtrag.exception.DocumentNotFoundException;
import com.courtrag.exception.GlobalExceptionHandler;
import com.courtrag.model.MetadataField;
import com.courtrag.service.ingestion.IngestionService;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class DocumentControllerTest {

    private IngestionService ingestionService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ingestionService = mock(IngestionService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new DocumentController(ingestionService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    void shouldCreateNewDocument() throws Exception {
        when(ingestionService.ingest(any())).thenReturn(IngestionReport.builder()
            .documentId("doc_1")
            .indexedChunks(3)
            .totalChunks(3)
            .build());

        mockMvc.perform(post("/api/documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"id\":\"doc_1\",\"filename\":\"doc_1.pdf\",\"text\":\"QƏTNAMƏ\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.documentId").value("doc_1"))
            .andExpect(jsonPath("$.indexedChunks").value(3));
    }

    @Test
    void shouldAnswerOkWhenDocumentReplaced() throws Exception {
        when(ingestionService.ingest(any())).thenReturn(IngestionReport.builder()
            .documentId("doc_1")
            .replacedExisting(true)
            .build());

        mockMvc.perform(post("/api/documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"id\":\"doc_1\",\"text\":\"QƏTNAMƏ\"}"))
            .andExpect(status().isOk());
    }

    @Test
    void shouldRequireText() throws Exception {
        mockMvc.perform(post("/api/documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"id\":\"doc_1\"}"))
            .andExpect(status().isBadRequest());

        verify(ingestionService, never()).ingest(any());
    }

    @Test
    void shouldReturnNotFoundForUnknownDocument() throws Exception {
        when(ingestionService.view("missing")).thenThrow(new DocumentNotFoundException("missing"));

        mockMvc.perform(get("/api/documents/missing"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Document not found: missing"));
    }

    @Test
    void shouldDeleteDocument() throws Exception {
        mockMvc.perform(delete("/api/documents/doc_1"))
            .andExpect(status().isNoContent());

        verify(ingestionService).delete("doc_1");
    }

    @Test
    void shouldReturnNotFoundWhenDeletingUnknownDocument() throws Exception {
        doThrow(new DocumentNotFoundException("doc_9")).when(ingestionService).delete("doc_9");

        mockMvc.perform(delete("/api/documents/doc_9"))
            .andExpect(status().isNotFound());
    }

    @Test
    void shouldApplyMetadataCorrection() throws Exception {
        when(ingestionService.correctMetadata("doc_1", Map.of(MetadataField.JUDGE, "Kamran Əliyev", MetadataField.YEAR, "")))
            .thenReturn(DocumentView.builder()
                .id("doc_1")
                .metadata(Map.of("judge", "Kamran Əliyev"))
                .build());

        mockMvc.perform(patch("/api/documents/doc_1/metadata")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"corrections\":{\"judge\":\"Kamran Əliyev\",\"year\":null}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.metadata.judge").value("Kamran Əliyev"));
    }

    @Test
    void shouldRejectUnknownMetadataField() throws Exception {
        mockMvc.perform(patch("/api/documents/doc_1/metadata")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"corrections\":{\"color\":\"red\"}}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Unknown metadata field: color"));
    }
}
