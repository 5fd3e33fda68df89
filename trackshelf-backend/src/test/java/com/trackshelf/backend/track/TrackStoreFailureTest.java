package com.trackshelf.backend.track;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.CannotCreateTransactionException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/** Upload and read paths when the metadata database misbehaves. */
@SpringBootTest
@AutoConfigureMockMvc
class TrackStoreFailureTest {

    private static Path uploadDir;

    @DynamicPropertySource
    static void uploadRoot(DynamicPropertyRegistry registry) throws IOException {
        uploadDir = Files.createTempDirectory("trackshelf-failure-");
        registry.add("app.upload.root", uploadDir::toString);
    }

    @Autowired private MockMvc mockMvc;

    @MockBean private TrackRepository trackRepository;

    @Test
    void failedInsertRemovesStoredFileAndReports500() throws Exception {
        when(trackRepository.saveAndFlush(any(Track.class)))
                .thenThrow(new DataIntegrityViolationException("could not execute statement"));
        MockMultipartFile file = new MockMultipartFile("file", "a.mp3", "audio/mpeg", new byte[]{1, 2, 3});

        mockMvc.perform(multipart("/api/tracks/upload").file(file).param("title", "Doomed"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.detail").value("Database error while saving track"));

        verify(trackRepository).saveAndFlush(any(Track.class));
        assertEquals(0, storedFileCount());
    }

    @Test
    void unreachableDatabaseIsReportedAsUnavailable() throws Exception {
        when(trackRepository.findAllByOrderByCreatedAtDescIdDesc())
                .thenThrow(new CannotCreateTransactionException("Could not open JPA EntityManager for transaction"));

        mockMvc.perform(get("/api/tracks"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.detail").value("Database not available"));
    }

    @Test
    void mediaIsStillServedWhenDatabaseIsDown() throws Exception {
        Files.write(uploadDir.resolve("0123456789abcdef0123456789abcdef.ogg"), new byte[]{4, 5, 6});
        when(trackRepository.findByFilename(any()))
                .thenThrow(new CannotCreateTransactionException("Could not open JPA EntityManager for transaction"));

        mockMvc.perform(get("/media/0123456789abcdef0123456789abcdef.ogg"))
                .andExpect(status().isOk())
                .andExpect(content().contentType("application/octet-stream"))
                .andExpect(content().bytes(new byte[]{4, 5, 6}));
    }

    @Test
    void statusPageReportsDatabaseError() throws Exception {
        when(trackRepository.count()).thenThrow(new CannotCreateTransactionException("down"));

        mockMvc.perform(get("/test"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.backend").value("Running"))
                .andExpect(jsonPath("$.connection_status").value("Not Connected"));
    }

    private static long storedFileCount() throws IOException {
        try (Stream<Path> files = Files.walk(uploadDir)) {
            return files.filter(Files::isRegularFile).count();
        }
    }
}
