package com.trackshelf.backend.system;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(properties = "app.upload.root=target/test-uploads")
@AutoConfigureMockMvc
class SystemControllerTest {

    @Autowired private MockMvc mockMvc;

    @Test
    void rootAnswersWithReadyMessage() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Music Upload API ready"));

        mockMvc.perform(get("/api/hello"))
                .andExpect(jsonPath("$.message").value("Hello from the backend API!"));
    }

    @Test
    void statusPageReportsWorkingDatabase() throws Exception {
        mockMvc.perform(get("/test"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.backend").value("Running"))
                .andExpect(jsonPath("$.database").value("Connected & Working"))
                .andExpect(jsonPath("$.database_url").value("Set"))
                .andExpect(jsonPath("$.upload_dir").value("Set"))
                .andExpect(jsonPath("$.track_count").isNumber());
    }

    @Test
    void corsEchoesOriginAndAllowsCredentials() throws Exception {
        mockMvc.perform(options("/api/tracks")
                        .header(HttpHeaders.ORIGIN, "https://player.example.com")
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "GET"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "https://player.example.com"))
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_CREDENTIALS, "true"))
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS, containsString("GET")));
    }

    @Test
    void unknownRouteIsNotFound() throws Exception {
        mockMvc.perform(get("/api/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").exists());
    }
}
