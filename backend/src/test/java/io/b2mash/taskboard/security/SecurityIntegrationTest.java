package io.b2mash.taskboard.security;

import static io.b2mash.taskboard.testutil.TestTaskboardFactory.userJwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.taskboard.TestcontainersConfiguration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class SecurityIntegrationTest {

  @Autowired private MockMvc mockMvc;

  @Test
  void anonymousWithoutGuestIdIsRejected() throws Exception {
    mockMvc.perform(get("/api/tasks")).andExpect(status().isUnauthorized());
    mockMvc.perform(get("/api/contacts")).andExpect(status().isUnauthorized());
    mockMvc
        .perform(get("/api/subtasks").param("guest_id", "  "))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void guestMayUseTaskEndpoints() throws Exception {
    mockMvc
        .perform(get("/api/tasks").param("guest_id", "guest-42"))
        .andExpect(status().isOk());
    mockMvc
        .perform(
            post("/api/tasks")
                .param("guest_id", "guest-42")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"title": "Guest task", "due_date": "2025-07-01", "priority": "low"}
                    """))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.title").value("Guest task"));
  }

  @Test
  void summaryBoardsAndProfileRequireUser() throws Exception {
    mockMvc
        .perform(get("/api/summary").param("guest_id", "guest-42"))
        .andExpect(status().isUnauthorized());
    mockMvc
        .perform(get("/api/board").param("guest_id", "guest-42"))
        .andExpect(status().isUnauthorized());
    mockMvc
        .perform(get("/api/boards").param("guest_id", "guest-42"))
        .andExpect(status().isUnauthorized());
    mockMvc.perform(get("/api/auth/profile")).andExpect(status().isUnauthorized());

    mockMvc.perform(get("/api/summary").with(userJwt())).andExpect(status().isOk());
  }

  @Test
  void invalidBearerTokenIsRejectedEvenForGuests() throws Exception {
    mockMvc
        .perform(
            get("/api/tasks")
                .param("guest_id", "guest-42")
                .header(HttpHeaders.AUTHORIZATION, "Bearer not-a-real-token"))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void healthAndAuthEndpointsArePublic() throws Exception {
    mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
    mockMvc
        .perform(
            post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"email": "ghost@example.com", "password": "whatever1"}
                    """))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.detail").value("Invalid credentials"));
  }

  @Test
  void unlistedPathsAreDenied() throws Exception {
    mockMvc.perform(get("/api/unknown")).andExpect(status().isUnauthorized());
    mockMvc.perform(get("/api/unknown").with(userJwt())).andExpect(status().isForbidden());
  }
}
