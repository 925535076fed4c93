package io.b2mash.taskboard.testutil;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import java.util.UUID;
import org.springframework.http.MediaType;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

/** Shared helpers for integration tests that need contacts, tasks or an authenticated caller. */
public final class TestTaskboardFactory {

  private TestTaskboardFactory() {}

  /** A bearer token for an arbitrary user id; enough for endpoints that do not load the user. */
  public static JwtRequestPostProcessor userJwt() {
    return jwt().jwt(j -> j.subject("1").claim("email", "tester@example.com"));
  }

  public static String uniqueEmail(String prefix) {
    return prefix + "-" + UUID.randomUUID().toString().substring(0, 8) + "@example.com";
  }

  public static Long createContact(MockMvc mockMvc, String name) throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/contacts")
                    .with(userJwt())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"name": "%s", "email": "%s", "phone": "+49 30 1234"}
                        """
                            .formatted(name, uniqueEmail(name.toLowerCase().replace(' ', '.')))))
            .andExpect(status().isCreated())
            .andReturn();
    return extractId(result);
  }

  public static Long createTask(MockMvc mockMvc, String body) throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/tasks")
                    .with(userJwt())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(body))
            .andExpect(status().isCreated())
            .andReturn();
    return extractId(result);
  }

  public static Long extractId(MvcResult result) throws Exception {
    Number id = JsonPath.read(result.getResponse().getContentAsString(), "$.id");
    return id.longValue();
  }
}
