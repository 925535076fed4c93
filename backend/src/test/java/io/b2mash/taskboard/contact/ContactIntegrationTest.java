package io.b2mash.taskboard.contact;

import static io.b2mash.taskboard.testutil.TestTaskboardFactory.createContact;
import static io.b2mash.taskboard.testutil.TestTaskboardFactory.extractId;
import static io.b2mash.taskboard.testutil.TestTaskboardFactory.uniqueEmail;
import static io.b2mash.taskboard.testutil.TestTaskboardFactory.userJwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
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
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ContactIntegrationTest {

  @Autowired private MockMvc mockMvc;

  @Test
  void shouldCreateContactWithDefaultColor() throws Exception {
    var email = uniqueEmail("linus");

    mockMvc
        .perform(
            post("/api/contacts")
                .with(userJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Linus", "email": "%s", "phone": "+1 555 0100"}
                    """
                        .formatted(email)))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.name").value("Linus"))
        .andExpect(jsonPath("$.email").value(email))
        .andExpect(jsonPath("$.color").value("#000000"));
  }

  @Test
  void duplicateEmailIsFieldError() throws Exception {
    var email = uniqueEmail("dup");
    String body =
        """
        {"name": "Dup", "email": "%s", "phone": "123"}
        """
            .formatted(email);
    mockMvc
        .perform(
            post("/api/contacts")
                .with(userJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
        .andExpect(status().isCreated());

    mockMvc
        .perform(
            post("/api/contacts")
                .with(userJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body.replace(email, email.toUpperCase())))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errors.email[0]").value("A contact with this email already exists"));
  }

  @Test
  void invalidColorAndPhoneAreRejected() throws Exception {
    mockMvc
        .perform(
            post("/api/contacts")
                .with(userJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Bad", "email": "%s", "phone": "012345678901234567890",
                     "color": "red"}
                    """
                        .formatted(uniqueEmail("bad"))))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errors.color").isArray())
        .andExpect(jsonPath("$.errors.phone").isArray());
  }

  @Test
  void patchWithBlankNameOrPhoneIsRejected() throws Exception {
    var id = createContact(mockMvc, "Blank Patch");

    mockMvc
        .perform(
            patch("/api/contacts/" + id)
                .with(userJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": " ", "phone": "\\t"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errors.name[0]").value("name must not be blank"))
        .andExpect(jsonPath("$.errors.phone[0]").value("phone must not be blank"));

    mockMvc
        .perform(get("/api/contacts/" + id).with(userJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("Blank Patch"));
  }

  @Test
  void patchUpdatesOnlyGivenFields() throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/contacts")
                    .with(userJwt())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"name": "Before", "email": "%s", "phone": "42", "color": "#112233"}
                        """
                            .formatted(uniqueEmail("patch"))))
            .andExpect(status().isCreated())
            .andReturn();
    var id = extractId(result);

    mockMvc
        .perform(
            patch("/api/contacts/" + id)
                .with(userJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "After"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("After"))
        .andExpect(jsonPath("$.phone").value("42"))
        .andExpect(jsonPath("$.color").value("#112233"));

    mockMvc
        .perform(delete("/api/contacts/" + id).with(userJwt()))
        .andExpect(status().isNoContent());
    mockMvc
        .perform(get("/api/contacts/" + id).with(userJwt()))
        .andExpect(status().isNotFound());
  }
}
