package dev.courier.api;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.courier.attachment.AttachmentGuard;
import dev.courier.config.GlobalExceptionHandler;
import dev.courier.urlfilter.UrlFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class AttachmentControllerTest {

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    var guard = new AttachmentGuard(new UrlFilter("*", "127.0.* localhost*"));
    mockMvc =
        MockMvcBuilders.standaloneSetup(new AttachmentController(guard))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Test
  void verifyReturnsAcceptedUrlsInOrder() throws Exception {
    mockMvc
        .perform(
            post("/api/attachments/verify")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"attachments": ["https://cdn.example.com/a.png", " http://files.example.com/b.zip "]}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.accepted.length()").value(2))
        .andExpect(jsonPath("$.accepted[0]").value("https://cdn.example.com/a.png"))
        .andExpect(jsonPath("$.accepted[1]").value("http://files.example.com/b.zip"));
  }

  @Test
  void deniedAttachmentReturnsProblemDetail() throws Exception {
    mockMvc
        .perform(
            post("/api/attachments/verify")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"attachments": ["https://cdn.example.com/a.png", "http://localhost:8080/admin"]}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Attachment rejected"))
        .andExpect(
            jsonPath("$.detail").value("The attachment URL is not permitted by this server."))
        .andExpect(jsonPath("$.status").value(400));
  }

  @Test
  void nonStringAttachmentReturnsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/attachments/verify")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"attachments\": [42]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("Bad attachment"));
  }

  @Test
  void emptyAttachmentListFailsValidation() throws Exception {
    mockMvc
        .perform(
            post("/api/attachments/verify")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"attachments\": []}"))
        .andExpect(status().isBadRequest());
  }
}
