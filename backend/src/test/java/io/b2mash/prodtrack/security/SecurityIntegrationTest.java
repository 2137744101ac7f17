package io.b2mash.prodtrack.security;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.prodtrack.TestcontainersConfiguration;
import io.b2mash.prodtrack.testutil.TestJwts;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class SecurityIntegrationTest {

  @Autowired private MockMvc mockMvc;

  @Test
  void unauthenticatedRequest_toApi_returns401() throws Exception {
    mockMvc.perform(get("/api/job-statuses")).andExpect(status().isUnauthorized());
  }

  @Test
  void authenticatedUser_canReadConfiguration() throws Exception {
    mockMvc.perform(get("/api/job-statuses").with(TestJwts.user())).andExpect(status().isOk());
  }

  @Test
  void plainUser_cannotChangeConfiguration() throws Exception {
    mockMvc
        .perform(post("/api/lead-times/initialize").with(TestJwts.user()))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.title").value("Access denied"));
  }

  @Test
  void plainUser_cannotCreateHoliday() throws Exception {
    mockMvc
        .perform(
            post("/api/holidays")
                .with(TestJwts.user())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Closure", "date": "2031-07-01"}
                    """))
        .andExpect(status().isForbidden());
  }

  @Test
  void actuatorHealth_isPublic() throws Exception {
    mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
  }

  @Test
  void unknownPath_returns403() throws Exception {
    mockMvc.perform(get("/unknown").with(TestJwts.user())).andExpect(status().isForbidden());
  }
}
