package io.b2mash.prodtrack.calendar;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
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
class HolidayIntegrationTest {

  @Autowired private MockMvc mockMvc;

  @Test
  void listForYear_returnsSeededHolidaysInDateOrder() throws Exception {
    mockMvc
        .perform(get("/api/holidays/year/2025").with(TestJwts.user()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].name").value("New Year's Day"))
        .andExpect(jsonPath("$[0].date").value("2025-01-01"))
        .andExpect(jsonPath("$.length()").value(11));
  }

  @Test
  void listForYear_outOfRange_returns400() throws Exception {
    mockMvc
        .perform(get("/api/holidays/year/1800").with(TestJwts.user()))
        .andExpect(status().isBadRequest());
  }

  @Test
  void createUpdateDelete_customClosure() throws Exception {
    var created =
        mockMvc
            .perform(
                post("/api/holidays")
                    .with(TestJwts.manager())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"name": "Workshop closure", "date": "2031-07-01", "isPublic": false}
                        """))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.isPublic").value(false))
            .andExpect(jsonPath("$.isCustom").value(true))
            .andReturn();
    Integer id = JsonPath.read(created.getResponse().getContentAsString(), "$.id");

    mockMvc
        .perform(
            post("/api/holidays")
                .with(TestJwts.manager())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Duplicate", "date": "2031-07-01"}
                    """))
        .andExpect(status().isConflict());

    mockMvc
        .perform(
            put("/api/holidays/" + id)
                .with(TestJwts.admin())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Stocktake", "date": "2031-07-02", "description": "Annual"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("Stocktake"))
        .andExpect(jsonPath("$.date").value("2031-07-02"))
        .andExpect(jsonPath("$.isPublic").value(false));

    mockMvc
        .perform(delete("/api/holidays/" + id).with(TestJwts.admin()))
        .andExpect(status().isNoContent());

    mockMvc
        .perform(delete("/api/holidays/" + id).with(TestJwts.admin()))
        .andExpect(status().isNotFound());
  }
}
