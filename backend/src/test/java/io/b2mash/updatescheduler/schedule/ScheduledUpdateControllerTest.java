package io.b2mash.updatescheduler.schedule;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.b2mash.updatescheduler.TestcontainersConfiguration;
import io.b2mash.updatescheduler.owner.OwnerHeaders;
import java.util.UUID;
import org.junit.jupiter.api.Test;
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
class ScheduledUpdateControllerTest {

  private static final String WEEKLY_BODY =
      """
      {
        "updateType": "WEEKLY",
        "content": "Friday recap",
        "scheduleType": "WEEKLY",
        "scheduledTime": "16:00",
        "dayOfWeek": 5,
        "timezone": "America/New_York",
        "recipients": ["lead@test.com"],
        "sendEmail": true
      }
      """;

  @Autowired private MockMvc mockMvc;

  @Test
  void createReturnsScheduleWithNextRun() throws Exception {
    mockMvc
        .perform(create(UUID.randomUUID(), WEEKLY_BODY))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.id").isNotEmpty())
        .andExpect(jsonPath("$.isActive").value(true))
        .andExpect(jsonPath("$.nextRun").isNotEmpty())
        .andExpect(jsonPath("$.dayOfWeek").value(5));
  }

  @Test
  void malformedTimeIsRejected() throws Exception {
    mockMvc
        .perform(create(UUID.randomUUID(), WEEKLY_BODY.replace("16:00", "25:00")))
        .andExpect(status().isBadRequest());
  }

  @Test
  void weeklyWithoutDayOfWeekIsRejected() throws Exception {
    mockMvc
        .perform(create(UUID.randomUUID(), WEEKLY_BODY.replace("\"dayOfWeek\": 5,", "")))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Invalid schedule"));
  }

  @Test
  void unknownTimezoneIsRejected() throws Exception {
    mockMvc
        .perform(create(UUID.randomUUID(), WEEKLY_BODY.replace("America/New_York", "Nowhere/X")))
        .andExpect(status().isBadRequest());
  }

  @Test
  void missingOwnerHeaderIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/api/schedules").contentType(MediaType.APPLICATION_JSON).content(WEEKLY_BODY))
        .andExpect(status().isBadRequest());
  }

  @Test
  void otherOwnerIsForbiddenAndUnknownIdIsNotFound() throws Exception {
    UUID owner = UUID.randomUUID();
    UUID id = createdId(owner);

    mockMvc
        .perform(get("/api/schedules/" + id).header(OwnerHeaders.OWNER_ID, UUID.randomUUID()))
        .andExpect(status().isForbidden());
    mockMvc
        .perform(get("/api/schedules/" + UUID.randomUUID()).header(OwnerHeaders.OWNER_ID, owner))
        .andExpect(status().isNotFound());
  }

  @Test
  void toggleFlipsActiveFlag() throws Exception {
    UUID owner = UUID.randomUUID();
    UUID id = createdId(owner);

    mockMvc
        .perform(post("/api/schedules/" + id + "/toggle").header(OwnerHeaders.OWNER_ID, owner))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.isActive").value(false));
    mockMvc
        .perform(post("/api/schedules/" + id + "/toggle").header(OwnerHeaders.OWNER_ID, owner))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.isActive").value(true));
  }

  @Test
  void partialUpdateChangesOnlyGivenFields() throws Exception {
    UUID owner = UUID.randomUUID();
    UUID id = createdId(owner);

    mockMvc
        .perform(
            put("/api/schedules/" + id)
                .header(OwnerHeaders.OWNER_ID, owner)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"scheduleType\": \"MONTHLY\", \"dayOfMonth\": 31}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.scheduleType").value("MONTHLY"))
        .andExpect(jsonPath("$.dayOfMonth").value(31))
        .andExpect(jsonPath("$.content").value("Friday recap"))
        .andExpect(jsonPath("$.scheduledTime").value("16:00"));
  }

  @Test
  void listIsScopedToOwnerAndFilterable() throws Exception {
    UUID owner = UUID.randomUUID();
    createdId(owner);
    createdId(owner);

    mockMvc
        .perform(get("/api/schedules").header(OwnerHeaders.OWNER_ID, owner))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(2));
    mockMvc
        .perform(
            get("/api/schedules").param("type", "DAILY").header(OwnerHeaders.OWNER_ID, owner))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(0));
  }

  private UUID createdId(UUID owner) throws Exception {
    var result = mockMvc.perform(create(owner, WEEKLY_BODY)).andReturn();
    return UUID.fromString(JsonPath.read(result.getResponse().getContentAsString(), "$.id"));
  }

  private static org.springframework.test.web.servlet.RequestBuilder create(
      UUID owner, String body) {
    return post("/api/schedules")
        .header(OwnerHeaders.OWNER_ID, owner)
        .contentType(MediaType.APPLICATION_JSON)
        .content(body);
  }
}
