package com.example.labjobs.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.labjobs.model.ReminderScheduleRecord;
import com.example.labjobs.model.ReminderStep;
import com.example.labjobs.service.LabJobConfigurationService;
import com.example.labjobs.service.ReminderScheduleFormatException;
import com.example.labjobs.service.ReminderScheduleParser;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ReminderScheduleController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import({ApiExceptionHandler.class, ReminderScheduleParser.class})
class ReminderScheduleControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private LabJobConfigurationService configurationService;

  @Test
  void listRendersStepsInEditNotation() throws Exception {
    when(configurationService.listSchedules())
        .thenReturn(
            List.of(
                new ReminderScheduleRecord(
                    4L,
                    "Kitchen",
                    List.of(
                        new ReminderStep(Duration.ZERO, Duration.ofDays(1)),
                        new ReminderStep(Duration.ofDays(2), Duration.ofHours(12))))));

    mockMvc
        .perform(get("/v1/labjobs/reminder-schedules"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].schedule_id").value(4))
        .andExpect(jsonPath("$[0].reminders").value("0s=1d; 2d=12h"));
  }

  @Test
  void malformedRemindersReturn400() throws Exception {
    when(configurationService.updateSchedule(4L, "Kitchen", "0s=1d; 2d"))
        .thenThrow(new ReminderScheduleFormatException("reminder entry must look like <threshold>=<interval>"));

    mockMvc
        .perform(
            put("/v1/labjobs/reminder-schedules/4")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"name":"Kitchen","reminders":"0s=1d; 2d"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("LABJOBS_INVALID_CONFIGURATION"));
  }
}
