package com.example.shifthybrid.schedule;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ScheduleControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void generate_validRequest_returnsScheduleAndMeta() throws Exception {
        String payload = """
            {
              "roster": [
                {"id": "s1", "name": "Aoki", "mayWorkEarly": true, "mayWorkLate": true},
                {"id": "s2", "name": "Baba", "mayWorkEarly": false, "mayWorkLate": true},
                {"id": "s3", "name": "Chiba", "mayWorkEarly": true, "mayWorkLate": false}
              ],
              "dateRange": {"start": "2025-03-03", "end": "2025-03-09"},
              "constraints": [
                {"type": "DAILY_LIMIT", "id": "daily-off", "shift": "OFF", "max": 1},
                {"type": "PRIORITY_RULE", "id": "s2-late", "ruleType": "PREFERRED_SHIFT",
                 "staffIds": ["s2"], "daysOfWeek": ["MONDAY"], "shifts": ["LATE"]}
              ],
              "calendarMandates": {"mustWork": [], "mustOff": ["2025-03-05"]},
              "rngSeed": 5
            }
            """;

        mockMvc.perform(post("/api/schedule/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.message").value("シフトを生成しました"))
            .andExpect(jsonPath("$.data.method").value("RULE_ONLY"))
            .andExpect(jsonPath("$.data.schedule.rows.s2[2]").value("OFF"))
            .andExpect(jsonPath("$.data.schedule.rows.s1[2]").value("EARLY"))
            .andExpect(jsonPath("$.data.rngSeed").value(5))
            .andExpect(jsonPath("$.meta.lockedCells").value(3))
            .andExpect(jsonPath("$.meta.band").value("UNAVAILABLE"));
    }

    @Test
    void generate_missingDateRange_returnsBadRequest() throws Exception {
        String payload = """
            {
              "roster": [{"id": "s1", "mayWorkEarly": true, "mayWorkLate": true}]
            }
            """;

        mockMvc.perform(post("/api/schedule/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
            .andExpect(jsonPath("$.details.dateRange").exists());
    }

    @Test
    void generate_contradictoryLimit_returnsConfigurationError() throws Exception {
        String payload = """
            {
              "roster": [{"id": "s1", "mayWorkEarly": true, "mayWorkLate": true}],
              "dateRange": {"start": "2025-03-03", "end": "2025-03-09"},
              "constraints": [
                {"type": "WEEKLY_LIMIT", "id": "weekly-off", "shift": "OFF", "min": 3, "max": 1}
              ]
            }
            """;

        mockMvc.perform(post("/api/schedule/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("CONFIGURATION_ERROR"))
            .andExpect(jsonPath("$.constraintId").value("weekly-off"));
    }

    @Test
    void registry_listsEveryConstraintKindInPriorityOrder() throws Exception {
        mockMvc.perform(get("/api/schedule/registry"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.length()").value(16))
            .andExpect(jsonPath("$.data[0].kind").value("CALENDAR_MUST_WORK"))
            .andExpect(jsonPath("$.data[0].severity").value("CRITICAL"))
            .andExpect(jsonPath("$.data[15].kind").value("FAIR_DISTRIBUTION"));
    }
}
