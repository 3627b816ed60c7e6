package com.github.dimitryivaniuta.remotefirewall.web;

import com.github.dimitryivaniuta.remotefirewall.firewall.audit.CallLogService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.MOCK)
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
class FirewallAdminControllerTest {

    @Autowired MockMvc mvc;
    @Autowired CallLogService callLog;

    @Test
    void shouldExposeRegisteredEndpoints() throws Exception {
        mvc.perform(get("/api/admin/firewall/endpoints"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[?(@.name == 'PurchaseItem')].middlewareCount").value(1))
                .andExpect(jsonPath("$[?(@.name == 'ReportPosition')].kind").value("EVENT"))
                .andExpect(jsonPath("$[?(@.name == 'ReportPosition')].forceLogging").value(true));
    }

    @Test
    void shouldReadAndReplaceSettings() throws Exception {
        mvc.perform(get("/api/admin/firewall/settings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.maxLogCount").value(50))
                .andExpect(jsonPath("$.rateLimitMaxRequests").value(2));

        mvc.perform(put("/api/admin/firewall/settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"maxLogCount":20,"cleanupIntervalSeconds":120,"rateLimitWindowSeconds":30,
                                 "rateLimitMaxRequests":5,"debuggingMode":true,"logSampleRate":0.5}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.maxLogCount").value(20))
                .andExpect(jsonPath("$.logCapacity").value(20))
                .andExpect(jsonPath("$.debuggingMode").value(true));

        assertThat(callLog.capacity()).isEqualTo(20);
    }

    @Test
    void shouldRejectInvalidSettings() throws Exception {
        mvc.perform(put("/api/admin/firewall/settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"maxLogCount":0,"cleanupIntervalSeconds":120,"rateLimitWindowSeconds":30,
                                 "rateLimitMaxRequests":5,"debuggingMode":false,"logSampleRate":2.0}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation failed"));
    }
}
