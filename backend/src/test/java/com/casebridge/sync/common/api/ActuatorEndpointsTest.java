package com.casebridge.sync.common.api;

import com.casebridge.sync.bootstrap.CaseBridgeApplication;
import com.casebridge.sync.support.SyncTestBeans;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = CaseBridgeApplication.class)
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(SyncTestBeans.class)
class ActuatorEndpointsTest {

    @Autowired
    MockMvc mvc;

    @Test
    void exposed_endpoints_answer() throws Exception {
        mvc.perform(get("/actuator/health"))
                .andExpect(status().isOk());

        mvc.perform(get("/actuator/prometheus"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("casebridge_poll_account_failures_total")));
    }
}
