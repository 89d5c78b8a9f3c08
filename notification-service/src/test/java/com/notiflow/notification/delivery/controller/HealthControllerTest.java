package com.notiflow.notification.delivery.controller;

import com.notiflow.notification.delivery.service.DeliveryHealthException;
import com.notiflow.notification.delivery.usecase.CheckHealthUseCase;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CheckHealthUseCase checkHealthUseCase;

    @Test
    void testHealth_WhenAllComponentsHealthy_ReturnsUp() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    void testHealth_WhenCheckFails_ReturnsServiceUnavailable() throws Exception {
        doThrow(new DeliveryHealthException("Some channels are not ready")).when(checkHealthUseCase).checkHealth();

        mockMvc.perform(get("/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.error").value("Some channels are not ready"));
    }
}
