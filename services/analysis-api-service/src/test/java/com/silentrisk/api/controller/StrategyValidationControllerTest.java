package com.silentrisk.api.controller;

import com.silentrisk.api.dto.TaskResponse;
import com.silentrisk.api.service.StrategyValidationService;
import com.silentrisk.api.service.TaskStatusService;
import com.silentrisk.common.error.GlobalExceptionHandler;
import com.silentrisk.common.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("StrategyValidationController Web Tests")
class StrategyValidationControllerTest {

    private static final String WALLET = "0x7e5f4552091a69125d5dfcb7b8c2659029395bdf";

    @Mock
    private StrategyValidationService strategyValidationService;

    @Mock
    private TaskStatusService taskStatusService;

    @InjectMocks
    private StrategyValidationController controller;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private String body(String strategyType, int backtestDays) {
        return "{"
                + "\"commitment\":\"0x" + "7a".repeat(32) + "\","
                + "\"walletAddress\":\"" + WALLET + "\","
                + "\"signature\":\"0x" + "ab".repeat(65) + "\","
                + "\"message\":\"Silent Risk Analysis: " + WALLET + " at 1700000000\","
                + "\"timestamp\":1700000000,"
                + "\"backtestDays\":" + backtestDays + ","
                + "\"parameters\":{\"strategyType\":\"" + strategyType + "\","
                + "\"takeProfit\":6.0,\"stopLoss\":3.0,\"positionSize\":5.0,\"timeframe\":\"4h\"}"
                + "}";
    }

    @Test
    @DisplayName("Should accept a valid strategy with 202")
    void shouldAcceptStrategy() throws Exception {
        when(strategyValidationService.submit(any())).thenReturn(TaskResponse.builder()
                .taskId("task-9").status(TaskStatus.PENDING).progress(0).build());

        mockMvc.perform(post("/api/v1/strategy/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("swing", 30)))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.taskId").value("task-9"));
    }

    @Test
    @DisplayName("Should reject an unknown strategy type")
    void shouldRejectUnknownStrategyType() throws Exception {
        mockMvc.perform(post("/api/v1/strategy/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("martingale", 30)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors['parameters.strategyType']").exists());
        verifyNoInteractions(strategyValidationService);
    }

    @Test
    @DisplayName("Should reject a backtest window outside 7 to 365 days")
    void shouldRejectBacktestWindow() throws Exception {
        mockMvc.perform(post("/api/v1/strategy/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("swing", 400)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.backtestDays").exists());
    }
}
