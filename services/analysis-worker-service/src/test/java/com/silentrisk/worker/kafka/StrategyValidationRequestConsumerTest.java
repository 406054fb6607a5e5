package com.silentrisk.worker.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.silentrisk.common.error.ValidationException;
import com.silentrisk.common.model.StrategyValidationRequestMessage;
import com.silentrisk.worker.pipeline.StrategyValidationPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("StrategyValidationRequestConsumer Unit Tests")
class StrategyValidationRequestConsumerTest {

    private static final String TOPIC = "silentrisk.strategy.requests";
    private static final String TASK_ID = "9e1d2c3b-4a5f-4e6d-8c7b-0a1b2c3d4e5f";
    private static final String COMMITMENT = "0x" + "3c".repeat(32);
    private static final String WALLET = "0x7e5f4552091a69125d5dfcb7b8c2659029395bdf";

    @Mock
    private StrategyValidationPipeline pipeline;

    @Mock
    private Acknowledgment acknowledgment;

    private StrategyValidationRequestConsumer consumer;

    @BeforeEach
    void setUp() {
        consumer = new StrategyValidationRequestConsumer(new ObjectMapper().findAndRegisterModules(), pipeline);
    }

    @Test
    @DisplayName("Should hand parsed parameters to the pipeline and acknowledge")
    void shouldProcessAndAcknowledge() {
        // Given
        String payload = "{\"taskId\":\"" + TASK_ID + "\",\"commitment\":\"" + COMMITMENT
                + "\",\"walletAddress\":\"" + WALLET + "\",\"backtestDays\":60,\"parameters\":{\"strategyType\":\"swing\","
                + "\"takeProfit\":10.0,\"stopLoss\":5.0,\"positionSize\":5.0,\"timeframe\":\"4h\"}}";
        ArgumentCaptor<StrategyValidationRequestMessage> requestCaptor =
                ArgumentCaptor.forClass(StrategyValidationRequestMessage.class);

        // When
        consumer.handleStrategyValidationRequest(payload, TOPIC, 1, 7L, null, acknowledgment);

        // Then
        verify(pipeline).process(requestCaptor.capture());
        verify(acknowledgment).acknowledge();
        StrategyValidationRequestMessage request = requestCaptor.getValue();
        assertThat(request.getBacktestDays()).isEqualTo(60);
        assertThat(request.getParameters().getStrategyType()).isEqualTo("swing");
        assertThat(request.getParameters().getTakeProfit()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("Should reject a request without strategy parameters")
    void shouldRejectMissingParameters() {
        String payload = "{\"taskId\":\"" + TASK_ID + "\",\"commitment\":\"" + COMMITMENT
                + "\",\"walletAddress\":\"" + WALLET + "\"}";

        assertThatThrownBy(() -> consumer.handleStrategyValidationRequest(payload, TOPIC, 1, 7L, null, acknowledgment))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Request message is missing strategy parameters");
        verifyNoInteractions(pipeline, acknowledgment);
    }
}
