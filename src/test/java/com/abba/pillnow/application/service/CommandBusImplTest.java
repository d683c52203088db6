package com.abba.pillnow.application.service;

import com.abba.pillnow.domain.model.DeviceCommand;
import com.abba.pillnow.domain.model.PillConfig;
import com.abba.pillnow.domain.service.DeviceChannel;
import com.abba.pillnow.infrastructure.config.DeviceProperties;
import com.abba.pillnow.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CommandBusImplTest {

    @Mock
    private DeviceChannel deviceChannel;

    private final DeviceProperties deviceProperties = new DeviceProperties();
    private final RelayMetrics metrics = new RelayMetrics();
    private MutableClock clock;
    private CommandBusImpl commandBus;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-10-18T08:29:59", "Asia/Manila");
        commandBus = new CommandBusImpl(deviceChannel, deviceProperties, new ObjectMapper(), metrics, clock);
    }

    @Test
    void secondCaptureInsideDebounceWindowIsNotResent() {
        when(deviceChannel.isConnected("container1")).thenReturn(true);
        when(deviceChannel.send(eq("pillnow/container1/cmd"), anyString())).thenReturn(true);

        assertThat(commandBus.publish("container1", DeviceCommand.capture(1, new PillConfig(2, null)))).isTrue();
        clock.advance(Duration.ofSeconds(1));
        assertThat(commandBus.publish("container1", DeviceCommand.capture(1, new PillConfig(2, null)))).isTrue();

        verify(deviceChannel, times(1)).send(eq("pillnow/container1/cmd"), anyString());
        assertThat(metrics.snapshot()).containsEntry("capturesDebounced", 1L);

        clock.advance(Duration.ofSeconds(3));
        assertThat(commandBus.publish("container1", DeviceCommand.capture(1, new PillConfig(2, null)))).isTrue();
        verify(deviceChannel, times(2)).send(eq("pillnow/container1/cmd"), anyString());
    }

    @Test
    void alarmsAreNeverDebounced() {
        when(deviceChannel.isConnected("container2")).thenReturn(true);
        when(deviceChannel.send(eq("pillnow/container2/cmd"), anyString())).thenReturn(true);

        commandBus.publishToContainer(2, DeviceCommand.alarm(2, "2026-10-18", "08:30"));
        commandBus.publishToContainer(2, DeviceCommand.alarm(2, "2026-10-18", "08:30"));

        verify(deviceChannel, times(2)).send(eq("pillnow/container2/cmd"), anyString());
    }

    @Test
    void disconnectedChannelReturnsFalseWithoutSending() {
        when(deviceChannel.isConnected("container1")).thenReturn(false);

        assertThat(commandBus.publish("container1", DeviceCommand.capture(1, PillConfig.empty()))).isFalse();

        verify(deviceChannel, never()).send(anyString(), anyString());
        assertThat(metrics.snapshot()).containsEntry("publishFailures", 1L);
    }

    @Test
    void failedSendDoesNotConsumeTheDebounceWindow() {
        when(deviceChannel.isConnected("container1")).thenReturn(true);
        when(deviceChannel.send(eq("pillnow/container1/cmd"), anyString())).thenReturn(false, true);

        assertThat(commandBus.publish("container1", DeviceCommand.capture(1, PillConfig.empty()))).isFalse();
        assertThat(commandBus.publish("container1", DeviceCommand.capture(1, PillConfig.empty()))).isTrue();

        verify(deviceChannel, times(2)).send(eq("pillnow/container1/cmd"), anyString());
    }

    @Test
    void singleDeviceOverrideKeepsLogicalContainerInBody() {
        deviceProperties.setSingleDeviceId("pillbox");
        when(deviceChannel.isConnected("pillbox")).thenReturn(true);
        when(deviceChannel.send(eq("pillnow/pillbox/cmd"), anyString())).thenReturn(true);

        assertThat(commandBus.resolveDeviceId(3)).isEqualTo("pillbox");
        assertThat(commandBus.publishToContainer(3, DeviceCommand.alarm(3, "2026-10-18", "20:00"))).isTrue();

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(deviceChannel).send(eq("pillnow/pillbox/cmd"), payload.capture());
        assertThat(payload.getValue())
                .contains("\"action\":\"alarm_triggered\"")
                .contains("\"container\":\"container3\"")
                .contains("\"time\":\"20:00\"");
    }

    @Test
    void capturesForDifferentContainersOnOneDeviceAreIndependent() {
        deviceProperties.setSingleDeviceId("pillbox");
        when(deviceChannel.isConnected("pillbox")).thenReturn(true);
        when(deviceChannel.send(eq("pillnow/pillbox/cmd"), anyString())).thenReturn(true);

        commandBus.publishToContainer(1, DeviceCommand.capture(1, PillConfig.empty()));
        commandBus.publishToContainer(2, DeviceCommand.capture(2, PillConfig.empty()));

        verify(deviceChannel, times(2)).send(eq("pillnow/pillbox/cmd"), anyString());
    }

    @Test
    void configIsRetainedOnConfigTopic() {
        when(deviceChannel.retain(eq("pillnow/container1/config"), anyString())).thenReturn(false);

        assertThat(commandBus.publishConfig("container1", Map.of("backend", "192.168.1.5:5001"))).isTrue();

        verify(deviceChannel).retain("pillnow/container1/config", "{\"backend\":\"192.168.1.5:5001\"}");
    }
}
