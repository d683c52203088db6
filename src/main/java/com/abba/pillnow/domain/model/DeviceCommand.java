package com.abba.pillnow.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeviceCommand {

    private CommandAction action;
    private String container;
    private PillConfig expected;
    private String date;
    private String time;
    private String reason;
    private List<DetectedClass> detected;

    public static DeviceCommand capture(int containerId, PillConfig expected) {
        return DeviceCommand.builder()
                .action(CommandAction.CAPTURE)
                .container(ContainerIds.name(containerId))
                .expected(expected)
                .build();
    }

    public static DeviceCommand alarm(int containerId, String date, String time) {
        return DeviceCommand.builder()
                .action(CommandAction.ALARM_TRIGGERED)
                .container(ContainerIds.name(containerId))
                .date(date)
                .time(time)
                .build();
    }
}
