package com.abba.pillnow.device.alarm;

public interface Actuator {

    void setBuzzer(boolean on);

    void setContainerLed(int container, boolean on);

    void allLedsOff();
}
