package com.abba.pillnow.device;

public interface SerialLink {

    String name();

    byte[] pollLine();

    void writeLine(String line);
}
