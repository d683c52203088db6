package com.abba.pillnow.domain.service;

public interface AlarmScheduler {

    void tick();

    boolean fireNow(int containerId);

    int pruneFireRecords();

    int fireRecordCount();
}
