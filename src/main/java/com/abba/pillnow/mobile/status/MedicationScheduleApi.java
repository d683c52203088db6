package com.abba.pillnow.mobile.status;

import java.io.IOException;
import java.util.List;

public interface MedicationScheduleApi {

    boolean patchStatus(String scheduleId, String status) throws IOException;

    boolean putSchedule(String scheduleId, CachedSchedule schedule) throws IOException;

    List<CachedSchedule> listSchedules() throws IOException;
}
