package com.abba.pillnow.application.service;

import com.abba.pillnow.application.dto.ScheduleUpdate;
import com.abba.pillnow.application.dto.SyncResult;
import com.abba.pillnow.domain.model.CloudScheduleRow;
import com.abba.pillnow.domain.model.ContainerIds;
import com.abba.pillnow.domain.model.ContainerSchedule;
import com.abba.pillnow.domain.model.DoseSlot;
import com.abba.pillnow.domain.model.DoseTimes;
import com.abba.pillnow.domain.model.PillConfig;
import com.abba.pillnow.domain.repository.ContainerScheduleRepository;
import com.abba.pillnow.domain.service.CloudScheduleGateway;
import com.abba.pillnow.domain.service.ScheduleStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

@Service
@Slf4j
public class ScheduleStoreImpl implements ScheduleStore {

    private final ContainerScheduleRepository repository;
    private final CloudScheduleGateway cloudScheduleGateway;
    private final Clock clock;

    private final Map<Integer, ContainerSchedule> schedules = new ConcurrentHashMap<>();
    private final AtomicInteger registrationCounter = new AtomicInteger();

    public ScheduleStoreImpl(ContainerScheduleRepository repository,
                             CloudScheduleGateway cloudScheduleGateway,
                             Clock clock) {
        this.repository = repository;
        this.cloudScheduleGateway = cloudScheduleGateway;
        this.clock = clock;
    }

    @Override
    public ContainerSchedule setSchedule(ScheduleUpdate update) {
        int containerId = update.containerId();
        if (!ContainerIds.isValid(containerId)) {
            throw new IllegalArgumentException("containerId must be between "
                    + ContainerIds.MIN_CONTAINER + " and " + ContainerIds.MAX_CONTAINER + ": " + containerId);
        }

        ContainerSchedule schedule = schedules.computeIfAbsent(containerId, this::register);
        synchronized (schedule) {
            if (update.pillConfig() != null) {
                schedule.setPillConfig(schedule.getPillConfig() == null
                        ? update.pillConfig().copy()
                        : schedule.getPillConfig().mergedWith(update.pillConfig()));
            }
            if (update.schedules() != null && !update.schedules().isEmpty()) {
                schedule.setSchedules(normalizeSlots(update.schedules()));
            } else if (update.replace()) {
                schedule.setSchedules(new ArrayList<>());
            }
            if (update.times() != null && !update.times().isEmpty()) {
                schedule.setTimes(normalizeTimes(update.times()));
            } else if (update.replace()) {
                schedule.setTimes(new ArrayList<>());
            }
            if (update.notifyTarget() != null && !update.notifyTarget().isBlank()) {
                schedule.setNotifyTarget(update.notifyTarget().trim());
            }
            schedule.setUpdatedAt(OffsetDateTime.now(clock));
        }

        persist(schedule);
        log.info("Schedule set container={} pillConfig={} slots={} times={} replace={}",
                containerId, schedule.getPillConfig(), schedule.getSchedules().size(),
                schedule.getTimes().size(), update.replace());
        return schedule;
    }

    @Override
    public Optional<ContainerSchedule> getSchedule(int containerId) {
        return Optional.ofNullable(schedules.get(containerId));
    }

    @Override
    public PillConfig getPillConfig(int containerId) {
        ContainerSchedule cached = schedules.get(containerId);
        if (cached != null && cached.getPillConfig() != null) {
            return cached.getPillConfig().copy();
        }
        try {
            Optional<ContainerSchedule> stored = repository.findById(containerId);
            if (stored.isPresent() && stored.get().getPillConfig() != null) {
                return stored.get().getPillConfig().copy();
            }
        } catch (Exception e) {
            log.warn("Pill config lookup failed container={} reason={}", containerId, e.getMessage());
        }
        return PillConfig.empty();
    }

    @Override
    public List<ContainerSchedule> registeredContainers() {
        return schedules.values().stream()
                .sorted(Comparator.comparingInt(ContainerSchedule::getRegistrationOrder))
                .toList();
    }

    @Override
    public SyncResult syncFromCloud(String elderId) {
        List<CloudScheduleRow> rows = cloudScheduleGateway.fetchSchedules(elderId);
        log.info("Syncing schedules from cloud elderId={} rows={}", elderId, rows.size());

        Map<Integer, List<DoseSlot>> slotsByContainer = new TreeMap<>();
        Map<Integer, CloudScheduleRow> latestRowByContainer = new LinkedHashMap<>();
        int skipped = 0;

        for (CloudScheduleRow row : rows) {
            String time = DoseTimes.normalizeTime(row.time());
            if (time == null) {
                skipped++;
                log.debug("Skipping cloud row without usable time id={} time={}", row.id(), row.time());
                continue;
            }
            int containerId = ContainerIds.normalize(row.container());
            slotsByContainer.computeIfAbsent(containerId, ignored -> new ArrayList<>())
                    .add(new DoseSlot(DoseTimes.normalizeDate(row.date()), time));
            latestRowByContainer.put(containerId, row);
        }

        Map<Integer, Integer> dosesPerContainer = new TreeMap<>();
        for (Map.Entry<Integer, List<DoseSlot>> entry : slotsByContainer.entrySet()) {
            int containerId = entry.getKey();
            ContainerSchedule schedule = schedules.computeIfAbsent(containerId, this::register);
            PillConfig pillConfig = resolvePillConfig(schedule, latestRowByContainer.get(containerId));
            synchronized (schedule) {
                schedule.setSchedules(entry.getValue());
                schedule.setPillConfig(pillConfig);
                schedule.setUpdatedAt(OffsetDateTime.now(clock));
            }
            persist(schedule);
            dosesPerContainer.put(containerId, entry.getValue().size());
        }

        if (!slotsByContainer.isEmpty()) {
            for (ContainerSchedule schedule : schedules.values()) {
                if (!slotsByContainer.containsKey(schedule.getContainerId()) && !schedule.getSchedules().isEmpty()) {
                    synchronized (schedule) {
                        schedule.setSchedules(new ArrayList<>());
                    }
                    persist(schedule);
                    dosesPerContainer.put(schedule.getContainerId(), 0);
                }
            }
        }

        log.info("Cloud sync finished doses={} skipped={}", dosesPerContainer, skipped);
        return new SyncResult(rows.size(), skipped, dosesPerContainer);
    }

    @Override
    public int loadPersisted() {
        List<ContainerSchedule> stored = repository.findAllByOrderByRegistrationOrderAsc();
        for (ContainerSchedule schedule : stored) {
            if (schedule.getContainerId() == null || !ContainerIds.isValid(schedule.getContainerId())) {
                continue;
            }
            schedules.putIfAbsent(schedule.getContainerId(), schedule);
            registrationCounter.accumulateAndGet(schedule.getRegistrationOrder(), Math::max);
        }
        log.info("Loaded {} persisted container schedule(s)", schedules.size());
        return schedules.size();
    }

    private ContainerSchedule register(int containerId) {
        ContainerSchedule schedule = new ContainerSchedule();
        schedule.setContainerId(containerId);
        schedule.setRegistrationOrder(registrationCounter.incrementAndGet());
        schedule.setUpdatedAt(OffsetDateTime.now(clock));
        return schedule;
    }

    private PillConfig resolvePillConfig(ContainerSchedule schedule, CloudScheduleRow row) {
        PillConfig current = schedule.getPillConfig() == null ? PillConfig.empty() : schedule.getPillConfig().copy();
        if (row == null) {
            return current;
        }
        if (row.pillCount() != null) {
            current.setCount(row.pillCount());
        }
        if (row.medicationId() == null || row.medicationId().isBlank()) {
            return current;
        }
        try {
            cloudScheduleGateway.findMedicationLabel(row.medicationId()).ifPresent(current::setLabel);
        } catch (Exception e) {
            log.warn("Label lookup failed container={} medication={} reason={}",
                    schedule.getContainerId(), row.medicationId(), e.getMessage());
        }
        return current;
    }

    private void persist(ContainerSchedule schedule) {
        try {
            repository.save(schedule);
        } catch (Exception e) {
            log.warn("Failed to persist schedule container={} reason={}", schedule.getContainerId(), e.getMessage());
        }
    }

    private List<DoseSlot> normalizeSlots(List<DoseSlot> slots) {
        List<DoseSlot> normalized = new ArrayList<>();
        for (DoseSlot slot : slots) {
            String time = DoseTimes.normalizeTime(slot.getTime());
            if (time == null) {
                log.debug("Ignoring dose slot with invalid time {}", slot.getTime());
                continue;
            }
            normalized.add(new DoseSlot(DoseTimes.normalizeDate(slot.getDate()), time));
        }
        return normalized;
    }

    private List<String> normalizeTimes(List<String> times) {
        List<String> normalized = new ArrayList<>();
        for (String raw : times) {
            String time = DoseTimes.normalizeTime(raw);
            if (time != null && !normalized.contains(time)) {
                normalized.add(time);
            }
        }
        return normalized;
    }
}
