package com.abba.pillnow.mobile.status;

import com.abba.pillnow.mobile.store.KeyValueStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

@Slf4j
public class ScheduleStatusService {

    public static final String CACHE_KEY = "schedule_status_cache";
    public static final String OFFLINE_KEY = "offline_schedule_updates";
    public static final String STATUS_DONE = "Done";
    public static final int MAX_OFFLINE_UPDATES = 100;
    public static final Duration SYNC_DEBOUNCE = Duration.ofMillis(200);
    public static final Duration UPDATE_LOCK = Duration.ofSeconds(1);

    private static final TypeReference<LinkedHashMap<String, CachedSchedule>> CACHE_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<OfflineUpdate>> OFFLINE_TYPE = new TypeReference<>() {
    };

    private final KeyValueStore store;
    private final MedicationScheduleApi api;
    private final ScheduledExecutorService timer;
    private final Executor io;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    private final Map<String, CachedSchedule> cache = new ConcurrentHashMap<>();
    private final Map<String, Instant> updateLocks = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> pendingSyncs = new ConcurrentHashMap<>();
    private final List<ScheduleStatusListener> listeners = new CopyOnWriteArrayList<>();
    private final Object offlineLog = new Object();

    public ScheduleStatusService(KeyValueStore store,
                                 MedicationScheduleApi api,
                                 ScheduledExecutorService timer,
                                 Executor io,
                                 Clock clock,
                                 ObjectMapper objectMapper) {
        this.store = store;
        this.api = api;
        this.timer = timer;
        this.io = io;
        this.clock = clock;
        this.objectMapper = objectMapper;
    }

    public void addListener(ScheduleStatusListener listener) {
        listeners.add(listener);
    }

    public void initialize() {
        try {
            Optional<String> stored = store.get(CACHE_KEY);
            if (stored.isPresent()) {
                cache.putAll(objectMapper.readValue(stored.get(), CACHE_TYPE));
                log.info("Loaded {} cached schedule(s)", cache.size());
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to load schedule cache", e);
        }
    }

    public void updateScheduleCache(List<CachedSchedule> schedules) {
        for (CachedSchedule schedule : schedules) {
            if (schedule.getId() != null && schedule.getContainer() != null && schedule.getTime() != null) {
                cache.put(key(schedule.getContainer(), normalizeTime(schedule.getTime()), day(schedule.getDate())), schedule);
            }
        }
        io.execute(this::persistCache);
    }

    public Optional<String> getStatus(int container, String time, String date) {
        return Optional.ofNullable(cache.get(key(container, normalizeTime(time), day(date))))
                .map(CachedSchedule::getStatus);
    }

    public boolean markTaken(int container, String time, String date) {
        String t = normalizeTime(time);
        String day = day(date);
        String key = key(container, t, day);
        Instant now = clock.instant();

        Instant lockedUntil = updateLocks.get(key);
        if (lockedUntil != null && now.isBefore(lockedUntil)) {
            log.debug("Update already in progress for {}", key);
            return false;
        }

        CachedSchedule schedule = lookup(key, container, t);
        if (schedule == null) {
            log.warn("Schedule not cached for container {} at {}, recording offline", container, t);
            schedule = CachedSchedule.builder().container(container).time(t).date(day).build();
        } else if (isTaken(schedule.getStatus())) {
            log.debug("Schedule {} already {}", key, schedule.getStatus());
            return false;
        }

        updateLocks.put(key, now.plus(UPDATE_LOCK));
        schedule.setStatus(STATUS_DONE);
        schedule.setUpdatedAt(now.toEpochMilli());
        cache.put(key, schedule);

        emit(new ScheduleStatusEvent(container, t, day, STATUS_DONE, schedule.getId()));

        String scheduleDay = schedule.getDate() != null ? day(schedule.getDate()) : day;
        OfflineUpdate update = new OfflineUpdate(container, t, scheduleDay, STATUS_DONE, schedule.getId(), now.toEpochMilli());
        io.execute(() -> {
            persistCache();
            appendOffline(update);
        });

        scheduleSync(schedule.getId() != null ? schedule.getId() : key, update, schedule);
        log.info("Container {} at {} marked taken", container, t);
        return true;
    }

    public int syncOfflineUpdates() {
        synchronized (offlineLog) {
            List<OfflineUpdate> updates = readOffline();
            if (updates.isEmpty()) {
                return 0;
            }
            log.info("Syncing {} offline update(s)", updates.size());
            List<OfflineUpdate> failed = new ArrayList<>();
            for (OfflineUpdate update : updates) {
                CachedSchedule cached = cache.get(key(update.container(), update.time(), update.date()));
                if (!syncToBackend(update, cached)) {
                    failed.add(update);
                }
            }
            writeOffline(failed);
            return updates.size() - failed.size();
        }
    }

    List<OfflineUpdate> offlineUpdates() {
        synchronized (offlineLog) {
            return readOffline();
        }
    }

    private CachedSchedule lookup(String key, int container, String time) {
        CachedSchedule exact = cache.get(key);
        if (exact != null) {
            return exact;
        }
        String prefix = container + "|" + time + "|";
        return cache.entrySet().stream()
                .filter(e -> e.getKey().startsWith(prefix))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
    }

    private void scheduleSync(String syncKey, OfflineUpdate update, CachedSchedule snapshot) {
        ScheduledFuture<?> previous = pendingSyncs.remove(syncKey);
        if (previous != null) {
            previous.cancel(false);
        }
        ScheduledFuture<?> future = timer.schedule(() -> {
            pendingSyncs.remove(syncKey);
            io.execute(() -> syncToBackend(update, snapshot));
        }, SYNC_DEBOUNCE.toMillis(), TimeUnit.MILLISECONDS);
        pendingSyncs.put(syncKey, future);
    }

    private boolean syncToBackend(OfflineUpdate update, CachedSchedule snapshot) {
        try {
            String id = update.scheduleId();
            if (id != null) {
                if (api.patchStatus(id, STATUS_DONE)) {
                    log.info("Synced schedule {}", id);
                    return true;
                }
                if (snapshot != null && api.putSchedule(id, snapshot)) {
                    log.info("Synced schedule {} with full update", id);
                    return true;
                }
            }

            List<CachedSchedule> all = api.listSchedules();
            Optional<CachedSchedule> match = all.stream()
                    .filter(s -> sameDose(s, update) && update.date().equals(day(s.getDate())))
                    .findFirst()
                    .or(() -> all.stream().filter(s -> sameDose(s, update)).findFirst());
            if (match.isEmpty() || match.get().getId() == null) {
                log.warn("No cloud schedule for container {} at {}", update.container(), update.time());
                return false;
            }

            CachedSchedule found = match.get();
            if (!api.patchStatus(found.getId(), STATUS_DONE)) {
                return false;
            }
            found.setStatus(STATUS_DONE);
            cache.put(key(update.container(), update.time(), found.getDate() != null ? day(found.getDate()) : update.date()), found);
            persistCache();
            log.info("Synced schedule {} found by search", found.getId());
            return true;
        } catch (IOException e) {
            log.warn("Schedule sync failed for container {} at {}: {}", update.container(), update.time(), e.getMessage());
            return false;
        }
    }

    private void emit(ScheduleStatusEvent event) {
        for (ScheduleStatusListener listener : listeners) {
            try {
                listener.onStatusChanged(event);
            } catch (RuntimeException e) {
                log.error("Status listener failed", e);
            }
        }
    }

    private void persistCache() {
        try {
            store.put(CACHE_KEY, objectMapper.writeValueAsString(new LinkedHashMap<>(cache)));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Failed to persist schedule cache", e);
        }
    }

    private void appendOffline(OfflineUpdate update) {
        synchronized (offlineLog) {
            List<OfflineUpdate> updates = readOffline();
            updates.add(update);
            if (updates.size() > MAX_OFFLINE_UPDATES) {
                updates = new ArrayList<>(updates.subList(updates.size() - MAX_OFFLINE_UPDATES, updates.size()));
            }
            writeOffline(updates);
        }
    }

    private List<OfflineUpdate> readOffline() {
        try {
            Optional<String> stored = store.get(OFFLINE_KEY);
            if (stored.isPresent()) {
                return new ArrayList<>(objectMapper.readValue(stored.get(), OFFLINE_TYPE));
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to read offline updates", e);
        }
        return new ArrayList<>();
    }

    private void writeOffline(List<OfflineUpdate> updates) {
        try {
            if (updates.isEmpty()) {
                store.remove(OFFLINE_KEY);
            } else {
                store.put(OFFLINE_KEY, objectMapper.writeValueAsString(updates));
            }
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Failed to store offline updates", e);
        }
    }

    private String day(String date) {
        if (date == null || date.length() < 10) {
            return LocalDate.now(clock).toString();
        }
        return date.substring(0, 10);
    }

    private static boolean sameDose(CachedSchedule schedule, OfflineUpdate update) {
        return schedule.getContainer() != null
                && schedule.getContainer() == update.container()
                && schedule.getTime() != null
                && normalizeTime(schedule.getTime()).equals(update.time());
    }

    private static boolean isTaken(String status) {
        String s = status == null ? "pending" : status.toLowerCase(Locale.ROOT);
        return s.equals("done") || s.equals("taken");
    }

    private static String normalizeTime(String time) {
        return time.length() > 5 ? time.substring(0, 5) : time;
    }

    private static String key(int container, String time, String day) {
        return container + "|" + time + "|" + day;
    }
}
