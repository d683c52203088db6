package com.abba.pillnow.mobile.store;

import java.util.Optional;

public interface KeyValueStore {

    Optional<String> get(String key);

    void put(String key, String value);

    void remove(String key);
}
