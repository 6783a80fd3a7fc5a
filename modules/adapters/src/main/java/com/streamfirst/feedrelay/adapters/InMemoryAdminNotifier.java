package com.streamfirst.feedrelay.adapters;

import com.streamfirst.feedrelay.ports.AdminNotifier;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * AdminNotifier that logs notices and keeps them in memory.
 */
@Slf4j
public class InMemoryAdminNotifier implements AdminNotifier {

    private final List<String> notices = new CopyOnWriteArrayList<>();

    @Override
    public void notifyAdmins(String message) {
        log.info("Admin notice:\n{}", message);
        notices.add(message);
    }

    public List<String> notices() {
        return List.copyOf(notices);
    }
}
