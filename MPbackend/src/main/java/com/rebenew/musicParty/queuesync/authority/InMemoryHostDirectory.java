package com.rebenew.musicParty.queuesync.authority;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryHostDirectory implements HostDirectory {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryHostDirectory.class);

    private final Map<String, String> hosts = new ConcurrentHashMap<>();

    @Override
    public String claim(String sessionId, String memberId) {
        if (sessionId == null || sessionId.trim().isEmpty()) {
            throw new IllegalArgumentException("sessionId no puede ser nulo o vacío");
        }
        if (memberId == null || memberId.trim().isEmpty()) {
            throw new IllegalArgumentException("memberId no puede ser nulo o vacío");
        }
        String existing = hosts.putIfAbsent(sessionId, memberId);
        if (existing == null) {
            logger.info("👑 {} es host de la sesión {}", memberId, sessionId);
            return memberId;
        }
        return existing;
    }

    @Override
    public Optional<String> hostOf(String sessionId) {
        return Optional.ofNullable(sessionId == null ? null : hosts.get(sessionId));
    }

    @Override
    public void release(String sessionId) {
        if (hosts.remove(sessionId) != null) {
            logger.debug("Host liberado para sesión {}", sessionId);
        }
    }
}
