package com.codefarm.shortlink.service.repository;

import com.codefarm.shortlink.service.model.LinkRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local store for running without a database. Links are lost on restart.
 */
@Component
@ConditionalOnProperty(name = "shortlink.store", havingValue = "memory")
public class InMemoryLinkStore implements LinkStore {

    private final ConcurrentMap<String, LinkRecord> records = new ConcurrentHashMap<>();

    @Override
    public boolean putIfAbsent(String shortId, String longUrl) {
        return records.putIfAbsent(shortId, new LinkRecord(shortId, longUrl, LocalDateTime.now())) == null;
    }

    @Override
    public Optional<String> get(String shortId) {
        return Optional.ofNullable(records.get(shortId)).map(LinkRecord::getLongUrl);
    }
}
