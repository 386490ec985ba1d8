package com.production.pdf_analysis.llm.gigachat;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Caches one access token per provider client. The check-and-fetch runs under a single lock,
 * so concurrent callers wait for the same fetch instead of issuing their own.
 */
@Slf4j
public class GigaChatTokenManager {

    private final TokenFetcher fetcher;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private AccessToken cached;

    public GigaChatTokenManager(TokenFetcher fetcher, Clock clock) {
        this.fetcher = fetcher;
        this.clock = clock;
    }

    public String getToken() {
        lock.lock();
        try {
            if (cached != null && cached.isValidAt(clock.instant())) {
                return cached.value();
            }
            cached = fetcher.fetch();
            log.info("GigaChat access token obtained, valid until {}", cached.expiresAt());
            return cached.value();
        } finally {
            lock.unlock();
        }
    }

    /** Drops the cached token after the server rejected it. */
    public void invalidate() {
        lock.lock();
        try {
            cached = null;
        } finally {
            lock.unlock();
        }
    }
}
