package com.production.pdf_analysis.llm;

/**
 * Backoff pause between retries; swapped out in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
