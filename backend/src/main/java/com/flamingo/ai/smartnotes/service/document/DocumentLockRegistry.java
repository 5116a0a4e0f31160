package com.flamingo.ai.smartnotes.service.document;

import com.flamingo.ai.smartnotes.config.SmartNotesConfig;
import com.flamingo.ai.smartnotes.exception.ConcurrencyException;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Per-document exclusive section for mutating operations. */
@Component
@RequiredArgsConstructor
@Slf4j
public class DocumentLockRegistry {

  private final Map<UUID, ReentrantLock> locks = new ConcurrentHashMap<>();
  private final SmartNotesConfig config;

  /**
   * Runs an action while holding the document's lock.
   *
   * @throws ConcurrencyException if the lock is not acquired within {@code
   *     concurrency.lock-wait-ms}
   */
  public <T> T runExclusive(UUID documentId, Supplier<T> action) {
    ReentrantLock lock = locks.computeIfAbsent(documentId, id -> new ReentrantLock());
    boolean acquired;
    try {
      acquired = lock.tryLock(config.getConcurrency().getLockWaitMs(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ConcurrencyException(documentId);
    }
    if (!acquired) {
      log.warn("Document {} is busy, rejecting concurrent mutation", documentId);
      throw new ConcurrencyException(documentId);
    }
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  /** Drops the lock of a deleted document. */
  public void forget(UUID documentId) {
    locks.computeIfPresent(documentId, (id, lock) -> lock.isLocked() ? lock : null);
  }
}
