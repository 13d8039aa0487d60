package com.mk.fx.qa.jmeter.execution.lock;

import com.mk.fx.qa.jmeter.execution.exception.BusyException;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Per-definition exclusivity tokens. At most one {@link LockHandle} per definition name is
 * outstanding at any time; acquisition never blocks.
 */
@Slf4j
@Component
public class RunLockRegistry {

  private final Map<String, LockHandle> held = new ConcurrentHashMap<>();

  /** Returns a handle, or empty if the definition is already locked. */
  public Optional<LockHandle> tryAcquire(String definitionName) {
    var candidate = new LockHandle(definitionName);
    var existing = held.putIfAbsent(definitionName, candidate);
    if (existing != null) {
      return Optional.empty();
    }
    log.debug("Run lock {} acquired for {}", candidate.token, definitionName);
    return Optional.of(candidate);
  }

  /**
   * Same as {@link #tryAcquire} but reports a held lock as {@link BusyException}.
   *
   * @throws BusyException if the definition is already locked
   */
  public LockHandle acquire(String definitionName) {
    return tryAcquire(definitionName).orElseThrow(() -> new BusyException(definitionName));
  }

  public boolean isLocked(String definitionName) {
    return held.containsKey(definitionName);
  }

  public int heldCount() {
    return held.size();
  }

  private void release(LockHandle handle) {
    // remove(key, value) so a stale handle never frees somebody else's lock
    if (held.remove(handle.definitionName, handle)) {
      log.debug("Run lock {} released for {}", handle.token, handle.definitionName);
    }
  }

  /** Token for one acquisition. {@link #release()} is idempotent. */
  public final class LockHandle implements AutoCloseable {

    private final String definitionName;
    private final UUID token = UUID.randomUUID();
    private final AtomicBoolean released = new AtomicBoolean();

    private LockHandle(String definitionName) {
      this.definitionName = definitionName;
    }

    public String getDefinitionName() {
      return definitionName;
    }

    public boolean isReleased() {
      return released.get();
    }

    public void release() {
      if (released.compareAndSet(false, true)) {
        RunLockRegistry.this.release(this);
      }
    }

    @Override
    public void close() {
      release();
    }
  }
}
