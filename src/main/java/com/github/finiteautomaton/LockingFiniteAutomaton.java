package com.github.finiteautomaton;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock.ReadLock;
import java.util.concurrent.locks.ReentrantReadWriteLock.WriteLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.finiteautomaton.FiniteAutomatonException.Code;

/**
 * Readers-writer guard around a FiniteAutomaton for embedders that share one instance between
 * threads. Mutations hold the write lock, everything else holds the read lock, so concurrent
 * string checks never observe a half-validated mutation.
 *
 * Locks are only waited on for lockAcquisitionMillis. A timeout surfaces as
 * {@link Code#OPERATION_LOCK_ACQUISITION_FAILURE}, which is retryable. Introspection methods
 * cannot throw checked exceptions and wait uninterruptibly instead.
 */
final class LockingFiniteAutomaton implements FiniteAutomaton {
  private static final Logger logger =
      LogManager.getLogger(LockingFiniteAutomaton.class.getSimpleName());

  final static long defaultLockAcquisitionMillis = 100L;

  private final FiniteAutomaton delegate;
  private final long lockAcquisitionMillis;

  private final ReentrantReadWriteLock automatonSuperLock = new ReentrantReadWriteLock(true);
  private final WriteLock automatonWriteLock = automatonSuperLock.writeLock();
  private final ReadLock automatonReadLock = automatonSuperLock.readLock();

  LockingFiniteAutomaton(final FiniteAutomaton delegate, final long lockAcquisitionMillis) {
    this.delegate = delegate;
    this.lockAcquisitionMillis =
        lockAcquisitionMillis <= 0L ? defaultLockAcquisitionMillis : lockAcquisitionMillis;
  }

  @Override
  public void addState(final String stateName) throws FiniteAutomatonException {
    addState(stateName, false, false);
  }

  @Override
  public void addState(final String stateName, final boolean accepting, final boolean initial)
      throws FiniteAutomatonException {
    acquire(automatonWriteLock, "add state");
    try {
      delegate.addState(stateName, accepting, initial);
    } finally {
      automatonWriteLock.unlock();
    }
  }

  @Override
  public void addTransition(final String startStateName, final String targetStateName,
      final List<Character> inputCharacters) throws FiniteAutomatonException {
    acquire(automatonWriteLock, "add transition");
    try {
      delegate.addTransition(startStateName, targetStateName, inputCharacters);
    } finally {
      automatonWriteLock.unlock();
    }
  }

  @Override
  public void addTransition(final String startStateName, final String targetStateName,
      final String inputCharacters) throws FiniteAutomatonException {
    acquire(automatonWriteLock, "add transition");
    try {
      delegate.addTransition(startStateName, targetStateName, inputCharacters);
    } finally {
      automatonWriteLock.unlock();
    }
  }

  @Override
  public boolean isDeterministic() {
    automatonReadLock.lock();
    try {
      return delegate.isDeterministic();
    } finally {
      automatonReadLock.unlock();
    }
  }

  @Override
  public boolean checkString(final String string) throws FiniteAutomatonException {
    return run(string).isAccepted();
  }

  @Override
  public RunResult run(final String string) throws FiniteAutomatonException {
    acquire(automatonReadLock, "check string");
    try {
      return delegate.run(string);
    } finally {
      automatonReadLock.unlock();
    }
  }

  @Override
  public String getId() {
    return delegate.getId();
  }

  @Override
  public List<Character> getAlphabet() {
    return delegate.getAlphabet();
  }

  @Override
  public boolean isForceDeterminism() {
    return delegate.isForceDeterminism();
  }

  @Override
  public List<String> getStateNames() {
    automatonReadLock.lock();
    try {
      return delegate.getStateNames();
    } finally {
      automatonReadLock.unlock();
    }
  }

  @Override
  public int size() {
    automatonReadLock.lock();
    try {
      return delegate.size();
    } finally {
      automatonReadLock.unlock();
    }
  }

  @Override
  public Boolean isStateInitial(final String stateName) {
    automatonReadLock.lock();
    try {
      return delegate.isStateInitial(stateName);
    } finally {
      automatonReadLock.unlock();
    }
  }

  @Override
  public Boolean isStateAccepting(final String stateName) {
    automatonReadLock.lock();
    try {
      return delegate.isStateAccepting(stateName);
    } finally {
      automatonReadLock.unlock();
    }
  }

  @Override
  public List<String> getTransitions(final String startStateName) {
    automatonReadLock.lock();
    try {
      return delegate.getTransitions(startStateName);
    } finally {
      automatonReadLock.unlock();
    }
  }

  @Override
  public List<Character> getInputCharacters(final String startStateName,
      final String targetStateName) {
    automatonReadLock.lock();
    try {
      return delegate.getInputCharacters(startStateName, targetStateName);
    } finally {
      automatonReadLock.unlock();
    }
  }

  /**
   * The copy gets its own lock, it shares nothing with this instance.
   */
  @Override
  public FiniteAutomaton copy() {
    automatonReadLock.lock();
    try {
      return new LockingFiniteAutomaton(delegate.copy(), lockAcquisitionMillis);
    } finally {
      automatonReadLock.unlock();
    }
  }

  @Override
  public String toString() {
    automatonReadLock.lock();
    try {
      return delegate.toString();
    } finally {
      automatonReadLock.unlock();
    }
  }

  private void acquire(final Lock lock, final String operation) throws FiniteAutomatonException {
    try {
      if (!lock.tryLock(lockAcquisitionMillis, TimeUnit.MILLISECONDS)) {
        logger.warn(new StringBuilder().append("[a:").append(delegate.getId())
            .append("] Timed out while trying to ").append(operation).toString());
        throw new FiniteAutomatonException(Code.OPERATION_LOCK_ACQUISITION_FAILURE,
            "Timed out while trying to " + operation);
      }
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new FiniteAutomatonException(Code.INTERRUPTED, exception);
    }
  }

}
