package com.github.finiteautomaton;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

import com.github.finiteautomaton.FiniteAutomaton.FiniteAutomatonBuilder;
import com.github.finiteautomaton.FiniteAutomatonConfiguration.FiniteAutomatonConfigurationBuilder;
import com.github.finiteautomaton.FiniteAutomatonException.Code;

/**
 * Tests for the readers-writer guard.
 */
public class LockingFiniteAutomatonTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testDelegation() throws FiniteAutomatonException {
    final FiniteAutomaton automaton = lockingAutomaton(100L);
    assertTrue(automaton instanceof LockingFiniteAutomaton);
    automaton.addState("s0", false, true);
    automaton.addState("s1", true, false);
    automaton.addTransition("s0", "s1", "a");
    automaton.addTransition("s0", "s0", Arrays.asList('b'));

    assertEquals(2, automaton.size());
    assertEquals(Arrays.asList("s0", "s1"), automaton.getStateNames());
    assertEquals(Boolean.TRUE, automaton.isStateInitial("s0"));
    assertEquals(Boolean.TRUE, automaton.isStateAccepting("s1"));
    assertEquals(Arrays.asList("s1", "s0"), automaton.getTransitions("s0"));
    assertEquals(Arrays.asList('a'), automaton.getInputCharacters("s0", "s1"));
    assertNull(automaton.getTransitions("nope"));
    assertTrue(automaton.isDeterministic());
    assertTrue(automaton.checkString("bba"));
    assertFalse(automaton.checkString("ab"));
    assertEquals(RunOutcome.REJECTED_STUCK, automaton.run("ab").getOutcome());

    try {
      automaton.addState("s2", false, true);
      fail("Expected a determinism violation");
    } catch (FiniteAutomatonException problem) {
      assertEquals(Code.DETERMINISM_VIOLATION, problem.getCode());
    }

    final FiniteAutomaton copy = automaton.copy();
    assertTrue(copy instanceof LockingFiniteAutomaton);
    assertTrue(FiniteAutomata.structurallyEqual(automaton, copy));
    assertTrue(FiniteAutomata.structurallyEqual(automaton,
        FiniteAutomatonParser.parse(FiniteAutomatonSerializer.serialize(automaton))));
  }

  @Test
  public void testConcurrentChecksAndMutations() throws Exception {
    final FiniteAutomaton automaton = lockingAutomaton(5000L);
    automaton.addState("s0", true, true);
    final ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      final List<Future<?>> futures = new ArrayList<>();
      for (int worker = 0; worker < 4; worker++) {
        final int id = worker;
        futures.add(executor.submit(() -> {
          for (int i = 0; i < 50; i++) {
            final String stateName = "w" + id + "-" + i;
            automaton.addState(stateName);
            automaton.checkString("");
            assertTrue(automaton.isDeterministic());
          }
          return null;
        }));
      }
      for (final Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }
    assertEquals(1 + 4 * 50, automaton.size());
  }

  @Test
  public void testLockAcquisitionTimeout() throws Exception {
    final CountDownLatch mutating = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    final FiniteAutomaton real = FiniteAutomatonTest.automaton("ab", false);
    real.addState("s0", true, true);

    final FiniteAutomaton delegate = new BlockingFiniteAutomaton(real, mutating, release);
    final FiniteAutomaton automaton = new LockingFiniteAutomaton(delegate, 50L);

    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      final Future<?> writer = executor.submit(() -> {
        automaton.addState("s1");
        return null;
      });
      assertTrue(mutating.await(10, TimeUnit.SECONDS));
      try {
        automaton.checkString("");
        fail("Expected a lock acquisition failure");
      } catch (FiniteAutomatonException problem) {
        assertEquals(Code.OPERATION_LOCK_ACQUISITION_FAILURE, problem.getCode());
      }
      try {
        automaton.addTransition("s0", "s0", "a");
        fail("Expected a lock acquisition failure");
      } catch (FiniteAutomatonException problem) {
        assertEquals(Code.OPERATION_LOCK_ACQUISITION_FAILURE, problem.getCode());
      }
      release.countDown();
      writer.get(10, TimeUnit.SECONDS);
    } finally {
      release.countDown();
      executor.shutdownNow();
    }
    assertEquals(2, automaton.size());
    assertTrue(automaton.checkString(""));
  }

  /**
   * Parks every addState call until released, so the caller keeps holding the write lock.
   */
  private static final class BlockingFiniteAutomaton implements FiniteAutomaton {
    private final FiniteAutomaton delegate;
    private final CountDownLatch mutating;
    private final CountDownLatch release;

    private BlockingFiniteAutomaton(final FiniteAutomaton delegate, final CountDownLatch mutating,
        final CountDownLatch release) {
      this.delegate = delegate;
      this.mutating = mutating;
      this.release = release;
    }

    @Override
    public void addState(final String stateName) throws FiniteAutomatonException {
      block();
      delegate.addState(stateName);
    }

    @Override
    public void addState(final String stateName, final boolean accepting, final boolean initial)
        throws FiniteAutomatonException {
      block();
      delegate.addState(stateName, accepting, initial);
    }

    @Override
    public void addTransition(final String startStateName, final String targetStateName,
        final List<Character> inputCharacters) throws FiniteAutomatonException {
      delegate.addTransition(startStateName, targetStateName, inputCharacters);
    }

    @Override
    public void addTransition(final String startStateName, final String targetStateName,
        final String inputCharacters) throws FiniteAutomatonException {
      delegate.addTransition(startStateName, targetStateName, inputCharacters);
    }

    @Override
    public boolean isDeterministic() {
      return delegate.isDeterministic();
    }

    @Override
    public boolean checkString(final String string) throws FiniteAutomatonException {
      return delegate.checkString(string);
    }

    @Override
    public RunResult run(final String string) throws FiniteAutomatonException {
      return delegate.run(string);
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
      return delegate.getStateNames();
    }

    @Override
    public int size() {
      return delegate.size();
    }

    @Override
    public Boolean isStateInitial(final String stateName) {
      return delegate.isStateInitial(stateName);
    }

    @Override
    public Boolean isStateAccepting(final String stateName) {
      return delegate.isStateAccepting(stateName);
    }

    @Override
    public List<String> getTransitions(final String startStateName) {
      return delegate.getTransitions(startStateName);
    }

    @Override
    public List<Character> getInputCharacters(final String startStateName,
        final String targetStateName) {
      return delegate.getInputCharacters(startStateName, targetStateName);
    }

    @Override
    public FiniteAutomaton copy() {
      return new BlockingFiniteAutomaton(delegate.copy(), mutating, release);
    }

    private void block() throws FiniteAutomatonException {
      mutating.countDown();
      try {
        release.await(10, TimeUnit.SECONDS);
      } catch (InterruptedException problem) {
        Thread.currentThread().interrupt();
        throw new FiniteAutomatonException(Code.INTERRUPTED, problem);
      }
    }
  }

  private static FiniteAutomaton lockingAutomaton(final long lockAcquisitionMillis)
      throws FiniteAutomatonException {
    final FiniteAutomatonConfiguration config = FiniteAutomatonConfigurationBuilder.newBuilder()
        .alphabet("ab").forceDeterminism(true).build();
    return FiniteAutomatonBuilder.newBuilder().config(config).locking(true)
        .lockAcquisitionMillis(lockAcquisitionMillis).build();
  }
}
