package sylt;

import java.io.PrintStream;
import java.util.concurrent.locks.ReentrantLock;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.concurrent.GuardedBy;

/**
 * Owns one {@link Vm} and serializes every use of it, so an embedding can hand a runner between
 * threads. Values are never locked individually; a program runs start to finish under the lock.
 */
public final class SyltRunner {
  private final ReentrantLock lock = new ReentrantLock();

  @GuardedBy("lock")
  private final Vm vm;

  public SyltRunner(Program program, PrintStream out, boolean trace) {
    this.vm = new Vm(program, out, trace);
  }

  public SyltRunner(Program program) {
    this(program, System.out, false);
  }

  public void run() throws VmException {
    lock.lock();
    try {
      vm.run();
    } finally {
      lock.unlock();
    }
  }

  public ImmutableList<VmException> typecheck() {
    lock.lock();
    try {
      return Typechecker.check(vm);
    } finally {
      lock.unlock();
    }
  }
}
