package net.littleredcomputer.cnfanalysis.ipasir;

import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Keeps track of the IPASIR protocol state. Every public operation checks that the current
 * state permits it before subclasses get to do any work, and moves to the state the protocol
 * prescribes afterwards.
 */
public abstract class AbstractIpasirSolver implements IpasirSolver {
    private static final Logger log = LogManager.getFormatterLogger(AbstractIpasirSolver.class);
    private final String name;
    private SolverState state = SolverState.INPUT;
    private BooleanSupplier terminate = () -> false;
    long stepCount = 0;  // literals and terminators added so far
    private long lastStepCount = 0;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    protected AbstractIpasirSolver(String name) {
        this.name = name;
    }

    public void setLogInterval(Duration interval) { logInterval = interval; }

    public SolverState state() { return state; }

    protected Stopwatch stopwatch() { return stopwatch; }

    protected final void require(SolverState.Operation op) {
        if (!state.permits(op)) {
            throw new SolverStateException(String.format("%s: %s not permitted in state %s", name, op, state));
        }
    }

    @Override
    public String signature() {
        return "IPASIR interface 1.1.0";
    }

    @Override
    public void add(int litOrZero) {
        require(SolverState.Operation.ADD);
        if (!stopwatch.isRunning() && stepCount == 0) {
            stopwatch.start();
            lastLogTime = Instant.now();
        }
        state = SolverState.INPUT;
        ++stepCount;
        if (stepCount % 10000 == 0) maybeReportProgress(() -> "");
    }

    @Override
    public void assume(int lit) {
        require(SolverState.Operation.ASSUME);
        state = SolverState.INPUT;
    }

    @Override
    public int solve() {
        require(SolverState.Operation.SOLVE);
        if (terminate.getAsBoolean()) {
            state = SolverState.INPUT;
            return UNKNOWN;
        }
        final int result = search();
        state = SolverState.afterSolve(result);
        return result;
    }

    /**
     * Carry out the search requested by {@link #solve}.
     * @return one of {@link #SAT}, {@link #UNSAT}, {@link #UNKNOWN}
     */
    protected abstract int search();

    @Override
    public int val(int lit) {
        require(SolverState.Operation.VAL);
        return 0;
    }

    @Override
    public boolean failed(int lit) {
        require(SolverState.Operation.FAILED);
        return false;
    }

    @Override
    public <T> void setTerminate(T state, Predicate<? super T> terminate) {
        require(SolverState.Operation.SET_TERMINATE);
        this.terminate = () -> terminate.test(state);
    }

    @Override
    public void release() {
        require(SolverState.Operation.RELEASE);
        if (stopwatch.isRunning()) stopwatch.stop();
        state = SolverState.RELEASED;
    }

    void maybeReportProgress(Supplier<String> s) {
        if (!log.isDebugEnabled()) return;
        Instant now = Instant.now();
        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        log.debug(() -> new FormattedMessage("%s %d steps %s %.0f/sec %s", name, stepCount, stopwatch, perSec, s.get()));
        lastLogTime = now;
        lastStepCount = stepCount;
    }
}
