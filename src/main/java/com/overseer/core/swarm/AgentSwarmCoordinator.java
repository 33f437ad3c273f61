package com.overseer.core.swarm;

import com.overseer.core.config.OverseerProperties;
import com.overseer.core.logging.MdcContext;
import com.overseer.core.metrics.OverseerMetrics;
import com.overseer.core.model.AgentTask;
import com.overseer.core.model.BudgetAction;
import com.overseer.core.model.Phase;
import com.overseer.core.model.PhaseResult;
import com.overseer.core.model.TaskOutcome;
import com.overseer.core.model.TaskStatus;
import com.overseer.core.model.VerificationLevel;
import com.overseer.core.model.VerificationVerdict;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the tasks of one phase on a pool of concurrent workers.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Refuses phases whose sibling tasks claim overlapping resources</li>
 *   <li>Shapes tasks into waves under the worker ceiling via {@link BudgetPolicy}</li>
 *   <li>Replaces a worker that stops reporting progress, exactly once</li>
 *   <li>Verifies outcomes and runs narrowly scoped fix workers for the failing tasks only</li>
 *   <li>Switches to conservation mode under context pressure</li>
 * </ul>
 *
 * <p>A wave advances only after every worker in it has completed, failed or been replaced.
 * Waits are bounded by the poll interval so a silent worker never blocks the coordinator.
 */
@Service
public class AgentSwarmCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AgentSwarmCoordinator.class);

    static final String REPLACEMENT_SUFFIX = ".r1";
    static final String FIX_PREFIX = "fix-";

    private final OverseerProperties.Swarm config;
    private final AgentExecutor executor;
    private final VerificationProvider verifier;
    private final OverseerMetrics metrics;
    private final ExecutorService workerPool;
    private final AtomicInteger activeWorkers = new AtomicInteger();

    @Autowired
    public AgentSwarmCoordinator(OverseerProperties properties, AgentExecutor executor,
                                 VerificationProvider verifier,
                                 @Autowired(required = false) OverseerMetrics metrics) {
        this(properties.getSwarm(), executor, verifier, metrics);
    }

    AgentSwarmCoordinator(OverseerProperties.Swarm config, AgentExecutor executor,
                          VerificationProvider verifier, OverseerMetrics metrics) {
        this.config = config;
        this.executor = executor;
        this.verifier = verifier;
        this.metrics = metrics;
        var counter = new AtomicInteger();
        this.workerPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "swarm-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public ContextPressureMonitor newPressureMonitor() {
        return new ContextPressureMonitor(config);
    }

    /**
     * Standalone run: waves, verification and one targeted-fix round, with fresh
     * pressure and failure tracking.
     */
    public PhaseResult runPhase(Phase phase, List<AgentTask> tasks, PhaseObserver observer) {
        var pressure = newPressureMonitor();
        PhaseResult result = runPhase("standalone", phase, tasks, pressure, observer);
        if (!result.failingTaskIds().isEmpty()) {
            result = runTargetedFix("standalone", phase, result, new FailureTracker(), pressure, observer);
        }
        return result;
    }

    /**
     * Executes every pending task of a phase and verifies the outcomes. Tasks handed in with a
     * terminal status (blocked by the risk gate, skipped) are reported as such without running.
     *
     * @throws PlanningException if two tasks claim the same resource
     */
    public PhaseResult runPhase(String requestId, Phase phase, List<AgentTask> tasks,
                                ContextPressureMonitor pressure, PhaseObserver observer) {
        ResourcePartition.requireDisjoint(tasks);
        long startMs = System.currentTimeMillis();
        var ledger = new PhaseLedger(tasks);

        var runnable = new ArrayList<AgentTask>();
        for (AgentTask task : tasks) {
            if (task.status() == TaskStatus.PENDING) {
                runnable.add(task);
            } else {
                ledger.record(new TaskOutcome(task.id(), task.status(), null, List.of(), "",
                        "not executed: " + task.status(), null, 0));
            }
        }

        var budget = new BudgetPolicy(config.getMaxConcurrentWorkers());
        var plan = budget.plan(runnable, pressure.conservationMode());
        applyActions(plan.actions(), ledger, observer);
        log.info("Phase '{}': {} task(s) in {} wave(s), ceiling {}",
                phase.name(), runnable.size(), plan.waves().size(),
                budget.effectiveCeiling(pressure.conservationMode()));

        var waves = new ArrayDeque<List<WorkUnit>>(plan.waves());
        while (!waves.isEmpty() && !Thread.currentThread().isInterrupted()) {
            var assignments = waves.poll().stream()
                    .map(unit -> new Assignment(unit, unit.task().id(), null, null))
                    .toList();
            runWave(requestId, phase, assignments, pressure, observer, ledger);
            pressure.recordIteration();

            if (enteredConservation(pressure, observer) && !waves.isEmpty()) {
                var remaining = waves.stream().flatMap(List::stream)
                        .flatMap(u -> u.members().stream()).toList();
                var replanned = budget.plan(remaining, true);
                waves.clear();
                waves.addAll(replanned.waves());
                applyActions(replanned.actions(), ledger, observer);
            }
            if (pressure.conservationMode() && !waves.isEmpty() && ledger.criticalWorkDone()) {
                var skipped = waves.stream().flatMap(List::stream)
                        .flatMap(u -> u.memberIds().stream()).toList();
                for (String id : skipped) {
                    ledger.record(new TaskOutcome(id, TaskStatus.SKIPPED, null, List.of(), "",
                            "terminated early under context pressure", null, 0));
                }
                waves.clear();
                log.info("Critical tasks complete; skipping {} non-critical task(s)", skipped.size());
                applyActions(List.of(new BudgetAction(BudgetAction.Kind.EARLY_COMPLETION,
                        "remaining non-critical waves terminated", skipped)), ledger, observer);
            }
        }
        ledger.failUnfinished("phase interrupted before the task ran");

        verify(phase, ledger, ledger.outcomeIds(), observer);
        long elapsed = System.currentTimeMillis() - startMs;
        if (metrics != null) {
            metrics.recordPhaseDuration(phase.name(), elapsed);
        }
        return ledger.toResult(phase.name(), pressure.conservationMode(), elapsed);
    }

    /**
     * Partial rollback: spawns one fix worker per failing task of {@code previous}, bound to that
     * task's resources and failure context, then re-verifies only those tasks. Passing tasks are
     * never re-executed. A task failing again is reported in {@link PhaseResult#escalated()}.
     */
    public PhaseResult runTargetedFix(String requestId, Phase phase, PhaseResult previous,
                                      FailureTracker failures, ContextPressureMonitor pressure,
                                      PhaseObserver observer) {
        List<String> failing = previous.failingTaskIds();
        if (failing.isEmpty()) {
            return previous;
        }
        long startMs = System.currentTimeMillis();
        var ledger = PhaseLedger.from(previous);

        var assignments = new ArrayList<Assignment>();
        for (String taskId : failing) {
            AgentTask task = ledger.task(taskId);
            TaskOutcome outcome = previous.outcome(taskId);
            VerificationVerdict failure = outcome.verdict() != null
                    ? outcome.verdict()
                    : VerificationVerdict.fail(outcome.error(), List.of());
            failures.recordFailure(taskId, failure.detail());
            String note = "Targeted fix for " + taskId + ": " + failure.detail()
                    + (failure.failingChecks().isEmpty() ? "" : " (failing checks " + failure.failingChecks() + ")")
                    + ". Only touch " + task.resources() + ".";
            assignments.add(new Assignment(WorkUnit.single(task.withStatus(TaskStatus.PENDING)),
                    FIX_PREFIX + taskId, note, failure));
        }

        int limit = new BudgetPolicy(config.getMaxConcurrentWorkers())
                .effectiveCeiling(pressure.conservationMode());
        log.info("Phase '{}': {} targeted fix worker(s) for {}", phase.name(), assignments.size(), failing);
        for (int from = 0; from < assignments.size(); from += limit) {
            var batch = assignments.subList(from, Math.min(assignments.size(), from + limit));
            batch.forEach(a -> ledger.fixWorker(a.workerId()));
            runWave(requestId, phase, batch, pressure, observer, ledger);
        }
        pressure.recordIteration();
        enteredConservation(pressure, observer);

        verify(phase, ledger, failing, observer);
        for (String taskId : failing) {
            int attempts = previous.outcome(taskId).fixAttempts() + 1;
            TaskOutcome fixed = ledger.outcome(taskId).withFixAttempts(attempts);
            ledger.record(fixed);
            boolean resolved = fixed.passed();
            if (metrics != null) {
                metrics.recordFixWorker(resolved);
            }
            AgentTask task = ledger.task(taskId);
            callObserver(() -> observer.onTargetedFix(task, FIX_PREFIX + taskId, resolved));
            if (resolved) {
                failures.clearHistory(taskId);
                continue;
            }
            failures.recordFailure(taskId, fixed.verdict() != null ? fixed.verdict().detail() : fixed.error());
            if (failures.shouldEscalate(taskId)) {
                log.warn("Task {} failed again after its targeted fix; escalating", taskId);
                ledger.escalate(taskId);
            }
        }
        long elapsed = previous.durationMs() + System.currentTimeMillis() - startMs;
        return ledger.toResult(phase.name(), pressure.conservationMode(), elapsed);
    }

    public int activeWorkers() {
        return activeWorkers.get();
    }

    public boolean isAvailable() {
        return !workerPool.isShutdown();
    }

    @PreDestroy
    public void shutdown() {
        workerPool.shutdownNow();
    }

    private void runWave(String requestId, Phase phase, List<Assignment> assignments,
                         ContextPressureMonitor pressure, PhaseObserver observer, PhaseLedger ledger) {
        if (assignments.isEmpty()) {
            return;
        }
        if (metrics != null) {
            metrics.recordWaveSize(assignments.size());
        }
        CompletionService<WorkerReport> completion = new ExecutorCompletionService<>(workerPool);
        var active = new LinkedHashMap<String, Worker>();
        var byFuture = new HashMap<Future<WorkerReport>, Worker>();
        for (Assignment assignment : assignments) {
            Worker worker = spawn(requestId, phase, assignment, false, pressure, completion, observer);
            active.put(worker.unitId(), worker);
            byFuture.put(worker.future(), worker);
        }

        long pollMs = Math.max(1, config.getPollInterval().toMillis());
        Duration grace = config.getStallGracePeriod();
        while (!active.isEmpty()) {
            Future<WorkerReport> done;
            try {
                done = completion.poll(pollMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting on {} worker(s); cancelling them", active.size());
                for (Worker worker : active.values()) {
                    worker.cancel();
                    recordReport(worker, WorkerReport.failure("interrupted"), pressure, observer, ledger);
                }
                active.clear();
                return;
            }
            while (done != null) {
                Worker worker = byFuture.remove(done);
                if (worker != null && active.get(worker.unitId()) == worker) {
                    active.remove(worker.unitId());
                    recordReport(worker, collect(done), pressure, observer, ledger);
                }
                done = completion.poll();
            }

            for (Worker worker : List.copyOf(active.values())) {
                if (worker.context().sinceLastProgress().compareTo(grace) <= 0) {
                    continue;
                }
                String stalledId = worker.workerId();
                worker.cancel();
                byFuture.remove(worker.future());
                ledger.stalled(stalledId);
                if (metrics != null) {
                    metrics.recordWorkerStall();
                }
                AgentTask task = worker.assignment().unit().task();
                if (!worker.replacement()) {
                    String replacementId = stalledId + REPLACEMENT_SUFFIX;
                    log.warn("Worker {} reported no progress for {}; replacing it with {}",
                            stalledId, grace, replacementId);
                    var replacementNote = "Replacement for stalled worker " + stalledId
                            + ": no progress within " + grace.toSeconds() + "s. Resume the same task on "
                            + task.resources() + "; earlier partial output was discarded.";
                    Worker replacement = spawn(requestId, phase,
                            worker.assignment().replacedBy(replacementId, replacementNote),
                            true, pressure, completion, observer);
                    active.put(replacement.unitId(), replacement);
                    byFuture.put(replacement.future(), replacement);
                    callObserver(() -> observer.onWorkerStalled(task, stalledId, replacementId));
                } else {
                    log.warn("Replacement worker {} stalled as well; failing task {}", stalledId, task.id());
                    active.remove(worker.unitId());
                    recordReport(worker, WorkerReport.failure("worker stalled twice without progress"),
                            pressure, observer, ledger);
                    callObserver(() -> observer.onWorkerStalled(task, stalledId, null));
                }
            }
        }
    }

    private Worker spawn(String requestId, Phase phase, Assignment assignment, boolean replacement,
                         ContextPressureMonitor pressure, CompletionService<WorkerReport> completion,
                         PhaseObserver observer) {
        var context = new WorkerContext(requestId, assignment.workerId(), assignment.unit().task(),
                assignment.note(), assignment.failure(), pressure.conservationMode());
        pressure.recordSpawn();
        Future<WorkerReport> future = completion.submit(() -> work(phase, context));
        log.info("Spawned worker {} for task {} ({} resource(s))",
                assignment.workerId(), assignment.unit().task().id(), assignment.unit().task().resources().size());
        callObserver(() -> observer.onWorkerSpawned(assignment.unit().task(), assignment.workerId()));
        return new Worker(assignment, context, future, replacement);
    }

    private WorkerReport work(Phase phase, WorkerContext context) {
        activeWorkers.incrementAndGet();
        MdcContext.setWorker(context.requestId(), phase.name(), context.task().id(), context.workerId());
        try {
            WorkerReport report = executor.execute(context);
            return report != null ? report : WorkerReport.failure("worker returned no report");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return WorkerReport.failure("interrupted");
        } catch (Exception e) {
            log.warn("Worker {} failed: {}", context.workerId(), e.getMessage());
            return WorkerReport.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            activeWorkers.decrementAndGet();
            MdcContext.clear();
        }
    }

    private WorkerReport collect(Future<WorkerReport> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return WorkerReport.failure(cause.getMessage());
        } catch (CancellationException e) {
            return WorkerReport.failure("cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return WorkerReport.failure("interrupted");
        }
    }

    private void recordReport(Worker worker, WorkerReport report, ContextPressureMonitor pressure,
                              PhaseObserver observer, PhaseLedger ledger) {
        pressure.recordLog(worker.context().logChars() + report.summary().length());
        WorkUnit unit = worker.assignment().unit();
        for (AgentTask member : unit.members()) {
            List<String> resources = unit.merged()
                    ? shareOf(member, unit.members(), report.modifiedResources())
                    : report.modifiedResources();
            var outcome = new TaskOutcome(member.id(),
                    report.success() ? TaskStatus.COMPLETED : TaskStatus.FAILED,
                    worker.workerId(), resources, pressure.compress(report.summary()),
                    report.error(), null, 0);
            ledger.record(outcome);
            if (!resources.isEmpty()) {
                callObserver(() -> observer.onResourcesMutated(member, worker.workerId(), resources));
            }
        }
    }

    /**
     * Resources of a merged worker's report that belong to {@code member}. Resources matching no
     * member are attributed to the first one.
     */
    static List<String> shareOf(AgentTask member, List<AgentTask> members, List<String> modified) {
        var share = new ArrayList<String>();
        for (String resource : modified) {
            AgentTask owner = members.stream()
                    .filter(m -> m.resources().stream().anyMatch(r -> ResourcePartition.resourcesMatch(r, resource)))
                    .findFirst()
                    .orElse(members.get(0));
            if (owner.id().equals(member.id())) {
                share.add(resource);
            }
        }
        return share;
    }

    private void verify(Phase phase, PhaseLedger ledger, List<String> taskIds, PhaseObserver observer) {
        if (phase.verification() == VerificationLevel.NONE) {
            return;
        }
        var executed = taskIds.stream()
                .map(ledger::outcome)
                .filter(o -> o != null && o.executed())
                .toList();
        if (executed.isEmpty()) {
            return;
        }
        Map<String, VerificationVerdict> verdicts;
        try {
            verdicts = verifier.verify(phase, executed);
        } catch (RuntimeException e) {
            log.warn("Verification provider failed for phase '{}': {}", phase.name(), e.getMessage());
            var failed = new LinkedHashMap<String, VerificationVerdict>();
            executed.forEach(o -> failed.put(o.taskId(),
                    VerificationVerdict.fail("verification unavailable: " + e.getMessage(), List.of("verifier"))));
            verdicts = failed;
        }
        for (TaskOutcome outcome : executed) {
            VerificationVerdict verdict = verdicts != null && verdicts.get(outcome.taskId()) != null
                    ? verdicts.get(outcome.taskId())
                    : OutcomeVerificationProvider.judge(outcome);
            ledger.record(outcome.withVerdict(verdict));
            if (!verdict.passed()) {
                log.info("Task {} failed verification: {} {}", outcome.taskId(), verdict.detail(), verdict.failingChecks());
                AgentTask task = ledger.task(outcome.taskId());
                callObserver(() -> observer.onVerificationFailed(task, verdict));
            }
        }
    }

    private boolean enteredConservation(ContextPressureMonitor pressure, PhaseObserver observer) {
        if (!pressure.checkThresholds()) {
            return false;
        }
        if (metrics != null) {
            metrics.recordConservationMode();
        }
        String reason = pressure.conservationReason();
        callObserver(() -> observer.onConservationEntered(reason));
        return true;
    }

    private void applyActions(List<BudgetAction> actions, PhaseLedger ledger, PhaseObserver observer) {
        for (BudgetAction action : actions) {
            ledger.action(action);
            if (metrics != null) {
                metrics.recordBudgetAction(action.kind().name());
            }
            callObserver(() -> observer.onBudgetAction(action));
        }
    }

    private void callObserver(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Phase observer threw: {}", e.getMessage(), e);
        }
    }

    private record Assignment(WorkUnit unit, String workerId, String note, VerificationVerdict failure) {

        Assignment replacedBy(String replacementId, String replacementNote) {
            String combined = note == null ? replacementNote : note + "\n" + replacementNote;
            return new Assignment(unit, replacementId, combined, failure);
        }
    }

    private record Worker(Assignment assignment, WorkerContext context, Future<WorkerReport> future,
                          boolean replacement) {

        String unitId() {
            return assignment.unit().task().id();
        }

        String workerId() {
            return assignment.workerId();
        }

        void cancel() {
            context.cancel();
            future.cancel(true);
        }
    }

    /**
     * Mutable accumulator for one phase run, confined to the coordinator thread.
     */
    private static final class PhaseLedger {

        private final Map<String, AgentTask> tasks = new LinkedHashMap<>();
        private final Map<String, TaskOutcome> outcomes = new HashMap<>();
        private final List<String> escalated = new ArrayList<>();
        private final List<String> stalled = new ArrayList<>();
        private final List<String> fixWorkers = new ArrayList<>();
        private final List<BudgetAction> actions = new ArrayList<>();

        PhaseLedger(List<AgentTask> planned) {
            planned.forEach(t -> tasks.put(t.id(), t));
        }

        static PhaseLedger from(PhaseResult result) {
            var ledger = new PhaseLedger(result.tasks());
            ledger.outcomes.putAll(result.outcomes());
            ledger.escalated.addAll(result.escalated());
            ledger.stalled.addAll(result.stalledWorkers());
            ledger.fixWorkers.addAll(result.fixWorkers());
            ledger.actions.addAll(result.budgetActions());
            return ledger;
        }

        AgentTask task(String id) {
            return tasks.get(id);
        }

        TaskOutcome outcome(String id) {
            return outcomes.get(id);
        }

        void record(TaskOutcome outcome) {
            outcomes.put(outcome.taskId(), outcome);
        }

        void escalate(String id) {
            if (!escalated.contains(id)) {
                escalated.add(id);
            }
        }

        void stalled(String workerId) {
            stalled.add(workerId);
        }

        void fixWorker(String workerId) {
            fixWorkers.add(workerId);
        }

        void action(BudgetAction action) {
            actions.add(action);
        }

        List<String> outcomeIds() {
            return tasks.keySet().stream().filter(outcomes::containsKey).toList();
        }

        boolean criticalWorkDone() {
            var critical = tasks.values().stream().filter(AgentTask::critical).toList();
            return !critical.isEmpty() && critical.stream().allMatch(t -> {
                TaskOutcome outcome = outcomes.get(t.id());
                return outcome != null && outcome.status() == TaskStatus.COMPLETED;
            });
        }

        void failUnfinished(String reason) {
            for (String id : tasks.keySet()) {
                outcomes.computeIfAbsent(id, k ->
                        new TaskOutcome(k, TaskStatus.FAILED, null, List.of(), "", reason, null, 0));
            }
        }

        PhaseResult toResult(String phase, boolean conservation, long durationMs) {
            var ordered = new LinkedHashMap<String, TaskOutcome>();
            for (String id : tasks.keySet()) {
                if (outcomes.containsKey(id)) {
                    ordered.put(id, outcomes.get(id));
                }
            }
            return new PhaseResult(phase, List.copyOf(tasks.values()), ordered, escalated, stalled,
                    fixWorkers, actions, conservation, durationMs);
        }
    }
}
