package com.fleetdeck.core.dispatch;

import com.fleetdeck.core.events.EventBus;
import com.fleetdeck.core.events.FleetEvent;
import com.fleetdeck.core.logging.MdcContext;
import com.fleetdeck.core.metrics.FleetMetrics;
import com.fleetdeck.core.model.DispatchResult;
import com.fleetdeck.core.model.NodeRecord;
import com.fleetdeck.core.model.RoutePlan;
import com.fleetdeck.core.model.UnreachableReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs a unit of work against every routable node of a round in parallel.
 *
 * <p>At most {@code maxConcurrency} nodes are worked on at once; the rest wait
 * in plan order. Each node gets its own timeout, so one slow node never holds
 * up its siblings' results. When nodes are dispatched together with a router,
 * routing (including relay tunnel setup) happens inside the node's worker and
 * counts against its timeout and the overall deadline. Unreachable plans get
 * a result without any work being started. Every failure is turned into a
 * {@link DispatchResult}; nothing is thrown to the caller, and the results
 * come back in input order.
 */
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    static final String DEADLINE_EXCEEDED = "cancelled: overall deadline exceeded";

    private final ConnectionProvider connections;
    private final EventBus eventBus;
    private final FleetMetrics metrics;

    public Dispatcher(ConnectionProvider connections, EventBus eventBus, FleetMetrics metrics) {
        this.connections = connections;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    Dispatcher(ConnectionProvider connections) {
        this(connections, new EventBus(), null);
    }

    public <T> List<DispatchResult<T>> run(List<RoutePlan> plans, UnitOfWork<T> unit, DispatchOptions options) {
        return run(UUID.randomUUID().toString().substring(0, 8), plans, unit, options);
    }

    /**
     * Dispatches {@code unit} to every DIRECT or RELAYED plan.
     *
     * @return one result per plan, in plan order
     */
    public <T> List<DispatchResult<T>> run(String roundId, List<RoutePlan> plans, UnitOfWork<T> unit,
                                           DispatchOptions options) {
        var targets = new ArrayList<Target>(plans.size());
        for (RoutePlan plan : plans) {
            targets.add(new Target(plan.nodeId(), plan, () -> plan));
        }
        return dispatch(roundId, targets, unit, options);
    }

    /**
     * Routes and dispatches every node. {@code router} is called on the node's
     * worker thread, so a slow relay only delays its own node.
     *
     * @return one result per node, in input order
     */
    public <T> List<DispatchResult<T>> run(String roundId, List<NodeRecord> nodes,
                                           Function<NodeRecord, RoutePlan> router,
                                           UnitOfWork<T> unit, DispatchOptions options) {
        var targets = new ArrayList<Target>(nodes.size());
        for (NodeRecord node : nodes) {
            targets.add(new Target(node.name(), null, () -> router.apply(node)));
        }
        return dispatch(roundId, targets, unit, options);
    }

    private <T> List<DispatchResult<T>> dispatch(String roundId, List<Target> targets, UnitOfWork<T> unit,
                                                 DispatchOptions options) {
        var results = new AtomicReferenceArray<DispatchResult<T>>(targets.size());
        var runnable = new ArrayList<Integer>();
        for (int i = 0; i < targets.size(); i++) {
            RoutePlan known = targets.get(i).known();
            if (known != null && !known.dispatchable()) {
                complete(roundId, results, i, unreachableResult(known));
            } else {
                runnable.add(i);
            }
        }

        if (!runnable.isEmpty()) {
            log.info("Dispatching round {} to {} node(s), {} at a time",
                    roundId, runnable.size(), options.maxConcurrency());
            dispatchAll(roundId, targets, runnable, unit, options, results);
        }

        var ordered = new ArrayList<DispatchResult<T>>(targets.size());
        for (int i = 0; i < targets.size(); i++) {
            DispatchResult<T> result = results.get(i);
            ordered.add(result);
            if (metrics != null) {
                metrics.recordNodeOutcome(result.status());
            }
        }
        return ordered;
    }

    private <T> void dispatchAll(String roundId, List<Target> targets, List<Integer> runnable,
                                 UnitOfWork<T> unit, DispatchOptions options,
                                 AtomicReferenceArray<DispatchResult<T>> results) {
        int slots = Math.min(options.maxConcurrency(), runnable.size());
        var slotPool = new ThreadPoolExecutor(slots, slots, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), namedDaemon("dispatch-" + roundId + "-slot-"));
        ExecutorService callPool = Executors.newCachedThreadPool(namedDaemon("dispatch-" + roundId + "-node-"));

        long deadlineNanos = options.overallDeadline() == null
                ? Long.MAX_VALUE
                : System.nanoTime() + options.overallDeadline().toNanos();
        var slotFutures = new ArrayList<Future<?>>(runnable.size());
        try {
            for (int index : runnable) {
                Target target = targets.get(index);
                slotFutures.add(slotPool.submit(() ->
                        complete(roundId, results, index, runNode(roundId, target, unit, options, callPool))));
            }

            for (int k = 0; k < slotFutures.size(); k++) {
                Future<?> slot = slotFutures.get(k);
                try {
                    if (deadlineNanos == Long.MAX_VALUE) {
                        slot.get();
                    } else {
                        slot.get(Math.max(0, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
                    }
                } catch (TimeoutException e) {
                    log.warn("Round {} hit its overall deadline of {}ms, cancelling remaining nodes",
                            roundId, options.overallDeadline().toMillis());
                    for (int rest = k; rest < slotFutures.size(); rest++) {
                        slotFutures.get(rest).cancel(true);
                    }
                    break;
                } catch (ExecutionException | CancellationException e) {
                    log.error("Dispatch slot failed unexpectedly in round {}", roundId, e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            slotFutures.forEach(f -> f.cancel(true));
            log.warn("Round {} interrupted, cancelling remaining nodes", roundId);
        } finally {
            slotPool.shutdownNow();
            callPool.shutdownNow();
        }

        for (int index : runnable) {
            complete(roundId, results, index,
                    DispatchResult.timeout(targets.get(index).nodeId(), DEADLINE_EXCEEDED, Duration.ZERO));
        }
    }

    private <T> DispatchResult<T> runNode(String roundId, Target target, UnitOfWork<T> unit,
                                          DispatchOptions options, ExecutorService callPool) {
        String nodeId = target.nodeId();
        long start = System.nanoTime();
        var routed = new AtomicReference<RoutePlan>();

        Future<DispatchResult<T>> call = callPool.submit(() -> {
            RoutePlan plan = target.route().get();
            routed.set(plan);
            if (!plan.dispatchable()) {
                return unreachableResult(plan);
            }
            eventBus.publish(FleetEvent.nodeStarted(roundId, nodeId, plan.mode()));
            MdcContext.setNode(roundId, nodeId, plan.mode().name());
            try (var context = new WorkContext(roundId, plan, connections)) {
                return DispatchResult.success(nodeId, unit.execute(context), since(start));
            } finally {
                MdcContext.clear();
            }
        });

        DispatchResult<T> result;
        try {
            result = call.get(options.perNodeTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Node {} timed out after {}ms", nodeId, options.perNodeTimeout().toMillis());
            result = DispatchResult.timeout(nodeId,
                    "timed out after " + options.perNodeTimeout().toMillis() + "ms", since(start));
        } catch (ExecutionException e) {
            result = failureResult(nodeId, e.getCause(), since(start));
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            result = DispatchResult.timeout(nodeId, DEADLINE_EXCEEDED, since(start));
        }

        RoutePlan plan = routed.get();
        if (metrics != null && plan != null && plan.dispatchable()) {
            metrics.recordNodeExecution(plan.mode(), result.elapsed().toMillis());
        }
        return result;
    }

    /** Records {@code result} unless the node already has one, publishing completion exactly once. */
    private <T> void complete(String roundId, AtomicReferenceArray<DispatchResult<T>> results, int index,
                              DispatchResult<T> result) {
        if (results.compareAndSet(index, null, result)) {
            eventBus.publish(FleetEvent.nodeCompleted(roundId, result.nodeId(), result.status(), result.elapsed()));
        }
    }

    private <T> DispatchResult<T> failureResult(String nodeId, Throwable cause, Duration elapsed) {
        if (cause instanceof ConnectionException) {
            log.warn("Connection to {} failed: {}", nodeId, cause.getMessage());
            return DispatchResult.connectionFailed(nodeId, cause.getMessage(), elapsed);
        }
        if (cause instanceof CommandException ce) {
            log.warn("Command on {} failed: {}", nodeId, ce.getMessage());
            return DispatchResult.commandFailed(nodeId, ce.getMessage(), ce.getPartialOutput(), elapsed);
        }
        log.error("Unexpected failure on node {}", nodeId, cause);
        return DispatchResult.commandFailed(nodeId, String.valueOf(cause.getMessage()), null, elapsed);
    }

    private static <T> DispatchResult<T> unreachableResult(RoutePlan plan) {
        if (plan.unreachableReason() == UnreachableReason.RELAY_FAILED) {
            return DispatchResult.connectionFailed(plan.nodeId(), plan.reason(), Duration.ZERO);
        }
        return DispatchResult.skipped(plan.nodeId(), plan.reason());
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static ThreadFactory namedDaemon(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /** A node to dispatch; {@code known} is set when the plan was decided before dispatch. */
    private record Target(String nodeId, RoutePlan known, Supplier<RoutePlan> route) {}
}
