package com.ryuqq.bridge.adapter.runner;

import com.ryuqq.bridge.application.bridge.SerialBridge;
import com.ryuqq.bridge.core.contract.CompletionHandle;
import com.ryuqq.bridge.core.contract.WorkItem;
import com.ryuqq.bridge.core.spi.ResourceConnector;
import com.ryuqq.bridge.core.spi.ResourceOperation;
import com.ryuqq.bridge.core.spi.ResourceReleaser;
import com.ryuqq.bridge.core.spi.TaskQueue;
import com.ryuqq.bridge.core.statemachine.ConnectionClosedException;
import com.ryuqq.bridge.core.statemachine.ConnectionState;
import com.ryuqq.bridge.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 단일 리소스 연결 구현체 (Future Bridge + Connection Lifecycle).
 *
 * <p>하나의 리소스 핸들, 하나의 작업 큐, 하나의 전용 Worker 스레드를 소유합니다.
 * 연결마다 인스턴스가 하나씩 존재하며 전역 상태는 없습니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>connect(): UNCONNECTED → CONNECTING, Worker 스레드 시작, 부트스트랩 작업을 큐에 넣음</li>
 *   <li>부트스트랩(Worker 스레드): 리소스 생성 → CONNECTING → OPEN (실패 시 → CLOSED)</li>
 *   <li>submit(): 호출자 스케줄러에 묶인 핸들 생성 → WorkItem을 큐에 넣고 future 반환</li>
 *   <li>Worker: FIFO로 실행 → Outcome을 핸들에 보고 → 호출자 스케줄러에서 future 완료</li>
 *   <li>closeAsync(): OPEN → CLOSING, teardown 작업을 큐 맨 뒤에 넣음</li>
 *   <li>teardown 종료(성공/실패 무관): running = false, CLOSING → CLOSED</li>
 *   <li>Worker가 close 없이 종료(인터럽트)되면 Worker 스레드에서 남은 작업 실행 후 리소스 해제, → CLOSED</li>
 * </ol>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>리소스 핸들은 Worker 스레드에서만 읽고 씀 (잠금 불필요)</li>
 *   <li>상태 전이는 모두 write lock 하에서 수행</li>
 *   <li>submit의 "상태 확인 + 큐 삽입"은 read lock 하에서 수행되어,
 *       OPEN → CLOSING 전이와 teardown 삽입 사이에 끼어들 수 없음</li>
 *   <li>따라서 수락된 모든 작업은 teardown보다 앞에 있고, close 전에 모두 결과를 받음</li>
 * </ul>
 *
 * @param <R> 리소스 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SerialConnection<R> implements SerialBridge<R> {

    private static final Logger log = LoggerFactory.getLogger(SerialConnection.class);

    private static final AtomicInteger WORKER_IDS = new AtomicInteger();

    /**
     * 내부 공유 future 완료용: 호출자 재개는 각자의 핸들이 담당.
     */
    private static final Executor DIRECT = Runnable::run;

    private final ResourceConnector<R> connector;
    private final ResourceReleaser<R> releaser;
    private final TaskQueue<WorkItem<?>> queue;
    private final WorkerConfig config;
    private final Executor defaultScheduler;
    private final WorkerLoop worker;
    private final ReentrantReadWriteLock lifecycleLock;
    private final AtomicLong sequence;

    // 수락되었지만 아직 호출자 스케줄러에서 완료되지 않은 submit future
    private final Set<CompletableFuture<?>> undelivered;

    private volatile ConnectionState state;
    private volatile Thread workerThread;

    // write lock 하에서만 접근
    private CompletableFuture<SerialBridge<R>> bootstrap;
    private CompletableFuture<Void> shutdown;

    // Worker 스레드 전용
    private R resource;

    /**
     * 생성자.
     *
     * @param connector 부트스트랩 (리소스 생성)
     * @param releaser teardown (리소스 해제)
     * @param queue 작업 큐
     * @param config 설정
     * @param defaultScheduler 스케줄러를 지정하지 않은 호출에 사용할 콜백 스케줄러
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SerialConnection(
        ResourceConnector<R> connector,
        ResourceReleaser<R> releaser,
        TaskQueue<WorkItem<?>> queue,
        WorkerConfig config,
        Executor defaultScheduler
    ) {
        if (connector == null) {
            throw new IllegalArgumentException("connector cannot be null");
        }
        if (releaser == null) {
            throw new IllegalArgumentException("releaser cannot be null");
        }
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (defaultScheduler == null) {
            throw new IllegalArgumentException("defaultScheduler cannot be null");
        }

        this.connector = connector;
        this.releaser = releaser;
        this.queue = queue;
        this.config = config;
        this.defaultScheduler = defaultScheduler;
        this.worker = new WorkerLoop(queue, config);
        this.lifecycleLock = new ReentrantReadWriteLock();
        this.sequence = new AtomicLong();
        this.undelivered = ConcurrentHashMap.newKeySet();
        this.state = ConnectionState.UNCONNECTED;
    }

    @Override
    public <T> CompletableFuture<T> submit(ResourceOperation<R, T> operation) {
        return submit(operation, defaultScheduler);
    }

    @Override
    public <T> CompletableFuture<T> submit(ResourceOperation<R, T> operation, Executor scheduler) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }

        lifecycleLock.readLock().lock();
        try {
            ConnectionState current = state;
            if (!current.acceptsSubmissions() || !worker.isRunning()) {
                throw new ConnectionClosedException(current);
            }
            CompletableFuture<T> future = enqueue(() -> operation.apply(resource()), scheduler);
            undelivered.add(future);
            future.whenComplete((value, failure) -> undelivered.remove(future));
            return future;
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    @Override
    public CompletableFuture<SerialBridge<R>> connect() {
        return connect(defaultScheduler);
    }

    @Override
    public CompletableFuture<SerialBridge<R>> connect(Executor scheduler) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }

        CompletableFuture<SerialBridge<R>> shared;
        lifecycleLock.writeLock().lock();
        try {
            ConnectionState current = state;
            if (current == ConnectionState.UNCONNECTED) {
                transitionTo(ConnectionState.CONNECTING);
                startWorker();
                bootstrap = enqueue(this::bootstrap, DIRECT);
            } else if (current.isShuttingDown()) {
                throw new ConnectionClosedException(current);
            }
            shared = bootstrap;
        } finally {
            lifecycleLock.writeLock().unlock();
        }

        return CompletionHandle.<SerialBridge<R>>bind(scheduler).follow(shared);
    }

    @Override
    public CompletableFuture<Void> closeAsync() {
        return closeAsync(defaultScheduler);
    }

    @Override
    public CompletableFuture<Void> closeAsync(Executor scheduler) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }

        CompletableFuture<Void> shared;
        lifecycleLock.writeLock().lock();
        try {
            if (shutdown == null) {
                shutdown = beginClose();
            }
            shared = shutdown;
        } finally {
            lifecycleLock.writeLock().unlock();
        }

        return CompletionHandle.<Void>bind(scheduler).follow(shared);
    }

    @Override
    public void close() {
        if (Thread.currentThread() == workerThread) {
            throw new IllegalStateException("close() cannot block on the worker thread, use closeAsync()");
        }

        Throwable failure = null;
        try {
            closeAsync(DIRECT).get();
        } catch (ExecutionException e) {
            failure = e.getCause();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Close interrupted", e);
        }

        joinWorker();
        awaitDelivery();

        if (failure instanceof RuntimeException runtimeException) {
            throw runtimeException;
        }
        if (failure instanceof Error error) {
            throw error;
        }
        if (failure != null) {
            throw new RuntimeException("Failed to close connection", failure);
        }
    }

    @Override
    public ConnectionState state() {
        return state;
    }

    /**
     * 큐에서 실행을 기다리는 작업 수.
     *
     * @return 대기 작업 수 (스냅샷)
     */
    public int pendingCount() {
        return queue.size();
    }

    /**
     * Worker가 실행한 작업 수 (부트스트랩, teardown 포함).
     *
     * @return 누적 처리 수
     */
    public long processedCount() {
        return worker.processedCount();
    }

    /**
     * Worker에서 실패로 끝난 작업 수.
     *
     * @return 누적 실패 수
     */
    public long failedCount() {
        return worker.failedCount();
    }

    /**
     * Worker 스레드가 살아 있는지 확인.
     *
     * @return Worker 스레드가 시작되었고 아직 종료되지 않았으면 true
     */
    public boolean isWorkerAlive() {
        Thread thread = workerThread;
        return thread != null && thread.isAlive();
    }

    /**
     * Worker 스레드 종료 대기.
     *
     * @param timeoutMs 최대 대기 시간 (밀리초)
     * @return Worker가 종료되었거나 시작된 적이 없으면 true
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public boolean awaitTermination(long timeoutMs) throws InterruptedException {
        Thread thread = workerThread;
        if (thread == null) {
            return true;
        }
        thread.join(timeoutMs);
        return !thread.isAlive();
    }

    /**
     * WorkItem 생성 후 큐에 삽입.
     *
     * <p>상태 검사는 호출자가 lifecycleLock 하에서 이미 수행했어야 합니다.</p>
     */
    private <T> CompletableFuture<T> enqueue(Callable<T> operation, Executor scheduler) {
        CompletionHandle<T> handle = CompletionHandle.bind(scheduler);
        queue.push(WorkItem.of(sequence.incrementAndGet(), handle, operation));
        return handle.future();
    }

    /**
     * 부트스트랩 작업 (Worker 스레드에서 실행).
     *
     * <p>리소스를 생성하고 OPEN으로 전이한 뒤에 반환하므로, connect 호출자가
     * 재개되는 시점에는 항상 submit이 허용됩니다.</p>
     */
    private SerialBridge<R> bootstrap() throws Exception {
        try {
            R opened = connector.connect();
            if (opened == null) {
                throw new IllegalStateException("connector returned no resource");
            }
            resource = opened;
            transitionUnderLock(ConnectionState.OPEN);
            log.info("Connection opened on {}", Thread.currentThread().getName());
            return this;
        } catch (Throwable t) {
            log.warn("Bootstrap failed, closing connection", t);
            resource = null;
            markClosed();
            throw t;
        }
    }

    /**
     * teardown 작업 (Worker 스레드에서 실행).
     */
    private Void teardown() throws Exception {
        R current = resource;
        resource = null;
        if (current != null) {
            releaser.release(current);
        }
        return null;
    }

    /**
     * close 절차 시작 (write lock 하에서 호출).
     */
    private CompletableFuture<Void> beginClose() {
        switch (state) {
            case UNCONNECTED:
                transitionTo(ConnectionState.CLOSED);
                worker.stop();
                log.info("Connection closed before connect");
                return CompletableFuture.completedFuture(null);
            case CONNECTING:
                // 부트스트랩 결과(OPEN 또는 CLOSED)를 본 뒤 다시 판단
                return bootstrap
                    .handle((bridge, failure) -> (Void) null)
                    .thenCompose(ignored -> closeAfterBootstrap());
            case OPEN:
                return beginTeardown();
            default:
                // 부트스트랩 실패로 이미 CLOSED
                return CompletableFuture.completedFuture(null);
        }
    }

    private CompletableFuture<Void> closeAfterBootstrap() {
        lifecycleLock.writeLock().lock();
        try {
            if (state == ConnectionState.OPEN) {
                return beginTeardown();
            }
            return CompletableFuture.completedFuture(null);
        } finally {
            lifecycleLock.writeLock().unlock();
        }
    }

    /**
     * OPEN → CLOSING 전이 후 teardown을 큐 맨 뒤에 삽입 (write lock 하에서 호출).
     */
    private CompletableFuture<Void> beginTeardown() {
        transitionTo(ConnectionState.CLOSING);
        log.info("Closing connection, {} item(s) still queued", queue.size());
        return enqueue(this::teardown, DIRECT)
            .whenComplete((ignored, failure) -> finishClose(failure));
    }

    private void finishClose(Throwable failure) {
        try {
            if (failure != null) {
                log.info("exception occurred while closing connection", failure);
            }
        } finally {
            markClosed();
            log.info("Connection closed");
        }
    }

    /**
     * running = false 및 CLOSED 전이 (어느 스레드에서든 호출 가능, 멱등).
     */
    private void markClosed() {
        lifecycleLock.writeLock().lock();
        try {
            worker.stop();
            if (state != ConnectionState.CLOSED) {
                transitionTo(ConnectionState.CLOSED);
            }
        } finally {
            lifecycleLock.writeLock().unlock();
        }
    }

    private void transitionUnderLock(ConnectionState next) {
        lifecycleLock.writeLock().lock();
        try {
            transitionTo(next);
        } finally {
            lifecycleLock.writeLock().unlock();
        }
    }

    /**
     * 상태 전이 (write lock 하에서 호출).
     */
    private void transitionTo(ConnectionState next) {
        ConnectionState previous = state;
        state = StateTransition.transition(previous, next);
        log.debug("Connection state {} → {}", previous, next);
    }

    private void startWorker() {
        Thread thread = new Thread(this::runWorker, config.threadNamePrefix() + "-" + WORKER_IDS.incrementAndGet());
        thread.setDaemon(config.daemon());
        thread.setUncaughtExceptionHandler((t, e) ->
            log.error("Worker thread {} terminated unexpectedly", t.getName(), e));
        workerThread = thread;
        thread.start();
    }

    private void runWorker() {
        try {
            worker.run();
        } finally {
            cleanUpAfterExit();
        }
    }

    /**
     * Worker 루프 종료 후 정리 (Worker 스레드에서 실행).
     *
     * <p>인터럽트처럼 close 없이 루프가 끝난 경우에도 남은 작업(늦게 들어온 teardown 포함)을
     * 실행하고, 리소스를 해제한 뒤 CLOSED로 전이합니다. write lock을 잡고 있으므로
     * 그 사이 새 작업이나 teardown이 큐에 들어올 수 없습니다.</p>
     */
    private void cleanUpAfterExit() {
        lifecycleLock.writeLock().lock();
        try {
            int drained = worker.drainRemaining();
            if (drained > 0) {
                log.debug("Executed {} item(s) queued after the worker loop exited", drained);
            }
            if (state == ConnectionState.CLOSED) {
                return;
            }

            log.warn("Worker exited while {}, releasing resource", state);
            if (state == ConnectionState.OPEN) {
                transitionTo(ConnectionState.CLOSING);
            }
            try {
                teardown();
            } catch (Exception e) {
                log.info("exception occurred while closing connection", e);
            } finally {
                markClosed();
            }
        } finally {
            lifecycleLock.writeLock().unlock();
        }
    }

    /**
     * drain된 작업의 결과가 호출자 스케줄러에서 모두 완료될 때까지 대기 (terminationTimeoutMs 한도).
     *
     * <p>호출자 스케줄러 스레드에서 close()를 호출하면 그 스케줄러에 묶인 결과는
     * 대기 중에 완료될 수 없으므로 타임아웃 후 경고 로그를 남기고 반환합니다.</p>
     */
    private void awaitDelivery() {
        CompletableFuture<?>[] pending = undelivered.toArray(new CompletableFuture<?>[0]);
        if (pending.length == 0) {
            return;
        }

        CompletableFuture<Void> delivered = CompletableFuture.allOf(pending).handle((ignored, failure) -> null);
        try {
            delivered.get(config.terminationTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("{} result(s) still undelivered to caller schedulers after {}ms",
                undelivered.size(), config.terminationTimeoutMs());
        } catch (ExecutionException e) {
            throw new IllegalStateException("Unexpected failure while awaiting result delivery", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while waiting for result delivery", e);
        }
    }

    private void joinWorker() {
        try {
            if (!awaitTermination(config.terminationTimeoutMs())) {
                log.warn("Worker thread did not terminate within {}ms", config.terminationTimeoutMs());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while waiting for worker termination", e);
        }
    }

    /**
     * Worker 스레드 전용 리소스 접근.
     *
     * @throws IllegalStateException 리소스가 없는 경우 (부트스트랩 전 또는 teardown 후)
     */
    private R resource() {
        R current = resource;
        if (current == null) {
            throw new IllegalStateException("no active resource");
        }
        return current;
    }

    @Override
    public String toString() {
        return "SerialConnection{state=" + state + ", pending=" + queue.size() + ", worker=" + workerThread + "}";
    }
}
