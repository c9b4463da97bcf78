package com.ryuqq.bridge.adapter.runner;

import com.ryuqq.bridge.application.runtime.WorkerRuntime;
import com.ryuqq.bridge.core.contract.WorkItem;
import com.ryuqq.bridge.core.outcome.Fail;
import com.ryuqq.bridge.core.outcome.Outcome;
import com.ryuqq.bridge.core.spi.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Worker Loop 구현체.
 *
 * <p>큐에서 작업을 하나씩 꺼내 동기 실행하고, 결과를 각 작업의 핸들로 보고합니다.
 * 리소스에 접근하는 유일한 실행 경로이므로 리소스 주변에 별도 잠금이 필요 없습니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>짧은 타임아웃으로 큐 폴링 (유휴 시에도 running 플래그 재확인)</li>
 *   <li>작업 동기 실행 및 Outcome 포착 (Ok, Fail)</li>
 *   <li>Outcome을 작업 핸들에 보고 (호출자 스케줄러로 게시)</li>
 *   <li>stop 이후에도 큐가 빌 때까지 계속 처리 (모든 호출자가 결과를 받음)</li>
 * </ul>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * run()
 *   ↓
 * loop:
 *   1. poll(pollTimeoutMs) → WorkItem 또는 null
 *   2. WorkItem:
 *      a. execute() → Outcome (예외도 Fail로 포착)
 *      b. report(outcome) → 호출자 스케줄러에서 future 완료
 *   3. null이고 running == false이고 큐가 비었으면 → 종료
 * </pre>
 *
 * <p><strong>장애 격리:</strong></p>
 * <ul>
 *   <li>개별 작업 실패는 해당 호출자에게만 전달되고 루프는 계속 진행</li>
 *   <li>인터럽트 시 새 작업 수락을 중단(stop)하고 남은 작업을 모두 처리한 뒤
 *       인터럽트 플래그를 복원하고 종료</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkerLoop implements WorkerRuntime {

    private static final Logger log = LoggerFactory.getLogger(WorkerLoop.class);

    private final TaskQueue<WorkItem<?>> queue;
    private final WorkerConfig config;
    private final AtomicLong processedCount;
    private final AtomicLong failedCount;
    private volatile boolean running;

    /**
     * 생성자.
     *
     * @param queue 작업 큐
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public WorkerLoop(TaskQueue<WorkItem<?>> queue, WorkerConfig config) {
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.queue = queue;
        this.config = config;
        this.processedCount = new AtomicLong();
        this.failedCount = new AtomicLong();
        this.running = true;
    }

    @Override
    public boolean pump() throws InterruptedException {
        WorkItem<?> item = queue.poll(config.pollTimeoutMs());
        if (item == null) {
            return false;
        }
        process(item);
        return true;
    }

    @Override
    public void run() {
        log.debug("Worker loop started on {}", Thread.currentThread().getName());
        boolean interrupted = false;

        while (true) {
            try {
                if (pump()) {
                    continue;
                }
            } catch (InterruptedException e) {
                // 플래그는 이미 해제됨: 남은 작업을 처리한 뒤 복원
                interrupted = true;
                stop();
                log.warn("Worker interrupted, draining {} queued item(s) before exit", queue.size());
                continue;
            }

            if (!running && queue.isEmpty()) {
                break;
            }
        }

        log.debug("Worker loop stopped after {} item(s) ({} failed)", processedCount.get(), failedCount.get());
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void stop() {
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * 큐에 남은 작업을 대기 없이 모두 실행 (Worker 스레드에서 호출).
     *
     * <p>{@link #run()}이 끝난 뒤 마지막 순간에 들어온 작업을 처리하는 용도입니다.
     * 인터럽트 플래그는 실행 동안 해제되었다가 복원됩니다.</p>
     *
     * @return 실행한 작업 수
     */
    public int drainRemaining() {
        boolean interrupted = Thread.interrupted();
        int drained = 0;
        try {
            WorkItem<?> item;
            while ((item = queue.poll(0)) != null) {
                process(item);
                drained++;
            }
        } catch (InterruptedException e) {
            interrupted = true;
            log.warn("Interrupted while draining, {} item(s) left in queue", queue.size());
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
        return drained;
    }

    /**
     * 실행한 작업 수 (성공 + 실패).
     *
     * @return 누적 처리 수
     */
    public long processedCount() {
        return processedCount.get();
    }

    /**
     * 실패로 끝난 작업 수.
     *
     * @return 누적 실패 수
     */
    public long failedCount() {
        return failedCount.get();
    }

    /**
     * 작업 하나를 실행하고 결과 보고.
     *
     * @param item 실행할 작업
     * @param <T> 작업 반환 타입
     */
    private <T> void process(WorkItem<T> item) {
        log.debug("executing {}", item);
        Outcome<T> outcome = item.execute();
        processedCount.incrementAndGet();

        if (outcome instanceof Fail<T> fail) {
            failedCount.incrementAndGet();
            log.debug("returning failure for {}: {}", item, fail.cause().toString());
        } else {
            log.debug("operation {} completed", item);
        }

        if (!item.report(outcome)) {
            log.debug("handle of {} was already resolved, outcome dropped", item);
        }
    }
}
