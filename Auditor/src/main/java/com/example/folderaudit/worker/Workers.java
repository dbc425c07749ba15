package com.example.folderaudit.worker;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pool de workers para tarefas de I/O independentes (comparação e checksum).
 * <p>
 * Fan-out/fan-in: cada tarefa é despachada para o pool e escreve apenas no seu próprio
 * slot de resultado (indexado pela posição de entrada). A ordem de execução não é garantida;
 * a associação tarefa -> resultado é.
 */
public final class Workers {

    private Workers() {}

    /** Unidade de trabalho que pode falhar com I/O. */
    @FunctionalInterface
    public interface IoTask<T> {
        T call() throws IOException;
    }

    /** Callback de progresso, chamado a cada tarefa concluída (de qualquer thread). */
    @FunctionalInterface
    public interface ProgressListener {
        void onProgress(int completed, int total);

        static ProgressListener none() {
            return (completed, total) -> { };
        }
    }

    /**
     * Resultado de uma tarefa: valor ou falha de I/O capturada.
     * Uma falha nunca derruba as tarefas irmãs.
     */
    public static final class TaskOutcome<T> {
        private final T value;
        private final IOException failure;

        private TaskOutcome(T value, IOException failure) {
            this.value = value;
            this.failure = failure;
        }

        public static <T> TaskOutcome<T> succeeded(T value) {
            return new TaskOutcome<>(value, null);
        }

        public static <T> TaskOutcome<T> failed(IOException failure) {
            return new TaskOutcome<>(null, Objects.requireNonNull(failure, "failure"));
        }

        public boolean isSuccess() { return failure == null; }
        public Optional<T> value() { return Optional.ofNullable(value); }
        public Optional<IOException> failure() { return Optional.ofNullable(failure); }

        /** Valor da tarefa bem-sucedida; lança IllegalStateException se ela falhou. */
        public T get() {
            if (failure != null) {
                throw new IllegalStateException("Tarefa falhou: " + failure.getMessage(), failure);
            }
            return value;
        }
    }

    /**
     * Pool de tamanho fixo. Uma instância por execução; feche após o uso.
     * Não há cancelamento nem timeout: {@link #runAll} bloqueia até todas as tarefas terminarem.
     */
    public static final class WorkerPool implements AutoCloseable {

        private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

        private final ExecutorService executor;
        private final int workerCount;

        public WorkerPool(int workerCount, String threadPrefix) {
            if (workerCount < 1) {
                throw new IllegalArgumentException("workerCount deve ser >= 1: " + workerCount);
            }
            Objects.requireNonNull(threadPrefix, "threadPrefix");
            final AtomicInteger threadCounter = new AtomicInteger(0);
            final ThreadFactory threadFactory = r -> {
                final Thread thread = new Thread(r, threadPrefix + "-" + threadCounter.getAndIncrement());
                thread.setDaemon(true);
                return thread;
            };
            this.workerCount = workerCount;
            this.executor = Executors.newFixedThreadPool(workerCount, threadFactory);
            log.debug("WorkerPool '{}' iniciado com {} threads", threadPrefix, workerCount);
        }

        public int workerCount() {
            return workerCount;
        }

        public <T> List<TaskOutcome<T>> runAll(List<? extends IoTask<T>> tasks) {
            return runAll(tasks, ProgressListener.none());
        }

        /**
         * Executa todas as tarefas e devolve os resultados na mesma ordem da entrada.
         * <p>
         * Falhas de I/O ficam no {@link TaskOutcome} da própria tarefa. Exceções não checadas
         * (erro de programação) são propagadas depois que todas as tarefas terminarem.
         */
        public <T> List<TaskOutcome<T>> runAll(List<? extends IoTask<T>> tasks, ProgressListener listener) {
            Objects.requireNonNull(tasks, "tasks");
            Objects.requireNonNull(listener, "listener");
            final int total = tasks.size();
            if (total == 0) {
                return List.of();
            }

            @SuppressWarnings("unchecked")
            final TaskOutcome<T>[] slots = (TaskOutcome<T>[]) new TaskOutcome[total];
            final AtomicInteger completed = new AtomicInteger();

            List<CompletableFuture<Void>> futures = new ArrayList<>(total);
            for (int i = 0; i < total; i++) {
                final int index = i;
                final IoTask<T> task = Objects.requireNonNull(tasks.get(i), "task");
                futures.add(CompletableFuture.runAsync(() -> {
                    slots[index] = execute(task);
                    notifyProgress(listener, completed.incrementAndGet(), total);
                }, executor));
            }

            try {
                CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                if (cause instanceof Error) {
                    throw (Error) cause;
                }
                throw e;
            }

            List<TaskOutcome<T>> results = new ArrayList<>(total);
            Collections.addAll(results, slots);
            return results;
        }

        private static <T> TaskOutcome<T> execute(IoTask<T> task) {
            try {
                return TaskOutcome.succeeded(task.call());
            } catch (IOException e) {
                return TaskOutcome.failed(e);
            }
        }

        private static void notifyProgress(ProgressListener listener, int done, int total) {
            try {
                listener.onProgress(done, total);
            } catch (RuntimeException e) {
                log.debug("Listener de progresso lançou exceção: {}", e.toString());
            }
        }

        @Override
        public void close() {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                    log.warn("WorkerPool não terminou a tempo, forçando shutdown");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
