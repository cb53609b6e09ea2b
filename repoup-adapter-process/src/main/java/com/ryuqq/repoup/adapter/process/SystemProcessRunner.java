package com.ryuqq.repoup.adapter.process;

import com.ryuqq.repoup.core.error.UpdateTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ProcessBuilder} 기반 ProcessRunner.
 *
 * <p>표준 출력과 표준 에러는 별도 스레드에서 끝까지 읽어 파이프 버퍼가 차서 멈추는 일을 막습니다.
 * timeout이 지나면 프로세스를 강제 종료하고 {@link UpdateTimeoutException}을 던집니다.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public final class SystemProcessRunner implements ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(SystemProcessRunner.class);

    private static final AtomicInteger THREAD_SEQUENCE = new AtomicInteger();

    private static final ExecutorService STREAM_READERS = Executors.newCachedThreadPool(daemonThreads());

    @Override
    public ProcessResult run(ProcessCommand command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        ProcessBuilder builder = new ProcessBuilder(command.arguments());
        if (command.workingDirectory() != null) {
            builder.directory(command.workingDirectory().toFile());
        }
        builder.environment().putAll(command.environment());

        log.debug("Running {}", command);
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to start " + command.executable() + ": " + e.getMessage(), e);
        }

        CompletableFuture<byte[]> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()), STREAM_READERS);
        CompletableFuture<byte[]> stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()), STREAM_READERS);
        try {
            writeInput(process, command.input());
            if (!process.waitFor(command.timeout().toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new UpdateTimeoutException(command.executable() + " did not finish within " + command.timeout());
            }
            ProcessResult result = new ProcessResult(process.exitValue(), stdout.join(), stderr.join());
            log.debug("{} exited with {}", command.executable(), result.exitCode());
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new UpdateTimeoutException("Interrupted while waiting for " + command.executable(), e);
        } catch (CompletionException e) {
            throw e.getCause() instanceof UncheckedIOException io ? io : e;
        }
    }

    private static void writeInput(Process process, byte[] input) {
        try (OutputStream stdin = process.getOutputStream()) {
            if (input != null) {
                stdin.write(input);
            }
        } catch (IOException e) {
            process.destroyForcibly();
            throw new UncheckedIOException("Unable to write to the standard input of the process", e);
        }
    }

    private static byte[] readAll(InputStream stream) {
        try (InputStream in = stream) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static ThreadFactory daemonThreads() {
        return runnable -> {
            Thread thread = new Thread(runnable, "repoup-process-io-" + THREAD_SEQUENCE.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
