package com.qqsuccubus.egress.node.pipeline;

import com.qqsuccubus.egress.core.msg.StartEgressRequest;
import com.qqsuccubus.egress.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs every egress job in its own handler process.
 * <p>
 * The start request is written as JSON to the handler's stdin and the egress id is exported as
 * {@code EGRESS_ID}. The handler is considered active once it has started; exit code 0 (or any
 * exit after a stop request) completes the job, anything else fails it with the tail of the
 * handler's output.
 * </p>
 */
public class ProcessPipelineExecutor implements IPipelineExecutor {
    private static final Logger log = LoggerFactory.getLogger(ProcessPipelineExecutor.class);

    private static final int OUTPUT_TAIL_LINES = 20;

    private final List<String> command;
    private final Scheduler scheduler;

    public ProcessPipelineExecutor(String handlerCommand, Scheduler scheduler) {
        this.command = Arrays.asList(handlerCommand.trim().split("\\s+"));
        this.scheduler = scheduler;
    }

    @Override
    public PipelineHandle launch(String egressId, StartEgressRequest request) {
        HandlerProcess handle = new HandlerProcess(egressId, JsonUtils.writeValueAsString(request));
        scheduler.schedule(handle::run);
        return handle;
    }

    private class HandlerProcess implements PipelineHandle {
        private final String egressId;
        private final String requestJson;
        private final Sinks.Many<PipelineEvent> sink = Sinks.many().replay().all();
        private final AtomicReference<Process> process = new AtomicReference<>();
        private final AtomicBoolean stopRequested = new AtomicBoolean(false);
        private final AtomicBoolean killed = new AtomicBoolean(false);

        HandlerProcess(String egressId, String requestJson) {
            this.egressId = egressId;
            this.requestJson = requestJson;
        }

        void run() {
            Process started;
            try {
                ProcessBuilder builder = new ProcessBuilder(command);
                builder.environment().put("EGRESS_ID", egressId);
                builder.redirectErrorStream(true);

                log.info("Launching handler for egress {}: {}", egressId, String.join(" ", command));
                started = builder.start();
                process.set(started);
            } catch (IOException e) {
                log.error("Failed to launch handler for egress {}", egressId, e);
                sink.tryEmitNext(PipelineEvent.failed("failed to launch handler: " + e.getMessage()));
                sink.tryEmitComplete();
                return;
            }

            try (OutputStream stdin = started.getOutputStream()) {
                stdin.write(requestJson.getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                // handler is free to ignore its input; its exit code decides the outcome
                log.warn("Handler for egress {} did not take the request: {}", egressId, e.getMessage());
            }

            // stop() may have raced the launch
            if (stopRequested.get()) {
                started.destroy();
            }

            sink.tryEmitNext(PipelineEvent.active());

            Deque<String> tail = new ArrayDeque<>(OUTPUT_TAIL_LINES);
            try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(started.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("[{}] {}", egressId, line);
                    if (tail.size() == OUTPUT_TAIL_LINES) {
                        tail.removeFirst();
                    }
                    tail.addLast(line);
                }

                int exitCode = started.waitFor();
                log.info("Handler for egress {} exited with code {}", egressId, exitCode);

                if (killed.get()) {
                    sink.tryEmitComplete();
                    return;
                }
                if (exitCode == 0 || stopRequested.get()) {
                    sink.tryEmitNext(PipelineEvent.complete());
                } else {
                    sink.tryEmitNext(PipelineEvent.failed(
                        "handler exited with code " + exitCode + ": " + String.join("\n", tail)));
                }
            } catch (IOException e) {
                log.warn("Lost handler output for egress {}: {}", egressId, e.getMessage());
                sink.tryEmitNext(PipelineEvent.failed("lost handler output: " + e.getMessage()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                started.destroyForcibly();
                sink.tryEmitNext(PipelineEvent.failed("interrupted while waiting for handler"));
            }
            sink.tryEmitComplete();
        }

        @Override
        public Flux<PipelineEvent> events() {
            return sink.asFlux();
        }

        @Override
        public void stop() {
            if (stopRequested.compareAndSet(false, true)) {
                Process p = process.get();
                if (p != null) {
                    log.info("Stopping handler for egress {}", egressId);
                    p.destroy();
                }
            }
        }

        @Override
        public void kill() {
            killed.set(true);
            stopRequested.set(true);
            Process p = process.get();
            if (p != null) {
                log.warn("Killing handler for egress {}", egressId);
                p.destroyForcibly();
            }
        }
    }
}
