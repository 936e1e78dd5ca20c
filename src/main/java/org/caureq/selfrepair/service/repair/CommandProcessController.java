package org.caureq.selfrepair.service.repair;

import lombok.extern.slf4j.Slf4j;
import org.caureq.selfrepair.config.SupervisorProps.CommandProps;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Controls a component through shell commands. Restart falls back to stop + start
 * when no dedicated restart command is configured.
 */
@Slf4j
public class CommandProcessController implements ProcessController {
    private static final int MAX_OUTPUT = 500;

    private final String component;
    private final CommandProps commands;

    public CommandProcessController(String component, CommandProps commands) {
        this.component = component;
        this.commands = commands;
    }

    @Override public ControlResult start(Duration timeout) { return runConfigured("start", commands.start(), timeout); }
    @Override public ControlResult stop(Duration timeout) { return runConfigured("stop", commands.stop(), timeout); }
    @Override public ControlResult reload(Duration timeout) { return runConfigured("reload", commands.reload(), timeout); }
    @Override public ControlResult isHealthy(Duration timeout) { return runConfigured("health", commands.health(), timeout); }

    @Override
    public ControlResult restart(Duration timeout) {
        if (isSet(commands.restart())) return runConfigured("restart", commands.restart(), timeout);
        if (!isSet(commands.start())) return ControlResult.unsupported("restart");
        long deadline = System.nanoTime() + timeout.toNanos();
        if (isSet(commands.stop())) {
            var stopped = run("stop", commands.stop(), timeout);
            if (!stopped.ok()) log.warn("[Repair] {} stop before start failed: {}", component, stopped.detail());
        }
        var remaining = Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
        if (remaining.isZero()) return ControlResult.failed("restart timed out during stop");
        return run("start", commands.start(), remaining);
    }

    private ControlResult runConfigured(String op, String command, Duration timeout) {
        if (!isSet(command)) return ControlResult.unsupported(op);
        return run(op, command, timeout);
    }

    private ControlResult run(String op, String command, Duration timeout) {
        Path out = null;
        try {
            out = Files.createTempFile("supervisor-" + op + "-", ".out");
            Process p = new ProcessBuilder(shell(command))
                    .redirectErrorStream(true)
                    .redirectOutput(out.toFile())
                    .start();
            boolean ended = p.waitFor(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS);
            if (!ended) {
                p.destroyForcibly();
                return ControlResult.failed("%s timed out after %d ms".formatted(op, timeout.toMillis()));
            }
            String output = tail(Files.readString(out, StandardCharsets.UTF_8));
            int code = p.exitValue();
            log.debug("[Repair] {} {} exit={} out={}", component, op, code, output);
            return code == 0
                    ? ControlResult.ok("%s ok%s".formatted(op, output.isBlank() ? "" : ": " + output))
                    : ControlResult.failed("%s exited %d%s".formatted(op, code, output.isBlank() ? "" : ": " + output));
        } catch (IOException e) {
            return ControlResult.failed(op + " could not run: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ControlResult.failed(op + " interrupted");
        } finally {
            if (out != null) {
                try { Files.deleteIfExists(out); } catch (IOException e) { log.debug("temp output not removed: {}", e.getMessage()); }
            }
        }
    }

    private static String[] shell(String command) {
        String os = System.getProperty("os.name").toLowerCase(Locale.ROOT);
        return os.contains("win")
                ? new String[]{"cmd", "/c", command}
                : new String[]{"/bin/sh", "-c", command};
    }

    private static String tail(String s) {
        var t = s.strip();
        return t.length() > MAX_OUTPUT ? t.substring(t.length() - MAX_OUTPUT) : t;
    }

    private static boolean isSet(String s) { return s != null && !s.isBlank(); }
}
