package org.caureq.selfrepair.cli;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

/** Runs one supervisor command inside the application context and keeps its exit code. */
@Slf4j
@Component
@Profile("cli")
@RequiredArgsConstructor
public class SupervisorCli implements CommandLineRunner, ExitCodeGenerator {
    private final SupervisorCommand command;
    private int exitCode;

    @Override
    public void run(String... args) {
        exitCode = command.commandLine().execute(args);
        log.debug("[Cli] {} exited {}", args.length == 0 ? "" : args[0], exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
