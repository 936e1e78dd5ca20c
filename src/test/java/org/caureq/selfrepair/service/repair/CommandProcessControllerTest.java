package org.caureq.selfrepair.service.repair;

import org.caureq.selfrepair.config.SupervisorProps.CommandProps;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CommandProcessController")
@DisabledOnOs(OS.WINDOWS)
class CommandProcessControllerTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Test
    @DisplayName("Exit code 0 is success and output is kept")
    void success() {
        var c = new CommandProcessController("web", new CommandProps(null, null, "echo restarted", null, null));

        var r = c.restart(TIMEOUT);

        assertThat(r.ok()).isTrue();
        assertThat(r.detail()).contains("restarted");
    }

    @Test
    @DisplayName("A non-zero exit code is a failure")
    void failure() {
        var c = new CommandProcessController("web", new CommandProps(null, null, null, null, "echo down; exit 3"));

        var r = c.isHealthy(TIMEOUT);

        assertThat(r.ok()).isFalse();
        assertThat(r.detail()).contains("exited 3").contains("down");
    }

    @Test
    @DisplayName("A command that overruns is killed and reported")
    void timeout() {
        var c = new CommandProcessController("web", new CommandProps(null, null, null, "sleep 5", null));

        var r = c.reload(Duration.ofMillis(200));

        assertThat(r.ok()).isFalse();
        assertThat(r.detail()).contains("timed out");
    }

    @Test
    @DisplayName("Restart falls back to stop then start")
    void restartFallsBack() {
        var c = new CommandProcessController("web", new CommandProps("echo started", "true", null, null, null));

        var r = c.restart(TIMEOUT);

        assertThat(r.ok()).isTrue();
        assertThat(r.detail()).contains("start ok");
    }

    @Test
    @DisplayName("An operation without a command is unsupported")
    void unsupported() {
        var c = new CommandProcessController("web", new CommandProps(null, null, null, null, null));

        assertThat(c.reload(TIMEOUT).supported()).isFalse();
        assertThat(c.restart(TIMEOUT).supported()).isFalse();
    }
}
