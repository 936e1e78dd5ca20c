package org.caureq.selfrepair;

import org.caureq.selfrepair.config.SupervisorProps;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Without a sub-command (or with only {@code --property} arguments) the supervisor runs as a daemon
 * with its scheduler and REST API. With a sub-command it runs that command once and exits with its code.
 */
@SpringBootApplication
@EnableConfigurationProperties(SupervisorProps.class)
public class SelfRepairSupervisorApplication {

    public static void main(String[] args) {
        if (args.length == 0 || args[0].startsWith("--")) {
            SpringApplication.run(SelfRepairSupervisorApplication.class, args);
            return;
        }
        var app = new SpringApplication(SelfRepairSupervisorApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.setAdditionalProfiles("cli");
        app.setBannerMode(Banner.Mode.OFF);
        System.exit(SpringApplication.exit(app.run(args)));
    }
}
