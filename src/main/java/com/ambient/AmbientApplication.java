package com.ambient;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

import java.util.Set;

@SpringBootApplication
public class AmbientApplication {

    private static final Set<String> SERVER_MODES = Set.of("serve", "operator", "content");

    public static void main(String[] args) {
        // The content service image is started without arguments by tenant bootstrap.
        if (args.length == 0 && "true".equalsIgnoreCase(System.getenv("CONTENT_SERVICE_MODE"))) {
            args = new String[]{"content"};
        }

        String mode = serverMode(args);

        SpringApplicationBuilder builder = new SpringApplicationBuilder(AmbientApplication.class);

        if (mode != null) {
            builder.properties(
                    "spring.main.web-application-type=servlet",
                    "spring.main.banner-mode=off",
                    "ambient.mode=" + mode
            );
        } else {
            // one-shot command; the context closes once picocli returns
            builder.properties(
                    "spring.main.web-application-type=none",
                    "spring.main.banner-mode=off",
                    "ambient.mode=cli"
            );
        }

        ApplicationContext ctx = builder.run(args);

        if (mode == null) {
            ExitCodeGenerator cli = ctx.getBean(ExitCodeGenerator.class);
            int exitCode = SpringApplication.exit(ctx, cli);
            System.exit(exitCode);
        }
        // server modes return here and Tomcat holds the process open
    }

    /** The long-running mode named by the first argument, or {@code null} for a CLI command. */
    public static String serverMode(String... args) {
        if (args == null || args.length == 0) {
            return null;
        }
        return SERVER_MODES.contains(args[0]) ? args[0] : null;
    }
}
