package com.chronograph;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

import java.util.Arrays;

@SpringBootApplication
public class ChronographApplication {

    public static void main(String[] args) {
        // No arguments starts the server, the way the hook setup launches it.
        if (args.length == 0) {
            args = new String[]{"serve"};
        }

        boolean serveMode = isServeMode(args);

        SpringApplicationBuilder builder = new SpringApplicationBuilder(ChronographApplication.class);

        if (serveMode) {
            builder.properties(
                    "spring.main.web-application-type=servlet",
                    "spring.main.banner-mode=off"
            );
        } else {
            // CLI-only: no web server, no MCP endpoint, quiet console
            builder.properties(
                    "spring.main.web-application-type=none",
                    "spring.main.banner-mode=off",
                    "spring.ai.mcp.server.enabled=false",
                    "logging.level.root=WARN"
            );
        }

        ApplicationContext ctx = builder.run(args);

        if (!serveMode) {
            ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
            int exitCode = SpringApplication.exit(ctx, exitCodeGen);
            System.exit(exitCode);
        }
    }

    public static boolean isServeMode(String... args) {
        return args.length == 0 || Arrays.asList(args).contains("serve");
    }
}
