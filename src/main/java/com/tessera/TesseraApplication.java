package com.tessera;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Entry point. {@code tessera serve} starts the REST and SSE server; every other
 * first argument runs one CLI command and exits with its code.
 */
@SpringBootApplication
public class TesseraApplication {

    public static void main(String[] args) {
        boolean serve = isServeMode(args);

        SpringApplicationBuilder builder = new SpringApplicationBuilder(TesseraApplication.class)
                .properties("spring.main.banner-mode=off");
        if (serve) {
            builder.properties("spring.main.web-application-type=servlet")
                    .profiles("serve");
        } else {
            // CLI output owns stdout; no embedded server
            builder.properties("spring.main.web-application-type=none");
        }

        ConfigurableApplicationContext ctx = builder.run(args);
        if (!serve) {
            System.exit(SpringApplication.exit(ctx, ctx.getBean(ExitCodeGenerator.class)));
        }
    }

    /** Serve mode is selected by the first argument only, so free-text input can say "serve". */
    public static boolean isServeMode(String[] args) {
        return args.length > 0 && "serve".equals(args[0]);
    }
}
