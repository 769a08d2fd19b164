package com.typewarden;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class TypewardenApplication {

    public static void main(String[] args) {
        // No web server; keep-alive holds the JVM open for the daemon monitor thread
        new SpringApplicationBuilder(TypewardenApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off",
                        "spring.main.keep-alive=true"
                )
                .run(args);
    }
}
