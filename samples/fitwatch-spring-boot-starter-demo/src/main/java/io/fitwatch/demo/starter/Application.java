package io.fitwatch.demo.starter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot starter demo: the watcher is auto-configured from {@code application.properties}.
 *
 * <p>Run with: mvn install -DskipTests && mvn -f samples/fitwatch-spring-boot-starter-demo/pom.xml spring-boot:run
 *
 * <p>Override directories with {@code FITWATCH_INBOX} / {@code FITWATCH_OUTBOX}.
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
