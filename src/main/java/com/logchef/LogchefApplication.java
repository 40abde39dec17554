package com.logchef;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Logchef query core.
 *
 * Hosts the LogchefQL compiler: lexing and parsing of the filter language, translation
 * to ClickHouse SQL and VictoriaLogs LogsQL, and assembly of complete time-bounded queries.
 */
@SpringBootApplication
public class LogchefApplication {

    public static void main(String[] args) {
        SpringApplication.run(LogchefApplication.class, args);
    }
}
