package eu.virtualparadox.notedraft;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NoteDraftApplication {

    public static void main(String[] args) {
        SpringApplication.run(NoteDraftApplication.class, args);
    }
}
