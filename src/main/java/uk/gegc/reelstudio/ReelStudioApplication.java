package uk.gegc.reelstudio;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ReelStudioApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReelStudioApplication.class, args);
    }
}
