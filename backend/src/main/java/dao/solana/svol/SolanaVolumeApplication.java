package dao.solana.svol;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SolanaVolumeApplication {

    public static void main(String[] args) {
        SpringApplication.run(SolanaVolumeApplication.class, args);
    }
}
