package se.fishmarket_be;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FishmarketBeApplication {

    public static void main(String[] args) {
        SpringApplication.run(FishmarketBeApplication.class, args);
    }

}
