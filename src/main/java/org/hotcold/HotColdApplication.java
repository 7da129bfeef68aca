package org.hotcold;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HotColdApplication {
    public static void main(String[] args) {
        SpringApplication.run(HotColdApplication.class, args);
    }
}
