package com.nosota.msale;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MsaleApplication {
    public static void main(String[] args) {
        SpringApplication.run(MsaleApplication.class, args);
    }
}
