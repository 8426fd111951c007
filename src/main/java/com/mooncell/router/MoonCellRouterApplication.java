package com.mooncell.router;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MoonCellRouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(MoonCellRouterApplication.class, args);
    }

}
