package com.mibprofile;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MibProfileApplication {

    public static void main(String[] args) {
        SpringApplication.run(MibProfileApplication.class, args);
    }
}
