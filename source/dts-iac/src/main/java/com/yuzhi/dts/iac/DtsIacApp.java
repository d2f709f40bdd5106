package com.yuzhi.dts.iac;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DtsIacApp {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(DtsIacApp.class, args)));
    }
}
