package com.care.assist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 危機支援對話協調服務主應用程式
 * 管理短時、安全敏感的支援 Session：同意、分流、支持、風險升級與結束
 */
@SpringBootApplication
@EnableScheduling
public class AssistApplication {

    public static void main(String[] args) {
        SpringApplication.run(AssistApplication.class, args);
    }
}
