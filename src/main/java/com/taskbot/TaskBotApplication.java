package com.taskbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TaskBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskBotApplication.class, args);
    }
}
