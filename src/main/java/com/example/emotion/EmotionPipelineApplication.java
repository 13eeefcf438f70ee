package com.example.emotion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EmotionPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(EmotionPipelineApplication.class, args);
    }
}
