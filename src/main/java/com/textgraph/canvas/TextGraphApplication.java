package com.textgraph.canvas;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TextGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(TextGraphApplication.class, args);
    }
}
