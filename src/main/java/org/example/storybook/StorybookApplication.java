package org.example.storybook;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StorybookApplication {

    public static void main(String[] args) {
        SpringApplication.run(StorybookApplication.class, args);
    }
}
