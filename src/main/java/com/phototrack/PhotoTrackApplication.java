package com.phototrack;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PhotoTrackApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(PhotoTrackApplication.class, args)));
    }
}
