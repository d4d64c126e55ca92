package ch.so.arp.scenesearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SceneSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(SceneSearchApplication.class, args);
    }
}
