package io.github.nicechester.commentariat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CommentariatApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(CommentariatApplication.class, args);
    }
}
