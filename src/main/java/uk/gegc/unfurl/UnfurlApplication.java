package uk.gegc.unfurl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class UnfurlApplication {

    public static void main(String[] args) {
        SpringApplication.run(UnfurlApplication.class, args);
    }
}
