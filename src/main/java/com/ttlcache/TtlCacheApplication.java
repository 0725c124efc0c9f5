package com.ttlcache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TtlCacheApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(TtlCacheApplication.class, args);
    }
}
