package com.dharmil.catalogcrawl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CatalogCrawlApplication {

    public static void main(String[] args) {
        SpringApplication.run(CatalogCrawlApplication.class, args);
    }
}
