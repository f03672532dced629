package com.deptcatalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DepartmentCatalogApplication {

    public static void main(String[] args) {
        SpringApplication.run(DepartmentCatalogApplication.class, args);
    }
}
