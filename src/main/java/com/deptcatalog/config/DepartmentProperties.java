package com.deptcatalog.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Setter
@Getter
@Configuration
@ConfigurationProperties(prefix = "department")
public class DepartmentProperties {

    private final Validation validation = new Validation();
    private final Seed seed = new Seed();

    @Setter
    @Getter
    public static class Validation {
        private ValidationMode mode = ValidationMode.ORDERED;
    }

    @Setter
    @Getter
    public static class Seed {
        private boolean enabled = false;
    }

    public enum ValidationMode {
        // 규칙 순서대로 검사하고 첫 위반에서 중단
        ORDERED,
        // Bean Validation 으로 모든 필드 위반 수집
        ANNOTATION
    }
}
