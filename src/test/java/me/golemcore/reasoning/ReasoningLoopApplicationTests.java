package me.golemcore.reasoning;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class ReasoningLoopApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(ReasoningLoopApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(ReasoningLoopApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(ReasoningLoopApplication.class.getMethod("main", String[].class));
    }
}
