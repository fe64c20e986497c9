package com.taskbot.exception;

import com.taskbot.domain.enums.UserRole;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class PermissionDeniedExceptionTest {

    private Locale previous;

    @BeforeEach
    void setUp() {
        previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
    }

    @AfterEach
    void tearDown() {
        Locale.setDefault(previous);
    }

    @Test
    void roleNamesDoNotDependOnDefaultLocale() {
        PermissionDeniedException exception = new PermissionDeniedException("assign tasks",
                List.of(UserRole.MANAGER, UserRole.ADMIN));

        assertThat(exception).hasMessage("Only admin, manager users can assign tasks.");
    }
}
