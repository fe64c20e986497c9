package com.taskbot.exception;

import com.taskbot.domain.enums.UserRole;

import java.util.Collection;
import java.util.Locale;
import java.util.stream.Collectors;

public class PermissionDeniedException extends AssistantException {

    public PermissionDeniedException(String action, Collection<UserRole> permittedRoles) {
        super("Only " + permittedRoles.stream()
                .map(role -> role.name().toLowerCase(Locale.ROOT))
                .sorted()
                .collect(Collectors.joining(", "))
                + " users can " + action + ".");
    }
}
