package com.taskbot.domain.enums;

public enum UserRole {
    ADMIN,
    CHAIRMAN,
    DIRECTOR,
    MANAGER,
    HR,
    EMPLOYEE;

    public boolean isManager() {
        return this != EMPLOYEE;
    }
}
